package io.evitadb.lokit;

import io.evitadb.lokit.llm.LangChainHttpTransport;
import io.evitadb.lokit.llm.LanguageNames;
import io.evitadb.lokit.llm.OAuthTokenProvider;
import io.evitadb.lokit.llm.PluralForms;
import io.evitadb.lokit.llm.PromptLoader;
import io.evitadb.lokit.llm.ProviderConfig;
import io.evitadb.lokit.llm.ProviderDispatcher;
import io.evitadb.lokit.llm.ProviderRoute;
import io.evitadb.lokit.llm.RateLimitCoordinator;
import io.evitadb.lokit.llm.RequestExecutor;
import io.evitadb.lokit.model.CancellationToken;
import io.evitadb.lokit.model.LanguageTask;
import io.evitadb.lokit.model.RunOptions;
import io.evitadb.lokit.model.TranslationSummary;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Entry point of the translation engine. One engine is bound to one provider configuration and can
 * execute any number of runs; every run gets its own route, rate-limit state and worker pool.
 *
 * Example:
 * <pre>
 * final TranslationEngine engine = TranslationEngine.create(config, Map.of(), log);
 * final TranslationSummary summary = engine.translate(tasks, RunOptions.builder().log(log).build());
 * summary.throwIfFailed();
 * </pre>
 */
public final class TranslationEngine {

	private final ProviderConfig provider;
	private final ProviderDispatcher dispatcher;
	private final Function<RunOptions, RequestExecutor> executorFactory;
	private final PromptLoader promptLoader;

	/**
	 * @param provider        resolved provider configuration
	 * @param dispatcher      registry resolving the provider's route
	 * @param executorFactory creates the request executor of a run
	 * @param promptLoader    loader of system prompt templates
	 */
	public TranslationEngine(
		@Nonnull ProviderConfig provider,
		@Nonnull ProviderDispatcher dispatcher,
		@Nonnull Function<RunOptions, RequestExecutor> executorFactory,
		@Nonnull PromptLoader promptLoader
	) {
		this.provider = Objects.requireNonNull(provider, "provider must not be null");
		this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
		this.executorFactory = Objects.requireNonNull(executorFactory, "executorFactory must not be null");
		this.promptLoader = Objects.requireNonNull(promptLoader, "promptLoader must not be null");
	}

	/**
	 * Creates an engine sending its requests over HTTP with the built-in provider routes.
	 *
	 * @param provider       resolved provider configuration
	 * @param tokenProviders OAuth token providers keyed by provider identifier
	 * @param log            log receiving retry warnings and diagnostics
	 * @return engine ready to translate
	 */
	@Nonnull
	public static TranslationEngine create(
		@Nonnull ProviderConfig provider,
		@Nonnull Map<String, OAuthTokenProvider> tokenProviders,
		@Nonnull Log log
	) {
		Objects.requireNonNull(provider, "provider must not be null");
		Objects.requireNonNull(log, "log must not be null");
		return new TranslationEngine(
			provider,
			ProviderDispatcher.withDefaults(tokenProviders),
			options -> new RequestExecutor(
				LangChainHttpTransport.create(provider.proxy(), effectiveTimeout(provider, options)),
				log,
				options.isVerbose()
			),
			new PromptLoader()
		);
	}

	/**
	 * Translates all tasks with a token that is never cancelled.
	 *
	 * @param tasks   languages to translate
	 * @param options run settings
	 * @return summary of the run
	 */
	@Nonnull
	public TranslationSummary translate(@Nonnull List<LanguageTask> tasks, @Nonnull RunOptions options) {
		return translate(tasks, options, CancellationToken.create());
	}

	/**
	 * Translates all tasks. Failures of single languages are reported through the options' error
	 * callback and listed in the summary; call {@link TranslationSummary#throwIfFailed()} to turn
	 * them into an exception.
	 *
	 * @param tasks   languages to translate, documents are modified and persisted in place
	 * @param options run settings
	 * @param token   cancels the run cooperatively
	 * @return summary of the run
	 * @throws io.evitadb.lokit.llm.exception.ProviderException when the provider route cannot be built
	 */
	@Nonnull
	public TranslationSummary translate(
		@Nonnull List<LanguageTask> tasks,
		@Nonnull RunOptions options,
		@Nonnull CancellationToken token
	) {
		Objects.requireNonNull(tasks, "tasks must not be null");
		Objects.requireNonNull(options, "options must not be null");
		Objects.requireNonNull(token, "token must not be null");

		if (tasks.isEmpty()) {
			return TranslationSummary.empty();
		}

		final ProviderRoute route = this.dispatcher.resolve(this.provider);
		options.verbose("Using " + route.describe() + " (" + options + ")");

		final ChunkTranslator translator = new ChunkTranslator(
			route,
			this.executorFactory.apply(options),
			new RateLimitCoordinator(),
			options.getMaxRetries(),
			token
		);
		final TaskScheduler scheduler = new TaskScheduler(
			translator,
			options,
			token,
			task -> this.promptLoader.systemPrompt(options.getSystemPrompt(), options.getPromptType(), languageName(task)),
			task -> PluralForms.nplurals(task.document().pluralFormsHeader().orElse(null), task.language())
		);
		final TranslationSummary summary = scheduler.run(tasks);
		options.verbose(summary.toString());
		return summary;
	}

	@Nonnull
	public ProviderConfig getProvider() {
		return this.provider;
	}

	/**
	 * Per-run timeout wins over the provider's default.
	 */
	@Nonnull
	static Duration effectiveTimeout(@Nonnull ProviderConfig provider, @Nonnull RunOptions options) {
		final Duration timeout = options.getTimeout();
		return timeout == null ? provider.timeout() : timeout;
	}

	@Nonnull
	private static String languageName(@Nonnull LanguageTask task) {
		return task.displayName() == null ? LanguageNames.nativeName(task.language()) : task.displayName();
	}
}
