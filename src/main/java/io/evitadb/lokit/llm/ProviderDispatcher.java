package io.evitadb.lokit.llm;

import io.evitadb.lokit.llm.exception.ProviderAuthenticationException;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Registry mapping provider identifiers to the routes that talk to them. Identifiers without a
 * registered factory fall back to OpenAI-compatible chat completions.
 *
 * Multi-format proxies register a list of {@link ModelRule}s: the first rule whose predicate
 * matches the model name builds the route, otherwise chat completions are used.
 */
public final class ProviderDispatcher {

	private final Map<String, RouteFactory> factories = new ConcurrentHashMap<>();

	/**
	 * Creates a dispatcher with all built-in providers registered.
	 *
	 * @param tokenProviders OAuth token providers keyed by provider identifier
	 *                       ({@link Providers#COPILOT}, {@link Providers#GEMINI})
	 * @return dispatcher with default routes
	 */
	@Nonnull
	public static ProviderDispatcher withDefaults(@Nonnull Map<String, OAuthTokenProvider> tokenProviders) {
		Objects.requireNonNull(tokenProviders, "tokenProviders must not be null");
		final Map<String, OAuthTokenProvider> tokens = Map.copyOf(tokenProviders);

		final ProviderDispatcher dispatcher = new ProviderDispatcher();
		dispatcher.register(Providers.GOOGLE, config -> {
			final OAuthTokenProvider geminiTokens = tokens.get(Providers.GEMINI);
			if (!config.hasApiKey() && geminiTokens != null) {
				return new CodeAssistRoute(config, geminiTokens);
			}
			return new StaticKeyRoute(config, GenerateContentFormat.INSTANCE);
		});
		dispatcher.register(
			Providers.GEMINI,
			config -> new CodeAssistRoute(config, config.baseUrl(), requireTokens(tokens, Providers.GEMINI))
		);
		dispatcher.register(
			Providers.COPILOT,
			config -> new CopilotRoute(config, requireTokens(tokens, Providers.COPILOT))
		);
		dispatcher.registerMultiFormat(
			Providers.OPENCODE,
			List.of(
				new ModelRule(
					model -> model.startsWith("gemini-"),
					config -> new StaticKeyRoute(
						config, GenerateContentFormat.INSTANCE, config.baseUrl() + "/models/" + config.model()
					)
				),
				new ModelRule(model -> model.startsWith("claude-"), config -> new StaticKeyRoute(config, MessagesFormat.INSTANCE)),
				new ModelRule(model -> model.startsWith("gpt-"), config -> new StaticKeyRoute(config, ResponsesFormat.INSTANCE))
			)
		);
		dispatcher.register(Providers.OLLAMA, ProviderDispatcher::ollamaRoute);
		return dispatcher;
	}

	/**
	 * Registers or replaces the route factory of a provider.
	 *
	 * @param providerId provider identifier
	 * @param factory    factory building the route from the resolved configuration
	 * @return this dispatcher
	 */
	@Nonnull
	public ProviderDispatcher register(@Nonnull String providerId, @Nonnull RouteFactory factory) {
		Objects.requireNonNull(providerId, "providerId must not be null");
		Objects.requireNonNull(factory, "factory must not be null");
		this.factories.put(providerId, factory);
		return this;
	}

	/**
	 * Registers a provider whose wire format depends on the model name.
	 *
	 * @param providerId provider identifier
	 * @param rules      rules evaluated in order, chat completions when none matches
	 * @return this dispatcher
	 */
	@Nonnull
	public ProviderDispatcher registerMultiFormat(@Nonnull String providerId, @Nonnull List<ModelRule> rules) {
		final List<ModelRule> ordered = new ArrayList<>(rules);
		return register(providerId, config -> {
			for (final ModelRule rule : ordered) {
				if (rule.modelMatcher().test(config.model())) {
					return rule.factory().create(config);
				}
			}
			return new StaticKeyRoute(config, ChatCompletionsFormat.INSTANCE);
		});
	}

	/**
	 * Resolves the route for the provider configuration.
	 *
	 * @param config resolved provider configuration
	 * @return route for the run
	 */
	@Nonnull
	public ProviderRoute resolve(@Nonnull ProviderConfig config) {
		Objects.requireNonNull(config, "config must not be null");
		final RouteFactory factory = this.factories.get(config.id());
		return factory == null
			? new StaticKeyRoute(config, ChatCompletionsFormat.INSTANCE)
			: factory.create(config);
	}

	/**
	 * Ollama serves its OpenAI-compatible API below {@code /v1}.
	 */
	@Nonnull
	private static ProviderRoute ollamaRoute(@Nonnull ProviderConfig config) {
		final String base = config.baseUrl();
		if (base.endsWith("/v1") || base.endsWith("/chat/completions")) {
			return new StaticKeyRoute(config, ChatCompletionsFormat.INSTANCE);
		}
		return new StaticKeyRoute(config.withBaseUrl(base + "/v1"), ChatCompletionsFormat.INSTANCE);
	}

	@Nonnull
	private static OAuthTokenProvider requireTokens(@Nonnull Map<String, OAuthTokenProvider> tokens, @Nonnull String providerId) {
		final OAuthTokenProvider provider = tokens.get(providerId);
		if (provider == null) {
			throw new ProviderAuthenticationException("No OAuth token available for provider " + providerId);
		}
		return provider;
	}

	/**
	 * Builds a route from the resolved provider configuration.
	 */
	@FunctionalInterface
	public interface RouteFactory {

		@Nonnull
		ProviderRoute create(@Nonnull ProviderConfig config);
	}

	/**
	 * Route selection by model name for multi-format providers.
	 *
	 * @param modelMatcher predicate over the model name
	 * @param factory      factory used when the predicate matches
	 */
	public record ModelRule(@Nonnull Predicate<String> modelMatcher, @Nonnull RouteFactory factory) {

		public ModelRule {
			Objects.requireNonNull(modelMatcher, "modelMatcher must not be null");
			Objects.requireNonNull(factory, "factory must not be null");
		}
	}
}
