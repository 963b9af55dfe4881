package io.evitadb.lokit;

import io.evitadb.lokit.document.PropertiesDocument;
import io.evitadb.lokit.llm.OAuthToken;
import io.evitadb.lokit.llm.OAuthTokenProvider;
import io.evitadb.lokit.llm.PromptLoader;
import io.evitadb.lokit.llm.ProviderConfig;
import io.evitadb.lokit.llm.Providers;
import io.evitadb.lokit.llm.StaticOAuthTokenProvider;
import io.evitadb.lokit.model.ChunkSplitter;
import io.evitadb.lokit.model.ConcurrencyMode;
import io.evitadb.lokit.model.LanguageTask;
import io.evitadb.lokit.model.RunOptions;
import io.evitadb.lokit.model.TranslatableUnit;
import io.evitadb.lokit.model.TranslationFailedException;
import io.evitadb.lokit.model.TranslationSummary;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Main Mojo of the lokit plugin providing actions:
 * - show-config: prints current configuration
 * - translate: translates a source properties file into one file per target language
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class LokitMojo extends AbstractMojo {

	/** Environment variable consulted when no token is configured. */
	static final String API_KEY_ENV = "LOKIT_API_KEY";

	/** Which action to perform: "show-config" or "translate". */
	@Parameter(property = "lokit.action", defaultValue = "show-config")
	private String action;

	/** Provider identifier, see {@link Providers}. */
	@Parameter(property = "lokit.llmProvider", defaultValue = "google")
	private String llmProvider = Providers.GOOGLE;

	/** Base URL override, the provider default when not set. */
	@Parameter(property = "lokit.llmUrl")
	private String llmUrl;

	/** API key, or OAuth access token for the copilot and gemini providers. */
	@Parameter(property = "lokit.llmToken")
	private String llmToken;

	/** Project bound to the OAuth token of the gemini provider. */
	@Parameter(property = "lokit.oauthProject")
	private String oauthProject;

	/** Model name. */
	@Parameter(property = "lokit.llmModel", defaultValue = "gemini-2.5-flash")
	private String llmModel = "gemini-2.5-flash";

	/** Outbound proxy as http://host:port, HTTPS_PROXY / HTTP_PROXY when not set. */
	@Parameter(property = "lokit.proxy")
	private String proxy;

	/** Source-language properties file. */
	@Parameter(property = "lokit.sourceFile")
	private String sourceFile;

	/** Directory of the translated files, the source file's directory when not set. */
	@Parameter(property = "lokit.targetDir")
	private String targetDir;

	/** Target language codes. */
	@Parameter(property = "lokit.languages")
	private List<String> languages;

	/** Units per request, 0 sends each language in one request. */
	@Parameter(property = "lokit.chunkSize", defaultValue = "0")
	private int chunkSize;

	/** "sequential" or "full-parallel". */
	@Parameter(property = "lokit.parallelMode", defaultValue = "sequential")
	private String parallelMode = ConcurrencyMode.SEQUENTIAL.getId();

	/** Maximum requests in flight in full-parallel mode. */
	@Parameter(property = "lokit.maxConcurrent", defaultValue = "3")
	private int maxConcurrent = RunOptions.DEFAULT_MAX_CONCURRENT;

	/** Delay between two requests in milliseconds. */
	@Parameter(property = "lokit.requestDelay", defaultValue = "0")
	private long requestDelay;

	/** Per-request timeout in seconds, 0 for the provider default. */
	@Parameter(property = "lokit.timeout", defaultValue = "0")
	private int timeout;

	/** Retries of a failed request. */
	@Parameter(property = "lokit.maxRetries", defaultValue = "3")
	private int maxRetries = RunOptions.DEFAULT_MAX_RETRIES;

	/** Translate entries that already have a value again. */
	@Parameter(property = "lokit.retranslate", defaultValue = "false")
	private boolean retranslate;

	/** Built-in prompt type. */
	@Parameter(property = "lokit.promptType", defaultValue = "properties")
	private String promptType = "properties";

	/** Custom system prompt replacing the prompt type. */
	@Parameter(property = "lokit.systemPrompt")
	private String systemPrompt;

	/** When true, only report what would be translated. */
	@Parameter(property = "lokit.dryRun", defaultValue = "true")
	private boolean dryRun = true;

	/** Report every chunk and request attempt. */
	@Parameter(property = "lokit.verbose", defaultValue = "false")
	private boolean verbose;

	private Map<String, String> environment = System.getenv();
	private BiFunction<ProviderConfig, Map<String, OAuthTokenProvider>, TranslationEngine> engineFactory =
		(config, tokens) -> TranslationEngine.create(config, tokens, getLog());

	@Override
	public void execute() throws MojoExecutionException, MojoFailureException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config" -> showConfig(getLog());
			case "translate" -> translate(getLog());
			default -> throw new MojoExecutionException(
				"Unknown action: " + this.action + ". Supported actions: show-config, translate"
			);
		}
	}

	private void showConfig(@Nonnull Log log) {
		log.info("Lokit Plugin Configuration:");
		log.info(" - llmProvider: " + this.llmProvider);
		if (!Providers.isKnown(this.llmProvider)) {
			log.warn("Unknown provider " + this.llmProvider + ", it will be called as an OpenAI-compatible endpoint");
		}
		log.info(" - llmUrl: " + (isBlank(this.llmUrl) ? "<provider default>" : this.llmUrl));
		final String token = effectiveToken();
		log.info(" - llmToken: " + (token == null ? "<not set>" : mask(token)));
		if (token == null) {
			log.warn("LLM token is not set (use lokit.llmToken or " + API_KEY_ENV + ")");
		}
		log.info(" - llmModel: " + this.llmModel);
		log.info(" - proxy: " + (isBlank(this.proxy) ? "<environment>" : this.proxy));
		log.info(" - sourceFile: " + (isBlank(this.sourceFile) ? "<not set>" : this.sourceFile));
		if (isBlank(this.sourceFile)) {
			log.warn("Source file is not set");
		}
		log.info(" - targetDir: " + (isBlank(this.targetDir) ? "<source directory>" : this.targetDir));
		if (this.languages == null || this.languages.isEmpty()) {
			log.info(" - languages: <none>");
			log.warn("No target languages configured");
		} else {
			log.info(" - languages: " + String.join(", ", this.languages));
		}
		log.info(" - chunkSize: " + this.chunkSize);
		log.info(" - parallelMode: " + this.parallelMode);
		log.info(" - maxConcurrent: " + this.maxConcurrent);
		log.info(" - requestDelay: " + this.requestDelay + " ms");
		log.info(" - timeout: " + (this.timeout <= 0 ? "<provider default>" : this.timeout + " s"));
		log.info(" - maxRetries: " + this.maxRetries);
		log.info(" - retranslate: " + this.retranslate);
		log.info(" - promptType: " + this.promptType);
		if (!isBlank(this.promptType) && !new PromptLoader().isKnownPromptType(this.promptType)) {
			log.warn("Unknown prompt type " + this.promptType + ", the default prompt will be used");
		}
		log.info(" - systemPrompt: " + (isBlank(this.systemPrompt) ? "<prompt type>" : "<custom>"));
		log.info(" - dryRun: " + this.dryRun);
		log.info(" - verbose: " + this.verbose);
	}

	private void translate(@Nonnull Log log) throws MojoExecutionException, MojoFailureException {
		if (isBlank(this.sourceFile)) {
			throw new MojoExecutionException("Source file must be specified for translate action");
		}
		if (this.languages == null || this.languages.isEmpty()) {
			throw new MojoExecutionException("At least one target language must be specified for translate action");
		}

		final Path source = Path.of(this.sourceFile).toAbsolutePath().normalize();
		if (!Files.isRegularFile(source)) {
			throw new MojoExecutionException("Source file does not exist: " + source);
		}
		final Path outputDir = isBlank(this.targetDir)
			? source.getParent()
			: Path.of(this.targetDir).toAbsolutePath().normalize();

		final RunOptions options = buildOptions(log);
		final List<LanguageTask> tasks;
		try {
			tasks = createTasks(PropertiesDocument.read(source), baseName(source), outputDir);
		} catch (IOException e) {
			throw new MojoExecutionException("Failed to read translation files: " + e.getMessage(), e);
		}

		if (this.dryRun) {
			reportDryRun(log, tasks, options);
			return;
		}

		final ProviderConfig config;
		try {
			config = Providers.resolve(
				this.llmProvider, this.llmUrl, isOAuthProvider() ? null : effectiveToken(), this.llmModel,
				this.proxy, this.timeout > 0 ? Duration.ofSeconds(this.timeout) : null
			);
		} catch (IllegalArgumentException e) {
			throw new MojoExecutionException(e.getMessage(), e);
		}

		log.info("Translating " + source.getFileName() + " into " + tasks.size() + " language(s) using " + config.name());
		final TranslationEngine engine = this.engineFactory.apply(config, tokenProviders(config));
		final TranslationSummary summary = engine.translate(tasks, options);

		log.info("--- Translation Summary ---");
		log.info("Translated entries: " + summary.translatedUnits());
		log.info("Requests: " + summary.calls());
		if (summary.cancelled()) {
			log.warn("Run was cancelled");
		}
		try {
			summary.throwIfFailed();
		} catch (TranslationFailedException e) {
			throw new MojoFailureException(e.getMessage(), e);
		}
	}

	@Nonnull
	private RunOptions buildOptions(@Nonnull Log log) throws MojoExecutionException {
		try {
			return RunOptions.builder()
				.chunkSize(this.chunkSize)
				.mode(ConcurrencyMode.fromId(this.parallelMode))
				.maxConcurrent(this.maxConcurrent)
				.requestDelay(Duration.ofMillis(this.requestDelay))
				.timeout(this.timeout > 0 ? Duration.ofSeconds(this.timeout) : null)
				.maxRetries(this.maxRetries)
				.retranslateExisting(this.retranslate)
				.promptType(this.promptType)
				.systemPrompt(isBlank(this.systemPrompt) ? null : this.systemPrompt)
				.verbose(this.verbose)
				.log(log)
				.onProgress((language, done, total) -> log.info("[" + language + "] " + done + "/" + total))
				.build();
		} catch (IllegalArgumentException e) {
			throw new MojoExecutionException("Invalid configuration: " + e.getMessage(), e);
		}
	}

	/**
	 * Opens or creates the target file of every language, aligned with the source structure.
	 */
	@Nonnull
	private List<LanguageTask> createTasks(
		@Nonnull PropertiesDocument source,
		@Nonnull String baseName,
		@Nonnull Path outputDir
	) throws IOException {
		final List<LanguageTask> tasks = new ArrayList<>();
		for (final String language : new LinkedHashSet<>(this.languages)) {
			if (isBlank(language)) {
				continue;
			}
			final String code = language.trim();
			final Path output = outputDir.resolve(baseName + "_" + code + ".properties");
			final PropertiesDocument document = Files.isRegularFile(output)
				? PropertiesDocument.read(output).syncWith(source)
				: PropertiesDocument.mirror(source);
			tasks.add(LanguageTask.of(code, document, output));
		}
		return tasks;
	}

	private void reportDryRun(@Nonnull Log log, @Nonnull List<LanguageTask> tasks, @Nonnull RunOptions options) {
		final ChunkSplitter splitter = new ChunkSplitter(options.getChunkSize());
		int total = 0;
		for (final LanguageTask task : tasks) {
			final List<TranslatableUnit> units = task.document().unitsNeedingTranslation(
				options.isRetranslateExisting(), options.isIncludeFuzzy()
			);
			total += units.size();
			log.info(
				"[" + task.language() + "] " + task.outputPath().getFileName() + ": " + units.size() +
					" entries to translate in " + splitter.split(task.language(), units).size() + " request(s)"
			);
		}
		log.info("--- Dry-run Summary ---");
		log.info("Languages: " + tasks.size());
		log.info("Entries to translate: " + total);
	}

	@Nonnull
	private Map<String, OAuthTokenProvider> tokenProviders(@Nonnull ProviderConfig config) {
		final Map<String, OAuthTokenProvider> tokens = new HashMap<>();
		final String token = effectiveToken();
		if (token != null && isOAuthProvider()) {
			tokens.put(config.id(), new StaticOAuthTokenProvider(new OAuthToken(token, this.oauthProject)));
		}
		return tokens;
	}

	private boolean isOAuthProvider() {
		return Providers.COPILOT.equalsIgnoreCase(this.llmProvider) || Providers.GEMINI.equalsIgnoreCase(this.llmProvider);
	}

	@Nullable
	private String effectiveToken() {
		if (!isBlank(this.llmToken)) {
			return this.llmToken;
		}
		final String fromEnvironment = this.environment.get(API_KEY_ENV);
		return isBlank(fromEnvironment) ? null : fromEnvironment;
	}

	@Nonnull
	private static String baseName(@Nonnull Path source) {
		final String fileName = source.getFileName().toString();
		final int dot = fileName.lastIndexOf('.');
		return dot > 0 ? fileName.substring(0, dot) : fileName;
	}

	@Nonnull
	static String mask(@Nullable String value) {
		if (value == null || value.length() <= 4) {
			return "****";
		}
		return "****" + value.substring(value.length() - 4);
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.isBlank();
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setLlmProvider(@Nullable final String llmProvider) { this.llmProvider = llmProvider; }
	void setLlmUrl(@Nullable final String llmUrl) { this.llmUrl = llmUrl; }
	void setLlmToken(@Nullable final String llmToken) { this.llmToken = llmToken; }
	void setLlmModel(@Nonnull final String llmModel) { this.llmModel = llmModel; }
	void setSourceFile(@Nullable final String sourceFile) { this.sourceFile = sourceFile; }
	void setTargetDir(@Nullable final String targetDir) { this.targetDir = targetDir; }
	void setLanguages(@Nullable final List<String> languages) { this.languages = languages; }
	void setChunkSize(final int chunkSize) { this.chunkSize = chunkSize; }
	void setParallelMode(@Nonnull final String parallelMode) { this.parallelMode = parallelMode; }
	void setMaxConcurrent(final int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
	void setRetranslate(final boolean retranslate) { this.retranslate = retranslate; }
	void setDryRun(final boolean dryRun) { this.dryRun = dryRun; }
	void setEnvironment(@Nonnull final Map<String, String> environment) { this.environment = environment; }
	void setEngineFactory(@Nonnull final BiFunction<ProviderConfig, Map<String, OAuthTokenProvider>, TranslationEngine> engineFactory) {
		this.engineFactory = engineFactory;
	}
}
