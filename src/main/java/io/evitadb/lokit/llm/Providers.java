package io.evitadb.lokit.llm;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Built-in provider defaults and their resolution with user overrides.
 */
public final class Providers {

	public static final String GOOGLE = "google";
	public static final String GEMINI = "gemini";
	public static final String GROQ = "groq";
	public static final String OPENCODE = "opencode";
	public static final String COPILOT = "copilot";
	public static final String CUSTOM_OPENAI = "custom-openai";
	public static final String OLLAMA = "ollama";

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

	private static final Map<String, Defaults> DEFAULTS;

	static {
		final Map<String, Defaults> defaults = new LinkedHashMap<>();
		defaults.put(GOOGLE, new Defaults("Google AI (Gemini)", "https://generativelanguage.googleapis.com", Duration.ofSeconds(120)));
		defaults.put(GEMINI, new Defaults("Gemini Code Assist (OAuth)", CodeAssistEnvelope.CODE_ASSIST_BASE, Duration.ofSeconds(120)));
		defaults.put(GROQ, new Defaults("Groq", "https://api.groq.com/openai/v1", Duration.ofSeconds(60)));
		defaults.put(OPENCODE, new Defaults("OpenCode", "https://opencode.ai/zen/v1", Duration.ofSeconds(120)));
		defaults.put(COPILOT, new Defaults("GitHub Copilot", "https://api.githubcopilot.com", Duration.ofSeconds(120)));
		defaults.put(CUSTOM_OPENAI, new Defaults("Custom OpenAI", "", Duration.ofSeconds(60)));
		defaults.put(OLLAMA, new Defaults("Ollama", "http://localhost:11434", Duration.ofSeconds(120)));
		DEFAULTS = Collections.unmodifiableMap(defaults);
	}

	private Providers() {
	}

	/**
	 * Returns identifiers of the built-in providers in display order.
	 *
	 * @return provider identifiers
	 */
	@Nonnull
	public static Iterable<String> knownIds() {
		return DEFAULTS.keySet();
	}

	public static boolean isKnown(@Nonnull String id) {
		return DEFAULTS.containsKey(id.toLowerCase(Locale.ROOT).trim());
	}

	/**
	 * Resolves the provider configuration from built-in defaults and explicit overrides.
	 * Unknown identifiers are accepted and treated as OpenAI-compatible endpoints, which then
	 * require an explicit base URL.
	 *
	 * @param id      provider identifier
	 * @param baseUrl base URL override, null or blank keeps the default
	 * @param apiKey  static API key
	 * @param model   model name
	 * @param proxy   proxy URL
	 * @param timeout timeout override, null keeps the provider default
	 * @return resolved configuration
	 * @throws IllegalArgumentException when no base URL is known for the provider
	 */
	@Nonnull
	public static ProviderConfig resolve(
		@Nonnull String id,
		@Nullable String baseUrl,
		@Nullable String apiKey,
		@Nonnull String model,
		@Nullable String proxy,
		@Nullable Duration timeout
	) {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(model, "model must not be null");

		final String normalizedId = id.toLowerCase(Locale.ROOT).trim();
		final Defaults defaults = DEFAULTS.getOrDefault(normalizedId, new Defaults(id, "", DEFAULT_TIMEOUT));
		final String effectiveUrl = baseUrl == null || baseUrl.isBlank() ? defaults.baseUrl() : baseUrl;
		if (effectiveUrl.isBlank()) {
			throw new IllegalArgumentException("Provider '" + id + "' requires a base URL");
		}
		final Duration effectiveTimeout = timeout == null || timeout.isZero() || timeout.isNegative()
			? defaults.timeout()
			: timeout;
		return new ProviderConfig(normalizedId, defaults.name(), effectiveUrl, apiKey, model, proxy, effectiveTimeout);
	}

	/**
	 * Normalizes the URL by removing surrounding whitespace and trailing slashes.
	 *
	 * @param url the URL to normalize
	 * @return normalized URL
	 */
	@Nonnull
	public static String normalizeUrl(@Nonnull String url) {
		String normalized = url.trim();
		while (normalized.endsWith("/")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return normalized;
	}

	private record Defaults(@Nonnull String name, @Nonnull String baseUrl, @Nonnull Duration timeout) {
	}
}
