package io.evitadb.lokit.llm;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One resolved way of talking to a provider: how to build a request and how to read the response.
 * Routes are created once per run and shared by all workers, so implementations must be thread-safe.
 */
public interface ProviderRoute {

	/**
	 * Returns a short human-readable description used in log messages.
	 *
	 * @return description such as {@code Groq (chat completions)}
	 */
	@Nonnull
	String describe();

	/**
	 * Builds the request for one translation call. OAuth routes inject the current token.
	 *
	 * @param systemPrompt system instructions
	 * @param userPrompt   entries to translate
	 * @return request ready to be sent
	 */
	@Nonnull
	OutboundRequest buildRequest(@Nonnull String systemPrompt, @Nonnull String userPrompt);

	/**
	 * Extracts the model's text from a successful response body.
	 *
	 * @param body response body
	 * @return model output text
	 * @throws io.evitadb.lokit.llm.exception.DecodeException when no text can be extracted
	 */
	@Nonnull
	default String decode(@Nonnull String body) {
		return ResponseDecoder.extractText(body);
	}

	/**
	 * Returns true when a 401 response can be recovered by {@link #reauthenticate()}.
	 *
	 * @return true for OAuth-backed routes
	 */
	default boolean supportsReauthentication() {
		return false;
	}

	/**
	 * Replaces the token used by subsequent requests.
	 *
	 * @throws io.evitadb.lokit.llm.exception.ProviderAuthenticationException when no new token can be obtained
	 */
	default void reauthenticate() {
		throw new UnsupportedOperationException(describe() + " does not support re-authentication");
	}

	/**
	 * Returns a message replacing the generic error for the given rejected status, or null.
	 *
	 * @param statusCode HTTP status of the rejected call
	 * @return explanatory message or null
	 */
	@Nullable
	default String rejectionMessage(int statusCode) {
		return null;
	}
}
