package io.evitadb.lokit.llm;

import io.evitadb.lokit.llm.exception.ProviderAuthenticationException;

import javax.annotation.Nonnull;

/**
 * Supplies tokens for OAuth-backed providers. Obtaining the first token, storing credentials and
 * any interactive login flow belong to the implementation; the engine only asks for the current
 * token and, after a 401 response, for a new one. Implementations must be thread-safe.
 */
public interface OAuthTokenProvider {

	/**
	 * Returns a valid token, authenticating first when no token is available.
	 *
	 * @return current token
	 * @throws ProviderAuthenticationException when no token can be obtained
	 */
	@Nonnull
	OAuthToken currentToken();

	/**
	 * Obtains a new access token using the stored refresh credentials.
	 *
	 * @return refreshed token
	 * @throws ProviderAuthenticationException when the refresh fails
	 */
	@Nonnull
	OAuthToken refresh();

	/**
	 * Discards the cached token and authenticates from scratch.
	 *
	 * @return new token
	 * @throws ProviderAuthenticationException when authentication fails
	 */
	@Nonnull
	OAuthToken reauthenticate();
}
