package io.evitadb.lokit.llm;

import io.evitadb.lokit.llm.exception.ProviderAuthenticationException;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Token provider for a token obtained outside of the engine, for example passed to the Maven goal.
 * It cannot refresh: once the provider rejects the token the run fails with an authentication error.
 */
public final class StaticOAuthTokenProvider implements OAuthTokenProvider {

	private final OAuthToken token;

	public StaticOAuthTokenProvider(@Nonnull OAuthToken token) {
		this.token = Objects.requireNonNull(token, "token must not be null");
	}

	@Nonnull
	@Override
	public OAuthToken currentToken() {
		return this.token;
	}

	@Nonnull
	@Override
	public OAuthToken refresh() {
		throw new ProviderAuthenticationException("static token cannot be refreshed");
	}

	@Nonnull
	@Override
	public OAuthToken reauthenticate() {
		throw new ProviderAuthenticationException("static token was rejected, obtain a new one and run again");
	}
}
