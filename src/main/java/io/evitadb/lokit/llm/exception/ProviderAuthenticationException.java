package io.evitadb.lokit.llm.exception;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Authentication against an OAuth-backed provider failed, either because the provider kept
 * answering 401 after re-authentication or because the token provider could not supply a token.
 */
public final class ProviderAuthenticationException extends ProviderException {

	private static final long serialVersionUID = 6930872219857021348L;

	public ProviderAuthenticationException(@Nonnull String message) {
		super(ErrorKind.AUTH_EXPIRED, null, message, null);
	}

	public ProviderAuthenticationException(@Nullable Integer statusCode, @Nonnull String message) {
		super(ErrorKind.AUTH_EXPIRED, statusCode, message, null);
	}

	public ProviderAuthenticationException(@Nonnull String message, @Nullable Throwable cause) {
		super(ErrorKind.AUTH_EXPIRED, null, message, cause);
	}
}
