package io.evitadb.lokit.llm.exception;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when a provider response does not contain text in any known envelope shape, reports
 * a structured error, or when the model's text cannot be read as a translation array.
 */
public final class DecodeException extends ProviderException {

	private static final long serialVersionUID = -2214981722410559016L;

	public DecodeException(@Nonnull String message) {
		super(ErrorKind.MALFORMED_RESPONSE, null, message, null);
	}

	public DecodeException(@Nonnull String message, @Nullable Throwable cause) {
		super(ErrorKind.MALFORMED_RESPONSE, null, message, cause);
	}
}
