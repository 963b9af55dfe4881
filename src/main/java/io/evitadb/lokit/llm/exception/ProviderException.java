package io.evitadb.lokit.llm.exception;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Base exception for failures of a single translation call against an AI provider.
 * Carries the {@link ErrorKind} and the HTTP status code when the failure came from a response.
 */
public class ProviderException extends RuntimeException {

	private static final long serialVersionUID = 4125309541983474130L;

	private final ErrorKind kind;
	@Nullable private final Integer statusCode;

	public ProviderException(@Nonnull ErrorKind kind, @Nonnull String message) {
		this(kind, null, message, null);
	}

	public ProviderException(@Nonnull ErrorKind kind, @Nullable Integer statusCode, @Nonnull String message) {
		this(kind, statusCode, message, null);
	}

	public ProviderException(
		@Nonnull ErrorKind kind,
		@Nullable Integer statusCode,
		@Nonnull String message,
		@Nullable Throwable cause
	) {
		super(message, cause);
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
		this.statusCode = statusCode;
	}

	@Nonnull
	public ErrorKind getKind() {
		return this.kind;
	}

	/**
	 * Returns the HTTP status code of the failed response, or null for network and decode failures.
	 *
	 * @return status code or null
	 */
	@Nullable
	public Integer getStatusCode() {
		return this.statusCode;
	}

	/**
	 * Shortens a response body for inclusion in an error message.
	 *
	 * @param body     the body, may be null
	 * @param maxChars maximal number of characters kept
	 * @return the body or its prefix followed by {@code ...}
	 */
	@Nonnull
	public static String truncate(@Nullable String body, int maxChars) {
		if (body == null) {
			return "";
		}
		if (body.length() <= maxChars) {
			return body;
		}
		return body.substring(0, maxChars) + "...";
	}
}
