package io.evitadb.lokit.llm.exception;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;

/**
 * The provider kept answering 429 until the retry budget was exhausted.
 */
public final class RateLimitedException extends ProviderException {

	private static final long serialVersionUID = 1870326648517002963L;

	private final Duration retryDelay;

	public RateLimitedException(@Nonnull String message, @Nonnull Duration retryDelay) {
		super(ErrorKind.RATE_LIMITED, 429, message);
		this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay must not be null");
	}

	/**
	 * Returns the delay the provider asked for in its last 429 response, including the safety buffer.
	 *
	 * @return the last computed pause
	 */
	@Nonnull
	public Duration getRetryDelay() {
		return this.retryDelay;
	}
}
