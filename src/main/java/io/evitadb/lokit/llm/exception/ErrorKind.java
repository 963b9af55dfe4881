package io.evitadb.lokit.llm.exception;

/**
 * Classification of failures crossing the provider boundary. The kind decides whether
 * {@link io.evitadb.lokit.llm.RequestExecutor} retries a call and how.
 */
public enum ErrorKind {

	/**
	 * Network failure or 5xx status. Retried with exponential backoff.
	 */
	TRANSIENT,
	/**
	 * Status 429. Retried after a pause shared by all workers of the run.
	 */
	RATE_LIMITED,
	/**
	 * Status 401 from an OAuth-backed provider. Re-authenticated once.
	 */
	AUTH_EXPIRED,
	/**
	 * Any other 4xx status. Never retried.
	 */
	CLIENT_REJECTED,
	/**
	 * The response could not be decoded into translations. Never retried.
	 */
	MALFORMED_RESPONSE;

	/**
	 * Returns true when the executor may issue another attempt for this kind of failure.
	 *
	 * @return true for transient and rate-limited failures
	 */
	public boolean isRetryable() {
		return this == TRANSIENT || this == RATE_LIMITED;
	}
}
