package io.evitadb.lokit.llm;

import io.evitadb.lokit.llm.exception.ErrorKind;
import io.evitadb.lokit.llm.exception.ProviderAuthenticationException;
import io.evitadb.lokit.llm.exception.ProviderException;
import io.evitadb.lokit.llm.exception.RateLimitedException;
import io.evitadb.lokit.model.CancellationToken;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Issues one translation call with retries. Each attempt first waits out a shared rate-limit
 * pause and checks cancellation, then sends the request and classifies the outcome:
 *
 * - network failure or 5xx: exponential backoff ({@code 2^attempt} backoff units) while attempts remain
 * - 429: pauses every worker of the run for the announced delay, waits until the shared pause ends and retries
 * - 401 on an OAuth route: re-authenticates once, on the first attempt only
 * - other non-2xx: fails immediately
 * - 2xx: the body is decoded by the route
 *
 * The executor is stateless apart from its configuration and can be shared by all workers.
 */
public final class RequestExecutor {

	/**
	 * Base of the exponential backoff.
	 */
	public static final Duration DEFAULT_BACKOFF_UNIT = Duration.ofSeconds(1);

	private final HttpTransport transport;
	private final Log log;
	private final boolean verbose;
	private final Duration backoffUnit;
	private final Duration pollInterval;
	private final RetryDelayParser retryDelayParser;

	public RequestExecutor(@Nonnull HttpTransport transport, @Nonnull Log log, boolean verbose) {
		this(transport, log, verbose, DEFAULT_BACKOFF_UNIT, RateLimitCoordinator.DEFAULT_POLL_INTERVAL, new RetryDelayParser());
	}

	/**
	 * Creates an executor with explicit timing, mainly for tests that cannot wait for seconds.
	 *
	 * @param transport        transport sending the requests
	 * @param log              log receiving warnings and verbose diagnostics
	 * @param verbose          report every attempt at info level
	 * @param backoffUnit      wait before the second attempt, doubled for each further attempt
	 * @param pollInterval     polling interval while the run is paused
	 * @param retryDelayParser computes pauses from 429 responses
	 */
	public RequestExecutor(
		@Nonnull HttpTransport transport,
		@Nonnull Log log,
		boolean verbose,
		@Nonnull Duration backoffUnit,
		@Nonnull Duration pollInterval,
		@Nonnull RetryDelayParser retryDelayParser
	) {
		this.transport = Objects.requireNonNull(transport, "transport must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.verbose = verbose;
		this.backoffUnit = Objects.requireNonNull(backoffUnit, "backoffUnit must not be null");
		this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
		this.retryDelayParser = Objects.requireNonNull(retryDelayParser, "retryDelayParser must not be null");
	}

	/**
	 * Sends the prompts through the route and returns the model's text.
	 *
	 * @param route        provider route of the run
	 * @param systemPrompt system instructions
	 * @param userPrompt   entries to translate
	 * @param rateLimit    pause shared by all workers of the run
	 * @param maxRetries   number of retries after the first attempt
	 * @param token        cancellation token of the run
	 * @return model output text
	 * @throws ProviderException                          when the call fails for good
	 * @throws java.util.concurrent.CancellationException when the run is cancelled
	 */
	@Nonnull
	public String execute(
		@Nonnull ProviderRoute route,
		@Nonnull String systemPrompt,
		@Nonnull String userPrompt,
		@Nonnull RateLimitCoordinator rateLimit,
		int maxRetries,
		@Nonnull CancellationToken token
	) {
		Objects.requireNonNull(route, "route must not be null");
		Objects.requireNonNull(rateLimit, "rateLimit must not be null");
		Objects.requireNonNull(token, "token must not be null");
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must not be negative");
		}

		for (int attempt = 0; attempt <= maxRetries; attempt++) {
			rateLimit.awaitIfPaused(token, this.pollInterval);
			token.throwIfCancelled();

			final OutboundRequest request = route.buildRequest(systemPrompt, userPrompt);
			debug(route.describe() + " attempt " + (attempt + 1) + ": POST " + request.url());

			final TransportResponse response;
			try {
				response = this.transport.send(request);
			} catch (IOException e) {
				if (attempt < maxRetries) {
					debug("Request failed (" + e.getMessage() + "), retrying");
					backoff(attempt, token);
					continue;
				}
				throw new ProviderException(ErrorKind.TRANSIENT, null, "API request failed: " + e.getMessage(), e);
			}

			final int status = response.statusCode();
			final String body = response.body();

			if (status == 429) {
				final Duration delay = this.retryDelayParser.parse(body);
				rateLimit.pause(delay);
				this.log.warn(
					"429 rate limited by " + route.describe() + ", pausing all requests for " + delay.toMillis() +
						" ms (attempt " + (attempt + 1) + "/" + (maxRetries + 1) + ")"
				);
				if (attempt < maxRetries) {
					token.sleep(delay);
					rateLimit.resumeIfElapsed();
					continue;
				}
				throw new RateLimitedException(
					"rate limited after " + maxRetries + " retries: " + ProviderException.truncate(body, 500),
					delay
				);
			}

			if (status == 401 && route.supportsReauthentication()) {
				if (attempt == 0) {
					this.log.warn(route.describe() + " rejected the token (401), re-authenticating");
					route.reauthenticate();
					continue;
				}
				throw new ProviderAuthenticationException(
					status, "authentication failed (401): " + ProviderException.truncate(body, 300)
				);
			}

			if (!response.isSuccessful()) {
				if (status >= 500) {
					if (attempt < maxRetries) {
						debug("Server error " + status + ", retrying");
						backoff(attempt, token);
						continue;
					}
					throw new ProviderException(ErrorKind.TRANSIENT, status, statusMessage(status, body));
				}
				final String rejection = route.rejectionMessage(status);
				throw new ProviderException(
					ErrorKind.CLIENT_REJECTED, status, rejection == null ? statusMessage(status, body) : rejection
				);
			}

			return route.decode(body);
		}

		throw new ProviderException(ErrorKind.TRANSIENT, "exhausted all " + maxRetries + " retries");
	}

	private void backoff(int attempt, @Nonnull CancellationToken token) {
		token.sleep(this.backoffUnit.multipliedBy(1L << Math.min(attempt, 30)));
	}

	private void debug(@Nonnull String message) {
		if (this.verbose) {
			this.log.info(message);
		} else if (this.log.isDebugEnabled()) {
			this.log.debug(message);
		}
	}

	@Nonnull
	private static String statusMessage(int status, @Nonnull String body) {
		return "API returned status " + status + ": " + ProviderException.truncate(body, 500);
	}
}
