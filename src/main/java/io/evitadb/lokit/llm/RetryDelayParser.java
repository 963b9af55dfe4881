package io.evitadb.lokit.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;

/**
 * Reads the pause a provider requests in a 429 response. Google style bodies carry
 * {@code error.details[]} with a {@code RetryInfo} entry whose {@code retryDelay} looks like
 * {@code "30s"} or {@code "12.5s"}. The parsed delay is extended by a safety buffer; bodies without
 * a usable hint yield the fallback delay.
 */
public final class RetryDelayParser {

	/**
	 * Added to every delay announced by the provider.
	 */
	public static final Duration DEFAULT_BUFFER = Duration.ofSeconds(5);
	/**
	 * Used when the response carries no retry hint: one minute plus the buffer.
	 */
	public static final Duration DEFAULT_DELAY = Duration.ofSeconds(65);

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final Duration buffer;
	private final Duration fallback;

	public RetryDelayParser() {
		this(DEFAULT_BUFFER, DEFAULT_DELAY);
	}

	public RetryDelayParser(@Nonnull Duration buffer, @Nonnull Duration fallback) {
		this.buffer = Objects.requireNonNull(buffer, "buffer must not be null");
		this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
	}

	/**
	 * Computes how long all workers should pause after a 429 response.
	 *
	 * @param body 429 response body, may be null or not JSON at all
	 * @return announced delay plus buffer, or the fallback delay
	 */
	@Nonnull
	public Duration parse(@Nullable String body) {
		if (body == null || body.isBlank()) {
			return this.fallback;
		}
		final JsonNode root;
		try {
			root = MAPPER.readTree(body);
		} catch (JsonProcessingException e) {
			return this.fallback;
		}
		if (root == null) {
			return this.fallback;
		}
		for (final JsonNode detail : root.path("error").path("details")) {
			final String type = detail.path("@type").asText("");
			final String retryDelay = detail.path("retryDelay").asText("");
			if (type.contains("RetryInfo") && !retryDelay.isEmpty()) {
				final String seconds = retryDelay.endsWith("s")
					? retryDelay.substring(0, retryDelay.length() - 1)
					: retryDelay;
				try {
					final long millis = (long) (Double.parseDouble(seconds) * 1000);
					return Duration.ofMillis(millis).plus(this.buffer);
				} catch (NumberFormatException e) {
					return this.fallback;
				}
			}
		}
		return this.fallback;
	}

	@Nonnull
	public Duration getBuffer() {
		return this.buffer;
	}

	@Nonnull
	public Duration getFallback() {
		return this.fallback;
	}
}
