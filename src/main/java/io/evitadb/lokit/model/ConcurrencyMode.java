package io.evitadb.lokit.model;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * How the scheduler distributes chunks over outbound calls.
 */
public enum ConcurrencyMode {

	/**
	 * One language after another, chunks in source order, one call in flight.
	 */
	SEQUENTIAL("sequential"),
	/**
	 * All (language, chunk) pairs of the run flattened into one bounded worker pool.
	 */
	FULL_PARALLEL("full-parallel");

	private final String id;

	ConcurrencyMode(@Nonnull String id) {
		this.id = id;
	}

	@Nonnull
	public String getId() {
		return this.id;
	}

	/**
	 * Resolves the mode from its configuration identifier (case-insensitive).
	 *
	 * @param id identifier such as {@code sequential} or {@code full-parallel}
	 * @return matching mode
	 * @throws IllegalArgumentException for unknown identifiers
	 */
	@Nonnull
	public static ConcurrencyMode fromId(@Nonnull String id) {
		final String normalized = id.trim().toLowerCase(Locale.ROOT);
		for (final ConcurrencyMode mode : values()) {
			if (mode.id.equals(normalized)) {
				return mode;
			}
		}
		throw new IllegalArgumentException(
			"Unknown concurrency mode '" + id + "', expected one of: " +
				Arrays.stream(values()).map(ConcurrencyMode::getId).collect(Collectors.joining(", "))
		);
	}
}
