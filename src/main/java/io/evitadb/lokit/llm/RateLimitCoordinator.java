package io.evitadb.lokit.llm;

import io.evitadb.lokit.model.CancellationToken;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pause shared by all workers of one translation run. When any worker receives a 429 response it
 * pauses the coordinator until a deadline; every worker consults the coordinator before each
 * attempt and waits until the deadline has passed. The first worker to observe the elapsed
 * deadline clears the pause, the others simply proceed.
 *
 * The paused flag is read without locking, the deadline is guarded by the instance monitor.
 */
public final class RateLimitCoordinator {

	/**
	 * Default polling interval of {@link #awaitIfPaused(CancellationToken, Duration)}.
	 */
	public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

	private final AtomicBoolean paused = new AtomicBoolean(false);
	private final Object lock = new Object();
	private final Clock clock;
	@Nullable private Instant pauseUntil;

	public RateLimitCoordinator() {
		this(Clock.systemUTC());
	}

	public RateLimitCoordinator(@Nonnull Clock clock) {
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	public boolean isPaused() {
		return this.paused.get();
	}

	/**
	 * Pauses all workers for the given duration, counted from now. A running pause with a later
	 * deadline is kept, a pause never gets shorter.
	 *
	 * @param duration pause length
	 */
	public void pause(@Nonnull Duration duration) {
		Objects.requireNonNull(duration, "duration must not be null");
		synchronized (this.lock) {
			final Instant deadline = this.clock.instant().plus(duration);
			if (!this.paused.get() || this.pauseUntil == null || deadline.isAfter(this.pauseUntil)) {
				this.pauseUntil = deadline;
			}
			this.paused.set(true);
		}
	}

	/**
	 * Clears the pause once its deadline has passed. A deadline extended by another worker keeps
	 * the pause in place.
	 *
	 * @return true when the coordinator is no longer paused
	 */
	public boolean resumeIfElapsed() {
		synchronized (this.lock) {
			if (this.paused.get() && this.pauseUntil != null && this.clock.instant().isBefore(this.pauseUntil)) {
				return false;
			}
			this.paused.set(false);
			this.pauseUntil = null;
			return true;
		}
	}

	/**
	 * Returns the current pause deadline, null when not paused.
	 *
	 * @return deadline or null
	 */
	@Nullable
	public Instant getPauseUntil() {
		synchronized (this.lock) {
			return this.paused.get() ? this.pauseUntil : null;
		}
	}

	/**
	 * Blocks while the coordinator is paused, polling at the given interval so that cancellation
	 * is observed promptly.
	 *
	 * @param token        cancellation token of the run
	 * @param pollInterval maximal time between two checks of the deadline
	 * @throws java.util.concurrent.CancellationException when the run is cancelled while waiting
	 */
	public void awaitIfPaused(@Nonnull CancellationToken token, @Nonnull Duration pollInterval) {
		Objects.requireNonNull(token, "token must not be null");
		Objects.requireNonNull(pollInterval, "pollInterval must not be null");

		while (this.paused.get()) {
			final Duration remaining;
			synchronized (this.lock) {
				if (!this.paused.get()) {
					return;
				}
				remaining = this.pauseUntil == null
					? Duration.ZERO
					: Duration.between(this.clock.instant(), this.pauseUntil);
				if (remaining.isZero() || remaining.isNegative()) {
					this.paused.set(false);
					this.pauseUntil = null;
					return;
				}
			}
			token.sleep(remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval);
		}
	}
}
