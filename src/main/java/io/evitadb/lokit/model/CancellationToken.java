package io.evitadb.lokit.model;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by everything running for one translation run.
 * Work is never interrupted forcibly: callers check the token at chunk boundaries and every wait
 * goes through {@link #sleep(Duration)} so that it wakes up as soon as the token is cancelled.
 */
public final class CancellationToken {

	private final AtomicBoolean cancelled = new AtomicBoolean(false);
	private final CountDownLatch signal = new CountDownLatch(1);

	/**
	 * Creates a token that is cancelled only when {@link #cancel()} is called on it.
	 *
	 * @return fresh token
	 */
	@Nonnull
	public static CancellationToken create() {
		return new CancellationToken();
	}

	/**
	 * Requests cancellation. Repeated calls have no further effect.
	 */
	public void cancel() {
		if (this.cancelled.compareAndSet(false, true)) {
			this.signal.countDown();
		}
	}

	public boolean isCancelled() {
		return this.cancelled.get();
	}

	/**
	 * @throws CancellationException when the token has been cancelled
	 */
	public void throwIfCancelled() {
		if (this.cancelled.get()) {
			throw new CancellationException("Translation run was cancelled");
		}
	}

	/**
	 * Waits for the given duration or until the token is cancelled, whichever comes first.
	 *
	 * @param duration time to wait, zero or negative returns immediately
	 * @throws CancellationException when the token is cancelled before or during the wait,
	 *                               or the waiting thread is interrupted
	 */
	public void sleep(@Nonnull Duration duration) {
		Objects.requireNonNull(duration, "duration must not be null");
		throwIfCancelled();
		if (duration.isZero() || duration.isNegative()) {
			return;
		}
		try {
			if (this.signal.await(duration.toNanos(), TimeUnit.NANOSECONDS)) {
				throwIfCancelled();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			final CancellationException cancellation = new CancellationException("Interrupted while waiting");
			cancellation.initCause(e);
			throw cancellation;
		}
	}
}
