package io.evitadb.lokit.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CancellationToken should stop waits cooperatively")
public class CancellationTokenTest {

	@Test
	@DisplayName("is not cancelled until cancel is called")
	void shouldTrackCancellation() {
		final CancellationToken token = CancellationToken.create();
		assertFalse(token.isCancelled());
		assertDoesNotThrow(token::throwIfCancelled);

		token.cancel();
		token.cancel();

		assertTrue(token.isCancelled());
		assertThrows(CancellationException.class, token::throwIfCancelled);
	}

	@Test
	@DisplayName("sleeps for the full duration when not cancelled")
	void shouldSleepWhenNotCancelled() {
		final CancellationToken token = CancellationToken.create();
		final long start = System.nanoTime();

		token.sleep(Duration.ofMillis(50));

		assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(45));
	}

	@Test
	@DisplayName("wakes up a sleeping thread promptly on cancel")
	void shouldWakeUpOnCancel() {
		final CancellationToken token = CancellationToken.create();
		final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
		try {
			scheduler.schedule(token::cancel, 50, TimeUnit.MILLISECONDS);
			final long start = System.nanoTime();

			assertThrows(CancellationException.class, () -> token.sleep(Duration.ofSeconds(30)));

			assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(5));
		} finally {
			scheduler.shutdownNow();
		}
	}

	@Test
	@DisplayName("refuses to sleep once cancelled")
	void shouldThrowImmediatelyWhenCancelled() {
		final CancellationToken token = CancellationToken.create();
		token.cancel();

		assertThrows(CancellationException.class, () -> token.sleep(Duration.ZERO));
	}
}
