package io.evitadb.lokit.llm;

import io.evitadb.lokit.model.CancellationToken;
import io.evitadb.lokit.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RateLimitCoordinator should hold all workers during a 429 pause")
public class RateLimitCoordinatorTest {

	private static final Instant START = Instant.parse("2026-01-01T10:00:00Z");
	private static final Duration POLL = Duration.ofMillis(5);

	private MutableClock clock;
	private RateLimitCoordinator coordinator;

	@BeforeEach
	void setUp() {
		clock = new MutableClock(START);
		coordinator = new RateLimitCoordinator(clock);
	}

	@Test
	@DisplayName("does not block when not paused")
	void shouldPassThroughWhenNotPaused() {
		assertFalse(coordinator.isPaused());
		assertNull(coordinator.getPauseUntil());
		assertDoesNotThrow(() -> coordinator.awaitIfPaused(CancellationToken.create(), POLL));
	}

	@Test
	@DisplayName("pauses for the announced delay plus buffer and releases observers at the deadline")
	void shouldHoldObserverForWholeWindow() throws Exception {
		final String body = "{\"error\":{\"details\":[{\"@type\":\"type.googleapis.com/google.rpc.RetryInfo\",\"retryDelay\":\"30s\"}]}}";
		coordinator.pause(new RetryDelayParser().parse(body));

		assertTrue(coordinator.isPaused());
		assertEquals(START.plusSeconds(35), coordinator.getPauseUntil());

		final CompletableFuture<Void> observer = CompletableFuture.runAsync(
			() -> coordinator.awaitIfPaused(CancellationToken.create(), POLL)
		);

		clock.advance(Duration.ofSeconds(34));
		Thread.sleep(50);
		assertFalse(observer.isDone(), "observer must wait until the deadline");
		assertTrue(coordinator.isPaused());

		clock.advance(Duration.ofSeconds(1));
		observer.get(5, TimeUnit.SECONDS);

		assertFalse(coordinator.isPaused());
		assertNull(coordinator.getPauseUntil());
	}

	@Test
	@DisplayName("later deadline extends the pause")
	void shouldExtendDeadline() {
		coordinator.pause(Duration.ofSeconds(5));
		clock.advance(Duration.ofSeconds(2));
		coordinator.pause(Duration.ofSeconds(10));

		assertEquals(START.plusSeconds(12), coordinator.getPauseUntil());
	}

	@Test
	@DisplayName("shorter delay never shortens a running pause")
	void shouldKeepLaterDeadline() {
		coordinator.pause(Duration.ofSeconds(60));
		coordinator.pause(Duration.ofMillis(10));

		assertEquals(START.plusSeconds(60), coordinator.getPauseUntil());
	}

	@Test
	@DisplayName("stays paused while another worker's deadline is pending")
	void shouldNotResumeBeforeDeadline() {
		coordinator.pause(Duration.ofSeconds(1));
		clock.advance(Duration.ofMillis(500));
		coordinator.pause(Duration.ofSeconds(1));
		clock.advance(Duration.ofMillis(600));

		assertFalse(coordinator.resumeIfElapsed());
		assertTrue(coordinator.isPaused());
		assertEquals(START.plusMillis(1500), coordinator.getPauseUntil());

		clock.advance(Duration.ofMillis(400));
		assertTrue(coordinator.resumeIfElapsed());
		assertFalse(coordinator.isPaused());
		assertDoesNotThrow(() -> coordinator.awaitIfPaused(CancellationToken.create(), POLL));
	}

	@Test
	@DisplayName("waiting observer gives up when the run is cancelled")
	void shouldStopWaitingOnCancel() {
		final CancellationToken token = CancellationToken.create();
		coordinator.pause(Duration.ofMinutes(5));

		final CompletableFuture<Void> observer = CompletableFuture.runAsync(() -> coordinator.awaitIfPaused(token, POLL));
		token.cancel();

		final Exception ex = assertThrows(Exception.class, () -> observer.get(5, TimeUnit.SECONDS));
		assertInstanceOf(CancellationException.class, ex.getCause());
	}
}
