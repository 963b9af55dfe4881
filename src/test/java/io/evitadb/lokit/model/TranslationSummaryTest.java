package io.evitadb.lokit.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TranslationSummary should track run statistics")
public class TranslationSummaryTest {

	@Test
	@DisplayName("shouldCreateEmptySummary")
	void shouldCreateEmptySummary() {
		final TranslationSummary summary = TranslationSummary.empty();

		assertEquals(0, summary.translatedUnits());
		assertEquals(0, summary.calls());
		assertTrue(summary.failedLanguages().isEmpty());
		assertFalse(summary.cancelled());
		assertTrue(summary.isAllSuccessful());
	}

	@Test
	@DisplayName("shouldAccumulateChunks")
	void shouldAccumulateChunks() {
		final TranslationSummary summary = TranslationSummary.empty()
			.withChunk(2)
			.withChunk(2)
			.withChunk(1);

		assertEquals(5, summary.translatedUnits());
		assertEquals(3, summary.calls());
	}

	@Test
	@DisplayName("shouldListFailedLanguageOnce")
	void shouldListFailedLanguageOnce() {
		final TranslationSummary summary = TranslationSummary.empty()
			.withFailedLanguage("de")
			.withFailedLanguage("ru")
			.withFailedLanguage("de");

		assertEquals(List.of("de", "ru"), summary.failedLanguages());
		assertTrue(summary.hasFailures());
	}

	@Test
	@DisplayName("shouldThrowAggregateFailure")
	void shouldThrowAggregateFailure() {
		final TranslationSummary summary = TranslationSummary.empty()
			.withFailedLanguage("de")
			.withFailedLanguage("ru");

		final TranslationFailedException ex = assertThrows(TranslationFailedException.class, summary::throwIfFailed);
		assertEquals("2 language(s) failed: de, ru", ex.getMessage());
		assertEquals(List.of("de", "ru"), ex.getFailedLanguages());
	}

	@Test
	@DisplayName("shouldNotThrowWithoutFailures")
	void shouldNotThrowWithoutFailures() {
		assertDoesNotThrow(() -> TranslationSummary.empty().withChunk(3).withCancelled().throwIfFailed());
	}

	@Test
	@DisplayName("shouldBeImmutable")
	void shouldBeImmutable() {
		final TranslationSummary original = TranslationSummary.empty();
		final TranslationSummary modified = original.withChunk(4).withCancelled();

		assertEquals(0, original.translatedUnits());
		assertFalse(original.cancelled());
		assertEquals(4, modified.translatedUnits());
		assertTrue(modified.cancelled());
	}
}
