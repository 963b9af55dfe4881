package io.evitadb.lokit.model;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable record summarizing a translation run.
 *
 * @param translatedUnits number of units that received a translation
 * @param calls           number of chunks that completed an outbound call successfully
 * @param failedLanguages languages with at least one failed chunk, in task order
 * @param cancelled       true when the run stopped early because of cancellation
 */
public record TranslationSummary(
	int translatedUnits,
	int calls,
	@Nonnull List<String> failedLanguages,
	boolean cancelled
) {

	public TranslationSummary {
		failedLanguages = List.copyOf(failedLanguages);
	}

	/**
	 * Creates an empty summary with all counts at zero.
	 *
	 * @return an empty TranslationSummary
	 */
	@Nonnull
	public static TranslationSummary empty() {
		return new TranslationSummary(0, 0, List.of(), false);
	}

	public boolean isAllSuccessful() {
		return this.failedLanguages.isEmpty();
	}

	public boolean hasFailures() {
		return !this.failedLanguages.isEmpty();
	}

	/**
	 * Creates a new summary with one more successful chunk.
	 *
	 * @param units units translated by the chunk
	 * @return a new TranslationSummary with updated counts
	 */
	@Nonnull
	public TranslationSummary withChunk(int units) {
		return new TranslationSummary(this.translatedUnits + units, this.calls + 1, this.failedLanguages, this.cancelled);
	}

	/**
	 * Creates a new summary with the language marked as failed. Marking a language twice keeps one entry.
	 *
	 * @param language failed language code
	 * @return a new TranslationSummary with updated failures
	 */
	@Nonnull
	public TranslationSummary withFailedLanguage(@Nonnull String language) {
		if (this.failedLanguages.contains(language)) {
			return this;
		}
		final List<String> failed = new ArrayList<>(this.failedLanguages);
		failed.add(language);
		return new TranslationSummary(this.translatedUnits, this.calls, failed, this.cancelled);
	}

	@Nonnull
	public TranslationSummary withCancelled() {
		return new TranslationSummary(this.translatedUnits, this.calls, this.failedLanguages, true);
	}

	/**
	 * @throws TranslationFailedException when any language failed
	 */
	public void throwIfFailed() {
		if (hasFailures()) {
			throw new TranslationFailedException(this.failedLanguages);
		}
	}

	@Override
	public String toString() {
		return String.format(
			"TranslationSummary[translated=%d, calls=%d, failed=%s, cancelled=%b]",
			this.translatedUnits, this.calls, this.failedLanguages, this.cancelled
		);
	}
}
