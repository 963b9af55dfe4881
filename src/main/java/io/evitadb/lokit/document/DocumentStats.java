package io.evitadb.lokit.document;

/**
 * Translation statistics of a document.
 *
 * @param total       number of translatable entries
 * @param translated  number of entries with a translation
 * @param needsReview number of entries marked as needing review
 */
public record DocumentStats(int total, int translated, int needsReview) {

	public DocumentStats {
		if (total < 0 || translated < 0 || needsReview < 0) {
			throw new IllegalArgumentException("counts must be non-negative");
		}
	}

	public int untranslated() {
		return this.total - this.translated;
	}

	/**
	 * Returns the share of translated entries in percent, 100 for an empty document.
	 *
	 * @return percentage in range 0..100
	 */
	public int percentTranslated() {
		return this.total == 0 ? 100 : (int) (this.translated * 100L / this.total);
	}
}
