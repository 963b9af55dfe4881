package io.evitadb.lokit.model;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Aggregate failure of a translation run naming every language that could not be translated.
 */
public final class TranslationFailedException extends RuntimeException {

	private static final long serialVersionUID = -6152231938305508837L;

	private final List<String> failedLanguages;

	public TranslationFailedException(@Nonnull List<String> failedLanguages) {
		super(failedLanguages.size() + " language(s) failed: " + String.join(", ", failedLanguages));
		this.failedLanguages = List.copyOf(failedLanguages);
	}

	@Nonnull
	public List<String> getFailedLanguages() {
		return this.failedLanguages;
	}
}
