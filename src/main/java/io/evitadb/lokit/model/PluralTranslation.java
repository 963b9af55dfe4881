package io.evitadb.lokit.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Result for one unit: either a single string or the list of plural forms of the target language.
 *
 * @param singular translated text of a non-plural unit, null for plural results
 * @param forms    translated plural forms, exactly {@code nplurals} long, null for singular results
 */
public record PluralTranslation(
	@Nullable String singular,
	@Nullable List<String> forms
) {

	public PluralTranslation {
		if ((singular == null) == (forms == null)) {
			throw new IllegalArgumentException("exactly one of singular or forms must be set");
		}
		forms = forms == null ? null : List.copyOf(forms);
	}

	@Nonnull
	public static PluralTranslation single(@Nonnull String text) {
		return new PluralTranslation(text, null);
	}

	@Nonnull
	public static PluralTranslation plural(@Nonnull List<String> forms) {
		return new PluralTranslation(null, forms);
	}

	public boolean isPlural() {
		return this.forms != null;
	}

	/**
	 * Returns true when the result carries at least one non-empty string.
	 *
	 * @return false for results that must not be applied
	 */
	public boolean hasContent() {
		if (this.singular != null) {
			return !this.singular.isEmpty();
		}
		for (final String form : this.forms) {
			if (!form.isEmpty()) {
				return true;
			}
		}
		return false;
	}
}
