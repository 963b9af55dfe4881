package io.evitadb.lokit.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * A single piece of source text handed out by a document for translation. Units are owned by
 * the document; the engine reads them and writes results back through the document by {@link #id()}.
 *
 * @param id           identifier of the entry within its document
 * @param source       source text (the singular form for plural entries)
 * @param pluralSource source plural form, or null when the entry has no plural
 * @param references   source references used as context hints, may be empty
 * @param needsReview  true when the current translation is marked fuzzy / needs review
 */
public record TranslatableUnit(
	@Nonnull String id,
	@Nonnull String source,
	@Nullable String pluralSource,
	@Nonnull List<String> references,
	boolean needsReview
) {

	public TranslatableUnit {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(source, "source must not be null");
		references = references == null ? List.of() : List.copyOf(references);
	}

	@Nonnull
	public static TranslatableUnit of(@Nonnull String id, @Nonnull String source) {
		return new TranslatableUnit(id, source, null, List.of(), false);
	}

	@Nonnull
	public static TranslatableUnit plural(@Nonnull String id, @Nonnull String singular, @Nonnull String plural) {
		return new TranslatableUnit(id, singular, Objects.requireNonNull(plural, "plural must not be null"), List.of(), false);
	}

	/**
	 * Returns true when the entry carries a plural counterpart and must be translated into all
	 * plural forms of the target language.
	 *
	 * @return true for plural entries
	 */
	public boolean isPlural() {
		return this.pluralSource != null && !this.pluralSource.isEmpty();
	}
}
