package io.evitadb.lokit.document;

import io.evitadb.lokit.model.TranslatableUnit;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Contract between the translation engine and one on-disk translation format. The document owns
 * its entries; the engine only asks which units need work and writes results back by identifier.
 *
 * Implementations need not be thread-safe: the engine serializes all mutations of one output
 * document.
 */
public interface TranslationDocument {

	/**
	 * Returns the units to translate in source order. With {@code retranslate} set every unit is
	 * returned. Otherwise a unit is returned when it is marked as needing review and
	 * {@code includeFuzzy} is set, or when it is untranslated and not marked as needing review.
	 *
	 * @param retranslate  translate every unit, including translated ones
	 * @param includeFuzzy include units marked as needing review
	 * @return units in source order
	 */
	@Nonnull
	List<TranslatableUnit> unitsNeedingTranslation(boolean retranslate, boolean includeFuzzy);

	/**
	 * Returns the current translated value of the unit, null when the identifier is unknown.
	 */
	@Nullable
	String get(@Nonnull String id);

	/**
	 * Stores the translation of a non-plural unit.
	 */
	void set(@Nonnull String id, @Nonnull String value);

	/**
	 * Stores one plural form of a plural unit. Other form slots are left untouched.
	 */
	void setForm(@Nonnull String id, int formIndex, @Nonnull String value);

	/**
	 * Removes the needs-review marker of the unit.
	 */
	void clearNeedsReview(@Nonnull String id);

	@Nonnull
	DocumentStats stats();

	/**
	 * Writes the document preserving key order and non-translatable content of the original.
	 *
	 * @param path target file
	 * @throws IOException when the file cannot be written
	 */
	void persist(@Nonnull Path path) throws IOException;

	/**
	 * Returns the plural rule header of the document (gettext {@code Plural-Forms} syntax)
	 * when the format carries one.
	 *
	 * @return header value or empty
	 */
	@Nonnull
	default Optional<String> pluralFormsHeader() {
		return Optional.empty();
	}
}
