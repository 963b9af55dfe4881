package io.evitadb.lokit.model;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * An ordered, non-empty slice of units translated by a single outbound call.
 *
 * @param language target language code
 * @param index    zero-based index of this chunk within the language
 * @param count    total number of chunks of the language
 * @param units    units in source order
 */
public record Chunk(
	@Nonnull String language,
	int index,
	int count,
	@Nonnull List<TranslatableUnit> units
) {

	public Chunk {
		Objects.requireNonNull(language, "language must not be null");
		Objects.requireNonNull(units, "units must not be null");
		if (units.isEmpty()) {
			throw new IllegalArgumentException("units must not be empty");
		}
		if (index < 0 || index >= count) {
			throw new IllegalArgumentException("index must be within 0.." + (count - 1) + " but was " + index);
		}
		units = List.copyOf(units);
	}

	public int size() {
		return this.units.size();
	}

	/**
	 * Returns true if at least one unit of the chunk needs plural forms.
	 *
	 * @return true when the plural-aware protocol must be used
	 */
	public boolean hasPlurals() {
		for (final TranslatableUnit unit : this.units) {
			if (unit.isPlural()) {
				return true;
			}
		}
		return false;
	}

	@Override
	public String toString() {
		return "Chunk[" + this.language + " " + (this.index + 1) + "/" + this.count + ", " + this.units.size() + " units]";
	}
}
