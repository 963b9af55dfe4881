package io.evitadb.lokit.model;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Splits the units of one language into chunks of a fixed size, keeping source order.
 * A chunk size of zero or less means a single chunk holding everything.
 */
public final class ChunkSplitter {

	private final int chunkSize;

	public ChunkSplitter(int chunkSize) {
		this.chunkSize = chunkSize;
	}

	/**
	 * Splits the units into chunks.
	 *
	 * @param language language the chunks belong to
	 * @param units    units needing translation, in source order
	 * @return chunks in source order, empty when there are no units
	 */
	@Nonnull
	public List<Chunk> split(@Nonnull String language, @Nonnull List<TranslatableUnit> units) {
		Objects.requireNonNull(language, "language must not be null");
		Objects.requireNonNull(units, "units must not be null");

		if (units.isEmpty()) {
			return Collections.emptyList();
		}
		if (this.chunkSize <= 0 || this.chunkSize >= units.size()) {
			return List.of(new Chunk(language, 0, 1, units));
		}

		final int count = (units.size() + this.chunkSize - 1) / this.chunkSize;
		final List<Chunk> chunks = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			final int from = i * this.chunkSize;
			final int to = Math.min(from + this.chunkSize, units.size());
			chunks.add(new Chunk(language, i, count, units.subList(from, to)));
		}
		return chunks;
	}

	public int getChunkSize() {
		return this.chunkSize;
	}
}
