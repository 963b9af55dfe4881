package io.evitadb.lokit.model;

import javax.annotation.Nonnull;

/**
 * Receives cumulative progress of one language after each translated chunk.
 */
@FunctionalInterface
public interface ProgressListener {

	ProgressListener NONE = (language, done, total) -> {
	};

	/**
	 * @param language target language code
	 * @param done     number of units handled so far for the language
	 * @param total    number of units the language needs translated in this run
	 */
	void onProgress(@Nonnull String language, int done, int total);
}
