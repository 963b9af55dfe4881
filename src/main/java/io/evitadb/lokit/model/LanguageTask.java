package io.evitadb.lokit.model;

import io.evitadb.lokit.document.TranslationDocument;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One target language of a run: the document to fill in and where to persist it.
 *
 * @param language    target language code
 * @param displayName language name used in the prompt, null for the native name of the code
 * @param document    document receiving the translations
 * @param outputPath  file the document is persisted to
 */
public record LanguageTask(
	@Nonnull String language,
	@Nullable String displayName,
	@Nonnull TranslationDocument document,
	@Nonnull Path outputPath
) {

	public LanguageTask {
		Objects.requireNonNull(language, "language must not be null");
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(outputPath, "outputPath must not be null");
		if (language.isBlank()) {
			throw new IllegalArgumentException("language must not be blank");
		}
	}

	@Nonnull
	public static LanguageTask of(@Nonnull String language, @Nonnull TranslationDocument document, @Nonnull Path outputPath) {
		return new LanguageTask(language, null, document, outputPath);
	}
}
