package io.evitadb.lokit.llm;

import io.evitadb.lokit.model.TranslatableUnit;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Builds the user prompt listing the entries of one chunk. Entries are numbered from one, quoted
 * and have newlines and tabs rendered as {@code \n} and {@code \t} so that each entry stays on one
 * line. Source references are appended as a context hint.
 */
public final class PromptBuilder {

	private PromptBuilder() {
	}

	/**
	 * Builds a prompt asking for one string per entry.
	 *
	 * @param units units of the chunk
	 * @return user prompt
	 */
	@Nonnull
	public static String userPrompt(@Nonnull List<TranslatableUnit> units) {
		Objects.requireNonNull(units, "units must not be null");

		final StringBuilder prompt = new StringBuilder("Translate these entries:\n\n");
		for (int i = 0; i < units.size(); i++) {
			final TranslatableUnit unit = units.get(i);
			prompt.append(i + 1).append(". ").append(escape(unit.source())).append('\n');
			appendContext(prompt, unit);
		}
		prompt.append("\nReturn a JSON array with exactly ").append(units.size()).append(" translated strings.");
		return prompt.toString();
	}

	/**
	 * Builds a prompt in which plural entries list both source forms and ask for an array of
	 * {@code nplurals} forms.
	 *
	 * @param units    units of the chunk
	 * @param nplurals plural form count of the target language
	 * @return user prompt
	 */
	@Nonnull
	public static String pluralUserPrompt(@Nonnull List<TranslatableUnit> units, int nplurals) {
		Objects.requireNonNull(units, "units must not be null");

		final StringBuilder prompt = new StringBuilder("Translate these entries:\n\n");
		for (int i = 0; i < units.size(); i++) {
			final TranslatableUnit unit = units.get(i);
			if (unit.isPlural()) {
				prompt.append(i + 1).append(". singular: ").append(escape(unit.source()))
					.append(" | plural: ").append(escape(unit.pluralSource())).append('\n')
					.append("   (return an array of exactly ").append(nplurals)
					.append(" plural forms for the target language)\n");
			} else {
				prompt.append(i + 1).append(". ").append(escape(unit.source())).append('\n');
			}
			appendContext(prompt, unit);
		}
		prompt.append("\nReturn a JSON array with exactly ").append(units.size()).append(" elements. ")
			.append("For singular entries return a string. For plural entries (marked with 'singular: ... | plural: ...') ")
			.append("return an array of strings (one per plural form).");
		return prompt.toString();
	}

	/**
	 * Quotes the text and renders newlines and tabs as escape sequences.
	 *
	 * @param text source text
	 * @return single-line quoted text
	 */
	@Nonnull
	static String escape(@Nonnull String text) {
		return '"' + text.replace("\n", "\\n").replace("\t", "\\t") + '"';
	}

	private static void appendContext(@Nonnull StringBuilder prompt, @Nonnull TranslatableUnit unit) {
		if (!unit.references().isEmpty()) {
			prompt.append("   (context: ").append(String.join(", ", unit.references())).append(")\n");
		}
	}
}
