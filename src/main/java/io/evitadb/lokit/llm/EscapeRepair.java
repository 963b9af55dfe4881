package io.evitadb.lokit.llm;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Repairs JSON produced by language models that forget to escape backslashes inside strings.
 * Documentation markup such as groff {@code \[dq]} or {@code \fB} is copied verbatim into the
 * array elements, which makes the JSON invalid. Every backslash inside a quoted string that does
 * not start a valid JSON escape is doubled; everything else is left untouched.
 */
public final class EscapeRepair {

	private EscapeRepair() {
	}

	/**
	 * Returns JSON text in which all backslashes inside string literals form valid escapes.
	 *
	 * @param json JSON text, possibly with invalid escapes
	 * @return repaired JSON text, identical to the input when nothing needed repair
	 */
	@Nonnull
	public static String repair(@Nonnull String json) {
		Objects.requireNonNull(json, "json must not be null");

		final StringBuilder fixed = new StringBuilder(json.length() + 16);
		boolean inQuote = false;
		boolean escaped = false;

		for (int i = 0; i < json.length(); i++) {
			final char c = json.charAt(i);

			if (c == '"' && !escaped) {
				inQuote = !inQuote;
				fixed.append(c);
				continue;
			}

			if (inQuote && c == '\\' && !escaped) {
				if (i + 1 < json.length() && isEscapeCharacter(json.charAt(i + 1))) {
					fixed.append(c);
					escaped = true;
				} else {
					fixed.append("\\\\");
				}
				continue;
			}

			fixed.append(c);
			escaped = c == '\\' && !escaped;
		}
		return fixed.toString();
	}

	private static boolean isEscapeCharacter(char next) {
		return switch (next) {
			case '"', '\\', '/', 'b', 'f', 'n', 'r', 't', 'u' -> true;
			default -> false;
		};
	}
}
