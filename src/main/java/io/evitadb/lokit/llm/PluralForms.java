package io.evitadb.lokit.llm;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plural rules of target languages in gettext {@code Plural-Forms} syntax.
 */
public final class PluralForms {

	/**
	 * Plural form count used when neither the document nor the table knows better.
	 */
	public static final int DEFAULT_NPLURALS = 2;

	private static final Pattern NPLURALS = Pattern.compile("nplurals\\s*=\\s*(\\d+)");

	private static final String ONE_FORM = "nplurals=1; plural=0;";
	private static final String TWO_FORMS_ZERO_SINGULAR = "nplurals=2; plural=(n > 1);";
	private static final String TWO_FORMS = "nplurals=2; plural=(n != 1);";
	private static final String EAST_SLAVIC = "nplurals=3; plural=(n%10==1 && n%100!=11 ? 0 : n%10>=2 && n%10<=4 && (n%100<10 || n%100>=20) ? 1 : 2);";
	private static final String POLISH = "nplurals=3; plural=(n==1 ? 0 : n%10>=2 && n%10<=4 && (n%100<10 || n%100>=20) ? 1 : 2);";
	private static final String CZECH_SLOVAK = "nplurals=3; plural=(n==1 ? 0 : n>=2 && n<=4 ? 1 : 2);";
	private static final String ROMANIAN = "nplurals=3; plural=(n==1 ? 0 : (n==0 || (n%100 > 0 && n%100 < 20)) ? 1 : 2);";
	private static final String LITHUANIAN = "nplurals=3; plural=(n%10==1 && n%100!=11 ? 0 : n%10>=2 && (n%100<10 || n%100>=20) ? 1 : 2);";
	private static final String LATVIAN = "nplurals=3; plural=(n%10==1 && n%100!=11 ? 0 : n != 0 ? 1 : 2);";
	private static final String ARABIC = "nplurals=6; plural=(n==0 ? 0 : n==1 ? 1 : n==2 ? 2 : n%100>=3 && n%100<=10 ? 3 : n%100>=11 ? 4 : 5);";

	private PluralForms() {
	}

	/**
	 * Returns the plural rule of the language. Region suffixes are ignored.
	 *
	 * @param language language code such as {@code ru} or {@code pt_BR}
	 * @return gettext plural rule, two forms for unknown languages
	 */
	@Nonnull
	public static String forLanguage(@Nonnull String language) {
		Objects.requireNonNull(language, "language must not be null");
		final int separator = indexOfSeparator(language);
		final String base = separator > 0 ? language.substring(0, separator) : language;

		return switch (base) {
			case "ja", "ko", "zh", "vi", "th", "id", "ms" -> ONE_FORM;
			case "fr", "pt" -> TWO_FORMS_ZERO_SINGULAR;
			case "ru", "uk", "be", "hr", "sr", "bs" -> EAST_SLAVIC;
			case "pl" -> POLISH;
			case "cs", "sk" -> CZECH_SLOVAK;
			case "ro" -> ROMANIAN;
			case "lt" -> LITHUANIAN;
			case "lv" -> LATVIAN;
			case "ar" -> ARABIC;
			default -> TWO_FORMS;
		};
	}

	/**
	 * Returns the plural form count, preferring the document's own header over the language table.
	 *
	 * @param header   plural rule header of the document, may be null or blank
	 * @param language target language code
	 * @return number of plural forms, at least one
	 */
	public static int nplurals(@Nullable String header, @Nonnull String language) {
		final String rule = header == null || header.isBlank() ? forLanguage(language) : header;
		final Matcher matcher = NPLURALS.matcher(rule);
		if (matcher.find()) {
			try {
				final int count = Integer.parseInt(matcher.group(1));
				if (count > 0) {
					return count;
				}
			} catch (NumberFormatException e) {
				return DEFAULT_NPLURALS;
			}
		}
		return DEFAULT_NPLURALS;
	}

	private static int indexOfSeparator(@Nonnull String language) {
		for (int i = 0; i < language.length(); i++) {
			final char c = language.charAt(i);
			if (c == '_' || c == '-') {
				return i;
			}
		}
		return -1;
	}
}
