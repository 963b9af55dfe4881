package io.evitadb.lokit.llm;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Objects;

/**
 * Native display names of target languages, used for the {@code {{targetLang}}} prompt placeholder
 * when the run does not supply a display name.
 */
public final class LanguageNames {

	private static final Map<String, String> NATIVE_NAMES = Map.ofEntries(
		Map.entry("ar", "العربية"),
		Map.entry("bg", "Български"),
		Map.entry("cs", "Čeština"),
		Map.entry("da", "Dansk"),
		Map.entry("de", "Deutsch"),
		Map.entry("el", "Ελληνικά"),
		Map.entry("en", "English"),
		Map.entry("es", "Español"),
		Map.entry("fi", "Suomi"),
		Map.entry("fr", "Français"),
		Map.entry("he", "עברית"),
		Map.entry("hi", "हिन्दी"),
		Map.entry("hr", "Hrvatski"),
		Map.entry("hu", "Magyar"),
		Map.entry("id", "Bahasa Indonesia"),
		Map.entry("it", "Italiano"),
		Map.entry("ja", "日本語"),
		Map.entry("ko", "한국어"),
		Map.entry("lt", "Lietuvių"),
		Map.entry("lv", "Latviešu"),
		Map.entry("ms", "Bahasa Melayu"),
		Map.entry("nl", "Nederlands"),
		Map.entry("no", "Norsk"),
		Map.entry("nb", "Norsk bokmål"),
		Map.entry("nn", "Norsk nynorsk"),
		Map.entry("pl", "Polski"),
		Map.entry("pt", "Português"),
		Map.entry("pt_BR", "Português (Brasil)"),
		Map.entry("ro", "Română"),
		Map.entry("ru", "Русский"),
		Map.entry("sk", "Slovenčina"),
		Map.entry("sr", "Српски"),
		Map.entry("sv", "Svenska"),
		Map.entry("th", "ไทย"),
		Map.entry("tr", "Türkçe"),
		Map.entry("uk", "Українська"),
		Map.entry("vi", "Tiếng Việt"),
		Map.entry("zh", "中文")
	);

	private LanguageNames() {
	}

	/**
	 * Returns the native name of the language. Region variants ({@code pt-BR}, {@code pt_BR}) use
	 * their own entry when there is one and the base language otherwise. Unknown codes are returned
	 * unchanged.
	 *
	 * @param code language code
	 * @return native language name or the code itself
	 */
	@Nonnull
	public static String nativeName(@Nonnull String code) {
		Objects.requireNonNull(code, "code must not be null");
		final String canonical = code.trim().replace('-', '_');
		final String exact = NATIVE_NAMES.get(canonical);
		if (exact != null) {
			return exact;
		}
		final int separator = canonical.indexOf('_');
		if (separator > 0) {
			final String base = NATIVE_NAMES.get(canonical.substring(0, separator));
			if (base != null) {
				return base;
			}
		}
		return code;
	}
}
