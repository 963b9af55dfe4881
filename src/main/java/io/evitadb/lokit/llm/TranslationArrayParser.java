package io.evitadb.lokit.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.evitadb.lokit.llm.exception.DecodeException;
import io.evitadb.lokit.llm.exception.ProviderException;
import io.evitadb.lokit.model.PluralTranslation;
import io.evitadb.lokit.model.TranslatableUnit;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the JSON array of translations out of the model's text. Models wrap the array in
 * markdown fences, prepend chatter or emit unescaped backslashes, so the text is first reduced
 * to the outermost {@code [...]} span and repaired with {@link EscapeRepair}.
 *
 * Results are matched to units by position. Extra elements are ignored, missing elements leave
 * their units without a result.
 */
public final class TranslationArrayParser {

	private static final ObjectMapper MAPPER = new ObjectMapper();
	private static final Pattern CODE_FENCE = Pattern.compile("(?s)```(?:json)?\\s*(.*?)\\s*```");

	private TranslationArrayParser() {
	}

	/**
	 * Parses a flat array of strings.
	 *
	 * @param content  model output text
	 * @param expected number of units of the chunk, used in error messages
	 * @return translations in response order
	 * @throws DecodeException when the text holds no valid, non-empty array
	 */
	@Nonnull
	public static List<String> parseStrings(@Nonnull String content, int expected) {
		final JsonNode array = readArray(content, expected);
		final List<String> translations = new ArrayList<>(array.size());
		for (final JsonNode element : array) {
			translations.add(asSingular(element));
		}
		return Collections.unmodifiableList(translations);
	}

	/**
	 * Parses an array whose elements are strings for non-plural units and arrays of plural forms
	 * for plural units. A string given for a plural unit is repeated for every form, short form
	 * lists are padded with their last form and long ones are truncated to {@code nplurals}.
	 *
	 * @param content  model output text
	 * @param units    units of the chunk in prompt order
	 * @param nplurals plural form count of the target language
	 * @return one result per unit that has a matching element, in unit order
	 * @throws DecodeException when the text holds no valid, non-empty array
	 */
	@Nonnull
	public static List<PluralTranslation> parsePlural(
		@Nonnull String content,
		@Nonnull List<TranslatableUnit> units,
		int nplurals
	) {
		Objects.requireNonNull(units, "units must not be null");
		if (nplurals < 1) {
			throw new IllegalArgumentException("nplurals must be positive");
		}

		final JsonNode array = readArray(content, units.size());
		final int count = Math.min(units.size(), array.size());
		final List<PluralTranslation> result = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			final JsonNode element = array.get(i);
			if (units.get(i).isPlural()) {
				result.add(PluralTranslation.plural(normalizeForms(element, nplurals)));
			} else {
				result.add(PluralTranslation.single(asSingular(element)));
			}
		}
		return Collections.unmodifiableList(result);
	}

	/**
	 * Strips fences and surrounding text, leaving the outermost array span.
	 *
	 * @param content model output text
	 * @return candidate JSON array text
	 */
	@Nonnull
	static String isolateArray(@Nonnull String content) {
		String text = content.trim();
		final Matcher fence = CODE_FENCE.matcher(text);
		if (fence.find()) {
			text = fence.group(1);
		}
		final int start = text.indexOf('[');
		final int end = text.lastIndexOf(']');
		if (start >= 0 && end > start) {
			text = text.substring(start, end + 1);
		}
		return text;
	}

	@Nonnull
	private static JsonNode readArray(@Nonnull String content, int expected) {
		Objects.requireNonNull(content, "content must not be null");
		final String json = EscapeRepair.repair(isolateArray(content));
		final JsonNode array;
		try {
			array = MAPPER.readTree(json);
		} catch (JsonProcessingException e) {
			throw new DecodeException(
				"failed to parse translation response as JSON array: " + e.getOriginalMessage() +
					"\nResponse: " + ProviderException.truncate(json, 300),
				e
			);
		}
		if (array == null || !array.isArray()) {
			throw new DecodeException(
				"failed to parse translation response as JSON array: not an array" +
					"\nResponse: " + ProviderException.truncate(json, 300)
			);
		}
		if (array.isEmpty()) {
			throw new DecodeException("got 0 translations, expected " + expected);
		}
		return array;
	}

	/**
	 * Plain string as is, first element of an array of strings, empty string otherwise.
	 */
	@Nonnull
	private static String asSingular(@Nonnull JsonNode element) {
		if (element.isTextual()) {
			return element.asText();
		}
		if (element.isArray() && !element.isEmpty() && element.get(0).isTextual()) {
			return element.get(0).asText();
		}
		return "";
	}

	@Nonnull
	private static List<String> normalizeForms(@Nonnull JsonNode element, int nplurals) {
		final List<String> forms = new ArrayList<>(nplurals);
		if (element.isTextual()) {
			for (int i = 0; i < nplurals; i++) {
				forms.add(element.asText());
			}
			return forms;
		}
		if (element.isArray()) {
			for (final JsonNode form : element) {
				if (forms.size() == nplurals) {
					break;
				}
				forms.add(form.isTextual() ? form.asText() : "");
			}
		}
		// lossy recovery: short answers repeat the last form instead of asking again
		while (forms.size() < nplurals) {
			forms.add(forms.isEmpty() ? "" : forms.get(forms.size() - 1));
		}
		return forms;
	}
}
