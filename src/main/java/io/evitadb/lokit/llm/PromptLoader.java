package io.evitadb.lokit.llm;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads system prompt templates from classpath resources under `META-INF/prompts/` and resolves
 * their placeholders. There is one template per prompt type (`default.txt`, `docs.txt`, ...).
 * Templates are cached, placeholders in the format `{{name}}` are replaced with provided values.
 */
public final class PromptLoader {

	/**
	 * Prompt type used when none or an unknown one is requested.
	 */
	public static final String DEFAULT_PROMPT_TYPE = "default";
	/**
	 * Placeholder replaced with the target language name.
	 */
	public static final String TARGET_LANG = "targetLang";

	private static final String PROMPTS_PATH = "META-INF/prompts/";
	private static final String TEMPLATE_SUFFIX = ".txt";
	private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{(\\w+)}}");

	private final Map<String, String> templateCache = new ConcurrentHashMap<>();

	/**
	 * Loads a prompt template from the classpath.
	 *
	 * @param templateName the template file name (e.g., "default.txt")
	 * @return the template content
	 * @throws IllegalArgumentException if template is not found
	 */
	@Nonnull
	public String loadTemplate(@Nonnull String templateName) {
		Objects.requireNonNull(templateName, "templateName must not be null");

		return this.templateCache.computeIfAbsent(templateName, this::loadTemplateFromClasspath);
	}

	/**
	 * Returns the system prompt for the language. An explicit custom prompt wins over the prompt type;
	 * an unknown prompt type falls back to {@link #DEFAULT_PROMPT_TYPE}.
	 *
	 * @param customPrompt custom prompt template, null or blank to use the prompt type
	 * @param promptType   prompt type such as `docs` or `android`, null for the default
	 * @param languageName display name substituted for `{{targetLang}}`
	 * @return system prompt ready to be sent
	 */
	@Nonnull
	public String systemPrompt(@Nullable String customPrompt, @Nullable String promptType, @Nonnull String languageName) {
		Objects.requireNonNull(languageName, "languageName must not be null");

		final String template = customPrompt != null && !customPrompt.isBlank()
			? customPrompt
			: loadPromptType(promptType);
		return interpolate(template, Map.of(TARGET_LANG, languageName));
	}

	/**
	 * Returns true if a template for the prompt type is on the classpath.
	 *
	 * @param promptType prompt type
	 * @return true for known prompt types
	 */
	public boolean isKnownPromptType(@Nonnull String promptType) {
		final String templateName = normalizeType(promptType) + TEMPLATE_SUFFIX;
		return this.templateCache.containsKey(templateName) ||
			getClass().getClassLoader().getResource(PROMPTS_PATH + templateName) != null;
	}

	@Nonnull
	private String loadPromptType(@Nullable String promptType) {
		final String type = promptType == null || promptType.isBlank() ? DEFAULT_PROMPT_TYPE : normalizeType(promptType);
		return isKnownPromptType(type)
			? loadTemplate(type + TEMPLATE_SUFFIX)
			: loadTemplate(DEFAULT_PROMPT_TYPE + TEMPLATE_SUFFIX);
	}

	@Nonnull
	private static String normalizeType(@Nonnull String promptType) {
		return promptType.trim().toLowerCase(Locale.ROOT);
	}

	/**
	 * Replaces placeholders in a template string with provided values.
	 * Placeholders use the format `{{name}}`.
	 * If a placeholder has no corresponding value, it is left unchanged.
	 * Empty or null values result in an empty string replacement.
	 *
	 * @param template the template string with placeholders
	 * @param values   map of placeholder names to their values
	 * @return the interpolated string
	 */
	@Nonnull
	public String interpolate(@Nonnull String template, @Nonnull Map<String, String> values) {
		Objects.requireNonNull(template, "template must not be null");
		Objects.requireNonNull(values, "values must not be null");

		final Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
		final StringBuilder result = new StringBuilder();

		while (matcher.find()) {
			final String placeholder = matcher.group(1);
			final String value = values.get(placeholder);
			// If value is null or not in map, leave placeholder as-is
			// If value is empty string, replace with empty string
			if (value != null) {
				matcher.appendReplacement(result, Matcher.quoteReplacement(value));
			}
		}
		matcher.appendTail(result);

		return result.toString();
	}

	/**
	 * Loads a template from the classpath.
	 *
	 * @param templateName the template file name
	 * @return the template content
	 * @throws IllegalArgumentException if template is not found
	 */
	@Nonnull
	private String loadTemplateFromClasspath(@Nonnull String templateName) {
		final String resourcePath = PROMPTS_PATH + templateName;
		final InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourcePath);

		if (inputStream == null) {
			throw new IllegalArgumentException("Prompt template not found: " + resourcePath);
		}

		try (final BufferedReader reader = new BufferedReader(
			new InputStreamReader(inputStream, StandardCharsets.UTF_8)
		)) {
			final StringBuilder content = new StringBuilder();
			String line;
			boolean first = true;
			while ((line = reader.readLine()) != null) {
				if (!first) {
					content.append("\n");
				}
				content.append(line);
				first = false;
			}
			return content.toString();
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read prompt template: " + resourcePath, e);
		}
	}

	/**
	 * Clears the template cache. Useful for testing.
	 */
	public void clearCache() {
		this.templateCache.clear();
	}
}
