package io.evitadb.lokit.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PromptLoader should load and interpolate prompt templates")
public class PromptLoaderTest {

	private PromptLoader loader;

	@BeforeEach
	void setUp() {
		loader = new PromptLoader();
		loader.clearCache();
	}

	@Test
	@DisplayName("shouldLoadTemplateFromClasspath")
	void shouldLoadTemplateFromClasspath() {
		final String template = loader.loadTemplate("default.txt");
		assertTrue(template.contains("{{targetLang}}"));
	}

	@Test
	@DisplayName("shouldResolveTargetLanguageInPromptType")
	void shouldResolveTargetLanguageInPromptType() {
		final String prompt = loader.systemPrompt(null, "docs", "Deutsch");

		assertTrue(prompt.contains("groff"));
		assertTrue(prompt.contains("into Deutsch"));
		assertFalse(prompt.contains("{{targetLang}}"));
	}

	@Test
	@DisplayName("shouldPreferCustomPrompt")
	void shouldPreferCustomPrompt() {
		assertEquals(
			"Translate into Français, keep {{count}} intact.",
			loader.systemPrompt("Translate into {{targetLang}}, keep {{count}} intact.", "android", "Français")
		);
	}

	@Test
	@DisplayName("shouldFallBackToDefaultForUnknownOrMissingType")
	void shouldFallBackToDefaultForUnknownOrMissingType() {
		final String expected = loader.systemPrompt(null, "default", "Polski");

		assertEquals(expected, loader.systemPrompt(null, "yaml", "Polski"));
		assertEquals(expected, loader.systemPrompt(null, null, "Polski"));
		assertEquals(expected, loader.systemPrompt("  ", " ", "Polski"));
	}

	@Test
	@DisplayName("shouldKnowBuiltInPromptTypes")
	void shouldKnowBuiltInPromptTypes() {
		for (final String type : new String[]{"default", "docs", "i18next", "android", "properties", "DOCS"}) {
			assertTrue(loader.isKnownPromptType(type), type);
		}
		assertFalse(loader.isKnownPromptType("yaml"));
	}

	@Test
	@DisplayName("shouldMentionMessageFormatInPropertiesPrompt")
	void shouldMentionMessageFormatInPropertiesPrompt() {
		assertTrue(loader.systemPrompt(null, "properties", "Čeština").contains("MessageFormat"));
	}

	@Test
	@DisplayName("shouldCacheLoadedTemplates")
	void shouldCacheLoadedTemplates() {
		final String first = loader.loadTemplate("android.txt");
		final String second = loader.loadTemplate("android.txt");
		assertSame(first, second, "Cached template should return same instance");
	}

	@Test
	@DisplayName("shouldThrowWhenTemplateNotFound")
	void shouldThrowWhenTemplateNotFound() {
		final Exception exception = assertThrows(IllegalArgumentException.class, () ->
			loader.loadTemplate("non-existent-template.txt")
		);
		assertTrue(exception.getMessage().contains("Prompt template not found"));
	}

	@Test
	@DisplayName("shouldPreservePlaceholderWhenNoValue")
	void shouldPreservePlaceholderWhenNoValue() {
		final String result = loader.interpolate("Hello {{name}}, welcome to {{place}}!", Map.of("name", "User"));
		assertEquals("Hello User, welcome to {{place}}!", result);
	}

	@Test
	@DisplayName("shouldHandleSpecialCharactersInValue")
	void shouldHandleSpecialCharactersInValue() {
		final String result = loader.interpolate("Code: {{code}}", Map.of("code", "x = $100; y = \\n"));
		assertEquals("Code: x = $100; y = \\n", result);
	}
}
