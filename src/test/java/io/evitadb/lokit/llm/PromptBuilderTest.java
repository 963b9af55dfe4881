package io.evitadb.lokit.llm;

import io.evitadb.lokit.model.TranslatableUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PromptBuilder should list chunk entries for the model")
public class PromptBuilderTest {

	@Test
	@DisplayName("numbers and quotes entries and asks for a sized array")
	void shouldBuildUserPrompt() {
		final String prompt = PromptBuilder.userPrompt(List.of(
			TranslatableUnit.of("a", "Save"),
			new TranslatableUnit("b", "Line one\nLine\ttwo", null, List.of("src/main.c:12", "src/ui.c:40"), false)
		));

		assertEquals(
			"Translate these entries:\n\n" +
				"1. \"Save\"\n" +
				"2. \"Line one\\nLine\\ttwo\"\n" +
				"   (context: src/main.c:12, src/ui.c:40)\n" +
				"\nReturn a JSON array with exactly 2 translated strings.",
			prompt
		);
	}

	@Test
	@DisplayName("describes plural entries with both source forms")
	void shouldBuildPluralPrompt() {
		final String prompt = PromptBuilder.pluralUserPrompt(List.of(
			TranslatableUnit.of("a", "Files"),
			TranslatableUnit.plural("b", "%d file", "%d files")
		), 3);

		assertTrue(prompt.contains("1. \"Files\"\n"));
		assertTrue(prompt.contains("2. singular: \"%d file\" | plural: \"%d files\"\n"));
		assertTrue(prompt.contains("(return an array of exactly 3 plural forms for the target language)"));
		assertTrue(prompt.contains("Return a JSON array with exactly 2 elements."));
	}
}
