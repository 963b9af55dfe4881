package io.evitadb.lokit.llm;

import io.evitadb.lokit.llm.exception.DecodeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResponseDecoder should extract the model text from every supported envelope")
public class ResponseDecoderTest {

	@Test
	@DisplayName("reads chat completions")
	void shouldReadChatCompletions() {
		assertEquals("[\"Hallo\"]", ResponseDecoder.extractText(
			"{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"[\\\"Hallo\\\"]\"}}]}"
		));
	}

	@Test
	@DisplayName("reads native generation candidates")
	void shouldReadCandidates() {
		assertEquals("hola", ResponseDecoder.extractText(
			"{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"hola\"}],\"role\":\"model\"}}]}"
		));
	}

	@Test
	@DisplayName("reads the first text block of a messages response")
	void shouldReadMessages() {
		assertEquals("ciao", ResponseDecoder.extractText(
			"{\"content\":[{\"type\":\"thinking\",\"thinking\":\"...\"},{\"type\":\"text\",\"text\":\"ciao\"}]}"
		));
	}

	@Test
	@DisplayName("reads the output text of a responses response")
	void shouldReadResponses() {
		assertEquals("hej", ResponseDecoder.extractText(
			"{\"output\":[{\"type\":\"reasoning\"},{\"type\":\"message\",\"content\":[{\"type\":\"output_text\",\"text\":\"hej\"}]}]}"
		));
	}

	@Test
	@DisplayName("reads a flat response")
	void shouldReadFlatResponse() {
		assertEquals("ahoj", ResponseDecoder.extractText("{\"response\":\"ahoj\"}"));
	}

	@Test
	@DisplayName("reports a provider error message")
	void shouldReportProviderError() {
		final DecodeException ex = assertThrows(
			DecodeException.class,
			() -> ResponseDecoder.extractText("{\"error\":{\"message\":\"model overloaded\",\"code\":503}}")
		);
		assertEquals("API error: model overloaded", ex.getMessage());
	}

	@Test
	@DisplayName("reports invalid JSON")
	void shouldReportInvalidJson() {
		final DecodeException ex = assertThrows(DecodeException.class, () -> ResponseDecoder.extractText("<html>"));
		assertTrue(ex.getMessage().startsWith("invalid JSON response: "));
	}

	@Test
	@DisplayName("reports unknown shapes with a truncated body")
	void shouldReportUnknownShape() {
		final String body = "{\"unexpected\":\"" + "x".repeat(600) + "\"}";
		final DecodeException ex = assertThrows(DecodeException.class, () -> ResponseDecoder.extractText(body));

		assertTrue(ex.getMessage().startsWith("could not extract text from response: "));
		assertTrue(ex.getMessage().endsWith("..."));
	}
}
