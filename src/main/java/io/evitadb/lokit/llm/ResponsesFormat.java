package io.evitadb.lokit.llm;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * OpenAI responses API ({@code POST /responses}). It takes a single input string, so the system
 * and user prompts are joined by a blank line.
 */
public final class ResponsesFormat implements WireFormat {

	public static final ResponsesFormat INSTANCE = new ResponsesFormat();

	@Nonnull
	@Override
	public String endpoint(@Nonnull String baseUrl, @Nonnull String model) {
		return baseUrl + "/responses";
	}

	@Nonnull
	@Override
	public ObjectNode body(@Nonnull String model, @Nonnull String systemPrompt, @Nonnull String userPrompt) {
		final ObjectNode body = JsonNodeFactory.instance.objectNode();
		body.put("model", model);
		body.put("input", systemPrompt + "\n\n" + userPrompt);
		return body;
	}

	@Nonnull
	@Override
	public Map<String, String> authHeaders(@Nullable String apiKey) {
		return apiKey == null ? Map.of() : Map.of("Authorization", "Bearer " + apiKey);
	}
}
