package io.evitadb.lokit.llm;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * Google native generation API ({@code POST /v1beta/models/{model}:generateContent}). The same body
 * is wrapped by {@link CodeAssistEnvelope} for the OAuth route.
 */
public final class GenerateContentFormat implements WireFormat {

	public static final GenerateContentFormat INSTANCE = new GenerateContentFormat();

	@Nonnull
	@Override
	public String endpoint(@Nonnull String baseUrl, @Nonnull String model) {
		return baseUrl + "/v1beta/models/" + model + ":generateContent";
	}

	@Nonnull
	@Override
	public ObjectNode body(@Nonnull String model, @Nonnull String systemPrompt, @Nonnull String userPrompt) {
		final ObjectNode body = JsonNodeFactory.instance.objectNode();
		final ObjectNode content = body.putArray("contents").addObject();
		content.put("role", "user");
		content.putArray("parts").addObject().put("text", userPrompt);
		body.putObject("generationConfig").put("temperature", TEMPERATURE);
		if (!systemPrompt.isEmpty()) {
			body.putObject("systemInstruction").putArray("parts").addObject().put("text", systemPrompt);
		}
		return body;
	}

	@Nonnull
	@Override
	public Map<String, String> authHeaders(@Nullable String apiKey) {
		return apiKey == null ? Map.of() : Map.of("x-goog-api-key", apiKey);
	}
}
