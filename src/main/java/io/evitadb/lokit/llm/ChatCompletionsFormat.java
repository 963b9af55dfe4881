package io.evitadb.lokit.llm;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * OpenAI-compatible chat completions ({@code POST /chat/completions}) used by Groq, Ollama,
 * Copilot and any unknown provider.
 */
public final class ChatCompletionsFormat implements WireFormat {

	public static final ChatCompletionsFormat INSTANCE = new ChatCompletionsFormat();

	private static final String PATH = "/chat/completions";

	@Nonnull
	@Override
	public String endpoint(@Nonnull String baseUrl, @Nonnull String model) {
		return baseUrl.endsWith(PATH) ? baseUrl : baseUrl + PATH;
	}

	@Nonnull
	@Override
	public ObjectNode body(@Nonnull String model, @Nonnull String systemPrompt, @Nonnull String userPrompt) {
		final ObjectNode body = JsonNodeFactory.instance.objectNode();
		body.put("model", model);
		final ArrayNode messages = body.putArray("messages");
		messages.addObject().put("role", "system").put("content", systemPrompt);
		messages.addObject().put("role", "user").put("content", userPrompt);
		body.put("temperature", TEMPERATURE);
		body.put("stream", false);
		return body;
	}

	@Nonnull
	@Override
	public Map<String, String> authHeaders(@Nullable String apiKey) {
		return apiKey == null ? Map.of() : Map.of("Authorization", "Bearer " + apiKey);
	}
}
