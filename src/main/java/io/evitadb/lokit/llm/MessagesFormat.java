package io.evitadb.lokit.llm;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Anthropic-style messages API ({@code POST /messages}).
 */
public final class MessagesFormat implements WireFormat {

	public static final MessagesFormat INSTANCE = new MessagesFormat();

	static final int MAX_TOKENS = 8192;
	static final String API_VERSION = "2023-06-01";

	@Nonnull
	@Override
	public String endpoint(@Nonnull String baseUrl, @Nonnull String model) {
		return baseUrl + "/messages";
	}

	@Nonnull
	@Override
	public ObjectNode body(@Nonnull String model, @Nonnull String systemPrompt, @Nonnull String userPrompt) {
		final ObjectNode body = JsonNodeFactory.instance.objectNode();
		body.put("model", model);
		body.put("max_tokens", MAX_TOKENS);
		if (!systemPrompt.isEmpty()) {
			body.put("system", systemPrompt);
		}
		body.putArray("messages").addObject().put("role", "user").put("content", userPrompt);
		return body;
	}

	@Nonnull
	@Override
	public Map<String, String> authHeaders(@Nullable String apiKey) {
		final Map<String, String> headers = new LinkedHashMap<>();
		if (apiKey != null) {
			headers.put("x-api-key", apiKey);
		}
		headers.put("anthropic-version", API_VERSION);
		return headers;
	}
}
