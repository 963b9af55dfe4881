package io.evitadb.lokit.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.evitadb.lokit.llm.exception.DecodeException;
import io.evitadb.lokit.llm.exception.ProviderException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Outer layer of the Gemini Code Assist API. Requests carry the native generation body inside
 * {@code {model, project, request}}, responses carry the native response inside {@code {response}}.
 */
public final class CodeAssistEnvelope {

	public static final String CODE_ASSIST_BASE = "https://cloudcode-pa.googleapis.com";
	public static final String CODE_ASSIST_VERSION = "v1internal";

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private CodeAssistEnvelope() {
	}

	/**
	 * Returns the generate endpoint below the given base URL.
	 *
	 * @param baseUrl base URL without trailing slash
	 * @return endpoint URL
	 */
	@Nonnull
	public static String endpoint(@Nonnull String baseUrl) {
		return baseUrl + "/" + CODE_ASSIST_VERSION + ":generateContent";
	}

	/**
	 * Wraps a native generation request. The API expects a bare model name, so a
	 * {@code models/} prefix is removed.
	 *
	 * @param model     model name
	 * @param projectId project bound to the OAuth token
	 * @param request   native generation request body
	 * @return envelope body
	 */
	@Nonnull
	public static ObjectNode wrap(@Nonnull String model, @Nullable String projectId, @Nonnull ObjectNode request) {
		final ObjectNode envelope = JsonNodeFactory.instance.objectNode();
		envelope.put("model", model.startsWith("models/") ? model.substring("models/".length()) : model);
		if (projectId == null) {
			envelope.putNull("project");
		} else {
			envelope.put("project", projectId);
		}
		envelope.set("request", request);
		return envelope;
	}

	/**
	 * Extracts the model's text from an envelope response. Bodies without the envelope are
	 * decoded directly.
	 *
	 * @param body response body
	 * @return model output text
	 * @throws DecodeException when no text can be extracted
	 */
	@Nonnull
	public static String unwrap(@Nonnull String body) {
		final JsonNode root;
		try {
			root = MAPPER.readTree(body);
		} catch (JsonProcessingException e) {
			throw new DecodeException(
				"parsing Code Assist response: " + e.getOriginalMessage() + " (raw: " + ProviderException.truncate(body, 300) + ")",
				e
			);
		}
		if (root == null || !root.isObject()) {
			return ResponseDecoder.extractText(body);
		}
		final JsonNode response = root.get("response");
		if (response != null && response.isObject()) {
			return ResponseDecoder.extractText(response, body);
		}
		return ResponseDecoder.extractText(root, body);
	}
}
