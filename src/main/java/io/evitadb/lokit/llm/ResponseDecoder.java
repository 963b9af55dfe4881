package io.evitadb.lokit.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.evitadb.lokit.llm.exception.DecodeException;
import io.evitadb.lokit.llm.exception.ProviderException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Extracts the text a model produced from a provider response body. The supported envelope
 * shapes are tried in this order:
 *
 * 1. chat completions: {@code choices[0].message.content}
 * 2. native generation: {@code candidates[0].content.parts[0].text}
 * 3. messages: first {@code content[]} block of type {@code text}
 * 4. responses: {@code output[]} item of type {@code message}, its {@code output_text} block
 * 5. flat: top-level {@code response} string
 *
 * A top-level {@code error} field is reported as a failure with the provider's message.
 */
public final class ResponseDecoder {

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private ResponseDecoder() {
	}

	/**
	 * Returns the model's text from the response body.
	 *
	 * @param body raw response body
	 * @return model output text
	 * @throws DecodeException when the body is not JSON, reports an error or has an unknown shape
	 */
	@Nonnull
	public static String extractText(@Nonnull String body) {
		Objects.requireNonNull(body, "body must not be null");
		final JsonNode root;
		try {
			root = MAPPER.readTree(body);
		} catch (JsonProcessingException e) {
			throw new DecodeException("invalid JSON response: " + e.getOriginalMessage(), e);
		}
		if (root == null || !root.isObject()) {
			throw new DecodeException("could not extract text from response: " + ProviderException.truncate(body, 500));
		}
		return extractText(root, body);
	}

	/**
	 * Variant of {@link #extractText(String)} for an already parsed body.
	 *
	 * @param root    parsed response object
	 * @param rawBody raw body used in error messages
	 * @return model output text
	 */
	@Nonnull
	static String extractText(@Nonnull JsonNode root, @Nonnull String rawBody) {
		final JsonNode error = root.get("error");
		if (error != null && !error.isNull()) {
			final JsonNode message = error.get("message");
			if (message != null && message.isTextual()) {
				throw new DecodeException("API error: " + message.asText());
			}
			throw new DecodeException("API error: " + error);
		}

		String text = chatCompletion(root);
		if (text == null) {
			text = nativeGeneration(root);
		}
		if (text == null) {
			text = messages(root);
		}
		if (text == null) {
			text = responses(root);
		}
		if (text == null) {
			final JsonNode flat = root.get("response");
			if (flat != null && flat.isTextual()) {
				text = flat.asText();
			}
		}
		if (text == null) {
			throw new DecodeException("could not extract text from response: " + ProviderException.truncate(rawBody, 500));
		}
		return text;
	}

	@Nullable
	private static String chatCompletion(@Nonnull JsonNode root) {
		final JsonNode content = root.path("choices").path(0).path("message").path("content");
		return content.isTextual() ? content.asText() : null;
	}

	@Nullable
	private static String nativeGeneration(@Nonnull JsonNode root) {
		final JsonNode text = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
		return text.isTextual() ? text.asText() : null;
	}

	@Nullable
	private static String messages(@Nonnull JsonNode root) {
		final JsonNode content = root.get("content");
		if (content == null || !content.isArray()) {
			return null;
		}
		for (final JsonNode block : content) {
			if ("text".equals(block.path("type").asText()) && block.path("text").isTextual()) {
				return block.get("text").asText();
			}
		}
		return null;
	}

	@Nullable
	private static String responses(@Nonnull JsonNode root) {
		final JsonNode output = root.get("output");
		if (output == null || !output.isArray()) {
			return null;
		}
		for (final JsonNode item : output) {
			if (!"message".equals(item.path("type").asText())) {
				continue;
			}
			for (final JsonNode block : item.path("content")) {
				if ("output_text".equals(block.path("type").asText()) && block.path("text").isTextual()) {
					return block.get("text").asText();
				}
			}
		}
		return null;
	}
}
