package io.evitadb.lokit.llm;

import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * Request layout of one family of provider APIs.
 */
public interface WireFormat {

	/**
	 * Sampling temperature used for every translation request.
	 */
	double TEMPERATURE = 0.3;

	/**
	 * Returns the endpoint of the API below the provider's base URL.
	 *
	 * @param baseUrl base URL without trailing slash
	 * @param model   model name
	 * @return full endpoint URL
	 */
	@Nonnull
	String endpoint(@Nonnull String baseUrl, @Nonnull String model);

	/**
	 * Builds the JSON request body.
	 *
	 * @param model        model name
	 * @param systemPrompt system instructions, may be empty
	 * @param userPrompt   entries to translate
	 * @return request body
	 */
	@Nonnull
	ObjectNode body(@Nonnull String model, @Nonnull String systemPrompt, @Nonnull String userPrompt);

	/**
	 * Returns the headers authenticating a static API key, empty when there is no key.
	 *
	 * @param apiKey API key or null
	 * @return authentication headers
	 */
	@Nonnull
	Map<String, String> authHeaders(@Nullable String apiKey);
}
