package io.evitadb.lokit.llm;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A fully built POST request to a provider endpoint.
 *
 * @param url     endpoint URL
 * @param headers request headers in insertion order
 * @param body    JSON body
 */
public record OutboundRequest(
	@Nonnull String url,
	@Nonnull Map<String, String> headers,
	@Nonnull String body
) {

	public OutboundRequest {
		Objects.requireNonNull(url, "url must not be null");
		Objects.requireNonNull(headers, "headers must not be null");
		Objects.requireNonNull(body, "body must not be null");
		headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
	}

	@Override
	public String toString() {
		// headers carry credentials
		return "OutboundRequest[POST " + this.url + ", " + this.body.length() + " chars]";
	}
}
