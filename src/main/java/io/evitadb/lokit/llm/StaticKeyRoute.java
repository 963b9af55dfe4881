package io.evitadb.lokit.llm;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Route for providers authenticated by a static API key (or by nothing, like a local Ollama).
 */
public final class StaticKeyRoute implements ProviderRoute {

	private final ProviderConfig config;
	private final WireFormat format;
	private final String endpoint;

	public StaticKeyRoute(@Nonnull ProviderConfig config, @Nonnull WireFormat format) {
		this(config, format, format.endpoint(config.baseUrl(), config.model()));
	}

	/**
	 * Creates a route with an explicit endpoint, used where a proxy exposes a format under its own path.
	 */
	public StaticKeyRoute(@Nonnull ProviderConfig config, @Nonnull WireFormat format, @Nonnull String endpoint) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.format = Objects.requireNonNull(format, "format must not be null");
		this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
	}

	@Nonnull
	@Override
	public String describe() {
		return this.config.name() + " (" + this.format.getClass().getSimpleName() + ")";
	}

	@Nonnull
	@Override
	public OutboundRequest buildRequest(@Nonnull String systemPrompt, @Nonnull String userPrompt) {
		final Map<String, String> headers = new LinkedHashMap<>();
		headers.put("Content-Type", "application/json");
		headers.putAll(this.format.authHeaders(this.config.apiKey()));
		return new OutboundRequest(
			this.endpoint,
			headers,
			this.format.body(this.config.model(), systemPrompt, userPrompt).toString()
		);
	}

	@Nonnull
	public WireFormat getFormat() {
		return this.format;
	}

	@Nonnull
	public String getEndpoint() {
		return this.endpoint;
	}
}
