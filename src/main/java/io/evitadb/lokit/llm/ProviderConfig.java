package io.evitadb.lokit.llm;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings of the AI provider used for a run. Resolved once per run by
 * {@link Providers#resolve} and never modified afterwards.
 *
 * @param id      provider identifier, selects the request route
 * @param name    display name
 * @param baseUrl base endpoint without trailing slash
 * @param apiKey  static API key, null for OAuth-backed and local providers
 * @param model   model name
 * @param proxy   outbound proxy as {@code http://host:port}, null for none
 * @param timeout per-call timeout
 */
public record ProviderConfig(
	@Nonnull String id,
	@Nonnull String name,
	@Nonnull String baseUrl,
	@Nullable String apiKey,
	@Nonnull String model,
	@Nullable String proxy,
	@Nonnull Duration timeout
) {

	public ProviderConfig {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(baseUrl, "baseUrl must not be null");
		Objects.requireNonNull(model, "model must not be null");
		Objects.requireNonNull(timeout, "timeout must not be null");
		baseUrl = Providers.normalizeUrl(baseUrl);
		apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey;
		proxy = proxy == null || proxy.isBlank() ? null : proxy;
	}

	public boolean hasApiKey() {
		return this.apiKey != null;
	}

	@Nonnull
	public ProviderConfig withModel(@Nonnull String model) {
		return new ProviderConfig(this.id, this.name, this.baseUrl, this.apiKey, model, this.proxy, this.timeout);
	}

	@Nonnull
	public ProviderConfig withBaseUrl(@Nonnull String baseUrl) {
		return new ProviderConfig(this.id, this.name, baseUrl, this.apiKey, this.model, this.proxy, this.timeout);
	}

	@Override
	public String toString() {
		return "ProviderConfig[id=" + this.id + ", baseUrl=" + this.baseUrl + ", model=" + this.model +
			", apiKey=" + (this.apiKey == null ? "(none)" : "****") + ", proxy=" + this.proxy +
			", timeout=" + this.timeout + "]";
	}
}
