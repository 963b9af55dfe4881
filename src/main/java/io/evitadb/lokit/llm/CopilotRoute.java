package io.evitadb.lokit.llm;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * GitHub Copilot: chat completions authenticated by a device-flow OAuth token that is injected
 * into every request. A 401 triggers one full re-authentication.
 */
public final class CopilotRoute implements ProviderRoute {

	static final String USER_AGENT = "lokit/1.0";

	static final String FORBIDDEN_MESSAGE = """
		Copilot API returned 403 Forbidden: access denied

		Common causes:
		  1. Geographic restrictions, GitHub Copilot may be blocked in your region
		  2. No active Copilot subscription
		  3. Invalid or expired authentication token

		Solutions:
		  - Obtain a new Copilot token and run again
		  - Configure a proxy if geographic restrictions apply
		  - Switch to another provider such as gemini, google or ollama""";

	private final ProviderConfig config;
	private final OAuthTokenProvider tokenProvider;
	private final AtomicReference<OAuthToken> token = new AtomicReference<>();

	public CopilotRoute(@Nonnull ProviderConfig config, @Nonnull OAuthTokenProvider tokenProvider) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.tokenProvider = Objects.requireNonNull(tokenProvider, "tokenProvider must not be null");
	}

	@Nonnull
	@Override
	public String describe() {
		return this.config.name();
	}

	@Nonnull
	@Override
	public OutboundRequest buildRequest(@Nonnull String systemPrompt, @Nonnull String userPrompt) {
		final Map<String, String> headers = new LinkedHashMap<>();
		headers.put("Content-Type", "application/json");
		headers.put("Authorization", "Bearer " + currentToken().accessToken());
		headers.put("User-Agent", USER_AGENT);
		headers.put("Openai-Intent", "conversation-edits");
		headers.put("X-Initiator", "user");
		return new OutboundRequest(
			ChatCompletionsFormat.INSTANCE.endpoint(this.config.baseUrl(), this.config.model()),
			headers,
			ChatCompletionsFormat.INSTANCE.body(this.config.model(), systemPrompt, userPrompt).toString()
		);
	}

	@Override
	public boolean supportsReauthentication() {
		return true;
	}

	@Override
	public void reauthenticate() {
		this.token.set(this.tokenProvider.reauthenticate());
	}

	@Nullable
	@Override
	public String rejectionMessage(int statusCode) {
		return statusCode == 403 ? FORBIDDEN_MESSAGE : null;
	}

	@Nonnull
	private OAuthToken currentToken() {
		final OAuthToken current = this.token.get();
		if (current != null) {
			return current;
		}
		final OAuthToken fetched = this.tokenProvider.currentToken();
		return this.token.compareAndSet(null, fetched) ? fetched : this.token.get();
	}
}
