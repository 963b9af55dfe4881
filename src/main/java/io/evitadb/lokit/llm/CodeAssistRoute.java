package io.evitadb.lokit.llm;

import io.evitadb.lokit.llm.exception.ProviderAuthenticationException;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Gemini through the Code Assist API with an OAuth token. The native generation body travels
 * inside {@link CodeAssistEnvelope}. A 401 triggers a token refresh, or a full re-authentication
 * when the refresh fails.
 */
public final class CodeAssistRoute implements ProviderRoute {

	private final ProviderConfig config;
	private final String endpoint;
	private final OAuthTokenProvider tokenProvider;
	private final AtomicReference<OAuthToken> token = new AtomicReference<>();

	public CodeAssistRoute(@Nonnull ProviderConfig config, @Nonnull OAuthTokenProvider tokenProvider) {
		this(config, CodeAssistEnvelope.CODE_ASSIST_BASE, tokenProvider);
	}

	/**
	 * @param endpointBase base URL of the Code Assist API, differs from the provider base URL when
	 *                     the plain Google provider falls back to OAuth
	 */
	public CodeAssistRoute(@Nonnull ProviderConfig config, @Nonnull String endpointBase, @Nonnull OAuthTokenProvider tokenProvider) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.endpoint = CodeAssistEnvelope.endpoint(Providers.normalizeUrl(endpointBase));
		this.tokenProvider = Objects.requireNonNull(tokenProvider, "tokenProvider must not be null");
	}

	@Nonnull
	@Override
	public String describe() {
		return this.config.name() + " (Code Assist)";
	}

	@Nonnull
	@Override
	public OutboundRequest buildRequest(@Nonnull String systemPrompt, @Nonnull String userPrompt) {
		final OAuthToken current = currentToken();
		final Map<String, String> headers = new LinkedHashMap<>();
		headers.put("Content-Type", "application/json");
		headers.put("Authorization", "Bearer " + current.accessToken());
		headers.put("User-Agent", CopilotRoute.USER_AGENT);
		return new OutboundRequest(
			this.endpoint,
			headers,
			CodeAssistEnvelope.wrap(
				this.config.model(),
				current.projectId(),
				GenerateContentFormat.INSTANCE.body(this.config.model(), systemPrompt, userPrompt)
			).toString()
		);
	}

	@Nonnull
	@Override
	public String decode(@Nonnull String body) {
		return CodeAssistEnvelope.unwrap(body);
	}

	@Override
	public boolean supportsReauthentication() {
		return true;
	}

	@Override
	public void reauthenticate() {
		OAuthToken renewed;
		try {
			renewed = this.tokenProvider.refresh();
		} catch (ProviderAuthenticationException refreshFailure) {
			try {
				renewed = this.tokenProvider.reauthenticate();
			} catch (ProviderAuthenticationException reauthFailure) {
				reauthFailure.addSuppressed(refreshFailure);
				throw reauthFailure;
			}
		}
		this.token.set(renewed);
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
