package io.evitadb.lokit.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.evitadb.lokit.llm.exception.ProviderAuthenticationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ProviderDispatcher should pick the route and wire format per provider")
@ExtendWith(MockitoExtension.class)
public class ProviderDispatcherTest {

	private static final ObjectMapper MAPPER = new ObjectMapper();

	@Mock
	private OAuthTokenProvider geminiTokens;

	private ProviderDispatcher dispatcher;

	@BeforeEach
	void setUp() {
		dispatcher = ProviderDispatcher.withDefaults(Map.of(Providers.GEMINI, geminiTokens));
	}

	@Test
	@DisplayName("sends Google requests to the native generation endpoint with the key header")
	void shouldRouteGoogleWithKey() throws Exception {
		final OutboundRequest request = dispatcher
			.resolve(Providers.resolve(Providers.GOOGLE, null, "g-key", "gemini-2.5-flash", null, null))
			.buildRequest("Be precise.", "Translate");

		assertEquals(
			"https://generativelanguage.googleapis.com/v1beta/models/gemini-2.5-flash:generateContent",
			request.url()
		);
		assertEquals("g-key", request.headers().get("x-goog-api-key"));
		final JsonNode body = MAPPER.readTree(request.body());
		assertEquals("Translate", body.at("/contents/0/parts/0/text").asText());
		assertEquals("Be precise.", body.at("/systemInstruction/parts/0/text").asText());
		assertEquals(0.3, body.at("/generationConfig/temperature").asDouble(), 0.0001);
	}

	@Test
	@DisplayName("falls back to the Code Assist envelope for Google without a key")
	void shouldRouteGoogleWithoutKeyThroughOAuth() throws Exception {
		when(geminiTokens.currentToken()).thenReturn(new OAuthToken("oauth", "project-7"));

		final OutboundRequest request = dispatcher
			.resolve(Providers.resolve(Providers.GOOGLE, null, null, "models/gemini-2.5-pro", null, null))
			.buildRequest("", "Translate");

		assertEquals("https://cloudcode-pa.googleapis.com/v1internal:generateContent", request.url());
		assertEquals("Bearer oauth", request.headers().get("Authorization"));
		final JsonNode body = MAPPER.readTree(request.body());
		assertEquals("gemini-2.5-pro", body.get("model").asText());
		assertEquals("project-7", body.get("project").asText());
		assertEquals("Translate", body.at("/request/contents/0/parts/0/text").asText());
		assertTrue(body.at("/request/systemInstruction").isMissingNode(), "empty system prompt is omitted");
	}

	@Test
	@DisplayName("routes OpenCode by model prefix")
	void shouldRouteOpenCodeByModel() throws Exception {
		final OutboundRequest gemini = openCode("gemini-2.5-pro");
		final OutboundRequest claude = openCode("claude-sonnet-4");
		final OutboundRequest gpt = openCode("gpt-5");
		final OutboundRequest other = openCode("qwen3-coder");

		assertEquals("https://opencode.ai/zen/v1/models/gemini-2.5-pro", gemini.url());
		assertEquals("oc-key", gemini.headers().get("x-goog-api-key"));

		assertEquals("https://opencode.ai/zen/v1/messages", claude.url());
		assertEquals("oc-key", claude.headers().get("x-api-key"));
		assertEquals("2023-06-01", claude.headers().get("anthropic-version"));
		final JsonNode claudeBody = MAPPER.readTree(claude.body());
		assertEquals(8192, claudeBody.get("max_tokens").asInt());
		assertEquals("system", claudeBody.get("system").asText());

		assertEquals("https://opencode.ai/zen/v1/responses", gpt.url());
		assertEquals("system\n\nuser", MAPPER.readTree(gpt.body()).get("input").asText());

		assertEquals("https://opencode.ai/zen/v1/chat/completions", other.url());
		assertEquals("Bearer oc-key", other.headers().get("Authorization"));
	}

	@Test
	@DisplayName("appends /v1 to Ollama base URLs")
	void shouldAppendVersionForOllama() {
		final OutboundRequest local = dispatcher
			.resolve(Providers.resolve(Providers.OLLAMA, null, null, "llama3", null, null))
			.buildRequest("s", "u");
		final OutboundRequest explicit = dispatcher
			.resolve(Providers.resolve(Providers.OLLAMA, "http://gpu-box:11434/v1/", null, "llama3", null, null))
			.buildRequest("s", "u");

		assertEquals("http://localhost:11434/v1/chat/completions", local.url());
		assertEquals("http://gpu-box:11434/v1/chat/completions", explicit.url());
		assertFalse(local.headers().containsKey("Authorization"));
	}

	@Test
	@DisplayName("sends Copilot headers with the OAuth token")
	void shouldSendCopilotHeaders() {
		final OAuthTokenProvider copilotTokens = mock(OAuthTokenProvider.class);
		when(copilotTokens.currentToken()).thenReturn(new OAuthToken("gho_token", null));
		final ProviderDispatcher withCopilot = ProviderDispatcher.withDefaults(Map.of(Providers.COPILOT, copilotTokens));

		final OutboundRequest request = withCopilot
			.resolve(Providers.resolve(Providers.COPILOT, null, null, "gpt-4o", null, null))
			.buildRequest("s", "u");

		assertEquals("https://api.githubcopilot.com/chat/completions", request.url());
		assertEquals("Bearer gho_token", request.headers().get("Authorization"));
		assertEquals("lokit/1.0", request.headers().get("User-Agent"));
		assertEquals("conversation-edits", request.headers().get("Openai-Intent"));
		assertEquals("user", request.headers().get("X-Initiator"));
	}

	@Test
	@DisplayName("requires a token provider for OAuth-only providers")
	void shouldRequireTokenProvider() {
		final ProviderDispatcher empty = ProviderDispatcher.withDefaults(Map.of());

		final ProviderAuthenticationException ex = assertThrows(
			ProviderAuthenticationException.class,
			() -> empty.resolve(Providers.resolve(Providers.COPILOT, null, null, "gpt-4o", null, null))
		);
		assertEquals("No OAuth token available for provider copilot", ex.getMessage());
	}

	@Test
	@DisplayName("treats unknown providers as chat completions")
	void shouldUseChatForUnknownProviders() {
		final ProviderRoute route = dispatcher.resolve(
			Providers.resolve("lmstudio", "http://127.0.0.1:1234/v1", null, "phi-4", null, null)
		);

		assertInstanceOf(StaticKeyRoute.class, route);
		assertSame(ChatCompletionsFormat.INSTANCE, ((StaticKeyRoute) route).getFormat());
		assertEquals("http://127.0.0.1:1234/v1/chat/completions", ((StaticKeyRoute) route).getEndpoint());
	}

	@Test
	@DisplayName("lets callers register their own model rules")
	void shouldHonorCustomRules() {
		dispatcher.registerMultiFormat("gateway", List.of(
			new ProviderDispatcher.ModelRule(
				model -> model.startsWith("claude-"),
				config -> new StaticKeyRoute(config, MessagesFormat.INSTANCE)
			)
		));

		final ProviderRoute route = dispatcher.resolve(
			Providers.resolve("gateway", "https://gw.example.com", "k", "claude-opus-4", null, null)
		);

		assertEquals("https://gw.example.com/messages", ((StaticKeyRoute) route).getEndpoint());
	}

	private OutboundRequest openCode(String model) {
		return dispatcher
			.resolve(Providers.resolve(Providers.OPENCODE, null, "oc-key", model, null, null))
			.buildRequest("system", "user");
	}
}
