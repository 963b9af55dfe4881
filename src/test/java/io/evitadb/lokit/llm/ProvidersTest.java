package io.evitadb.lokit.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Providers should resolve configuration from defaults and overrides")
public class ProvidersTest {

	@Test
	@DisplayName("applies provider defaults")
	void shouldApplyDefaults() {
		final ProviderConfig groq = Providers.resolve("Groq", null, "k", "llama-3.3-70b", null, null);

		assertEquals(Providers.GROQ, groq.id());
		assertEquals("Groq", groq.name());
		assertEquals("https://api.groq.com/openai/v1", groq.baseUrl());
		assertEquals(Duration.ofSeconds(60), groq.timeout());
	}

	@Test
	@DisplayName("prefers explicit overrides")
	void shouldPreferOverrides() {
		final ProviderConfig config = Providers.resolve(
			Providers.OLLAMA, "http://gpu:11434///", "  ", "llama3", "http://proxy:3128", Duration.ofSeconds(5)
		);

		assertEquals("http://gpu:11434", config.baseUrl());
		assertNull(config.apiKey());
		assertFalse(config.hasApiKey());
		assertEquals("http://proxy:3128", config.proxy());
		assertEquals(Duration.ofSeconds(5), config.timeout());
	}

	@Test
	@DisplayName("requires a base URL for custom endpoints")
	void shouldRequireBaseUrlForCustomProviders() {
		assertThrows(IllegalArgumentException.class, () -> Providers.resolve(Providers.CUSTOM_OPENAI, null, "k", "m", null, null));
		assertThrows(IllegalArgumentException.class, () -> Providers.resolve("unknown", "", "k", "m", null, null));
		assertEquals(Providers.DEFAULT_TIMEOUT, Providers.resolve("unknown", "http://x", null, "m", null, null).timeout());
	}

	@Test
	@DisplayName("never prints the key")
	void shouldMaskKeyInToString() {
		final ProviderConfig config = Providers.resolve(Providers.GROQ, null, "gsk_secret", "m", null, null);

		assertFalse(config.toString().contains("gsk_secret"));
	}

	@Test
	@DisplayName("knows the built-in providers")
	void shouldKnowBuiltInProviders() {
		assertTrue(Providers.isKnown("copilot"));
		assertTrue(Providers.isKnown("custom-openai"));
		assertFalse(Providers.isKnown("lmstudio"));
	}
}
