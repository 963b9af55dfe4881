package io.evitadb.lokit.llm;

import dev.langchain4j.exception.HttpException;
import dev.langchain4j.http.client.HttpClient;
import dev.langchain4j.http.client.HttpMethod;
import dev.langchain4j.http.client.HttpRequest;
import dev.langchain4j.http.client.SuccessfulHttpResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("LangChainHttpTransport should adapt the HTTP client to plain responses")
@ExtendWith(MockitoExtension.class)
public class LangChainHttpTransportTest {

	@Mock
	private HttpClient client;

	@Test
	@DisplayName("posts the body with all headers")
	void shouldPostRequest() throws IOException {
		when(client.execute(any(HttpRequest.class))).thenReturn(
			SuccessfulHttpResponse.builder().statusCode(200).body("{\"response\":\"ok\"}").build()
		);
		final LangChainHttpTransport transport = new LangChainHttpTransport(client);

		final TransportResponse response = transport.send(new OutboundRequest(
			"https://api.example.com/chat/completions",
			Map.of("Authorization", "Bearer k"),
			"{\"model\":\"m\"}"
		));

		assertEquals(200, response.statusCode());
		assertTrue(response.isSuccessful());
		final ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
		verify(client).execute(captor.capture());
		assertEquals(HttpMethod.POST, captor.getValue().method());
		assertEquals("https://api.example.com/chat/completions", captor.getValue().url());
		assertEquals("{\"model\":\"m\"}", captor.getValue().body());
	}

	@Test
	@DisplayName("turns error statuses into responses")
	void shouldReturnErrorStatuses() throws IOException {
		when(client.execute(any(HttpRequest.class))).thenThrow(new HttpException(429, "{\"error\":\"slow down\"}"));

		final TransportResponse response = new LangChainHttpTransport(client)
			.send(new OutboundRequest("https://api.example.com", Map.of(), "{}"));

		assertEquals(429, response.statusCode());
		assertEquals("{\"error\":\"slow down\"}", response.body());
		assertFalse(response.isSuccessful());
	}

	@Test
	@DisplayName("rethrows wrapped network failures as IOException")
	void shouldUnwrapNetworkFailures() {
		when(client.execute(any(HttpRequest.class))).thenThrow(new UncheckedIOException(new IOException("reset")));

		final IOException ex = assertThrows(
			IOException.class,
			() -> new LangChainHttpTransport(client).send(new OutboundRequest("https://api.example.com", Map.of(), "{}"))
		);
		assertEquals("reset", ex.getMessage());
	}

	@Test
	@DisplayName("reads the proxy from the environment, HTTPS first")
	void shouldReadProxyFromEnvironment() {
		assertEquals("http://secure:3128", LangChainHttpTransport.proxyFromEnvironment(
			Map.of("HTTP_PROXY", "http://plain:8080", "HTTPS_PROXY", "http://secure:3128")
		));
		assertEquals("http://plain:8080", LangChainHttpTransport.proxyFromEnvironment(Map.of("http_proxy", "http://plain:8080")));
		assertNull(LangChainHttpTransport.proxyFromEnvironment(Map.of()));
	}

	@Test
	@DisplayName("routes every request through the configured proxy")
	void shouldBuildProxySelector() {
		final ProxySelector selector = LangChainHttpTransport.toProxySelector("proxy.internal:3128");
		final InetSocketAddress address = (InetSocketAddress) selector.select(URI.create("https://api.groq.com")).get(0).address();

		assertEquals("proxy.internal", address.getHostString());
		assertEquals(3128, address.getPort());
		assertThrows(IllegalArgumentException.class, () -> LangChainHttpTransport.toProxySelector("http://:80"));
	}
}
