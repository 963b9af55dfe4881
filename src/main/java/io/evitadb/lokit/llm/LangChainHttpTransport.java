package io.evitadb.lokit.llm;

import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.http.client.HttpClient;
import dev.langchain4j.http.client.HttpMethod;
import dev.langchain4j.http.client.HttpRequest;
import dev.langchain4j.http.client.SuccessfulHttpResponse;
import dev.langchain4j.http.client.jdk.JdkHttpClient;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * {@link HttpTransport} backed by the LangChain4j HTTP client. Non-2xx responses, which the client
 * reports as {@link HttpException}, are turned back into plain responses so that the executor
 * can classify them.
 */
public final class LangChainHttpTransport implements HttpTransport {

	private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);

	private final HttpClient client;

	public LangChainHttpTransport(@Nonnull HttpClient client) {
		this.client = Objects.requireNonNull(client, "client must not be null");
	}

	/**
	 * Creates a transport on top of the JDK HTTP client.
	 *
	 * @param proxy   proxy as {@code http://host:port}, null to use the {@code HTTPS_PROXY} /
	 *                {@code HTTP_PROXY} environment variables when present
	 * @param timeout per-call read timeout
	 * @return new transport
	 */
	@Nonnull
	public static LangChainHttpTransport create(@Nullable String proxy, @Nonnull Duration timeout) {
		Objects.requireNonNull(timeout, "timeout must not be null");

		final java.net.http.HttpClient.Builder jdkBuilder = java.net.http.HttpClient.newBuilder();
		final String effectiveProxy = proxy == null || proxy.isBlank() ? proxyFromEnvironment(System.getenv()) : proxy;
		if (effectiveProxy != null) {
			jdkBuilder.proxy(toProxySelector(effectiveProxy));
		}

		final HttpClient client = JdkHttpClient.builder()
			.httpClientBuilder(jdkBuilder)
			.connectTimeout(CONNECT_TIMEOUT.compareTo(timeout) < 0 ? CONNECT_TIMEOUT : timeout)
			.readTimeout(timeout)
			.build();
		return new LangChainHttpTransport(client);
	}

	@Nonnull
	@Override
	public TransportResponse send(@Nonnull OutboundRequest request) throws IOException {
		final HttpRequest.Builder builder = HttpRequest.builder()
			.method(HttpMethod.POST)
			.url(request.url())
			.body(request.body());
		for (final Map.Entry<String, String> header : request.headers().entrySet()) {
			builder.addHeader(header.getKey(), header.getValue());
		}

		try {
			final SuccessfulHttpResponse response = this.client.execute(builder.build());
			return new TransportResponse(response.statusCode(), response.body() == null ? "" : response.body());
		} catch (HttpException e) {
			return new TransportResponse(e.statusCode(), e.getMessage() == null ? "" : e.getMessage());
		} catch (TimeoutException e) {
			throw new IOException("Request to " + request.url() + " timed out", e);
		} catch (RuntimeException e) {
			final Throwable cause = e.getCause();
			if (cause instanceof InterruptedException) {
				Thread.currentThread().interrupt();
				final InterruptedIOException interrupted = new InterruptedIOException("Request to " + request.url() + " was interrupted");
				interrupted.initCause(cause);
				throw interrupted;
			}
			if (cause instanceof IOException ioException) {
				throw ioException;
			}
			throw e;
		}
	}

	/**
	 * Resolves the proxy from the conventional environment variables.
	 *
	 * @param environment environment variables
	 * @return proxy URL or null
	 */
	@Nullable
	static String proxyFromEnvironment(@Nonnull Map<String, String> environment) {
		for (final String name : new String[]{"HTTPS_PROXY", "https_proxy", "HTTP_PROXY", "http_proxy"}) {
			final String value = environment.get(name);
			if (value != null && !value.isBlank()) {
				return value;
			}
		}
		return null;
	}

	/**
	 * Converts {@code http://host:port} (scheme optional) into a fixed proxy selector.
	 *
	 * @param proxy proxy URL
	 * @return selector routing all requests through the proxy
	 * @throws IllegalArgumentException when the host is missing
	 */
	@Nonnull
	static ProxySelector toProxySelector(@Nonnull String proxy) {
		final URI uri = URI.create(proxy.contains("://") ? proxy : "http://" + proxy);
		if (uri.getHost() == null) {
			throw new IllegalArgumentException("Invalid proxy URL: " + proxy);
		}
		final int port = uri.getPort() > 0 ? uri.getPort() : ("https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80);
		return ProxySelector.of(InetSocketAddress.createUnresolved(uri.getHost(), port));
	}
}
