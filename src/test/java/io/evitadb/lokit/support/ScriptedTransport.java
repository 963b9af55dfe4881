package io.evitadb.lokit.support;

import io.evitadb.lokit.llm.HttpTransport;
import io.evitadb.lokit.llm.OutboundRequest;
import io.evitadb.lokit.llm.TransportResponse;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * Transport answering from a queue of canned outcomes and recording every request. When the queue
 * is empty the fallback function answers. All methods are thread-safe.
 */
public class ScriptedTransport implements HttpTransport {

	private final Deque<Object> script = new ArrayDeque<>();
	private final List<OutboundRequest> requests = new ArrayList<>();
	private Function<OutboundRequest, TransportResponse> fallback =
		request -> new TransportResponse(500, "{\"error\":{\"message\":\"script exhausted\"}}");

	public synchronized ScriptedTransport respond(int status, String body) {
		script.add(new TransportResponse(status, body));
		return this;
	}

	public synchronized ScriptedTransport respondWithText(String text) {
		return respond(200, chatCompletion(text));
	}

	public synchronized ScriptedTransport fail(IOException failure) {
		script.add(failure);
		return this;
	}

	public synchronized ScriptedTransport otherwise(Function<OutboundRequest, TransportResponse> fallback) {
		this.fallback = fallback;
		return this;
	}

	@Nonnull
	@Override
	public TransportResponse send(@Nonnull OutboundRequest request) throws IOException {
		final Object next;
		final Function<OutboundRequest, TransportResponse> currentFallback;
		synchronized (this) {
			requests.add(request);
			next = script.poll();
			currentFallback = fallback;
		}
		if (next instanceof IOException failure) {
			throw failure;
		}
		if (next instanceof TransportResponse response) {
			return response;
		}
		return currentFallback.apply(request);
	}

	public synchronized List<OutboundRequest> getRequests() {
		return new ArrayList<>(requests);
	}

	public synchronized int getRequestCount() {
		return requests.size();
	}

	/**
	 * Wraps the text into a chat completions response body.
	 */
	public static String chatCompletion(String text) {
		final String escaped = text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
		return "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"" + escaped + "\"}}]}";
	}
}
