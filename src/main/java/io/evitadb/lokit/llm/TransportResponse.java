package io.evitadb.lokit.llm;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Status and body of a provider response, successful or not.
 */
public record TransportResponse(int statusCode, @Nonnull String body) {

	public TransportResponse {
		Objects.requireNonNull(body, "body must not be null");
	}

	public boolean isSuccessful() {
		return this.statusCode >= 200 && this.statusCode < 300;
	}
}
