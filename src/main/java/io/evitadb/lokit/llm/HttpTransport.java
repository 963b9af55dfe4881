package io.evitadb.lokit.llm;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * Sends one request to a provider. Implementations return every HTTP response, including error
 * statuses, and throw only when no response was received at all.
 */
@FunctionalInterface
public interface HttpTransport {

	/**
	 * @param request request to send
	 * @return the response whatever its status
	 * @throws IOException on connection failures and timeouts
	 */
	@Nonnull
	TransportResponse send(@Nonnull OutboundRequest request) throws IOException;
}
