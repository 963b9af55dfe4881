package io.evitadb.lokit.llm;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Access token issued by an OAuth-backed provider.
 *
 * @param accessToken bearer token sent with every request
 * @param projectId   project the token is bound to, required by the Code Assist envelope route
 */
public record OAuthToken(@Nonnull String accessToken, @Nullable String projectId) {

	public OAuthToken {
		Objects.requireNonNull(accessToken, "accessToken must not be null");
	}

	@Override
	public String toString() {
		return "OAuthToken[projectId=" + this.projectId + "]";
	}
}
