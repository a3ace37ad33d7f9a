package zoho.contacts.app.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;

/**
 * OAuth2 credential as persisted in {@code tokens.json}.
 * {@code expiresAt} already has the safety margin subtracted.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Credential {
    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("refresh_token")
    private String refreshToken;

    @JsonProperty("expires_at")
    private Instant expiresAt;

    @JsonProperty("retrieved_at")
    private Instant retrievedAt;

    @JsonProperty("refreshed_at")
    private Instant refreshedAt;

    public boolean isExpiredAt(Instant now) {
        // No recorded expiry means the server never told us; assume still usable
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isEmpty();
    }
}
