package zoho.contacts.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;
import zoho.contacts.app.config.ExtractorProperties;
import zoho.contacts.app.entity.Credential;
import zoho.contacts.app.repository.TokenStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Owns the access/refresh token pair. Tokens are loaded lazily from the {@link TokenStore},
 * refreshed when {@link #acquire()} sees them expired, and persisted after every change.
 */
@Slf4j
@Service
public class TokenRefreshService {

    public enum State { UNLOADED, VALID, EXPIRED, UNAUTHENTICATED }

    private static final String AUTH_PATH = "/oauth/v2/auth";
    private static final String TOKEN_PATH = "/oauth/v2/token";

    private final ExtractorProperties properties;
    private final TokenStore tokenStore;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private Credential credential;
    private boolean loadAttempted;

    public TokenRefreshService(ExtractorProperties properties, TokenStore tokenStore,
                               RestTemplate restTemplate, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.tokenStore = tokenStore;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    private void validateClientCredentials() {
        if (isBlank(properties.getClientId()) || properties.getClientId().startsWith("${")) {
            throw new AuthException("Zoho OAuth client-id is not configured. Please set ZOHO_CLIENT_ID");
        }
        if (isBlank(properties.getClientSecret()) || properties.getClientSecret().startsWith("${")) {
            throw new AuthException("Zoho OAuth client-secret is not configured. Please set ZOHO_CLIENT_SECRET");
        }
    }

    public State getState() {
        if (credential == null) {
            return loadAttempted ? State.UNAUTHENTICATED : State.UNLOADED;
        }
        return credential.isExpiredAt(clock.instant()) ? State.EXPIRED : State.VALID;
    }

    /**
     * Loads the stored credential, refreshing it right away if it has already expired.
     *
     * @return true when a usable token is now held, false when a fresh authorization is needed
     */
    public boolean loadStoredCredential() {
        loadAttempted = true;
        Optional<Credential> stored = tokenStore.load();
        if (stored.isEmpty()) {
            credential = null;
            return false;
        }

        credential = stored.get();
        if (!credential.isExpiredAt(clock.instant())) {
            log.info("Tokens loaded successfully");
            return true;
        }

        log.info("Saved token is expired, will need refresh");
        if (!credential.hasRefreshToken()) {
            log.warn("No refresh token available for expired access token");
            credential = null;
            return false;
        }
        try {
            refresh();
            return true;
        } catch (AuthException e) {
            log.warn("Stored token could not be refreshed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Returns a credential that is valid at call time, refreshing it if needed.
     *
     * @throws AuthException if no token is available or the refresh fails
     */
    public Credential acquire() {
        if (credential == null && !loadAttempted) {
            loadStoredCredential();
        }
        if (credential == null) {
            throw new AuthException("No access token available. Please re-authenticate.");
        }
        if (credential.isExpiredAt(clock.instant())) {
            log.info("Token expired, refreshing...");
            refresh();
        }
        return credential;
    }

    /**
     * Refreshes regardless of the recorded expiry; used when the API answers 401.
     */
    public Credential forceRefresh() {
        if (credential == null) {
            throw new AuthException("Received 401 Unauthorized and no credential is loaded. Please re-authenticate.");
        }
        log.info("Received 401, refreshing access token");
        refresh();
        return credential;
    }

    public String buildAuthorizationUrl() {
        return UriComponentsBuilder.fromUriString(properties.getAccountsUrl() + AUTH_PATH)
                .queryParam("response_type", "code")
                .queryParam("client_id", properties.getClientId())
                .queryParam("scope", properties.getScopes())
                .queryParam("redirect_uri", properties.getRedirectUri())
                .queryParam("access_type", "offline")
                .queryParam("prompt", "consent")
                .encode()
                .build()
                .toUriString();
    }

    /**
     * Exchanges a one-time authorization code for a token pair and persists it.
     */
    public Credential exchangeCode(String authorizationCode) {
        validateClientCredentials();

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("grant_type", "authorization_code");
        body.add("client_id", properties.getClientId());
        body.add("client_secret", properties.getClientSecret());
        body.add("redirect_uri", properties.getRedirectUri());
        body.add("code", authorizationCode);

        JsonNode tokens;
        try {
            tokens = postTokenRequest(body);
        } catch (AuthException e) {
            throw e;
        } catch (Exception e) {
            throw new AuthException("Error exchanging authorization code: " + e.getMessage(), e);
        }

        Instant now = clock.instant();
        Credential exchanged = new Credential();
        exchanged.setAccessToken(tokens.get("access_token").asText());
        if (tokens.hasNonNull("refresh_token")) {
            exchanged.setRefreshToken(tokens.get("refresh_token").asText());
        }
        exchanged.setExpiresAt(expiryFrom(tokens, now));
        exchanged.setRetrievedAt(now);

        try {
            tokenStore.save(exchanged);
        } catch (RuntimeException e) {
            log.error("Failed to save tokens: {}", e.getMessage(), e);
            throw new AuthException("Failed to save tokens: " + e.getMessage(), e);
        }
        credential = exchanged;
        loadAttempted = true;
        log.info("Tokens saved successfully, expires at {}, refresh token available: {}",
                exchanged.getExpiresAt(), exchanged.hasRefreshToken());
        return credential;
    }

    private void refresh() {
        validateClientCredentials();

        if (!credential.hasRefreshToken()) {
            credential = null;
            throw new AuthException("Access token expired and no refresh token available. Please re-authenticate.");
        }

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("grant_type", "refresh_token");
        body.add("client_id", properties.getClientId());
        body.add("client_secret", properties.getClientSecret());
        body.add("refresh_token", credential.getRefreshToken());

        try {
            log.info("Attempting to refresh access token...");
            JsonNode tokens = postTokenRequest(body);
            Instant now = clock.instant();

            Credential refreshed = new Credential();
            refreshed.setAccessToken(tokens.get("access_token").asText());
            refreshed.setExpiresAt(expiryFrom(tokens, now));
            refreshed.setRetrievedAt(credential.getRetrievedAt());
            refreshed.setRefreshedAt(now);
            // The refresh token usually stays the same; the server may rotate it
            refreshed.setRefreshToken(tokens.hasNonNull("refresh_token")
                    ? tokens.get("refresh_token").asText()
                    : credential.getRefreshToken());

            tokenStore.save(refreshed);
            credential = refreshed;
            log.info("Access token refreshed successfully, expires at: {}", refreshed.getExpiresAt());
        } catch (Exception e) {
            credential = null;
            log.error("Failed to refresh access token: {}", e.getMessage(), e);
            throw new AuthException("Failed to refresh access token: " + e.getMessage(), e);
        }
    }

    private JsonNode postTokenRequest(MultiValueMap<String, String> body) throws Exception {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        HttpEntity<MultiValueMap<String, String>> request = new HttpEntity<>(body, headers);

        ResponseEntity<String> response = restTemplate.postForEntity(
                properties.getAccountsUrl() + TOKEN_PATH,
                request,
                String.class
        );
        log.info("Token endpoint response: {}", response.getStatusCode().value());

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            String errorBody = response.getBody() != null ? response.getBody() : "No response body";
            throw new AuthException("Token request failed. Status: " + response.getStatusCode() + ", Body: " + errorBody);
        }

        JsonNode json = objectMapper.readTree(response.getBody());
        if (!json.hasNonNull("access_token")) {
            throw new AuthException("Token response missing access_token. Response: " + response.getBody());
        }
        return json;
    }

    private Instant expiryFrom(JsonNode tokens, Instant now) {
        Duration expiresIn = tokens.hasNonNull("expires_in")
                ? Duration.ofSeconds(tokens.get("expires_in").asLong())
                : properties.getAuth().getDefaultExpiresIn();
        return now.plus(expiresIn).minus(properties.getAuth().getExpirySafetyMargin());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
