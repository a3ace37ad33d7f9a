package zoho.contacts.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;
import zoho.contacts.app.config.ExtractorProperties;
import zoho.contacts.app.entity.ApiResponse;
import zoho.contacts.app.entity.Credential;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Issues authenticated, rate-limited calls against the mail API.
 *
 * <ul>
 *   <li>401: one forced token refresh and an immediate reissue; a second 401 fails with UNAUTHORIZED.</li>
 *   <li>429: backoff {@code min(2^attempt, 60)} seconds.</li>
 *   <li>5xx: backoff {@code min(2^attempt, 30)} seconds.</li>
 *   <li>timeout / network error: backoff {@code 2^attempt} seconds.</li>
 * </ul>
 * After {@code maxRetries} retries the call fails with EXHAUSTED. Every other status,
 * 404 included, is returned to the caller.
 */
@Slf4j
@Service
public class ApiRequestExecutor {
    static final String AUTH_SCHEME = "Zoho-oauthtoken ";
    static final String USER_AGENT = "ZohoEmailExtractor/1.0";

    private final ExtractorProperties properties;
    private final RestTemplate restTemplate;
    private final TokenRefreshService tokenRefreshService;
    private final ApiRateLimiter rateLimiter;
    private final Sleeper sleeper;

    public ApiRequestExecutor(ExtractorProperties properties, RestTemplate restTemplate,
                              TokenRefreshService tokenRefreshService, ApiRateLimiter rateLimiter,
                              Sleeper sleeper) {
        this.properties = properties;
        this.restTemplate = restTemplate;
        this.tokenRefreshService = tokenRefreshService;
        this.rateLimiter = rateLimiter;
        this.sleeper = sleeper;
    }

    public ApiResponse get(String endpoint) {
        return execute(endpoint, HttpMethod.GET, Collections.emptyMap());
    }

    public ApiResponse get(String endpoint, Map<String, String> params) {
        return execute(endpoint, HttpMethod.GET, params);
    }

    public ApiResponse execute(String endpoint, HttpMethod method, Map<String, String> params) {
        URI uri = buildUri(endpoint, params);
        int maxRetries = properties.getRequest().getMaxRetries();
        ApiRequestException.Kind lastFailure = null;
        Exception lastCause = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            Credential credential = tokenRefreshService.acquire();
            log.debug("API request attempt {}: {} {}", attempt + 1, method, uri);

            try {
                ResponseEntity<byte[]> response = send(uri, method, credential);
                int status = response.getStatusCode().value();

                if (status == 401) {
                    response = reauthenticateAndResend(uri, method);
                    status = response.getStatusCode().value();
                }

                if (status == 429) {
                    lastFailure = ApiRequestException.Kind.RATE_LIMITED;
                    lastCause = null;
                    if (attempt < maxRetries) {
                        long waitSeconds = Math.min(1L << attempt, 60);
                        log.warn("Rate limit hit, waiting {} seconds...", waitSeconds);
                        backoff(waitSeconds);
                    }
                    continue;
                }

                if (status >= 500) {
                    lastFailure = ApiRequestException.Kind.SERVER_ERROR;
                    lastCause = null;
                    if (attempt < maxRetries) {
                        long waitSeconds = Math.min(1L << attempt, 30);
                        log.warn("Server error ({}), retrying in {} seconds...", status, waitSeconds);
                        backoff(waitSeconds);
                    }
                    continue;
                }

                if (status != 200) {
                    log.warn("API request {} returned {}: {}", uri, status, abbreviate(response.getBody()));
                }
                return new ApiResponse(status, response.getHeaders(), response.getBody());

            } catch (ResourceAccessException e) {
                lastFailure = classify(e);
                lastCause = e;
                if (attempt < maxRetries) {
                    long waitSeconds = 1L << attempt;
                    log.warn("{} on {}, retrying in {} seconds (attempt {}): {}",
                            lastFailure == ApiRequestException.Kind.TIMEOUT ? "Request timeout" : "Network error",
                            uri, waitSeconds, attempt + 1, e.getMessage());
                    backoff(waitSeconds);
                }
            }
        }

        throw ApiRequestException.exhausted(lastFailure, maxRetries + 1, uri.toString(), lastCause);
    }

    private ResponseEntity<byte[]> reauthenticateAndResend(URI uri, HttpMethod method) {
        Credential refreshed;
        try {
            refreshed = tokenRefreshService.forceRefresh();
        } catch (AuthException e) {
            throw new ApiRequestException(ApiRequestException.Kind.UNAUTHORIZED,
                    "Failed to refresh token after 401 error", e);
        }

        ResponseEntity<byte[]> retried = send(uri, method, refreshed);
        if (retried.getStatusCode().value() == 401) {
            throw new ApiRequestException(ApiRequestException.Kind.UNAUTHORIZED,
                    "Request to " + uri + " still unauthorized after token refresh");
        }
        return retried;
    }

    private ResponseEntity<byte[]> send(URI uri, HttpMethod method, Credential credential) {
        admit();

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, AUTH_SCHEME + credential.getAccessToken());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON, MediaType.ALL));
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);

        return restTemplate.exchange(uri, method, new HttpEntity<Void>(headers), byte[].class);
    }

    private void admit() {
        try {
            rateLimiter.admit();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionInterruptedException("Interrupted while waiting for rate limiter", e);
        }
    }

    private void backoff(long seconds) {
        try {
            sleeper.sleep(seconds * 1000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionInterruptedException("Interrupted during retry backoff", e);
        }
    }

    private URI buildUri(String endpoint, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.getApiBaseUrl())
                .path("/")
                .path(endpoint);
        params.forEach(builder::queryParam);
        return builder.encode().build().toUri();
    }

    static ApiRequestException.Kind classify(ResourceAccessException e) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof SocketTimeoutException) {
                return ApiRequestException.Kind.TIMEOUT;
            }
            cause = cause.getCause();
        }
        return ApiRequestException.Kind.NETWORK_ERROR;
    }

    private static String abbreviate(byte[] body) {
        if (body == null) {
            return "";
        }
        String text = new String(body, StandardCharsets.UTF_8);
        return text.length() > 300 ? text.substring(0, 300) + "..." : text;
    }
}
