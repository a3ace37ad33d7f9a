package zoho.contacts.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import zoho.contacts.app.config.ExtractorProperties;

import java.time.Duration;

/**
 * Makes sure a usable token is held before extraction starts: the stored token if
 * there is one, otherwise a browser-driven authorization-code exchange.
 */
@Slf4j
@Service
public class AuthorizationService {
    private final TokenRefreshService tokenRefreshService;
    private final AuthorizationCodeListener codeListener;
    private final Duration callbackTimeout;

    public AuthorizationService(TokenRefreshService tokenRefreshService, AuthorizationCodeListener codeListener,
                                ExtractorProperties properties) {
        this.tokenRefreshService = tokenRefreshService;
        this.codeListener = codeListener;
        this.callbackTimeout = properties.getAuth().getCallbackTimeout();
    }

    /**
     * @throws AuthException if no code arrives within the callback timeout or the exchange fails
     */
    public void ensureAuthorized() {
        if (tokenRefreshService.getState() == TokenRefreshService.State.VALID) {
            log.debug("Access token already loaded");
            return;
        }
        if (tokenRefreshService.loadStoredCredential()) {
            log.info("Using saved tokens");
            return;
        }

        log.info("Starting OAuth authentication flow...");
        codeListener.begin();
        String url = tokenRefreshService.buildAuthorizationUrl();
        log.info("Please open the following URL in your browser and authorize access:");
        log.info("{}", url);
        log.info("Waiting for authorization (timeout: {} seconds)...", callbackTimeout.toSeconds());

        String code = codeListener.await(callbackTimeout);
        log.info("Authorization code received, exchanging for tokens...");
        tokenRefreshService.exchangeCode(code);
        log.info("Authentication successful!");
    }
}
