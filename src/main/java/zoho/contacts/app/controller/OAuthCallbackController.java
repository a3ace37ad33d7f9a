package zoho.contacts.app.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;
import zoho.contacts.app.service.AuthorizationCodeListener;

/**
 * Redirect target of the OAuth consent page. Hands the one-time code (or the error)
 * to the waiting extractor and answers the browser with a short HTML page.
 */
@Slf4j
@RestController
public class OAuthCallbackController {
    private final AuthorizationCodeListener codeListener;

    public OAuthCallbackController(AuthorizationCodeListener codeListener) {
        this.codeListener = codeListener;
    }

    @GetMapping(value = "/oauth/callback", produces = MediaType.TEXT_HTML_VALUE)
    public ResponseEntity<String> callback(@RequestParam(required = false) String code,
                                           @RequestParam(required = false) String error,
                                           @RequestParam(value = "error_description", required = false) String errorDescription) {
        if (!codeListener.isAwaiting()) {
            log.warn("Ignoring OAuth callback: no authorization in progress");
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(page("Authorization already handled", "You can close this window."));
        }

        if (error != null) {
            String detail = errorDescription != null ? error + " - " + errorDescription : error;
            log.error("OAuth error: {}", detail);
            codeListener.fail(detail);
            return ResponseEntity.badRequest().body(page("Authorization failed", detail));
        }

        if (code == null || code.isBlank()) {
            log.error("No authorization code received");
            codeListener.fail("No authorization code received");
            return ResponseEntity.badRequest().body(page("Authorization failed", "No authorization code received."));
        }

        codeListener.complete(code);
        log.info("Authorization code received via callback");
        return ResponseEntity.ok(page("Authorization successful!",
                "You can close this window and return to the application."));
    }

    private static String page(String title, String message) {
        return "<html><body><h1>" + HtmlUtils.htmlEscape(title) + "</h1><p>"
                + HtmlUtils.htmlEscape(message) + "</p></body></html>";
    }
}
