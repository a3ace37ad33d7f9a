package zoho.contacts.app.service;

/**
 * No usable access token and no way to get one without a new authorization-code flow.
 */
public class AuthException extends RuntimeException {
    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
