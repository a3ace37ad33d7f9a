package zoho.contacts.app.service;

import lombok.Getter;

/**
 * The mail API answered, but not with a usable 200 response.
 */
@Getter
public class MailApiException extends RuntimeException {
    private final int statusCode;

    public MailApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
