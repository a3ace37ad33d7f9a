package zoho.contacts.app.service;

import lombok.Getter;

/**
 * Transport, authorization or throttling failure of a mail API call.
 * {@link Kind#EXHAUSTED} carries the kind of the last failed attempt.
 */
@Getter
public class ApiRequestException extends RuntimeException {

    public enum Kind {
        UNAUTHORIZED,
        RATE_LIMITED,
        SERVER_ERROR,
        TIMEOUT,
        NETWORK_ERROR,
        EXHAUSTED
    }

    private final Kind kind;
    private final Kind lastFailure;

    public ApiRequestException(Kind kind, String message) {
        this(kind, null, message, null);
    }

    public ApiRequestException(Kind kind, String message, Throwable cause) {
        this(kind, null, message, cause);
    }

    public ApiRequestException(Kind kind, Kind lastFailure, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.lastFailure = lastFailure;
    }

    public static ApiRequestException exhausted(Kind lastFailure, int attempts, String url, Throwable cause) {
        return new ApiRequestException(Kind.EXHAUSTED, lastFailure,
                "API request to " + url + " failed after " + attempts + " attempts (last failure: " + lastFailure + ")",
                cause);
    }
}
