package zoho.contacts.app.entity;

import lombok.Getter;
import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;

/**
 * Transport-level result of a mail API call: any status the executor did not
 * treat as a retryable failure, with the raw body.
 */
@Getter
public class ApiResponse {
    private final int statusCode;
    private final HttpHeaders headers;
    private final byte[] body;

    public ApiResponse(int statusCode, HttpHeaders headers, byte[] body) {
        this.statusCode = statusCode;
        this.headers = headers == null ? HttpHeaders.EMPTY : headers;
        this.body = body == null ? new byte[0] : body;
    }

    public boolean isOk() {
        return statusCode == 200;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public long contentLength() {
        long declared = headers.getContentLength();
        return declared >= 0 ? declared : body.length;
    }
}
