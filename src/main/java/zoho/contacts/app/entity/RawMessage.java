package zoho.contacts.app.entity;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One entry of a listing page. The mail API returns either the full message
 * record inline or only the message identifier, which needs a detail fetch.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RawMessage {

    public enum Kind { INLINE, REFERENCE }

    private final Kind kind;
    private final JsonNode record;
    private final String messageId;

    private RawMessage(Kind kind, JsonNode record, String messageId) {
        this.kind = kind;
        this.record = record;
        this.messageId = messageId;
    }

    public static RawMessage inline(JsonNode record) {
        return new RawMessage(Kind.INLINE, record, null);
    }

    public static RawMessage reference(String messageId) {
        return new RawMessage(Kind.REFERENCE, null, messageId);
    }
}
