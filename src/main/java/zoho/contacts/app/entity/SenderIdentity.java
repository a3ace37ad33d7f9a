package zoho.contacts.app.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Normalized sender of a single message, ready to be merged into the ledger.
 */
@Value
@Builder
public class SenderIdentity {
    public static final String UNKNOWN_NAME = "Unknown";

    String email;
    String name;
    String subject;
    Long receivedTime;
    String messageId;
    boolean hasAttachment;

    public String getDomain() {
        int at = email.indexOf('@');
        return at >= 0 ? email.substring(at + 1) : "";
    }
}
