package zoho.contacts.app.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ledger entry: everything known about one sender address.
 */
@Data
@NoArgsConstructor
public class ContactRecord {
    private String email;
    private String name;

    @JsonProperty("message_count")
    private int messageCount;

    @JsonProperty("first_seen")
    private Long firstSeen;

    @JsonProperty("last_seen")
    private Long lastSeen;

    private String subject;

    @JsonProperty("has_attachment")
    private boolean hasAttachment;

    private List<AttachmentRef> attachments = new ArrayList<>();

    public static ContactRecord firstSighting(SenderIdentity identity, List<AttachmentRef> attachments) {
        ContactRecord record = new ContactRecord();
        record.setEmail(identity.getEmail());
        record.setName(identity.getName());
        record.setSubject(identity.getSubject());
        record.setMessageCount(1);
        record.setFirstSeen(identity.getReceivedTime());
        record.setLastSeen(identity.getReceivedTime());
        record.setHasAttachment(identity.isHasAttachment());
        record.getAttachments().addAll(attachments);
        return record;
    }

    public String getDomain() {
        int at = email == null ? -1 : email.indexOf('@');
        return at >= 0 ? email.substring(at + 1) : "";
    }
}
