package zoho.contacts.app.entity;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class ExtractionResult {

    public enum Outcome { COMPLETED, INTERRUPTED, FAILED }

    private List<ContactRecord> contacts;
    private int processedCount;
    private Outcome outcome;
    private String failureReason;

    public int totalMessages() {
        return contacts.stream().mapToInt(ContactRecord::getMessageCount).sum();
    }

    public int totalAttachments() {
        return contacts.stream().mapToInt(c -> c.getAttachments().size()).sum();
    }
}
