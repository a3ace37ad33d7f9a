package zoho.contacts.app.entity;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * One batch returned by a listing call. {@code total} is 0 when the API did not report it.
 */
@Data
@AllArgsConstructor
public class MessagePage {
    private int startIndex;
    private List<RawMessage> messages;
    private int total;

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
