package zoho.contacts.app.entity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory mapping from normalized email to its contact record for one run.
 * Iteration order is irrelevant while accumulating; {@link #sortedByMessageCount()}
 * produces the export order.
 */
public class ContactLedger {
    private final Map<String, ContactRecord> contacts = new HashMap<>();

    public Optional<ContactRecord> find(String email) {
        return Optional.ofNullable(contacts.get(email));
    }

    public void add(ContactRecord record) {
        if (contacts.putIfAbsent(record.getEmail(), record) != null) {
            throw new IllegalStateException("Ledger already holds " + record.getEmail());
        }
    }

    public int size() {
        return contacts.size();
    }

    public boolean isEmpty() {
        return contacts.isEmpty();
    }

    public Collection<ContactRecord> records() {
        return contacts.values();
    }

    public int totalMessages() {
        return contacts.values().stream().mapToInt(ContactRecord::getMessageCount).sum();
    }

    public List<ContactRecord> sortedByMessageCount() {
        List<ContactRecord> sorted = new ArrayList<>(contacts.values());
        sorted.sort(Comparator.comparingInt(ContactRecord::getMessageCount).reversed()
                .thenComparing(ContactRecord::getEmail));
        return sorted;
    }
}
