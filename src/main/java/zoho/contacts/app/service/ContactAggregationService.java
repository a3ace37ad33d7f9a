package zoho.contacts.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import zoho.contacts.app.entity.AttachmentRef;
import zoho.contacts.app.entity.ContactLedger;
import zoho.contacts.app.entity.ContactRecord;
import zoho.contacts.app.entity.MessagePage;
import zoho.contacts.app.entity.RawMessage;
import zoho.contacts.app.entity.SenderIdentity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves page entries to sender identities and folds them into the contact ledger.
 */
@Slf4j
@Service
public class ContactAggregationService {
    private final MailApiService mailApiService;
    private final SenderIdentityParser identityParser;
    private final AttachmentService attachmentService;

    public ContactAggregationService(MailApiService mailApiService, SenderIdentityParser identityParser,
                                     AttachmentService attachmentService) {
        this.mailApiService = mailApiService;
        this.identityParser = identityParser;
        this.attachmentService = attachmentService;
    }

    /**
     * Merges a whole page. Every entry is resolved (detail and attachment fetches included)
     * before the ledger is touched, so an interrupted page leaves the ledger unchanged.
     *
     * @return the number of entries merged; discarded entries are not counted
     */
    public int processPage(String accountId, MessagePage page, ContactLedger ledger) {
        List<Sighting> sightings = new ArrayList<>(page.size());
        for (RawMessage message : page.getMessages()) {
            resolve(accountId, message).ifPresent(identity ->
                    sightings.add(new Sighting(identity, attachmentService.fetchAttachments(accountId, identity))));
        }

        for (Sighting sighting : sightings) {
            merge(ledger, sighting.identity, sighting.attachments);
        }
        if (sightings.size() < page.size()) {
            log.debug("Discarded {} of {} entries starting at {}",
                    page.size() - sightings.size(), page.size(), page.getStartIndex());
        }
        return sightings.size();
    }

    public Optional<SenderIdentity> resolve(String accountId, RawMessage message) {
        if (message.getKind() == RawMessage.Kind.INLINE) {
            return identityParser.parse(message.getRecord());
        }

        log.debug("Processing message ID: {}", message.getMessageId());
        try {
            Optional<JsonNode> details = mailApiService.getMessageDetails(accountId, message.getMessageId());
            if (details.isEmpty()) {
                log.warn("No details returned for message {}", message.getMessageId());
                return Optional.empty();
            }
            return identityParser.parse(details.get());
        } catch (ApiRequestException | MailApiException e) {
            log.error("Error fetching message details for {}: {}", message.getMessageId(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Folds one sighting into the ledger.
     * <ul>
     *   <li>name: a placeholder is always replaced; otherwise only by a strictly longer name</li>
     *   <li>subject: replaced only by a non-empty, strictly longer subject</li>
     *   <li>first_seen / last_seen: widened to the minimum / maximum timestamp seen</li>
     * </ul>
     */
    public static void merge(ContactLedger ledger, SenderIdentity identity, List<AttachmentRef> attachments) {
        Optional<ContactRecord> existing = ledger.find(identity.getEmail());
        if (existing.isEmpty()) {
            ledger.add(ContactRecord.firstSighting(identity, attachments));
            return;
        }

        ContactRecord record = existing.get();
        record.setMessageCount(record.getMessageCount() + 1);

        String name = identity.getName();
        if (!SenderIdentity.UNKNOWN_NAME.equals(name)
                && (SenderIdentity.UNKNOWN_NAME.equals(record.getName()) || name.length() > length(record.getName()))) {
            record.setName(name);
        }

        String subject = identity.getSubject();
        if (subject != null && !subject.isEmpty() && subject.length() > length(record.getSubject())) {
            record.setSubject(subject);
        }

        Long received = identity.getReceivedTime();
        if (received != null) {
            if (record.getFirstSeen() == null || received < record.getFirstSeen()) {
                record.setFirstSeen(received);
            }
            if (record.getLastSeen() == null || received > record.getLastSeen()) {
                record.setLastSeen(received);
            }
        }

        if (identity.isHasAttachment()) {
            record.setHasAttachment(true);
        }
        record.getAttachments().addAll(attachments);
    }

    private static int length(String value) {
        return value == null ? 0 : value.length();
    }

    private static final class Sighting {
        private final SenderIdentity identity;
        private final List<AttachmentRef> attachments;

        private Sighting(SenderIdentity identity, List<AttachmentRef> attachments) {
            this.identity = identity;
            this.attachments = attachments;
        }
    }
}
