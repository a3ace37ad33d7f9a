package zoho.contacts.app.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import zoho.contacts.app.config.ExtractorProperties;
import zoho.contacts.app.entity.AttachmentRef;
import zoho.contacts.app.entity.ContactLedger;
import zoho.contacts.app.entity.ContactRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Writes the ledger to the output directory: the periodic progress snapshot during a run
 * and the JSON and CSV exports at the end of it.
 */
@Slf4j
@Service
public class ContactExportService {
    static final String JSON_FILE = "zoho_email_contacts_latest.json";
    static final String CSV_FILE = "zoho_email_contacts_latest.csv";
    static final String PROGRESS_FILE = "extraction_progress.json";

    private static final DateTimeFormatter READABLE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter BACKUP_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();
    private final Clock clock;
    private final Path outputDir;

    public ContactExportService(ObjectMapper objectMapper, ExtractorProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.outputDir = Paths.get(properties.getOutput().getDirectory());
    }

    /**
     * Writes both exports. An empty contact list writes nothing.
     *
     * @return the files written
     */
    public List<Path> exportAll(List<ContactRecord> contacts) {
        List<Path> written = new ArrayList<>();
        if (contacts.isEmpty()) {
            log.warn("No email data to save");
            return written;
        }
        exportJson(contacts).ifPresent(written::add);
        exportCsv(contacts).ifPresent(written::add);
        return written;
    }

    public Optional<Path> exportJson(List<ContactRecord> contacts) {
        Path target = outputDir.resolve(JSON_FILE);
        try {
            Files.createDirectories(outputDir);
            backupExisting(target, "json");

            ArrayNode rows = objectMapper.createArrayNode();
            for (ContactRecord contact : contacts) {
                ObjectNode row = objectMapper.valueToTree(contact);
                if (contact.getFirstSeen() != null) {
                    row.put("first_seen_readable", readable(contact.getFirstSeen()));
                }
                if (contact.getLastSeen() != null) {
                    row.put("last_seen_readable", readable(contact.getLastSeen()));
                }
                rows.add(row);
            }

            ObjectNode document = objectMapper.createObjectNode();
            document.put("extraction_date", LocalDateTime.now(clock).toString());
            document.put("total_unique_emails", contacts.size());
            document.put("total_messages", contacts.stream().mapToInt(ContactRecord::getMessageCount).sum());
            document.set("contacts", rows);

            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), document);
            log.info("JSON file saved: {}", target);
            return Optional.of(target);
        } catch (IOException e) {
            log.error("Error saving to JSON: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    public Optional<Path> exportCsv(List<ContactRecord> contacts) {
        Path target = outputDir.resolve(CSV_FILE);
        try {
            Files.createDirectories(outputDir);
            backupExisting(target, "csv");

            List<CsvRow> rows = contacts.stream().map(this::toCsvRow).collect(Collectors.toList());
            CsvSchema schema = csvMapper.schemaFor(CsvRow.class).withHeader();
            csvMapper.writer(schema).writeValue(target.toFile(), rows);
            log.info("CSV file saved: {}", target);
            return Optional.of(target);
        } catch (IOException e) {
            log.error("Error saving to CSV: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Overwrites the progress snapshot with the ledger as accumulated so far.
     */
    public void saveProgress(ContactLedger ledger, int processedCount) {
        ObjectNode snapshot = objectMapper.createObjectNode();
        snapshot.put("processed_count", processedCount);
        snapshot.put("unique_emails", ledger.size());
        snapshot.put("timestamp", LocalDateTime.now(clock).toString());
        snapshot.set("emails", objectMapper.valueToTree(ledger.records()));

        try {
            Files.createDirectories(outputDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputDir.resolve(PROGRESS_FILE).toFile(), snapshot);
            log.debug("Progress snapshot saved ({} processed, {} unique)", processedCount, ledger.size());
        } catch (IOException e) {
            log.error("Error saving progress: {}", e.getMessage());
        }
    }

    public void clearProgress() {
        try {
            Files.deleteIfExists(outputDir.resolve(PROGRESS_FILE));
        } catch (IOException e) {
            log.warn("Could not remove progress file: {}", e.getMessage());
        }
    }

    private void backupExisting(Path target, String extension) throws IOException {
        if (!Files.exists(target)) {
            return;
        }
        String suffix = LocalDateTime.now(clock).format(BACKUP_SUFFIX);
        String base = "zoho_email_contacts_backup_" + suffix;
        Path backup = outputDir.resolve(base + "." + extension);
        // Same-second runs get a counter instead of overwriting an earlier backup
        for (int n = 1; Files.exists(backup); n++) {
            backup = outputDir.resolve(base + "_" + n + "." + extension);
        }
        Files.move(target, backup);
        log.info("Previous {} file backed up as: {}", extension.toUpperCase(Locale.ROOT), backup);
    }

    private CsvRow toCsvRow(ContactRecord contact) {
        List<AttachmentRef> attachments = contact.getAttachments();
        return CsvRow.builder()
                .email(contact.getEmail())
                .name(contact.getName())
                .messageCount(contact.getMessageCount())
                .firstSeen(contact.getFirstSeen() == null ? "" : readable(contact.getFirstSeen()))
                .lastSeen(contact.getLastSeen() == null ? "" : readable(contact.getLastSeen()))
                .latestSubject(contact.getSubject() == null ? "" : contact.getSubject())
                .domain(contact.getDomain())
                .hasAttachments(contact.isHasAttachment())
                .attachmentCount(attachments.size())
                .attachmentFiles(attachments.stream().map(AttachmentRef::getFilename).collect(Collectors.joining(", ")))
                .build();
    }

    private String readable(long epochMillis) {
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), clock.getZone()).format(READABLE);
    }

    @Value
    @Builder
    @JsonPropertyOrder({"email", "name", "message_count", "first_seen", "last_seen", "latest_subject",
            "domain", "has_attachments", "attachment_count", "attachment_files"})
    public static class CsvRow {
        String email;
        String name;
        @JsonProperty("message_count")
        int messageCount;
        @JsonProperty("first_seen")
        String firstSeen;
        @JsonProperty("last_seen")
        String lastSeen;
        @JsonProperty("latest_subject")
        String latestSubject;
        String domain;
        @JsonProperty("has_attachments")
        boolean hasAttachments;
        @JsonProperty("attachment_count")
        int attachmentCount;
        @JsonProperty("attachment_files")
        String attachmentFiles;
    }
}
