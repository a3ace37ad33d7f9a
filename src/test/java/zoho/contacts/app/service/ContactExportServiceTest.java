package zoho.contacts.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import zoho.contacts.app.config.ExtractorProperties;
import zoho.contacts.app.entity.AttachmentRef;
import zoho.contacts.app.entity.ContactLedger;
import zoho.contacts.app.entity.ContactRecord;
import zoho.contacts.app.entity.SenderIdentity;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ContactExportServiceTest {

    @TempDir
    Path outputDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ContactExportService exportService;

    @BeforeEach
    void setUp() {
        ExtractorProperties properties = new ExtractorProperties();
        properties.getOutput().setDirectory(outputDir.toString());
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);
        exportService = new ContactExportService(objectMapper, properties, clock);
    }

    private static ContactRecord contact(String email, String name, int count, Long first, Long last) {
        ContactRecord record = ContactRecord.firstSighting(SenderIdentity.builder()
                .email(email).name(name).subject("Hello, world").receivedTime(first).build(), List.of());
        record.setMessageCount(count);
        record.setLastSeen(last);
        return record;
    }

    @Test
    void exportAll_WithNoContacts_ShouldWriteNothing() throws IOException {
        // When
        List<Path> written = exportService.exportAll(Collections.emptyList());

        // Then
        assertTrue(written.isEmpty());
        try (Stream<Path> files = Files.list(outputDir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void exportJson_ShouldWriteTotalsAndReadableTimestamps() throws IOException {
        // Given
        List<ContactRecord> contacts = List.of(
                contact("a@example.com", "Ann", 3, 0L, 1_714_558_530_000L),
                contact("b@example.org", "Bob", 1, null, null));

        // When
        Path file = exportService.exportJson(contacts).orElseThrow();

        // Then
        assertEquals(outputDir.resolve("zoho_email_contacts_latest.json"), file);
        JsonNode json = objectMapper.readTree(file.toFile());
        assertEquals(2, json.get("total_unique_emails").asInt());
        assertEquals(4, json.get("total_messages").asInt());
        assertEquals("2024-05-01T10:15:30", json.get("extraction_date").asText());
        JsonNode first = json.get("contacts").get(0);
        assertEquals("a@example.com", first.get("email").asText());
        assertEquals(3, first.get("message_count").asInt());
        assertEquals("1970-01-01 00:00:00", first.get("first_seen_readable").asText());
        assertEquals("2024-05-01 10:15:30", first.get("last_seen_readable").asText());
        assertFalse(json.get("contacts").get(1).has("first_seen_readable"));
    }

    @Test
    void exportJson_WithExistingExport_ShouldBackItUp() throws IOException {
        // Given
        Files.writeString(outputDir.resolve("zoho_email_contacts_latest.json"), "{\"old\":true}");

        // When
        exportService.exportJson(List.of(contact("a@example.com", "Ann", 1, 1L, 1L)));

        // Then
        Path backup = outputDir.resolve("zoho_email_contacts_backup_20240501_101530.json");
        assertTrue(Files.exists(backup));
        assertEquals("{\"old\":true}", Files.readString(backup));
    }

    @Test
    void exportJson_TwiceWithinSameSecond_ShouldKeepBothBackups() throws IOException {
        // Given
        Files.writeString(outputDir.resolve("zoho_email_contacts_latest.json"), "{\"run\":0}");
        exportService.exportJson(List.of(contact("a@example.com", "Ann", 1, 1L, 1L)));

        // When
        Path file = exportService.exportJson(List.of(contact("b@example.com", "Bob", 1, 1L, 1L))).orElseThrow();

        // Then
        assertEquals("b@example.com", objectMapper.readTree(file.toFile()).get("contacts").get(0).get("email").asText());
        assertEquals("{\"run\":0}", Files.readString(outputDir.resolve("zoho_email_contacts_backup_20240501_101530.json")));
        Path second = outputDir.resolve("zoho_email_contacts_backup_20240501_101530_1.json");
        assertEquals("a@example.com",
                objectMapper.readTree(second.toFile()).get("contacts").get(0).get("email").asText());
    }

    @Test
    void exportCsv_ShouldWriteHeaderAndRows() throws IOException {
        // Given
        ContactRecord withFiles = contact("a@example.com", "Ann", 2, 0L, 0L);
        withFiles.setHasAttachment(true);
        withFiles.getAttachments().add(AttachmentRef.builder().filename("x.pdf").path("p/x.pdf").size(1).build());
        withFiles.getAttachments().add(AttachmentRef.builder().filename("y.png").path("p/y.png").size(1).build());

        // When
        Path file = exportService.exportCsv(List.of(withFiles)).orElseThrow();

        // Then
        List<String> lines = Files.readAllLines(file);
        assertEquals("email,name,message_count,first_seen,last_seen,latest_subject,domain,"
                + "has_attachments,attachment_count,attachment_files", lines.get(0));
        assertEquals("a@example.com,Ann,2,\"1970-01-01 00:00:00\",\"1970-01-01 00:00:00\",\"Hello, world\","
                + "example.com,true,2,\"x.pdf, y.png\"", lines.get(1));
    }

    @Test
    void saveProgress_ThenClear_ShouldWriteAndRemoveSnapshot() throws IOException {
        // Given
        ContactLedger ledger = new ContactLedger();
        ledger.add(contact("a@example.com", "Ann", 1, 1L, 1L));

        // When
        exportService.saveProgress(ledger, 50);

        // Then
        Path snapshot = outputDir.resolve("extraction_progress.json");
        JsonNode json = objectMapper.readTree(snapshot.toFile());
        assertEquals(50, json.get("processed_count").asInt());
        assertEquals(1, json.get("unique_emails").asInt());
        assertEquals("a@example.com", json.get("emails").get(0).get("email").asText());

        exportService.clearProgress();
        assertFalse(Files.exists(snapshot));
    }
}
