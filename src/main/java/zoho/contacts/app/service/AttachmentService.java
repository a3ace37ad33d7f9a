package zoho.contacts.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import zoho.contacts.app.config.ExtractorProperties;
import zoho.contacts.app.entity.ApiResponse;
import zoho.contacts.app.entity.AttachmentRef;
import zoho.contacts.app.entity.SenderIdentity;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Downloads the attachments of a message into {@code {output}/attachments/{sender_dir}}.
 *
 * The attachment sub-path of the mail API is not stable, so listing and download each
 * walk an ordered list of candidate endpoints and stop at the first one answering 200.
 * Once {@code failureThreshold} consecutive listings reach no endpoint, the service
 * disables itself for the rest of the run.
 */
@Slf4j
@Service
public class AttachmentService {
    private final ApiRequestExecutor requestExecutor;
    private final ObjectMapper objectMapper;
    private final ExtractorProperties.Attachments settings;
    private final Path attachmentsDir;

    private boolean available;
    private int consecutiveFailures;
    private int downloadedCount;

    public AttachmentService(ApiRequestExecutor requestExecutor, ObjectMapper objectMapper,
                             ExtractorProperties properties) {
        this.requestExecutor = requestExecutor;
        this.objectMapper = objectMapper;
        this.settings = properties.getAttachments();
        this.attachmentsDir = Paths.get(properties.getOutput().getDirectory(), "attachments");
        this.available = settings.isEnabled();
    }

    public boolean isAvailable() {
        return available;
    }

    public int getDownloadedCount() {
        return downloadedCount;
    }

    /**
     * Fetches and stores the attachments of a message flagged as having some.
     *
     * @return the stored attachments; empty when none qualified or the side channel is off
     */
    public List<AttachmentRef> fetchAttachments(String accountId, SenderIdentity sender) {
        if (!available || !sender.isHasAttachment() || sender.getMessageId() == null) {
            return Collections.emptyList();
        }

        Optional<JsonNode> listing = listAttachments(accountId, sender.getMessageId());
        if (listing.isEmpty() || listing.get().isEmpty()) {
            recordFailure(sender.getMessageId());
            return Collections.emptyList();
        }
        consecutiveFailures = 0;

        List<AttachmentRef> stored = new ArrayList<>();
        for (JsonNode attachment : listing.get()) {
            String attachmentId = attachment.path("attachmentId").asText("");
            if (attachmentId.isEmpty()) {
                continue;
            }
            String filename = attachment.path("attachmentName").asText("unknown");
            long listedSize = attachment.path("size").asLong(0);

            download(accountId, sender, attachmentId, filename, listedSize)
                    .ifPresent(path -> stored.add(AttachmentRef.builder()
                            .filename(filename)
                            .path(path.toString())
                            .size(listedSize)
                            .build()));
        }
        return stored;
    }

    private Optional<JsonNode> listAttachments(String accountId, String messageId) {
        List<String> candidates = List.of(
                "accounts/" + accountId + "/messages/" + messageId + "/attachments",
                "accounts/" + accountId + "/messages/" + messageId + "/attachment",
                "accounts/" + accountId + "/folders/*/messages/" + messageId + "/attachments");

        for (String endpoint : candidates) {
            Optional<ApiResponse> response = tryEndpoint(endpoint);
            if (response.isPresent()) {
                try {
                    JsonNode data = objectMapper.readTree(response.get().getBody()).path("data");
                    if (data.isArray()) {
                        return Optional.of(data);
                    }
                } catch (IOException e) {
                    log.debug("Unreadable attachment listing from {}: {}", endpoint, e.getMessage());
                }
            }
        }
        log.debug("No attachments endpoint found for message {}", messageId);
        return Optional.empty();
    }

    private Optional<Path> download(String accountId, SenderIdentity sender, String attachmentId,
                                    String filename, long listedSize) {
        Path target = attachmentsDir.resolve(senderDirectory(sender.getEmail()))
                .resolve(safeFilename(filename, attachmentId));

        if (Files.exists(target)) {
            log.debug("Attachment already exists: {}", target.getFileName());
            return Optional.of(target);
        }
        if (!isAllowedExtension(target.getFileName().toString())) {
            log.debug("Skipping attachment with disallowed extension: {}", target.getFileName());
            return Optional.empty();
        }
        long maxBytes = settings.getMaxSize().toBytes();
        if (listedSize > maxBytes) {
            log.warn("Attachment too large, skipping: {} ({} bytes)", target.getFileName(), listedSize);
            return Optional.empty();
        }

        String base = "accounts/" + accountId + "/messages/" + sender.getMessageId();
        List<String> candidates = List.of(
                base + "/attachments/" + attachmentId,
                base + "/attachment/" + attachmentId,
                base + "/attachments/" + attachmentId + "/content");

        for (String endpoint : candidates) {
            Optional<ApiResponse> response = tryEndpoint(endpoint);
            if (response.isEmpty()) {
                continue;
            }
            if (response.get().contentLength() > maxBytes) {
                log.warn("Attachment too large, skipping: {} ({} bytes)",
                        target.getFileName(), response.get().contentLength());
                return Optional.empty();
            }
            try {
                Files.createDirectories(target.getParent());
                Files.write(target, response.get().getBody());
            } catch (IOException e) {
                log.error("Error saving attachment {} to {}", attachmentId, target, e);
                return Optional.empty();
            }
            downloadedCount++;
            log.info("Downloaded attachment: {} from {}", target.getFileName(), sender.getEmail());
            return Optional.of(target);
        }

        log.debug("Could not download attachment {} - no working endpoint found", attachmentId);
        return Optional.empty();
    }

    private Optional<ApiResponse> tryEndpoint(String endpoint) {
        try {
            ApiResponse response = requestExecutor.get(endpoint);
            return response.isOk() ? Optional.of(response) : Optional.empty();
        } catch (ApiRequestException e) {
            log.debug("Attachment endpoint {} failed: {}", endpoint, e.getMessage());
            return Optional.empty();
        }
    }

    private void recordFailure(String messageId) {
        consecutiveFailures++;
        if (consecutiveFailures >= settings.getFailureThreshold()) {
            available = false;
            log.warn("Attachment API unreachable for message {}; attachment download disabled for this run", messageId);
        }
    }

    private boolean isAllowedExtension(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return false;
        }
        String extension = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        return settings.getAllowedExtensions().stream()
                .anyMatch(allowed -> allowed.equalsIgnoreCase(extension));
    }

    static String senderDirectory(String email) {
        return email.replace("@", "_at_").replace(".", "_");
    }

    static String safeFilename(String filename, String attachmentId) {
        StringBuilder safe = new StringBuilder();
        for (char c : filename.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_' || c == '.') {
                safe.append(c);
            }
        }
        String cleaned = safe.toString().stripTrailing();
        // "." and ".." would escape the sender directory
        if (cleaned.isEmpty() || cleaned.chars().allMatch(c -> c == '.')) {
            return "attachment_" + attachmentId;
        }
        return cleaned;
    }
}
