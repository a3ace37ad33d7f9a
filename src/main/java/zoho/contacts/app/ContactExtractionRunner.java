package zoho.contacts.app;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import zoho.contacts.app.entity.ContactRecord;
import zoho.contacts.app.entity.ExtractionResult;
import zoho.contacts.app.service.AttachmentService;
import zoho.contacts.app.service.AuthException;
import zoho.contacts.app.service.AuthorizationService;
import zoho.contacts.app.service.ContactExportService;
import zoho.contacts.app.service.EmailExtractionService;
import zoho.contacts.app.service.ExtractionCancellation;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Command-line entry: authorize, extract, export, summarize.
 * Ctrl-C stops the page loop after the current page and still exports what was found.
 */
@Slf4j
@Component
public class ContactExtractionRunner implements CommandLineRunner, ExitCodeGenerator {
    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private final AuthorizationService authorizationService;
    private final EmailExtractionService extractionService;
    private final ContactExportService exportService;
    private final AttachmentService attachmentService;
    private final ExtractionCancellation cancellation;
    private final CountDownLatch finished = new CountDownLatch(1);
    private int exitCode;

    public ContactExtractionRunner(AuthorizationService authorizationService,
                                   EmailExtractionService extractionService,
                                   ContactExportService exportService,
                                   AttachmentService attachmentService,
                                   ExtractionCancellation cancellation) {
        this.authorizationService = authorizationService;
        this.extractionService = extractionService;
        this.exportService = exportService;
        this.attachmentService = attachmentService;
        this.cancellation = cancellation;
    }

    @Override
    public void run(String... args) {
        Thread shutdownHook = new Thread(this::awaitPersistence, "extraction-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            exitCode = execute();
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }
    }

    int execute() {
        log.info("Zoho Mail Email Extractor starting");
        try {
            authorizationService.ensureAuthorized();
        } catch (AuthException e) {
            log.error("Authentication failed: {}", e.getMessage());
            return 1;
        }

        ExtractionResult result = extractionService.extract();
        if (result.getContacts().isEmpty()) {
            log.warn("No email addresses found or extraction failed");
            return result.getOutcome() == ExtractionResult.Outcome.FAILED ? 1 : 0;
        }

        List<Path> files = exportService.exportAll(result.getContacts());
        logSummary(result, files);
        return result.getOutcome() == ExtractionResult.Outcome.FAILED ? 1 : 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void awaitPersistence() {
        if (finished.getCount() == 0) {
            return;
        }
        log.info("Interrupt received, finishing current batch and saving results...");
        cancellation.cancel();
        try {
            if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Results were not saved within {} seconds", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Shutdown wait interrupted");
        }
    }

    private void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, keeping shutdown hook");
        }
    }

    private void logSummary(ExtractionResult result, List<Path> files) {
        List<ContactRecord> contacts = result.getContacts();
        long withAttachments = contacts.stream().filter(ContactRecord::isHasAttachment).count();

        log.info("EXTRACTION SUMMARY ({})", result.getOutcome());
        log.info("Total unique email addresses: {}", contacts.size());
        log.info("Total messages processed: {}", result.getProcessedCount());
        log.info("Total messages from contacts: {}", result.totalMessages());
        log.info("Contacts with attachments: {}", withAttachments);
        log.info("Total attachments downloaded: {}", attachmentService.getDownloadedCount());
        files.forEach(file -> log.info("Output file: {}", file.toAbsolutePath()));

        log.info("Top 10 most frequent senders:");
        contacts.stream().limit(10).forEach(contact ->
                log.info("  {} ({}) - {} messages", contact.getName(), contact.getEmail(), contact.getMessageCount()));

        List<ContactRecord> attachmentSenders = contacts.stream()
                .filter(contact -> !contact.getAttachments().isEmpty())
                .sorted(Comparator.comparingInt((ContactRecord contact) -> contact.getAttachments().size()).reversed())
                .limit(5)
                .collect(Collectors.toList());
        if (!attachmentSenders.isEmpty()) {
            log.info("Top 5 senders with attachments:");
            attachmentSenders.forEach(contact ->
                    log.info("  {} ({}) - {} attachments", contact.getName(), contact.getEmail(), contact.getAttachments().size()));
        }
    }
}
