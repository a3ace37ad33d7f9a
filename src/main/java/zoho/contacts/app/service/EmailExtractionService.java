package zoho.contacts.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import zoho.contacts.app.config.ExtractorProperties;
import zoho.contacts.app.entity.ContactLedger;
import zoho.contacts.app.entity.ExtractionResult;
import zoho.contacts.app.entity.MailAccount;
import zoho.contacts.app.entity.MessagePage;

import java.util.Collections;
import java.util.Optional;

/**
 * Runs one extraction: account lookup, folder resolution, then page-by-page aggregation
 * until the mailbox is exhausted, the run is cancelled or an unrecoverable error occurs.
 * Whatever was accumulated is always returned.
 */
@Slf4j
@Service
public class EmailExtractionService {
    private final MailApiService mailApiService;
    private final FolderResolutionService folderResolutionService;
    private final MessagePaginationService paginationService;
    private final ContactAggregationService aggregationService;
    private final ContactExportService exportService;
    private final ExtractionCancellation cancellation;
    private final int progressEveryPages;

    public EmailExtractionService(MailApiService mailApiService,
                                  FolderResolutionService folderResolutionService,
                                  MessagePaginationService paginationService,
                                  ContactAggregationService aggregationService,
                                  ContactExportService exportService,
                                  ExtractionCancellation cancellation,
                                  ExtractorProperties properties) {
        this.mailApiService = mailApiService;
        this.folderResolutionService = folderResolutionService;
        this.paginationService = paginationService;
        this.aggregationService = aggregationService;
        this.exportService = exportService;
        this.cancellation = cancellation;
        this.progressEveryPages = properties.getPagination().getProgressEveryPages();
    }

    public ExtractionResult extract() {
        log.info("Starting email extraction process...");

        Optional<MailAccount> account;
        try {
            account = mailApiService.getPrimaryAccount();
        } catch (AuthException | ApiRequestException | MailApiException e) {
            log.error("Failed to get account information: {}", e.getMessage());
            return new ExtractionResult(Collections.emptyList(), 0, ExtractionResult.Outcome.FAILED, e.getMessage());
        }
        if (account.isEmpty()) {
            log.error("Failed to get account information");
            return new ExtractionResult(Collections.emptyList(), 0, ExtractionResult.Outcome.FAILED,
                    "No mail account available");
        }
        String accountId = account.get().getAccountId();

        String folderId = folderResolutionService.resolveFolderId(accountId).orElse(null);
        if (folderId == null) {
            log.warn("Could not get folder ID, trying without it...");
        }

        ContactLedger ledger = new ContactLedger();
        MessagePaginationService.PageIterator pages = paginationService.open(accountId, folderId);
        ExtractionResult.Outcome outcome = ExtractionResult.Outcome.COMPLETED;
        String failureReason = null;
        int pageCount = 0;
        int processed = 0;

        try {
            while (true) {
                if (cancellation.isCancelled()) {
                    log.info("Extraction interrupted by user");
                    outcome = ExtractionResult.Outcome.INTERRUPTED;
                    break;
                }
                if (!pages.hasNext()) {
                    break;
                }
                MessagePage page = pages.next();
                int merged = aggregationService.processPage(accountId, page, ledger);
                pageCount++;
                processed += page.size();

                logProgress(merged, processed, pages.getTotalKnown(), ledger);
                if (pageCount % progressEveryPages == 0) {
                    exportService.saveProgress(ledger, processed);
                }
            }
        } catch (ExtractionInterruptedException e) {
            log.info("Extraction interrupted by user");
            outcome = ExtractionResult.Outcome.INTERRUPTED;
        } catch (AuthException | ApiRequestException | MailApiException e) {
            log.error("Extraction stopped: {}", e.getMessage(), e);
            outcome = ExtractionResult.Outcome.FAILED;
            failureReason = e.getMessage();
        } catch (RuntimeException e) {
            log.error("Unexpected error during extraction: {}", e.getMessage(), e);
            outcome = ExtractionResult.Outcome.FAILED;
            failureReason = e.getMessage();
        } finally {
            exportService.clearProgress();
        }

        if (outcome != ExtractionResult.Outcome.COMPLETED) {
            log.info("Saving progress... Found {} unique emails so far", ledger.size());
        }
        log.info("Extraction complete! Found {} unique email addresses", ledger.size());
        return new ExtractionResult(ledger.sortedByMessageCount(), processed, outcome, failureReason);
    }

    private void logProgress(int merged, int processed, Integer total, ContactLedger ledger) {
        log.info("Batch complete: {} valid emails found", merged);
        log.info("Progress: {} messages processed, {} unique emails found", processed, ledger.size());
        if (total != null && total > 0) {
            double percent = Math.min(100.0, processed * 100.0 / total);
            log.info("Progress: {}% complete", String.format("%.1f", percent));
        }
    }
}
