package zoho.contacts.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import zoho.contacts.app.config.ExtractorProperties;
import zoho.contacts.app.entity.MessagePage;
import zoho.contacts.app.entity.PaginationCursor;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Drives page fetches from index 0 until the mailbox runs out or the processed-count
 * ceiling is reached. Pages are fetched lazily, one per {@link PageIterator#hasNext()}.
 */
@Slf4j
@Service
public class MessagePaginationService {
    private final MailApiService mailApiService;
    private final ExtractorProperties.Pagination settings;
    private final Sleeper sleeper;

    public MessagePaginationService(MailApiService mailApiService, ExtractorProperties properties, Sleeper sleeper) {
        this.mailApiService = mailApiService;
        this.settings = properties.getPagination();
        this.sleeper = sleeper;
    }

    /**
     * Starts a new run at index 0.
     *
     * @param folderId folder to list, or null to use the unscoped listing
     */
    public PageIterator open(String accountId, String folderId) {
        return new PageIterator(accountId, folderId);
    }

    public class PageIterator implements Iterator<MessagePage> {
        private final String accountId;
        private final String folderId;
        private final PaginationCursor cursor = new PaginationCursor(settings.getPageSize());
        private MessagePage pending;
        private boolean finished;
        private boolean firstPage = true;

        PageIterator(String accountId, String folderId) {
            this.accountId = accountId;
            this.folderId = folderId;
        }

        @Override
        public boolean hasNext() {
            if (pending != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            if (cursor.getProcessedCount() >= settings.getMaxMessages()) {
                log.info("Reached the configured maximum of {} messages", settings.getMaxMessages());
                finished = true;
                return false;
            }

            if (!firstPage) {
                pause();
            }
            firstPage = false;

            log.info("Fetching batch starting at index {}...", cursor.getStartIndex());
            MessagePage page = fetchPage(cursor.getStartIndex());
            if (page.isEmpty()) {
                log.info("No more messages to process");
                finished = true;
                return false;
            }

            if (page.getTotal() > 0) {
                cursor.setTotalKnown(page.getTotal());
            }
            cursor.advance(page.size());
            if (page.size() < cursor.getPageSize()) {
                log.info("Reached end of available messages");
                finished = true;
            }
            pending = page;
            return true;
        }

        @Override
        public MessagePage next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            MessagePage page = pending;
            pending = null;
            return page;
        }

        public int getProcessedCount() {
            return cursor.getProcessedCount();
        }

        public Integer getTotalKnown() {
            return cursor.getTotalKnown();
        }

        private MessagePage fetchPage(int start) {
            int limit = cursor.getPageSize();
            if (folderId == null) {
                return mailApiService.searchMessages(accountId, start, limit);
            }
            try {
                return mailApiService.listFolderMessages(accountId, folderId, start, limit);
            } catch (MailApiException | ApiRequestException e) {
                log.warn("Folder listing failed at index {} ({}), retrying page via search endpoint", start, e.getMessage());
                return mailApiService.searchMessages(accountId, start, limit);
            }
        }

        private void pause() {
            try {
                sleeper.sleep(settings.getBatchDelay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExtractionInterruptedException("Interrupted between pages", e);
            }
        }
    }
}
