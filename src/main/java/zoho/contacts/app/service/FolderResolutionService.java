package zoho.contacts.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import zoho.contacts.app.entity.MailFolder;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the folder to paginate. Failure to resolve one is not fatal: the caller
 * then lists messages without a folder filter.
 */
@Slf4j
@Service
public class FolderResolutionService {
    private static final Set<String> INBOX_NAMES = Set.of("inbox", "inbox folder");
    private static final String WELL_KNOWN_INBOX_ID = "1";

    private final MailApiService mailApiService;

    public FolderResolutionService(MailApiService mailApiService) {
        this.mailApiService = mailApiService;
    }

    public Optional<String> resolveFolderId(String accountId) {
        try {
            Optional<MailFolder> folder = selectFolder(mailApiService.listFolders(accountId));
            if (folder.isEmpty()) {
                log.error("No suitable folder found");
                return Optional.empty();
            }
            log.info("Using folder: {} (ID: {})", folder.get().getFolderName(), folder.get().getFolderId());
            return Optional.ofNullable(folder.get().getFolderId());
        } catch (MailApiException | ApiRequestException e) {
            log.error("Exception getting folders: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Priority: a folder named "Inbox" (any case), then a system folder or the well-known
     * inbox id, then whatever came first.
     */
    static Optional<MailFolder> selectFolder(List<MailFolder> folders) {
        for (MailFolder folder : folders) {
            String name = folder.getFolderName() == null ? "" : folder.getFolderName().toLowerCase(Locale.ROOT);
            if (INBOX_NAMES.contains(name)) {
                return Optional.of(folder);
            }
        }
        for (MailFolder folder : folders) {
            if (folder.isSystemFolder() || WELL_KNOWN_INBOX_ID.equals(folder.getFolderId())) {
                return Optional.of(folder);
            }
        }
        return folders.stream().findFirst();
    }
}
