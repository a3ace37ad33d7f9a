package zoho.contacts.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import zoho.contacts.app.entity.MailAccount;
import zoho.contacts.app.entity.MailFolder;
import zoho.contacts.app.entity.MessagePage;

import java.util.List;
import java.util.Optional;

/**
 * Interface for the mail API operations the extractor needs.
 * This abstraction keeps pagination and aggregation testable without HTTP.
 */
public interface MailApiService {
    /**
     * Look up the mailbox account the token belongs to.
     * @return the first account, or empty if the API lists none or the call failed
     */
    Optional<MailAccount> getPrimaryAccount();

    /**
     * List the account's folders.
     * @throws MailApiException if the API does not answer 200
     */
    List<MailFolder> listFolders(String accountId);

    /**
     * Fetch one page of a folder's messages.
     * @param start zero-based index of the first message
     * @param limit page size
     * @throws MailApiException if the API does not answer 200
     */
    MessagePage listFolderMessages(String accountId, String folderId, int start, int limit);

    /**
     * Fetch one page of messages without a folder filter.
     * @throws MailApiException if the API does not answer 200
     */
    MessagePage searchMessages(String accountId, int start, int limit);

    /**
     * Fetch the full record of a single message.
     * @return the message's {@code data} object, or empty if it could not be fetched
     */
    Optional<JsonNode> getMessageDetails(String accountId, String messageId);
}
