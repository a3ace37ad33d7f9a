package zoho.contacts.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import zoho.contacts.app.entity.ApiResponse;
import zoho.contacts.app.entity.MailAccount;
import zoho.contacts.app.entity.MailFolder;
import zoho.contacts.app.entity.MessagePage;
import zoho.contacts.app.entity.RawMessage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class ZohoMailService implements MailApiService {
    private final ApiRequestExecutor requestExecutor;
    private final ObjectMapper objectMapper;

    public ZohoMailService(ApiRequestExecutor requestExecutor, ObjectMapper objectMapper) {
        this.requestExecutor = requestExecutor;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<MailAccount> getPrimaryAccount() {
        log.info("Fetching account information...");
        ApiResponse response = requestExecutor.get("accounts");
        if (!response.isOk()) {
            log.error("Failed to get account info: {} - {}", response.getStatusCode(), response.bodyAsString());
            return Optional.empty();
        }

        JsonNode data = readJson(response).path("data");
        if (!data.isArray() || data.isEmpty()) {
            log.error("No accounts found in response");
            return Optional.empty();
        }

        JsonNode first = data.get(0);
        MailAccount account = new MailAccount(first.path("accountId").asText(), first.path("displayName").asText("Unknown"));
        log.info("Account ID retrieved: {} ({})", account.getAccountId(), account.getDisplayName());
        return Optional.of(account);
    }

    @Override
    public List<MailFolder> listFolders(String accountId) {
        log.info("Fetching folders...");
        ApiResponse response = requestExecutor.get("accounts/" + accountId + "/folders");
        if (!response.isOk()) {
            throw new MailApiException("Failed to get folders: " + response.bodyAsString(), response.getStatusCode());
        }

        List<MailFolder> folders = new ArrayList<>();
        for (JsonNode folder : readJson(response).path("data")) {
            folders.add(new MailFolder(
                    folder.path("folderId").asText(null),
                    folder.path("folderName").asText(""),
                    folder.path("systemFolder").asBoolean(false)));
        }
        log.debug("Folders response: {} folders", folders.size());
        return folders;
    }

    @Override
    public MessagePage listFolderMessages(String accountId, String folderId, int start, int limit) {
        Map<String, String> params = pageParams(start, limit);
        params.put("folderId", folderId);

        ApiResponse response = requestExecutor.get("accounts/" + accountId + "/messages/view", params);
        if (!response.isOk()) {
            throw new MailApiException("Failed to fetch messages batch: " + response.bodyAsString(), response.getStatusCode());
        }
        MessagePage page = toPage(readJson(response), start);
        log.info("Fetched batch: {} messages (starting from {})", page.size(), start);
        return page;
    }

    @Override
    public MessagePage searchMessages(String accountId, int start, int limit) {
        ApiResponse response = requestExecutor.get("accounts/" + accountId + "/messages/search", pageParams(start, limit));
        if (!response.isOk()) {
            throw new MailApiException("Failed to fetch messages via search: " + response.bodyAsString(), response.getStatusCode());
        }
        MessagePage page = toPage(readJson(response), start);
        log.info("Fetched batch via search: {} messages (starting from {})", page.size(), start);
        return page;
    }

    @Override
    public Optional<JsonNode> getMessageDetails(String accountId, String messageId) {
        ApiResponse response = requestExecutor.get("accounts/" + accountId + "/messages/" + messageId);
        if (!response.isOk()) {
            return Optional.empty();
        }
        JsonNode data = readJson(response).path("data");
        return data.isObject() ? Optional.of(data) : Optional.empty();
    }

    private static Map<String, String> pageParams(int start, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("start", String.valueOf(start));
        params.put("limit", String.valueOf(limit));
        return params;
    }

    private MessagePage toPage(JsonNode body, int start) {
        List<RawMessage> messages = new ArrayList<>();
        for (JsonNode entry : body.path("data")) {
            if (entry.isObject()) {
                messages.add(RawMessage.inline(entry));
            } else if (entry.isTextual() || entry.isNumber()) {
                messages.add(RawMessage.reference(entry.asText()));
            } else {
                log.error("Unexpected message entry type: {}", entry.getNodeType());
            }
        }
        int total = body.path("total").asInt(0);
        if (total > 0) {
            log.info("Total messages available: {}", total);
        }
        return new MessagePage(start, messages, total);
    }

    private JsonNode readJson(ApiResponse response) {
        try {
            JsonNode node = objectMapper.readTree(response.getBody());
            return node == null ? MissingNode.getInstance() : node;
        } catch (IOException e) {
            throw new MailApiException("Unparseable response body: " + e.getMessage(), response.getStatusCode());
        }
    }
}
