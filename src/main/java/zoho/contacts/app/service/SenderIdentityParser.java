package zoho.contacts.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import zoho.contacts.app.entity.SenderIdentity;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns one message record into a normalized sender, or nothing if no valid address
 * can be recovered.
 *
 * Name precedence: {@code sender.name} (or a plain {@code sender} string), then
 * {@code fromName}, then the display name of a {@code Name <address>} header, then a
 * title-cased local part of the address.
 */
@Slf4j
@Component
public class SenderIdentityParser {
    static final Pattern EMAIL_PATTERN = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    public Optional<SenderIdentity> parse(JsonNode message) {
        String fromAddress = text(message, "fromAddress");
        String name = senderName(message.get("sender"));
        if (name.isEmpty()) {
            name = text(message, "fromName");
        }

        String email = fromAddress;
        if (fromAddress.contains("<")) {
            // Format: "Name <email@domain.com>"
            try {
                InternetAddress parsed = new InternetAddress(fromAddress, false);
                email = parsed.getAddress() == null ? "" : parsed.getAddress();
                if (name.isEmpty() && parsed.getPersonal() != null) {
                    name = stripQuotes(parsed.getPersonal());
                }
            } catch (AddressException e) {
                log.debug("Unparseable sender header '{}': {}", fromAddress, e.getMessage());
                return Optional.empty();
            }
        }
        email = email.trim().toLowerCase(Locale.ROOT);

        if (!isValidEmail(email)) {
            log.debug("Discarding message with invalid sender address '{}'", fromAddress);
            return Optional.empty();
        }
        if (name.isEmpty()) {
            name = nameFromLocalPart(email);
        }

        return Optional.of(SenderIdentity.builder()
                .email(email)
                .name(name.isEmpty() ? SenderIdentity.UNKNOWN_NAME : name)
                .subject(text(message, "subject"))
                .receivedTime(timestamp(message.get("receivedTime")))
                .messageId(messageId(message))
                .hasAttachment(flag(message.get("hasAttachment")))
                .build());
    }

    public static boolean isValidEmail(String email) {
        return email != null && EMAIL_PATTERN.matcher(email).matches();
    }

    /**
     * "jane.doe_smith" becomes "Jane Doe Smith".
     */
    static String nameFromLocalPart(String email) {
        String local = email.substring(0, email.indexOf('@')).replace('.', ' ').replace('_', ' ');
        StringBuilder titled = new StringBuilder(local.length());
        boolean startOfWord = true;
        for (char c : local.toCharArray()) {
            if (Character.isLetter(c)) {
                titled.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                titled.append(c);
                startOfWord = true;
            }
        }
        return titled.toString().trim();
    }

    private static String senderName(JsonNode sender) {
        if (sender == null || sender.isNull()) {
            return "";
        }
        if (sender.isObject()) {
            return sender.path("name").asText("").trim();
        }
        return sender.isTextual() ? sender.asText().trim() : "";
    }

    private static String messageId(JsonNode message) {
        String id = text(message, "messageId");
        if (id.isEmpty()) {
            id = text(message, "id");
        }
        return id.isEmpty() ? null : id;
    }

    private static Long timestamp(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asLong();
        }
        try {
            return Long.parseLong(value.asText().trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric receivedTime '{}'", value.asText());
            return null;
        }
    }

    private static boolean flag(JsonNode value) {
        if (value == null || value.isNull()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        String text = value.asText().trim();
        return "true".equalsIgnoreCase(text) || "1".equals(text);
    }

    private static String text(JsonNode message, String field) {
        JsonNode value = message.get(field);
        return value == null || value.isNull() ? "" : value.asText().trim();
    }

    private static String stripQuotes(String value) {
        String stripped = value.trim();
        while (stripped.startsWith("\"")) {
            stripped = stripped.substring(1);
        }
        while (stripped.endsWith("\"")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        return stripped.trim();
    }
}
