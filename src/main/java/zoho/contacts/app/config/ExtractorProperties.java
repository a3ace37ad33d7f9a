package zoho.contacts.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Typed configuration for the extractor, bound from the {@code zoho.*} properties.
 * Client credentials come from {@code ZOHO_CLIENT_ID} / {@code ZOHO_CLIENT_SECRET}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "zoho")
public class ExtractorProperties {

    @NotBlank(message = "Please set ZOHO_CLIENT_ID (zoho.client-id)")
    private String clientId;

    @NotBlank(message = "Please set ZOHO_CLIENT_SECRET (zoho.client-secret)")
    private String clientSecret;

    @NotBlank
    private String redirectUri = "http://localhost:5000/oauth/callback";

    @NotBlank
    private String accountsUrl = "https://accounts.zoho.in";

    @NotBlank
    private String apiBaseUrl = "https://mail.zoho.in/api";

    @NotBlank
    private String scopes = "ZohoMail.messages.READ,ZohoMail.folders.READ,ZohoMail.accounts.READ";

    @Valid
    private final Auth auth = new Auth();

    @Valid
    private final RateLimit rateLimit = new RateLimit();

    @Valid
    private final Request request = new Request();

    @Valid
    private final Pagination pagination = new Pagination();

    @Valid
    private final Attachments attachments = new Attachments();

    @Valid
    private final Output output = new Output();

    @Data
    public static class Auth {
        // Subtracted from expires_in so a token is refreshed before the server rejects it
        @NotNull
        private Duration expirySafetyMargin = Duration.ofSeconds(300);

        @NotNull
        private Duration defaultExpiresIn = Duration.ofSeconds(3600);

        @NotNull
        private Duration callbackTimeout = Duration.ofSeconds(300);
    }

    @Data
    public static class RateLimit {
        @Min(1)
        private int requestsPerMinute = 40;

        @Min(0)
        private int safetyMargin = 5;

        @NotNull
        private Duration minDelay = Duration.ofMillis(1200);
    }

    @Data
    public static class Request {
        @Min(0)
        private int maxRetries = 3;

        @NotNull
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Pagination {
        @Min(1)
        private int pageSize = 50;

        @Min(1)
        private int maxMessages = 5000;

        @NotNull
        private Duration batchDelay = Duration.ofMillis(1000);

        @Min(1)
        private int progressEveryPages = 5;
    }

    @Data
    public static class Attachments {
        private boolean enabled = true;

        @NotNull
        private DataSize maxSize = DataSize.ofMegabytes(10);

        private Set<String> allowedExtensions = new LinkedHashSet<>(List.of(
                "pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx", "txt", "csv",
                "zip", "rar", "jpg", "jpeg", "png", "gif"));

        @Min(1)
        private int failureThreshold = 1;
    }

    @Data
    public static class Output {
        @NotBlank
        private String directory = "zoho_email_extraction";
    }
}
