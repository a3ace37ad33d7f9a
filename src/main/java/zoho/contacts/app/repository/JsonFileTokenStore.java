package zoho.contacts.app.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import zoho.contacts.app.config.ExtractorProperties;
import zoho.contacts.app.entity.Credential;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Stores the credential as {@code tokens.json} in the output directory.
 * Instants are written as epoch seconds.
 */
@Slf4j
@Repository
public class JsonFileTokenStore implements TokenStore {
    static final String TOKEN_FILE = "tokens.json";

    private final Path tokenFile;
    private final ObjectMapper objectMapper;

    @Autowired
    public JsonFileTokenStore(ExtractorProperties properties) {
        this(Path.of(properties.getOutput().getDirectory()).resolve(TOKEN_FILE));
    }

    JsonFileTokenStore(Path tokenFile) {
        this.tokenFile = tokenFile;
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    @Override
    public Optional<Credential> load() {
        if (!Files.exists(tokenFile)) {
            log.info("No token file found at {}", tokenFile);
            return Optional.empty();
        }

        try {
            String content = Files.readString(tokenFile, StandardCharsets.UTF_8).strip();
            if (content.isEmpty()) {
                log.warn("Token file {} is empty", tokenFile);
                discard();
                return Optional.empty();
            }

            Credential credential = objectMapper.readValue(content, Credential.class);
            if (credential.getAccessToken() == null || credential.getAccessToken().isEmpty()) {
                log.warn("No access token found in {}", tokenFile);
                discard();
                return Optional.empty();
            }
            return Optional.of(credential);
        } catch (JsonProcessingException e) {
            log.error("Invalid JSON in token file {}: {}", tokenFile, e.getOriginalMessage());
            discard();
            return Optional.empty();
        } catch (IOException e) {
            log.error("Error loading tokens from {}: {}", tokenFile, e.getMessage(), e);
            return Optional.empty();
        }
    }

    @Override
    public void save(Credential credential) {
        try {
            Path parent = tokenFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(tokenFile.toFile(), credential);
            log.debug("Tokens saved to {}", tokenFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not save tokens to " + tokenFile, e);
        }
    }

    private void discard() {
        try {
            Files.deleteIfExists(tokenFile);
            log.info("Invalid token file deleted");
        } catch (IOException e) {
            log.warn("Could not delete corrupted token file {}: {}", tokenFile, e.getMessage());
        }
    }
}
