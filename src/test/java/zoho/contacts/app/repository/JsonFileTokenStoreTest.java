package zoho.contacts.app.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import zoho.contacts.app.entity.Credential;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileTokenStoreTest {

    @TempDir
    Path tempDir;

    private Path tokenFile;
    private JsonFileTokenStore tokenStore;

    @BeforeEach
    void setUp() {
        tokenFile = tempDir.resolve("out").resolve(JsonFileTokenStore.TOKEN_FILE);
        tokenStore = new JsonFileTokenStore(tokenFile);
    }

    @Test
    void load_WithMissingFile_ShouldReturnEmpty() {
        assertTrue(tokenStore.load().isEmpty());
    }

    @Test
    void save_ThenLoad_ShouldRestoreCredential() {
        // Given
        Credential credential = new Credential();
        credential.setAccessToken("access");
        credential.setRefreshToken("refresh");
        credential.setExpiresAt(Instant.ofEpochSecond(1_714_560_000L));

        // When
        tokenStore.save(credential);
        Optional<Credential> loaded = tokenStore.load();

        // Then
        assertTrue(Files.exists(tokenFile));
        assertTrue(loaded.isPresent());
        assertEquals("access", loaded.get().getAccessToken());
        assertEquals("refresh", loaded.get().getRefreshToken());
        assertEquals(Instant.ofEpochSecond(1_714_560_000L), loaded.get().getExpiresAt());
    }

    @Test
    void save_ShouldUseSnakeCaseFieldNames() throws IOException {
        // Given
        Credential credential = new Credential();
        credential.setAccessToken("access");
        credential.setExpiresAt(Instant.ofEpochSecond(1_714_560_000L));

        // When
        tokenStore.save(credential);

        // Then
        String json = Files.readString(tokenFile);
        assertTrue(json.contains("\"access_token\""));
        assertTrue(json.contains("\"expires_at\" : 1714560000"));
        assertFalse(json.contains("refresh_token"));
    }

    @Test
    void load_WithEpochSecondsWrittenByHand_ShouldParseExpiry() throws IOException {
        // Given
        Files.createDirectories(tokenFile.getParent());
        Files.writeString(tokenFile, "{\"access_token\":\"a\",\"refresh_token\":\"r\",\"expires_at\":1714560000}");

        // When
        Optional<Credential> loaded = tokenStore.load();

        // Then
        assertTrue(loaded.isPresent());
        assertEquals(Instant.ofEpochSecond(1_714_560_000L), loaded.get().getExpiresAt());
    }

    @Test
    void load_WithEmptyFile_ShouldDiscardFile() throws IOException {
        // Given
        Files.createDirectories(tokenFile.getParent());
        Files.writeString(tokenFile, "   ");

        // When
        Optional<Credential> loaded = tokenStore.load();

        // Then
        assertTrue(loaded.isEmpty());
        assertFalse(Files.exists(tokenFile));
    }

    @Test
    void load_WithCorruptFile_ShouldDiscardFile() throws IOException {
        // Given
        Files.createDirectories(tokenFile.getParent());
        Files.writeString(tokenFile, "{\"access_token\": ");

        // When
        Optional<Credential> loaded = tokenStore.load();

        // Then
        assertTrue(loaded.isEmpty());
        assertFalse(Files.exists(tokenFile));
    }

    @Test
    void load_WithoutAccessToken_ShouldDiscardFile() throws IOException {
        // Given
        Files.createDirectories(tokenFile.getParent());
        Files.writeString(tokenFile, "{\"refresh_token\":\"r\"}");

        // When
        Optional<Credential> loaded = tokenStore.load();

        // Then
        assertTrue(loaded.isEmpty());
        assertFalse(Files.exists(tokenFile));
    }
}
