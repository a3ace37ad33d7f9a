package zoho.contacts.app.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AuthorizationCodeListenerTest {

    private final AuthorizationCodeListener listener = new AuthorizationCodeListener();

    @Test
    void await_ShouldReturnCodeDeliveredFromAnotherThread() throws Exception {
        // Given
        listener.begin();

        // When
        CompletableFuture<Boolean> delivered = CompletableFuture.supplyAsync(() -> listener.complete("code-123"));

        // Then
        assertEquals("code-123", listener.await(Duration.ofSeconds(5)));
        assertTrue(delivered.get(5, TimeUnit.SECONDS));
        assertFalse(listener.isAwaiting());
    }

    @Test
    void complete_ShouldAcceptOnlyFirstCallback() {
        listener.begin();

        assertTrue(listener.complete("first"));
        assertFalse(listener.complete("second"));
        assertEquals("first", listener.await(Duration.ofMillis(10)));
    }

    @Test
    void complete_BeforeBegin_ShouldBeRejected() {
        assertFalse(listener.isAwaiting());
        assertFalse(listener.complete("early"));
    }

    @Test
    void await_WithErrorCallback_ShouldThrowAuthException() {
        listener.begin();
        listener.fail("access_denied");

        AuthException exception = assertThrows(AuthException.class, () -> listener.await(Duration.ofSeconds(1)));
        assertTrue(exception.getMessage().contains("access_denied"));
    }

    @Test
    void await_WithoutCallback_ShouldTimeOut() {
        listener.begin();

        AuthException exception = assertThrows(AuthException.class, () -> listener.await(Duration.ofMillis(50)));
        assertTrue(exception.getMessage().contains("Timeout"));
        assertFalse(listener.isAwaiting());
    }

    @Test
    void await_BeforeBegin_ShouldThrowIllegalState() {
        assertThrows(IllegalStateException.class, () -> listener.await(Duration.ofMillis(10)));
    }
}
