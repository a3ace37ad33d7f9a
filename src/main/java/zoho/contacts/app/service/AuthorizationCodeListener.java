package zoho.contacts.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One-shot hand-off of the authorization code from the callback endpoint to the
 * thread waiting in {@link AuthorizationService}. Only the first callback after
 * {@link #begin()} is accepted.
 */
@Slf4j
@Component
public class AuthorizationCodeListener {
    private volatile CompletableFuture<String> pending;

    public synchronized void begin() {
        pending = new CompletableFuture<>();
    }

    public boolean isAwaiting() {
        CompletableFuture<String> current = pending;
        return current != null && !current.isDone();
    }

    /**
     * @return false if no authorization is in progress or a callback was already received
     */
    public synchronized boolean complete(String code) {
        return isAwaiting() && pending.complete(code);
    }

    public synchronized boolean fail(String error) {
        return isAwaiting() && pending.completeExceptionally(new AuthException("OAuth error: " + error));
    }

    /**
     * Blocks until the callback delivers a code.
     *
     * @throws AuthException on timeout, on an error callback, or if interrupted
     */
    public String await(Duration timeout) {
        CompletableFuture<String> current = pending;
        if (current == null) {
            throw new IllegalStateException("Authorization has not been started");
        }
        try {
            return current.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            current.cancel(false);
            throw new AuthException("Timeout waiting for authorization code after " + timeout.toSeconds() + " seconds", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof AuthException) {
                throw (AuthException) e.getCause();
            }
            throw new AuthException("Authorization failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.cancel(false);
            throw new AuthException("Interrupted while waiting for authorization code", e);
        }
    }
}
