package zoho.contacts.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag for the page loop. Raised from the shutdown hook on Ctrl-C;
 * the loop finishes its current page and returns what it has.
 */
@Slf4j
@Component
public class ExtractionCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Extraction interrupted by user, stopping after the current page");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
