package zoho.contacts.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import zoho.contacts.app.config.ExtractorProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window limiter for the mail API.
 *
 * Two layers: no more than {@code requestsPerMinute - safetyMargin} admissions in any
 * trailing 60 seconds, and at least {@code minDelay} between consecutive admissions.
 * Admission blocks the caller; there is a single caller per run, so ordering is call order.
 */
@Slf4j
@Component
public class ApiRateLimiter {
    static final Duration WINDOW = Duration.ofSeconds(60);

    private final int threshold;
    private final long minDelayMs;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Deque<Instant> window = new ArrayDeque<>();
    private Instant lastAdmission;

    public ApiRateLimiter(ExtractorProperties properties, Clock clock, Sleeper sleeper) {
        ExtractorProperties.RateLimit limits = properties.getRateLimit();
        this.threshold = Math.max(1, limits.getRequestsPerMinute() - limits.getSafetyMargin());
        this.minDelayMs = limits.getMinDelay().toMillis();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until one more request may be issued, then records it.
     *
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    public synchronized void admit() throws InterruptedException {
        Instant now = clock.instant();
        prune(now);

        while (window.size() >= threshold) {
            Instant oldest = window.peekFirst();
            long waitMs = Duration.between(now, oldest.plus(WINDOW)).toMillis();
            if (waitMs > 0) {
                log.info("Rate limit approaching, waiting {} seconds...", String.format("%.1f", waitMs / 1000.0));
                sleeper.sleep(waitMs);
            }
            now = clock.instant();
            // Only what has left the window; requests still inside it count against the ceiling
            prune(now);
        }

        if (minDelayMs > 0 && lastAdmission != null) {
            long sinceLastMs = Duration.between(lastAdmission, now).toMillis();
            if (sinceLastMs < minDelayMs) {
                sleeper.sleep(minDelayMs - sinceLastMs);
                now = clock.instant();
            }
        }

        window.addLast(now);
        lastAdmission = now;
        log.debug("Request admitted ({}/{} in window)", window.size(), threshold);
    }

    public synchronized int getCurrentLoad() {
        prune(clock.instant());
        return window.size();
    }

    public int getThreshold() {
        return threshold;
    }

    private void prune(Instant now) {
        Instant windowStart = now.minus(WINDOW);
        while (!window.isEmpty() && !window.peekFirst().isAfter(windowStart)) {
            window.pollFirst();
        }
    }
}
