package zoho.contacts.app.service;

/**
 * Blocking pause used for rate-limit waits, retry backoff and inter-page delays.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
}
