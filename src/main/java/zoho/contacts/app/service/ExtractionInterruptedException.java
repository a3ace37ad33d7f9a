package zoho.contacts.app.service;

/**
 * Thrown when a blocking wait is interrupted. The interrupt flag is restored before throwing.
 */
public class ExtractionInterruptedException extends RuntimeException {
    public ExtractionInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
