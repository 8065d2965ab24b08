package it.aw.regmetrics.registry;

/**
 * Feed agencies.json mancante (anche dopo il tentativo di download) o non interpretabile.
 */
public class ReferenceFeedException extends RuntimeException {

    public ReferenceFeedException(String message) {
        super(message);
    }

    public ReferenceFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
