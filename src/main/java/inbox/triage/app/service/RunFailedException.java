package inbox.triage.app.service;

/**
 * Unrecoverable failure of a whole run (fetch, aggregation or report delivery).
 */
public class RunFailedException extends RuntimeException {
    public RunFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public RunFailedException(String message) {
        super(message);
    }
}
