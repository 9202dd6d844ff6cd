package mail.classifier.app.service.extraction;

/**
 * Backend output could not be turned into a JSON object after every recovery attempt.
 */
public class MalformedOutputException extends RuntimeException {
    public MalformedOutputException(String message, Throwable cause) {
        super(message, cause);
    }

    public MalformedOutputException(String message) {
        super(message);
    }
}
