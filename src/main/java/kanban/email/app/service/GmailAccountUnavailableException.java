package kanban.email.app.service;

/**
 * The user's Gmail account cannot be called: none is connected, or its credentials are no longer usable.
 */
public class GmailAccountUnavailableException extends RuntimeException {
    public GmailAccountUnavailableException(String message) {
        super(message);
    }

    public GmailAccountUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
