package kanban.email.app.service;

public class PushDeliveryException extends RuntimeException {
    public PushDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
