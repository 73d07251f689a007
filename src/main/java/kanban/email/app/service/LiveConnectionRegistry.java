package kanban.email.app.service;

/**
 * Open client connections (SSE streams) per user.
 */
public interface LiveConnectionRegistry {

    /**
     * Sends an event to every open connection of the user. Fire-and-forget:
     * nothing is buffered for users without an open connection.
     */
    void send(String userId, String eventType, Object payload);

    int connectionCount(String userId);
}
