package kanban.email.app.service;

import kanban.email.app.model.PushNotification;

import java.util.List;
import java.util.Map;

/**
 * Single entry point the background workers use to reach a user: open client
 * connections and registered devices.
 */
public interface NotificationDispatcher {

    /**
     * Best-effort fan-out to the user's open connections. A no-op when none are open.
     */
    void notifyUser(String userId, String eventType, Map<String, ?> payload);

    /**
     * Attempts every token once, without retries.
     *
     * @return tokens the provider reported as permanently invalid; the caller prunes them
     */
    List<String> pushToDevices(List<String> tokens, PushNotification notification);

    boolean isPushEnabled();
}
