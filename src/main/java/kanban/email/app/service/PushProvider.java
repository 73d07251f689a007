package kanban.email.app.service;

import kanban.email.app.model.PushNotification;

import java.util.List;

/**
 * Device push transport.
 */
public interface PushProvider {

    /** Used when no push credentials are configured. */
    PushProvider DISABLED = new PushProvider() {
        @Override
        public List<String> sendToDevices(List<String> tokens, PushNotification notification) {
            return List.of();
        }

        @Override
        public boolean isEnabled() {
            return false;
        }
    };

    /**
     * Attempts delivery to every token once.
     *
     * @return the tokens the provider rejected as permanently invalid
     * @throws PushDeliveryException if the call as a whole failed or timed out
     */
    List<String> sendToDevices(List<String> tokens, PushNotification notification);

    default boolean isEnabled() {
        return true;
    }
}
