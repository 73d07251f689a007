package kanban.email.app.service;

import kanban.email.app.model.PushNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class DefaultNotificationDispatcher implements NotificationDispatcher {
    private final LiveConnectionRegistry liveConnectionRegistry;
    private final PushProvider pushProvider;

    public DefaultNotificationDispatcher(LiveConnectionRegistry liveConnectionRegistry, PushProvider pushProvider) {
        this.liveConnectionRegistry = liveConnectionRegistry;
        this.pushProvider = pushProvider;
    }

    @Override
    public void notifyUser(String userId, String eventType, Map<String, ?> payload) {
        try {
            liveConnectionRegistry.send(userId, eventType, payload);
        } catch (Exception e) {
            log.warn("Failed to send {} event to user {}: {}", eventType, userId, e.getMessage());
        }
    }

    @Override
    public List<String> pushToDevices(List<String> tokens, PushNotification notification) {
        if (tokens == null || tokens.isEmpty() || !pushProvider.isEnabled()) {
            return List.of();
        }
        try {
            List<String> invalid = pushProvider.sendToDevices(tokens, notification);
            log.info("Push '{}' delivered to {} of {} device(s)", notification.getTitle(),
                    tokens.size() - invalid.size(), tokens.size());
            return invalid;
        } catch (PushDeliveryException e) {
            log.error("Push '{}' to {} device(s) failed: {}", notification.getTitle(), tokens.size(), e.getMessage(), e);
            return List.of();
        }
    }

    @Override
    public boolean isPushEnabled() {
        return pushProvider.isEnabled();
    }
}
