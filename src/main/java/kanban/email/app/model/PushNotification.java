package kanban.email.app.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Device push payload. Sent data-only; {@code title} and {@code body} are copied into
 * the data map so the client service worker can render them.
 */
@Value
@Builder
public class PushNotification {
    String title;
    String body;
    @Singular("data")
    Map<String, String> data;
}
