package kanban.email.app.service;

import com.google.firebase.messaging.BatchResponse;
import com.google.firebase.messaging.FirebaseMessaging;
import com.google.firebase.messaging.FirebaseMessagingException;
import com.google.firebase.messaging.MessagingErrorCode;
import com.google.firebase.messaging.MulticastMessage;
import com.google.firebase.messaging.SendResponse;
import kanban.email.app.model.PushNotification;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Firebase Cloud Messaging transport. Messages are data-only so the client decides how to display them.
 */
@Slf4j
public class FirebasePushProvider implements PushProvider {
    // FCM rejects multicast batches above this size
    static final int MAX_TOKENS_PER_BATCH = 500;

    // INVALID_ARGUMENT is left out: FCM also returns it for an oversized or malformed message
    private static final Set<MessagingErrorCode> PERMANENT_ERRORS = EnumSet.of(
        MessagingErrorCode.UNREGISTERED,
        MessagingErrorCode.SENDER_ID_MISMATCH);

    private final FirebaseMessaging messaging;
    private final long timeoutSeconds;

    public FirebasePushProvider(FirebaseMessaging messaging, long timeoutSeconds) {
        this.messaging = messaging;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public List<String> sendToDevices(List<String> tokens, PushNotification notification) {
        List<String> invalidTokens = new ArrayList<>();
        if (tokens == null || tokens.isEmpty()) {
            return invalidTokens;
        }

        Map<String, String> data = new HashMap<>(notification.getData());
        data.put("title", notification.getTitle() != null ? notification.getTitle() : "");
        data.put("body", notification.getBody() != null ? notification.getBody() : "");

        for (int i = 0; i < tokens.size(); i += MAX_TOKENS_PER_BATCH) {
            List<String> batch = tokens.subList(i, Math.min(i + MAX_TOKENS_PER_BATCH, tokens.size()));
            invalidTokens.addAll(sendBatch(batch, data));
        }
        return invalidTokens;
    }

    private List<String> sendBatch(List<String> batch, Map<String, String> data) {
        MulticastMessage message = MulticastMessage.builder()
            .addAllTokens(batch)
            .putAllData(data)
            .build();

        BatchResponse response;
        try {
            response = messaging.sendEachForMulticastAsync(message).get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PushDeliveryException("Interrupted while sending FCM multicast", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new PushDeliveryException("FCM multicast failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new PushDeliveryException("FCM multicast timed out after " + timeoutSeconds + "s", e);
        }

        log.info("FCM multicast sent: {} success, {} failures", response.getSuccessCount(), response.getFailureCount());

        List<String> invalid = new ArrayList<>();
        List<SendResponse> responses = response.getResponses();
        for (int i = 0; i < responses.size(); i++) {
            SendResponse sendResponse = responses.get(i);
            if (sendResponse.isSuccessful()) {
                continue;
            }
            FirebaseMessagingException error = sendResponse.getException();
            MessagingErrorCode code = error != null ? error.getMessagingErrorCode() : null;
            if (code != null && PERMANENT_ERRORS.contains(code)) {
                invalid.add(batch.get(i));
            } else {
                log.warn("Transient FCM failure for token {}: {}", abbreviate(batch.get(i)),
                        error != null ? error.getMessage() : "unknown error");
            }
        }
        return invalid;
    }

    static String abbreviate(String token) {
        return token.length() <= 20 ? token : token.substring(0, 20) + "...";
    }
}
