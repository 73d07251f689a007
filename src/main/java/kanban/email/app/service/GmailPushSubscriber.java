package kanban.email.app.service;

import com.google.api.gax.batching.FlowControlSettings;
import com.google.api.gax.rpc.NotFoundException;
import com.google.cloud.pubsub.v1.AckReplyConsumer;
import com.google.cloud.pubsub.v1.MessageReceiver;
import com.google.cloud.pubsub.v1.Subscriber;
import com.google.cloud.pubsub.v1.SubscriptionAdminClient;
import com.google.cloud.pubsub.v1.TopicAdminClient;
import com.google.pubsub.v1.ProjectSubscriptionName;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.PushConfig;
import com.google.pubsub.v1.TopicName;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pulls Gmail watch notifications from Pub/Sub and hands them to {@link GmailChangeEventConsumer}.
 * Without a configured project, or when the topic does not exist, it logs and stays idle.
 */
@Slf4j
@Component
public class GmailPushSubscriber {
    static final int ACK_DEADLINE_SECONDS = 10;

    private final GmailChangeEventConsumer consumer;

    @Value("${gmail.pubsub.project-id:}")
    private String projectId;

    @Value("${gmail.pubsub.topic:gmail-notifications}")
    private String topic;

    @Value("${gmail.pubsub.max-outstanding-messages:100}")
    private long maxOutstandingMessages;

    private volatile Subscriber subscriber;

    public GmailPushSubscriber(GmailChangeEventConsumer consumer) {
        this.consumer = consumer;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (projectId == null || projectId.isBlank()) {
            log.warn("gmail.pubsub.project-id is not set, Gmail push notifications are disabled");
            return;
        }
        try {
            ProjectSubscriptionName subscriptionName = ensureSubscription();
            if (subscriptionName == null) {
                return;
            }
            Subscriber created = Subscriber.newBuilder(subscriptionName, receiver())
                .setFlowControlSettings(FlowControlSettings.newBuilder()
                    .setMaxOutstandingElementCount(maxOutstandingMessages)
                    .build())
                .build();
            created.startAsync().awaitRunning();
            subscriber = created;
            log.info("Listening for Gmail notifications on {}", subscriptionName);
        } catch (Exception e) {
            log.error("Failed to start Gmail notification subscriber: {}", e.getMessage(), e);
        }
    }

    MessageReceiver receiver() {
        return (PubsubMessage message, AckReplyConsumer reply) -> {
            try {
                consumer.handle(message.getData().toStringUtf8());
            } catch (RuntimeException e) {
                log.error("Failed to handle Gmail notification {}: {}", message.getMessageId(), e.getMessage(), e);
            } finally {
                // Redelivery would only be dropped by the dedup check
                reply.ack();
            }
        };
    }

    /**
     * Creates {@code <topic>-sub} if it is missing.
     *
     * @return the subscription, or null when the topic does not exist
     */
    private ProjectSubscriptionName ensureSubscription() throws IOException {
        TopicName topicName = TopicName.of(projectId, topic);
        ProjectSubscriptionName subscriptionName = ProjectSubscriptionName.of(projectId, topic + "-sub");

        try (TopicAdminClient topicAdmin = TopicAdminClient.create()) {
            topicAdmin.getTopic(topicName);
        } catch (NotFoundException e) {
            log.warn("Pub/Sub topic {} does not exist, Gmail push notifications are disabled", topicName);
            return null;
        }

        try (SubscriptionAdminClient subscriptionAdmin = SubscriptionAdminClient.create()) {
            try {
                subscriptionAdmin.getSubscription(subscriptionName.toString());
            } catch (NotFoundException e) {
                log.info("Creating Pub/Sub subscription {}", subscriptionName);
                subscriptionAdmin.createSubscription(subscriptionName.toString(), topicName,
                    PushConfig.getDefaultInstance(), ACK_DEADLINE_SECONDS);
            }
        }
        return subscriptionName;
    }

    public boolean isRunning() {
        return subscriber != null && subscriber.isRunning();
    }

    @PreDestroy
    public void stop() {
        Subscriber running = subscriber;
        if (running == null) {
            return;
        }
        log.info("Stopping Gmail notification subscriber");
        try {
            running.stopAsync().awaitTerminated(30, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Gmail notification subscriber did not stop within 30s");
        }
        subscriber = null;
    }
}
