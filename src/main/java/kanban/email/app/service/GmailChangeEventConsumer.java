package kanban.email.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import kanban.email.app.entity.GmailAccount;
import kanban.email.app.model.GmailNotification;
import kanban.email.app.model.MailSummary;
import kanban.email.app.model.PushNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns Gmail mailbox-change events into live updates and device pushes.
 * <p>
 * {@link #handle(String)} does the cheap part on the caller's thread (decode, user lookup,
 * dedup, live update) so the message can be acknowledged right after. Enrichment and
 * device push run on the bounded notification executor.
 */
@Slf4j
@Service
public class GmailChangeEventConsumer {
    static final String EVENT_EMAIL_UPDATE = "email_update";
    static final String FALLBACK_TITLE = "New email";
    static final String FALLBACK_BODY = "You have new mail in your inbox";
    static final String NO_SUBJECT = "(No subject)";
    private static final int MAX_BODY_LENGTH = 100;

    private final ObjectMapper objectMapper;
    private final GmailAccountService gmailAccountService;
    private final HistoryDedupTracker historyDedupTracker;
    private final NotificationDispatcher notificationDispatcher;
    private final PushTokenService pushTokenService;
    private final GmailApiService gmailApiService;
    private final IndexingQueue indexingQueue;
    private final TaskExecutor notificationExecutor;
    private final Clock clock;

    public GmailChangeEventConsumer(ObjectMapper objectMapper,
                                    GmailAccountService gmailAccountService,
                                    HistoryDedupTracker historyDedupTracker,
                                    NotificationDispatcher notificationDispatcher,
                                    PushTokenService pushTokenService,
                                    GmailApiService gmailApiService,
                                    IndexingQueue indexingQueue,
                                    @Qualifier("notificationExecutor") TaskExecutor notificationExecutor,
                                    Clock clock) {
        this.objectMapper = objectMapper;
        this.gmailAccountService = gmailAccountService;
        this.historyDedupTracker = historyDedupTracker;
        this.notificationDispatcher = notificationDispatcher;
        this.pushTokenService = pushTokenService;
        this.gmailApiService = gmailApiService;
        this.indexingQueue = indexingQueue;
        this.notificationExecutor = notificationExecutor;
        this.clock = clock;
    }

    /**
     * Handles one Pub/Sub payload. Never throws; the caller acknowledges the message either way.
     *
     * @return true if the event was new and fanned out
     */
    public boolean handle(String payload) {
        GmailNotification event;
        try {
            event = objectMapper.readValue(payload, GmailNotification.class);
        } catch (JsonProcessingException e) {
            log.warn("Dropping undecodable Gmail notification: {}", e.getOriginalMessage());
            return false;
        }
        if (event.getEmailAddress() == null || event.getEmailAddress().isBlank()) {
            log.warn("Dropping Gmail notification without an email address");
            return false;
        }

        Optional<GmailAccount> account;
        try {
            account = gmailAccountService.findAccountByMailbox(event.getEmailAddress());
        } catch (Exception e) {
            log.error("Failed to resolve user for {}: {}", event.getEmailAddress(), e.getMessage(), e);
            return false;
        }
        if (account.isEmpty()) {
            log.debug("No user for mailbox {}, ignoring notification", event.getEmailAddress());
            return false;
        }

        String userId = account.get().getUser().getId();
        if (!historyDedupTracker.tryAdvance(account.get().getUser(), event.getHistoryId())) {
            log.debug("Skipping already handled history id {} for user {}", event.getHistoryId(), userId);
            return false;
        }

        log.info("Mailbox {} changed (history id {})", event.getEmailAddress(), event.getHistoryId());
        notificationDispatcher.notifyUser(userId, EVENT_EMAIL_UPDATE, Map.of(
            "email", event.getEmailAddress(),
            "historyId", event.getHistoryId(),
            "timestamp", clock.instant().getEpochSecond()));

        GmailAccount gmailAccount = account.get();
        try {
            notificationExecutor.execute(() -> pushNewMail(userId, gmailAccount, event.getHistoryId()));
        } catch (TaskRejectedException e) {
            log.warn("Notification executor full, dropping push for user {} (history id {})", userId, event.getHistoryId());
        }
        return true;
    }

    void pushNewMail(String userId, GmailAccount account, long historyId) {
        if (!notificationDispatcher.isPushEnabled()) {
            return;
        }
        try {
            List<String> tokens = pushTokenService.getTokens(userId);
            if (tokens.isEmpty()) {
                log.debug("User {} has no push tokens", userId);
                return;
            }

            MailSummary latest = fetchLatestInboxMessage(account);
            if (latest != null) {
                indexingQueue.enqueue(userId, latest);
            }

            List<String> invalid = notificationDispatcher.pushToDevices(tokens, buildNotification(account.getEmailAddress(), historyId, latest));
            pushTokenService.pruneInvalid(invalid);
        } catch (Exception e) {
            log.error("Failed to push new mail notification to user {}: {}", userId, e.getMessage(), e);
        }
    }

    private MailSummary fetchLatestInboxMessage(GmailAccount account) {
        try {
            List<MailSummary> messages = gmailAccountService.callWithAccessToken(account, accessToken ->
                gmailApiService.fetchLatestMessages(accessToken, account.getEmailAddress(), LabelSyncService.INBOX_LABEL, 1));
            return messages.isEmpty() ? null : messages.get(0);
        } catch (Exception e) {
            log.warn("Could not fetch latest message for {}, sending generic notification: {}",
                account.getEmailAddress(), e.getMessage());
            return null;
        }
    }

    static PushNotification buildNotification(String emailAddress, long historyId, MailSummary latest) {
        PushNotification.PushNotificationBuilder builder = PushNotification.builder()
            .data("type", EVENT_EMAIL_UPDATE)
            .data("email", emailAddress)
            .data("historyId", Long.toString(historyId));
        if (latest == null) {
            return builder
                .title(FALLBACK_TITLE)
                .body(FALLBACK_BODY)
                .data("click_action", "/inbox")
                .build();
        }
        return builder
            .title("Email from " + latest.senderDisplayName())
            .body(subjectLine(latest.getSubject()))
            .data("messageId", latest.getId())
            .data("click_action", "/inbox/" + latest.getId())
            .build();
    }

    static String subjectLine(String subject) {
        if (subject == null || subject.isEmpty()) {
            return NO_SUBJECT;
        }
        if (subject.length() > MAX_BODY_LENGTH) {
            return subject.substring(0, MAX_BODY_LENGTH - 3) + "...";
        }
        return subject;
    }
}
