package kanban.email.app.service;

import kanban.email.app.entity.ReminderTask;
import kanban.email.app.model.PushNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Sends a device push for every task whose reminder time has come.
 * <p>
 * A reminder is attempted at most once: it is marked sent after the attempt
 * whatever the outcome, and immediately when the user has no devices.
 */
@Slf4j
@Component
public class TaskReminderWorker {
    private static final DateTimeFormatter DUE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");
    static final String DEFAULT_BODY = "You have a task to complete";
    // Keeps the FCM data payload well under its 4 KB limit
    static final int MAX_DESCRIPTION_LENGTH = 500;

    private final ReminderTaskService reminderTaskService;
    private final PushTokenService pushTokenService;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;
    private final ZoneId zone;

    public TaskReminderWorker(ReminderTaskService reminderTaskService,
                              PushTokenService pushTokenService,
                              NotificationDispatcher notificationDispatcher,
                              Clock clock,
                              @Value("${kanban.reminder.zone:UTC}") String zone) {
        this.reminderTaskService = reminderTaskService;
        this.pushTokenService = pushTokenService;
        this.notificationDispatcher = notificationDispatcher;
        this.clock = clock;
        this.zone = ZoneId.of(zone);
    }

    @Scheduled(fixedDelayString = "${kanban.reminder.poll-interval-ms:60000}", initialDelay = 0)
    public void checkReminders() {
        if (!notificationDispatcher.isPushEnabled()) {
            log.debug("Push disabled, skipping reminder check");
            return;
        }
        List<ReminderTask> due;
        try {
            due = reminderTaskService.findPendingReminders(clock.instant());
        } catch (Exception e) {
            log.error("Failed to load pending reminders: {}", e.getMessage(), e);
            return;
        }
        if (!due.isEmpty()) {
            log.info("Processing {} due reminder(s)", due.size());
        }
        for (ReminderTask task : due) {
            sendReminder(task);
        }
    }

    void sendReminder(ReminderTask task) {
        List<String> tokens;
        try {
            tokens = pushTokenService.getTokens(task.getUserId());
        } catch (Exception e) {
            // Not marked sent, so the next tick tries again
            log.error("Failed to load push tokens for user {}: {}", task.getUserId(), e.getMessage(), e);
            return;
        }

        if (tokens.isEmpty()) {
            log.debug("User {} has no push tokens, marking reminder {} as sent", task.getUserId(), task.getId());
            markSent(task);
            return;
        }

        try {
            List<String> invalid = notificationDispatcher.pushToDevices(tokens, buildNotification(task));
            pushTokenService.pruneInvalid(invalid);
        } catch (Exception e) {
            log.error("Failed to send reminder {} to user {}: {}", task.getId(), task.getUserId(), e.getMessage(), e);
        }
        markSent(task);
    }

    PushNotification buildNotification(ReminderTask task) {
        String body = task.getDescription() != null && !task.getDescription().isEmpty()
            ? abbreviate(task.getDescription())
            : DEFAULT_BODY;
        if (task.getDueDate() != null) {
            body += "\n📅 Due: " + DUE_FORMAT.format(task.getDueDate().atZone(zone));
        }
        return PushNotification.builder()
            .title(task.getPriority().getMarker() + " Reminder: " + task.getTitle())
            .body(body)
            .data("type", "task_reminder")
            .data("task_id", task.getId())
            .data("priority", task.getPriority().name().toLowerCase())
            .data("click_action", "/tasks")
            .build();
    }

    static String abbreviate(String description) {
        if (description.length() <= MAX_DESCRIPTION_LENGTH) {
            return description;
        }
        return description.substring(0, MAX_DESCRIPTION_LENGTH - 3) + "...";
    }

    private void markSent(ReminderTask task) {
        try {
            reminderTaskService.markReminderSent(task.getId());
        } catch (Exception e) {
            log.error("Failed to mark reminder {} as sent: {}", task.getId(), e.getMessage(), e);
        }
    }
}
