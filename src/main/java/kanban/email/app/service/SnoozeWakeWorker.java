package kanban.email.app.service;

import kanban.email.app.model.SnoozedAssignment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Returns snoozed emails to their previous column once the wake time has passed.
 * <p>
 * Each tick handles every overdue row, so a missed tick only delays the wake-up.
 * A row the user moved or re-snoozed after the scan is left alone.
 */
@Slf4j
@Component
public class SnoozeWakeWorker {
    static final String EVENT_EMAIL_UPDATE = "email_update";

    private final ColumnAssignmentService columnAssignmentService;
    private final LabelSyncService labelSyncService;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    public SnoozeWakeWorker(ColumnAssignmentService columnAssignmentService,
                            LabelSyncService labelSyncService,
                            NotificationDispatcher notificationDispatcher,
                            Clock clock) {
        this.columnAssignmentService = columnAssignmentService;
        this.labelSyncService = labelSyncService;
        this.notificationDispatcher = notificationDispatcher;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${kanban.snooze.poll-interval-ms:60000}", initialDelay = 0)
    public void checkSnoozedEmails() {
        wakeDueEmails();
    }

    /**
     * @return number of emails woken in this pass
     */
    public int wakeDueEmails() {
        Instant now = clock.instant();
        List<SnoozedAssignment> snoozed;
        try {
            snoozed = columnAssignmentService.listAllSnoozed();
        } catch (Exception e) {
            log.error("Failed to list snoozed emails: {}", e.getMessage(), e);
            return 0;
        }

        int woken = 0;
        for (SnoozedAssignment assignment : snoozed) {
            if (!assignment.isDue(now)) {
                continue;
            }
            try {
                if (wake(assignment, now)) {
                    woken++;
                }
            } catch (Exception e) {
                log.error("Failed to wake email {} of user {}: {}",
                    assignment.getEmailId(), assignment.getUserId(), e.getMessage(), e);
            }
        }
        if (woken > 0) {
            log.info("Woke {} snoozed email(s)", woken);
        }
        return woken;
    }

    private boolean wake(SnoozedAssignment assignment, Instant now) {
        String userId = assignment.getUserId();
        String emailId = assignment.getEmailId();
        String target = assignment.getPreviousColumnId();

        if (!columnAssignmentService.wakeIfStillSnoozed(userId, emailId, target, now)) {
            log.debug("Email {} of user {} changed since the scan, not waking", emailId, userId);
            return false;
        }

        try {
            labelSyncService.applyColumnPolicy(userId, emailId, target);
        } catch (Exception e) {
            log.warn("Woke email {} but label sync to '{}' failed: {}", emailId, target, e.getMessage());
        }

        notificationDispatcher.notifyUser(userId, EVENT_EMAIL_UPDATE, Map.of(
            "email_id", emailId,
            "action", "unsnooze",
            "column", target));
        log.debug("Woke email {} of user {} into '{}'", emailId, userId, target);
        return true;
    }
}
