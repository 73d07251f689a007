package kanban.email.app.service;

import kanban.email.app.entity.ColumnAssignment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;

/**
 * Interactive board operations: move, snooze, unsnooze and delete.
 */
@Slf4j
@Service
public class KanbanBoardService {
    private final ColumnAssignmentService columnAssignmentService;
    private final LabelSyncService labelSyncService;
    private final Clock clock;

    public KanbanBoardService(ColumnAssignmentService columnAssignmentService,
                              LabelSyncService labelSyncService,
                              Clock clock) {
        this.columnAssignmentService = columnAssignmentService;
        this.labelSyncService = labelSyncService;
        this.clock = clock;
    }

    /**
     * Moves an email to another column. Gmail labels are updated first; if that fails
     * the board is left unchanged.
     *
     * @param sourceColumnId column the client saw the email in; only used when nothing is stored
     */
    public void moveEmail(String userId, String emailId, String targetColumnId, String sourceColumnId) throws IOException {
        if (targetColumnId == null || targetColumnId.isBlank()) {
            throw new IllegalArgumentException("Target column must not be empty");
        }
        if (ColumnAssignment.SNOOZED.equals(targetColumnId)) {
            throw new IllegalArgumentException("Use snoozeEmail to move an email into the snoozed column");
        }
        String stored = columnAssignmentService.getColumn(userId, emailId);
        String source = !stored.isEmpty() ? stored : sourceColumnId;
        labelSyncService.applyForMove(userId, emailId, source, targetColumnId);
        columnAssignmentService.setColumn(userId, emailId, targetColumnId);
        log.info("Moved email {} of user {} from '{}' to '{}'", emailId, userId, source, targetColumnId);
    }

    /**
     * Hides an email until {@code until}. The column it came from is remembered for the wake-up.
     */
    public void snoozeEmail(String userId, String emailId, Instant until) {
        if (until == null || !until.isAfter(clock.instant())) {
            throw new IllegalArgumentException("Snooze time must be in the future");
        }
        String current = columnAssignmentService.getColumn(userId, emailId);
        String previous = current.isEmpty() || ColumnAssignment.SNOOZED.equals(current)
            ? ColumnAssignment.INBOX
            : current;
        columnAssignmentService.snoozeTo(userId, emailId, previous, until);
        log.info("Snoozed email {} of user {} until {}, will return to '{}'", emailId, userId, until, previous);
    }

    /**
     * Returns a snoozed email to the column it came from ahead of its wake time.
     *
     * @return the column the email was restored to
     */
    public String unsnoozeEmail(String userId, String emailId) {
        String previous = columnAssignmentService.getPreviousColumn(userId, emailId);
        columnAssignmentService.setColumn(userId, emailId, previous);
        log.info("Unsnoozed email {} of user {} back to '{}'", emailId, userId, previous);
        return previous;
    }

    public void deleteEmail(String userId, String emailId) {
        columnAssignmentService.removeMapping(userId, emailId);
    }
}
