package kanban.email.app.service;

import kanban.email.app.entity.ColumnAssignment;
import kanban.email.app.model.SnoozedAssignment;
import kanban.email.app.repository.ColumnAssignmentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Persistent mapping of (user, email) to the Kanban column the email sits in.
 * <p>
 * Reads never fail on a missing row: they fall back to {@code ""} or {@code "inbox"}.
 * Writes propagate storage errors.
 */
@Slf4j
@Service
public class ColumnAssignmentService {
    private final ColumnAssignmentRepository repository;
    private final Clock clock;

    public ColumnAssignmentService(ColumnAssignmentRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Moves an email to {@code columnId}, creating the mapping on first use.
     * Leaving the snoozed column clears the wake time.
     */
    @Transactional
    public void setColumn(String userId, String emailId, String columnId) {
        requireColumnId(columnId);
        ColumnAssignment assignment = repository.findByUserIdAndEmailId(userId, emailId)
            .orElseGet(() -> ColumnAssignment.create(userId, emailId));
        assignment.moveTo(columnId);
        repository.save(assignment);
    }

    @Transactional
    public void snoozeTo(String userId, String emailId, String previousColumnId, Instant wakeAt) {
        ColumnAssignment assignment = repository.findByUserIdAndEmailId(userId, emailId)
            .orElseGet(() -> ColumnAssignment.create(userId, emailId));
        assignment.snooze(previousColumnId, wakeAt);
        repository.save(assignment);
    }

    /**
     * @return the current column, or an empty string if the email has never been placed
     */
    @Transactional(readOnly = true)
    public String getColumn(String userId, String emailId) {
        return repository.findByUserIdAndEmailId(userId, emailId)
            .map(ColumnAssignment::getColumnId)
            .orElse("");
    }

    @Transactional(readOnly = true)
    public String getPreviousColumn(String userId, String emailId) {
        return repository.findByUserIdAndEmailId(userId, emailId)
            .map(ColumnAssignment::getPreviousColumnId)
            .filter(previous -> !previous.isEmpty())
            .orElse(ColumnAssignment.INBOX);
    }

    @Transactional(readOnly = true)
    public List<String> listByColumn(String userId, String columnId) {
        return repository.findByUserIdAndColumnId(userId, columnId).stream()
            .map(ColumnAssignment::getEmailId)
            .collect(Collectors.toList());
    }

    @Transactional
    public void removeMapping(String userId, String emailId) {
        int removed = repository.deleteMapping(userId, emailId);
        log.debug("Removed {} column mapping(s) for email {} of user {}", removed, emailId, userId);
    }

    /**
     * Removes the mapping only if the email is still in {@code columnId}.
     */
    @Transactional
    public void removeMapping(String userId, String emailId, String columnId) {
        int removed = repository.deleteMapping(userId, emailId, columnId);
        log.debug("Removed {} mapping(s) for email {} in column {} of user {}", removed, emailId, columnId, userId);
    }

    /**
     * Every snoozed mapping across all users. An empty previous column resolves to inbox.
     */
    @Transactional(readOnly = true)
    public List<SnoozedAssignment> listAllSnoozed() {
        return repository.findByColumnId(ColumnAssignment.SNOOZED).stream()
            .map(a -> new SnoozedAssignment(
                a.getUserId(),
                a.getEmailId(),
                a.getPreviousColumnId() == null || a.getPreviousColumnId().isEmpty()
                    ? ColumnAssignment.INBOX
                    : a.getPreviousColumnId(),
                a.getSnoozedUntil()))
            .collect(Collectors.toList());
    }

    /**
     * Wakes a snoozed email if it is still snoozed and due at {@code now}.
     *
     * @return true if the row was restored, false if the user changed it in the meantime
     */
    @Transactional
    public boolean wakeIfStillSnoozed(String userId, String emailId, String targetColumnId, Instant now) {
        requireColumnId(targetColumnId);
        return repository.wakeIfStillSnoozed(userId, emailId, targetColumnId, now) > 0;
    }

    /**
     * Points every email in {@code fromColumnId} at {@code toColumnId}.
     *
     * @return number of emails moved
     */
    @Transactional
    public int reassignColumn(String userId, String fromColumnId, String toColumnId) {
        requireColumnId(toColumnId);
        if (ColumnAssignment.SNOOZED.equals(fromColumnId)) {
            throw new IllegalArgumentException("Snoozed emails are restored by waking them, not by reassignment");
        }
        return repository.reassignColumn(userId, fromColumnId, toColumnId, clock.instant());
    }

    private void requireColumnId(String columnId) {
        if (columnId == null || columnId.isBlank()) {
            throw new IllegalArgumentException("columnId must not be empty");
        }
        if (ColumnAssignment.SNOOZED.equals(columnId)) {
            throw new IllegalArgumentException("Use snoozeTo to move an email into the snoozed column");
        }
    }
}
