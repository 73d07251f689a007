package kanban.email.app.service;

import kanban.email.app.entity.ReminderTask;
import kanban.email.app.entity.TaskPriority;
import kanban.email.app.entity.TaskStatus;
import kanban.email.app.repository.ReminderTaskRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

@Slf4j
@Service
public class ReminderTaskService {
    private final ReminderTaskRepository reminderTaskRepository;
    private final Clock clock;

    public ReminderTaskService(ReminderTaskRepository reminderTaskRepository, Clock clock) {
        this.reminderTaskRepository = reminderTaskRepository;
        this.clock = clock;
    }

    @Transactional
    public ReminderTask createTask(String userId, String emailId, String title, String description,
                                   Instant dueDate, Instant reminderAt, TaskPriority priority) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Task title must not be empty");
        }
        ReminderTask task = new ReminderTask();
        task.setUserId(userId);
        task.setEmailId(emailId);
        task.setTitle(title);
        task.setDescription(description);
        task.setDueDate(dueDate);
        task.setReminderAt(reminderAt);
        task.setPriority(priority != null ? priority : TaskPriority.MEDIUM);
        task.setStatus(TaskStatus.PENDING);
        return reminderTaskRepository.save(task);
    }

    @Transactional(readOnly = true)
    public List<ReminderTask> getTasks(String userId) {
        return reminderTaskRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public ReminderTask getTask(String userId, String taskId) {
        return reminderTaskRepository.findByIdAndUserId(taskId, userId)
            .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /**
     * Changes (or clears, with {@code null}) the reminder time. A new time re-arms the reminder.
     */
    @Transactional
    public ReminderTask updateReminder(String userId, String taskId, Instant reminderAt) {
        ReminderTask task = getTask(userId, taskId);
        if (!Objects.equals(task.getReminderAt(), reminderAt)) {
            task.setReminderAt(reminderAt);
            task.setReminderSent(false);
        }
        return reminderTaskRepository.save(task);
    }

    @Transactional
    public ReminderTask updateStatus(String userId, String taskId, TaskStatus status) {
        ReminderTask task = getTask(userId, taskId);
        task.setStatus(status);
        return reminderTaskRepository.save(task);
    }

    @Transactional
    public void deleteTask(String userId, String taskId) {
        reminderTaskRepository.delete(getTask(userId, taskId));
    }

    /**
     * Tasks whose reminder is due at {@code now}, not yet attempted, and not completed.
     */
    @Transactional(readOnly = true)
    public List<ReminderTask> findPendingReminders(Instant now) {
        return reminderTaskRepository.findPendingReminders(now);
    }

    public void markReminderSent(String taskId) {
        int updated = reminderTaskRepository.markReminderSent(taskId, clock.instant());
        if (updated == 0) {
            log.debug("Task {} disappeared before its reminder could be marked sent", taskId);
        }
    }
}
