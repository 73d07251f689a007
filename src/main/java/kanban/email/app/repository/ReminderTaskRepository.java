package kanban.email.app.repository;

import kanban.email.app.entity.ReminderTask;
import kanban.email.app.entity.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReminderTaskRepository extends JpaRepository<ReminderTask, String> {
    List<ReminderTask> findByUserIdOrderByCreatedAtDesc(String userId);

    Optional<ReminderTask> findByIdAndUserId(String id, String userId);

    @Query("SELECT t FROM ReminderTask t WHERE t.reminderAt <= :now AND t.reminderSent = false AND t.status <> :excluded")
    List<ReminderTask> findDueReminders(@Param("now") Instant now, @Param("excluded") TaskStatus excluded);

    default List<ReminderTask> findPendingReminders(Instant now) {
        return findDueReminders(now, TaskStatus.COMPLETED);
    }

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ReminderTask t SET t.reminderSent = true, t.updatedAt = :now WHERE t.id = :id")
    int markReminderSent(@Param("id") String id, @Param("now") Instant now);
}
