package kanban.email.app.repository;

import kanban.email.app.entity.ColumnAssignment;
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
public interface ColumnAssignmentRepository extends JpaRepository<ColumnAssignment, String> {
    Optional<ColumnAssignment> findByUserIdAndEmailId(String userId, String emailId);

    List<ColumnAssignment> findByUserIdAndColumnId(String userId, String columnId);

    // Global scan, used by the snooze wake worker only
    List<ColumnAssignment> findByColumnId(String columnId);

    @Transactional
    @Modifying
    @Query("DELETE FROM ColumnAssignment a WHERE a.userId = :userId AND a.emailId = :emailId")
    int deleteMapping(@Param("userId") String userId, @Param("emailId") String emailId);

    @Transactional
    @Modifying
    @Query("DELETE FROM ColumnAssignment a WHERE a.userId = :userId AND a.emailId = :emailId AND a.columnId = :columnId")
    int deleteMapping(@Param("userId") String userId, @Param("emailId") String emailId, @Param("columnId") String columnId);

    /**
     * Restores a snoozed row to {@code targetColumnId}, but only while it is still snoozed and due.
     * A row the user already un-snoozed or moved is left untouched.
     *
     * @return number of rows updated (0 or 1)
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ColumnAssignment a SET a.columnId = :targetColumnId, a.snoozedUntil = null, a.updatedAt = :now " +
           "WHERE a.userId = :userId AND a.emailId = :emailId AND a.columnId = 'snoozed' AND a.snoozedUntil <= :now")
    int wakeIfStillSnoozed(@Param("userId") String userId,
                           @Param("emailId") String emailId,
                           @Param("targetColumnId") String targetColumnId,
                           @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ColumnAssignment a SET a.columnId = :toColumnId, a.updatedAt = :now " +
           "WHERE a.userId = :userId AND a.columnId = :fromColumnId")
    int reassignColumn(@Param("userId") String userId,
                       @Param("fromColumnId") String fromColumnId,
                       @Param("toColumnId") String toColumnId,
                       @Param("now") Instant now);
}
