package kanban.email.app.repository;

import kanban.email.app.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface UserRepository extends JpaRepository<User, String> {

    // Monotonic: never moves the stored id backwards
    @Transactional
    @Modifying
    @Query("UPDATE User u SET u.lastNotifiedHistoryId = :historyId " +
           "WHERE u.id = :userId AND (u.lastNotifiedHistoryId IS NULL OR u.lastNotifiedHistoryId < :historyId)")
    int advanceLastNotifiedHistoryId(@Param("userId") String userId, @Param("historyId") long historyId);
}
