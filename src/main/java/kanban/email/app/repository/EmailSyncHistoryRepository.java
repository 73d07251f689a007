package kanban.email.app.repository;

import kanban.email.app.entity.EmailSyncHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EmailSyncHistoryRepository extends JpaRepository<EmailSyncHistory, String> {
    boolean existsByUserIdAndEmailId(String userId, String emailId);
}
