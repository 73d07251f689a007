package kanban.email.app.repository;

import kanban.email.app.entity.GmailAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface GmailAccountRepository extends JpaRepository<GmailAccount, String> {
    @Query("SELECT g FROM GmailAccount g JOIN FETCH g.user WHERE LOWER(g.emailAddress) = LOWER(:emailAddress)")
    Optional<GmailAccount> findByEmailAddressWithUser(@Param("emailAddress") String emailAddress);

    @Query("SELECT g FROM GmailAccount g WHERE g.user.id = :userId ORDER BY g.primaryAccount DESC")
    List<GmailAccount> findByUserIdPrimaryFirst(@Param("userId") String userId);
}
