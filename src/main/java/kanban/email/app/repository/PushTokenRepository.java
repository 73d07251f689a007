package kanban.email.app.repository;

import kanban.email.app.entity.PushToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface PushTokenRepository extends JpaRepository<PushToken, String> {
    List<PushToken> findByUserId(String userId);

    Optional<PushToken> findByToken(String token);

    @Transactional
    @Modifying
    @Query("DELETE FROM PushToken t WHERE t.token = :token")
    int deleteByToken(@Param("token") String token);

    @Transactional
    @Modifying
    @Query("DELETE FROM PushToken t WHERE t.userId = :userId AND t.token = :token")
    int deleteByUserIdAndToken(@Param("userId") String userId, @Param("token") String token);
}
