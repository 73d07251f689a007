package kanban.email.app.repository;

import kanban.email.app.entity.KanbanColumn;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface KanbanColumnRepository extends JpaRepository<KanbanColumn, String> {
    List<KanbanColumn> findByUserIdOrderByDisplayOrderAsc(String userId);

    Optional<KanbanColumn> findByUserIdAndColumnId(String userId, String columnId);

    boolean existsByUserIdAndColumnId(String userId, String columnId);

    @Transactional
    @Modifying
    @Query("DELETE FROM KanbanColumn c WHERE c.userId = :userId AND c.columnId = :columnId")
    int deleteColumn(@Param("userId") String userId, @Param("columnId") String columnId);
}
