package kanban.email.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * Marks an email as already handed to the downstream indexer.
 */
@Entity
@Table(name = "email_sync_history",
        uniqueConstraints = @UniqueConstraint(name = "uk_sync_history_user_email", columnNames = {"user_id", "email_id"}))
@Data
public class EmailSyncHistory {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "email_id", nullable = false)
    private String emailId;

    private Instant syncedAt;
}
