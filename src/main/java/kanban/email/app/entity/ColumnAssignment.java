package kanban.email.app.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Which Kanban column an email currently sits in, for one user.
 * <p>
 * {@code snoozedUntil} is set exactly when {@code columnId} is {@link #SNOOZED};
 * {@link #moveTo(String)} and {@link #snooze(String, Instant)} are the only mutators
 * that touch either field, so the pair cannot drift apart.
 */
@Entity
@Table(name = "email_kanban_columns",
        uniqueConstraints = @UniqueConstraint(name = "uk_email_column_user_email", columnNames = {"user_id", "email_id"}),
        indexes = @Index(name = "idx_email_column_column", columnList = "column_id"))
@Data
public class ColumnAssignment {
    public static final String INBOX = "inbox";
    public static final String SNOOZED = "snoozed";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "email_id", nullable = false)
    private String emailId;

    @Column(name = "column_id", nullable = false)
    @Setter(AccessLevel.NONE)
    private String columnId;

    private String previousColumnId = "";

    @Setter(AccessLevel.NONE)
    private Instant snoozedUntil;

    @CreationTimestamp
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public static ColumnAssignment create(String userId, String emailId) {
        ColumnAssignment assignment = new ColumnAssignment();
        assignment.setUserId(userId);
        assignment.setEmailId(emailId);
        return assignment;
    }

    public void moveTo(String targetColumnId) {
        if (SNOOZED.equals(targetColumnId)) {
            throw new IllegalArgumentException("Snoozing requires a wake time; use snooze() instead");
        }
        this.columnId = targetColumnId;
        this.snoozedUntil = null;
    }

    public void snooze(String previousColumnId, Instant wakeAt) {
        if (wakeAt == null) {
            throw new IllegalArgumentException("wakeAt is required to snooze an email");
        }
        this.columnId = SNOOZED;
        this.previousColumnId = previousColumnId != null ? previousColumnId : "";
        this.snoozedUntil = wakeAt;
    }

    public boolean isSnoozed() {
        return SNOOZED.equals(columnId);
    }
}
