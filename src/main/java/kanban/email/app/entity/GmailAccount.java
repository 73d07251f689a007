package kanban.email.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A Gmail mailbox connected to a user. Change notifications are matched to users through
 * {@link #emailAddress}, which is stored trimmed and lower-cased.
 */
@Entity
@Table(name = "gmail_accounts", indexes = @Index(name = "idx_gmail_accounts_user", columnList = "user_id"))
@Getter
@Setter
@ToString(exclude = {"user", "token"})
@EqualsAndHashCode(exclude = {"user", "token"})
public class GmailAccount {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "email_address", unique = true, nullable = false)
    private String emailAddress;

    @Column(name = "is_primary")
    private boolean primaryAccount;

    @Embedded
    private OAuthToken token;

    @Enumerated(EnumType.STRING)
    @Column(name = "sync_status", length = 16)
    private SyncStatus syncStatus = SyncStatus.ACTIVE;

    @Column(name = "status_changed_at")
    private Instant statusChangedAt;

    /**
     * Records a token health change. Returns false when the status was already {@code status}.
     */
    public boolean changeStatus(SyncStatus status, Instant at) {
        if (status == syncStatus) {
            return false;
        }
        this.syncStatus = status;
        this.statusChangedAt = at;
        return true;
    }

    @PrePersist
    @PreUpdate
    void normalizeEmailAddress() {
        if (emailAddress != null) {
            emailAddress = emailAddress.trim().toLowerCase();
        }
    }
}
