package kanban.email.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "users")
@Getter
@Setter
@ToString(exclude = "gmailAccounts")
@EqualsAndHashCode(exclude = "gmailAccounts")
public class User {
    @Id
    private String id;

    @Column(name = "primary_email")
    private String primaryEmail;

    // Highest Gmail history id already fanned out; only ever moves forward
    @Column(name = "last_notified_history_id")
    private Long lastNotifiedHistoryId;

    @OneToMany(mappedBy = "user", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<GmailAccount> gmailAccounts = new ArrayList<>();
}
