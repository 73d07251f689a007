package kanban.email.app.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "kanban_columns",
        uniqueConstraints = @UniqueConstraint(name = "uk_kanban_column_user_column", columnNames = {"user_id", "column_id"}))
@Data
public class KanbanColumn {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "column_id", nullable = false)
    private String columnId;

    @Column(nullable = false)
    private String name;

    @Column(name = "display_order", nullable = false)
    private int displayOrder;

    // Gmail label added when an email lands here (e.g. "STARRED")
    private String gmailLabelId;

    // Gmail labels removed when an email lands here (e.g. ["INBOX"])
    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> removeLabelIds = new ArrayList<>();

    @CreationTimestamp
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public boolean hasGmailLabel() {
        return gmailLabelId != null && !gmailLabelId.isEmpty();
    }
}
