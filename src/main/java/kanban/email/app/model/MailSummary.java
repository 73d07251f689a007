package kanban.email.app.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MailSummary {
    String id;
    String from;
    String fromName;
    String subject;
    String snippet;

    public String senderDisplayName() {
        return fromName != null && !fromName.isEmpty() ? fromName : from;
    }
}
