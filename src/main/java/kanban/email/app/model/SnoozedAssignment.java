package kanban.email.app.model;

import lombok.Value;

import java.time.Instant;

@Value
public class SnoozedAssignment {
    String userId;
    String emailId;
    String previousColumnId;
    Instant snoozedUntil;

    public boolean isDue(Instant now) {
        return snoozedUntil != null && !snoozedUntil.isAfter(now);
    }
}
