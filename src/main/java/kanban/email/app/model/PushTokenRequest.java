package kanban.email.app.model;

import lombok.Data;

@Data
public class PushTokenRequest {
    private String token;
    private String deviceInfo;
}
