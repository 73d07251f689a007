package kanban.email.app.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;

import java.time.Instant;

/**
 * Google OAuth credentials of one connected mailbox.
 */
@Embeddable
@Data
public class OAuthToken {
    @Column(name = "access_token", length = 4000)
    private String accessToken;

    @Column(name = "refresh_token", length = 4000)
    private String refreshToken;

    @Column(name = "token_expiry")
    private Instant expiry;

    /**
     * True when the access token is still valid {@code marginSeconds} after {@code now}.
     * An unknown expiry counts as expired.
     */
    public boolean isValidAt(Instant now, long marginSeconds) {
        return accessToken != null && expiry != null && expiry.isAfter(now.plusSeconds(marginSeconds));
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isEmpty();
    }

    /**
     * Stores the result of a refresh. A null {@code newRefreshToken} keeps the current one.
     */
    public void renew(String newAccessToken, Instant newExpiry, String newRefreshToken) {
        this.accessToken = newAccessToken;
        this.expiry = newExpiry;
        if (newRefreshToken != null && !newRefreshToken.isEmpty()) {
            this.refreshToken = newRefreshToken;
        }
    }
}
