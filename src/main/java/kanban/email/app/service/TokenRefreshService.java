package kanban.email.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import kanban.email.app.entity.GmailAccount;
import kanban.email.app.entity.OAuthToken;
import kanban.email.app.entity.SyncStatus;
import kanban.email.app.repository.GmailAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Keeps Gmail access tokens usable: refreshes them shortly before expiry or after a 401.
 */
@Slf4j
@Service
public class TokenRefreshService {
    private static final long EXPIRY_MARGIN_SECONDS = 300;
    private static final long DEFAULT_LIFETIME_SECONDS = 3600;

    private final GmailAccountRepository gmailAccountRepository;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${google.oauth.client-id:}")
    private String clientId;

    @Value("${google.oauth.client-secret:}")
    private String clientSecret;

    @Value("${google.oauth.token-uri:https://oauth2.googleapis.com/token}")
    private String tokenUri;

    public TokenRefreshService(GmailAccountRepository gmailAccountRepository,
                               RestTemplateBuilder restTemplateBuilder,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.gmailAccountRepository = gmailAccountRepository;
        this.restTemplate = restTemplateBuilder
            .setConnectTimeout(Duration.ofSeconds(10))
            .setReadTimeout(Duration.ofSeconds(10))
            .build();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Returns an access token that stays valid for at least the next few minutes,
     * refreshing it first when needed.
     */
    public String ensureValidAccessToken(GmailAccount account) {
        OAuthToken token = requireToken(account);
        if (token.isValidAt(clock.instant(), EXPIRY_MARGIN_SECONDS)) {
            return token.getAccessToken();
        }
        return refresh(account, "token expires at " + token.getExpiry());
    }

    /**
     * Gmail rejected the current token; exchange the refresh token for a new one.
     */
    public String refreshTokenOn401(GmailAccount account) {
        requireToken(account);
        return refresh(account, "Gmail returned 401");
    }

    private String refresh(GmailAccount account, String reason) {
        OAuthToken token = account.getToken();
        if (!token.hasRefreshToken()) {
            markStatus(account, SyncStatus.EXPIRED);
            throw new GmailAccountUnavailableException("No refresh token for " + account.getEmailAddress() + "; re-authentication required");
        }
        if (clientId == null || clientId.isBlank() || clientSecret == null || clientSecret.isBlank()) {
            throw new GmailAccountUnavailableException("google.oauth.client-id and google.oauth.client-secret must be set to refresh tokens");
        }

        log.info("Refreshing access token for {} ({})", account.getEmailAddress(), reason);
        try {
            JsonNode json = requestNewToken(token.getRefreshToken());
            if (!json.hasNonNull("access_token")) {
                throw new GmailAccountUnavailableException("Token response for " + account.getEmailAddress() + " has no access_token");
            }
            long lifetime = json.hasNonNull("expires_in") ? json.get("expires_in").asLong() : DEFAULT_LIFETIME_SECONDS;
            Instant now = clock.instant();
            // Google usually keeps the refresh token, but honour a rotated one
            token.renew(json.get("access_token").asText(), now.plusSeconds(lifetime),
                json.hasNonNull("refresh_token") ? json.get("refresh_token").asText() : null);
            account.setToken(token);
            account.changeStatus(SyncStatus.ACTIVE, now);
            gmailAccountRepository.save(account);
            log.info("Access token for {} refreshed, expires at {}", account.getEmailAddress(), token.getExpiry());
            return token.getAccessToken();
        } catch (RestClientException | IOException e) {
            markStatus(account, SyncStatus.ERROR);
            log.error("Failed to refresh access token for {}: {}", account.getEmailAddress(), e.getMessage());
            throw new GmailAccountUnavailableException("Failed to refresh access token for " + account.getEmailAddress(), e);
        }
    }

    private JsonNode requestNewToken(String refreshToken) throws IOException {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", clientId);
        body.add("client_secret", clientSecret);
        body.add("refresh_token", refreshToken);
        body.add("grant_type", "refresh_token");

        ResponseEntity<String> response = restTemplate.postForEntity(tokenUri, new HttpEntity<>(body, headers), String.class);
        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new IOException("Token endpoint returned " + response.getStatusCode());
        }
        return objectMapper.readTree(response.getBody());
    }

    private OAuthToken requireToken(GmailAccount account) {
        if (account.getToken() == null || account.getToken().getAccessToken() == null) {
            throw new GmailAccountUnavailableException("No access token stored for " + account.getEmailAddress());
        }
        return account.getToken();
    }

    private void markStatus(GmailAccount account, SyncStatus status) {
        if (account.changeStatus(status, clock.instant())) {
            log.warn("Gmail account {} is now {}", account.getEmailAddress(), status);
            gmailAccountRepository.save(account);
        }
    }
}
