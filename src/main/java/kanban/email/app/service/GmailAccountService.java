package kanban.email.app.service;

import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import kanban.email.app.entity.GmailAccount;
import kanban.email.app.entity.User;
import kanban.email.app.repository.GmailAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Resolves users from mailbox addresses and runs Gmail calls with a valid access token.
 */
@Slf4j
@Service
public class GmailAccountService {
    private final GmailAccountRepository gmailAccountRepository;
    private final TokenRefreshService tokenRefreshService;

    public GmailAccountService(GmailAccountRepository gmailAccountRepository,
                               TokenRefreshService tokenRefreshService) {
        this.gmailAccountRepository = gmailAccountRepository;
        this.tokenRefreshService = tokenRefreshService;
    }

    /**
     * A Gmail call made with an access token.
     */
    @FunctionalInterface
    public interface GmailCall<T> {
        T apply(String accessToken) throws IOException;
    }

    /**
     * The connected account for a mailbox address, with its owning user loaded. Case-insensitive.
     */
    @Transactional(readOnly = true)
    public Optional<GmailAccount> findAccountByMailbox(String emailAddress) {
        if (emailAddress == null || emailAddress.isBlank()) {
            return Optional.empty();
        }
        return gmailAccountRepository.findByEmailAddressWithUser(emailAddress.trim());
    }

    @Transactional(readOnly = true)
    public Optional<User> findUserByMailbox(String emailAddress) {
        return findAccountByMailbox(emailAddress).map(GmailAccount::getUser);
    }

    /**
     * The primary account, or the first connected one if none is flagged primary.
     */
    @Transactional(readOnly = true)
    public Optional<GmailAccount> findPrimaryAccount(String userId) {
        List<GmailAccount> accounts = gmailAccountRepository.findByUserIdPrimaryFirst(userId);
        return accounts.isEmpty() ? Optional.empty() : Optional.of(accounts.get(0));
    }

    /**
     * Runs {@code call} with a fresh token. A 401 triggers one refresh and one retry.
     */
    public <T> T callWithAccessToken(GmailAccount account, GmailCall<T> call) throws IOException {
        String accessToken = tokenRefreshService.ensureValidAccessToken(account);
        try {
            return call.apply(accessToken);
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() != 401) {
                throw e;
            }
            log.warn("Gmail rejected the access token for {}, refreshing and retrying once", account.getEmailAddress());
            return call.apply(tokenRefreshService.refreshTokenOn401(account));
        }
    }
}
