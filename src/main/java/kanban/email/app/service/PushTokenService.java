package kanban.email.app.service;

import kanban.email.app.entity.PushToken;
import kanban.email.app.repository.PushTokenRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
public class PushTokenService {
    private final PushTokenRepository pushTokenRepository;

    public PushTokenService(PushTokenRepository pushTokenRepository) {
        this.pushTokenRepository = pushTokenRepository;
    }

    /**
     * Registers a device token. A token already known under another user moves to this one.
     */
    @Transactional
    public PushToken register(String userId, String token, String deviceInfo) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Push token must not be empty");
        }
        PushToken pushToken = pushTokenRepository.findByToken(token).orElseGet(PushToken::new);
        pushToken.setUserId(userId);
        pushToken.setToken(token);
        pushToken.setDeviceInfo(deviceInfo);
        return pushTokenRepository.save(pushToken);
    }

    @Transactional
    public void unregister(String userId, String token) {
        pushTokenRepository.deleteByUserIdAndToken(userId, token);
    }

    @Transactional(readOnly = true)
    public List<String> getTokens(String userId) {
        return pushTokenRepository.findByUserId(userId).stream()
            .map(PushToken::getToken)
            .collect(Collectors.toList());
    }

    /**
     * Deletes tokens the push provider reported as invalid. Each delete commits on its own,
     * so one failed delete does not roll back the rest.
     */
    public void pruneInvalid(Collection<String> invalidTokens) {
        if (invalidTokens == null || invalidTokens.isEmpty()) {
            return;
        }
        log.info("Pruning {} invalid push token(s)", invalidTokens.size());
        for (String token : invalidTokens) {
            try {
                pushTokenRepository.deleteByToken(token);
            } catch (Exception e) {
                log.error("Failed to delete invalid push token {}: {}", FirebasePushProvider.abbreviate(token), e.getMessage(), e);
            }
        }
    }
}
