package kanban.email.app.service;

import kanban.email.app.entity.User;
import kanban.email.app.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Highest Gmail history id already handled per user.
 * <p>
 * The check-and-advance is a single compare-and-set, so two deliveries of the same id
 * on different threads let exactly one through. The value is seeded from and written
 * through to {@code users.last_notified_history_id}, so a restart does not re-notify.
 */
@Slf4j
@Component
public class HistoryDedupTracker {
    private final UserRepository userRepository;
    private final Map<String, AtomicLong> lastSeen = new ConcurrentHashMap<>();

    public HistoryDedupTracker(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /**
     * Advances the user's history id to {@code historyId} if it is strictly higher.
     *
     * @param user user whose stored value seeds the counter on first use
     * @return true if the event is new and should be fanned out
     */
    public boolean tryAdvance(User user, long historyId) {
        AtomicLong current = lastSeen.computeIfAbsent(user.getId(), id ->
            new AtomicLong(user.getLastNotifiedHistoryId() != null ? user.getLastNotifiedHistoryId() : 0L));
        while (true) {
            long seen = current.get();
            if (historyId <= seen) {
                return false;
            }
            if (current.compareAndSet(seen, historyId)) {
                break;
            }
        }
        try {
            userRepository.advanceLastNotifiedHistoryId(user.getId(), historyId);
        } catch (Exception e) {
            // The in-memory value already advanced; only restart safety is lost
            log.warn("Failed to persist history id {} for user {}: {}", historyId, user.getId(), e.getMessage());
        }
        return true;
    }

    long lastSeen(String userId) {
        AtomicLong value = lastSeen.get(userId);
        return value != null ? value.get() : 0L;
    }
}
