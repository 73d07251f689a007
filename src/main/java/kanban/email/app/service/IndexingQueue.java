package kanban.email.app.service;

import kanban.email.app.entity.EmailSyncHistory;
import kanban.email.app.model.MailSummary;
import kanban.email.app.repository.EmailSyncHistoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Fire-and-forget hand-off of new messages to the {@link EmailIndexer}.
 * Work runs on the bounded indexing executor; when it is full the job is dropped.
 */
@Slf4j
@Service
public class IndexingQueue {
    private final EmailIndexer emailIndexer;
    private final EmailSyncHistoryRepository syncHistoryRepository;
    private final TaskExecutor indexingExecutor;
    private final Clock clock;

    public IndexingQueue(ObjectProvider<EmailIndexer> emailIndexer,
                         EmailSyncHistoryRepository syncHistoryRepository,
                         @Qualifier("indexingExecutor") TaskExecutor indexingExecutor,
                         Clock clock) {
        this.emailIndexer = emailIndexer.getIfAvailable();
        this.syncHistoryRepository = syncHistoryRepository;
        this.indexingExecutor = indexingExecutor;
        this.clock = clock;
        if (this.emailIndexer == null) {
            log.warn("No EmailIndexer configured, new emails will not be indexed");
        }
    }

    public boolean isEnabled() {
        return emailIndexer != null;
    }

    /**
     * Queues a message for indexing.
     *
     * @return false if indexing is disabled or the queue is full
     */
    public boolean enqueue(String userId, MailSummary message) {
        if (emailIndexer == null) {
            log.debug("Indexing disabled, skipping email {} of user {}", message.getId(), userId);
            return false;
        }
        try {
            indexingExecutor.execute(() -> index(userId, message));
            return true;
        } catch (TaskRejectedException e) {
            log.warn("Indexing queue full, dropping email {} of user {}", message.getId(), userId);
            return false;
        }
    }

    void index(String userId, MailSummary message) {
        try {
            if (syncHistoryRepository.existsByUserIdAndEmailId(userId, message.getId())) {
                log.debug("Email {} of user {} already indexed", message.getId(), userId);
                return;
            }
            emailIndexer.index(userId, message);

            EmailSyncHistory history = new EmailSyncHistory();
            history.setUserId(userId);
            history.setEmailId(message.getId());
            history.setSyncedAt(clock.instant());
            syncHistoryRepository.save(history);
            log.debug("Indexed email {} of user {}", message.getId(), userId);
        } catch (Exception e) {
            log.error("Failed to index email {} of user {}: {}", message.getId(), userId, e.getMessage(), e);
        }
    }
}
