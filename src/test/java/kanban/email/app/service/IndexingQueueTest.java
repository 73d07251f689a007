package kanban.email.app.service;

import kanban.email.app.entity.EmailSyncHistory;
import kanban.email.app.model.MailSummary;
import kanban.email.app.repository.EmailSyncHistoryRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IndexingQueueTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final MailSummary MESSAGE = MailSummary.builder().id("m1").subject("Hi").build();

    @Mock
    private ObjectProvider<EmailIndexer> indexerProvider;

    @Mock
    private EmailIndexer emailIndexer;

    @Mock
    private EmailSyncHistoryRepository syncHistoryRepository;

    private IndexingQueue queue(TaskExecutor executor, EmailIndexer indexer) {
        when(indexerProvider.getIfAvailable()).thenReturn(indexer);
        return new IndexingQueue(indexerProvider, syncHistoryRepository, executor, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void enqueue_NewEmail_ShouldIndexAndRecordHistory() throws Exception {
        // Given
        IndexingQueue queue = queue(Runnable::run, emailIndexer);
        when(syncHistoryRepository.existsByUserIdAndEmailId("u1", "m1")).thenReturn(false);

        // When
        boolean queued = queue.enqueue("u1", MESSAGE);

        // Then
        assertTrue(queued);
        verify(emailIndexer).index("u1", MESSAGE);
        ArgumentCaptor<EmailSyncHistory> captor = ArgumentCaptor.forClass(EmailSyncHistory.class);
        verify(syncHistoryRepository).save(captor.capture());
        assertEquals("m1", captor.getValue().getEmailId());
        assertEquals(NOW, captor.getValue().getSyncedAt());
    }

    @Test
    void enqueue_AlreadyIndexedEmail_ShouldSkip() throws Exception {
        // Given
        IndexingQueue queue = queue(Runnable::run, emailIndexer);
        when(syncHistoryRepository.existsByUserIdAndEmailId("u1", "m1")).thenReturn(true);

        // When
        queue.enqueue("u1", MESSAGE);

        // Then
        verify(emailIndexer, never()).index(anyString(), any());
        verify(syncHistoryRepository, never()).save(any());
    }

    @Test
    void enqueue_WhenIndexerFails_ShouldNotRecordHistory() throws Exception {
        // Given
        IndexingQueue queue = queue(Runnable::run, emailIndexer);
        when(syncHistoryRepository.existsByUserIdAndEmailId("u1", "m1")).thenReturn(false);
        doThrow(new IllegalStateException("index offline")).when(emailIndexer).index("u1", MESSAGE);

        // When
        queue.enqueue("u1", MESSAGE);

        // Then
        verify(syncHistoryRepository, never()).save(any());
    }

    @Test
    void enqueue_WhenQueueFull_ShouldDropJob() {
        IndexingQueue queue = queue(task -> {
            throw new TaskRejectedException("full");
        }, emailIndexer);

        assertFalse(queue.enqueue("u1", MESSAGE));
    }

    @Test
    void enqueue_WithoutIndexer_ShouldBeNoOp() {
        IndexingQueue queue = queue(Runnable::run, null);

        assertFalse(queue.isEnabled());
        assertFalse(queue.enqueue("u1", MESSAGE));
        verifyNoInteractions(syncHistoryRepository);
    }
}
