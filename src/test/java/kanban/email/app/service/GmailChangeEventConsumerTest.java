package kanban.email.app.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import kanban.email.app.entity.GmailAccount;
import kanban.email.app.entity.User;
import kanban.email.app.model.MailSummary;
import kanban.email.app.model.PushNotification;
import kanban.email.app.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GmailChangeEventConsumerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String MAILBOX = "a@example.com";

    @Mock
    private GmailAccountService gmailAccountService;

    @Mock
    private UserRepository userRepository;

    @Mock
    private NotificationDispatcher notificationDispatcher;

    @Mock
    private PushTokenService pushTokenService;

    @Mock
    private GmailApiService gmailApiService;

    @Mock
    private IndexingQueue indexingQueue;

    private GmailChangeEventConsumer consumer;
    private GmailAccount account;

    @BeforeEach
    void setUp() {
        consumer = newConsumer(Runnable::run);

        User user = new User();
        user.setId("u1");
        account = new GmailAccount();
        account.setUser(user);
        account.setEmailAddress(MAILBOX);
    }

    private GmailChangeEventConsumer newConsumer(TaskExecutor executor) {
        return new GmailChangeEventConsumer(new ObjectMapper(), gmailAccountService,
            new HistoryDedupTracker(userRepository), notificationDispatcher, pushTokenService,
            gmailApiService, indexingQueue, executor, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static String payload(long historyId) {
        return "{\"emailAddress\":\"" + MAILBOX + "\",\"historyId\":" + historyId + "}";
    }

    @SuppressWarnings("unchecked")
    private void stubGmailCalls() throws IOException {
        when(gmailAccountService.callWithAccessToken(eq(account), any())).thenAnswer(invocation ->
            ((GmailAccountService.GmailCall<Object>) invocation.getArgument(1)).apply("access-token"));
    }

    @Test
    void handle_NewEvent_ShouldNotifyLiveConnections() {
        // Given
        when(gmailAccountService.findAccountByMailbox(MAILBOX)).thenReturn(Optional.of(account));
        when(notificationDispatcher.isPushEnabled()).thenReturn(false);

        // When
        boolean admitted = consumer.handle(payload(100));

        // Then
        assertTrue(admitted);
        verify(notificationDispatcher).notifyUser("u1", "email_update",
            Map.of("email", MAILBOX, "historyId", 100L, "timestamp", NOW.getEpochSecond()));
    }

    @Test
    void handle_DuplicateEvent_ShouldFanOutOnce() {
        // Given
        when(gmailAccountService.findAccountByMailbox(MAILBOX)).thenReturn(Optional.of(account));
        when(notificationDispatcher.isPushEnabled()).thenReturn(false);

        // When
        boolean first = consumer.handle(payload(100));
        boolean second = consumer.handle(payload(100));

        // Then
        assertTrue(first);
        assertFalse(second);
        verify(notificationDispatcher, times(1)).notifyUser(eq("u1"), eq("email_update"), anyMap());
    }

    @Test
    void handle_StaleEvent_ShouldBeDropped() {
        // Given
        when(gmailAccountService.findAccountByMailbox(MAILBOX)).thenReturn(Optional.of(account));
        when(notificationDispatcher.isPushEnabled()).thenReturn(false);
        consumer.handle(payload(100));

        // When
        boolean stale = consumer.handle(payload(90));

        // Then
        assertFalse(stale);
        verify(notificationDispatcher, times(1)).notifyUser(anyString(), anyString(), anyMap());
    }

    @Test
    void handle_UnknownMailbox_ShouldDropWithoutSideEffects() {
        // Given
        when(gmailAccountService.findAccountByMailbox(MAILBOX)).thenReturn(Optional.empty());

        // When
        boolean admitted = consumer.handle(payload(100));

        // Then
        assertFalse(admitted);
        verifyNoInteractions(notificationDispatcher, pushTokenService, userRepository);
    }

    @Test
    void handle_UndecodablePayload_ShouldBeDropped() {
        assertFalse(consumer.handle("not json"));
        verifyNoInteractions(gmailAccountService, notificationDispatcher);
    }

    @Test
    void handle_WithLatestMessage_ShouldPushEnrichedNotificationAndQueueIndexing() throws Exception {
        // Given
        MailSummary latest = MailSummary.builder()
            .id("m1").from("jane@example.com").fromName("Jane Doe").subject("Lunch?").build();
        when(gmailAccountService.findAccountByMailbox(MAILBOX)).thenReturn(Optional.of(account));
        when(notificationDispatcher.isPushEnabled()).thenReturn(true);
        when(pushTokenService.getTokens("u1")).thenReturn(List.of("tokA", "tokB"));
        stubGmailCalls();
        when(gmailApiService.fetchLatestMessages("access-token", MAILBOX, "INBOX", 1)).thenReturn(List.of(latest));
        when(notificationDispatcher.pushToDevices(anyList(), any())).thenReturn(List.of("tokB"));

        // When
        consumer.handle(payload(100));

        // Then
        ArgumentCaptor<PushNotification> captor = ArgumentCaptor.forClass(PushNotification.class);
        verify(notificationDispatcher).pushToDevices(eq(List.of("tokA", "tokB")), captor.capture());
        PushNotification push = captor.getValue();
        assertEquals("Email from Jane Doe", push.getTitle());
        assertEquals("Lunch?", push.getBody());
        assertEquals("email_update", push.getData().get("type"));
        assertEquals(MAILBOX, push.getData().get("email"));
        assertEquals("100", push.getData().get("historyId"));
        assertEquals("m1", push.getData().get("messageId"));
        assertEquals("/inbox/m1", push.getData().get("click_action"));
        verify(indexingQueue).enqueue("u1", latest);
        verify(pushTokenService).pruneInvalid(List.of("tokB"));
    }

    @Test
    void handle_WhenFetchFails_ShouldPushGenericNotification() throws Exception {
        // Given
        when(gmailAccountService.findAccountByMailbox(MAILBOX)).thenReturn(Optional.of(account));
        when(notificationDispatcher.isPushEnabled()).thenReturn(true);
        when(pushTokenService.getTokens("u1")).thenReturn(List.of("tokA"));
        when(gmailAccountService.callWithAccessToken(eq(account), any()))
            .thenThrow(new GmailAccountUnavailableException("token revoked"));
        when(notificationDispatcher.pushToDevices(anyList(), any())).thenReturn(List.of());

        // When
        consumer.handle(payload(100));

        // Then
        ArgumentCaptor<PushNotification> captor = ArgumentCaptor.forClass(PushNotification.class);
        verify(notificationDispatcher).pushToDevices(eq(List.of("tokA")), captor.capture());
        assertEquals(GmailChangeEventConsumer.FALLBACK_TITLE, captor.getValue().getTitle());
        assertEquals(GmailChangeEventConsumer.FALLBACK_BODY, captor.getValue().getBody());
        assertEquals("/inbox", captor.getValue().getData().get("click_action"));
        verify(indexingQueue, never()).enqueue(anyString(), any());
    }

    @Test
    void handle_WithoutTokens_ShouldSkipFetchAndPush() {
        // Given
        when(gmailAccountService.findAccountByMailbox(MAILBOX)).thenReturn(Optional.of(account));
        when(notificationDispatcher.isPushEnabled()).thenReturn(true);
        when(pushTokenService.getTokens("u1")).thenReturn(List.of());

        // When
        consumer.handle(payload(100));

        // Then
        verifyNoInteractions(gmailApiService, indexingQueue);
        verify(notificationDispatcher, never()).pushToDevices(anyList(), any());
    }

    @Test
    void handle_WhenExecutorIsFull_ShouldStillAdmitEvent() {
        // Given
        consumer = newConsumer(task -> {
            throw new TaskRejectedException("queue full");
        });
        when(gmailAccountService.findAccountByMailbox(MAILBOX)).thenReturn(Optional.of(account));

        // When
        boolean admitted = consumer.handle(payload(100));

        // Then
        assertTrue(admitted);
        verify(notificationDispatcher).notifyUser(eq("u1"), eq("email_update"), anyMap());
        verifyNoInteractions(pushTokenService);
    }

    @Test
    void subjectLine_ShouldTruncateLongSubjectsAndFillEmptyOnes() {
        String longSubject = "x".repeat(150);

        String truncated = GmailChangeEventConsumer.subjectLine(longSubject);

        assertEquals(100, truncated.length());
        assertTrue(truncated.endsWith("..."));
        assertEquals("x".repeat(100), GmailChangeEventConsumer.subjectLine("x".repeat(100)));
        assertEquals(GmailChangeEventConsumer.NO_SUBJECT, GmailChangeEventConsumer.subjectLine(""));
        assertEquals(GmailChangeEventConsumer.NO_SUBJECT, GmailChangeEventConsumer.subjectLine(null));
    }

    @Test
    void buildNotification_WithoutSenderName_ShouldUseAddress() {
        MailSummary latest = MailSummary.builder().id("m2").from("bob@example.com").fromName("").subject("Hi").build();

        PushNotification push = GmailChangeEventConsumer.buildNotification(MAILBOX, 7L, latest);

        assertEquals("Email from bob@example.com", push.getTitle());
    }
}
