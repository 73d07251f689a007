package kanban.email.app.service;

import kanban.email.app.model.MailSummary;

import java.io.IOException;
import java.util.List;

/**
 * Gmail operations the board and the notifier need.
 * This abstraction allows for easier testing.
 */
public interface GmailApiService {
    /**
     * Most recent messages carrying a label, newest first, with sender and subject headers only.
     * @param accessToken OAuth access token
     * @param mailbox Gmail user ID (email address)
     * @param labelId label to list, e.g. "INBOX"
     * @param count maximum number of messages
     */
    List<MailSummary> fetchLatestMessages(String accessToken, String mailbox, String labelId, int count) throws IOException;

    /**
     * Adds and removes labels on one message.
     */
    void modifyLabels(String accessToken, String mailbox, String messageId,
                      List<String> addLabelIds, List<String> removeLabelIds) throws IOException;
}
