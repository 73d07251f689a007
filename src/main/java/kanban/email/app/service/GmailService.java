package kanban.email.app.service;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePartHeader;
import com.google.api.services.gmail.model.ModifyMessageRequest;
import kanban.email.app.model.MailSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class GmailService implements GmailApiService {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String APPLICATION_NAME = "Kanban Email";

    private final NetHttpTransport httpTransport;
    private final int timeoutMs;

    public GmailService(@Value("${gmail.api.timeout-ms:15000}") int timeoutMs) throws GeneralSecurityException, IOException {
        this.httpTransport = GoogleNetHttpTransport.newTrustedTransport();
        this.timeoutMs = timeoutMs;
    }

    Gmail getGmailService(String accessToken) {
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
            .setTransport(httpTransport)
            .setJsonFactory(JSON_FACTORY)
            .build();
        credential.setAccessToken(accessToken);

        // Bound every call so a stuck request cannot stall a worker thread
        HttpRequestInitializer initializer = request -> {
            credential.initialize(request);
            request.setConnectTimeout(timeoutMs);
            request.setReadTimeout(timeoutMs);
        };

        return new Gmail.Builder(httpTransport, JSON_FACTORY, initializer)
            .setApplicationName(APPLICATION_NAME)
            .build();
    }

    @Override
    public List<MailSummary> fetchLatestMessages(String accessToken, String mailbox, String labelId, int count) throws IOException {
        Gmail service = getGmailService(accessToken);
        ListMessagesResponse response = service.users().messages().list(mailbox)
            .setLabelIds(List.of(labelId))
            .setMaxResults((long) count)
            .execute();

        List<MailSummary> summaries = new ArrayList<>();
        if (response.getMessages() == null) {
            return summaries;
        }
        for (Message messageRef : response.getMessages()) {
            Message message = service.users().messages().get(mailbox, messageRef.getId())
                .setFormat("metadata")
                .setMetadataHeaders(List.of("From", "Subject"))
                .execute();
            summaries.add(toSummary(message));
        }
        return summaries;
    }

    @Override
    public void modifyLabels(String accessToken, String mailbox, String messageId,
                             List<String> addLabelIds, List<String> removeLabelIds) throws IOException {
        Gmail service = getGmailService(accessToken);
        ModifyMessageRequest mods = new ModifyMessageRequest()
            .setAddLabelIds(addLabelIds)
            .setRemoveLabelIds(removeLabelIds);
        service.users().messages().modify(mailbox, messageId, mods).execute();
        log.debug("Modified labels on message {}: +{} -{}", messageId, addLabelIds, removeLabelIds);
    }

    static MailSummary toSummary(Message message) {
        String from = "";
        String subject = "";
        if (message.getPayload() != null && message.getPayload().getHeaders() != null) {
            for (MessagePartHeader header : message.getPayload().getHeaders()) {
                switch (header.getName().toLowerCase()) {
                    case "from":
                        from = header.getValue();
                        break;
                    case "subject":
                        subject = header.getValue();
                        break;
                    default:
                        break;
                }
            }
        }
        String[] sender = parseSender(from);
        return MailSummary.builder()
            .id(message.getId())
            .fromName(sender[0])
            .from(sender[1])
            .subject(subject)
            .snippet(message.getSnippet())
            .build();
    }

    /**
     * Splits a From header such as {@code "Jane Doe" <jane@example.com>} into display name and address.
     */
    static String[] parseSender(String header) {
        if (header == null || header.isBlank()) {
            return new String[]{"", ""};
        }
        int open = header.lastIndexOf('<');
        int close = header.lastIndexOf('>');
        if (open < 0 || close < open) {
            return new String[]{"", header.trim()};
        }
        String name = header.substring(0, open).trim();
        if (name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"")) {
            name = name.substring(1, name.length() - 1);
        }
        return new String[]{name, header.substring(open + 1, close).trim()};
    }
}
