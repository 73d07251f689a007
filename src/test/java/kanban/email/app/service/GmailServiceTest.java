package kanban.email.app.service;

import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import kanban.email.app.model.MailSummary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GmailServiceTest {

    @Test
    void parseSender_WithQuotedDisplayName_ShouldSplitNameAndAddress() {
        String[] sender = GmailService.parseSender("\"Jane Doe\" <jane@example.com>");

        assertEquals("Jane Doe", sender[0]);
        assertEquals("jane@example.com", sender[1]);
    }

    @Test
    void parseSender_WithBareAddress_ShouldHaveNoName() {
        String[] sender = GmailService.parseSender("bob@example.com");

        assertEquals("", sender[0]);
        assertEquals("bob@example.com", sender[1]);
    }

    @Test
    void parseSender_WithMissingHeader_ShouldReturnEmptyParts() {
        assertArrayEquals(new String[]{"", ""}, GmailService.parseSender(null));
    }

    @Test
    void toSummary_ShouldReadFromAndSubjectHeaders() {
        // Given
        Message message = new Message()
            .setId("m1")
            .setSnippet("see you at noon")
            .setPayload(new MessagePart().setHeaders(List.of(
                new MessagePartHeader().setName("Subject").setValue("Lunch?"),
                new MessagePartHeader().setName("From").setValue("Jane <jane@example.com>"))));

        // When
        MailSummary summary = GmailService.toSummary(message);

        // Then
        assertEquals("m1", summary.getId());
        assertEquals("Lunch?", summary.getSubject());
        assertEquals("Jane", summary.getFromName());
        assertEquals("jane@example.com", summary.getFrom());
        assertEquals("Jane", summary.senderDisplayName());
    }
}
