package kanban.email.app.controller;

import kanban.email.app.model.PushTokenRequest;
import kanban.email.app.service.PushTokenService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PushTokenControllerTest {

    @Mock
    private PushTokenService pushTokenService;

    @InjectMocks
    private PushTokenController controller;

    @Test
    void register_ShouldStoreTokenForCaller() {
        // Given
        PushTokenRequest request = new PushTokenRequest();
        request.setToken("tok");
        request.setDeviceInfo("Firefox");

        // When
        ResponseEntity<Map<String, String>> response = controller.register("u1", request);

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        verify(pushTokenService).register("u1", "tok", "Firefox");
    }

    @Test
    void register_WithoutToken_ShouldReturnBadRequest() {
        ResponseEntity<Map<String, String>> response = controller.register("u1", new PushTokenRequest());

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        verify(pushTokenService, never()).register(anyString(), any(), any());
    }

    @Test
    void unregister_ShouldRemoveCallersToken() {
        ResponseEntity<Void> response = controller.unregister("u1", "tok");

        assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode());
        verify(pushTokenService).unregister("u1", "tok");
    }
}
