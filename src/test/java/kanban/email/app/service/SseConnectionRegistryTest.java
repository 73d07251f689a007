package kanban.email.app.service;

import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SseConnectionRegistryTest {

    @Test
    void register_ShouldTrackConnectionsPerUser() {
        SseConnectionRegistry registry = new SseConnectionRegistry(60_000L);

        SseEmitter first = registry.register("u1");
        SseEmitter second = registry.register("u1");

        assertNotSame(first, second);
        assertEquals(2, registry.connectionCount("u1"));
        assertEquals(0, registry.connectionCount("u2"));
    }

    @Test
    void send_ToUserWithoutConnections_ShouldBeSilentNoOp() {
        SseConnectionRegistry registry = new SseConnectionRegistry(60_000L);

        assertDoesNotThrow(() -> registry.send("nobody", "email_update", Map.of("email", "a@example.com")));
    }

    @Test
    void send_ToCompletedEmitter_ShouldDropIt() {
        // Given
        SseConnectionRegistry registry = new SseConnectionRegistry(60_000L);
        SseEmitter emitter = registry.register("u1");
        emitter.complete();

        // When
        registry.send("u1", "email_update", Map.of("email", "a@example.com"));

        // Then
        assertEquals(0, registry.connectionCount("u1"));
    }
}
