package kanban.email.app.controller;

import kanban.email.app.service.SseConnectionRegistry;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Live board updates for the signed-in user. The user id comes from the upstream auth layer.
 */
@RestController
@RequestMapping("/api/events")
public class EventStreamController {
    private final SseConnectionRegistry sseConnectionRegistry;

    public EventStreamController(SseConnectionRegistry sseConnectionRegistry) {
        this.sseConnectionRegistry = sseConnectionRegistry;
    }

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestHeader("X-User-Id") String userId) {
        return sseConnectionRegistry.register(userId);
    }
}
