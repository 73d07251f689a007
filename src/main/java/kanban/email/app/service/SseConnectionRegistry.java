package kanban.email.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Slf4j
@Service
public class SseConnectionRegistry implements LiveConnectionRegistry {
    private final Map<String, List<SseEmitter>> emitters = new ConcurrentHashMap<>();
    private final long emitterTimeoutMs;

    public SseConnectionRegistry(@Value("${kanban.sse.timeout-ms:1800000}") long emitterTimeoutMs) {
        this.emitterTimeoutMs = emitterTimeoutMs;
    }

    public SseEmitter register(String userId) {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        emitters.computeIfAbsent(userId, id -> new CopyOnWriteArrayList<>()).add(emitter);
        emitter.onCompletion(() -> remove(userId, emitter));
        emitter.onTimeout(() -> remove(userId, emitter));
        emitter.onError(e -> remove(userId, emitter));
        log.debug("Registered SSE connection for user {} ({} open)", userId, connectionCount(userId));
        return emitter;
    }

    @Override
    public void send(String userId, String eventType, Object payload) {
        List<SseEmitter> userEmitters = emitters.get(userId);
        if (userEmitters == null || userEmitters.isEmpty()) {
            log.debug("No open connection for user {}, dropping {} event", userId, eventType);
            return;
        }
        for (SseEmitter emitter : userEmitters) {
            try {
                emitter.send(SseEmitter.event().name(eventType).data(payload));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping dead SSE connection for user {}: {}", userId, e.getMessage());
                remove(userId, emitter);
            }
        }
    }

    @Override
    public int connectionCount(String userId) {
        List<SseEmitter> userEmitters = emitters.get(userId);
        return userEmitters == null ? 0 : userEmitters.size();
    }

    private void remove(String userId, SseEmitter emitter) {
        emitters.computeIfPresent(userId, (id, list) -> {
            list.remove(emitter);
            return list.isEmpty() ? null : list;
        });
    }
}
