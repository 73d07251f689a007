package kanban.email.app.controller;

import kanban.email.app.model.PushTokenRequest;
import kanban.email.app.service.PushTokenService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/push-tokens")
public class PushTokenController {
    private final PushTokenService pushTokenService;

    public PushTokenController(PushTokenService pushTokenService) {
        this.pushTokenService = pushTokenService;
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> register(@RequestHeader("X-User-Id") String userId,
                                                        @RequestBody PushTokenRequest request) {
        if (request.getToken() == null || request.getToken().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "token is required"));
        }
        pushTokenService.register(userId, request.getToken(), request.getDeviceInfo());
        return ResponseEntity.ok(Map.of("status", "registered"));
    }

    @DeleteMapping("/{token}")
    public ResponseEntity<Void> unregister(@RequestHeader("X-User-Id") String userId,
                                           @PathVariable String token) {
        pushTokenService.unregister(userId, token);
        return ResponseEntity.noContent().build();
    }
}
