package kanban.email.app.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.messaging.FirebaseMessaging;
import kanban.email.app.service.FirebasePushProvider;
import kanban.email.app.service.PushProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Device push through Firebase Cloud Messaging. Without a service account file push is disabled.
 */
@Slf4j
@Configuration
public class FirebaseConfig {
    private static final String APP_NAME = "kanban-email";

    @Bean
    public PushProvider pushProvider(@Value("${firebase.credentials-file:}") String credentialsFile,
                                     @Value("${kanban.push.timeout-seconds:10}") long timeoutSeconds) {
        if (credentialsFile == null || credentialsFile.isBlank()) {
            log.warn("firebase.credentials-file is not set, device push notifications are disabled");
            return PushProvider.DISABLED;
        }
        try (InputStream in = new FileInputStream(credentialsFile)) {
            FirebaseOptions options = FirebaseOptions.builder()
                .setCredentials(GoogleCredentials.fromStream(in))
                .build();
            FirebaseApp app = FirebaseApp.getApps().stream()
                .filter(existing -> APP_NAME.equals(existing.getName()))
                .findFirst()
                .orElseGet(() -> FirebaseApp.initializeApp(options, APP_NAME));
            log.info("Firebase Cloud Messaging initialized");
            return new FirebasePushProvider(FirebaseMessaging.getInstance(app), timeoutSeconds);
        } catch (IOException e) {
            log.warn("Could not load Firebase credentials from {}, device push notifications are disabled: {}",
                credentialsFile, e.getMessage());
            return PushProvider.DISABLED;
        }
    }
}
