package com.example.faceclusters.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

@Configuration
public class FirebaseConfig {

    private static final Logger log = LoggerFactory.getLogger(FirebaseConfig.class);

    @Value("${firebase.service-account-key:}")
    private String serviceAccountKeyPath;

    @Value("${firebase.enabled:true}")
    private boolean firebaseEnabled;

    /**
     * Credential lookup order: GOOGLE_APPLICATION_CREDENTIALS file,
     * GOOGLE_APPLICATION_CREDENTIALS_JSON content, then the local service account key.
     * Returns null (no Firestore) when Firebase is disabled or no credentials exist.
     */
    @Bean(name = "firebaseApp")
    public FirebaseApp initializeFirebase() throws IOException {
        if (!firebaseEnabled) {
            log.info("Firebase is disabled - face clusters will not be persisted");
            return null;
        }

        if (!FirebaseApp.getApps().isEmpty()) {
            return FirebaseApp.getInstance();
        }

        GoogleCredentials credentials = null;

        String credentialsPath = System.getenv("GOOGLE_APPLICATION_CREDENTIALS");
        if (credentialsPath != null && !credentialsPath.isBlank()) {
            File credFile = new File(credentialsPath);
            if (credFile.exists()) {
                try (InputStream in = new FileInputStream(credFile)) {
                    credentials = GoogleCredentials.fromStream(in);
                }
                log.info("Loaded Firebase credentials from {}", credentialsPath);
            } else {
                log.warn("GOOGLE_APPLICATION_CREDENTIALS points to non-existent file: {}", credentialsPath);
            }
        }

        if (credentials == null) {
            String credentialsJson = System.getenv("GOOGLE_APPLICATION_CREDENTIALS_JSON");
            if (credentialsJson != null && !credentialsJson.isBlank()) {
                try (InputStream in = new ByteArrayInputStream(credentialsJson.getBytes(StandardCharsets.UTF_8))) {
                    credentials = GoogleCredentials.fromStream(in);
                }
                log.info("Loaded Firebase credentials from GOOGLE_APPLICATION_CREDENTIALS_JSON");
            }
        }

        if (credentials == null && serviceAccountKeyPath != null && !serviceAccountKeyPath.isBlank()) {
            File localFile = new File(serviceAccountKeyPath);
            if (localFile.exists()) {
                try (InputStream in = new FileInputStream(localFile)) {
                    credentials = GoogleCredentials.fromStream(in);
                }
                log.info("Loaded Firebase credentials from local file {}", serviceAccountKeyPath);
            }
        }

        if (credentials == null) {
            log.error("No Firebase credentials found. Set GOOGLE_APPLICATION_CREDENTIALS or "
                    + "firebase.service-account-key, or set firebase.enabled=false for local development");
            return null;
        }

        FirebaseOptions options = FirebaseOptions.builder()
            .setCredentials(credentials)
            .build();
        FirebaseApp app = FirebaseApp.initializeApp(options);
        log.info("Firebase initialized");
        return app;
    }
}
