package com.example.faceclusters.config;

import com.google.cloud.firestore.Firestore;
import com.google.firebase.FirebaseApp;
import com.google.firebase.cloud.FirestoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

@Configuration
public class FirestoreConfig {

    private static final Logger log = LoggerFactory.getLogger(FirestoreConfig.class);

    @Value("${firebase.enabled:true}")
    private boolean firebaseEnabled;

    @Value("${firestore.database-id:(default)}")
    private String databaseId;

    @Bean
    @DependsOn("firebaseApp")
    public Firestore getFirestore() {
        if (!firebaseEnabled || FirebaseApp.getApps().isEmpty()) {
            log.info("Firestore unavailable - running without persistence");
            return null;
        }

        if ("(default)".equals(databaseId) || databaseId == null || databaseId.isEmpty()) {
            log.info("Using default Firestore database");
            return FirestoreClient.getFirestore();
        }
        log.info("Using named Firestore database: {}", databaseId);
        return FirestoreClient.getFirestore(FirebaseApp.getInstance(), databaseId);
    }
}
