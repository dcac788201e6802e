package com.example.faceclusters.controller;

import com.example.faceclusters.ai.orchestrator.ClusterEngine;
import com.example.faceclusters.ai.orchestrator.ClusterRunHandle;
import com.example.faceclusters.ai.orchestrator.ClusterRunProgress;
import com.example.faceclusters.api.ApiResponse;
import com.example.faceclusters.model.ClusterRunRecord;
import com.example.faceclusters.model.ClusterSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/face-clusters")
public class FaceClusterController {

    private static final Logger log = LoggerFactory.getLogger(FaceClusterController.class);

    @Autowired
    private ClusterEngine clusterEngine;

    // Start a clustering run; the run continues on the clustering executor
    @PostMapping("/{collectionId}/runs")
    public ResponseEntity<ApiResponse<ClusterRunProgress>> startRun(@PathVariable String collectionId) {
        ClusterRunHandle handle = clusterEngine.submit(collectionId);
        log.info("Clustering run {} accepted for collection {}", handle.getRunId(), collectionId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(ApiResponse.ok("Clustering run started", handle.getProgress()));
    }

    @GetMapping("/{collectionId}/runs/active")
    public ResponseEntity<ApiResponse<ClusterRunProgress>> activeRun(@PathVariable String collectionId) {
        ClusterRunHandle handle = clusterEngine.activeRun(collectionId)
            .orElseThrow(() -> new NoSuchElementException("No active clustering run for collection " + collectionId));
        return ResponseEntity.ok(ApiResponse.ok(handle.getProgress()));
    }

    @PostMapping("/{collectionId}/runs/active/cancel")
    public ResponseEntity<ApiResponse<ClusterRunProgress>> cancelRun(@PathVariable String collectionId) {
        ClusterRunHandle handle = clusterEngine.activeRun(collectionId)
            .orElseThrow(() -> new NoSuchElementException("No active clustering run for collection " + collectionId));
        handle.cancel();
        log.info("Cancellation requested for clustering run {} ({})", handle.getRunId(), collectionId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(ApiResponse.ok("Cancellation requested", handle.getProgress()));
    }

    @GetMapping("/{collectionId}/runs")
    public ResponseEntity<ApiResponse<List<ClusterRunRecord>>> recentRuns(
            @PathVariable String collectionId,
            @RequestParam(defaultValue = "10") int limit) {
        if (limit < 1 || limit > 100) {
            throw new IllegalArgumentException("limit must be between 1 and 100");
        }
        return ResponseEntity.ok(ApiResponse.ok(clusterEngine.recentRuns(collectionId, limit)));
    }

    @GetMapping("/{collectionId}")
    public ResponseEntity<ApiResponse<ClusterSet>> currentClusters(@PathVariable String collectionId) {
        ClusterSet clusterSet = clusterEngine.currentClusters(collectionId)
            .orElseThrow(() -> new NoSuchElementException("No clusters stored for collection " + collectionId));
        return ResponseEntity.ok(ApiResponse.ok(clusterSet));
    }
}
