package com.example.faceclusters.controller;

import com.example.faceclusters.ai.orchestrator.ClusterEngine;
import com.example.faceclusters.ai.orchestrator.ClusterEngineException;
import com.example.faceclusters.ai.orchestrator.ClusterRunHandle;
import com.example.faceclusters.ai.orchestrator.ClusterRunProgress;
import com.example.faceclusters.ai.orchestrator.ClusterRunState;
import com.example.faceclusters.ai.orchestrator.DiagnosticCode;
import com.example.faceclusters.model.ClusterRunRecord;
import com.example.faceclusters.model.ClusterSet;
import com.example.faceclusters.model.FaceCluster;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@ActiveProfiles("ci")
@AutoConfigureMockMvc
public class FaceClusterControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ClusterEngine clusterEngine;

    @Test
    public void testStartRun_Accepted() throws Exception {
        // Given
        ClusterRunHandle handle = handle("run-1", "family", ClusterRunState.IDLE);
        when(clusterEngine.submit("family")).thenReturn(handle);

        // When / Then
        mockMvc.perform(post("/api/face-clusters/family/runs"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.success", is(true)))
            .andExpect(jsonPath("$.data.runId", is("run-1")))
            .andExpect(jsonPath("$.data.state", is("IDLE")));
    }

    @Test
    public void testStartRun_AlreadyActive_Conflict() throws Exception {
        // Given
        when(clusterEngine.submit("family")).thenThrow(
            new ClusterEngineException(DiagnosticCode.RUN_ALREADY_ACTIVE, "Clustering run run-0 is already active"));

        // When / Then
        mockMvc.perform(post("/api/face-clusters/family/runs"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.success", is(false)))
            .andExpect(jsonPath("$.error", containsString("already active")));
    }

    @Test
    public void testStartRun_InvalidParameters_BadRequest() throws Exception {
        when(clusterEngine.submit("family")).thenThrow(
            new ClusterEngineException(DiagnosticCode.INVALID_PARAMETERS, "eps 0.900 (default) is outside [0.20, 0.50]"));

        mockMvc.perform(post("/api/face-clusters/family/runs"))
            .andExpect(status().isBadRequest());
    }

    @Test
    public void testActiveRun_NoneRunning_NotFound() throws Exception {
        when(clusterEngine.activeRun("family")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/face-clusters/family/runs/active"))
            .andExpect(status().isNotFound());
    }

    @Test
    public void testCancelRun_RequestsCancellation() throws Exception {
        // Given
        ClusterRunHandle handle = handle("run-2", "family", ClusterRunState.SCORING_FACES);
        when(clusterEngine.activeRun("family")).thenReturn(Optional.of(handle));

        // When
        mockMvc.perform(post("/api/face-clusters/family/runs/active/cancel"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.data.state", is("SCORING_FACES")));

        // Then
        verify(handle).cancel();
    }

    @Test
    public void testCurrentClusters_Stored_ReturnsSet() throws Exception {
        // Given
        FaceCluster cluster = new FaceCluster();
        cluster.setClusterKey("face_001");
        cluster.setDisplayName("Person 1");
        cluster.setMemberIds(List.of("a", "b"));
        ClusterSet set = new ClusterSet("family", "run-3", List.of(cluster), List.of("z"), new ClusterRunRecord());
        when(clusterEngine.currentClusters("family")).thenReturn(Optional.of(set));

        // When / Then
        mockMvc.perform(get("/api/face-clusters/family"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.clusters", hasSize(1)))
            .andExpect(jsonPath("$.data.clusters[0].clusterKey", is("face_001")))
            .andExpect(jsonPath("$.data.unidentifiedIds[0]", is("z")));
    }

    @Test
    public void testCurrentClusters_NeverClustered_NotFound() throws Exception {
        when(clusterEngine.currentClusters("empty")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/face-clusters/empty"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.success", is(false)));
    }

    @Test
    public void testRecentRuns_LimitOutOfRange_BadRequest() throws Exception {
        mockMvc.perform(get("/api/face-clusters/family/runs").param("limit", "500"))
            .andExpect(status().isBadRequest());
    }

    @Test
    public void testRecentRuns_ReturnsRecords() throws Exception {
        ClusterRunRecord record = new ClusterRunRecord();
        record.setRunId("run-4");
        when(clusterEngine.recentRuns("family", 10)).thenReturn(List.of(record));

        mockMvc.perform(get("/api/face-clusters/family/runs"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].runId", is("run-4")));
    }

    private static ClusterRunHandle handle(String runId, String collectionId, ClusterRunState state) {
        ClusterRunHandle handle = mock(ClusterRunHandle.class);
        when(handle.getRunId()).thenReturn(runId);
        when(handle.getCollectionId()).thenReturn(collectionId);
        when(handle.getProgress()).thenReturn(
            new ClusterRunProgress(runId, collectionId, state, 0, 0, 0, 0, 0, 0, Map.of()));
        return handle;
    }
}
