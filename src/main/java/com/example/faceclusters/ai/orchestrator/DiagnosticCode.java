package com.example.faceclusters.ai.orchestrator;

public enum DiagnosticCode {
    LOAD_FAILED,
    CLUSTERING_FAILED,
    PERSISTENCE_FAILED,
    RUN_ALREADY_ACTIVE,
    INVALID_PARAMETERS,
    UNEXPECTED
}
