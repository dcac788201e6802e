package com.example.faceclusters.ai.orchestrator;

/**
 * Raised to callers that cannot start a run, and used internally to carry a
 * diagnostic code into a FAILED result.
 */
public class ClusterEngineException extends RuntimeException {

    private final DiagnosticCode code;

    public ClusterEngineException(DiagnosticCode code, String message) {
        super(message);
        this.code = code;
    }

    public ClusterEngineException(DiagnosticCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public DiagnosticCode getCode() {
        return code;
    }
}
