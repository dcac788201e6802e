package com.example.faceclusters.ai.clustering;

/**
 * A stored embedding that cannot take part in clustering.
 */
public class MalformedEmbeddingException extends RuntimeException {

    public enum Reason {
        MISSING,
        EMPTY,
        TRUNCATED,
        NON_FINITE,
        ZERO_NORM,
        DIMENSION_MISMATCH
    }

    private final Reason reason;

    public MalformedEmbeddingException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
