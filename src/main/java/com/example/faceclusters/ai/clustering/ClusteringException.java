package com.example.faceclusters.ai.clustering;

/**
 * Raised when the density clustering step cannot produce a labelling for the
 * given embedding matrix.
 */
public class ClusteringException extends RuntimeException {

    public ClusteringException(String message) {
        super(message);
    }

    public ClusteringException(String message, Throwable cause) {
        super(message, cause);
    }
}
