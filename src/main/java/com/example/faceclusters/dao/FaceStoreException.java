package com.example.faceclusters.dao;

/**
 * A Firestore read or write for face data did not complete.
 */
public class FaceStoreException extends RuntimeException {

    public FaceStoreException(String message) {
        super(message);
    }

    public FaceStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
