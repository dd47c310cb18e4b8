package com.example.pipeline.store;

/** The backing candidate storage failed or is unavailable. */
public class CandidateStoreException extends RuntimeException {

    public CandidateStoreException(String message) {
        super(message);
    }

    public CandidateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
