package com.alpharadar.ingestion.store;

/**
 * Mention store backend failure (connection loss, query timeout). Fatal to a detection cycle.
 */
public class MentionStoreException extends RuntimeException {

    public MentionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
