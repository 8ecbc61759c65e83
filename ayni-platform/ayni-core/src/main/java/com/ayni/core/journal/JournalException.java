package com.ayni.core.journal;

/**
 * Exception thrown when the transaction journal cannot be read, written or replayed.
 */
public class JournalException extends RuntimeException {

    public JournalException(String message) {
        super(message);
    }

    public JournalException(String message, Throwable cause) {
        super(message, cause);
    }
}
