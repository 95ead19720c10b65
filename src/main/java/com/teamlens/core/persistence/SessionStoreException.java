package com.teamlens.core.persistence;

/**
 * A session database operation failed for a reason other than an expected uniqueness conflict.
 */
public class SessionStoreException extends RuntimeException {

    public SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public SessionStoreException(String message) {
        super(message);
    }
}
