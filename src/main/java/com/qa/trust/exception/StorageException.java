package com.qa.trust.exception;

/**
 * Persisting history or detection logs failed. Carries whatever the operation had already
 * computed so the caller can retry the write step alone.
 */
public class StorageException extends RuntimeException {

    private final transient Object pendingResult;

    public StorageException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public StorageException(String message, Throwable cause, Object pendingResult) {
        super(message, cause);
        this.pendingResult = pendingResult;
    }

    public Object getPendingResult() {
        return pendingResult;
    }

    public <T> T getPendingResult(Class<T> type) {
        return type.isInstance(pendingResult) ? type.cast(pendingResult) : null;
    }
}
