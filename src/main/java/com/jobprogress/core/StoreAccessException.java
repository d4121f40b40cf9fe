package com.jobprogress.core;

/**
 * Unchecked wrapper for a failure of the backing store itself.
 *
 * <p>Thrown when a backend cannot complete a round-trip, for example because the
 * connection pool timed out or a transaction was rolled back. The original exception is
 * always kept as the cause. The store never retries; retry policy belongs to the caller.</p>
 */
public class StoreAccessException extends RuntimeException {

    public StoreAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
