package com.company.scheduler.exception;

/**
 * Genuine job store failure (connectivity, permissions, mapping).
 * Distinct from a conditional-update conflict, which is not an error.
 */
public class JobStoreException extends RuntimeException {
    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
