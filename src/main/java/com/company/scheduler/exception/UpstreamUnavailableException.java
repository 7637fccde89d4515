package com.company.scheduler.exception;

/**
 * Text-generation service or metrics source unreachable or erroring.
 */
public class UpstreamUnavailableException extends RuntimeException {
    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
