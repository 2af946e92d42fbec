package dev.jobmatcher.exception;

import lombok.Getter;

/**
 * Base exception for the job matcher pipeline.
 * Every subclass carries a stable error code next to its message.
 */
@Getter
public abstract class JobMatcherException extends RuntimeException {

    private final String errorCode;

    protected JobMatcherException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected JobMatcherException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
