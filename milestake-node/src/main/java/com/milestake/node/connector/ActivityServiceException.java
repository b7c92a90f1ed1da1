package com.milestake.node.connector;

/**
 * Failure talking to an activity service. Transient failures may succeed on retry.
 */
public class ActivityServiceException extends RuntimeException {

    private final String errorCode;
    private final boolean transientFailure;

    public ActivityServiceException(String errorCode, String message, boolean transientFailure) {
        super(message);
        this.errorCode = errorCode;
        this.transientFailure = transientFailure;
    }

    public ActivityServiceException(String errorCode, String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.transientFailure = transientFailure;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
