package com.buildhook.dispatcher.taskcluster;

/**
 * Thrown when the Taskcluster queue rejects a request or is unreachable.
 *
 * statusCode is 0 when no HTTP response was received. detail is the
 * human-readable part of the error body (the queue's {@code message} field),
 * quoted back to users when task submission fails.
 */
public class JobPlatformException extends RuntimeException {

    private final int    statusCode;
    private final String detail;

    public JobPlatformException(String message, int statusCode, String detail) {
        super(message);
        this.statusCode = statusCode;
        this.detail     = detail;
    }

    public JobPlatformException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.detail     = null;
    }

    public int statusCode() { return statusCode; }

    /** Error text suitable for a user-facing comment. */
    public String detail() {
        return detail != null ? detail : getMessage();
    }
}
