package com.buildhook.dispatcher.github;

/**
 * Thrown when a GitHub API call fails.
 *
 * NOT_FOUND is the only kind callers branch on (a missing .taskcluster.yml
 * means the repository has not opted in); API_ERROR and AUTH_ERROR propagate
 * and the message is redelivered.
 */
public class HostException extends RuntimeException {

    public enum Kind { NOT_FOUND, AUTH_ERROR, API_ERROR }

    private final Kind kind;

    public HostException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public HostException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public boolean is(Kind kind) { return this.kind == kind; }
}
