package com.buildhook.dispatcher.model;

/**
 * The three message streams the dispatcher consumes.
 *
 * JOB          : normalised webhook events (push, pull_request.*, release, tag)
 * TASK_STATUS  : a single task reached completed / failed / exception
 * GROUP_STATUS : a whole task group resolved
 *
 * The last two originate from the job platform's own event exchange and are
 * only accepted for this deployment's scheduler id.
 */
public enum Subscription {
    JOB("job"),
    TASK_STATUS("task-status"),
    GROUP_STATUS("group-status");

    private final String path;

    Subscription(String path) {
        this.path = path;
    }

    /** URL segment used by POST /messages/{subscription}. */
    public String path() {
        return path;
    }

    public boolean filteredBySchedulerId() {
        return this != JOB;
    }

    public static Subscription fromPath(String path) {
        for (Subscription s : values()) {
            if (s.path.equals(path)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown subscription: " + path);
    }
}
