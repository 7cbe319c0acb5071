package com.buildhook.dispatcher.event;

import java.util.Locale;

/**
 * Task states reported by the job platform. Only COMPLETED, FAILED and
 * EXCEPTION are terminal and arrive on the task-status subscription; the
 * others show up when listing a task group.
 */
public enum TaskState {
    UNSCHEDULED,
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    EXCEPTION;

    public boolean isFailure() {
        return this == FAILED || this == EXCEPTION;
    }

    public boolean isTerminal() {
        return this == COMPLETED || isFailure();
    }

    public static TaskState fromWire(String state) {
        if (state == null) {
            throw new MalformedMessageException("Missing task state");
        }
        try {
            return valueOf(state.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("Unknown task state: " + state, e);
        }
    }
}
