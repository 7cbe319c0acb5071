package com.buildhook.dispatcher.event;

/**
 * A queued message could not be decoded into an event.
 * Redelivering it will not help, so the dispatcher reports and drops it.
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
