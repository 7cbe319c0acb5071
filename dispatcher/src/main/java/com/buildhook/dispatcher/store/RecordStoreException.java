package com.buildhook.dispatcher.store;

/**
 * Thrown by the record stores for the outcomes callers are expected to branch on.
 *
 * Unchecked so handlers only catch it where a specific kind has a recovery
 * (ALREADY_EXISTS on create is success for an idempotent write); everything
 * else propagates to the dispatcher and the message is redelivered later.
 */
public class RecordStoreException extends RuntimeException {

    public enum Kind { NOT_FOUND, ALREADY_EXISTS, CONFLICT }

    private final Kind kind;

    public RecordStoreException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public RecordStoreException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public boolean is(Kind kind) { return this.kind == kind; }
}
