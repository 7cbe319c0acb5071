package com.buildhook.dispatcher.event;

/**
 * Parsed form of a dotted event type such as {@code pull_request.opened}.
 *
 * @param kind   which webhook produced the event
 * @param action the sub-action after the dot, or null (push, tag)
 * @param raw    the original string, kept for check-run titles and the builds table
 */
public record EventType(EventKind kind, String action, String raw) {

    public static EventType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedMessageException("Missing event type");
        }
        int dot = raw.indexOf('.');
        String name   = dot < 0 ? raw : raw.substring(0, dot);
        String action = dot < 0 ? null : raw.substring(dot + 1);
        return new EventType(EventKind.fromWebhookName(name), action, raw);
    }

    @Override
    public String toString() {
        return raw;
    }
}
