package com.buildhook.dispatcher.event;

/**
 * The closed set of GitHub events that can start a task group.
 *
 * Each kind carries the webhook name (the part of the event type before the
 * dot) and the {@code tasksFor} value a repository config uses to select tasks
 * for it.
 */
public enum EventKind {
    PUSH("push", "github-push"),
    PULL_REQUEST("pull_request", "github-pull-request"),
    RELEASE("release", "github-release"),
    TAG("tag", "github-tag");

    private final String webhookName;
    private final String tasksFor;

    EventKind(String webhookName, String tasksFor) {
        this.webhookName = webhookName;
        this.tasksFor    = tasksFor;
    }

    public String webhookName() { return webhookName; }
    public String tasksFor()    { return tasksFor; }

    static EventKind fromWebhookName(String name) {
        for (EventKind kind : values()) {
            if (kind.webhookName.equals(name)) {
                return kind;
            }
        }
        throw new MalformedMessageException("Unsupported event type: " + name);
    }
}
