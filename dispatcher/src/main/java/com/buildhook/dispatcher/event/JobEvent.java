package com.buildhook.dispatcher.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Optional;

/**
 * A normalised webhook event, as published on the job subscription.
 *
 * organization and repository arrive with literal dots replaced by '%'
 * (routing keys cannot contain dots); {@link #desanitize} undoes that.
 *
 * @param details flattened event fields such as {@code event.head.sha}
 * @param payload the whole message, handed to the config compiler
 */
public record JobEvent(
        long                installationId,
        String              organization,
        String              repository,
        String              eventId,
        EventType           eventType,
        Map<String, Object> details,
        JsonNode            payload
) {
    public static final String HEAD_SHA        = "event.head.sha";
    public static final String VERSION         = "event.version";
    public static final String PULL_NUMBER     = "event.pullNumber";
    public static final String HEAD_USER_LOGIN = "event.head.user.login";
    public static final String BASE_BRANCH     = "event.base.repo.branch";

    public static String desanitize(String name) {
        return name.replace('%', '.');
    }

    public Optional<String> headSha() {
        return detail(HEAD_SHA);
    }

    /** Tag name for release and tag events. */
    public Optional<String> version() {
        return detail(VERSION);
    }

    public Optional<Integer> pullNumber() {
        Object value = details.get(PULL_NUMBER);
        if (value instanceof Number n) {
            return Optional.of(n.intValue());
        }
        return detail(PULL_NUMBER).map(Integer::valueOf);
    }

    public Optional<String> headUserLogin() {
        return detail(HEAD_USER_LOGIN);
    }

    public Optional<String> baseBranch() {
        return detail(BASE_BRANCH);
    }

    private Optional<String> detail(String key) {
        Object value = details.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String s = value.toString();
        return s.isBlank() ? Optional.empty() : Optional.of(s);
    }
}
