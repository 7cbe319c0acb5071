package com.buildhook.dispatcher.model;

import java.util.Locale;

/**
 * Overall state of one task group, as recorded in the builds table.
 *
 * Transitions:
 *   QUEUED → SUCCESS  (task group resolved, no failed/exception tasks)
 *   QUEUED → FAILURE  (task group resolved with failures, or submission failed)
 *
 * FAILURE is sticky: once set, later aggregations never move a build out of it.
 */
public enum BuildState {
    QUEUED,
    SUCCESS,
    FAILURE;

    /** Lower-case form used in check-run payloads, comments and the builds API. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
