package com.buildhook.dispatcher.handler;

import com.buildhook.dispatcher.event.MalformedMessageException;
import com.buildhook.dispatcher.event.TaskState;
import com.buildhook.dispatcher.github.CheckConclusion;
import com.buildhook.dispatcher.github.CheckStatus;

import java.util.Locale;
import java.util.Map;

/**
 * Fixed lookup tables between Taskcluster states and GitHub check-runs.
 */
final class CheckRunTables {

    private CheckRunTables() {}

    // Human title for each check-run status and conclusion.
    private static final Map<String, String> TITLES = Map.ofEntries(
            Map.entry("success",         "Success"),
            Map.entry("failure",         "Failure"),
            Map.entry("neutral",         "It is neither good nor bad"),
            Map.entry("cancelled",       "Cancelled"),
            Map.entry("timed_out",       "Timed out"),
            Map.entry("action_required", "Action required"),
            Map.entry("queued",          "Queued"),
            Map.entry("in_progress",     "In progress"),
            Map.entry("completed",       "Completed"));

    static String title(CheckStatus status, CheckConclusion conclusion) {
        String key = conclusion != null ? conclusion.name() : status.name();
        return TITLES.get(key.toLowerCase(Locale.ROOT));
    }

    /** Check-run conclusion for a terminal task state. */
    static CheckConclusion conclusionFor(TaskState state) {
        return switch (state) {
            case COMPLETED         -> CheckConclusion.SUCCESS;
            case FAILED, EXCEPTION -> CheckConclusion.FAILURE;
            default -> throw new MalformedMessageException("Not a terminal task state: " + state);
        };
    }
}
