package com.buildhook.dispatcher.handler;

import com.buildhook.dispatcher.github.CheckConclusion;
import com.buildhook.dispatcher.github.CheckStatus;
import com.buildhook.dispatcher.model.BuildState;

import java.time.Instant;

/**
 * Result of submitting a task graph, fed into check-run and build bookkeeping.
 *
 * @param error why submission failed, or null
 */
record SubmissionOutcome(
        CheckStatus     status,
        CheckConclusion conclusion,
        Instant         completedAt,
        RuntimeException error
) {
    static SubmissionOutcome queued() {
        return new SubmissionOutcome(CheckStatus.QUEUED, null, null, null);
    }

    static SubmissionOutcome failed(RuntimeException error, Instant at) {
        return new SubmissionOutcome(CheckStatus.COMPLETED, CheckConclusion.FAILURE, at, error);
    }

    boolean isFailure() {
        return error != null;
    }

    BuildState buildState() {
        return isFailure() ? BuildState.FAILURE : BuildState.QUEUED;
    }

    String title() {
        return CheckRunTables.title(status, conclusion);
    }
}
