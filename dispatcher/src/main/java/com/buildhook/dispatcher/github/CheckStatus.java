package com.buildhook.dispatcher.github;

/** GitHub check-run status. */
public enum CheckStatus {
    QUEUED,
    IN_PROGRESS,
    COMPLETED
}
