package com.buildhook.dispatcher.github;

/** GitHub check-run conclusion, only meaningful once the status is COMPLETED. */
public enum CheckConclusion {
    SUCCESS,
    FAILURE,
    NEUTRAL,
    CANCELLED,
    TIMED_OUT,
    ACTION_REQUIRED
}
