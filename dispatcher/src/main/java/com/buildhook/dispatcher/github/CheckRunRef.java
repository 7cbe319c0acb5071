package com.buildhook.dispatcher.github;

/**
 * Ids GitHub assigned to a newly created check-run, as opaque strings.
 */
public record CheckRunRef(String checkSuiteId, String checkRunId) {}
