package com.buildhook.dispatcher.model;

/**
 * Lookup key of a {@link CheckRunRecord}: one task in a task group.
 */
public record CheckRunKey(String taskGroupId, String taskId) {}
