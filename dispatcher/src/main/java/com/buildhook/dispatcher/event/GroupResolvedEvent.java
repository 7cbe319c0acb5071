package com.buildhook.dispatcher.event;

/**
 * Every task in a task group has resolved.
 */
public record GroupResolvedEvent(String taskGroupId) {}
