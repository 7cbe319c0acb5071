package com.buildhook.dispatcher.event;

/**
 * A task reached a terminal state.
 */
public record TaskStatusEvent(String taskGroupId, String taskId, TaskState state) {}
