package com.buildhook.dispatcher.taskcluster;

import com.buildhook.dispatcher.event.TaskState;

/**
 * One member of a task group as returned by listTaskGroup.
 */
public record TaskSummary(String taskId, TaskState state) {}
