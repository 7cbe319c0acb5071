package com.buildhook.dispatcher.intree;

import java.util.List;

/**
 * Output of the config compiler: the tasks to create and the scopes they may
 * be created with. All tasks share one task group.
 */
public record TaskGraph(List<String> scopes, List<TaskDefinition> tasks) {

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    /** Task group of the graph, taken from its first task. */
    public String taskGroupId() {
        if (tasks.isEmpty()) {
            throw new IllegalStateException("Empty task graph has no task group");
        }
        return tasks.get(0).taskGroupId();
    }
}
