package com.buildhook.dispatcher.handler;

import java.util.List;

/**
 * A redelivered job event produced a build that disagrees with the build
 * already stored for the same task group.
 *
 * Task-group ids are unique per submission, so this means stored data is
 * corrupt or two different events compiled to the same task group. It is
 * never swallowed: the dispatcher reports it as fatal.
 */
public class BuildConsistencyException extends IllegalStateException {

    private final String       taskGroupId;
    private final List<String> mismatches;

    public BuildConsistencyException(String taskGroupId, List<String> mismatches) {
        super("Build for task group " + taskGroupId + " already exists with different values: "
                + String.join(", ", mismatches));
        this.taskGroupId = taskGroupId;
        this.mismatches  = List.copyOf(mismatches);
    }

    public String getTaskGroupId()      { return taskGroupId; }
    public List<String> getMismatches() { return mismatches; }
}
