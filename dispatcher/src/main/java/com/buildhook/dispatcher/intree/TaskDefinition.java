package com.buildhook.dispatcher.intree;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One task ready for submission: its id and the body sent to the queue.
 */
public record TaskDefinition(String taskId, ObjectNode task) {

    public String taskGroupId() {
        return task.path("taskGroupId").asText();
    }
}
