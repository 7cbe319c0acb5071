package com.buildhook.dispatcher.taskcluster;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * The Taskcluster queue operations the handlers need.
 */
public interface JobPlatformClient {

    /**
     * Create one task. The request is restricted to {@code authorizedScopes},
     * so the task can never get more than the repository config was granted.
     *
     * @throws JobPlatformException if the queue refuses the task
     */
    void createTask(String taskId, JsonNode definition, List<String> authorizedScopes);

    /**
     * @param continuationToken null for the first page
     * @throws JobPlatformException on any queue error
     */
    TaskGroupPage listTaskGroup(String taskGroupId, String continuationToken);
}
