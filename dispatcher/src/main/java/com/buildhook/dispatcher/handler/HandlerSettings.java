package com.buildhook.dispatcher.handler;

import java.util.Map;

/**
 * Deployment settings the handlers read.
 *
 * @param statusContext product name shown in check-run names, e.g. "Taskcluster"
 * @param configFile    path of the repository config, e.g. ".taskcluster.yml"
 * @param inspectorUrl  task-group inspector prefix; details links append {taskGroupId}/tasks/{taskId}/details
 * @param docsUrl       documentation page explaining who can trigger jobs
 * @param schemas       config schema URL per config version
 */
public record HandlerSettings(
        String               statusContext,
        String               configFile,
        String               inspectorUrl,
        String               docsUrl,
        Map<Integer, String> schemas
) {}
