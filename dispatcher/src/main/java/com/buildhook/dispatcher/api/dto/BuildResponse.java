package com.buildhook.dispatcher.api.dto;

import com.buildhook.dispatcher.model.Build;

import java.time.Instant;

/**
 * Response body for GET /builds and GET /builds/{taskGroupId}.
 * state is the lower-case wire name: queued, success or failure.
 */
public record BuildResponse(
        String  taskGroupId,
        String  organization,
        String  repository,
        String  sha,
        String  state,
        long    installationId,
        String  eventType,
        String  eventId,
        Instant created,
        Instant updated
) {
    public static BuildResponse from(Build build) {
        return new BuildResponse(
                build.getTaskGroupId(),
                build.getOrganization(),
                build.getRepository(),
                build.getSha(),
                build.getState().wireName(),
                build.getInstallationId(),
                build.getEventType(),
                build.getEventId(),
                build.getCreated(),
                build.getUpdated()
        );
    }
}
