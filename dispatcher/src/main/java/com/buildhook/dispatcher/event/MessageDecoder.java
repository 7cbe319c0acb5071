package com.buildhook.dispatcher.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Turns raw queue payloads into typed events.
 *
 * Message shapes:
 * <pre>
 *   job:          { installationId, organization, repository, eventId, eventType,
 *                   details: { "event.head.sha": ..., "event.pullNumber": ..., ... } }
 *   task-status:  { status: { taskGroupId, taskId, state, schedulerId } }
 *   group-status: { taskGroupId, schedulerId }
 * </pre>
 * Older job messages carry the event type only as {@code details["event.type"]};
 * that is accepted as a fallback.
 */
@Component
public class MessageDecoder {

    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {};

    private final ObjectMapper json;

    public MessageDecoder(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public JobEvent decodeJob(String payload) {
        JsonNode root = parse(payload);
        JsonNode detailsNode = root.path("details");
        Map<String, Object> details = detailsNode.isObject()
                ? json.convertValue(detailsNode, DETAILS_TYPE)
                : Map.of();

        String eventType = root.hasNonNull("eventType")
                ? root.get("eventType").asText()
                : (String) details.get("event.type");

        JsonNode installation = require(root, "installationId");
        if (!installation.canConvertToLong()) {
            throw new MalformedMessageException("installationId is not numeric: " + installation);
        }

        return new JobEvent(
                installation.asLong(),
                require(root, "organization").asText(),
                require(root, "repository").asText(),
                require(root, "eventId").asText(),
                EventType.parse(eventType),
                details,
                root);
    }

    public TaskStatusEvent decodeTaskStatus(String payload) {
        JsonNode status = require(parse(payload), "status");
        return new TaskStatusEvent(
                require(status, "taskGroupId").asText(),
                require(status, "taskId").asText(),
                TaskState.fromWire(require(status, "state").asText()));
    }

    public GroupResolvedEvent decodeGroupResolved(String payload) {
        return new GroupResolvedEvent(require(parse(payload), "taskGroupId").asText());
    }

    /** Fails with {@link MalformedMessageException} unless the payload is a JSON object. */
    public void requireObject(String payload) {
        parse(payload);
    }

    /**
     * Scheduler id a job-platform message was emitted for, or null if absent.
     * Task-status messages carry it inside {@code status}.
     */
    public String schedulerIdOf(String payload) {
        JsonNode root = parse(payload);
        JsonNode id = root.path("status").path("schedulerId");
        if (id.isMissingNode() || id.isNull()) {
            id = root.path("schedulerId");
        }
        return id.isTextual() ? id.asText() : null;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private JsonNode parse(String payload) {
        try {
            JsonNode root = json.readTree(payload);
            if (root == null || !root.isObject()) {
                throw new MalformedMessageException("Message is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Message is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode require(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new MalformedMessageException("Missing required field '" + field + "'");
        }
        return value;
    }
}
