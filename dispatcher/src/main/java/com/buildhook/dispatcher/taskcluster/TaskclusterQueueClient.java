package com.buildhook.dispatcher.taskcluster;

import com.buildhook.dispatcher.event.TaskState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for the Taskcluster queue service.
 *
 * Uses java.net.http.HttpClient directly; the two endpoints we call are
 * plain JSON over HTTPS and only task creation needs credentials.
 *
 *   PUT /api/queue/v1/task/{taskId}                 (Hawk, authorized scopes)
 *   GET /api/queue/v1/task-group/{taskGroupId}/list (unauthenticated)
 */
@Component
public class TaskclusterQueueClient implements JobPlatformClient {

    private static final Logger log = LoggerFactory.getLogger(TaskclusterQueueClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final HawkSigner   signer;

    public TaskclusterQueueClient(
            @Value("${buildhook.taskcluster.root-url}") String rootUrl,
            @Value("${buildhook.taskcluster.client-id}") String clientId,
            @Value("${buildhook.taskcluster.access-token}") String accessToken,
            ObjectMapper objectMapper) {
        this.baseUrl = stripTrailingSlash(rootUrl) + "/api/queue/v1";
        this.json    = objectMapper;
        this.signer  = new HawkSigner(clientId, accessToken, objectMapper, Clock.systemUTC());
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Task creation
    // ------------------------------------------------------------------

    @Override
    public void createTask(String taskId, JsonNode definition, List<String> authorizedScopes) {
        log.debug("Creating task {}", taskId);
        URI uri = URI.create(baseUrl + "/task/" + encode(taskId));
        String body;
        try {
            body = json.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new JobPlatformException("Could not serialise task " + taskId, e);
        }
        HttpRequest req = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofSeconds(60))
                .header("Content-Type",  "application/json")
                .header("Accept",        "application/json")
                .header("Authorization", signer.authorization("PUT", uri, authorizedScopes))
                .PUT(HttpRequest.BodyPublishers.ofString(body))
                .build();
        send(req, "createTask " + taskId);
    }

    // ------------------------------------------------------------------
    // Task group listing
    // ------------------------------------------------------------------

    @Override
    public TaskGroupPage listTaskGroup(String taskGroupId, String continuationToken) {
        String url = baseUrl + "/task-group/" + encode(taskGroupId) + "/list";
        if (continuationToken != null) {
            url += "?continuationToken=" + encode(continuationToken);
        }
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(60))
                .header("Accept", "application/json")
                .GET()
                .build();
        String respBody = send(req, "listTaskGroup " + taskGroupId);
        try {
            JsonNode root = json.readTree(respBody);
            List<TaskSummary> tasks = new ArrayList<>();
            for (JsonNode entry : root.path("tasks")) {
                JsonNode status = entry.path("status");
                tasks.add(new TaskSummary(
                        status.path("taskId").asText(),
                        TaskState.fromWire(status.path("state").asText(null))));
            }
            JsonNode token = root.get("continuationToken");
            return new TaskGroupPage(tasks, token == null || token.isNull() ? null : token.asText());
        } catch (JsonProcessingException e) {
            throw new JobPlatformException("Failed to parse listTaskGroup response for " + taskGroupId, e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String send(HttpRequest req, String opName) {
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobPlatformException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new JobPlatformException(opName + " failed", e);
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new JobPlatformException(
                    opName + " failed: HTTP " + resp.statusCode(),
                    resp.statusCode(),
                    errorDetail(resp.body()));
        }
        return resp.body();
    }

    /** The queue's error bodies look like {code, message, requestInfo}; keep the message. */
    private String errorDetail(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode root = json.readTree(body);
            if (root.hasNonNull("message")) {
                return root.get("message").asText();
            }
            return json.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
