package com.buildhook.dispatcher.intree;

import com.buildhook.dispatcher.event.EventKind;
import com.buildhook.dispatcher.event.JobEvent;
import com.buildhook.dispatcher.util.Slugids;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles version 1 .taskcluster.yml files.
 *
 * The config's {@code tasks} entries are literal task definitions. An entry
 * may carry a {@code tasksFor} list (github-push, github-pull-request,
 * github-release, github-tag) to run only for those events; entries without
 * it run for every event. The compiler then:
 * <ul>
 *   <li>assigns a slug id to every task without a {@code taskId};</li>
 *   <li>puts all tasks in one task group, named after the first task unless
 *       the first task names one;</li>
 *   <li>fills in {@code schedulerId}, {@code created} and {@code deadline};</li>
 *   <li>grants the repository's role for the event as the only scope.</li>
 * </ul>
 */
@Component
public class IntreeConfigCompiler implements ConfigCompiler {

    static final Duration DEFAULT_DEADLINE = Duration.ofDays(1);

    private static final List<String> REQUIRED_FIELDS = List.of("provisionerId", "workerType", "payload", "metadata");

    private final RepoConfigParser parser;
    private final String           schedulerId;
    private final Clock            clock;

    public IntreeConfigCompiler(RepoConfigParser parser,
                                @Value("${buildhook.taskcluster.scheduler-id}") String schedulerId,
                                Clock clock) {
        this.parser      = parser;
        this.schedulerId = schedulerId;
        this.clock       = clock;
    }

    @Override
    public TaskGraph compile(CompileRequest request) {
        JsonNode config = parser.parse(request.config());
        String schemaUrl = request.schemas().get(1);

        if (!config.isObject()) {
            throw schemaError("The config must be a YAML mapping", schemaUrl);
        }
        JsonNode version = config.get("version");
        if (version == null || !version.canConvertToInt() || version.asInt() != 1) {
            throw schemaError("Unsupported config version " + version
                    + "; only `version: 1` is supported", schemaUrl);
        }

        List<String> scopes = List.of(repoScope(request));
        JsonNode entries = config.path("tasks");
        if (entries.isMissingNode() || entries.isNull()) {
            return new TaskGraph(scopes, List.of());
        }
        if (!entries.isArray()) {
            throw schemaError("`tasks` must be a list", schemaUrl);
        }

        String tasksFor = request.event().eventType().kind().tasksFor();
        List<ObjectNode> selected = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            JsonNode entry = entries.get(i);
            if (!entry.isObject()) {
                throw schemaError("tasks[" + i + "] must be a mapping", schemaUrl);
            }
            ObjectNode task = ((ObjectNode) entry).deepCopy();
            JsonNode filter = task.remove("tasksFor");
            if (filter != null && !appliesTo(filter, tasksFor, i, schemaUrl)) {
                continue;
            }
            for (String field : REQUIRED_FIELDS) {
                if (!task.hasNonNull(field)) {
                    throw schemaError("tasks[" + i + "] is missing required field `" + field + "`", schemaUrl);
                }
            }
            selected.add(task);
        }
        if (selected.isEmpty()) {
            return new TaskGraph(scopes, List.of());
        }

        Instant now = clock.instant();
        List<TaskDefinition> tasks = new ArrayList<>();
        String taskGroupId = null;
        for (ObjectNode task : selected) {
            JsonNode id = task.remove("taskId");
            String taskId = id != null && id.isTextual() ? id.asText() : Slugids.nice();
            if (taskGroupId == null) {
                taskGroupId = task.hasNonNull("taskGroupId") ? task.get("taskGroupId").asText() : taskId;
            }
            task.put("taskGroupId", taskGroupId);
            if (!task.hasNonNull("schedulerId")) {
                task.put("schedulerId", schedulerId);
            }
            if (!task.hasNonNull("created")) {
                task.put("created", now.toString());
            }
            if (!task.hasNonNull("deadline")) {
                task.put("deadline", now.plus(DEFAULT_DEADLINE).toString());
            }
            tasks.add(new TaskDefinition(taskId, task));
        }
        return new TaskGraph(scopes, tasks);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static boolean appliesTo(JsonNode filter, String tasksFor, int index, String schemaUrl) {
        if (!filter.isArray()) {
            throw schemaError("tasks[" + index + "].tasksFor must be a list", schemaUrl);
        }
        for (JsonNode value : filter) {
            if (tasksFor.equals(value.asText())) {
                return true;
            }
        }
        return false;
    }

    /** The role a task graph for this repository and event may assume. */
    static String repoScope(CompileRequest request) {
        JobEvent event = request.event();
        String prefix = "assume:repo:github.com/" + request.organization() + "/" + request.repository();
        EventKind kind = event.eventType().kind();
        return switch (kind) {
            case PUSH         -> prefix + ":branch:" + event.baseBranch().orElse("unknown");
            case PULL_REQUEST -> prefix + ":pull-request";
            case RELEASE      -> prefix + ":release";
            case TAG          -> prefix + ":tag:" + event.version().orElse("unknown");
        };
    }

    private static ConfigException schemaError(String message, String schemaUrl) {
        return new ConfigException(ConfigException.Kind.SCHEMA,
                message + (schemaUrl != null ? " (schema: " + schemaUrl + ")" : ""));
    }
}
