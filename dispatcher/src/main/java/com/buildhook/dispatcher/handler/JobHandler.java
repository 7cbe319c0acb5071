package com.buildhook.dispatcher.handler;

import com.buildhook.dispatcher.event.EventKind;
import com.buildhook.dispatcher.event.JobEvent;
import com.buildhook.dispatcher.github.CheckRunRef;
import com.buildhook.dispatcher.github.HostClient;
import com.buildhook.dispatcher.github.HostException;
import com.buildhook.dispatcher.github.NewCheckRun;
import com.buildhook.dispatcher.intree.CompileRequest;
import com.buildhook.dispatcher.intree.ConfigException;
import com.buildhook.dispatcher.intree.TaskDefinition;
import com.buildhook.dispatcher.intree.TaskGraph;
import com.buildhook.dispatcher.model.Build;
import com.buildhook.dispatcher.model.CheckRunRecord;
import com.buildhook.dispatcher.permission.PermissionCheckException;
import com.buildhook.dispatcher.store.RecordStoreException;
import com.buildhook.dispatcher.taskcluster.JobPlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns one webhook event into a submitted task group.
 *
 * Pipeline:
 *   1. decode organization / repository
 *   2. resolve the commit sha (tag events only carry the tag name)
 *   3. fetch .taskcluster.yml at that sha      -> absent: repo not opted in, stop
 *   4. parse it as YAML                        -> invalid: comment, stop
 *   5. compile it to a task graph              -> no tasks: stop; invalid: comment, stop
 *   6. pull requests: check the PR policy      -> denied: comment, stop
 *   7. submit every task                       -> failure: comment, carry on
 *   8. open one check-run per task, record it
 *   9. record the build
 *
 * Steps 8 and 9 run whatever step 7's outcome was, so a failed submission
 * still shows up as failed check-runs on the commit.
 *
 * Redelivery of the same event is safe: existing check-run and build records
 * are left alone.
 */
@Component
public class JobHandler {

    private static final Logger log = LoggerFactory.getLogger(JobHandler.class);

    public void handle(HandlerContext ctx, JobEvent event) {
        MDC.put("eventId", event.eventId());
        log.info("Received {} event. Starting processing...", event.eventType());

        HostClient github = ctx.github().forInstallation(event.installationId());

        // Routing keys cannot contain dots, so the publisher replaced them with '%'.
        String organization = JobEvent.desanitize(event.organization());
        String repository   = JobEvent.desanitize(event.repository());
        String sha          = resolveSha(github, organization, repository, event);
        CommentTarget target = new CommentTarget(github, organization, repository, sha,
                event.pullNumber().orElse(null));

        log.info("Handling {} webhook for {}/{}@{}", event.eventType(), organization, repository, sha);

        // --- 3. Fetch config ---
        Optional<String> config = fetchConfig(ctx, github, organization, repository, sha);
        if (config.isEmpty()) {
            log.info("{}/{} has no '{}'. Skipping.", organization, repository, ctx.settings().configFile());
            return;
        }

        // --- 4. Parse ---
        try {
            ctx.configParser().parse(config.get());
        } catch (ConfigException e) {
            log.info("'{}' in {}/{}@{} is not valid YAML. Leaving comment on GitHub.",
                    ctx.settings().configFile(), organization, repository, sha);
            target.comment(Comments.submissionFailed(e.getMessage()));
            return;
        }

        // --- 5. Compile ---
        TaskGraph graph;
        try {
            graph = ctx.intree().compile(new CompileRequest(
                    config.get(), organization, repository, event, ctx.settings().schemas()));
        } catch (ConfigException e) {
            log.info("'{}' was not formatted correctly. Leaving comment on GitHub.", ctx.settings().configFile());
            target.comment(Comments.submissionFailed(e.getMessage()));
            return;
        }
        if (graph.isEmpty()) {
            log.info("Config for {}/{} compiled with zero tasks. Skipping.", organization, repository);
            return;
        }

        // --- 6. Pull request policy ---
        if (event.eventType().kind() == EventKind.PULL_REQUEST
                && !pullRequestAllowed(ctx, target, event)) {
            return;
        }

        // --- 7. Submit ---
        String taskGroupId = graph.taskGroupId();
        MDC.put("taskGroupId", taskGroupId);
        SubmissionOutcome outcome = submit(ctx, graph);

        // --- 8 + 9. Bookkeeping, whatever the outcome ---
        try {
            if (outcome.isFailure()) {
                log.info("Creating tasks failed! Leaving comment on GitHub.");
                target.commentOnCommit(Comments.submissionFailed(errorBody(outcome.error())));
            }
        } finally {
            recordCheckRuns(ctx, target, event, graph, outcome);
            recordBuild(ctx, event, organization, repository, sha, taskGroupId, outcome);
        }
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    private String resolveSha(HostClient github, String organization, String repository, JobEvent event) {
        Optional<String> headSha = event.headSha();
        if (headSha.isPresent()) {
            return headSha.get();
        }
        String tag = event.version().orElseThrow(() -> new IllegalArgumentException(
                "Event " + event.eventId() + " carries neither a head sha nor a tag"));
        log.debug("Resolving tag {} to a commit", tag);
        return github.getShaOfCommitRef(organization, repository, "refs/tags/" + tag);
    }

    private Optional<String> fetchConfig(HandlerContext ctx, HostClient github,
                                         String organization, String repository, String sha) {
        try {
            return Optional.of(github.getContent(organization, repository, ctx.settings().configFile(), sha));
        } catch (HostException e) {
            if (e.is(HostException.Kind.NOT_FOUND)) {
                return Optional.empty();
            }
            throw e;
        }
    }

    private boolean pullRequestAllowed(HandlerContext ctx, CommentTarget target, JobEvent event) {
        log.debug("Checking pull request permission...");
        String login = event.headUserLogin().orElse(null);
        try {
            if (ctx.pullRequestPolicy().isAllowed(target.github(), target.organization(), target.repository(), login)) {
                return true;
            }
            log.info("Pull request by {} is not allowed to start tasks", login);
            target.comment(Comments.pullRequestNotAllowed(ctx.settings().configFile()));
        } catch (PermissionCheckException e) {
            log.info("Default branch {} config is invalid; cannot check pull request permission", e.getBranch());
            target.comment(Comments.defaultBranchConfigError(
                    ctx.settings().configFile(), e.getBranch(), ctx.settings().docsUrl(), e.getMessage()));
        }
        return false;
    }

    private SubmissionOutcome submit(HandlerContext ctx, TaskGraph graph) {
        log.info("Creating {} tasks", graph.tasks().size());
        try {
            for (TaskDefinition task : graph.tasks()) {
                ctx.queue().createTask(task.taskId(), task.task(), graph.scopes());
            }
            return SubmissionOutcome.queued();
        } catch (RuntimeException e) {
            log.warn("Task submission failed: {}", e.getMessage());
            return SubmissionOutcome.failed(e, ctx.clock().instant());
        }
    }

    private void recordCheckRuns(HandlerContext ctx, CommentTarget target, JobEvent event,
                                 TaskGraph graph, SubmissionOutcome outcome) {
        log.debug("Creating check runs for {}/{}@{} ({})",
                target.organization(), target.repository(), target.sha(), outcome.status());
        String taskGroupId = graph.taskGroupId();
        String eventType   = event.eventType().raw();
        List<TaskDefinition> tasks = graph.tasks();

        for (int i = 0; i < tasks.size(); i++) {
            TaskDefinition task = tasks.get(i);
            CheckRunRef ref = target.github().createCheckRun(target.organization(), target.repository(),
                    new NewCheckRun(
                            "Task " + i + ": " + ctx.settings().statusContext()
                                    + " (" + event.eventType().kind().webhookName() + ")",
                            target.sha(),
                            outcome.status(),
                            outcome.conclusion(),
                            outcome.completedAt(),
                            "TaskGroup: " + outcome.title() + " (for " + eventType + ")",
                            "Check for " + eventType,
                            ctx.settings().inspectorUrl() + taskGroupId + "/tasks/" + task.taskId() + "/details"));
            try {
                ctx.checkRuns().create(new CheckRunRecord(
                        taskGroupId, task.taskId(), ref.checkSuiteId(), ref.checkRunId()));
            } catch (RecordStoreException e) {
                if (!e.is(RecordStoreException.Kind.ALREADY_EXISTS)) {
                    throw e;
                }
                log.debug("Check run for task {} already recorded", task.taskId());
            }
        }
    }

    private void recordBuild(HandlerContext ctx, JobEvent event, String organization, String repository,
                             String sha, String taskGroupId, SubmissionOutcome outcome) {
        Instant now = ctx.clock().instant();
        Build build = new Build(taskGroupId, organization, repository, sha, outcome.buildState(),
                event.installationId(), event.eventType().raw(), event.eventId(), now);
        try {
            ctx.builds().create(build);
        } catch (RecordStoreException e) {
            if (!e.is(RecordStoreException.Kind.ALREADY_EXISTS)) {
                throw e;
            }
            log.info("Build for task group {} already exists (redelivery); verifying it", taskGroupId);
            verifyDuplicate(ctx.builds().load(taskGroupId), build);
        }
    }

    /** A redelivered event must reproduce the stored build exactly. */
    static void verifyDuplicate(Build existing, Build expected) {
        List<String> mismatches = new ArrayList<>();
        compare(mismatches, "state",        existing.getState(),        expected.getState());
        compare(mismatches, "organization", existing.getOrganization(), expected.getOrganization());
        compare(mismatches, "repository",   existing.getRepository(),   expected.getRepository());
        compare(mismatches, "sha",          existing.getSha(),          expected.getSha());
        compare(mismatches, "eventType",    existing.getEventType(),    expected.getEventType());
        compare(mismatches, "eventId",      existing.getEventId(),      expected.getEventId());
        if (!mismatches.isEmpty()) {
            throw new BuildConsistencyException(expected.getTaskGroupId(), mismatches);
        }
    }

    private static void compare(List<String> mismatches, String field, Object stored, Object computed) {
        if (!Objects.equals(stored, computed)) {
            mismatches.add(field + " is " + stored + " instead of " + computed);
        }
    }

    private static String errorBody(RuntimeException error) {
        if (error instanceof JobPlatformException e) {
            return e.detail();
        }
        return error.getMessage();
    }

    // ------------------------------------------------------------------
    // Where user-facing comments go
    // ------------------------------------------------------------------

    /**
     * Comments go on the pull request when the event has one, otherwise on
     * the commit.
     */
    private record CommentTarget(HostClient github, String organization, String repository,
                                 String sha, Integer pullNumber) {

        void comment(String body) {
            if (pullNumber != null) {
                log.debug("Creating comment on {}/{}#{}", organization, repository, pullNumber);
                github.createComment(organization, repository, pullNumber, body);
            } else {
                commentOnCommit(body);
            }
        }

        // Submission failures are reported on the commit even for pull requests.
        void commentOnCommit(String body) {
            log.debug("Creating comment on {}/{}@{}", organization, repository, sha);
            github.createCommitComment(organization, repository, sha, body);
        }
    }
}
