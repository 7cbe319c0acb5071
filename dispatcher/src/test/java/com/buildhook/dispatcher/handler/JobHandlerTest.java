package com.buildhook.dispatcher.handler;

import com.buildhook.dispatcher.event.EventType;
import com.buildhook.dispatcher.event.JobEvent;
import com.buildhook.dispatcher.github.CheckConclusion;
import com.buildhook.dispatcher.github.CheckRunRef;
import com.buildhook.dispatcher.github.CheckStatus;
import com.buildhook.dispatcher.github.HostClient;
import com.buildhook.dispatcher.github.HostClientFactory;
import com.buildhook.dispatcher.github.HostException;
import com.buildhook.dispatcher.github.NewCheckRun;
import com.buildhook.dispatcher.intree.IntreeConfigCompiler;
import com.buildhook.dispatcher.intree.RepoConfigParser;
import com.buildhook.dispatcher.model.Build;
import com.buildhook.dispatcher.model.BuildState;
import com.buildhook.dispatcher.model.CheckRunRecord;
import com.buildhook.dispatcher.permission.PullRequestPolicy;
import com.buildhook.dispatcher.store.BuildStore;
import com.buildhook.dispatcher.store.CheckRunStore;
import com.buildhook.dispatcher.store.RecordStoreException;
import com.buildhook.dispatcher.taskcluster.JobPlatformClient;
import com.buildhook.dispatcher.taskcluster.JobPlatformException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobHandler.
 *
 * GitHub, the job platform and both stores are mocked; the YAML parser,
 * config compiler and pull request policy are real, so each test drives the
 * handler from an actual .taskcluster.yml.
 */
@ExtendWith(MockitoExtension.class)
class JobHandlerTest {

    static final String  ORG    = "org";
    static final String  REPO   = "repo";
    static final String  SHA    = "03e9577bc1ec60f2ff0929d5f1554de36b8f48cf";
    static final String  CONFIG = ".taskcluster.yml";
    static final Instant NOW    = Instant.parse("2024-05-01T12:00:00Z");

    static final String TWO_TASKS = """
            version: 1
            tasks:
              - taskId: taskA
                provisionerId: aws-provisioner-v1
                workerType: github-worker
                payload: {command: [make, test]}
                metadata: {name: tests, owner: dev@example.com}
              - taskId: taskB
                provisionerId: aws-provisioner-v1
                workerType: github-worker
                payload: {command: [make, lint]}
                metadata: {name: lint, owner: dev@example.com}
            """;

    @Mock BuildStore        builds;
    @Mock CheckRunStore     checkRuns;
    @Mock HostClientFactory githubFactory;
    @Mock HostClient        github;
    @Mock JobPlatformClient queue;

    HandlerContext ctx;
    JobHandler     handler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        RepoConfigParser parser = new RepoConfigParser();
        HandlerSettings settings = new HandlerSettings(
                "Taskcluster", CONFIG,
                "https://tools.example.net/inspector/#/",
                "https://docs.example.net/who-can-trigger-jobs",
                Map.of(1, "https://example.net/schemas/github/v1/taskcluster-github-config.v1.yml"));
        ctx = new HandlerContext(builds, checkRuns, githubFactory, queue, parser,
                new IntreeConfigCompiler(parser, "taskcluster-github", clock),
                new PullRequestPolicy(parser, CONFIG),
                settings, clock);
        handler = new JobHandler();
        when(githubFactory.forInstallation(42L)).thenReturn(github);
    }

    // ------------------------------------------------------------------
    // Nothing to do
    // ------------------------------------------------------------------

    @Test
    void handle_noConfigFile_doesNothing() {
        when(github.getContent(ORG, REPO, CONFIG, SHA))
                .thenThrow(new HostException(HostException.Kind.NOT_FOUND, "Not Found"));

        handler.handle(ctx, pushEvent());

        verifyNoInteractions(queue, builds, checkRuns);
        verify(github, never()).createCommitComment(any(), any(), any(), any());
    }

    @Test
    void handle_configWithoutTasks_doesNothing() {
        when(github.getContent(ORG, REPO, CONFIG, SHA)).thenReturn("version: 1\ntasks: []\n");

        handler.handle(ctx, pushEvent());

        verifyNoInteractions(queue, builds, checkRuns);
        verify(github, never()).createCheckRun(any(), any(), any());
    }

    @Test
    void handle_githubErrorFetchingConfig_propagates() {
        when(github.getContent(ORG, REPO, CONFIG, SHA))
                .thenThrow(new HostException(HostException.Kind.API_ERROR, "502 Bad Gateway"));

        assertThatThrownBy(() -> handler.handle(ctx, pushEvent()))
                .isInstanceOf(HostException.class);
        verifyNoInteractions(queue, builds, checkRuns);
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void handle_pushWithTwoTasks_submitsAndRecordsEverything() {
        when(github.getContent(ORG, REPO, CONFIG, SHA)).thenReturn(TWO_TASKS);
        when(github.createCheckRun(eq(ORG), eq(REPO), any()))
                .thenReturn(new CheckRunRef("7001", "9001"), new CheckRunRef("7001", "9002"));

        handler.handle(ctx, pushEvent());

        // Both tasks submitted with the branch role as the only scope
        List<String> scopes = List.of("assume:repo:github.com/org/repo:branch:main");
        verify(queue).createTask(eq("taskA"), any(), eq(scopes));
        verify(queue).createTask(eq("taskB"), any(), eq(scopes));

        // One queued check-run per task
        ArgumentCaptor<NewCheckRun> runs = ArgumentCaptor.forClass(NewCheckRun.class);
        verify(github, times(2)).createCheckRun(eq(ORG), eq(REPO), runs.capture());
        NewCheckRun first = runs.getAllValues().get(0);
        assertThat(first.name()).isEqualTo("Task 0: Taskcluster (push)");
        assertThat(first.headSha()).isEqualTo(SHA);
        assertThat(first.status()).isEqualTo(CheckStatus.QUEUED);
        assertThat(first.conclusion()).isNull();
        assertThat(first.title()).isEqualTo("TaskGroup: Queued (for push)");
        assertThat(first.summary()).isEqualTo("Check for push");
        assertThat(first.detailsUrl())
                .isEqualTo("https://tools.example.net/inspector/#/taskA/tasks/taskA/details");
        assertThat(runs.getAllValues().get(1).name()).isEqualTo("Task 1: Taskcluster (push)");

        // One record per check-run
        ArgumentCaptor<CheckRunRecord> records = ArgumentCaptor.forClass(CheckRunRecord.class);
        verify(checkRuns, times(2)).create(records.capture());
        assertThat(records.getAllValues())
                .extracting(CheckRunRecord::getTaskId, CheckRunRecord::getCheckRunId)
                .containsExactly(
                        tuple("taskA", "9001"),
                        tuple("taskB", "9002"));

        // One queued build
        ArgumentCaptor<Build> build = ArgumentCaptor.forClass(Build.class);
        verify(builds).create(build.capture());
        assertThat(build.getValue().getTaskGroupId()).isEqualTo("taskA");
        assertThat(build.getValue().getState()).isEqualTo(BuildState.QUEUED);
        assertThat(build.getValue().getSha()).isEqualTo(SHA);
        assertThat(build.getValue().getEventType()).isEqualTo("push");
        assertThat(build.getValue().getInstallationId()).isEqualTo(42L);

        verify(github, never()).createCommitComment(any(), any(), any(), any());
    }

    @Test
    void handle_sanitizedNames_areRestoredBeforeCallingGithub() {
        JobEvent event = event("push", Map.of(JobEvent.HEAD_SHA, SHA, JobEvent.BASE_BRANCH, "main"),
                "my%org", "repo%js");
        when(github.getContent("my.org", "repo.js", CONFIG, SHA))
                .thenThrow(new HostException(HostException.Kind.NOT_FOUND, "Not Found"));

        handler.handle(ctx, event);

        verify(github).getContent("my.org", "repo.js", CONFIG, SHA);
    }

    @Test
    void handle_tagEvent_resolvesShaFromTag() {
        JobEvent event = event("tag", Map.of(JobEvent.VERSION, "v1.0"), ORG, REPO);
        when(github.getShaOfCommitRef(ORG, REPO, "refs/tags/v1.0")).thenReturn(SHA);
        when(github.getContent(ORG, REPO, CONFIG, SHA)).thenReturn(TWO_TASKS);
        when(github.createCheckRun(eq(ORG), eq(REPO), any())).thenReturn(new CheckRunRef("1", "2"));

        handler.handle(ctx, event);

        List<String> scopes = List.of("assume:repo:github.com/org/repo:tag:v1.0");
        verify(queue).createTask(eq("taskA"), any(), eq(scopes));
        ArgumentCaptor<Build> build = ArgumentCaptor.forClass(Build.class);
        verify(builds).create(build.capture());
        assertThat(build.getValue().getSha()).isEqualTo(SHA);
    }

    // ------------------------------------------------------------------
    // Redelivery
    // ------------------------------------------------------------------

    @Test
    void handle_redeliveredEvent_matchingBuild_isAccepted() {
        when(github.getContent(ORG, REPO, CONFIG, SHA)).thenReturn(TWO_TASKS);
        when(github.createCheckRun(eq(ORG), eq(REPO), any())).thenReturn(new CheckRunRef("1", "2"));
        when(checkRuns.create(any()))
                .thenThrow(new RecordStoreException(RecordStoreException.Kind.ALREADY_EXISTS, "dup"));
        when(builds.create(any()))
                .thenThrow(new RecordStoreException(RecordStoreException.Kind.ALREADY_EXISTS, "dup"));
        when(builds.load("taskA")).thenReturn(storedBuild(SHA, BuildState.QUEUED));

        handler.handle(ctx, pushEvent());

        verify(checkRuns, times(2)).create(any());
        verify(builds).load("taskA");
    }

    @Test
    void handle_redeliveredEvent_conflictingBuild_throwsConsistencyViolation() {
        when(github.getContent(ORG, REPO, CONFIG, SHA)).thenReturn(TWO_TASKS);
        when(github.createCheckRun(eq(ORG), eq(REPO), any())).thenReturn(new CheckRunRef("1", "2"));
        when(builds.create(any()))
                .thenThrow(new RecordStoreException(RecordStoreException.Kind.ALREADY_EXISTS, "dup"));
        when(builds.load("taskA")).thenReturn(storedBuild("ffffffff", BuildState.QUEUED));

        assertThatThrownBy(() -> handler.handle(ctx, pushEvent()))
                .isInstanceOf(BuildConsistencyException.class)
                .hasMessageContaining("sha is ffffffff instead of " + SHA);
    }

    @Test
    void handle_checkRunStoreFailure_otherThanDuplicate_propagates() {
        when(github.getContent(ORG, REPO, CONFIG, SHA)).thenReturn(TWO_TASKS);
        when(github.createCheckRun(eq(ORG), eq(REPO), any())).thenReturn(new CheckRunRef("1", "2"));
        when(checkRuns.create(any()))
                .thenThrow(new RecordStoreException(RecordStoreException.Kind.CONFLICT, "boom"));

        assertThatThrownBy(() -> handler.handle(ctx, pushEvent()))
                .isInstanceOf(RecordStoreException.class);
    }

    // ------------------------------------------------------------------
    // User errors: comments, nothing submitted
    // ------------------------------------------------------------------

    @Test
    void handle_invalidYaml_commentsOnCommitAndStops() {
        when(github.getContent(ORG, REPO, CONFIG, SHA)).thenReturn("tasks: [unclosed");

        handler.handle(ctx, pushEvent());

        verify(github).createCommitComment(eq(ORG), eq(REPO), eq(SHA),
                contains("Submitting the task to Taskcluster failed"));
        verifyNoInteractions(queue, builds, checkRuns);
    }

    @Test
    void handle_unsupportedVersion_commentsOnCommitAndStops() {
        when(github.getContent(ORG, REPO, CONFIG, SHA)).thenReturn("version: 7\ntasks: []\n");

        handler.handle(ctx, pushEvent());

        verify(github).createCommitComment(eq(ORG), eq(REPO), eq(SHA), contains("version"));
        verifyNoInteractions(queue, builds, checkRuns);
    }

    @Test
    void handle_pullRequestFromNonCollaborator_commentsAndCreatesNothing() {
        when(github.getContent(ORG, REPO, CONFIG, SHA)).thenReturn(TWO_TASKS);
        when(github.getDefaultBranch(ORG, REPO)).thenReturn("main");
        when(github.getContent(ORG, REPO, CONFIG, "main")).thenReturn("version: 1\ntasks: []\n");
        when(github.isCollaborator(ORG, REPO, "mallory")).thenReturn(false);

        handler.handle(ctx, pullRequestEvent("mallory"));

        verify(github).createComment(eq(ORG), eq(REPO), eq(17), contains("allowPullRequests"));
        verifyNoInteractions(queue, builds, checkRuns);
        verify(github, never()).createCheckRun(any(), any(), any());
    }

    @Test
    void handle_pullRequestFromCollaborator_isSubmitted() {
        when(github.getContent(ORG, REPO, CONFIG, SHA)).thenReturn(TWO_TASKS);
        when(github.getDefaultBranch(ORG, REPO)).thenReturn("main");
        when(github.getContent(ORG, REPO, CONFIG, "main")).thenReturn("version: 1\ntasks: []\n");
        when(github.isCollaborator(ORG, REPO, "alice")).thenReturn(true);
        when(github.createCheckRun(eq(ORG), eq(REPO), any())).thenReturn(new CheckRunRef("1", "2"));

        handler.handle(ctx, pullRequestEvent("alice"));

        verify(queue, times(2)).createTask(anyString(), any(),
                eq(List.of("assume:repo:github.com/org/repo:pull-request")));
        ArgumentCaptor<NewCheckRun> runs = ArgumentCaptor.forClass(NewCheckRun.class);
        verify(github, times(2)).createCheckRun(eq(ORG), eq(REPO), runs.capture());
        assertThat(runs.getValue().name()).isEqualTo("Task 1: Taskcluster (pull_request)");
        assertThat(runs.getValue().title()).isEqualTo("TaskGroup: Queued (for pull_request.opened)");
        verify(github, never()).createComment(any(), any(), anyInt(), any());
    }

    @Test
    void handle_defaultBranchConfigInvalid_commentsWithBranchName() {
        when(github.getContent(ORG, REPO, CONFIG, SHA)).thenReturn(TWO_TASKS);
        when(github.getDefaultBranch(ORG, REPO)).thenReturn("main");
        when(github.getContent(ORG, REPO, CONFIG, "main")).thenReturn("tasks: [unclosed");

        handler.handle(ctx, pullRequestEvent("alice"));

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(github).createComment(eq(ORG), eq(REPO), eq(17), body.capture());
        assertThat(body.getValue())
                .contains("**on default branch main**")
                .contains("https://docs.example.net/who-can-trigger-jobs");
        verifyNoInteractions(queue, builds, checkRuns);
    }

    // ------------------------------------------------------------------
    // Submission failure: comment, then failed bookkeeping
    // ------------------------------------------------------------------

    @Test
    void handle_submissionFails_recordsFailedCheckRunsAndBuild() {
        when(github.getContent(ORG, REPO, CONFIG, SHA)).thenReturn(TWO_TASKS);
        doThrow(new JobPlatformException("createTask taskA failed", 403,
                "Client has insufficient scopes"))
                .when(queue).createTask(eq("taskA"), any(), any());
        when(github.createCheckRun(eq(ORG), eq(REPO), any())).thenReturn(new CheckRunRef("1", "2"));

        handler.handle(ctx, pushEvent());

        verify(github).createCommitComment(eq(ORG), eq(REPO), eq(SHA),
                contains("Client has insufficient scopes"));
        // The first failure stops submission
        verify(queue, never()).createTask(eq("taskB"), any(), any());

        ArgumentCaptor<NewCheckRun> runs = ArgumentCaptor.forClass(NewCheckRun.class);
        verify(github, times(2)).createCheckRun(eq(ORG), eq(REPO), runs.capture());
        assertThat(runs.getAllValues()).allSatisfy(run -> {
            assertThat(run.status()).isEqualTo(CheckStatus.COMPLETED);
            assertThat(run.conclusion()).isEqualTo(CheckConclusion.FAILURE);
            assertThat(run.completedAt()).isEqualTo(NOW);
            assertThat(run.title()).isEqualTo("TaskGroup: Failure (for push)");
        });

        ArgumentCaptor<Build> build = ArgumentCaptor.forClass(Build.class);
        verify(builds).create(build.capture());
        assertThat(build.getValue().getState()).isEqualTo(BuildState.FAILURE);
    }

    @Test
    void handle_pullRequestSubmissionFails_commentsOnCommitNotPullRequest() {
        when(github.getContent(ORG, REPO, CONFIG, SHA)).thenReturn(TWO_TASKS);
        when(github.getDefaultBranch(ORG, REPO)).thenReturn("main");
        when(github.getContent(ORG, REPO, CONFIG, "main")).thenReturn("version: 1\ntasks: []\n");
        when(github.isCollaborator(ORG, REPO, "alice")).thenReturn(true);
        doThrow(new JobPlatformException("createTask taskA failed", 400, "Task definition invalid"))
                .when(queue).createTask(eq("taskA"), any(), any());
        when(github.createCheckRun(eq(ORG), eq(REPO), any())).thenReturn(new CheckRunRef("1", "2"));

        handler.handle(ctx, pullRequestEvent("alice"));

        verify(github).createCommitComment(eq(ORG), eq(REPO), eq(SHA), contains("Task definition invalid"));
        verify(github, never()).createComment(any(), any(), anyInt(), any());
        verify(builds).create(any());
    }

    @Test
    void handle_submissionFailsAndCommentFails_stillRecordsBuild() {
        when(github.getContent(ORG, REPO, CONFIG, SHA)).thenReturn(TWO_TASKS);
        doThrow(new JobPlatformException("createTask taskA failed", 500, "internal"))
                .when(queue).createTask(eq("taskA"), any(), any());
        doThrow(new HostException(HostException.Kind.API_ERROR, "comment rejected"))
                .when(github).createCommitComment(any(), any(), any(), any());
        when(github.createCheckRun(eq(ORG), eq(REPO), any())).thenReturn(new CheckRunRef("1", "2"));

        assertThatThrownBy(() -> handler.handle(ctx, pushEvent()))
                .isInstanceOf(HostException.class);

        verify(checkRuns, times(2)).create(any());
        verify(builds).create(any());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static JobEvent pushEvent() {
        return event("push", Map.of(JobEvent.HEAD_SHA, SHA, JobEvent.BASE_BRANCH, "main"), ORG, REPO);
    }

    private static JobEvent pullRequestEvent(String login) {
        Map<String, Object> details = new HashMap<>();
        details.put(JobEvent.HEAD_SHA, SHA);
        details.put(JobEvent.PULL_NUMBER, 17);
        details.put(JobEvent.HEAD_USER_LOGIN, login);
        return event("pull_request.opened", details, ORG, REPO);
    }

    private static JobEvent event(String type, Map<String, Object> details, String org, String repo) {
        JsonNode payload = NullNode.getInstance();
        return new JobEvent(42L, org, repo, "delivery-1", EventType.parse(type), details, payload);
    }

    private static Build storedBuild(String sha, BuildState state) {
        return new Build("taskA", ORG, REPO, sha, state, 42L, "push", "delivery-1", NOW);
    }
}
