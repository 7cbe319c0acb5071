package com.buildhook.dispatcher.handler;

import com.buildhook.dispatcher.event.TaskStatusEvent;
import com.buildhook.dispatcher.github.CheckConclusion;
import com.buildhook.dispatcher.github.CheckStatus;
import com.buildhook.dispatcher.github.HostClient;
import com.buildhook.dispatcher.model.Build;
import com.buildhook.dispatcher.model.CheckRunKey;
import com.buildhook.dispatcher.model.CheckRunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Completes a task's check-run when the task reaches a terminal state.
 *
 * The build and check-run records must already exist: the job handler writes
 * both before any task of the group can run. A missing record, or any GitHub
 * failure, propagates so the message is redelivered; a skipped update would
 * leave the check-run queued forever.
 */
@Component
public class StatusHandler {

    private static final Logger log = LoggerFactory.getLogger(StatusHandler.class);

    public void handle(HandlerContext ctx, TaskStatusEvent event) {
        Build build = ctx.builds().load(event.taskGroupId());
        MDC.put("eventId", build.getEventId());
        MDC.put("taskGroupId", event.taskGroupId());
        log.info("Handling state change for task {} in group {}", event.taskId(), event.taskGroupId());

        CheckConclusion conclusion  = CheckRunTables.conclusionFor(event.state());
        Instant         completedAt = ctx.clock().instant();

        CheckRunRecord checkRun = ctx.checkRuns().load(new CheckRunKey(event.taskGroupId(), event.taskId()));

        HostClient github = ctx.github().forInstallation(build.getInstallationId());

        log.debug("Updating check run {} for {}/{}@{} to {}",
                checkRun.getCheckRunId(), build.getOrganization(), build.getRepository(),
                build.getSha(), conclusion);
        github.updateCheckRun(build.getOrganization(), build.getRepository(), checkRun.getCheckRunId(),
                CheckStatus.COMPLETED, conclusion, completedAt);
    }
}
