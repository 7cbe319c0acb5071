package com.buildhook.dispatcher.handler;

import com.buildhook.dispatcher.event.GroupResolvedEvent;
import com.buildhook.dispatcher.model.Build;
import com.buildhook.dispatcher.model.BuildState;
import com.buildhook.dispatcher.taskcluster.TaskGroupPage;
import com.buildhook.dispatcher.taskcluster.TaskSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Records the final state of a build once its task group resolves.
 *
 * The group is SUCCESS unless any member task failed or hit an exception.
 * A build already marked FAILURE stays FAILURE: group-resolved events can
 * overtake task events, and a failure must never be overwritten by a later
 * aggregation.
 */
@Component
public class GroupStatusHandler {

    private static final Logger log = LoggerFactory.getLogger(GroupStatusHandler.class);

    public void handle(HandlerContext ctx, GroupResolvedEvent event) {
        String taskGroupId = event.taskGroupId();
        Build build = ctx.builds().load(taskGroupId);
        MDC.put("eventId", build.getEventId());
        MDC.put("taskGroupId", taskGroupId);
        log.info("Handling state change for task group {}", taskGroupId);

        BuildState groupState = aggregate(ctx, taskGroupId);

        Build updated = ctx.builds().modify(taskGroupId, b -> {
            if (b.getState() != BuildState.FAILURE) {
                b.setState(groupState);
                b.setUpdated(ctx.clock().instant());
            }
        });
        log.info("Task group {} resolved as {}; build is {}", taskGroupId, groupState, updated.getState());
    }

    private BuildState aggregate(HandlerContext ctx, String taskGroupId) {
        BuildState state = BuildState.SUCCESS;
        String continuationToken = null;
        do {
            TaskGroupPage page = ctx.queue().listTaskGroup(taskGroupId, continuationToken);
            for (TaskSummary task : page.tasks()) {
                if (task.state().isFailure()) {
                    state = BuildState.FAILURE;
                }
            }
            continuationToken = page.hasMore() ? page.continuationToken() : null;
        } while (continuationToken != null);
        return state;
    }
}
