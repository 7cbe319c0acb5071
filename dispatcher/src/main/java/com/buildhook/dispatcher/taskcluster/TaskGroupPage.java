package com.buildhook.dispatcher.taskcluster;

import java.util.List;

/**
 * One page of a task group listing.
 *
 * @param continuationToken token for the next page, or null on the last page
 */
public record TaskGroupPage(List<TaskSummary> tasks, String continuationToken) {

    public boolean hasMore() {
        return continuationToken != null && !continuationToken.isEmpty();
    }
}
