package com.buildhook.dispatcher.github;

import java.time.Instant;

/**
 * Everything needed to open a check-run on a commit.
 *
 * @param conclusion  null unless status is COMPLETED
 * @param completedAt null unless status is COMPLETED
 */
public record NewCheckRun(
        String          name,
        String          headSha,
        CheckStatus     status,
        CheckConclusion conclusion,
        Instant         completedAt,
        String          title,
        String          summary,
        String          detailsUrl
) {}
