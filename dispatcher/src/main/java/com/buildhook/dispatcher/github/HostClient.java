package com.buildhook.dispatcher.github;

import java.time.Instant;

/**
 * GitHub operations, authenticated as one app installation.
 *
 * Every method throws {@link HostException}; NOT_FOUND is reported for a
 * missing file, ref, repository or user.
 */
public interface HostClient {

    /** Decoded text of {@code path} at {@code ref}. */
    String getContent(String owner, String repo, String path, String ref);

    /** Commit sha a ref such as {@code refs/tags/v1.0} points at. */
    String getShaOfCommitRef(String owner, String repo, String ref);

    /** Comment on an issue or pull request. */
    void createComment(String owner, String repo, int number, String body);

    /** Comment on a commit. */
    void createCommitComment(String owner, String repo, String sha, String body);

    CheckRunRef createCheckRun(String owner, String repo, NewCheckRun checkRun);

    void updateCheckRun(String owner, String repo, String checkRunId,
                        CheckStatus status, CheckConclusion conclusion, Instant completedAt);

    String getDefaultBranch(String owner, String repo);

    boolean isCollaborator(String owner, String repo, String login);
}
