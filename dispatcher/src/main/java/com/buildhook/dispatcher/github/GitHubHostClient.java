package com.buildhook.dispatcher.github;

import org.kohsuke.github.GHCheckRun;
import org.kohsuke.github.GHCheckRunBuilder;
import org.kohsuke.github.GHFileNotFoundException;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.HttpException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

/**
 * {@link HostClient} on top of the github-api library, bound to one
 * installation token.
 */
public class GitHubHostClient implements HostClient {

    @FunctionalInterface
    private interface GitHubCall<T> {
        T run() throws IOException;
    }

    private final GitHub gitHub;

    public GitHubHostClient(GitHub gitHub) {
        this.gitHub = gitHub;
    }

    @Override
    public String getContent(String owner, String repo, String path, String ref) {
        return call("getContent " + path + " @ " + ref, () -> {
            try (InputStream in = repository(owner, repo).getFileContent(path, ref).read()) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        });
    }

    @Override
    public String getShaOfCommitRef(String owner, String repo, String ref) {
        // GET /repos/{owner}/{repo}/commits/{ref} peels annotated tags to the commit.
        return call("getShaOfCommitRef " + ref,
                () -> repository(owner, repo).getCommit(ref).getSHA1());
    }

    @Override
    public void createComment(String owner, String repo, int number, String body) {
        call("createComment #" + number,
                () -> repository(owner, repo).getIssue(number).comment(body));
    }

    @Override
    public void createCommitComment(String owner, String repo, String sha, String body) {
        call("createCommitComment @" + sha,
                () -> repository(owner, repo).getCommit(sha).createComment(body));
    }

    @Override
    public CheckRunRef createCheckRun(String owner, String repo, NewCheckRun checkRun) {
        return call("createCheckRun " + checkRun.name(), () -> {
            GHCheckRunBuilder builder = repository(owner, repo)
                    .createCheckRun(checkRun.name(), checkRun.headSha())
                    .withStatus(GHCheckRun.Status.valueOf(checkRun.status().name()))
                    .withDetailsURL(checkRun.detailsUrl())
                    .add(new GHCheckRunBuilder.Output(checkRun.title(), checkRun.summary()));
            if (checkRun.conclusion() != null) {
                builder.withConclusion(GHCheckRun.Conclusion.valueOf(checkRun.conclusion().name()));
            }
            if (checkRun.completedAt() != null) {
                builder.withCompletedAt(Date.from(checkRun.completedAt()));
            }
            GHCheckRun created = builder.create();
            return new CheckRunRef(
                    String.valueOf(created.getCheckSuite().getId()),
                    String.valueOf(created.getId()));
        });
    }

    @Override
    public void updateCheckRun(String owner, String repo, String checkRunId,
                               CheckStatus status, CheckConclusion conclusion, Instant completedAt) {
        call("updateCheckRun " + checkRunId, () -> {
            GHCheckRunBuilder builder = repository(owner, repo)
                    .updateCheckRun(Long.parseLong(checkRunId))
                    .withStatus(GHCheckRun.Status.valueOf(status.name()));
            if (conclusion != null) {
                builder.withConclusion(GHCheckRun.Conclusion.valueOf(conclusion.name()));
            }
            if (completedAt != null) {
                builder.withCompletedAt(Date.from(completedAt));
            }
            return builder.create();
        });
    }

    @Override
    public String getDefaultBranch(String owner, String repo) {
        return call("getDefaultBranch", () -> repository(owner, repo).getDefaultBranch());
    }

    @Override
    public boolean isCollaborator(String owner, String repo, String login) {
        try {
            return call("isCollaborator " + login,
                    () -> repository(owner, repo).isCollaborator(gitHub.getUser(login)));
        } catch (HostException e) {
            if (e.is(HostException.Kind.NOT_FOUND)) {
                return false;   // unknown user
            }
            throw e;
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private GHRepository repository(String owner, String repo) throws IOException {
        return gitHub.getRepository(owner + "/" + repo);
    }

    private static <T> T call(String opName, GitHubCall<T> call) {
        try {
            return call.run();
        } catch (GHFileNotFoundException e) {
            throw new HostException(HostException.Kind.NOT_FOUND,
                    opName + ": not found", e);
        } catch (HttpException e) {
            throw new HostException(HostException.Kind.API_ERROR,
                    opName + " failed: HTTP " + e.getResponseCode() + ": "
                    + ErrorDetails.bound(e.getMessage()), e);
        } catch (IOException e) {
            throw new HostException(HostException.Kind.API_ERROR,
                    opName + " failed: " + ErrorDetails.bound(e.getMessage()), e);
        }
    }
}
