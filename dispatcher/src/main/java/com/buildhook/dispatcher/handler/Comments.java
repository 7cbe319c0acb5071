package com.buildhook.dispatcher.handler;

/**
 * Bodies of the comments posted when a push or pull request cannot be built.
 * GitHub renders them as Markdown; details are folded away in a
 * {@code <details>} block.
 */
final class Comments {

    private Comments() {}

    static String submissionFailed(String errorBody) {
        return String.join("\n",
                "<details>\n",
                "<summary>Submitting the task to Taskcluster failed. Details</summary>",
                "",
                errorBody,
                "",
                "</details>");
    }

    static String pullRequestNotAllowed(String configFile) {
        return String.join("\n",
                "<details>\n",
                "<summary>No Taskcluster jobs started for this pull request</summary>\n\n",
                "```js\n",
                "The `allowPullRequests` configuration for this repository (in `" + configFile + "` on the",
                "default branch) does not allow starting tasks for this pull request.",
                "```\n",
                "</details>");
    }

    static String defaultBranchConfigError(String configFile, String branch, String docsUrl, String error) {
        return String.join("\n",
                "<details>\n",
                "<summary>Error in `" + configFile + "` while checking",
                "for permissions **on default branch " + branch + "**.",
                "Read more about this in",
                "[the taskcluster docs](" + docsUrl + ").",
                "Details:</summary>\n\n",
                "```js\n",
                error,
                "```\n",
                "</details>");
    }
}
