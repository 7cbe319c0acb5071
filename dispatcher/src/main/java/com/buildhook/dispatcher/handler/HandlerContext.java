package com.buildhook.dispatcher.handler;

import com.buildhook.dispatcher.github.HostClientFactory;
import com.buildhook.dispatcher.intree.ConfigCompiler;
import com.buildhook.dispatcher.intree.RepoConfigParser;
import com.buildhook.dispatcher.permission.PullRequestPolicy;
import com.buildhook.dispatcher.store.BuildStore;
import com.buildhook.dispatcher.store.CheckRunStore;
import com.buildhook.dispatcher.taskcluster.JobPlatformClient;

import java.time.Clock;

/**
 * Everything a handler invocation may touch, passed in explicitly with each
 * message. Handlers keep no collaborators of their own.
 */
public record HandlerContext(
        BuildStore        builds,
        CheckRunStore     checkRuns,
        HostClientFactory github,
        JobPlatformClient queue,
        RepoConfigParser  configParser,
        ConfigCompiler    intree,
        PullRequestPolicy pullRequestPolicy,
        HandlerSettings   settings,
        Clock             clock
) {}
