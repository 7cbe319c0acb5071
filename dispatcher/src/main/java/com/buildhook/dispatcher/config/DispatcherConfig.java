package com.buildhook.dispatcher.config;

import com.buildhook.dispatcher.github.HostClientFactory;
import com.buildhook.dispatcher.handler.HandlerContext;
import com.buildhook.dispatcher.handler.HandlerSettings;
import com.buildhook.dispatcher.intree.ConfigCompiler;
import com.buildhook.dispatcher.intree.RepoConfigParser;
import com.buildhook.dispatcher.permission.PullRequestPolicy;
import com.buildhook.dispatcher.store.BuildStore;
import com.buildhook.dispatcher.store.CheckRunStore;
import com.buildhook.dispatcher.taskcluster.JobPlatformClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the handler context and the worker pool.
 *
 * Config keys (application.yml):
 *   buildhook.app.*          check-run naming, config file name, links
 *   buildhook.taskcluster.*  root URL (also the schema host)
 *   buildhook.dispatcher.*   worker-count
 */
@Configuration
public class DispatcherConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    HandlerSettings handlerSettings(
            @Value("${buildhook.app.status-context:Taskcluster}") String statusContext,
            @Value("${buildhook.app.config-file:.taskcluster.yml}") String configFile,
            @Value("${buildhook.app.inspector-url:https://tools.taskcluster.net/task-group-inspector/#/}") String inspectorUrl,
            @Value("${buildhook.app.docs-url:https://docs.taskcluster.net/reference/integrations/github/docs/usage#who-can-trigger-jobs}") String docsUrl,
            @Value("${buildhook.taskcluster.root-url}") String rootUrl) {
        String schemaBase = stripTrailingSlash(rootUrl) + "/schemas/github/v1/";
        Map<Integer, String> schemas = Map.of(
                0, schemaBase + "taskcluster-github-config.yml",
                1, schemaBase + "taskcluster-github-config.v1.yml");
        return new HandlerSettings(statusContext, configFile, inspectorUrl, docsUrl, schemas);
    }

    @Bean
    HandlerContext handlerContext(BuildStore builds,
                                  CheckRunStore checkRuns,
                                  HostClientFactory github,
                                  JobPlatformClient queue,
                                  RepoConfigParser configParser,
                                  ConfigCompiler intree,
                                  PullRequestPolicy pullRequestPolicy,
                                  HandlerSettings settings,
                                  Clock clock) {
        return new HandlerContext(builds, checkRuns, github, queue, configParser,
                intree, pullRequestPolicy, settings, clock);
    }

    // Handlers block on network I/O, so a fixed pool rather than the common pool.
    @Bean(name = "handlerWorkers", destroyMethod = "shutdown")
    ExecutorService handlerWorkers(@Value("${buildhook.dispatcher.worker-count:4}") int workerCount) {
        return Executors.newFixedThreadPool(workerCount);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
