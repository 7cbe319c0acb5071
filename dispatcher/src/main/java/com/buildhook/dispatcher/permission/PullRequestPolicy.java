package com.buildhook.dispatcher.permission;

import com.buildhook.dispatcher.github.HostClient;
import com.buildhook.dispatcher.github.HostException;
import com.buildhook.dispatcher.intree.ConfigException;
import com.buildhook.dispatcher.intree.RepoConfigParser;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Decides whether a pull request may start tasks.
 *
 * The policy is read from the default branch, never from the pull request
 * itself, so a contributor cannot grant themselves access:
 * <pre>
 *   version: 1
 *   policy:
 *     pullRequests: public          # anyone
 *     pullRequests: collaborators   # repository collaborators only (default)
 *
 *   allowPullRequests: public       # older configs
 * </pre>
 */
@Component
public class PullRequestPolicy {

    private static final Logger log = LoggerFactory.getLogger(PullRequestPolicy.class);

    static final String PUBLIC        = "public";
    static final String COLLABORATORS = "collaborators";

    private final RepoConfigParser parser;
    private final String           configFile;

    public PullRequestPolicy(RepoConfigParser parser,
                             @Value("${buildhook.app.config-file:.taskcluster.yml}") String configFile) {
        this.parser     = parser;
        this.configFile = configFile;
    }

    /**
     * @throws PermissionCheckException if the default branch config is not valid YAML
     * @throws HostException            on GitHub errors other than a missing config
     */
    public boolean isAllowed(HostClient github, String owner, String repo, String login) {
        String branch = github.getDefaultBranch(owner, repo);
        String policy = policyOn(github, owner, repo, branch);
        log.debug("Pull request policy for {}/{} on {} is '{}'", owner, repo, branch, policy);

        if (PUBLIC.equals(policy)) {
            return true;
        }
        if (!COLLABORATORS.equals(policy)) {
            log.warn("Unknown pull request policy '{}' in {}/{}; treating as '{}'",
                    policy, owner, repo, COLLABORATORS);
        }
        return login != null && github.isCollaborator(owner, repo, login);
    }

    private String policyOn(HostClient github, String owner, String repo, String branch) {
        String text;
        try {
            text = github.getContent(owner, repo, configFile, branch);
        } catch (HostException e) {
            if (e.is(HostException.Kind.NOT_FOUND)) {
                return COLLABORATORS;
            }
            throw e;
        }

        JsonNode config;
        try {
            config = parser.parse(text);
        } catch (ConfigException e) {
            throw new PermissionCheckException(branch, e.getMessage(), e);
        }

        JsonNode v1 = config.path("policy").path("pullRequests");
        if (v1.isTextual()) {
            return v1.asText();
        }
        JsonNode v0 = config.path("allowPullRequests");
        if (v0.isTextual()) {
            return v0.asText();
        }
        return COLLABORATORS;
    }
}
