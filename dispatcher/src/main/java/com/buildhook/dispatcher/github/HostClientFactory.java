package com.buildhook.dispatcher.github;

/**
 * Produces a {@link HostClient} authenticated as a GitHub App installation.
 */
public interface HostClientFactory {

    /**
     * @throws HostException AUTH_ERROR if no installation token could be obtained
     */
    HostClient forInstallation(long installationId);
}
