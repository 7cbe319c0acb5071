package com.buildhook.dispatcher.github;

import org.kohsuke.github.GHAppInstallationToken;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.kohsuke.github.extras.authorization.JWTTokenProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authenticates as the GitHub App (JWT signed with the app's private key),
 * then exchanges that for an installation token per installation.
 *
 * Installation tokens live for an hour; clients are cached for a bit less
 * than that so concurrent handlers for the same installation share one token.
 */
@Component
public class GitHubHostClientFactory implements HostClientFactory {

    private static final Logger log = LoggerFactory.getLogger(GitHubHostClientFactory.class);

    private static final Duration TOKEN_TTL = Duration.ofMinutes(50);

    private record CachedClient(HostClient client, Instant expiresAt) {}

    private final String apiUrl;
    private final String appId;
    private final Path   privateKeyPath;
    private final Map<Long, CachedClient> clients = new ConcurrentHashMap<>();

    private volatile JWTTokenProvider jwtProvider;

    public GitHubHostClientFactory(
            @Value("${buildhook.github.api-url:https://api.github.com}") String apiUrl,
            @Value("${buildhook.github.app-id}") String appId,
            @Value("${buildhook.github.private-key-path}") String privateKeyPath) {
        this.apiUrl         = apiUrl;
        this.appId          = appId;
        this.privateKeyPath = Path.of(privateKeyPath);
    }

    @Override
    public HostClient forInstallation(long installationId) {
        CachedClient cached = clients.get(installationId);
        if (cached != null && Instant.now().isBefore(cached.expiresAt())) {
            return cached.client();
        }
        log.debug("Authenticating as installation {}", installationId);
        try {
            GitHub asApp = new GitHubBuilder()
                    .withEndpoint(apiUrl)
                    .withAuthorizationProvider(jwtProvider())
                    .build();
            GHAppInstallationToken token = asApp.getApp()
                    .getInstallationById(installationId)
                    .createToken()
                    .create();
            GitHub asInstallation = new GitHubBuilder()
                    .withEndpoint(apiUrl)
                    .withAppInstallationToken(token.getToken())
                    .build();
            HostClient client = new GitHubHostClient(asInstallation);
            clients.put(installationId, new CachedClient(client, Instant.now().plus(TOKEN_TTL)));
            log.debug("Authorized as installation {}", installationId);
            return client;
        } catch (IOException | GeneralSecurityException e) {
            log.warn("Could not authenticate as installation {}: {}", installationId, e.getMessage());
            throw new HostException(HostException.Kind.AUTH_ERROR,
                    "Authenticating as installation " + installationId + " failed: "
                    + ErrorDetails.bound(e.getMessage()), e);
        }
    }

    private JWTTokenProvider jwtProvider() throws IOException, GeneralSecurityException {
        JWTTokenProvider provider = jwtProvider;
        if (provider == null) {
            synchronized (this) {
                if (jwtProvider == null) {
                    jwtProvider = new JWTTokenProvider(appId, privateKeyPath);
                }
                provider = jwtProvider;
            }
        }
        return provider;
    }
}
