package com.buildhook.dispatcher.permission;

import com.buildhook.dispatcher.github.HostClient;
import com.buildhook.dispatcher.github.HostException;
import com.buildhook.dispatcher.intree.RepoConfigParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PullRequestPolicyTest {

    static final String CONFIG = ".taskcluster.yml";

    @Mock HostClient github;

    PullRequestPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new PullRequestPolicy(new RepoConfigParser(), CONFIG);
        when(github.getDefaultBranch("org", "repo")).thenReturn("main");
    }

    @Test
    void publicPolicy_allowsAnyone() {
        when(github.getContent("org", "repo", CONFIG, "main"))
                .thenReturn("version: 1\npolicy:\n  pullRequests: public\n");

        assertThat(policy.isAllowed(github, "org", "repo", "stranger")).isTrue();
        verify(github, never()).isCollaborator(any(), any(), any());
    }

    @Test
    void legacyAllowPullRequests_isHonoured() {
        when(github.getContent("org", "repo", CONFIG, "main")).thenReturn("allowPullRequests: public\n");

        assertThat(policy.isAllowed(github, "org", "repo", "stranger")).isTrue();
    }

    @Test
    void defaultPolicy_requiresCollaborator() {
        when(github.getContent("org", "repo", CONFIG, "main")).thenReturn("version: 1\ntasks: []\n");
        when(github.isCollaborator("org", "repo", "alice")).thenReturn(true);
        when(github.isCollaborator("org", "repo", "mallory")).thenReturn(false);

        assertThat(policy.isAllowed(github, "org", "repo", "alice")).isTrue();
        assertThat(policy.isAllowed(github, "org", "repo", "mallory")).isFalse();
    }

    @Test
    void noConfigOnDefaultBranch_fallsBackToCollaborators() {
        when(github.getContent("org", "repo", CONFIG, "main"))
                .thenThrow(new HostException(HostException.Kind.NOT_FOUND, "Not Found"));
        when(github.isCollaborator("org", "repo", "alice")).thenReturn(false);

        assertThat(policy.isAllowed(github, "org", "repo", "alice")).isFalse();
    }

    @Test
    void unknownAuthor_isDenied() {
        when(github.getContent("org", "repo", CONFIG, "main")).thenReturn("version: 1\n");

        assertThat(policy.isAllowed(github, "org", "repo", null)).isFalse();
    }

    @Test
    void invalidDefaultBranchConfig_throwsWithBranch() {
        when(github.getContent("org", "repo", CONFIG, "main")).thenReturn("policy: [oops");

        assertThatThrownBy(() -> policy.isAllowed(github, "org", "repo", "alice"))
                .isInstanceOf(PermissionCheckException.class)
                .extracting(e -> ((PermissionCheckException) e).getBranch())
                .isEqualTo("main");
    }
}
