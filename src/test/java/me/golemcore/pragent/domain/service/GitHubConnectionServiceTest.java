package me.golemcore.pragent.domain.service;

import me.golemcore.pragent.domain.model.GitHubConnectionStatus;
import me.golemcore.pragent.domain.model.GitHubUser;
import me.golemcore.pragent.infrastructure.config.AgentProperties;
import me.golemcore.pragent.port.outbound.GitHubApiException;
import me.golemcore.pragent.port.outbound.GitHubClientProvider;
import me.golemcore.pragent.port.outbound.GitHubPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GitHubConnectionServiceTest {

    private static final String TOKEN = "ghp_test";

    private GitHubClientProvider clientProvider;
    private CredentialStore credentialStore;
    private AgentProperties properties;
    private GitHubConnectionService service;
    private AgentInstance instance;
    private GitHubPort github;

    @BeforeEach
    void setUp() {
        clientProvider = mock(GitHubClientProvider.class);
        credentialStore = mock(CredentialStore.class);
        properties = new AgentProperties();
        service = new GitHubConnectionService(clientProvider, credentialStore, properties);
        instance = new AgentInstance("agent-1",
                new TaskStateTracker("agent-1", mock(TaskStateRepository.class), Clock.systemUTC()));
        github = mock(GitHubPort.class);
        when(credentialStore.loadToken(anyString())).thenReturn(Optional.empty());
    }

    // ==================== connect ====================

    @Test
    void shouldConnectWithValidToken() {
        when(clientProvider.forToken(TOKEN)).thenReturn(github);
        when(github.getAuthenticatedUser()).thenReturn(new GitHubUser("octocat"));

        GitHubConnectionStatus status = service.connect(instance, "  " + TOKEN + " ");

        assertEquals(GitHubConnectionStatus.connected("octocat"), status);
        assertSame(github, instance.getGithub());
        assertTrue(instance.getTracker().getSnapshot().isGithubConnected());
        verify(credentialStore).saveToken("agent-1", TOKEN);
    }

    @Test
    void shouldRejectBlankToken() {
        GitHubConnectionStatus status = service.connect(instance, " ");

        assertEquals("GitHub token is required", status.error());
        verify(clientProvider, never()).forToken(any());
    }

    @Test
    void shouldReportInvalidTokenWithoutStoringIt() {
        when(clientProvider.forToken(TOKEN)).thenReturn(github);
        when(github.getAuthenticatedUser()).thenThrow(new GitHubApiException(401, "Bad credentials"));

        GitHubConnectionStatus status = service.connect(instance, TOKEN);

        assertFalse(status.connected());
        assertEquals("Invalid GitHub token: GitHub API error: 401 - Bad credentials", status.error());
        verify(credentialStore, never()).saveToken(anyString(), anyString());
        assertFalse(instance.getTracker().getSnapshot().isGithubConnected());
    }

    // ==================== ensureConnected ====================

    @Test
    void shouldReuseLiveClient() {
        instance.setGithub(github);

        assertSame(github, service.ensureConnected(instance).orElseThrow());
        verify(credentialStore, never()).loadToken(anyString());
    }

    @Test
    void shouldRestoreFromStoredCredential() {
        when(credentialStore.loadToken("agent-1")).thenReturn(Optional.of(TOKEN));
        when(clientProvider.forToken(TOKEN)).thenReturn(github);
        when(github.getAuthenticatedUser()).thenReturn(new GitHubUser("octocat"));

        Optional<GitHubPort> restored = service.ensureConnected(instance);

        assertSame(github, restored.orElseThrow());
        assertEquals("octocat", instance.getTracker().getSnapshot().getGithubUsername());
    }

    @Test
    void shouldFallBackToConfiguredToken() {
        properties.getGithub().setToken("ghp_configured");
        when(clientProvider.forToken("ghp_configured")).thenReturn(github);
        when(github.getAuthenticatedUser()).thenReturn(new GitHubUser("bot"));

        assertTrue(service.ensureConnected(instance).isPresent());
        assertEquals(GitHubConnectionStatus.connected("bot"), service.status(instance));
    }

    @Test
    void shouldReportDisconnectedWhenNoCredentialWorks() {
        instance.getTracker().updateConnection(true, "stale");

        assertTrue(service.ensureConnected(instance).isEmpty());
        assertFalse(instance.getTracker().getSnapshot().isGithubConnected());
        assertEquals(GitHubConnectionStatus.disconnected(), service.status(instance));
    }

    @Test
    void shouldForgetTokenOnDisconnect() {
        instance.setGithub(github);
        instance.getTracker().updateConnection(true, "octocat");

        service.disconnect(instance);

        assertNull(instance.getGithub());
        assertFalse(instance.getTracker().getSnapshot().isGithubConnected());
        verify(credentialStore).deleteToken("agent-1");
    }
}
