package me.golemcore.pragent.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pragent.domain.model.GitHubConnectionStatus;
import me.golemcore.pragent.domain.model.GitHubUser;
import me.golemcore.pragent.infrastructure.config.AgentProperties;
import me.golemcore.pragent.port.outbound.GitHubClientProvider;
import me.golemcore.pragent.port.outbound.GitHubPort;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Connects agent instances to GitHub.
 *
 * <p>
 * A token is verified against the authenticated-user endpoint before it is
 * stored. Instances without a live client are reconnected lazily, first from
 * their stored credential and then from {@code agent.github.token}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GitHubConnectionService {

    private final GitHubClientProvider clientProvider;
    private final CredentialStore credentialStore;
    private final AgentProperties properties;

    public GitHubConnectionStatus connect(AgentInstance instance, String token) {
        if (token == null || token.isBlank()) {
            return GitHubConnectionStatus.failed("GitHub token is required");
        }
        String trimmed = token.trim();
        GitHubPort github;
        GitHubUser user;
        try {
            github = clientProvider.forToken(trimmed);
            user = github.getAuthenticatedUser();
        } catch (RuntimeException e) { // NOSONAR - any verification failure means the token is unusable
            log.warn("[GitHub] Token verification failed for {}: {}", instance.getId(), e.getMessage());
            return GitHubConnectionStatus.failed("Invalid GitHub token: " + e.getMessage());
        }

        credentialStore.saveToken(instance.getId(), trimmed);
        instance.setGithub(github);
        instance.getTracker().updateConnection(true, user.login());
        log.info("[GitHub] Instance {} connected as {}", instance.getId(), user.login());
        return GitHubConnectionStatus.connected(user.login());
    }

    public GitHubConnectionStatus status(AgentInstance instance) {
        if (ensureConnected(instance).isPresent()) {
            return GitHubConnectionStatus.connected(instance.getTracker().getSnapshot().getGithubUsername());
        }
        return GitHubConnectionStatus.disconnected();
    }

    public void disconnect(AgentInstance instance) {
        instance.setGithub(null);
        credentialStore.deleteToken(instance.getId());
        instance.getTracker().updateConnection(false, null);
        log.info("[GitHub] Instance {} disconnected", instance.getId());
    }

    /**
     * The live client of the instance, restoring one from stored or configured
     * credentials when needed.
     */
    public Optional<GitHubPort> ensureConnected(AgentInstance instance) {
        GitHubPort current = instance.getGithub();
        if (current != null) {
            return Optional.of(current);
        }

        Optional<GitHubPort> restored = credentialStore.loadToken(instance.getId())
                .flatMap(token -> verify(instance, token, "stored credential"));
        if (restored.isEmpty()) {
            String defaultToken = properties.getGithub().getToken();
            if (defaultToken != null && !defaultToken.isBlank()) {
                restored = verify(instance, defaultToken.trim(), "configured token");
            }
        }
        if (restored.isEmpty() && instance.getTracker().getSnapshot().isGithubConnected()) {
            instance.getTracker().updateConnection(false, null);
        }
        return restored;
    }

    private Optional<GitHubPort> verify(AgentInstance instance, String token, String source) {
        try {
            GitHubPort github = clientProvider.forToken(token);
            GitHubUser user = github.getAuthenticatedUser();
            instance.setGithub(github);
            instance.getTracker().updateConnection(true, user.login());
            log.info("[GitHub] Instance {} reconnected from {} as {}", instance.getId(), source, user.login());
            return Optional.of(github);
        } catch (RuntimeException e) { // NOSONAR - fall through to the next credential source
            log.warn("[GitHub] Could not reconnect {} from {}: {}", instance.getId(), source, e.getMessage());
            return Optional.empty();
        }
    }
}
