package me.golemcore.pragent.adapter.outbound.github;

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

import me.golemcore.pragent.infrastructure.config.AgentProperties;
import me.golemcore.pragent.infrastructure.http.FeignClientFactory;
import me.golemcore.pragent.port.outbound.GitHubClientProvider;
import me.golemcore.pragent.port.outbound.GitHubPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Creates token-bound GitHub REST clients.
 */
@Component
@RequiredArgsConstructor
public class GitHubRestClientProvider implements GitHubClientProvider {

    private final FeignClientFactory feignClientFactory;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public GitHubPort forToken(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("GitHub token is required");
        }
        String userAgent = properties.getGithub().getUserAgent();
        GitHubApi api = feignClientFactory.create(GitHubApi.class, properties.getGithub().getApiUrl(),
                template -> {
                    template.header("Authorization", "Bearer " + token);
                    template.header("User-Agent", userAgent);
                });
        return new GitHubRestAdapter(api, objectMapper);
    }
}
