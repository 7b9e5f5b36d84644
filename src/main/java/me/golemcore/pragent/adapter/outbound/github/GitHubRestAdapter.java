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

import me.golemcore.pragent.domain.model.CommitComparison;
import me.golemcore.pragent.domain.model.GitHubUser;
import me.golemcore.pragent.domain.model.GitRef;
import me.golemcore.pragent.domain.model.PullRequestInfo;
import me.golemcore.pragent.domain.model.RepositoryEntry;
import me.golemcore.pragent.domain.model.RepositoryFile;
import me.golemcore.pragent.port.outbound.GitHubApiException;
import me.golemcore.pragent.port.outbound.GitHubPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link GitHubPort} over the GitHub REST API, bound to one access token.
 *
 * <p>
 * File content is base64 encoded on write; reads return GitHub's base64
 * payload untouched. Feign failures are translated to
 * {@link GitHubApiException} with the status and GitHub's error message.
 */
@Slf4j
public class GitHubRestAdapter implements GitHubPort {

    private static final String REFS_HEADS = "refs/heads/";
    private static final int STATUS_UNKNOWN = 0;

    private final GitHubApi api;
    private final ObjectMapper objectMapper;

    GitHubRestAdapter(GitHubApi api, ObjectMapper objectMapper) {
        this.api = api;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<RepositoryEntry> getContents(String owner, String repo, String path) {
        String dir = path != null ? path : "";
        List<GitHubApi.ContentItem> items = call("list contents of '" + dir + "'",
                () -> api.listContents(owner, repo, dir));
        if (items == null) {
            return List.of();
        }
        return items.stream()
                .map(item -> new RepositoryEntry(item.getPath(), item.getType()))
                .toList();
    }

    @Override
    public RepositoryFile getFileContent(String owner, String repo, String path, String ref) {
        GitHubApi.ContentItem item = call("read file '" + path + "'",
                () -> api.getContent(owner, repo, path, blankToNull(ref)));
        return new RepositoryFile(item.getPath(), item.getContent(), item.getSha());
    }

    @Override
    public GitRef getRef(String owner, String repo, String branch) {
        GitHubApi.RefResponse response = call("get ref '" + branch + "'", () -> api.getRef(owner, repo, branch));
        String sha = response.getObject() != null ? response.getObject().getSha() : null;
        return new GitRef(response.getRef(), sha);
    }

    @Override
    public void createRef(String owner, String repo, String branch, String sha) {
        call("create ref '" + branch + "'",
                () -> api.createRef(owner, repo, new GitHubApi.CreateRefRequest(REFS_HEADS + branch, sha)));
    }

    @Override
    public void createOrUpdateFile(String owner, String repo, String path, String content, String message,
            String branch, String sha) {
        String encoded = Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8));
        GitHubApi.PutContentRequest request = new GitHubApi.PutContentRequest(message, encoded, branch,
                blankToNull(sha));
        call("write file '" + path + "'", () -> {
            api.putContent(owner, repo, path, request);
            return null;
        });
    }

    @Override
    public PullRequestInfo createPullRequest(String owner, String repo, String title, String body, String head,
            String base) {
        GitHubApi.PullResponse response = call("create pull request " + head + " -> " + base,
                () -> api.createPull(owner, repo, new GitHubApi.CreatePullRequest(title, body, head, base)));
        return new PullRequestInfo(response.getHtmlUrl(), response.getNumber());
    }

    @Override
    public CommitComparison compareCommits(String owner, String repo, String base, String head) {
        GitHubApi.CompareResponse response = call("compare " + base + "..." + head,
                () -> api.compare(owner, repo, base + "..." + head));
        return new CommitComparison(response.getAheadBy(), response.getBehindBy());
    }

    @Override
    public GitHubUser getAuthenticatedUser() {
        GitHubApi.UserResponse response = call("get authenticated user", api::getUser);
        return new GitHubUser(response.getLogin());
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (FeignException e) {
            int status = e.status() > 0 ? e.status() : STATUS_UNKNOWN;
            String details = extractMessage(e);
            log.debug("[GitHub] Failed to {}: {} {}", operation, status, details);
            throw new GitHubApiException(status, details, e);
        }
    }

    private String extractMessage(FeignException e) {
        String body = e.contentUTF8();
        if (body == null || body.isBlank()) {
            return e.getMessage();
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode message = node.get("message");
            if (message == null || !message.isTextual()) {
                return body;
            }
            StringBuilder details = new StringBuilder(message.asText());
            JsonNode errors = node.get("errors");
            if (errors != null && errors.isArray()) {
                for (JsonNode error : errors) {
                    JsonNode errorMessage = error.get("message");
                    if (errorMessage != null && errorMessage.isTextual()) {
                        details.append(": ").append(errorMessage.asText());
                    }
                }
            }
            return details.toString();
        } catch (IOException parseError) {
            return body;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
