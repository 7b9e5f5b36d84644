package me.golemcore.pragent.port.outbound;

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

import java.util.List;

/**
 * Repository operations against a hosted GitHub REST API, bound to one access
 * token. Every failure is raised as {@link GitHubApiException} carrying the
 * HTTP status.
 */
public interface GitHubPort {

    /**
     * List immediate children of a directory. An empty path lists the root.
     */
    List<RepositoryEntry> getContents(String owner, String repo, String path);

    /**
     * Read a file at an optional ref. Content is returned base64 encoded.
     */
    RepositoryFile getFileContent(String owner, String repo, String path, String ref);

    GitRef getRef(String owner, String repo, String branch);

    void createRef(String owner, String repo, String branch, String sha);

    /**
     * Create a file, or replace it when {@code sha} names its current blob.
     *
     * @param content
     *            plain text content; the adapter takes care of encoding
     */
    void createOrUpdateFile(String owner, String repo, String path, String content, String message,
            String branch, String sha);

    PullRequestInfo createPullRequest(String owner, String repo, String title, String body, String head,
            String base);

    CommitComparison compareCommits(String owner, String repo, String base, String head);

    GitHubUser getAuthenticatedUser();
}
