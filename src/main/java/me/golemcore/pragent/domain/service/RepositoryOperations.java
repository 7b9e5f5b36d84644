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

import me.golemcore.pragent.domain.model.CommitComparison;
import me.golemcore.pragent.domain.model.FileChange;
import me.golemcore.pragent.domain.model.GitRef;
import me.golemcore.pragent.domain.model.PullRequestInfo;
import me.golemcore.pragent.domain.model.RepoLocator;
import me.golemcore.pragent.domain.model.RepositoryEntry;
import me.golemcore.pragent.domain.model.RepositoryFile;
import me.golemcore.pragent.port.outbound.GitHubApiException;
import me.golemcore.pragent.port.outbound.GitHubPort;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Repository operations shared by the autonomous tools and the deterministic
 * pipeline, bound to one repository and one GitHub client.
 *
 * <p>
 * Idempotency rules live here: an existing branch is reused, an existing pull
 * request for the same head counts as success, and a pull request is never
 * opened for a branch without commits ahead of its base.
 */
@Slf4j
public class RepositoryOperations {

    private static final int COMMIT_DESCRIPTION_CHARS = 50;

    private final GitHubPort github;
    private final RepoLocator locator;
    private final String webUrl;

    public RepositoryOperations(GitHubPort github, RepoLocator locator, String webUrl) {
        this.github = github;
        this.locator = locator;
        this.webUrl = webUrl != null ? webUrl : "https://github.com";
    }

    public RepoLocator getLocator() {
        return locator;
    }

    public List<RepositoryEntry> listDirectory(String path) {
        return github.getContents(locator.owner(), locator.repo(), path != null ? path : "");
    }

    public String readFile(String path, String ref) {
        RepositoryFile file = github.getFileContent(locator.owner(), locator.repo(), path, ref);
        return file.decodedContent();
    }

    public boolean branchExists(String branch) {
        try {
            github.getRef(locator.owner(), locator.repo(), branch);
            return true;
        } catch (GitHubApiException e) {
            if (e.isNotFound()) {
                return false;
            }
            throw e;
        }
    }

    /**
     * Create {@code branch} at the tip of {@code fromBranch}.
     *
     * @return {@code true} when the branch already existed
     */
    public boolean createBranch(String branch, String fromBranch) {
        GitRef source = github.getRef(locator.owner(), locator.repo(), fromBranch);
        try {
            github.createRef(locator.owner(), locator.repo(), branch, source.sha());
            log.info("[GitHub] Created branch {} from {} in {}", branch, fromBranch, locator.fullName());
            return false;
        } catch (GitHubApiException e) {
            if (e.isAlreadyExists()) {
                log.debug("[GitHub] Branch {} already exists in {}", branch, locator.fullName());
                return true;
            }
            throw e;
        }
    }

    /**
     * @return {@code true} when the branch was already there
     */
    public boolean ensureBranchExists(String branch, String fromBranch) {
        if (branchExists(branch)) {
            return true;
        }
        return createBranch(branch, fromBranch);
    }

    /**
     * Current blob sha of a file on a branch, {@code null} when the file does
     * not exist there.
     */
    public String findSha(String path, String branch) {
        try {
            return github.getFileContent(locator.owner(), locator.repo(), path, branch).sha();
        } catch (GitHubApiException e) {
            if (e.isNotFound()) {
                return null;
            }
            throw e;
        }
    }

    /**
     * Commit a single create or update. An update of a missing file becomes a
     * create; a create of an existing file becomes an update.
     */
    public void commitFile(FileChange change, String branch, String description) {
        FileChange.Action action = change.getAction() != null ? change.getAction() : FileChange.Action.UPDATE;
        if (action == FileChange.Action.DELETE) {
            throw new IllegalArgumentException("Deleting files is not supported: " + change.getPath());
        }
        String message = commitMessage(action, change.getPath(), description);
        String sha = action == FileChange.Action.UPDATE ? findSha(change.getPath(), branch) : null;
        try {
            github.createOrUpdateFile(locator.owner(), locator.repo(), change.getPath(), change.getContent(),
                    message, branch, sha);
        } catch (GitHubApiException e) {
            if (sha != null || e.getStatus() != 422) {
                throw e;
            }
            String existingSha = findSha(change.getPath(), branch);
            if (existingSha == null) {
                throw e;
            }
            github.createOrUpdateFile(locator.owner(), locator.repo(), change.getPath(), change.getContent(),
                    message, branch, existingSha);
        }
    }

    static String commitMessage(FileChange.Action action, String path, String description) {
        String text = description != null ? description : "";
        if (text.length() > COMMIT_DESCRIPTION_CHARS) {
            text = text.substring(0, COMMIT_DESCRIPTION_CHARS);
        }
        return action.value() + ": " + path + " - " + text;
    }

    /**
     * Open a pull request after checking that {@code head} has commits ahead
     * of {@code base}.
     *
     * @throws PreflightCheckException
     *             when the comparison fails or finds nothing to merge
     */
    public PullRequestOutcome openPullRequest(String head, String base, String title, String body) {
        CommitComparison comparison;
        try {
            comparison = github.compareCommits(locator.owner(), locator.repo(), base, head);
        } catch (RuntimeException e) { // NOSONAR - any compare failure blocks the pull request
            throw new PreflightCheckException("Preflight check failed: " + e.getMessage(), e);
        }
        if (comparison == null || comparison.aheadBy() <= 0) {
            throw new PreflightCheckException("Preflight check failed: No commits between " + base + " and "
                    + head + ". Use commit_files to commit your changes before creating a pull request.");
        }

        try {
            PullRequestInfo pr = github.createPullRequest(locator.owner(), locator.repo(), title, body, head, base);
            log.info("[GitHub] Opened pull request #{} in {}", pr.number(), locator.fullName());
            return new PullRequestOutcome(pr.htmlUrl(), pr.number(), false);
        } catch (GitHubApiException e) {
            if (e.isAlreadyExists()) {
                log.info("[GitHub] Pull request for {} already exists in {}", head, locator.fullName());
                return new PullRequestOutcome(pullsUrl(), null, true);
            }
            throw e;
        }
    }

    private String pullsUrl() {
        String base = webUrl.endsWith("/") ? webUrl.substring(0, webUrl.length() - 1) : webUrl;
        return base + "/" + locator.owner() + "/" + locator.repo() + "/pulls";
    }

    /**
     * @param number
     *            {@code null} when an existing pull request was reused
     */
    public record PullRequestOutcome(String prUrl, Integer number, boolean alreadyExists) {
    }
}
