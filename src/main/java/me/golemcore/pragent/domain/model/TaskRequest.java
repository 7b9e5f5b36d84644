package me.golemcore.pragent.domain.model;

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

/**
 * A change request submitted by a caller: which repository to change, what to
 * change in natural language, and optionally which branches to use.
 *
 * <p>
 * The request is immutable once a task starts. Executors resolve missing
 * branch names through {@link #resolveTargetBranch()} and
 * {@link me.golemcore.pragent.domain.service.BranchNames}.
 *
 * @param repoUrl
 *            repository URL ({@code https://github.com/owner/repo}) or
 *            {@code owner/repo} shorthand
 * @param description
 *            the user's intent in free text
 * @param branchName
 *            optional feature branch name
 * @param targetBranch
 *            optional base branch, {@code main} when absent
 */
public record TaskRequest(String repoUrl, String description, String branchName, String targetBranch) {

    public static final String DEFAULT_TARGET_BRANCH = "main";

    public String resolveTargetBranch() {
        return targetBranch != null && !targetBranch.isBlank() ? targetBranch : DEFAULT_TARGET_BRANCH;
    }

    public String descriptionOrEmpty() {
        return description != null ? description : "";
    }
}
