package me.golemcore.pragent.tools;

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

import me.golemcore.pragent.domain.component.ProgressSink;
import me.golemcore.pragent.domain.model.TaskRequest;
import me.golemcore.pragent.domain.service.RepositoryOperations;

/**
 * Everything a repository tool needs for one task.
 *
 * @param operations
 *            repository operations bound to the task's repository and client
 * @param request
 *            the task request with branch names already resolved
 * @param progress
 *            narrative sink of the running task
 * @param maxChangesPerCommit
 *            upper bound on entries handled by one {@code commit_files} call
 */
public record RepositoryToolContext(RepositoryOperations operations, TaskRequest request, ProgressSink progress,
        int maxChangesPerCommit) {

    public String featureBranch() {
        return request.branchName();
    }

    public String targetBranch() {
        return request.resolveTargetBranch();
    }

    public String description() {
        return request.descriptionOrEmpty();
    }
}
