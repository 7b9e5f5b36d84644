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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Observable state of the task owned by one agent instance.
 *
 * <p>
 * The state is reset at the start of every task (connection fields survive)
 * and is frozen once {@link #status} becomes terminal. Observers only ever see
 * copies produced by {@link #copy()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentTaskState {

    @Builder.Default
    private TaskStatus status = TaskStatus.IDLE;
    private boolean githubConnected;
    private String githubUsername;
    private TaskRequest currentRequest;
    @Builder.Default
    private List<FileChange> generatedChanges = new ArrayList<>();
    private TaskResult result;
    @Builder.Default
    private List<String> progressMessages = new ArrayList<>();
    private ExecutionPlan plan;
    private String errorMessage;
    private Instant updatedAt;

    public static AgentTaskState idle() {
        return AgentTaskState.builder().build();
    }

    public AgentTaskState copy() {
        List<FileChange> changes = new ArrayList<>();
        for (FileChange change : generatedChanges) {
            changes.add(new FileChange(change.getPath(), change.getContent(), change.getAction()));
        }
        TaskResult resultCopy = result != null
                ? new TaskResult(result.isSuccess(), result.getPrUrl(), result.getBranchName(), result.getError())
                : null;
        return AgentTaskState.builder()
                .status(status)
                .githubConnected(githubConnected)
                .githubUsername(githubUsername)
                .currentRequest(currentRequest)
                .generatedChanges(changes)
                .result(resultCopy)
                .progressMessages(new ArrayList<>(progressMessages))
                .plan(plan != null ? plan.copy() : null)
                .errorMessage(errorMessage)
                .updatedAt(updatedAt)
                .build();
    }
}
