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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pragent.domain.model.AgentTaskState;
import me.golemcore.pragent.domain.model.PlanStep;
import me.golemcore.pragent.domain.model.TaskResult;
import me.golemcore.pragent.domain.model.TaskStatus;
import me.golemcore.pragent.infrastructure.config.AgentProperties;
import me.golemcore.pragent.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Checkpoints task state snapshots as JSON, one file per agent instance.
 *
 * <p>
 * A snapshot written by a run that never finished is recovered on load: the
 * task becomes {@link TaskStatus#ERROR} and a step left running is marked as
 * failed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskStateRepository {

    static final String RECOVERY_INTERRUPTED_MSG = "Interrupted by restart/crash during execution";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final AgentProperties properties;
    private final Clock clock;

    public void save(String instanceId, AgentTaskState state) {
        try {
            String json = objectMapper.writeValueAsString(state);
            storagePort.putTextAtomic(directory(), fileName(instanceId), json).join();
        } catch (IOException | RuntimeException e) { // NOSONAR - checkpoint failures must not abort the task
            log.warn("[TaskState] Failed to checkpoint state for {}: {}", instanceId, e.getMessage());
        }
    }

    public Optional<AgentTaskState> load(String instanceId) {
        try {
            String json = storagePort.getText(directory(), fileName(instanceId)).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            AgentTaskState state = objectMapper.readValue(json, AgentTaskState.class);
            if (recoverInterrupted(state)) {
                log.warn("[TaskState] Recovered interrupted task for {}", instanceId);
                save(instanceId, state);
            }
            return Optional.of(state);
        } catch (IOException | RuntimeException e) { // NOSONAR - unreadable checkpoint starts fresh
            log.warn("[TaskState] Failed to load state for {}: {}", instanceId, e.getMessage());
            return Optional.empty();
        }
    }

    public void delete(String instanceId) {
        try {
            storagePort.deleteObject(directory(), fileName(instanceId)).join();
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[TaskState] Failed to delete state for {}: {}", instanceId, e.getMessage());
        }
    }

    private boolean recoverInterrupted(AgentTaskState state) {
        if (state.getStatus() == null || !state.getStatus().isRunning()) {
            return false;
        }
        Instant now = Instant.now(clock);
        state.setStatus(TaskStatus.ERROR);
        state.setErrorMessage(RECOVERY_INTERRUPTED_MSG);
        state.setResult(TaskResult.failure(RECOVERY_INTERRUPTED_MSG,
                state.getResult() != null ? state.getResult().getBranchName() : null));
        if (state.getPlan() != null) {
            for (PlanStep step : state.getPlan().getSteps()) {
                if (step.getStatus() == PlanStep.StepStatus.RUNNING) {
                    step.setStatus(PlanStep.StepStatus.ERROR);
                    step.setError(RECOVERY_INTERRUPTED_MSG);
                    step.setCompletedAt(now);
                }
            }
        }
        state.getProgressMessages().add("Error: " + RECOVERY_INTERRUPTED_MSG);
        state.setUpdatedAt(now);
        return true;
    }

    private String directory() {
        return properties.getStorage().getTasksDirectory();
    }

    static String fileName(String instanceId) {
        return sanitize(instanceId) + ".json";
    }

    static String sanitize(String instanceId) {
        return instanceId.replaceAll("[^a-zA-Z0-9._-]", "_");
    }
}
