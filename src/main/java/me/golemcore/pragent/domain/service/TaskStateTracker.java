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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pragent.domain.component.ProgressSink;
import me.golemcore.pragent.domain.model.AgentTaskState;
import me.golemcore.pragent.domain.model.ExecutionPlan;
import me.golemcore.pragent.domain.model.FileChange;
import me.golemcore.pragent.domain.model.PlanStep;
import me.golemcore.pragent.domain.model.TaskRequest;
import me.golemcore.pragent.domain.model.TaskResult;
import me.golemcore.pragent.domain.model.TaskStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns the {@link AgentTaskState} of one agent instance.
 *
 * <p>
 * Every mutation stamps {@code updatedAt} and checkpoints a copy through
 * {@link TaskStateRepository}. Once the task reaches a terminal status, task
 * mutations are ignored until the next {@link #startTask} or {@link #reset};
 * connection fields stay writable.
 */
@Slf4j
public class TaskStateTracker implements ProgressSink {

    private final String instanceId;
    private final TaskStateRepository repository;
    private final Clock clock;

    private AgentTaskState state;

    public TaskStateTracker(String instanceId, TaskStateRepository repository, Clock clock) {
        this.instanceId = instanceId;
        this.repository = repository;
        this.clock = clock;
        this.state = AgentTaskState.idle();
    }

    public String getInstanceId() {
        return instanceId;
    }

    /**
     * Replace the in-memory state with a recovered checkpoint.
     */
    public synchronized void restore(AgentTaskState restored) {
        this.state = restored.copy();
    }

    /**
     * Start a fresh task. Result, progress, plan and generated changes are
     * cleared; the GitHub connection is kept.
     */
    public synchronized void startTask(TaskRequest request, boolean withPlan) {
        Instant now = Instant.now(clock);
        AgentTaskState fresh = AgentTaskState.builder()
                .status(TaskStatus.CONNECTING)
                .githubConnected(state.isGithubConnected())
                .githubUsername(state.getGithubUsername())
                .currentRequest(request)
                .plan(withPlan ? ExecutionPlan.create(now) : null)
                .build();
        this.state = fresh;
        checkpoint(now);
    }

    public synchronized void setStatus(TaskStatus status) {
        if (isFrozen("status " + status)) {
            return;
        }
        state.setStatus(status);
        checkpoint(Instant.now(clock));
    }

    @Override
    public synchronized void appendProgress(String message) {
        log.info("[TaskState] {}: {}", instanceId, message);
        if (isFrozen("progress")) {
            return;
        }
        state.getProgressMessages().add(message);
        checkpoint(Instant.now(clock));
    }

    @Override
    public synchronized void setPlanStep(int index, PlanStep.StepStatus status, String error) {
        if (isFrozen("plan step " + index)) {
            return;
        }
        ExecutionPlan plan = state.getPlan();
        if (plan == null) {
            throw new IllegalStateException("Task has no execution plan");
        }
        List<PlanStep> steps = plan.getSteps();
        if (index < 0 || index >= steps.size()) {
            throw new IllegalStateException("Plan step index out of range: " + index);
        }
        PlanStep step = steps.get(index);
        validateTransition(steps, index, step.getStatus(), status);

        Instant now = Instant.now(clock);
        step.setStatus(status);
        if (status == PlanStep.StepStatus.RUNNING) {
            step.setStartedAt(now);
        } else {
            step.setCompletedAt(now);
        }
        if (status == PlanStep.StepStatus.ERROR) {
            step.setError(error);
        }
        plan.setCurrentStepIndex(index);
        checkpoint(now);
    }

    private static void validateTransition(List<PlanStep> steps, int index, PlanStep.StepStatus from,
            PlanStep.StepStatus to) {
        switch (to) {
        case PENDING -> throw new IllegalStateException("Plan step cannot return to pending: "
                + steps.get(index).getId().value());
        case RUNNING, SKIPPED -> {
            if (from != PlanStep.StepStatus.PENDING) {
                throw illegal(steps, index, from, to);
            }
            for (int i = 0; i < index; i++) {
                if (!steps.get(i).getStatus().isDone()) {
                    throw new IllegalStateException("Plan step " + steps.get(index).getId().value()
                            + " cannot start before " + steps.get(i).getId().value() + " is done");
                }
            }
        }
        case COMPLETED -> {
            if (from != PlanStep.StepStatus.RUNNING) {
                throw illegal(steps, index, from, to);
            }
        }
        case ERROR -> {
            if (from != PlanStep.StepStatus.RUNNING && from != PlanStep.StepStatus.PENDING) {
                throw illegal(steps, index, from, to);
            }
        }
        default -> throw illegal(steps, index, from, to);
        }
    }

    private static IllegalStateException illegal(List<PlanStep> steps, int index, PlanStep.StepStatus from,
            PlanStep.StepStatus to) {
        return new IllegalStateException("Illegal plan step transition for " + steps.get(index).getId().value()
                + ": " + from.value() + " -> " + to.value());
    }

    public synchronized void setGeneratedChanges(List<FileChange> changes) {
        if (isFrozen("generated changes")) {
            return;
        }
        state.setGeneratedChanges(new ArrayList<>(changes));
        checkpoint(Instant.now(clock));
    }

    /**
     * Record the task outcome. The status becomes completed or error and the
     * state freezes.
     */
    public synchronized void complete(TaskResult result) {
        if (isFrozen("result")) {
            return;
        }
        state.setResult(result);
        if (result.isSuccess()) {
            state.setStatus(TaskStatus.COMPLETED);
            state.setErrorMessage(null);
        } else {
            state.setStatus(TaskStatus.ERROR);
            state.setErrorMessage(result.getError());
        }
        checkpoint(Instant.now(clock));
    }

    public synchronized void updateConnection(boolean connected, String username) {
        state.setGithubConnected(connected);
        state.setGithubUsername(connected ? username : null);
        checkpoint(Instant.now(clock));
    }

    /**
     * Back to idle, keeping the GitHub connection.
     */
    public synchronized void reset() {
        AgentTaskState idle = AgentTaskState.idle();
        idle.setGithubConnected(state.isGithubConnected());
        idle.setGithubUsername(state.getGithubUsername());
        this.state = idle;
        checkpoint(Instant.now(clock));
    }

    public synchronized boolean isRunning() {
        return state.getStatus().isRunning();
    }

    @Override
    public synchronized AgentTaskState getSnapshot() {
        return state.copy();
    }

    private boolean isFrozen(String what) {
        if (state.getStatus().isTerminal()) {
            log.warn("[TaskState] {}: ignoring {} update, task already {}", instanceId, what,
                    state.getStatus().value());
            return true;
        }
        return false;
    }

    private void checkpoint(Instant now) {
        state.setUpdatedAt(now);
        repository.save(instanceId, state.copy());
    }
}
