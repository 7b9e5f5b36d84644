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
import me.golemcore.pragent.domain.model.AgentTaskState;
import me.golemcore.pragent.domain.model.GitHubConnectionStatus;
import me.golemcore.pragent.domain.model.TaskRequest;
import me.golemcore.pragent.domain.model.TaskResult;
import me.golemcore.pragent.domain.system.react.ReActTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;

/**
 * Entry point for agent instances: GitHub connection, task runs and state.
 *
 * <p>
 * Runs on one instance are serialized by its run lock; runs on different
 * instances proceed in parallel on the task executor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PrAgentService {

    private final AgentInstanceRegistry registry;
    private final GitHubConnectionService connectionService;
    private final ReActTaskExecutor reActTaskExecutor;
    private final PlannedTaskExecutor plannedTaskExecutor;
    private final ExecutorService taskExecutor;

    public GitHubConnectionStatus setGitHubToken(String instanceId, String token) {
        return connectionService.connect(registry.getOrCreate(instanceId), token);
    }

    public GitHubConnectionStatus checkGitHubStatus(String instanceId) {
        return connectionService.status(registry.getOrCreate(instanceId));
    }

    public void disconnect(String instanceId) {
        connectionService.disconnect(registry.getOrCreate(instanceId));
    }

    public CompletableFuture<TaskResult> runAutonomous(String instanceId, TaskRequest request) {
        return submit(instanceId, request, reActTaskExecutor::execute);
    }

    public CompletableFuture<TaskResult> runPlanned(String instanceId, TaskRequest request) {
        return submit(instanceId, request, plannedTaskExecutor::execute);
    }

    public AgentTaskState getState(String instanceId) {
        return registry.getOrCreate(instanceId).getTracker().getSnapshot();
    }

    /**
     * @throws IllegalStateException
     *             while a task is running on the instance
     */
    public AgentTaskState reset(String instanceId) {
        AgentInstance instance = registry.getOrCreate(instanceId);
        ReentrantLock lock = instance.getRunLock();
        if (!lock.tryLock()) {
            throw new IllegalStateException("A task is running on agent " + instanceId);
        }
        try {
            instance.getTracker().reset();
            return instance.getTracker().getSnapshot();
        } finally {
            lock.unlock();
        }
    }

    private CompletableFuture<TaskResult> submit(String instanceId, TaskRequest request,
            BiFunction<AgentInstance, TaskRequest, TaskResult> executor) {
        if (request == null) {
            throw new IllegalArgumentException("Task request is required");
        }
        AgentInstance instance = registry.getOrCreate(instanceId);
        log.debug("[PrAgent] Queued task for {} ({})", instanceId, request.repoUrl());
        return CompletableFuture.supplyAsync(() -> {
            ReentrantLock lock = instance.getRunLock();
            lock.lock();
            try {
                return executor.apply(instance, request);
            } finally {
                lock.unlock();
            }
        }, taskExecutor);
    }
}
