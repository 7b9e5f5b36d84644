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

import me.golemcore.pragent.port.outbound.GitHubPort;

import java.util.concurrent.locks.ReentrantLock;

/**
 * One logical agent: its task state, its GitHub connection and the lock that
 * serializes its runs.
 */
public class AgentInstance {

    private final String id;
    private final TaskStateTracker tracker;
    private final ReentrantLock runLock = new ReentrantLock();

    private volatile GitHubPort github;

    public AgentInstance(String id, TaskStateTracker tracker) {
        this.id = id;
        this.tracker = tracker;
    }

    public String getId() {
        return id;
    }

    public TaskStateTracker getTracker() {
        return tracker;
    }

    public ReentrantLock getRunLock() {
        return runLock;
    }

    public GitHubPort getGithub() {
        return github;
    }

    public void setGithub(GitHubPort github) {
        this.github = github;
    }
}
