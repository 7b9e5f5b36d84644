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
import me.golemcore.pragent.domain.model.FileChange;
import me.golemcore.pragent.domain.model.PlanStep;
import me.golemcore.pragent.domain.model.RepoLocator;
import me.golemcore.pragent.domain.model.TaskRequest;
import me.golemcore.pragent.domain.model.TaskResult;
import me.golemcore.pragent.domain.model.TaskStatus;
import me.golemcore.pragent.infrastructure.config.AgentProperties;
import me.golemcore.pragent.port.outbound.GitHubPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Deterministic executor: runs the seven plan steps strictly in order.
 *
 * <p>
 * Each step is marked running, then completed, or error on a fatal failure. The
 * first error halts the plan and leaves the remaining steps pending; the
 * failure message becomes the task result verbatim.
 */
@Service
@Slf4j
public class PlannedTaskExecutor {

    private static final int TITLE_CHARS = 100;

    private final ChangeSetGenerator changeSetGenerator;
    private final GitHubConnectionService connectionService;
    private final RepositoryContextLoader contextLoader;
    private final AgentProperties properties;
    private final Clock clock;

    public PlannedTaskExecutor(ChangeSetGenerator changeSetGenerator, GitHubConnectionService connectionService,
            RepositoryContextLoader contextLoader, AgentProperties properties, Clock clock) {
        this.changeSetGenerator = changeSetGenerator;
        this.connectionService = connectionService;
        this.contextLoader = contextLoader;
        this.properties = properties;
        this.clock = clock;
    }

    public TaskResult execute(AgentInstance instance, TaskRequest request) {
        TaskStateTracker tracker = instance.getTracker();
        TaskRequest resolved = new TaskRequest(request.repoUrl(), request.descriptionOrEmpty(),
                BranchNames.resolve(request.branchName(), request.description(), clock),
                request.resolveTargetBranch());
        tracker.startTask(resolved, true);
        log.info("[PlanExec] Starting planned task for {} on branch {}", resolved.repoUrl(), resolved.branchName());

        PlanRun run = new PlanRun(resolved);
        TaskResult result;
        try {
            runStep(tracker, PlanStep.StepId.VALIDATE_INPUT, TaskStatus.CONNECTING, () -> validateInput(run));
            runStep(tracker, PlanStep.StepId.ENSURE_GITHUB, TaskStatus.CONNECTING,
                    () -> ensureGitHub(instance, run));
            runStep(tracker, PlanStep.StepId.FETCH_REPO, TaskStatus.ANALYZING,
                    () -> run.repoContext = contextLoader.load(run.operations, tracker));
            runStep(tracker, PlanStep.StepId.GENERATE_CHANGES, TaskStatus.GENERATING,
                    () -> generateChanges(tracker, run));
            runStep(tracker, PlanStep.StepId.CREATE_BRANCH, TaskStatus.CREATING_PR, () -> createBranch(tracker, run));
            runStep(tracker, PlanStep.StepId.APPLY_CHANGES, TaskStatus.CREATING_PR, () -> applyChanges(tracker, run));
            runStep(tracker, PlanStep.StepId.CREATE_PR, TaskStatus.CREATING_PR, () -> createPullRequest(tracker, run));
            result = TaskResult.success(run.prUrl, resolved.branchName());
            log.info("[PlanExec] Completed planned task: {}", run.prUrl);
        } catch (PlanStepException e) {
            log.warn("[PlanExec] Step {} failed: {}", e.getStepId().value(), e.getMessage());
            result = TaskResult.failure(e.getMessage(), resolved.branchName());
        } catch (RuntimeException e) { // NOSONAR - executors report failures as results
            log.error("[PlanExec] Unexpected failure", e);
            tracker.appendProgress("Error: " + e.getMessage());
            result = TaskResult.failure(e.getMessage(), resolved.branchName());
        }

        tracker.complete(result);
        return result;
    }

    private void runStep(TaskStateTracker tracker, PlanStep.StepId stepId, TaskStatus status, StepAction action) {
        int index = stepId.ordinal();
        tracker.setStatus(status);
        tracker.setPlanStep(index, PlanStep.StepStatus.RUNNING, null);
        log.debug("[PlanExec] Step {}: {}", index + 1, stepId.value());
        try {
            action.run();
        } catch (RuntimeException e) { // NOSONAR - any step failure halts the plan
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            tracker.setPlanStep(index, PlanStep.StepStatus.ERROR, message);
            tracker.appendProgress("Error: " + message);
            throw new PlanStepException(stepId, message, e);
        }
        tracker.setPlanStep(index, PlanStep.StepStatus.COMPLETED, null);
    }

    private void validateInput(PlanRun run) {
        if (run.request.descriptionOrEmpty().isBlank()) {
            throw new IllegalArgumentException("Task description is required");
        }
        run.locator = RepoLocator.require(run.request.repoUrl());
    }

    private void ensureGitHub(AgentInstance instance, PlanRun run) {
        GitHubPort github = connectionService.ensureConnected(instance)
                .orElseThrow(() -> new GitHubNotConnectedException(
                        "GitHub not connected. Please set your GitHub Personal Access Token first."));
        run.operations = new RepositoryOperations(github, run.locator, properties.getGithub().getWebUrl());
        instance.getTracker().appendProgress("Starting PR creation for " + run.locator.fullName());
    }

    private void generateChanges(TaskStateTracker tracker, PlanRun run) {
        tracker.appendProgress("Using AI to analyze and generate code changes...");
        run.changes = changeSetGenerator.generate(run.request, run.repoContext);
        tracker.setGeneratedChanges(run.changes);
        tracker.appendProgress("Generated " + run.changes.size() + " file change(s)");
    }

    private void createBranch(TaskStateTracker tracker, PlanRun run) {
        String branch = run.request.branchName();
        tracker.appendProgress("Creating branch: " + branch);
        if (run.operations.createBranch(branch, run.request.resolveTargetBranch())) {
            tracker.appendProgress("Branch " + branch + " already exists, reusing it");
        } else {
            tracker.appendProgress("Branch " + branch + " created");
        }
    }

    private void applyChanges(TaskStateTracker tracker, PlanRun run) {
        int committed = 0;
        for (FileChange change : run.changes) {
            if (change.getAction() == FileChange.Action.DELETE) {
                tracker.appendProgress("Skipping delete for " + change.getPath() + " (not supported)");
                continue;
            }
            tracker.appendProgress((change.getAction() == FileChange.Action.CREATE ? "Creating " : "Updating ")
                    + change.getPath() + "...");
            try {
                run.operations.commitFile(change, run.request.branchName(), run.request.descriptionOrEmpty());
                committed++;
                tracker.appendProgress(change.getPath() + " committed");
            } catch (RuntimeException e) { // NOSONAR - a failed file does not stop the others
                log.warn("[PlanExec] Could not commit {}: {}", change.getPath(), e.getMessage());
                tracker.appendProgress("Warning: Could not " + change.getAction().value() + " "
                        + change.getPath() + ": " + e.getMessage());
            }
        }
        tracker.appendProgress("Committed " + committed + " of " + run.changes.size() + " change(s)");
    }

    private void createPullRequest(TaskStateTracker tracker, PlanRun run) {
        tracker.appendProgress("Creating pull request...");
        String description = run.request.descriptionOrEmpty();
        String title = description.length() > TITLE_CHARS ? description.substring(0, TITLE_CHARS) : description;
        RepositoryOperations.PullRequestOutcome outcome = run.operations.openPullRequest(
                run.request.branchName(), run.request.resolveTargetBranch(), title, body(description, run.changes));
        run.prUrl = outcome.prUrl();
        tracker.appendProgress(outcome.alreadyExists()
                ? "A pull request already exists for this branch"
                : "Pull request created successfully!");
    }

    static String body(String description, List<FileChange> changes) {
        String changeList = changes.stream()
                .map(change -> "- " + change.getAction().value() + ": `" + change.getPath() + "`")
                .collect(Collectors.joining("\n"));
        return "## Summary\n\n" + description + "\n\n## Changes\n\n" + changeList
                + "\n\n---\n*Created by GolemCore PR Agent*";
    }

    @FunctionalInterface
    private interface StepAction {
        void run();
    }

    /**
     * Values handed from one step to the next.
     */
    private static final class PlanRun {
        private final TaskRequest request;
        private RepoLocator locator;
        private RepositoryOperations operations;
        private String repoContext = "";
        private List<FileChange> changes = new ArrayList<>();
        private String prUrl;

        private PlanRun(TaskRequest request) {
            this.request = request;
        }
    }
}
