package me.golemcore.pragent.domain.service;

import me.golemcore.pragent.domain.model.AgentTaskState;
import me.golemcore.pragent.domain.model.FileChange;
import me.golemcore.pragent.domain.model.PlanStep;
import me.golemcore.pragent.domain.model.TaskRequest;
import me.golemcore.pragent.domain.model.TaskResult;
import me.golemcore.pragent.domain.model.TaskStatus;
import me.golemcore.pragent.infrastructure.config.AgentProperties;
import me.golemcore.pragent.testsupport.github.InMemoryGitHubRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlannedTaskExecutorTest {

    private static final String REPO_URL = "https://github.com/octo/site";
    private static final String BRANCH = "feature/dark-mode";

    private ChangeSetGenerator generator;
    private GitHubConnectionService connectionService;
    private InMemoryGitHubRepository github;
    private AgentInstance instance;
    private PlannedTaskExecutor executor;

    @BeforeEach
    void setUp() {
        generator = mock(ChangeSetGenerator.class);
        connectionService = mock(GitHubConnectionService.class);
        github = new InMemoryGitHubRepository()
                .withFile("index.html", "<html></html>")
                .withFile("README.md", "# Site");
        AgentProperties properties = new AgentProperties();
        Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
        instance = new AgentInstance("agent-1",
                new TaskStateTracker("agent-1", mock(TaskStateRepository.class), clock));
        when(connectionService.ensureConnected(instance)).thenReturn(Optional.of(github));
        executor = new PlannedTaskExecutor(generator, connectionService, new RepositoryContextLoader(properties),
                properties, clock);
    }

    private static List<PlanStep.StepStatus> statuses(AgentTaskState state) {
        return state.getPlan().getSteps().stream().map(PlanStep::getStatus).toList();
    }

    // ==================== Success ====================

    @Test
    void shouldCompleteAllStepsAndOpenPullRequest() {
        when(generator.generate(any(), anyString())).thenReturn(List.of(
                new FileChange("index.html", "<html class=\"dark\"></html>", FileChange.Action.UPDATE),
                new FileChange("dark.css", "body{background:#000}", FileChange.Action.CREATE)));

        TaskResult result = executor.execute(instance, new TaskRequest(REPO_URL, "Add dark mode", BRANCH, null));

        assertTrue(result.isSuccess());
        assertEquals("https://github.com/octo/site/pull/1", result.getPrUrl());
        assertEquals(BRANCH, result.getBranchName());
        AgentTaskState state = instance.getTracker().getSnapshot();
        assertEquals(TaskStatus.COMPLETED, state.getStatus());
        assertTrue(statuses(state).stream().allMatch(status -> status == PlanStep.StepStatus.COMPLETED));
        assertEquals(2, state.getGeneratedChanges().size());
        assertEquals("<html class=\"dark\"></html>", github.fileOn(BRANCH, "index.html"));
        assertEquals("<html></html>", github.fileOn("main", "index.html"));
        assertTrue(state.getProgressMessages().contains("Pull request created successfully!"));
    }

    @Test
    void shouldPassRepositoryContextToGenerator() {
        when(generator.generate(any(), anyString())).thenReturn(List.of(
                new FileChange("a.txt", "A", FileChange.Action.CREATE)));

        executor.execute(instance, new TaskRequest(REPO_URL, "Add a", BRANCH, "main"));

        verify(generator).generate(any(TaskRequest.class), contains("- index.html (file)"));
    }

    @Test
    void shouldReuseExistingBranch() {
        github.withBranch(BRANCH);
        when(generator.generate(any(), anyString())).thenReturn(List.of(
                new FileChange("a.txt", "A", FileChange.Action.CREATE)));

        TaskResult result = executor.execute(instance, new TaskRequest(REPO_URL, "Add a", BRANCH, "main"));

        assertTrue(result.isSuccess());
        assertTrue(instance.getTracker().getSnapshot().getProgressMessages()
                .contains("Branch " + BRANCH + " already exists, reusing it"));
    }

    // ==================== Failures ====================

    @Test
    void shouldHaltAtValidationForMalformedRepository() {
        TaskResult result = executor.execute(instance, new TaskRequest("not a repo", "Add dark mode", BRANCH, null));

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("Invalid GitHub URL: not a repo"));
        AgentTaskState state = instance.getTracker().getSnapshot();
        assertEquals(TaskStatus.ERROR, state.getStatus());
        List<PlanStep.StepStatus> statuses = statuses(state);
        assertEquals(PlanStep.StepStatus.ERROR, statuses.get(0));
        assertTrue(statuses.subList(1, 7).stream().allMatch(status -> status == PlanStep.StepStatus.PENDING));
        verify(connectionService, never()).ensureConnected(any());
        assertEquals(0, github.getTotalCalls());
    }

    @Test
    void shouldRequireDescription() {
        TaskResult result = executor.execute(instance, new TaskRequest(REPO_URL, "  ", BRANCH, null));

        assertEquals("Task description is required", result.getError());
    }

    @Test
    void shouldHaltWhenGitHubIsNotConnected() {
        when(connectionService.ensureConnected(instance)).thenReturn(Optional.empty());

        TaskResult result = executor.execute(instance, new TaskRequest(REPO_URL, "Add dark mode", BRANCH, null));

        assertEquals("GitHub not connected. Please set your GitHub Personal Access Token first.", result.getError());
        List<PlanStep.StepStatus> statuses = statuses(instance.getTracker().getSnapshot());
        assertEquals(List.of(PlanStep.StepStatus.COMPLETED, PlanStep.StepStatus.ERROR), statuses.subList(0, 2));
    }

    @Test
    void shouldHaltWhenGenerationIsRejected() {
        when(generator.generate(any(), anyString()))
                .thenThrow(new ChangeSetGenerationException(3, "Change array is empty"));

        TaskResult result = executor.execute(instance, new TaskRequest(REPO_URL, "Add dark mode", BRANCH, null));

        assertEquals("Failed to generate valid changes after 3 attempt(s): Change array is empty", result.getError());
        AgentTaskState state = instance.getTracker().getSnapshot();
        assertEquals(PlanStep.StepStatus.ERROR, statuses(state).get(3));
        assertEquals(PlanStep.StepStatus.PENDING, statuses(state).get(4));
        assertEquals(0, github.getCreateRefCalls());
        assertEquals("Error: " + result.getError(),
                state.getProgressMessages().get(state.getProgressMessages().size() - 1));
    }

    @Test
    void shouldRefusePullRequestWhenNothingWasCommitted() {
        when(generator.generate(any(), anyString())).thenReturn(List.of(
                new FileChange("index.html", "", FileChange.Action.DELETE)));

        TaskResult result = executor.execute(instance, new TaskRequest(REPO_URL, "Remove page", BRANCH, null));

        assertTrue(result.getError().startsWith("Preflight check failed: No commits between main and " + BRANCH));
        assertEquals(PlanStep.StepStatus.COMPLETED, statuses(instance.getTracker().getSnapshot()).get(5));
        assertEquals(PlanStep.StepStatus.ERROR, statuses(instance.getTracker().getSnapshot()).get(6));
        assertEquals(0, github.getCreatePullCalls());
    }

    @Test
    void shouldDescribeChangesInPullRequestBody() {
        String body = PlannedTaskExecutor.body("Add dark mode", List.of(
                new FileChange("dark.css", "", FileChange.Action.CREATE)));

        assertEquals("## Summary\n\nAdd dark mode\n\n## Changes\n\n- create: `dark.css`\n\n---\n"
                + "*Created by GolemCore PR Agent*", body);
    }
}
