package me.golemcore.pragent.tools;

import me.golemcore.pragent.domain.model.RepoLocator;
import me.golemcore.pragent.domain.model.TaskRequest;
import me.golemcore.pragent.domain.model.ToolResult;
import me.golemcore.pragent.domain.service.RepositoryOperations;
import me.golemcore.pragent.domain.service.TaskStateRepository;
import me.golemcore.pragent.domain.service.TaskStateTracker;
import me.golemcore.pragent.testsupport.github.InMemoryGitHubRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class GetRepoStructureToolTest {

    private GetRepoStructureTool tool;

    @BeforeEach
    void setUp() {
        InMemoryGitHubRepository github = new InMemoryGitHubRepository()
                .withFile("index.html", "<html></html>")
                .withFile("src/app.js", "")
                .withFile("src/lib/util.js", "");
        TaskStateTracker tracker = new TaskStateTracker("agent-1", mock(TaskStateRepository.class),
                Clock.systemUTC());
        RepositoryOperations operations = new RepositoryOperations(github,
                new RepoLocator(InMemoryGitHubRepository.OWNER, InMemoryGitHubRepository.REPO), null);
        TaskRequest request = new TaskRequest("octo/site", "Change", "feature/x", "main");
        tool = new GetRepoStructureTool(new RepositoryToolContext(operations, request, tracker, 10));
    }

    @Test
    void shouldListRootByDefault() {
        ToolResult result = tool.execute(Map.of()).join();

        assertTrue(result.isSuccess());
        List<?> structure = (List<?>) ((Map<?, ?>) result.getData()).get("structure");
        assertEquals(List.of(
                Map.of("path", "index.html", "type", "file"),
                Map.of("path", "src", "type", "dir")), structure);
    }

    @Test
    void shouldListSubdirectory() {
        ToolResult result = tool.execute(Map.of("path", "src")).join();

        List<?> structure = (List<?>) ((Map<?, ?>) result.getData()).get("structure");
        assertEquals(List.of(
                Map.of("path", "src/app.js", "type", "file"),
                Map.of("path", "src/lib", "type", "dir")), structure);
    }

    @Test
    void shouldReportUnknownDirectory() {
        ToolResult result = tool.execute(Map.of("path", "docs")).join();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("Failed to list docs"));
    }
}
