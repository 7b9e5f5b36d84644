package me.golemcore.pragent.domain.service;

import me.golemcore.pragent.domain.model.FileChange;
import me.golemcore.pragent.domain.model.GitRef;
import me.golemcore.pragent.domain.model.RepoLocator;
import me.golemcore.pragent.port.outbound.GitHubApiException;
import me.golemcore.pragent.port.outbound.GitHubPort;
import me.golemcore.pragent.testsupport.github.InMemoryGitHubRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RepositoryOperationsTest {

    private InMemoryGitHubRepository github;
    private RepositoryOperations operations;

    @BeforeEach
    void setUp() {
        github = new InMemoryGitHubRepository().withFile("index.html", "<html></html>");
        operations = new RepositoryOperations(github,
                new RepoLocator(InMemoryGitHubRepository.OWNER, InMemoryGitHubRepository.REPO), null);
    }

    @Test
    void shouldEnsureBranchOnlyOnce() {
        assertFalse(operations.ensureBranchExists("feature/x", "main"));
        assertTrue(operations.ensureBranchExists("feature/x", "main"));
        assertEquals(1, github.getCreateRefCalls());
    }

    @Test
    void shouldTreatMissingRepositoryRefsAsAbsent() {
        RepositoryOperations other = new RepositoryOperations(github, new RepoLocator("octo", "missing"), null);

        assertFalse(other.branchExists("main"));
        assertThrows(GitHubApiException.class, () -> other.createBranch("feature/x", "main"));
    }

    @Test
    void shouldPropagateUnprocessableRefErrorsThatAreNotDuplicates() {
        GitHubPort failing = mock(GitHubPort.class);
        when(failing.getRef("octo", "site", "main")).thenReturn(new GitRef("refs/heads/main", "abc123"));
        doThrow(new GitHubApiException(422, "Object does not exist"))
                .when(failing).createRef(anyString(), anyString(), anyString(), anyString());
        RepositoryOperations failingOperations = new RepositoryOperations(failing, new RepoLocator("octo", "site"),
                null);

        GitHubApiException error = assertThrows(GitHubApiException.class,
                () -> failingOperations.createBranch("feature/x", "main"));

        assertEquals("GitHub API error: 422 - Object does not exist", error.getMessage());
        assertFalse(error.isAlreadyExists());
    }

    @Test
    void shouldCreateFileWhenUpdateTargetIsMissing() {
        github.withBranch("feature/x");

        operations.commitFile(new FileChange("new.txt", "hello", FileChange.Action.UPDATE), "feature/x", "Docs");

        assertEquals("hello", github.fileOn("feature/x", "new.txt"));
        assertEquals(1, github.commitCount("feature/x"));
    }

    @Test
    void shouldRefuseDeletes() {
        FileChange delete = new FileChange("index.html", "", FileChange.Action.DELETE);

        assertThrows(IllegalArgumentException.class, () -> operations.commitFile(delete, "main", "Remove"));
        assertEquals("<html></html>", github.fileOn("main", "index.html"));
    }

    @Test
    void shouldFindShaOnlyForExistingFiles() {
        assertEquals(InMemoryGitHubRepository.sha("<html></html>"), operations.findSha("index.html", "main"));
        assertNull(operations.findSha("missing.txt", "main"));
    }

    @Test
    void shouldBuildCommitMessageWithShortDescription() {
        assertEquals("create: a.txt - " + "d".repeat(50),
                RepositoryOperations.commitMessage(FileChange.Action.CREATE, "a.txt", "d".repeat(80)));
        assertEquals("update: a.txt - ", RepositoryOperations.commitMessage(FileChange.Action.UPDATE, "a.txt", null));
    }
}
