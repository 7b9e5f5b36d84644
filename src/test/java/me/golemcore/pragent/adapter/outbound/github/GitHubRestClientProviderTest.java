package me.golemcore.pragent.adapter.outbound.github;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pragent.domain.model.CommitComparison;
import me.golemcore.pragent.domain.model.GitRef;
import me.golemcore.pragent.domain.model.PullRequestInfo;
import me.golemcore.pragent.domain.model.RepositoryEntry;
import me.golemcore.pragent.infrastructure.config.AgentProperties;
import me.golemcore.pragent.infrastructure.http.FeignClientFactory;
import me.golemcore.pragent.port.outbound.GitHubApiException;
import me.golemcore.pragent.port.outbound.GitHubPort;
import me.golemcore.pragent.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GitHubRestClientProviderTest {

    private static final String API_URL = "http://mock.github.local";
    private static final String OWNER = "octo";
    private static final String REPO = "site";

    private OkHttpMockEngine httpEngine;
    private GitHubPort github;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(httpEngine)
                .build();
        ObjectMapper objectMapper = new ObjectMapper();
        AgentProperties properties = new AgentProperties();
        properties.getGithub().setApiUrl(API_URL);
        GitHubRestClientProvider provider = new GitHubRestClientProvider(
                new FeignClientFactory(client, objectMapper), properties, objectMapper);
        github = provider.forToken("ghp_test");
    }

    @Test
    void shouldAuthenticateEveryRequest() {
        httpEngine.enqueueJson(200, "{\"login\":\"octocat\",\"id\":1}");

        assertEquals("octocat", github.getAuthenticatedUser().login());

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("GET", request.method());
        assertEquals("/user", request.target());
        assertEquals("Bearer ghp_test", request.header("Authorization"));
        assertEquals("golemcore-pr-agent", request.header("User-Agent"));
        assertEquals("application/vnd.github+json", request.header("Accept"));
    }

    @Test
    void shouldListDirectoryContents() {
        httpEngine.enqueueJson(200, "[{\"name\":\"index.html\",\"path\":\"index.html\",\"type\":\"file\"},"
                + "{\"name\":\"src\",\"path\":\"src\",\"type\":\"dir\",\"size\":0}]");

        List<RepositoryEntry> entries = github.getContents(OWNER, REPO, "docs");

        assertEquals(List.of(new RepositoryEntry("index.html", "file"), new RepositoryEntry("src", "dir")),
                entries);
        assertEquals("/repos/octo/site/contents/docs", httpEngine.takeRequest().target());
    }

    @Test
    void shouldReadFileAtRef() {
        httpEngine.enqueueJson(200, "{\"path\":\"README.md\",\"sha\":\"abc\",\"encoding\":\"base64\","
                + "\"content\":\"IyBTaXRl\\n\"}");

        assertEquals("# Site", github.getFileContent(OWNER, REPO, "README.md", "main").decodedContent());
        assertEquals("/repos/octo/site/contents/README.md?ref=main", httpEngine.takeRequest().target());
    }

    @Test
    void shouldReadRefSha() {
        httpEngine.enqueueJson(200, "{\"ref\":\"refs/heads/main\",\"object\":{\"sha\":\"deadbeef\","
                + "\"type\":\"commit\"}}");

        GitRef ref = github.getRef(OWNER, REPO, "main");

        assertEquals("deadbeef", ref.sha());
        assertEquals("/repos/octo/site/git/ref/heads/main", httpEngine.takeRequest().target());
    }

    @Test
    void shouldCreateBranchRef() {
        httpEngine.enqueueJson(201, "{\"ref\":\"refs/heads/feature\"}");

        github.createRef(OWNER, REPO, "feature", "deadbeef");

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/repos/octo/site/git/refs", request.target());
        assertTrue(request.body().contains("\"ref\":\"refs/heads/feature\""));
        assertTrue(request.body().contains("\"sha\":\"deadbeef\""));
    }

    @Test
    void shouldEncodeFileContentAndOmitMissingSha() {
        httpEngine.enqueueJson(201, "{\"content\":{\"sha\":\"new\"}}");

        github.createOrUpdateFile(OWNER, REPO, "hello.txt", "hello", "create: hello.txt - greet", "feature", null);

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("PUT", request.method());
        assertEquals("/repos/octo/site/contents/hello.txt", request.target());
        assertTrue(request.body().contains("\"content\":\"aGVsbG8=\""));
        assertTrue(request.body().contains("\"branch\":\"feature\""));
        assertFalse(request.body().contains("\"sha\""));
    }

    @Test
    void shouldOpenPullRequest() {
        httpEngine.enqueueJson(201, "{\"number\":7,\"html_url\":\"https://github.com/octo/site/pull/7\"}");

        PullRequestInfo pr = github.createPullRequest(OWNER, REPO, "Dark mode", "body", "feature", "main");

        assertEquals(new PullRequestInfo("https://github.com/octo/site/pull/7", 7), pr);
    }

    @Test
    void shouldCompareBranches() {
        httpEngine.enqueueJson(200, "{\"status\":\"ahead\",\"ahead_by\":2,\"behind_by\":0}");

        CommitComparison comparison = github.compareCommits(OWNER, REPO, "main", "feature");

        assertEquals(new CommitComparison(2, 0), comparison);
        assertEquals("/repos/octo/site/compare/main...feature", httpEngine.takeRequest().target());
    }

    // ==================== Errors ====================

    @Test
    void shouldMapNotFound() {
        httpEngine.enqueueJson(404, "{\"message\":\"Not Found\"}");

        GitHubApiException error = assertThrows(GitHubApiException.class,
                () -> github.getFileContent(OWNER, REPO, "missing.txt", null));

        assertTrue(error.isNotFound());
        assertEquals("GitHub API error: 404 - Not Found", error.getMessage());
    }

    @Test
    void shouldIncludeValidationDetails() {
        httpEngine.enqueueJson(422, "{\"message\":\"Validation Failed\",\"errors\":[{\"resource\":\"PullRequest\","
                + "\"message\":\"A pull request already exists for octo:feature.\"}]}");

        GitHubApiException error = assertThrows(GitHubApiException.class,
                () -> github.createPullRequest(OWNER, REPO, "t", "b", "feature", "main"));

        assertEquals(422, error.getStatus());
        assertTrue(error.isAlreadyExists());
        assertEquals("GitHub API error: 422 - Validation Failed: A pull request already exists for octo:feature.",
                error.getMessage());
    }

    @Test
    void shouldRejectBlankToken() {
        GitHubRestClientProvider provider = new GitHubRestClientProvider(
                new FeignClientFactory(new OkHttpClient(), new ObjectMapper()), new AgentProperties(),
                new ObjectMapper());

        assertThrows(IllegalArgumentException.class, () -> provider.forToken(" "));
    }
}
