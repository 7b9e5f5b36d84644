package me.golemcore.pragent.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pragent.domain.model.FileChange;
import me.golemcore.pragent.domain.model.LlmRequest;
import me.golemcore.pragent.domain.model.LlmResponse;
import me.golemcore.pragent.domain.model.TaskRequest;
import me.golemcore.pragent.domain.system.ModelFallbackRunner;
import me.golemcore.pragent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChangeSetGeneratorTest {

    private static final String VALID = "[{\"path\":\"index.html\",\"content\":\"<h1>Dark</h1>\","
            + "\"action\":\"update\"}]";
    private static final TaskRequest REQUEST = new TaskRequest("octo/site", "Add dark mode", "feature/x", "main");

    private ModelFallbackRunner modelRunner;
    private AgentProperties properties;
    private ChangeSetGenerator generator;

    @BeforeEach
    void setUp() {
        modelRunner = mock(ModelFallbackRunner.class);
        properties = new AgentProperties();
        generator = new ChangeSetGenerator(modelRunner, properties, new ObjectMapper(), Clock.systemUTC());
    }

    private static LlmResponse answer(String content) {
        return LlmResponse.builder().content(content).build();
    }

    @Test
    void shouldAcceptFirstValidAnswer() {
        when(modelRunner.run(any())).thenReturn(answer("```json\n" + VALID + "\n```"));

        List<FileChange> changes = generator.generate(REQUEST, "Repository structure:\n- index.html (file)\n");

        assertEquals(1, changes.size());
        assertEquals(FileChange.Action.UPDATE, changes.get(0).getAction());
        verify(modelRunner, times(1)).run(any());
    }

    @Test
    void shouldFeedRejectionBackUntilValid() {
        when(modelRunner.run(any()))
                .thenReturn(answer("I cannot do that"))
                .thenReturn(answer("[{\"path\":\"index.html\",\"content\":\"x\"}]"))
                .thenReturn(answer(VALID));

        List<FileChange> changes = generator.generate(REQUEST, "");

        assertEquals("index.html", changes.get(0).getPath());
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(modelRunner, times(3)).run(captor.capture());
        List<LlmRequest> requests = captor.getAllValues();
        String first = requests.get(0).getMessages().get(0).getContent();
        String second = requests.get(1).getMessages().get(0).getContent();
        String third = requests.get(2).getMessages().get(0).getContent();
        assertFalse(first.contains(ChangeSetGenerator.REJECTION_HEADER));
        assertTrue(second.contains(ChangeSetGenerator.REJECTION_HEADER + "No JSON array found in model response"));
        assertTrue(third.contains(ChangeSetGenerator.REJECTION_HEADER
                + "Item 0: \"action\" must be one of create, update, delete"));
        assertEquals(1, requests.get(2).getMessages().size());
    }

    @Test
    void shouldRecoverAfterTwoMalformedJsonAnswers() {
        when(modelRunner.run(any()))
                .thenReturn(answer("[{\"path\": \"index.html\", \"content\": }]"))
                .thenReturn(answer("```json\n[{path: index.html}]\n```"))
                .thenReturn(answer(VALID));

        List<FileChange> changes = generator.generate(REQUEST, "");

        assertEquals(1, changes.size());
        assertEquals("<h1>Dark</h1>", changes.get(0).getContent());
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(modelRunner, times(3)).run(captor.capture());
        String second = captor.getAllValues().get(1).getMessages().get(0).getContent();
        String third = captor.getAllValues().get(2).getMessages().get(0).getContent();
        assertTrue(second.contains(ChangeSetGenerator.REJECTION_HEADER + "Invalid JSON: "));
        assertTrue(third.contains(ChangeSetGenerator.REJECTION_HEADER + "Invalid JSON: "));
    }

    @Test
    void shouldGiveUpAfterAttemptBudget() {
        when(modelRunner.run(any())).thenReturn(answer("[]"));

        ChangeSetGenerationException error = assertThrows(ChangeSetGenerationException.class,
                () -> generator.generate(REQUEST, ""));

        assertEquals("Failed to generate valid changes after 3 attempt(s): Change array is empty",
                error.getMessage());
        verify(modelRunner, times(3)).run(any());
    }

    @Test
    void shouldPropagateModelFailure() {
        when(modelRunner.run(any())).thenThrow(new IllegalStateException("upstream unavailable"));

        assertThrows(IllegalStateException.class, () -> generator.generate(REQUEST, ""));
        verify(modelRunner, times(1)).run(any());
    }

    @Test
    void shouldTruncateLongDescriptionAndContext() {
        TaskRequest longRequest = new TaskRequest("octo/site", "d".repeat(600), null, null);

        String prompt = generator.buildPrompt(longRequest, "c".repeat(7000));

        assertTrue(prompt.contains("User request: " + "d".repeat(500) + "...\n"));
        assertFalse(prompt.contains("c".repeat(6001)));
        assertTrue(prompt.endsWith("Output ONLY the JSON array. Start with [ end with ]"));
    }
}
