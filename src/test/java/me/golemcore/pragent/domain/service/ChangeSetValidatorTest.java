package me.golemcore.pragent.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pragent.domain.model.FileChange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChangeSetValidatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ChangeSetValidator validator = new ChangeSetValidator();

    @Test
    void shouldAcceptWellFormedChanges() throws Exception {
        JsonNode node = objectMapper.readTree("[{\"path\":\" index.html \",\"content\":\"<h1>Hi</h1>\","
                + "\"action\":\"UPDATE\"},{\"path\":\"old.txt\",\"content\":\"\",\"action\":\"delete\"}]");

        List<FileChange> changes = validator.validate(node);

        assertEquals(2, changes.size());
        assertEquals("index.html", changes.get(0).getPath());
        assertEquals(FileChange.Action.UPDATE, changes.get(0).getAction());
        assertEquals(FileChange.Action.DELETE, changes.get(1).getAction());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "{}|Expected a JSON array of changes",
            "[]|Change array is empty",
            "[\"a.txt\"]|Item 0: expected an object",
            "[{\"content\":\"x\",\"action\":\"create\"}]|Item 0: missing or empty \"path\"",
            "[{\"path\":\"  \",\"content\":\"x\",\"action\":\"create\"}]|Item 0: missing or empty \"path\"",
            "[{\"path\":\"a\",\"action\":\"create\"}]|Item 0: missing or non-string \"content\"",
            "[{\"path\":\"a\",\"content\":5,\"action\":\"create\"}]|Item 0: missing or non-string \"content\"",
            "[{\"path\":\"a\",\"content\":\"x\",\"action\":\"rename\"}]|Item 0: \"action\" must be one of create, "
                    + "update, delete"
    })
    void shouldReportFirstViolation(String json, String expected) throws Exception {
        JsonNode node = objectMapper.readTree(json);

        ChangeSetRejectedException error = assertThrows(ChangeSetRejectedException.class,
                () -> validator.validate(node));

        assertEquals(expected, error.getMessage());
    }

    @Test
    void shouldNameIndexOfOffendingItem() throws Exception {
        JsonNode node = objectMapper.readTree("[{\"path\":\"a\",\"content\":\"x\",\"action\":\"create\"},"
                + "{\"path\":\"b\",\"content\":\"y\"}]");

        ChangeSetRejectedException error = assertThrows(ChangeSetRejectedException.class,
                () -> validator.validate(node));

        assertEquals("Item 1: \"action\" must be one of create, update, delete", error.getMessage());
    }
}
