package me.golemcore.pragent.domain.service;

import me.golemcore.pragent.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.pragent.infrastructure.config.AgentProperties;
import me.golemcore.pragent.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CredentialStoreTest {

    @TempDir
    Path tempDir;

    private CredentialStore store;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        store = new CredentialStore(storage, AutoConfiguration.objectMapper(), properties, Clock.systemUTC());
    }

    @Test
    void shouldPersistTokenOutsideTaskState() {
        store.saveToken("agent-1", "ghp_secret");

        assertEquals(Optional.of("ghp_secret"), store.loadToken("agent-1"));
        assertTrue(Files.exists(tempDir.resolve("credentials").resolve("agent-1.json")));
        assertFalse(Files.exists(tempDir.resolve("tasks").resolve("agent-1.json")));
    }

    @Test
    void shouldForgetDeletedToken() {
        store.saveToken("agent-1", "ghp_secret");

        store.deleteToken("agent-1");

        assertTrue(store.loadToken("agent-1").isEmpty());
    }

    @Test
    void shouldTreatCorruptCredentialAsMissing() throws Exception {
        Files.writeString(tempDir.resolve("credentials").resolve("agent-2.json"), "not json");

        assertTrue(store.loadToken("agent-2").isEmpty());
    }
}
