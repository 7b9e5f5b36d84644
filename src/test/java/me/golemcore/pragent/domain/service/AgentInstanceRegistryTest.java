package me.golemcore.pragent.domain.service;

import me.golemcore.pragent.domain.model.AgentTaskState;
import me.golemcore.pragent.domain.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentInstanceRegistryTest {

    private TaskStateRepository repository;
    private AgentInstanceRegistry registry;

    @BeforeEach
    void setUp() {
        repository = mock(TaskStateRepository.class);
        when(repository.load("fresh")).thenReturn(Optional.empty());
        registry = new AgentInstanceRegistry(repository, Clock.systemUTC());
    }

    @Test
    void shouldCreateInstanceOncePerId() {
        AgentInstance first = registry.getOrCreate("fresh");

        assertSame(first, registry.getOrCreate("fresh"));
        assertNotSame(first, registry.getOrCreate("other"));
        verify(repository, times(1)).load("fresh");
    }

    @Test
    void shouldRestoreCheckpointedState() {
        AgentTaskState stored = AgentTaskState.builder()
                .status(TaskStatus.ERROR)
                .errorMessage(TaskStateRepository.RECOVERY_INTERRUPTED_MSG)
                .build();
        when(repository.load("restored")).thenReturn(Optional.of(stored));

        AgentTaskState state = registry.getOrCreate("restored").getTracker().getSnapshot();

        assertEquals(TaskStatus.ERROR, state.getStatus());
        assertEquals(TaskStateRepository.RECOVERY_INTERRUPTED_MSG, state.getErrorMessage());
    }

    @Test
    void shouldRejectUnsafeIds() {
        assertThrows(IllegalArgumentException.class, () -> registry.getOrCreate(""));
        assertThrows(IllegalArgumentException.class, () -> registry.getOrCreate("a/b"));
        assertThrows(IllegalArgumentException.class, () -> registry.getOrCreate("x".repeat(129)));
    }
}
