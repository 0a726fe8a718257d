package com.fleetmind.core.model;

import com.fleetmind.core.store.Yamls;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("CliFamily")
    class CliFamilyTests {

        @Test
        @DisplayName("reset commands differ per family")
        void resetCommands() {
            assertEquals("/clear", CliFamily.CLAUDE.resetCommand());
            assertEquals("/new", CliFamily.CODEX.resetCommand());
            assertEquals("/model opus", CliFamily.CLAUDE.modelSwitchCommand("opus"));
        }

        @Test
        @DisplayName("fromString accepts wire and enum names, blank defaults to claude")
        void fromString() {
            assertEquals(CliFamily.CODEX, CliFamily.fromString("codex"));
            assertEquals(CliFamily.CODEX, CliFamily.fromString(" CODEX "));
            assertEquals(CliFamily.CLAUDE, CliFamily.fromString(null));
            assertThrows(IllegalArgumentException.class, () -> CliFamily.fromString("emacs"));
        }

        @Test
        @DisplayName("fromModel guesses the family from the model id")
        void fromModel() {
            assertEquals(CliFamily.CLAUDE, CliFamily.fromModel("claude-sonnet-4").orElseThrow());
            assertEquals(CliFamily.CODEX, CliFamily.fromModel("gpt-5.3-codex-spark").orElseThrow());
            assertTrue(CliFamily.fromModel("mystery").isEmpty());
            assertTrue(CliFamily.fromModel("").isEmpty());
        }
    }

    @Nested
    @DisplayName("Task")
    class TaskTests {

        @Test
        @DisplayName("empty id is rejected")
        void emptyId() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Task(" ", null, null, null, null, null, null, TaskStatus.ASSIGNED, null));
        }

        @Test
        @DisplayName("status and redo_of are replaced without touching the rest")
        void withers() {
            var task = new Task("B", "cmd_1", "review", "Review A", 4, List.of("A"), null, TaskStatus.BLOCKED, null);
            var at = Instant.parse("2026-02-10T09:30:00Z");

            var assigned = task.withStatus(TaskStatus.ASSIGNED, at).withRedoOf("B0");

            assertEquals(TaskStatus.ASSIGNED, assigned.status());
            assertEquals(at, assigned.timestamp());
            assertEquals("B0", assigned.redoOf());
            assertEquals(List.of("A"), assigned.blockedBy());
            assertEquals(4, assigned.bloomLevel());
        }

        @Test
        @DisplayName("status names are lower-case on the wire")
        void statusWire() {
            assertEquals("blocked", TaskStatus.BLOCKED.wireName());
            assertEquals(TaskStatus.DONE, TaskStatus.fromString("Done"));
            assertTrue(TaskStatus.DONE.terminal());
            assertFalse(TaskStatus.ASSIGNED.terminal());
        }
    }

    @Test
    @DisplayName("task document fields use snake_case keys in YAML")
    void taskYaml() throws Exception {
        var task = new Task("subtask_001a", "cmd_001", "implement", "Build it", 3, List.of("A"), "subtask_000",
                TaskStatus.BLOCKED, Instant.parse("2026-02-10T09:30:00Z"));

        String yaml = Yamls.mapper().writeValueAsString(task);

        assertTrue(yaml.contains("task_id: subtask_001a"), yaml);
        assertTrue(yaml.contains("bloom_level: 3"), yaml);
        assertTrue(yaml.contains("redo_of: subtask_000"), yaml);
        assertTrue(yaml.contains("status: blocked"), yaml);
        assertEquals(task, Yamls.mapper().readValue(yaml, Task.class));
    }

    @Test
    @DisplayName("worker document omits unset fields and reads back")
    void workerYaml() throws Exception {
        var worker = new Worker("karo", "opus", CliFamily.CLAUDE, "multiagent:0.0");

        String yaml = Yamls.mapper().writeValueAsString(worker);

        assertTrue(yaml.contains("worker_id: karo"), yaml);
        assertTrue(yaml.contains("cli: claude"), yaml);
        assertFalse(yaml.contains("announced_task"), yaml);
        assertEquals(worker, Yamls.mapper().readValue(yaml, Worker.class));
    }
}
