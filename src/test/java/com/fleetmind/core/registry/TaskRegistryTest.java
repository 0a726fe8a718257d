package com.fleetmind.core.registry;

import com.fleetmind.core.model.Task;
import com.fleetmind.core.model.TaskStatus;
import com.fleetmind.core.store.FileDocumentStore;
import com.fleetmind.core.store.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class TaskRegistryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-10T09:30:00Z"), ZoneOffset.UTC);

    private TaskRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TaskRegistry(new InMemoryDocumentStore<>(), CLOCK);
    }

    private static Task task(String id, String... blockedBy) {
        return new Task(id, "cmd_001", "implement", "Do " + id, null, List.of(blockedBy), null, null, null);
    }

    @Nested
    @DisplayName("Assignment")
    class Assignment {

        @Test
        @DisplayName("task without predecessors enters assigned")
        void freshAssigned() {
            Task stored = registry.assign("ashigaru1", task("A"));

            assertEquals(TaskStatus.ASSIGNED, stored.status());
            assertEquals(CLOCK.instant(), stored.timestamp());
            assertEquals(TaskStatus.ASSIGNED, registry.get("ashigaru1").orElseThrow().status());
        }

        @Test
        @DisplayName("task with predecessors enters blocked")
        void freshBlocked() {
            assertEquals(TaskStatus.BLOCKED, registry.assign("ashigaru2", task("B", "A")).status());
        }

        @Test
        @DisplayName("second unfinished task for one worker is rejected")
        void oneActiveTaskPerWorker() {
            registry.assign("ashigaru1", task("A"));

            assertThrows(IllegalTransitionException.class, () -> registry.assign("ashigaru1", task("B")));
            assertEquals("A", registry.get("ashigaru1").orElseThrow().taskId());
        }

        @Test
        @DisplayName("next task after done archives the previous one")
        void nextAfterDone() {
            registry.assign("ashigaru1", task("A"));
            registry.transition("ashigaru1", TaskStatus.DONE);
            registry.assign("ashigaru1", task("B"));

            assertEquals("B", registry.get("ashigaru1").orElseThrow().taskId());
            assertTrue(registry.isDone("A"));
        }

        @Test
        @DisplayName("task ids are unique across the registry")
        void duplicateIdRejected() {
            registry.assign("ashigaru1", task("A"));
            assertThrows(IllegalTransitionException.class, () -> registry.assign("ashigaru2", task("A")));
        }

        @Test
        @DisplayName("task id registered by another worker while waiting for the lock is rejected")
        void duplicateIdRegisteredConcurrently() {
            var racing = new InMemoryDocumentStore<TaskDocument>() {
                @Override
                public TaskDocument update(String key, Function<Optional<TaskDocument>, TaskDocument> mutation) {
                    if (key.equals("ashigaru1")) {
                        super.update("ashigaru2", current ->
                                new TaskDocument(task("X").withStatus(TaskStatus.ASSIGNED, CLOCK.instant()), List.of()));
                    }
                    return super.update(key, mutation);
                }
            };
            var contended = new TaskRegistry(racing, CLOCK);

            assertThrows(IllegalTransitionException.class, () -> contended.assign("ashigaru1", task("X")));
            assertTrue(contended.get("ashigaru1").isEmpty());
        }

        @Test
        @DisplayName("assign refuses a task carrying redo_of")
        void assignRejectsRedo() {
            var redo = new Task("A2", null, "implement", null, null, List.of(), "A", null, null);
            assertThrows(IllegalTransitionException.class, () -> registry.assign("ashigaru1", redo));
        }
    }

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("blocked -> assigned fails with StillBlocked until every predecessor is done")
        void stillBlockedUntilDone() {
            registry.assign("ashigaru1", task("A"));
            registry.assign("ashigaru3", task("C"));
            registry.assign("ashigaru2", task("B", "A", "C"));

            var ex = assertThrows(StillBlockedException.class,
                    () -> registry.transition("ashigaru2", TaskStatus.ASSIGNED));
            assertEquals(List.of("A", "C"), ex.pending());

            registry.transition("ashigaru1", TaskStatus.DONE);
            ex = assertThrows(StillBlockedException.class,
                    () -> registry.transition("ashigaru2", TaskStatus.ASSIGNED));
            assertEquals(List.of("C"), ex.pending());

            registry.transition("ashigaru3", TaskStatus.DONE);
            assertEquals(TaskStatus.ASSIGNED, registry.transition("ashigaru2", TaskStatus.ASSIGNED).status());
        }

        @Test
        @DisplayName("unknown predecessor keeps the task blocked")
        void unknownPredecessor() {
            registry.assign("ashigaru2", task("B", "ghost"));
            assertEquals(List.of("ghost"), registry.unsatisfied(registry.get("ashigaru2").orElseThrow()));
            assertThrows(StillBlockedException.class, () -> registry.transition("ashigaru2", TaskStatus.ASSIGNED));
        }

        @Test
        @DisplayName("predecessor completed earlier and archived still counts")
        void archivedPredecessor() {
            registry.assign("ashigaru1", task("A"));
            registry.transition("ashigaru1", TaskStatus.DONE);
            registry.assign("ashigaru1", task("A-next"));
            registry.assign("ashigaru2", task("B", "A"));

            assertEquals(TaskStatus.ASSIGNED, registry.transition("ashigaru2", TaskStatus.ASSIGNED).status());
        }

        @Test
        @DisplayName("done is terminal")
        void doneIsTerminal() {
            registry.assign("ashigaru1", task("A"));
            registry.transition("ashigaru1", TaskStatus.DONE);

            assertThrows(IllegalTransitionException.class, () -> registry.transition("ashigaru1", TaskStatus.ASSIGNED));
            assertThrows(IllegalTransitionException.class, () -> registry.transition("ashigaru1", TaskStatus.DONE));
            var rewrite = registry.get("ashigaru1").orElseThrow().withStatus(TaskStatus.ASSIGNED, CLOCK.instant());
            assertThrows(IllegalTransitionException.class, () -> registry.set("ashigaru1", rewrite));
        }

        @Test
        @DisplayName("blocked cannot jump straight to done")
        void blockedToDoneRejected() {
            registry.assign("ashigaru2", task("B", "A"));
            assertThrows(IllegalTransitionException.class, () -> registry.transition("ashigaru2", TaskStatus.DONE));
        }

        @Test
        @DisplayName("transition without a task is rejected")
        void noTask() {
            assertThrows(IllegalTransitionException.class, () -> registry.transition("nobody", TaskStatus.DONE));
        }
    }

    @Nested
    @DisplayName("Redo")
    class Redo {

        @Test
        @DisplayName("redo links the successor to the done task")
        void redoLinks() {
            registry.assign("ashigaru1", task("A"));
            registry.transition("ashigaru1", TaskStatus.DONE);

            Task b = registry.redo("ashigaru1", task("B"));

            assertEquals("A", b.redoOf());
            assertEquals(TaskStatus.ASSIGNED, b.status());
        }

        @Test
        @DisplayName("redo chain A <- B <- C keeps every link")
        void redoChain() {
            registry.assign("ashigaru1", task("A"));
            registry.transition("ashigaru1", TaskStatus.DONE);
            registry.redo("ashigaru1", task("B"));
            registry.transition("ashigaru1", TaskStatus.DONE);
            registry.redo("ashigaru1", task("C"));

            var chain = registry.lineage("ashigaru1");
            assertEquals(List.of("C", "B", "A"), chain.stream().map(Task::taskId).toList());
            assertEquals("B", chain.get(0).redoOf());
            assertEquals("A", chain.get(1).redoOf());
            assertNull(chain.get(2).redoOf());
        }

        @Test
        @DisplayName("redo of an unfinished task is rejected")
        void redoRequiresDone() {
            registry.assign("ashigaru1", task("A"));
            assertThrows(IllegalTransitionException.class, () -> registry.redo("ashigaru1", task("B")));
        }

        @Test
        @DisplayName("redo_of naming a different task is rejected")
        void redoOfMismatch() {
            registry.assign("ashigaru1", task("A"));
            registry.transition("ashigaru1", TaskStatus.DONE);
            var wrong = new Task("B", null, "implement", null, null, List.of(), "Z", null, null);

            assertThrows(IllegalTransitionException.class, () -> registry.redo("ashigaru1", wrong));
        }

        @Test
        @DisplayName("redo check rejects a reused id and a mismatched redo_of without writing")
        void checkRedoRejects() {
            registry.assign("ashigaru1", task("A"));
            registry.transition("ashigaru1", TaskStatus.DONE);
            var wrong = new Task("B", null, "implement", null, null, List.of(), "Z", null, null);

            assertThrows(IllegalTransitionException.class, () -> registry.checkRedo("ashigaru1", task("A")));
            assertThrows(IllegalTransitionException.class, () -> registry.checkRedo("ashigaru1", wrong));
            assertEquals("A", registry.checkRedo("ashigaru1", task("B")).taskId());
            assertEquals(TaskStatus.DONE, registry.get("ashigaru1").orElseThrow().status());
        }

        @Test
        @DisplayName("redo successor with predecessors enters blocked")
        void redoBlocked() {
            registry.assign("ashigaru1", task("A"));
            registry.transition("ashigaru1", TaskStatus.DONE);

            assertEquals(TaskStatus.BLOCKED, registry.redo("ashigaru1", task("B", "X")).status());
        }
    }

    @Test
    @DisplayName("activeTasks maps each worker to its current task")
    void activeTasks() {
        registry.assign("ashigaru1", task("A"));
        registry.assign("ashigaru2", task("B", "A"));

        var active = registry.activeTasks();
        assertEquals(List.of("ashigaru1", "ashigaru2"), List.copyOf(active.keySet()));
        assertEquals("B", active.get("ashigaru2").taskId());
    }

    @Nested
    @DisplayName("On disk")
    class OnDisk {

        @TempDir
        Path dir;

        @Test
        @DisplayName("dependencies resolve across separately stored worker files")
        void crossWorkerFiles() {
            var documents = new FileDocumentStore<>(dir, TaskDocument.class, Duration.ofSeconds(5));
            var onDisk = new TaskRegistry(documents, CLOCK);

            onDisk.assign("ashigaru1", task("A"));
            onDisk.assign("ashigaru2", task("B", "A"));
            onDisk.transition("ashigaru1", TaskStatus.DONE);

            var reopened = new TaskRegistry(new FileDocumentStore<>(dir, TaskDocument.class, Duration.ofSeconds(5)), CLOCK);
            assertEquals(TaskStatus.ASSIGNED, reopened.transition("ashigaru2", TaskStatus.ASSIGNED).status());
            assertEquals(List.of("A"), reopened.get("ashigaru2").orElseThrow().blockedBy());
        }
    }
}
