package com.fleetmind.core.registry;

import com.fleetmind.core.model.Task;
import com.fleetmind.core.model.TaskStatus;
import com.fleetmind.core.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the single active task of every worker, with its dependency and lineage metadata.
 *
 * <p>Lifecycle: a task enters as {@code blocked} when it names predecessors, otherwise as
 * {@code assigned}; {@code blocked -> assigned} requires every predecessor to be done;
 * {@code assigned -> done}; {@code done} is terminal. At most one unfinished task per worker.
 *
 * <p>Predecessors are resolved registry-wide: one worker's completed task can unblock
 * another worker's task. Writes hold only the owning worker's lock; the other workers'
 * documents are read as lock-free snapshots.
 */
@Service
public class TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private final DocumentStore<TaskDocument> documents;
    private final Clock clock;

    public TaskRegistry(DocumentStore<TaskDocument> documents, Clock clock) {
        this.documents = documents;
        this.clock = clock;
    }

    public Optional<Task> get(String workerId) {
        return documents.read(workerId).map(TaskDocument::task);
    }

    /**
     * Stores {@code task} as the worker's active task as given. The previous task moves to
     * history; it must be done unless it is the same task being rewritten.
     */
    public Task set(String workerId, Task task) {
        if (task.status() == null) {
            throw new IllegalArgumentException("Task " + task.taskId() + " has no status");
        }
        documents.update(workerId, current -> {
            TaskDocument document = current.orElseGet(() -> new TaskDocument(null, List.of()));
            requireReplaceable(workerId, document.task(), task);
            return document.replaceWith(task);
        });
        log.info("Task {} stored for {} [{}]", task.taskId(), workerId, task.status().wireName());
        return task;
    }

    /**
     * Gives the worker its next task: {@code blocked} if it names predecessors, otherwise
     * {@code assigned}. Fails while the worker still holds an unfinished task.
     *
     * <p>Task-id uniqueness is checked while holding this worker's lock only. Two workers
     * assigned the same new id at the same instant can both succeed; callers own id allocation.
     */
    public Task assign(String workerId, Task task) {
        if (task.redoOf() != null) {
            throw new IllegalTransitionException("Task " + task.taskId() + " carries redo_of; use redo");
        }
        TaskStatus initial = task.hasPredecessors() ? TaskStatus.BLOCKED : TaskStatus.ASSIGNED;
        Task stored = task.withStatus(initial, clock.instant());
        documents.update(workerId, current -> {
            TaskDocument document = current.orElseGet(() -> new TaskDocument(null, List.of()));
            requireReplaceable(workerId, document.task(), stored);
            requireUnknown(stored.taskId());
            return document.replaceWith(stored);
        });
        log.info("Task {} stored for {} [{}]", stored.taskId(), workerId, stored.status().wireName());
        return stored;
    }

    /**
     * Moves the worker's active task to {@code newStatus}.
     *
     * @throws StillBlockedException       if assigning a task whose predecessors are not all done
     * @throws IllegalTransitionException  for any other transition outside the lifecycle
     */
    public Task transition(String workerId, TaskStatus newStatus) {
        TaskDocument updated = documents.update(workerId, current -> {
            Task task = current.map(TaskDocument::task).orElseThrow(() ->
                    new IllegalTransitionException("Worker " + workerId + " has no task"));
            TaskStatus from = task.status();
            if (from == TaskStatus.BLOCKED && newStatus == TaskStatus.ASSIGNED) {
                List<String> pending = unsatisfied(task);
                if (!pending.isEmpty()) {
                    throw new StillBlockedException(task.taskId(), pending);
                }
            } else if (!(from == TaskStatus.ASSIGNED && newStatus == TaskStatus.DONE)) {
                throw new IllegalTransitionException("Task " + task.taskId() + ": "
                        + from.wireName() + " -> " + newStatus.wireName() + " is not allowed");
            }
            return current.get().replaceWith(task.withStatus(newStatus, clock.instant()));
        });
        Task task = updated.task();
        log.info("Task {} on {} -> {}", task.taskId(), workerId, task.status().wireName());
        return task;
    }

    /**
     * Checks that {@code successor} may replace the worker's task, without writing anything:
     * the current task is done, the successor's id is new, and its {@code redo_of}, when given,
     * names the done task.
     *
     * @return the done task the successor would supersede
     * @throws IllegalTransitionException if the redo would be rejected
     */
    public Task checkRedo(String workerId, Task successor) {
        Task previous = get(workerId).orElseThrow(() ->
                new IllegalTransitionException("Worker " + workerId + " has no task to redo"));
        requireRedoable(workerId, previous, successor);
        requireUnknown(successor.taskId());
        return previous;
    }

    /**
     * Replaces the worker's done task with its corrected successor. {@code redo_of} on the
     * successor is set to the done task's id (or must already equal it) and never changes
     * afterwards.
     */
    public Task redo(String workerId, Task successor) {
        TaskDocument updated = documents.update(workerId, current -> {
            Task previous = current.map(TaskDocument::task).orElseThrow(() ->
                    new IllegalTransitionException("Worker " + workerId + " has no task to redo"));
            requireRedoable(workerId, previous, successor);
            requireUnknown(successor.taskId());
            TaskStatus initial = successor.hasPredecessors() ? TaskStatus.BLOCKED : TaskStatus.ASSIGNED;
            Task next = successor.withRedoOf(previous.taskId()).withStatus(initial, clock.instant());
            return current.get().replaceWith(next);
        });
        Task task = updated.task();
        log.info("Task {} on {} redoes {} [{}]", task.taskId(), workerId, task.redoOf(), task.status().wireName());
        return task;
    }

    /**
     * Redo chain ending at the worker's active task, newest first (e.g. [C, B, A]).
     */
    public List<Task> lineage(String workerId) {
        Optional<Task> head = get(workerId);
        if (head.isEmpty()) {
            return List.of();
        }
        Map<String, Task> byId = indexAll();
        var chain = new ArrayList<Task>();
        Task cursor = head.get();
        while (cursor != null && chain.size() <= byId.size()) {
            chain.add(cursor);
            cursor = cursor.redoOf() == null ? null : byId.get(cursor.redoOf());
        }
        return chain;
    }

    /**
     * Whether a task with this id has reached {@code done} on any worker.
     */
    public boolean isDone(String taskId) {
        Task task = indexAll().get(taskId);
        return task != null && task.status() == TaskStatus.DONE;
    }

    /**
     * Predecessors of {@code task} that are not yet done, in declaration order.
     */
    public List<String> unsatisfied(Task task) {
        if (!task.hasPredecessors()) {
            return List.of();
        }
        Map<String, Task> byId = indexAll();
        var pending = new ArrayList<String>();
        for (String predecessor : task.blockedBy()) {
            Task found = byId.get(predecessor);
            if (found == null || found.status() != TaskStatus.DONE) {
                pending.add(predecessor);
            }
        }
        return pending;
    }

    /**
     * Active task per worker that has a task file, in worker-id order.
     */
    public Map<String, Task> activeTasks() {
        var active = new LinkedHashMap<String, Task>();
        for (String workerId : documents.keys()) {
            get(workerId).ifPresent(task -> active.put(workerId, task));
        }
        return active;
    }

    private Map<String, Task> indexAll() {
        var byId = new HashMap<String, Task>();
        for (String workerId : documents.keys()) {
            documents.read(workerId).ifPresent(document -> {
                for (Task task : document.allTasks()) {
                    byId.merge(task.taskId(), task, TaskRegistry::furthest);
                }
            });
        }
        return byId;
    }

    private void requireUnknown(String taskId) {
        if (indexAll().containsKey(taskId)) {
            throw new IllegalTransitionException("Task id " + taskId + " is already registered");
        }
    }

    private static void requireRedoable(String workerId, Task previous, Task successor) {
        if (previous.status() != TaskStatus.DONE) {
            throw new IllegalTransitionException("Task " + previous.taskId()
                    + " is " + previous.status().wireName() + "; only done tasks can be redone");
        }
        if (successor.redoOf() != null && !successor.redoOf().equals(previous.taskId())) {
            throw new IllegalTransitionException("Task " + successor.taskId() + " is a redo of "
                    + successor.redoOf() + " but " + workerId + " last completed " + previous.taskId());
        }
    }

    private static void requireReplaceable(String workerId, Task active, Task incoming) {
        if (active == null) {
            return;
        }
        if (active.taskId().equals(incoming.taskId())) {
            if (active.status().terminal() && !incoming.status().terminal()) {
                throw new IllegalTransitionException("Task " + active.taskId() + " is done; done is terminal");
            }
            return;
        }
        if (!active.status().terminal()) {
            throw new IllegalTransitionException("Worker " + workerId + " still holds unfinished task "
                    + active.taskId() + " [" + active.status().wireName() + "]");
        }
    }

    private static Task furthest(Task a, Task b) {
        return a.status().ordinal() >= b.status().ordinal() ? a : b;
    }
}
