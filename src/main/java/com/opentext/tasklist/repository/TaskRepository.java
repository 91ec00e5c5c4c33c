package com.opentext.tasklist.repository;

import com.opentext.tasklist.model.Task;
import com.opentext.tasklist.model.TaskNotFoundException;
import com.opentext.tasklist.model.TaskPatch;
import com.opentext.tasklist.model.TaskStore;
import com.opentext.tasklist.model.TaskValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * CRUD operations over a {@link TaskStore}.
 * <p>
 * Every call re-reads the whole collection; nothing is cached between calls. Mutating calls
 * (create, update, delete) hold a single process-wide lock across load, mutate and save so two
 * of them can never interleave. Reads take no lock and rely on the store's atomic writes.
 * Store failures are propagated as-is.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskRepository {

    private final TaskStore store;
    private final ReentrantLock mutationLock = new ReentrantLock();

    /** @return all tasks in persisted order */
    public List<Task> list() {
        return store.load();
    }

    public Optional<Task> findById(long id) {
        return store.load().stream()
                .filter(task -> task.getId() == id)
                .findFirst();
    }

    /**
     * Append a new task with the next free id (highest existing id plus one, or 1).
     * {@code completed} defaults to false unless supplied.
     * @throws TaskValidationException if the title is missing or blank
     */
    public Task create(TaskPatch fields) {
        if (fields == null) {
            throw new TaskValidationException("Task fields are required");
        }
        String title = requireTitle(fields.getTitle());
        checkExtensions(fields.getExtensions());

        mutationLock.lock();
        try {
            List<Task> tasks = new ArrayList<>(store.load());
            long nextId = tasks.stream().mapToLong(Task::getId).max().orElse(0L) + 1;

            Task task = new Task(nextId, title, Boolean.TRUE.equals(fields.getCompleted()));
            task.setPriority(fields.getPriority());
            task.setCategory(fields.getCategory());
            fields.getExtensions().forEach(task::putExtension);

            tasks.add(task);
            store.save(tasks);
            log.info("Created task: {}", nextId);
            return task;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Merge the supplied fields into the task with the given id. Fields left {@code null} in the
     * patch are not touched. Nothing is written when the id does not exist.
     * @throws TaskNotFoundException if no task has the given id
     * @throws TaskValidationException if a supplied title is blank
     */
    public Task update(long id, TaskPatch fields) {
        if (fields == null) {
            throw new TaskValidationException("Task fields are required");
        }
        String title = fields.getTitle() != null ? requireTitle(fields.getTitle()) : null;
        checkExtensions(fields.getExtensions());

        mutationLock.lock();
        try {
            List<Task> tasks = store.load();
            Task task = tasks.stream()
                    .filter(t -> t.getId() == id)
                    .findFirst()
                    .orElseThrow(() -> new TaskNotFoundException(id));

            if (title != null) {
                task.setTitle(title);
            }
            if (fields.getCompleted() != null) {
                task.setCompleted(fields.getCompleted());
            }
            if (fields.getPriority() != null) {
                task.setPriority(fields.getPriority());
            }
            if (fields.getCategory() != null) {
                task.setCategory(fields.getCategory());
            }
            fields.getExtensions().forEach(task::putExtension);

            store.save(tasks);
            log.info("Updated task: {}", id);
            return task;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Remove the task with the given id. Remaining ids are not renumbered.
     * @return true if a task was removed, false if none had that id
     */
    public boolean delete(long id) {
        mutationLock.lock();
        try {
            List<Task> tasks = store.load();
            List<Task> remaining = tasks.stream()
                    .filter(t -> t.getId() != id)
                    .collect(Collectors.toList());
            if (remaining.size() == tasks.size()) {
                log.debug("Delete found no task with id: {}", id);
                return false;
            }
            store.save(remaining);
            log.info("Deleted task: {}", id);
            return true;
        } finally {
            mutationLock.unlock();
        }
    }

    private static String requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new TaskValidationException("Task title must not be empty");
        }
        return title.trim();
    }

    private static void checkExtensions(Map<String, Object> extensions) {
        for (String name : extensions.keySet()) {
            if (name == null || name.isEmpty() || Task.RESERVED_FIELDS.contains(name)) {
                throw new TaskValidationException("Invalid extension field name: " + name);
            }
        }
    }
}
