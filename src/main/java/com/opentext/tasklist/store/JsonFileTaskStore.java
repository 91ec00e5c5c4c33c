package com.opentext.tasklist.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.opentext.tasklist.model.CorruptStoreException;
import com.opentext.tasklist.model.StoreWriteException;
import com.opentext.tasklist.model.Task;
import com.opentext.tasklist.model.TaskStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Task store backed by a single JSON file holding an array of task objects.
 * <p>
 * Key properties:
 * - A missing file reads as an empty collection; an unparseable one is reported, never repaired.
 * - Writes go to a temp file in the target directory, are forced to disk, then atomically moved
 *   over the target, so readers only ever see a complete collection.
 * - Output is deterministic: saving an unchanged collection reproduces the same bytes.
 * </p>
 */
@Slf4j
@Repository
public class JsonFileTaskStore implements TaskStore {

    private static final TypeReference<List<Task>> TASK_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper = JsonMapper.builder()
            .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    @Value("${tasks.store.path:data/tasks.json}")
    private String storePath;

    @Value("${tasks.store.pretty-print:true}")
    private boolean prettyPrint = true;

    @Override
    public Path path() {
        return Paths.get(storePath);
    }

    @Override
    public List<Task> load() {
        Path file = path();
        List<Task> tasks;
        try (InputStream in = Files.newInputStream(file)) {
            tasks = mapper.readValue(in, TASK_LIST);
        } catch (NoSuchFileException e) {
            log.debug("Store file {} does not exist yet, treating as empty", file);
            return new ArrayList<>();
        } catch (JsonProcessingException e) {
            log.error("Store file {} is not a valid task list: {}", file, e.getOriginalMessage());
            throw new CorruptStoreException("Cannot parse task store " + file, file, e);
        } catch (IOException e) {
            log.error("Failed to read store file {}", file, e);
            throw new CorruptStoreException("Cannot read task store " + file, file, e);
        }
        if (tasks == null) {
            throw new CorruptStoreException("Task store " + file + " does not contain a task array", file);
        }
        verifyLoaded(file, tasks);
        log.debug("Loaded {} tasks from {}", tasks.size(), file);
        return tasks;
    }

    @Override
    public void save(List<Task> tasks) {
        verifyIds(tasks);
        Path file = path();

        // Serialize before touching the file system so an encoding failure leaves no trace.
        byte[] payload;
        try {
            payload = writer().writeValueAsBytes(tasks);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} tasks for {}", tasks.size(), file, e);
            throw new StoreWriteException("Cannot serialize tasks for " + file, file, e);
        }

        Path dir = file.toAbsolutePath().getParent();
        Path tempPath = null;
        try {
            Files.createDirectories(dir);
            tempPath = Files.createTempFile(dir, file.getFileName() + ".", ".tmp");
            try (FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(payload);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            log.debug("Wrote {} bytes to temp file: {}", payload.length, tempPath);
            Files.move(tempPath, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved {} tasks to {}", tasks.size(), file);
        } catch (IOException e) {
            log.error("Failed to save task store {}", file, e);
            throw new StoreWriteException("Save failed for " + file, file, e);
        } finally {
            if (tempPath != null) {
                try {
                    if (Files.deleteIfExists(tempPath)) {
                        log.debug("Cleaned up temp file: {}", tempPath);
                    }
                } catch (IOException e) {
                    log.warn("Failed to delete temp file {}: {}", tempPath, e.getMessage());
                }
            }
        }
    }

    private ObjectWriter writer() {
        return prettyPrint ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    private void verifyLoaded(Path file, List<Task> tasks) {
        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < tasks.size(); i++) {
            Task task = tasks.get(i);
            if (task == null) {
                throw new CorruptStoreException("Null entry at index " + i + " in " + file, file);
            }
            if (task.getId() <= 0) {
                throw new CorruptStoreException("Non-positive id " + task.getId() + " at index " + i + " in " + file, file);
            }
            if (task.getTitle() == null || task.getTitle().isBlank()) {
                throw new CorruptStoreException("Task " + task.getId() + " has no title in " + file, file);
            }
            if (!seen.add(task.getId())) {
                throw new CorruptStoreException("Duplicate id " + task.getId() + " in " + file, file);
            }
        }
    }

    private static void verifyIds(List<Task> tasks) {
        Set<Long> seen = new HashSet<>();
        for (Task task : tasks) {
            if (task.getId() <= 0) {
                throw new IllegalArgumentException("Task id must be positive, got: " + task.getId());
            }
            if (!seen.add(task.getId())) {
                throw new IllegalArgumentException("Duplicate task id: " + task.getId());
            }
        }
    }
}
