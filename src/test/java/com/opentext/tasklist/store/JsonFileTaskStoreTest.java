package com.opentext.tasklist.store;

import com.opentext.tasklist.model.CorruptStoreException;
import com.opentext.tasklist.model.StoreWriteException;
import com.opentext.tasklist.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileTaskStoreTest {

    private JsonFileTaskStore store;
    private Path storeFile;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        storeFile = tempDir.resolve("tasks.json");
        store = new JsonFileTaskStore();
        ReflectionTestUtils.setField(store, "storePath", storeFile.toString());
    }

    @Test
    void testLoadMissingFileIsEmpty() {
        List<Task> tasks = store.load();
        assertTrue(tasks.isEmpty());
        assertFalse(Files.exists(storeFile));
    }

    @Test
    void testSaveCreatesMissingDirectories() {
        Path nested = tempDir.resolve("a").resolve("b").resolve("tasks.json");
        ReflectionTestUtils.setField(store, "storePath", nested.toString());

        store.save(List.of(new Task(1, "Buy milk", false)));

        assertTrue(Files.exists(nested));
        assertEquals(1, store.load().size());
    }

    @Test
    void testSaveAndLoadKeepsOrderAndFields() {
        Task first = new Task(3, "Walk dog", true);
        first.setPriority("high");
        first.setCategory("home");
        first.putExtension("dueDate", "2026-11-01");
        Task second = new Task(1, "Buy milk", false);

        store.save(List.of(first, second));
        List<Task> loaded = store.load();

        assertEquals(2, loaded.size());
        assertEquals(first, loaded.get(0));
        assertEquals(second, loaded.get(1));
        assertEquals("2026-11-01", loaded.get(0).getExtensions().get("dueDate"));
    }

    @Test
    void testUnsetOptionalFieldsAreOmitted() throws IOException {
        store.save(List.of(new Task(1, "Buy milk", false)));

        String json = Files.readString(storeFile);
        assertTrue(json.contains("\"title\""));
        assertFalse(json.contains("priority"));
        assertFalse(json.contains("category"));
        assertFalse(json.contains("null"));
    }

    @Test
    void testSaveOfLoadedSetIsByteIdentical() throws IOException {
        String original = """
                [
                  {"id": 2, "title": "Walk dog", "completed": false, "category": "home",
                   "estimate": {"hours": 1.5, "confidence": "low"}, "tags": ["outdoor", "daily"]},
                  {"id": 7, "title": "Buy milk", "completed": true, "priority": "low"}
                ]
                """;
        Files.writeString(storeFile, original, StandardCharsets.UTF_8);

        // First save normalizes formatting; every later save must reproduce it exactly.
        store.save(store.load());
        byte[] normalized = Files.readAllBytes(storeFile);
        store.save(store.load());

        assertArrayEquals(normalized, Files.readAllBytes(storeFile));
        Task walk = store.load().get(0);
        assertEquals(Map.of("hours", 1.5, "confidence", "low"), walk.getExtensions().get("estimate"));
        assertEquals(List.of("outdoor", "daily"), walk.getExtensions().get("tags"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "not json",
            "null",
            "{}",
            "[1, 2]",
            "[null]",
            "[{\"id\": 1, \"title\": \"a\"}] trailing",
            "[{\"id\": \"1\", \"title\": \"a\", \"completed\": false}]",
            "[{\"id\": 1.5, \"title\": \"a\", \"completed\": false}]",
            "[{\"id\": 1, \"title\": \"a\", \"completed\": null}]",
            "[{\"id\": 0, \"title\": \"a\", \"completed\": false}]",
            "[{\"id\": 1, \"title\": \"  \", \"completed\": false}]",
            "[{\"id\": 1, \"completed\": false}]",
            "[{\"id\": 1, \"title\": \"a\"}, {\"id\": 1, \"title\": \"b\"}]"
    })
    void testLoadCorruptContentFails(String content) throws IOException {
        Files.writeString(storeFile, content, StandardCharsets.UTF_8);

        CorruptStoreException e = assertThrows(CorruptStoreException.class, () -> store.load());
        assertEquals(storeFile, e.getPath());
        // never repaired
        assertEquals(content, Files.readString(storeFile));
    }

    @Test
    void testLoadDirectoryInsteadOfFileFails() throws IOException {
        Files.createDirectories(storeFile);
        assertThrows(CorruptStoreException.class, () -> store.load());
    }

    @Test
    void testSaveRejectsDuplicateIds() {
        List<Task> tasks = List.of(new Task(1, "a", false), new Task(1, "b", false));
        assertThrows(IllegalArgumentException.class, () -> store.save(tasks));
        assertFalse(Files.exists(storeFile));
    }

    @Test
    void testSaveRejectsNonPositiveIds() {
        assertThrows(IllegalArgumentException.class, () -> store.save(List.of(new Task(0, "a", false))));
        assertFalse(Files.exists(storeFile));
    }

    @Test
    void testSerializationFailureKeepsPreviousFile() throws IOException {
        store.save(List.of(new Task(1, "Buy milk", false)));
        byte[] before = Files.readAllBytes(storeFile);

        Task broken = new Task(2, "Broken", false);
        broken.putExtension("handle", new Object());
        List<Task> tasks = new ArrayList<>(store.load());
        tasks.add(broken);

        assertThrows(StoreWriteException.class, () -> store.save(tasks));
        assertArrayEquals(before, Files.readAllBytes(storeFile));
        assertNoTempFiles(tempDir);
    }

    @Test
    void testSaveFailsWhenParentIsAFile() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "x");
        Path target = blocker.resolve("tasks.json");
        ReflectionTestUtils.setField(store, "storePath", target.toString());

        StoreWriteException e = assertThrows(StoreWriteException.class,
                () -> store.save(List.of(new Task(1, "a", false))));
        assertEquals(target, e.getPath());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void testFailedMoveLeavesNoTempFile() throws IOException {
        // A non-empty directory at the target path cannot be replaced by a file.
        Files.createDirectories(storeFile);
        Files.writeString(storeFile.resolve("keep"), "x");

        assertThrows(StoreWriteException.class, () -> store.save(List.of(new Task(1, "a", false))));
        assertTrue(Files.isDirectory(storeFile));
        assertNoTempFiles(tempDir);
    }

    @Test
    void testSaveLeavesNoTempFiles() throws IOException {
        store.save(List.of(new Task(1, "a", false)));
        store.save(List.of(new Task(1, "a", true), new Task(2, "b", false)));
        assertNoTempFiles(tempDir);
        assertEquals(2, store.load().size());
    }

    @Test
    void testCompactOutput() throws IOException {
        ReflectionTestUtils.setField(store, "prettyPrint", false);
        store.save(List.of(new Task(1, "Buy milk", false)));

        assertEquals("[{\"id\":1,\"title\":\"Buy milk\",\"completed\":false}]", Files.readString(storeFile));
    }

    private static void assertNoTempFiles(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            long tmpCount = files
                    .filter(p -> p.getFileName().toString().endsWith(".tmp"))
                    .count();
            assertEquals(0, tmpCount);
        }
    }
}
