package org.docstore.service;

import org.docstore.DTO.FileEntry;
import org.docstore.DTO.PathType;
import org.docstore.config.DocStoreProperties;
import org.docstore.exception.ConflictException;
import org.docstore.exception.NotFoundException;
import org.docstore.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileStorageServiceTest {

    @TempDir
    Path dataDir;

    private FileStorageService storage;
    private Path root;

    @BeforeEach
    void setUp() throws IOException {
        DocStoreProperties properties = new DocStoreProperties();
        properties.setDataDir(dataDir.toString());
        storage = new FileStorageService(properties);
        root = storage.ensureVaultDir(UUID.randomUUID(), "personal");
    }

    @Test
    void vaultPathIsUserThenSlug() {
        UUID userId = UUID.randomUUID();
        assertEquals(dataDir.toAbsolutePath().normalize().resolve(userId.toString()).resolve("work"),
                storage.vaultPath(userId, "work"));
    }

    @Test
    void writeThenReadRoundTrip() throws IOException {
        storage.write(root, "notes/todo.md", "- [ ] buy milk\n");
        assertEquals("- [ ] buy milk\n", storage.read(root, "notes/todo.md"));
        assertTrue(Files.isDirectory(root.resolve("notes")));
    }

    @Test
    void roundTripsEmptyAndLargeUtf8Content() throws IOException {
        storage.write(root, "empty.md", "");
        assertEquals("", storage.read(root, "empty.md"));

        StringBuilder sb = new StringBuilder();
        while (sb.length() < 3 * 1024 * 1024) {
            sb.append("日本語のテキスト and ascii ✓ ").append(sb.length()).append('\n');
        }
        String large = sb.toString();
        storage.write(root, "large.md", large);
        assertEquals(large, storage.read(root, "large.md"));
        assertEquals(large.getBytes(StandardCharsets.UTF_8).length, Files.size(root.resolve("large.md")));
    }

    @Test
    void overwriteLeavesNoTempFiles() throws IOException {
        storage.write(root, "a.md", "one");
        storage.write(root, "a.md", "two");
        assertEquals("two", storage.read(root, "a.md"));
        try (Stream<Path> files = Files.list(root)) {
            List<String> names = files.map(p -> p.getFileName().toString()).collect(Collectors.toList());
            assertEquals(List.of("a.md"), names);
        }
    }

    @Test
    void rejectsInvalidPathsBeforeTouchingDisk() {
        assertThrows(ValidationException.class, () -> storage.write(root, "../escape.md", "x"));
        assertThrows(ValidationException.class, () -> storage.write(root, "notes/a.txt", "x"));
        assertFalse(Files.exists(root.resolve("notes")));
    }

    @Test
    void readMissingFileIsNotFound() {
        assertThrows(NotFoundException.class, () -> storage.read(root, "missing.md"));
        assertThrows(NotFoundException.class, () -> storage.delete(root, "missing.md"));
    }

    @Test
    void deleteRemovesEmptyAncestorsOnly() throws IOException {
        storage.write(root, "a/b/c.md", "c");
        storage.delete(root, "a/b/c.md");
        assertFalse(Files.exists(root.resolve("a")));
        assertTrue(Files.isDirectory(root));

        storage.write(root, "a/b/c.md", "c");
        storage.write(root, "a/keep.md", "k");
        storage.delete(root, "a/b/c.md");
        assertFalse(Files.exists(root.resolve("a/b")));
        assertTrue(Files.exists(root.resolve("a/keep.md")));
    }

    @Test
    void deleteDirectoryRemovesTree() throws IOException {
        storage.write(root, "projects/x/one.md", "1");
        storage.write(root, "projects/two.md", "2");
        storage.deleteDirectory(root, "projects");
        assertFalse(Files.exists(root.resolve("projects")));
        assertThrows(ValidationException.class, () -> storage.deleteDirectory(root, ""));
        assertThrows(NotFoundException.class, () -> storage.deleteDirectory(root, "nope"));
    }

    @Test
    void listSkipsHiddenEntriesAndRecurses() throws IOException {
        storage.write(root, "notes/a.md", "a");
        storage.write(root, "notes/deep/b.md", "bb");
        storage.write(root, "c.md", "ccc");
        Files.createDirectories(root.resolve(".obsidian"));
        Files.writeString(root.resolve(".obsidian/workspace.json"), "{}");
        Files.writeString(root.resolve("notes/.hidden.md"), "h");

        List<String> paths = storage.list(root, "").stream().map(FileEntry::getPath).collect(Collectors.toList());
        assertEquals(List.of("c.md", "notes", "notes/a.md", "notes/deep", "notes/deep/b.md"), paths);

        List<FileEntry> underNotes = storage.list(root, "notes");
        assertEquals(3, underNotes.size());
        FileEntry b = underNotes.stream().filter(e -> e.getName().equals("b.md")).findFirst().orElseThrow();
        assertFalse(b.isDirectory());
        assertEquals(2L, b.getSize());

        assertTrue(storage.list(root, "missing").isEmpty());
        assertEquals(List.of("c.md", "notes/a.md", "notes/deep/b.md"), storage.listMarkdownFiles(root));
    }

    @Test
    void pathExistsReportsType() throws IOException {
        storage.write(root, "notes/a.md", "a");
        assertEquals(PathType.FILE, storage.pathExists(root, "notes/a.md"));
        assertEquals(PathType.DIRECTORY, storage.pathExists(root, "notes"));
        assertEquals(PathType.ABSENT, storage.pathExists(root, "nothing"));
    }

    @Test
    void moveFileHonoursOverwriteFlag() throws IOException {
        storage.write(root, "inbox/a.md", "a");
        storage.write(root, "b.md", "b");

        assertThrows(ConflictException.class, () -> storage.move(root, "inbox/a.md", "b.md", false));
        assertEquals(PathType.FILE, storage.move(root, "inbox/a.md", "b.md", true));
        assertEquals("a", storage.read(root, "b.md"));
        // 源目录变空后被清理
        assertFalse(Files.exists(root.resolve("inbox")));
    }

    @Test
    void moveRejectsBadEndpoints() throws IOException {
        storage.write(root, "dir/a.md", "a");
        assertThrows(NotFoundException.class, () -> storage.move(root, "nope.md", "x.md", false));
        assertThrows(ValidationException.class, () -> storage.move(root, "dir/a.md", "dir/a.txt", false));
        assertThrows(ValidationException.class, () -> storage.move(root, "dir", "dir/sub", false));
    }

    @Test
    void moveDirectoryCreatesParents() throws IOException {
        storage.write(root, "old/x.md", "x");
        assertEquals(PathType.DIRECTORY, storage.move(root, "old", "archive/2024/old", false));
        assertEquals("x", storage.read(root, "archive/2024/old/x.md"));
        assertFalse(Files.exists(root.resolve("old")));
    }

    @Test
    void copyDirectoryKeepsSymlinksAsLinks() throws IOException {
        storage.write(root, "src/a.md", "a");
        Path outside = Files.writeString(dataDir.resolve("outside.txt"), "secret");
        try {
            Files.createSymbolicLink(root.resolve("src/link.md"), outside);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported");
        }

        assertEquals(PathType.DIRECTORY, storage.copy(root, "src", "dst", false));
        assertEquals("a", storage.read(root, "dst/a.md"));
        assertTrue(Files.isSymbolicLink(root.resolve("dst/link.md")));
        assertEquals("a", storage.read(root, "src/a.md"));
    }

    @Test
    void hashAndSizeUseUtf8Bytes() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", storage.hash(""));
        assertEquals(64, storage.hash("- [ ] buy milk\n").length());
        assertEquals(15, storage.sizeOf("- [ ] buy milk\n"));
        assertEquals(3, storage.sizeOf("日"));
    }

    @Test
    void deleteVaultDirToleratesMissingDirectory() throws IOException {
        UUID userId = UUID.randomUUID();
        storage.deleteVaultDir(userId, "never-created");
        Path vault = storage.ensureVaultDir(userId, "temp");
        storage.write(vault, "x/y.md", "y");
        storage.deleteVaultDir(userId, "temp");
        assertFalse(Files.exists(vault));
    }
}
