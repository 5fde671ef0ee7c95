package org.docstore.sync;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class VaultWatcherTest {

    @TempDir
    Path root;

    private final Set<Path> changed = ConcurrentHashMap.newKeySet();
    private final Set<Path> deleted = ConcurrentHashMap.newKeySet();

    private final VaultWatcher.Listener listener = new VaultWatcher.Listener() {
        @Override
        public void onFileChanged(Path file) {
            changed.add(file);
        }

        @Override
        public void onFileDeleted(Path file) {
            deleted.add(file);
        }

        @Override
        public void onOverflow() {
        }
    };

    @Test
    void registersNonHiddenDirectories() throws IOException {
        Files.createDirectories(root.resolve("u/v/notes"));
        Files.createDirectories(root.resolve("u/v/.obsidian/plugins"));

        try (VaultWatcher watcher = new VaultWatcher(root, listener)) {
            // root, u, u/v, u/v/notes
            assertEquals(4, watcher.registeredDirectories());
            assertTrue(watcher.isDaemon());
        }
    }

    @Test
    void reportsChangesDeletesAndNewDirectories() throws Exception {
        Files.createDirectories(root.resolve("u/v"));
        try (VaultWatcher watcher = new VaultWatcher(root, listener)) {
            watcher.start();

            Path file = root.resolve("u/v/a.md");
            Files.writeString(file, "a");
            await(() -> changed.contains(file));

            Files.delete(file);
            await(() -> deleted.contains(file));

            Path nested = root.resolve("u/v/new/deeper");
            Files.createDirectories(nested);
            Path inNew = nested.resolve("b.md");
            Files.writeString(inNew, "b");
            await(() -> changed.contains(inNew));
        }
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 15_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within 15s");
            }
            Thread.sleep(50);
        }
    }
}
