package com.mapsheet.collection.monitor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DirectoryWatcher Tests")
class DirectoryWatcherTest {

    private static final long TIMEOUT_SECONDS = 10;

    @TempDir
    Path dropFolder;

    private final BlockingQueue<FileEvent> events = new LinkedBlockingQueue<>();
    private DirectoryWatcher watcher;

    @AfterEach
    void tearDown() {
        if (watcher != null) {
            watcher.close();
        }
    }

    private Set<Path> awaitPaths(int count) throws InterruptedException {
        Set<Path> paths = new HashSet<>();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
        while (paths.size() < count && System.nanoTime() < deadline) {
            FileEvent event = events.poll(200, TimeUnit.MILLISECONDS);
            if (event != null) {
                paths.add(event.path());
            }
        }
        return paths;
    }

    @Test
    @DisplayName("Reports files already present at start")
    void scansExisting() throws Exception {
        Path existing = Files.writeString(dropFolder.resolve("MAHROUS_plan_routes_20250831.kmz"), "kmz");
        Path nested = Files.createDirectories(dropFolder.resolve("20250830"));
        Path nestedFile = Files.writeString(nested.resolve("ALTAIRAT_plan_routes_20250831.kmz"), "kmz");

        watcher = new DirectoryWatcher(dropFolder);
        watcher.start(events::add);

        assertEquals(Set.of(existing, nestedFile), awaitPaths(2));
        assertTrue(watcher.isRunning());
    }

    @Test
    @DisplayName("Skips files present at start when asked to")
    void skipsExisting() throws Exception {
        Files.writeString(dropFolder.resolve("old.kmz"), "kmz");

        watcher = new DirectoryWatcher(dropFolder, false, Clock.systemUTC());
        watcher.start(events::add);

        Path created = Files.writeString(dropFolder.resolve("new.kmz"), "kmz");
        assertEquals(created, events.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS).path());
    }

    @Test
    @DisplayName("Reports files created in new sub-folders")
    void newSubFolder() throws Exception {
        watcher = new DirectoryWatcher(dropFolder, false, Clock.systemUTC());
        watcher.start(events::add);

        Path folder = Files.createDirectories(dropFolder.resolve("20250830"));
        Path file = Files.writeString(folder.resolve("MAHROUS_finished_points_20250830.kmz"), "kmz");

        assertTrue(awaitPaths(1).contains(file));
    }

    @Test
    @DisplayName("Refuses a missing root and a second start")
    void invalidStart() {
        DirectoryWatcher missing = new DirectoryWatcher(dropFolder.resolve("missing"));
        assertThrows(IllegalArgumentException.class, () -> missing.start(events::add));

        watcher = new DirectoryWatcher(dropFolder);
        watcher.start(events::add);
        assertThrows(IllegalStateException.class, () -> watcher.start(events::add));
    }

    @Test
    @DisplayName("Stops after close")
    void closes() throws Exception {
        watcher = new DirectoryWatcher(dropFolder);
        watcher.start(events::add);
        watcher.close();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
        while (watcher.isRunning() && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertFalse(watcher.isRunning());
    }
}
