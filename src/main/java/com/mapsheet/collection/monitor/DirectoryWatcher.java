package com.mapsheet.collection.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * {@link FileEventSource} over a directory tree, built on {@link WatchService}.
 *
 * <p>Every sub-folder is watched, including folders created later; files already inside a new
 * folder when it is registered are reported too. With {@code scanExisting}, files present at
 * start are reported before watching begins.</p>
 */
public class DirectoryWatcher implements FileEventSource {
    private static final Logger log = LoggerFactory.getLogger(DirectoryWatcher.class);

    private final Path root;
    private final boolean scanExisting;
    private final Clock clock;
    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
    private volatile WatchService watchService;
    private volatile boolean closed;
    private Thread thread;

    public DirectoryWatcher(Path root) {
        this(root, true, Clock.systemDefaultZone());
    }

    public DirectoryWatcher(Path root, boolean scanExisting, Clock clock) {
        this.root = Objects.requireNonNull(root, "root is required");
        this.scanExisting = scanExisting;
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public synchronized void start(Consumer<FileEvent> sink) {
        Objects.requireNonNull(sink, "sink must not be null");
        if (thread != null) {
            throw new IllegalStateException("DirectoryWatcher already started");
        }
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Watched root is not a directory: " + root);
        }
        try {
            watchService = root.getFileSystem().newWatchService();
            registerTree(root, sink, scanExisting);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot watch " + root, e);
        }
        thread = new Thread(() -> dispatch(sink), "directory-watcher");
        thread.setDaemon(true);
        thread.start();
        log.info("watcher.started root={} folders={} scanExisting={}", root, keys.size(), scanExisting);
    }

    private void dispatch(Consumer<FileEvent> sink) {
        while (!closed) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (ClosedWatchServiceException e) {
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            Path folder = keys.get(key);
            if (folder != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    handle(folder, event, sink);
                }
            }
            if (!key.reset()) {
                keys.remove(key);
            }
        }
        log.debug("watcher.stopped root={}", root);
    }

    private void handle(Path folder, WatchEvent<?> event, Consumer<FileEvent> sink) {
        if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
            log.warn("watcher.overflow folder={} events may have been lost", folder);
            return;
        }
        Path child = folder.resolve((Path) event.context());
        try {
            if (Files.isDirectory(child)) {
                registerTree(child, sink, true);
            } else if (Files.isRegularFile(child)) {
                sink.accept(new FileEvent(child, clock.instant()));
            }
        } catch (IOException | UncheckedIOException e) {
            log.warn("watcher.register_failed path={} error={}", child, e.getMessage());
        }
    }

    private void registerTree(Path start, Consumer<FileEvent> sink, boolean emitFiles) throws IOException {
        try (Stream<Path> paths = Files.walk(start)) {
            for (Path path : (Iterable<Path>) paths::iterator) {
                if (Files.isDirectory(path)) {
                    WatchKey key = path.register(watchService, StandardWatchEventKinds.ENTRY_CREATE);
                    keys.put(key, path);
                } else if (emitFiles && Files.isRegularFile(path)) {
                    sink.accept(new FileEvent(path, clock.instant()));
                }
            }
        }
    }

    public boolean isRunning() {
        return thread != null && thread.isAlive();
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("watcher.close_failed root={} error={}", root, e.getMessage());
            }
        }
        if (thread != null) {
            thread.interrupt();
        }
    }
}
