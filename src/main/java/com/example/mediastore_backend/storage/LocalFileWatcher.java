package com.example.mediastore_backend.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Watches local directories with a {@link WatchService} on its own daemon thread and reports
 * file events to a {@link WatchEvents} listener. Closing stops the thread.
 */
class LocalFileWatcher implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileWatcher.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final WatchService watchService;
    private final WatchOptions options;
    private final WatchEvents events;
    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
    private final Thread thread;
    private volatile boolean closed;

    private LocalFileWatcher(WatchService watchService, WatchOptions options, WatchEvents events) {
        this.watchService = watchService;
        this.options = options;
        this.events = events;
        this.thread = new Thread(this::run, "storage-watch-" + THREAD_COUNTER.incrementAndGet());
        this.thread.setDaemon(true);
    }

    static LocalFileWatcher start(List<Path> roots, WatchOptions options, WatchEvents events) throws IOException {
        WatchService service = FileSystems.getDefault().newWatchService();
        LocalFileWatcher watcher = new LocalFileWatcher(service, options, events);
        try {
            for (Path root : roots) {
                watcher.register(root, !options.ignoreInitial());
            }
        } catch (IOException e) {
            service.close();
            throw e;
        }
        watcher.thread.start();
        return watcher;
    }

    private void register(Path dir, boolean reportFiles) throws IOException {
        if (!options.recursive()) {
            keys.put(dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE), dir);
            if (reportFiles) {
                try (Stream<Path> children = Files.list(dir)) {
                    children.filter(Files::isRegularFile).forEach(p -> events.onAdd(p.toString()));
                }
            }
            return;
        }
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) throws IOException {
                keys.put(d.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE), d);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (reportFiles && attrs.isRegularFile()) {
                    events.onAdd(file.toString());
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void run() {
        events.onReady();
        while (!closed) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            Path dir = keys.get(key);
            if (dir != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    dispatch(dir, event);
                }
            }
            if (!key.reset()) {
                keys.remove(key);
            }
        }
    }

    private void dispatch(Path dir, WatchEvent<?> event) {
        if (event.kind() == OVERFLOW) {
            LOGGER.warn("WATCH OVERFLOW dir={} events were lost", dir);
            return;
        }
        Path child = dir.resolve((Path) event.context());
        try {
            if (event.kind() == ENTRY_CREATE) {
                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                    if (options.recursive()) {
                        // files may land before the new directory is registered
                        register(child, true);
                    }
                } else {
                    events.onAdd(child.toString());
                }
            } else if (event.kind() == ENTRY_MODIFY) {
                if (!Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                    events.onChange(child.toString());
                }
            } else if (event.kind() == ENTRY_DELETE) {
                events.onUnlink(child.toString());
            }
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("WATCH ERROR path={} kind={} error={}", child, event.kind().name(), e.toString());
            events.onError(e);
        }
    }

    @Override
    public void close() throws IOException {
        closed = true;
        watchService.close();
        thread.interrupt();
    }
}
