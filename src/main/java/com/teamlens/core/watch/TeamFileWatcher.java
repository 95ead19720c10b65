package com.teamlens.core.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Watches the teams and tasks roots and emits classified {@link FileChange}s.
 * <p>
 * {@link #start(Consumer)} first enumerates every existing file under both roots and emits
 * one change per recognised file (configs before inboxes before tasks), which is how teams
 * that were already running are discovered. Live notifications are then delivered through a
 * {@link ChangeDebouncer}.
 * <p>
 * {@link WatchService} only reports entries of directories it was registered on, so every
 * directory below the roots is registered individually and new directories are registered
 * as they appear. Files written into a new directory before its registration are picked up
 * by scanning the directory right after registering it.
 */
@Service
public class TeamFileWatcher {

    private static final Logger log = LoggerFactory.getLogger(TeamFileWatcher.class);

    private static final long POLL_INTERVAL_MS = 250;

    private static final Comparator<FileChange> SCAN_ORDER = Comparator
            .comparing((FileChange c) -> c.kind().ordinal())
            .thenComparing(c -> c.path().toString());

    private final WatchProperties properties;
    private final PathClassifier classifier;

    private final Map<WatchKey, Path> watchedDirectories = new ConcurrentHashMap<>();
    private volatile WatchService watchService;
    private volatile ChangeDebouncer debouncer;
    private volatile Thread watchThread;
    private volatile boolean running;

    public TeamFileWatcher(WatchProperties properties) {
        this.properties = properties;
        this.classifier = properties.classifier();
    }

    /**
     * Performs the initial scan synchronously, then starts live watching on a background thread.
     *
     * @param sink receives every classified change, one at a time
     * @throws IllegalStateException if either watched root is missing or unreadable
     */
    public synchronized void start(Consumer<FileChange> sink) {
        if (running) {
            throw new IllegalStateException("Watcher already started");
        }
        Path teamsRoot = requireReadableDirectory(properties.getTeamsRoot(), "teams root");
        Path tasksRoot = requireReadableDirectory(properties.getTasksRoot(), "tasks root");

        try {
            watchService = teamsRoot.getFileSystem().newWatchService();
            // Register before scanning so writes that land during the scan are still reported.
            registerTree(teamsRoot);
            registerTree(tasksRoot);
        } catch (IOException e) {
            closeWatchService();
            throw new IllegalStateException("Failed to register watches under " + teamsRoot + " and " + tasksRoot, e);
        }

        List<FileChange> initial = new ArrayList<>();
        initial.addAll(scan(teamsRoot));
        initial.addAll(scan(tasksRoot));
        initial.sort(SCAN_ORDER);
        log.info("Initial scan found {} team files under {} and {}", initial.size(), teamsRoot, tasksRoot);
        for (FileChange change : initial) {
            sink.accept(change);
        }

        debouncer = new ChangeDebouncer(classifier, properties.getDebounceMillis(), sink);
        running = true;
        watchThread = new Thread(this::watchLoop, "team-file-watcher");
        watchThread.setDaemon(true);
        watchThread.start();
        log.info("Watching {} directories (debounce={}ms)", watchedDirectories.size(), properties.getDebounceMillis());
    }

    /**
     * Stops watching. Pending debounce timers are cancelled and no change is emitted afterwards.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (debouncer != null) {
            debouncer.close();
        }
        closeWatchService();
        Thread thread = watchThread;
        if (thread != null) {
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        watchedDirectories.clear();
        log.info("File watcher stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public int watchedDirectoryCount() {
        return watchedDirectories.size();
    }

    private void watchLoop() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            if (key == null) {
                continue;
            }

            Path dir = watchedDirectories.get(key);
            if (dir != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    handleEvent(dir, event);
                }
            }
            if (!key.reset()) {
                watchedDirectories.remove(key);
                log.debug("Watch on {} is no longer valid", dir);
            }
        }
    }

    private void handleEvent(Path dir, WatchEvent<?> event) {
        if (!running) {
            return;
        }
        if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
            log.warn("Watch event overflow under {}, rescanning", dir);
            notifyAllFiles(dir);
            return;
        }
        Path child = dir.resolve((Path) event.context());
        if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(child)) {
            try {
                registerTree(child);
            } catch (IOException e) {
                log.warn("Failed to watch new directory {}: {}", child, e.getMessage());
            }
            notifyAllFiles(child);
            return;
        }
        debouncer.notifyChanged(child);
    }

    private void notifyAllFiles(Path dir) {
        try (Stream<Path> files = Files.walk(dir)) {
            files.filter(Files::isRegularFile).forEach(debouncer::notifyChanged);
        } catch (IOException | UncheckedIOException e) {
            log.debug("Could not rescan {}: {}", dir, e.getMessage());
        }
    }

    private void registerTree(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                WatchKey key = dir.register(watchService,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_DELETE);
                watchedDirectories.put(key, dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private List<FileChange> scan(Path root) {
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .map(classifier::classify)
                    .filter(FileChange::isRelevant)
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new IllegalStateException("Failed to scan " + root, e);
        }
    }

    private void closeWatchService() {
        WatchService service = watchService;
        if (service == null) {
            return;
        }
        try {
            service.close();
        } catch (IOException e) {
            log.debug("Error closing watch service: {}", e.getMessage());
        }
    }

    private static Path requireReadableDirectory(Path path, String label) {
        if (path == null) {
            throw new IllegalStateException("No " + label + " configured");
        }
        Path absolute = path.toAbsolutePath().normalize();
        if (!Files.isDirectory(absolute) || !Files.isReadable(absolute)) {
            throw new IllegalStateException("Watched " + label + " is not a readable directory: " + absolute);
        }
        return absolute;
    }
}
