package com.example.lence.pages;

import com.example.lence.error.LenceException;
import com.example.lence.registry.RegistryLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Rebuilds the registry when page files change. Used while authoring; a broken page leaves the previous
 * registry serving until the next successful rebuild.
 */
public class PageWatcher implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(PageWatcher.class);
    private static final long SETTLE_MILLIS = 250;

    private final Path pagesDir;
    private final RegistryLoader loader;
    private WatchService watchService;
    private Thread thread;

    public PageWatcher(Path pagesDir, RegistryLoader loader) {
        this.pagesDir = pagesDir;
        this.loader = loader;
    }

    public synchronized void start() throws IOException {
        if (thread != null) {
            return;
        }
        if (!Files.isDirectory(pagesDir)) {
            LOGGER.warn("Not watching {}: directory does not exist", pagesDir);
            return;
        }
        WatchService service = FileSystems.getDefault().newWatchService();
        registerTree(service, pagesDir);
        watchService = service;
        thread = new Thread(() -> run(service), "lence-page-watcher");
        thread.setDaemon(true);
        thread.start();
        LOGGER.info("Watching {} for page changes", pagesDir);
    }

    private void run(WatchService service) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                WatchKey key = service.take();
                drain(key);
                // editors write in bursts; collect them into one rebuild
                WatchKey more;
                while ((more = service.poll(SETTLE_MILLIS, TimeUnit.MILLISECONDS)) != null) {
                    drain(more);
                }
                try {
                    registerTree(service, pagesDir);
                    loader.reload();
                } catch (LenceException e) {
                    LOGGER.warn("Pages changed but the registry was not rebuilt: {}", e.getDetail());
                } catch (ClosedWatchServiceException e) {
                    throw e;
                } catch (IOException | RuntimeException e) {
                    LOGGER.warn("Pages changed but the registry was not rebuilt; still watching {}", pagesDir, e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            LOGGER.debug("Page watcher closed");
        }
    }

    private void drain(WatchKey key) {
        key.pollEvents();
        key.reset();
    }

    private void registerTree(WatchService service, Path root) throws IOException {
        List<Path> directories;
        try (Stream<Path> stream = Files.walk(root)) {
            directories = stream.filter(Files::isDirectory).collect(Collectors.toList());
        }
        for (Path directory : directories) {
            directory.register(service,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
        }
    }

    @Override
    public synchronized void close() {
        if (thread != null) {
            thread.interrupt();
            thread = null;
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                LOGGER.warn("Error while closing page watcher", e);
            }
            watchService = null;
        }
    }
}
