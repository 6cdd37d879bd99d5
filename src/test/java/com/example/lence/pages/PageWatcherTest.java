package com.example.lence.pages;

import com.example.lence.registry.QueryRegistry;
import com.example.lence.registry.RegistryLoader;
import com.example.lence.registry.RegistrySnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertTrue;

class PageWatcherTest {

    @TempDir
    Path tempDir;

    @Test
    void keepsWatchingAfterAFailedRebuild() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch firstAttempt = new CountDownLatch(1);
        CountDownLatch rebuilt = new CountDownLatch(1);
        QueryRegistry registry = new QueryRegistry();
        RegistryLoader loader = new RegistryLoader(new PageScanner(tempDir), new QueryBlockParser(), registry) {
            @Override
            public synchronized RegistrySnapshot reload() {
                if (attempts.incrementAndGet() == 1) {
                    firstAttempt.countDown();
                    throw new UncheckedIOException(new NoSuchFileException("sales.md~"));
                }
                RegistrySnapshot snapshot = super.reload();
                if (getRegistry().get("/sales", "top").isPresent()) {
                    rebuilt.countDown();
                }
                return snapshot;
            }
        };

        try (PageWatcher watcher = new PageWatcher(tempDir, loader)) {
            watcher.start();
            Files.writeString(tempDir.resolve("draft.md"), "# Draft\n");
            assertTrue(firstAttempt.await(10, TimeUnit.SECONDS), "first change should trigger a rebuild");

            Files.writeString(tempDir.resolve("sales.md"),
                    "{% query name=\"top\" source=\"orders\" %}SELECT 1{% /query %}\n");
            assertTrue(rebuilt.await(10, TimeUnit.SECONDS), "watcher should survive the failed rebuild");
        }
        assertTrue(registry.get("/sales", "top").isPresent());
    }
}
