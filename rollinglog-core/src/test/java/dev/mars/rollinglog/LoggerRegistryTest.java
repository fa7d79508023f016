/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.rollinglog;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LoggerRegistry}: initialisation, duplicate instances and shutdown.
 */
class LoggerRegistryTest {

    @TempDir
    Path tempDir;

    private final LoggerRegistry registry = new LoggerRegistry(status -> fail("unexpected exit " + status));

    @AfterEach
    void tearDown() {
        registry.closeAll();
    }

    private LogConfig.Builder config(String name, String fileName) {
        return LogConfig.builder()
                .instanceName(name)
                .directory(tempDir)
                .fileName(fileName)
                .async(false);
    }

    @Test
    @DisplayName("Init creates the directory and an empty active file")
    void testInit_CreatesFiles() {
        Path dir = tempDir.resolve("nested").resolve("logs");

        RollingLogger logger = registry.init(config("app", "app").directory(dir).build());

        assertTrue(Files.isRegularFile(dir.resolve("app.log")));
        assertEquals("app", logger.name());
        assertFalse(logger.isClosed());
    }

    @Test
    @DisplayName("Invalid config is rejected before anything touches disk")
    void testInit_InvalidConfig() {
        Path dir = tempDir.resolve("never");

        assertThrows(LoggerInitException.class,
                () -> registry.init(config("app", "app").directory(dir).maxFiles(0).build()));

        assertFalse(Files.exists(dir));
        assertTrue(registry.names().isEmpty());
    }

    @Test
    @DisplayName("Unusable directory surfaces as LoggerInitException")
    void testInit_DirectoryIsAFile() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");

        LoggerInitException ex = assertThrows(LoggerInitException.class,
                () -> registry.init(config("app", "app").directory(blocker).build()));

        assertNotNull(ex.getCause());
        assertTrue(registry.get("app").isEmpty());
    }

    // ========================================================================
    // Duplicate instances
    // ========================================================================

    @Nested
    @DisplayName("Duplicate instances")
    class Duplicates {

        @Test
        @DisplayName("Same name and equal config share one instance")
        void testSameConfigShared() throws IOException {
            RollingLogger first = registry.init(config("app", "app").build());
            RollingLogger second = registry.init(config("app", "app").build());

            assertSame(first, second);
            first.info("one");
            second.info("two");
            assertEquals(2, Files.readAllLines(tempDir.resolve("app.log"), StandardCharsets.UTF_8).size());
        }

        @Test
        @DisplayName("Same name with a different config is rejected")
        void testSameNameDifferentConfig() {
            registry.init(config("app", "app").maxFiles(3).build());

            assertThrows(LoggerInitException.class,
                    () -> registry.init(config("app", "app").maxFiles(4).build()));
        }

        @Test
        @DisplayName("A second name for an active file is rejected")
        void testSameFileDifferentName() {
            registry.init(config("a", "shared").build());

            LoggerInitException ex = assertThrows(LoggerInitException.class,
                    () -> registry.init(config("b", "shared.log").build()));
            assertTrue(ex.getMessage().contains("'a'"), ex.getMessage());
            assertEquals(List.of("a"), registry.names());
        }

        @Test
        @DisplayName("Name and file are free again once the instance is closed")
        void testReuseAfterClose() {
            RollingLogger first = registry.init(config("app", "app").build());
            assertTrue(registry.close("app"));

            RollingLogger second = registry.init(config("app", "app").maxFiles(2).build());

            assertNotSame(first, second);
            assertTrue(first.isClosed());
            assertEquals(2, second.config().maxFiles());
        }

        @Test
        @DisplayName("Re-init while the previous instance is still draining waits for it to finish")
        void testReinitWaitsForDrainingInstance() throws Exception {
            int lines = 100_000;
            LogConfig cfg = config("app", "app")
                    .async(true)
                    .queueCapacity(lines)
                    .drainTimeoutMs(30_000)
                    .build();
            RollingLogger first = registry.init(cfg);
            for (int i = 0; i < lines; i++) {
                first.info("line {}", i);
            }

            CompletableFuture<Boolean> closing = CompletableFuture.supplyAsync(() -> registry.close("app"));
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!first.isClosed() && System.nanoTime() < deadline) {
                Thread.sleep(1);
            }
            RollingLogger second = registry.init(cfg);

            // The old writer must be completely done before a new sink opens the file
            assertTrue(first.isTerminated());
            assertNotSame(first, second);
            assertEquals(0, first.stats().queued());
            assertFalse(first.stats().hasLoss());
            assertTrue(closing.get(30, TimeUnit.SECONDS));

            second.info("after");
            assertTrue(second.flush(Duration.ofSeconds(10)));
            List<String> onDisk = Files.readAllLines(tempDir.resolve("app.log"), StandardCharsets.UTF_8);
            assertEquals(lines + 1, onDisk.size());
            assertTrue(onDisk.get(lines).endsWith("] after"));
            assertEquals(List.of("app"), registry.names());
        }

        @Test
        @DisplayName("A logger closed directly no longer blocks its name")
        void testReuseAfterDirectClose() {
            RollingLogger first = registry.init(config("app", "app").build());
            first.close();

            assertTrue(registry.get("app").isEmpty());
            assertNotSame(first, registry.init(config("app", "app").build()));
        }
    }

    // ========================================================================
    // Lookup and shutdown
    // ========================================================================

    @Test
    @DisplayName("Instances are listed in registration order and found by name")
    void testGetAndNames() {
        RollingLogger app = registry.init(config("app", "app").build());
        registry.init(config("access", "access").build());

        assertEquals(List.of("app", "access"), registry.names());
        Optional<RollingLogger> found = registry.get("app");
        assertTrue(found.isPresent());
        assertSame(app, found.get());
        assertTrue(registry.get("missing").isEmpty());
        assertFalse(registry.close("missing"));
    }

    @Test
    @DisplayName("Independent instances write independent files concurrently")
    void testIndependentInstances() throws Exception {
        RollingLogger app = registry.init(config("app", "app").build());
        RollingLogger access = registry.init(config("access", "access").async(true).build());

        CompletableFuture<Void> a = CompletableFuture.runAsync(() -> {
            for (int i = 0; i < 300; i++) {
                app.info("app {}", i);
            }
        });
        CompletableFuture<Void> b = CompletableFuture.runAsync(() -> {
            for (int i = 0; i < 300; i++) {
                access.info("access {}", i);
            }
        });
        CompletableFuture.allOf(a, b).get(30, TimeUnit.SECONDS);
        assertTrue(registry.closeAll());

        List<String> appLines = Files.readAllLines(tempDir.resolve("app.log"), StandardCharsets.UTF_8);
        List<String> accessLines = Files.readAllLines(tempDir.resolve("access.log"), StandardCharsets.UTF_8);
        assertEquals(300, appLines.size());
        assertEquals(300, accessLines.size());
        assertTrue(appLines.stream().allMatch(l -> l.contains("] app ")));
        assertTrue(accessLines.stream().allMatch(l -> l.contains("] access ")));
    }

    @Test
    @DisplayName("Close-all drains async queues and empties the registry")
    void testCloseAll() throws IOException {
        RollingLogger logger = registry.init(config("app", "app").async(true).build());
        for (int i = 0; i < 1000; i++) {
            logger.debug("line {}", i);
        }

        assertTrue(registry.closeAll());

        assertTrue(logger.isClosed());
        assertTrue(registry.names().isEmpty());
        assertEquals(1000, Files.readAllLines(tempDir.resolve("app.log"), StandardCharsets.UTF_8).size());
        assertFalse(logger.stats().hasLoss());
    }

    @Test
    @DisplayName("Shutdown hook registration is idempotent")
    void testShutdownHook() {
        registry.registerShutdownHook();
        registry.registerShutdownHook();
        registry.unregisterShutdownHook();
        registry.unregisterShutdownHook();
    }

    @Test
    @DisplayName("The global registry is a singleton")
    void testGlobal() {
        assertSame(LoggerRegistry.global(), LoggerRegistry.global());
    }
}
