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
package dev.mars.rollinglog.demo;

import dev.mars.rollinglog.LogConfig;
import dev.mars.rollinglog.LoggerRegistry;
import dev.mars.rollinglog.RollingLogger;
import dev.mars.rollinglog.sink.WriterStats;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stress harness for rotation under concurrent load.
 * <p>
 * Every scenario writes through a real {@link LoggerRegistry} into a scratch
 * directory and then checks the files on disk:
 * <ul>
 *   <li>Writer storm: no torn or interleaved lines while files rotate</li>
 *   <li>Retention: never more than {@code maxFiles} backups</li>
 *   <li>Lossless sync mode: every line present exactly once</li>
 *   <li>Async overflow: written plus dropped accounts for every line</li>
 *   <li>Restart: reopening appends to the existing active file</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build
 * mvn package -pl rollinglog-demo -am
 *
 * # Run all scenarios
 * java -cp rollinglog-demo/target/rollinglog-demo-1.0-SNAPSHOT.jar dev.mars.rollinglog.demo.RotationStress
 *
 * # Run one scenario
 * java -cp rollinglog-demo/target/rollinglog-demo-1.0-SNAPSHOT.jar dev.mars.rollinglog.demo.RotationStress storm
 * java -cp rollinglog-demo/target/rollinglog-demo-1.0-SNAPSHOT.jar dev.mars.rollinglog.demo.RotationStress async
 * </pre>
 *
 * @see RollingLogger
 */
public class RotationStress {

    private static final Pattern LINE = Pattern.compile(
            "\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}\\.\\d{3} \\[(debug|info |warn |error)]\\[\\d{4}] "
                    + "(T\\d+-N\\d+)-x*");

    private final Path baseDir;
    private final AtomicInteger testsPassed = new AtomicInteger(0);
    private final AtomicInteger testsFailed = new AtomicInteger(0);

    public RotationStress(Path baseDir) {
        this.baseDir = baseDir;
    }

    public static void main(String[] args) throws Exception {
        System.out.println("╔═══════════════════════════════════════════════════════════════╗");
        System.out.println("║              ROTATION STRESS SUITE                            ║");
        System.out.println("╚═══════════════════════════════════════════════════════════════╝");
        System.out.println();

        Path stressDir = Files.createTempDirectory("rollinglog-stress-");
        System.out.println("Stress directory: " + stressDir.toAbsolutePath());
        System.out.println();

        RotationStress stress = new RotationStress(stressDir);

        String filter = args.length > 0 ? args[0].toLowerCase() : "all";

        try {
            switch (filter) {
                case "storm" -> stress.runStormTests();
                case "async" -> stress.runAsyncTests();
                case "restart" -> stress.runRestartTests();
                case "all" -> {
                    stress.runStormTests();
                    stress.runAsyncTests();
                    stress.runRestartTests();
                }
                default -> {
                    System.err.println("Unknown scenario: " + filter);
                    System.err.println("Available: storm, async, restart, all");
                    System.exit(1);
                }
            }
        } finally {
            System.out.println();
            System.out.println("╔═══════════════════════════════════════════════════════════════╗");
            System.out.printf("║  RESULTS: %d passed, %d failed                                 ║%n",
                    stress.testsPassed.get(), stress.testsFailed.get());
            System.out.println("╚═══════════════════════════════════════════════════════════════╝");

            deleteRecursively(stressDir);
        }

        System.exit(stress.testsFailed.get() > 0 ? 1 : 0);
    }

    // =========================================================================
    // WRITER STORMS
    // =========================================================================

    private void runStormTests() {
        printSection("WRITER STORMS");

        stressTest("Sync storm with retention (16 threads × 2000 lines, 3 backups)", this::syncStormWithRetention);
        stressTest("Sync storm, nothing evicted (8 threads × 1000 lines)", this::syncStormLossless);
        stressTest("Two instances side by side", this::twoInstances);
    }

    private void syncStormWithRetention() throws Exception {
        Path dir = createTestDir("retention");
        LoggerRegistry registry = newRegistry();
        RollingLogger logger = registry.init(config(dir, "storm")
                .maxFileSize(32 * 1024)
                .maxFiles(3)
                .async(false)
                .build());

        storm(logger, 16, 2000);
        registry.closeAll();

        List<Path> files = logFiles(dir);
        if (files.size() > 4) {
            throw new AssertionError("Retention exceeded: " + files);
        }
        for (Path file : files) {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                checkLine(line);
            }
        }
    }

    private void syncStormLossless() throws Exception {
        Path dir = createTestDir("lossless");
        LoggerRegistry registry = newRegistry();
        RollingLogger logger = registry.init(config(dir, "lossless")
                .maxFileSize(16 * 1024)
                .maxFiles(10_000)
                .async(false)
                .build());

        int threads = 8;
        int perThread = 1000;
        storm(logger, threads, perThread);
        registry.closeAll();

        Set<String> ids = new HashSet<>();
        int total = 0;
        for (Path file : logFiles(dir)) {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                ids.add(checkLine(line));
                total++;
            }
        }
        if (total != threads * perThread || ids.size() != total) {
            throw new AssertionError("Expected " + threads * perThread + " unique lines, got "
                    + total + " lines / " + ids.size() + " unique");
        }
    }

    private void twoInstances() throws Exception {
        Path dir = createTestDir("two");
        LoggerRegistry registry = newRegistry();
        RollingLogger a = registry.init(config(dir, "a").instanceName("a").maxFileSize(8 * 1024).async(false).build());
        RollingLogger b = registry.init(config(dir, "b").instanceName("b").maxFileSize(8 * 1024).build());

        ExecutorService executor = Executors.newFixedThreadPool(2);
        executor.submit(() -> writeLines(a, 0, 3000));
        executor.submit(() -> writeLines(b, 1, 3000));
        executor.shutdown();
        if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
            throw new AssertionError("Writers did not finish");
        }
        if (!registry.closeAll()) {
            throw new AssertionError("Instance b lost lines on shutdown");
        }

        for (Path file : logFiles(dir)) {
            String expected = file.getFileName().toString().startsWith("a") ? "T0-" : "T1-";
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (!checkLine(line).startsWith(expected)) {
                    throw new AssertionError("Line in wrong file " + file.getFileName() + ": " + line);
                }
            }
        }
    }

    // =========================================================================
    // ASYNC OVERFLOW
    // =========================================================================

    private void runAsyncTests() {
        printSection("ASYNC OVERFLOW");

        stressTest("Tiny queue under storm: written + dropped = produced", this::asyncAccounting);
        stressTest("Block-with-timeout queue: nothing dropped", this::asyncBlocking);
    }

    private void asyncAccounting() throws Exception {
        Path dir = createTestDir("async-drop");
        LoggerRegistry registry = newRegistry();
        RollingLogger logger = registry.init(config(dir, "async")
                .maxFileSize(64 * 1024)
                .maxFiles(10_000)
                .queueCapacity(16)
                .build());

        int threads = 8;
        int perThread = 2000;
        storm(logger, threads, perThread);
        registry.closeAll();

        WriterStats stats = logger.stats();
        long produced = (long) threads * perThread;
        long accounted = stats.linesWritten() + stats.droppedOnOverflow() + stats.lostOnShutdown()
                + stats.writeFailures();
        if (accounted != produced) {
            throw new AssertionError("Produced " + produced + " but accounted for " + accounted + ": " + stats);
        }
        long onDisk = 0;
        for (Path file : logFiles(dir)) {
            onDisk += Files.readAllLines(file, StandardCharsets.UTF_8).size();
        }
        if (onDisk != stats.linesWritten()) {
            throw new AssertionError("Counted " + stats.linesWritten() + " writes, found " + onDisk + " lines");
        }
        System.out.printf("(dropped %d) ", stats.droppedOnOverflow());
    }

    private void asyncBlocking() throws Exception {
        Path dir = createTestDir("async-block");
        LoggerRegistry registry = newRegistry();
        RollingLogger logger = registry.init(config(dir, "async")
                .maxFileSize(64 * 1024)
                .maxFiles(10_000)
                .queueCapacity(16)
                .offerTimeoutMs(10_000)
                .build());

        storm(logger, 8, 1000);
        registry.closeAll();

        WriterStats stats = logger.stats();
        if (stats.hasLoss() || stats.linesWritten() != 8000) {
            throw new AssertionError("Expected a lossless run: " + stats);
        }
    }

    // =========================================================================
    // RESTART
    // =========================================================================

    private void runRestartTests() {
        printSection("RESTART");

        stressTest("Reopen appends to the active file", this::reopenAppends);
        stressTest("Rapid open/close cycles keep rotating", this::rapidCycles);
    }

    private void reopenAppends() throws Exception {
        Path dir = createTestDir("reopen");
        LogConfig config = config(dir, "app").async(false).build();

        LoggerRegistry registry = newRegistry();
        writeLines(registry.init(config), 0, 10);
        registry.closeAll();
        long sizeAfterFirst = Files.size(dir.resolve("app.log"));

        writeLines(registry.init(config), 1, 10);
        registry.closeAll();

        List<String> lines = Files.readAllLines(dir.resolve("app.log"), StandardCharsets.UTF_8);
        if (lines.size() != 20 || Files.size(dir.resolve("app.log")) <= sizeAfterFirst) {
            throw new AssertionError("Expected 20 appended lines, got " + lines.size());
        }
    }

    private void rapidCycles() throws Exception {
        Path dir = createTestDir("cycles");
        LogConfig config = config(dir, "cycle").maxFileSize(512).maxFiles(2).build();
        LoggerRegistry registry = newRegistry();

        for (int cycle = 0; cycle < 50; cycle++) {
            writeLines(registry.init(config), cycle, 20);
            if (!registry.closeAll()) {
                throw new AssertionError("Cycle " + cycle + " lost lines");
            }
        }
        List<Path> files = logFiles(dir);
        if (files.size() != 3) {
            throw new AssertionError("Expected active file + 2 backups, got " + files);
        }
    }

    // =========================================================================
    // UTILITIES
    // =========================================================================

    private static LoggerRegistry newRegistry() {
        return new LoggerRegistry(status -> {
            throw new AssertionError("fatal called with status " + status);
        });
    }

    private static LogConfig.Builder config(Path dir, String fileName) {
        return LogConfig.builder()
                .instanceName(fileName)
                .directory(dir)
                .fileName(fileName);
    }

    private static void storm(RollingLogger logger, int threads, int perThread) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threads);
        AtomicInteger errorCount = new AtomicInteger(0);

        for (int t = 0; t < threads; t++) {
            final int threadId = t;
            executor.submit(() -> {
                try {
                    startLatch.await(); // All threads start together
                    writeLines(logger, threadId, perThread);
                } catch (Exception e) {
                    errorCount.incrementAndGet();
                    System.err.println("    Writer " + threadId + " failed: " + e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown(); // GO!
        boolean finished = doneLatch.await(120, TimeUnit.SECONDS);
        executor.shutdown();
        if (!finished || errorCount.get() > 0) {
            throw new AssertionError("Storm incomplete: finished=" + finished + ", errors=" + errorCount.get());
        }
    }

    private static void writeLines(RollingLogger logger, int threadId, int count) {
        for (int i = 0; i < count; i++) {
            // Variable padding so lines straddle the rotation threshold at different offsets
            logger.info("T{}-N{}-{}", threadId, i, "x".repeat(i % 61));
        }
    }

    /** Returns the line's id after checking it is whole and well formed. */
    private static String checkLine(String line) {
        Matcher m = LINE.matcher(line);
        if (!m.matches()) {
            throw new AssertionError("Torn or malformed line: " + line);
        }
        return m.group(2);
    }

    private static List<Path> logFiles(Path dir) throws IOException {
        List<Path> files = new ArrayList<>();
        try (Stream<Path> stream = Files.list(dir)) {
            stream.filter(p -> p.getFileName().toString().endsWith(".log")).sorted().forEach(files::add);
        }
        return files;
    }

    private static void printSection(String name) {
        System.out.println();
        System.out.println("┌───────────────────────────────────────────────────────────────┐");
        System.out.printf("│  %-61s │%n", name);
        System.out.println("└───────────────────────────────────────────────────────────────┘");
    }

    private void stressTest(String name, StressTestRunnable test) {
        System.out.printf("  %-62s ", name);
        try {
            test.run();
            System.out.println("[PASS]");
            testsPassed.incrementAndGet();
        } catch (Throwable e) {
            System.out.println("[FAIL]");
            System.err.println("    Error: " + e.getMessage());
            e.printStackTrace(System.err);
            testsFailed.incrementAndGet();
        }
    }

    private Path createTestDir(String name) throws IOException {
        Path dir = baseDir.resolve(name + "-" + System.nanoTime());
        Files.createDirectories(dir);
        return dir;
    }

    private static void deleteRecursively(Path path) {
        try {
            if (Files.isDirectory(path)) {
                try (Stream<Path> stream = Files.list(path)) {
                    stream.forEach(RotationStress::deleteRecursively);
                }
            }
            Files.deleteIfExists(path);
        } catch (IOException e) {
            System.err.println("    Cleanup failed for " + path + ": " + e.getMessage());
        }
    }

    @FunctionalInterface
    interface StressTestRunnable {
        void run() throws Exception;
    }
}
