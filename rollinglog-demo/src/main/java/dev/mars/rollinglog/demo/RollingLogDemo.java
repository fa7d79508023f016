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
import dev.mars.rollinglog.LogLevel;
import dev.mars.rollinglog.LoggerRegistry;
import dev.mars.rollinglog.RollingLogger;
import dev.mars.rollinglog.sink.WriterStats;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Demo entry point for the rolling file logger.
 * <p>
 * This demonstrates:
 * <ul>
 *   <li>Two named instances in one process ({@code app} async, {@code access} sync)</li>
 *   <li>Level filtering</li>
 *   <li>Size-based rotation with bounded retention</li>
 *   <li>Draining queued lines on shutdown</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * The {@code app} instance is configured by {@link LogConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (directory only)</li>
 *   <li>System properties: {@code -Drollinglog.directory=/path -Drollinglog.maxFiles=3 ...}</li>
 *   <li>Environment variables: {@code ROLLINGLOG_DIRECTORY, ROLLINGLOG_MAX_FILES, ...}</li>
 *   <li>Properties file: {@code rollinglog.properties} on classpath or working directory</li>
 *   <li>Defaults, except a 64 KiB rotation threshold so rotation is visible</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl rollinglog-demo -am
 *
 * # Run with default configuration (writes to ./logs)
 * java -jar rollinglog-demo/target/rollinglog-demo-1.0-SNAPSHOT.jar
 *
 * # Run with CLI directory override
 * java -jar rollinglog-demo/target/rollinglog-demo-1.0-SNAPSHOT.jar /tmp/demo-logs
 *
 * # Run with system properties
 * java -Drollinglog.maxFiles=2 -Drollinglog.minLevel=info -jar rollinglog-demo/target/rollinglog-demo-1.0-SNAPSHOT.jar
 * </pre>
 *
 * @see LogConfig
 * @see LoggerRegistry
 */
public class RollingLogDemo {

    private static final long DEMO_MAX_FILE_SIZE = 64 * 1024;
    private static final int WORKERS = 4;
    private static final int EVENTS_PER_WORKER = 2_000;

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|        Rolling File Logger Demo       |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        LoggerRegistry registry = LoggerRegistry.global();
        registry.registerShutdownHook();

        // Build configuration with CLI override if provided
        LogConfig.Builder appBuilder = LogConfig.builder()
                .instanceName("app")
                .fileName("app");
        if (args.length > 0 && !args[0].isBlank()) {
            appBuilder.directory(args[0]);
        }
        if (System.getProperty("rollinglog.maxFileSize") == null) {
            appBuilder.maxFileSize(DEMO_MAX_FILE_SIZE);
        }
        LogConfig appConfig = appBuilder.build();

        LogConfig accessConfig = LogConfig.builder()
                .instanceName("access")
                .directory(appConfig.directory())
                .fileName("access")
                .maxFileSize(appConfig.maxFileSize())
                .async(false)
                .minLevel(LogLevel.INFO)
                .build();

        System.out.println("Configuration: " + appConfig);
        System.out.println("Configuration: " + accessConfig);
        System.out.println();

        RollingLogger app = registry.init(appConfig);
        RollingLogger access = registry.init(accessConfig);
        System.out.println("[OK] Opened instances " + registry.names() + " in " + appConfig.directory().toAbsolutePath());

        // Same name, same config: the registry hands back the running instance
        RollingLogger again = registry.init(appConfig);
        System.out.println("[OK] Re-init of 'app' returned the same instance: " + (again == app));

        app.info("Demo starting with {} workers x {} events", WORKERS, EVENTS_PER_WORKER);
        access.debug("Filtered out: access logs INFO and above");

        ExecutorService workers = Executors.newFixedThreadPool(WORKERS);
        CountDownLatch done = new CountDownLatch(WORKERS);
        long startNanos = System.nanoTime();

        for (int w = 0; w < WORKERS; w++) {
            final int worker = w;
            workers.submit(() -> {
                try {
                    ThreadLocalRandom random = ThreadLocalRandom.current();
                    for (int i = 0; i < EVENTS_PER_WORKER; i++) {
                        int latency = random.nextInt(1, 250);
                        access.info("GET /orders/{} 200 {}ms", random.nextInt(100_000), latency);
                        if (latency > 200) {
                            app.warn("worker-{} slow request #{} took {} ms", worker, i, latency);
                        } else {
                            app.debug("worker-{} handled request #{}", worker, i);
                        }
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        done.await(60, TimeUnit.SECONDS);
        workers.shutdown();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        app.info("Demo workload finished in {} ms", elapsedMs);

        boolean flushed = app.flush(Duration.ofSeconds(5));
        System.out.println("[OK] Workload finished in " + elapsedMs + " ms (app flushed: " + flushed + ")");

        printStats("app", app.stats());
        printStats("access", access.stats());
        printFiles(appConfig.directory());

        boolean clean = registry.closeAll();
        registry.unregisterShutdownHook();

        System.out.println("\n+---------------------------------------+");
        System.out.println("|  Demo complete! (clean shutdown: " + (clean ? "yes" : "no ") + ") |");
        System.out.println("|  Run again to see files appended.     |");
        System.out.println("+---------------------------------------+");
    }

    private static void printStats(String name, WriterStats stats) {
        System.out.printf("    %-8s written=%d failed=%d dropped=%d lost=%d queued=%d%n",
                name, stats.linesWritten(), stats.writeFailures(), stats.droppedOnOverflow(),
                stats.lostOnShutdown(), stats.queued());
    }

    private static void printFiles(Path directory) throws IOException {
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        System.out.println("\n  Files in " + directory.toAbsolutePath() + ":");
        for (Path file : files) {
            System.out.printf("    %-20s %,10d bytes%n", file.getFileName(), Files.size(file));
        }
    }
}
