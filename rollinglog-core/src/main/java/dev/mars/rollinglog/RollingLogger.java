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

import dev.mars.rollinglog.sink.AsyncWriter;
import dev.mars.rollinglog.sink.FileSink;
import dev.mars.rollinglog.sink.LineWriter;
import dev.mars.rollinglog.sink.LogWriteException;
import dev.mars.rollinglog.sink.SyncWriter;
import dev.mars.rollinglog.sink.WriterStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle to one rolling log instance.
 * <p>
 * Binds a {@link LogFormatter}, a minimum level and a {@link LineWriter} (a
 * {@link SyncWriter} or an {@link AsyncWriter}, per {@link LogConfig#async()}).
 * One instance is shared by every thread that logs to it; there is exactly one
 * file sink per instance.
 * <p>
 * <b>Usage:</b>
 * <pre>{@code
 * RollingLogger app = LoggerRegistry.global().init(LogConfig.builder()
 *     .instanceName("app")
 *     .directory("/var/log/myapp")
 *     .fileName("app")
 *     .build());
 *
 * app.info("Started in {} ms", elapsed);
 * app.log(LogLevel.WARN, "Disk usage above 90%");
 * }</pre>
 * <p>
 * <b>Errors:</b> in synchronous mode a failed write throws {@link LogWriteException};
 * in asynchronous mode failures are only counted (see {@link #stats()}).
 */
public final class RollingLogger implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(RollingLogger.class);

    /** Prefix written in front of the message of a {@link #fatal(String)} line. */
    public static final String FATAL_PREFIX = "FATAL: ";

    private final LogConfig config;
    private final LogFormatter formatter;
    private final LineWriter writer;
    private final ProcessTerminator terminator;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    RollingLogger(LogConfig config, LogFormatter formatter, LineWriter writer, ProcessTerminator terminator) {
        this.config = config;
        this.formatter = formatter;
        this.writer = writer;
        this.terminator = terminator;
    }

    /**
     * Opens the file sink described by {@code config} and wraps it in the configured writer.
     * <p>
     * Most callers should go through {@link LoggerRegistry#init(LogConfig)}, which also
     * guards against two instances writing the same file.
     *
     * @throws LoggerInitException if the config is invalid or the file cannot be opened
     */
    public static RollingLogger open(LogConfig config, ProcessTerminator terminator) {
        config.validate();
        String name = config.instanceName();
        LOG.info("Opening rolling log '{}' at {}", name, config.activeFile());

        FileSink sink;
        try {
            sink = new FileSink(config.directory(), config.fileName(),
                    config.maxFileSize(), config.maxFiles(), config.instantFlush());
        } catch (IOException e) {
            LOG.error("Failed to open rolling log '{}' at {}: {}", name, config.directory(), e.getMessage(), e);
            throw new LoggerInitException("Failed to open rolling log '" + name + "' at " + config.directory(), e);
        }

        LineWriter writer = config.async()
                ? new AsyncWriter(name, sink, config.queueCapacity(), config.offerTimeout(), config.drainTimeout())
                : new SyncWriter(name, sink);

        LOG.info("Rolling log '{}' opened: mode={}, minLevel={}, maxFileSize={}, maxFiles={}",
                name, config.async() ? "async" : "sync", config.minLevel(), config.maxFileSize(), config.maxFiles());
        return new RollingLogger(config, new LogFormatter(), writer, terminator);
    }

    // ========================================================================
    // Call-site operations
    // ========================================================================

    /**
     * Writes {@code message} at {@code level} if the level passes the minimum.
     *
     * @throws IllegalStateException if this logger is closed
     * @throws LogWriteException     synchronous mode only, if the write failed
     */
    public void log(LogLevel level, String message) {
        if (!isEnabled(level)) {
            return;
        }
        ensureOpen();
        writer.writeLine(formatter.format(LogRecord.capture(level, message)));
    }

    /**
     * Writes a message built from an SLF4J-style pattern ({@code "took {} ms"}).
     * The pattern is only formatted if the level passes the minimum.
     */
    public void log(LogLevel level, String pattern, Object... args) {
        if (!isEnabled(level)) {
            return;
        }
        log(level, MessageFormatter.arrayFormat(pattern, args).getMessage());
    }

    public void debug(String message) {
        log(LogLevel.DEBUG, message);
    }

    public void debug(String pattern, Object... args) {
        log(LogLevel.DEBUG, pattern, args);
    }

    public void info(String message) {
        log(LogLevel.INFO, message);
    }

    public void info(String pattern, Object... args) {
        log(LogLevel.INFO, pattern, args);
    }

    public void warn(String message) {
        log(LogLevel.WARN, message);
    }

    public void warn(String pattern, Object... args) {
        log(LogLevel.WARN, pattern, args);
    }

    public void error(String message) {
        log(LogLevel.ERROR, message);
    }

    public void error(String pattern, Object... args) {
        log(LogLevel.ERROR, pattern, args);
    }

    /**
     * Writes an ERROR line prefixed with {@code "FATAL: "} and then ends the process.
     * <p>
     * The line is written regardless of the minimum level. The process is only
     * terminated after the synchronous write has returned, or, in async mode,
     * after waiting up to the drain timeout for the queue to be written. A write
     * failure is logged but does not prevent termination.
     */
    public void fatal(String message) {
        String line = formatter.format(LogRecord.capture(LogLevel.ERROR, FATAL_PREFIX + message));
        try {
            writer.writeLine(line);
        } catch (LogWriteException e) {
            LOG.error("Fatal line for '{}' could not be written: {}", name(), e.getMessage(), e);
        }
        if (!writer.flush(config.drainTimeout())) {
            LOG.error("Fatal line for '{}' may not have reached disk within {} ms",
                    name(), config.drainTimeoutMs());
        }
        LOG.error("Terminating process after fatal log on '{}'", name());
        terminator.terminate(ProcessTerminator.FATAL_EXIT_CODE);
    }

    // ========================================================================
    // Lifecycle / diagnostics
    // ========================================================================

    /**
     * @return true if a line at {@code level} would be written
     */
    public boolean isEnabled(LogLevel level) {
        return level.isAtLeast(config.minLevel());
    }

    /**
     * Waits until all accepted lines are written and forced to the device where supported.
     *
     * @return true if flushed within the timeout
     */
    public boolean flush(Duration timeout) {
        return writer.flush(timeout);
    }

    /**
     * Stops the logger. In async mode, waits up to {@code timeout} for the queue to
     * drain; lines still queued afterwards are lost and counted.
     *
     * @return true if nothing was lost
     */
    public boolean shutdown(Duration timeout) {
        boolean first = closed.compareAndSet(false, true);
        if (first) {
            LOG.info("Closing rolling log '{}'", name());
        }
        try {
            return writer.shutdown(timeout);
        } finally {
            if (first) {
                terminated.countDown();
            }
        }
    }

    /**
     * Shuts down with the configured drain timeout.
     */
    @Override
    public void close() {
        shutdown(config.drainTimeout());
    }

    /**
     * @return true once shutdown has started; the writer may still be draining
     */
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @return true once shutdown has returned and the file is no longer written
     */
    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    /**
     * Waits for a shutdown started elsewhere to return.
     *
     * @return true if terminated within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public String name() {
        return config.instanceName();
    }

    public LogConfig config() {
        return config;
    }

    /**
     * @return counters of the underlying writer
     */
    public WriterStats stats() {
        return writer.stats();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Rolling log '" + name() + "' is closed");
        }
    }
}
