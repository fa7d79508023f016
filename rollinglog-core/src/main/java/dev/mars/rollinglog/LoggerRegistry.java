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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named rolling log instances of one process.
 * <p>
 * <b>Duplicate instances:</b>
 * <ul>
 *   <li>{@link #init(LogConfig)} with a name that is already active and an
 *       <em>equal</em> config returns the active instance: both callers share one
 *       sink and one rotation history</li>
 *   <li>the same name with a different config is rejected</li>
 *   <li>a different name whose active file is already written by another
 *       instance is rejected</li>
 * </ul>
 * An instance that has finished closing no longer counts; its name and file can
 * be reused. {@code init} waits for an instance that is still closing.
 * <p>
 * All methods are thread-safe.
 */
public final class LoggerRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(LoggerRegistry.class);

    private static final LoggerRegistry GLOBAL = new LoggerRegistry(ProcessTerminator.SYSTEM_EXIT);

    /** Extra wait beyond a closing instance's drain timeout before init gives up. */
    private static final Duration CLOSE_GRACE = Duration.ofSeconds(2);

    private final ProcessTerminator terminator;
    private final Map<String, RollingLogger> instances = new LinkedHashMap<>();
    private Thread shutdownHook;

    /**
     * Creates an empty registry whose loggers end the process through {@code terminator}.
     */
    public LoggerRegistry(ProcessTerminator terminator) {
        this.terminator = terminator;
    }

    /**
     * The process-wide registry, terminating via {@link System#exit(int)} on fatal.
     */
    public static LoggerRegistry global() {
        return GLOBAL;
    }

    /**
     * Validates {@code config}, opens its file and registers the instance.
     * <p>
     * If an instance with the same name or file is still shutting down, waits for
     * its shutdown to return first, at most its drain timeout plus a grace period.
     *
     * @return the new instance, or the already-active one with an equal config
     * @throws LoggerInitException on invalid config, I/O failure, a conflicting
     *                              instance or one that does not finish closing in time
     */
    public RollingLogger init(LogConfig config) {
        config.validate();
        while (true) {
            RollingLogger closing;
            synchronized (this) {
                closing = findClosing(config);
                if (closing == null) {
                    return register(config);
                }
            }
            awaitClosed(closing, config);
        }
    }

    private RollingLogger register(LogConfig config) {
        String name = config.instanceName();

        RollingLogger existing = instances.get(name);
        if (existing != null && !existing.isClosed()) {
            if (existing.config().equals(config)) {
                LOG.debug("Rolling log '{}' already active with the same config, sharing it", name);
                return existing;
            }
            throw new LoggerInitException("Rolling log '" + name + "' is already active with a different config: "
                    + existing.config());
        }

        Path activeFile = config.activeFile();
        for (RollingLogger other : instances.values()) {
            if (!other.isClosed() && other.config().activeFile().equals(activeFile)) {
                throw new LoggerInitException("File " + activeFile + " is already written by rolling log '"
                        + other.name() + "'");
            }
        }

        RollingLogger logger = RollingLogger.open(config, terminator);
        instances.put(name, logger);
        return logger;
    }

    /**
     * Returns a registered instance with the same name or file that has started
     * shutting down but not yet finished, or null.
     */
    private RollingLogger findClosing(LogConfig config) {
        Path activeFile = config.activeFile();
        for (RollingLogger other : instances.values()) {
            if (other.isClosed() && !other.isTerminated()
                    && (other.name().equals(config.instanceName())
                    || other.config().activeFile().equals(activeFile))) {
                return other;
            }
        }
        return null;
    }

    private static void awaitClosed(RollingLogger closing, LogConfig config) {
        Duration limit = closing.config().drainTimeout().plus(CLOSE_GRACE);
        LOG.debug("Rolling log '{}' waits up to {} ms for '{}' to finish closing",
                config.instanceName(), limit.toMillis(), closing.name());
        try {
            if (!closing.awaitTermination(limit)) {
                throw new LoggerInitException("Rolling log '" + closing.name() + "' at "
                        + closing.config().activeFile() + " did not finish closing within " + limit.toMillis() + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LoggerInitException("Interrupted waiting for rolling log '" + closing.name() + "' to close", e);
        }
    }

    /**
     * @return the active instance registered under {@code name}
     */
    public synchronized Optional<RollingLogger> get(String name) {
        RollingLogger logger = instances.get(name);
        return logger == null || logger.isClosed() ? Optional.empty() : Optional.of(logger);
    }

    /**
     * @return names of all active instances, in registration order
     */
    public synchronized List<String> names() {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, RollingLogger> entry : instances.entrySet()) {
            if (!entry.getValue().isClosed()) {
                names.add(entry.getKey());
            }
        }
        return names;
    }

    /**
     * Closes and unregisters one instance. The instance stays registered until its
     * shutdown has returned, so its name and file cannot be reopened meanwhile.
     *
     * @return false if no such instance was registered
     */
    public boolean close(String name) {
        RollingLogger logger;
        synchronized (this) {
            logger = instances.get(name);
        }
        if (logger == null) {
            return false;
        }
        logger.close();
        synchronized (this) {
            instances.remove(name, logger);
        }
        return true;
    }

    /**
     * Closes and unregisters every instance, draining async queues with each
     * instance's configured timeout.
     *
     * @return true if no instance lost buffered lines
     */
    public boolean closeAll() {
        Map<String, RollingLogger> toClose;
        synchronized (this) {
            toClose = new LinkedHashMap<>(instances);
        }
        boolean clean = true;
        for (RollingLogger logger : toClose.values()) {
            clean &= logger.shutdown(logger.config().drainTimeout());
        }
        synchronized (this) {
            for (Map.Entry<String, RollingLogger> entry : toClose.entrySet()) {
                instances.remove(entry.getKey(), entry.getValue());
            }
        }
        if (!toClose.isEmpty()) {
            LOG.info("Closed {} rolling logs (clean={})", toClose.size(), clean);
        }
        return clean;
    }

    /**
     * Registers a JVM shutdown hook that calls {@link #closeAll()}, so queued lines
     * are drained before the process exits. Idempotent.
     */
    public synchronized void registerShutdownHook() {
        if (shutdownHook != null) {
            return;
        }
        shutdownHook = new Thread(this::closeAll, "rollinglog-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOG.debug("Shutdown hook registered");
    }

    /**
     * Removes the hook installed by {@link #registerShutdownHook()}, if any.
     */
    public synchronized void unregisterShutdownHook() {
        if (shutdownHook == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            LOG.debug("JVM already shutting down, hook stays: {}", e.getMessage());
        }
        shutdownHook = null;
    }
}
