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
package dev.mars.rollinglog.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes lines on the calling thread while holding an exclusive lock on the sink.
 * <p>
 * <b>INVARIANT:</b> the sink is only touched with {@link #lock} held, and the lock
 * is released on every exit path, including I/O failure. Concurrent callers are
 * totally ordered by lock acquisition; no fairness is promised.
 * <p>
 * An I/O failure is returned to the caller as a {@link LogWriteException}.
 */
public final class SyncWriter implements LineWriter {

    private static final Logger LOG = LoggerFactory.getLogger(SyncWriter.class);

    private final String name;
    private final LogSink sink;
    private final ReentrantLock lock = new ReentrantLock();

    // Written only with lock held; volatile so stats() never waits on a stalled write
    private volatile long linesWritten;
    private volatile long writeFailures;
    private volatile boolean closed;

    /**
     * @param name instance name, used in diagnostics
     * @param sink sink this writer takes exclusive ownership of
     */
    public SyncWriter(String name, LogSink sink) {
        this.name = name;
        this.sink = sink;
        LOG.debug("SyncWriter '{}' created", name);
    }

    @Override
    public void writeLine(String line) {
        lock.lock();
        try {
            if (closed) {
                throw new LogWriteException("Writer '" + name + "' is closed");
            }
            sink.write(line);
            linesWritten++;
        } catch (IOException e) {
            writeFailures++;
            LOG.debug("Write failed on '{}': {}", name, e.getMessage());
            throw new LogWriteException("Failed to write log line to '" + name + "'", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean flush(Duration timeout) {
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (!acquired) {
            return false;
        }
        try {
            if (closed) {
                return true;
            }
            sink.flush();
            return true;
        } catch (IOException e) {
            LOG.warn("Flush failed on '{}': {}", name, e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean shutdown(Duration timeout) {
        lock.lock();
        try {
            if (closed) {
                return true;
            }
            closed = true;
            sink.close();
            LOG.info("SyncWriter '{}' closed: {} lines written, {} failures", name, linesWritten, writeFailures);
            return true;
        } catch (IOException e) {
            LOG.warn("Error closing sink of '{}': {}", name, e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        shutdown(Duration.ZERO);
    }

    @Override
    public WriterStats stats() {
        return new WriterStats(linesWritten, writeFailures, 0, 0, 0);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }
}
