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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Hands lines to a single background consumer through a bounded queue.
 * <p>
 * <b>Ownership:</b> the sink is driven exclusively by the consumer thread, so it
 * needs no lock. Producers only ever touch the queue.
 * <p>
 * <b>Ordering:</b> lines are written in queue (FIFO) order. Across producer threads
 * the order is whatever order their pushes won.
 * <p>
 * <b>Overflow policy:</b> a producer waits at most {@code offerTimeout} for space
 * (zero means not at all); if the queue is still full the line is dropped and
 * counted in {@link WriterStats#droppedOnOverflow()}. Capacity is a hard bound.
 * <p>
 * <b>Failures:</b> an I/O error discards the line and is counted in
 * {@link WriterStats#writeFailures()}; it never reaches the producer.
 * <p>
 * <b>Shutdown:</b> {@link #shutdown(Duration)} stops accepting lines and waits up
 * to the given timeout for the consumer to empty the queue. Whatever is still
 * queued after that is discarded, counted in {@link WriterStats#lostOnShutdown()}
 * and reported at ERROR.
 */
public final class AsyncWriter implements LineWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AsyncWriter.class);

    /** Upper bound on how long an idle consumer takes to notice shutdown. */
    private static final long POLL_INTERVAL_MS = 50;

    /** How long an interrupted consumer gets to release the sink after a timed-out drain. */
    private static final long INTERRUPT_GRACE_MS = 1000;

    /** Overflow and failure warnings are logged for the first event, then every Nth. */
    private static final long WARN_EVERY = 1000;

    private final String name;
    private final LogSink sink;
    private final int capacity;
    private final BlockingQueue<String> queue;
    private final long offerTimeoutNanos;
    private final Duration drainTimeout;

    /**
     * Single consumer thread.
     * <p>
     * <b>DO NOT</b> increase the pool size: the sink is not thread-safe and
     * write order relies on one consumer.
     */
    private final ExecutorService consumer;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Producers hold the read lock from the {@link #accepting} check until their
     * offer has completed; shutdown takes the write lock to stop accepting. Once
     * {@code accepting} is false no line can enter the queue, so an empty queue
     * seen by the consumer after that is final.
     */
    private final ReentrantReadWriteLock acceptLock = new ReentrantReadWriteLock();
    private volatile boolean accepting = true;

    private final AtomicLong linesWritten = new AtomicLong();
    private final AtomicLong writeFailures = new AtomicLong();
    private final AtomicLong droppedOnOverflow = new AtomicLong();
    private final AtomicLong lostOnShutdown = new AtomicLong();

    /** Lines accepted into the queue and not yet handled by the consumer. */
    private final AtomicLong outstanding = new AtomicLong();
    private final ReentrantLock idleLock = new ReentrantLock();
    private final Condition idle = idleLock.newCondition();

    /**
     * Creates the writer and starts its consumer thread.
     *
     * @param name         instance name, used for the thread name and diagnostics
     * @param sink         sink owned by the consumer from now on
     * @param capacity     queue capacity in lines
     * @param offerTimeout how long a producer may wait for space, zero for never
     * @param drainTimeout default drain bound used by {@link #close()}
     */
    public AsyncWriter(String name, LogSink sink, int capacity, Duration offerTimeout, Duration drainTimeout) {
        this(name, sink, boundedQueue(capacity), offerTimeout, drainTimeout);
    }

    /**
     * Uses {@code queue} as the buffer; its remaining capacity on entry is the bound.
     */
    AsyncWriter(String name, LogSink sink, BlockingQueue<String> queue, Duration offerTimeout, Duration drainTimeout) {
        this.name = name;
        this.sink = sink;
        this.capacity = queue.remainingCapacity();
        this.queue = queue;
        this.offerTimeoutNanos = Math.max(0, offerTimeout.toNanos());
        this.drainTimeout = drainTimeout;

        this.consumer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "rollinglog-" + name);
            t.setDaemon(true);
            return t;
        });
        consumer.execute(this::drainLoop);

        LOG.debug("AsyncWriter '{}' started: capacity={}, offerTimeout={} ms, drainTimeout={} ms",
                name, capacity, offerTimeout.toMillis(), drainTimeout.toMillis());
    }

    @Override
    public void writeLine(String line) {
        acceptLock.readLock().lock();
        try {
            if (!accepting) {
                recordDrop();
                return;
            }
            outstanding.incrementAndGet();
            boolean queued;
            try {
                queued = offerTimeoutNanos == 0
                        ? queue.offer(line)
                        : queue.offer(line, offerTimeoutNanos, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                queued = false;
            }
            if (!queued) {
                completeOne();
                recordDrop();
            }
        } finally {
            acceptLock.readLock().unlock();
        }
    }

    /**
     * Waits until the consumer has written every accepted line.
     * <p>
     * The consumer's sink forces data to the device itself when configured for
     * instant flush; this method only waits for the queue to empty.
     */
    @Override
    public boolean flush(Duration timeout) {
        long nanos = timeout.toNanos();
        idleLock.lock();
        try {
            while (outstanding.get() > 0) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = idle.awaitNanos(nanos);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            idleLock.unlock();
        }
    }

    @Override
    public boolean shutdown(Duration timeout) {
        if (!closed.compareAndSet(false, true)) {
            LOG.debug("AsyncWriter '{}' already closed, ignoring duplicate shutdown", name);
            return consumer.isTerminated() && lostOnShutdown.get() == 0;
        }
        // Waits for producers that are mid-offer, at most their offer timeout
        acceptLock.writeLock().lock();
        try {
            accepting = false;
        } finally {
            acceptLock.writeLock().unlock();
        }
        LOG.debug("Draining AsyncWriter '{}': {} lines queued", name, queue.size());

        consumer.shutdown();
        boolean drained;
        try {
            drained = consumer.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drained = false;
        }
        if (!drained) {
            List<Runnable> neverStarted = consumer.shutdownNow();
            if (!neverStarted.isEmpty()) {
                closeSink();
            } else {
                awaitConsumerExit();
            }
        }

        List<String> leftover = new ArrayList<>();
        queue.drainTo(leftover);
        if (!leftover.isEmpty()) {
            lostOnShutdown.addAndGet(leftover.size());
            outstanding.addAndGet(-leftover.size());
            signalIdle();
            LOG.error("AsyncWriter '{}' shut down with {} buffered lines lost (drain timeout {} ms)",
                    name, leftover.size(), timeout.toMillis());
        }

        LOG.info("AsyncWriter '{}' closed: {} written, {} failed, {} dropped, {} lost",
                name, linesWritten.get(), writeFailures.get(), droppedOnOverflow.get(), lostOnShutdown.get());
        return drained && leftover.isEmpty();
    }

    @Override
    public void close() {
        shutdown(drainTimeout);
    }

    @Override
    public WriterStats stats() {
        return new WriterStats(
                linesWritten.get(),
                writeFailures.get(),
                droppedOnOverflow.get(),
                lostOnShutdown.get(),
                queue.size());
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    /** Queue capacity in lines. */
    public int capacity() {
        return capacity;
    }

    // ========================================================================
    // Consumer
    // ========================================================================

    private void drainLoop() {
        try {
            while (true) {
                String line = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (line == null) {
                    if (!accepting) {
                        break;
                    }
                    continue;
                }
                writeToSink(line);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Consumer of '{}' interrupted with {} lines queued", name, queue.size());
        } finally {
            closeSink();
        }
    }

    private void writeToSink(String line) {
        try {
            sink.write(line);
            linesWritten.incrementAndGet();
        } catch (IOException e) {
            long failures = writeFailures.incrementAndGet();
            if (failures == 1 || failures % WARN_EVERY == 0) {
                LOG.warn("AsyncWriter '{}' discarded a line after an I/O failure ({} so far): {}",
                        name, failures, e.getMessage());
            }
        } finally {
            completeOne();
        }
    }

    private void closeSink() {
        try {
            sink.close();
        } catch (IOException e) {
            LOG.warn("Error closing sink of '{}': {}", name, e.getMessage());
        }
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private static BlockingQueue<String> boundedQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        return new ArrayBlockingQueue<>(capacity);
    }

    private void awaitConsumerExit() {
        try {
            if (!consumer.awaitTermination(INTERRUPT_GRACE_MS, TimeUnit.MILLISECONDS)) {
                LOG.warn("Consumer of '{}' still running {} ms after interrupt", name, INTERRUPT_GRACE_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void recordDrop() {
        long dropped = droppedOnOverflow.incrementAndGet();
        if (dropped == 1 || dropped % WARN_EVERY == 0) {
            LOG.warn("AsyncWriter '{}' dropped a line (capacity {}, accepting={}); {} dropped so far",
                    name, capacity, accepting, dropped);
        }
    }

    private void completeOne() {
        if (outstanding.decrementAndGet() == 0) {
            signalIdle();
        }
    }

    private void signalIdle() {
        idleLock.lock();
        try {
            idle.signalAll();
        } finally {
            idleLock.unlock();
        }
    }
}
