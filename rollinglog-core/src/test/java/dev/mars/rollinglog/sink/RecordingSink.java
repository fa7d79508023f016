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

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link LogSink} for writer tests: records lines, can stall on a latch,
 * inject I/O failures and observe concurrent entry.
 */
final class RecordingSink implements LogSink {

    final List<String> lines = Collections.synchronizedList(new ArrayList<>());
    final Set<String> writerThreads = ConcurrentHashMap.newKeySet();
    final CountDownLatch firstWriteEntered = new CountDownLatch(1);
    final AtomicInteger inFlight = new AtomicInteger();
    final AtomicInteger maxInFlight = new AtomicInteger();
    final AtomicInteger flushes = new AtomicInteger();
    final AtomicInteger failuresRemaining = new AtomicInteger();
    volatile boolean failAll;
    volatile boolean closed;

    private final CountDownLatch release;

    private RecordingSink(CountDownLatch release) {
        this.release = release;
    }

    static RecordingSink recording() {
        return new RecordingSink(null);
    }

    /** Every write waits for {@code release} before completing. */
    static RecordingSink blockedUntil(CountDownLatch release) {
        return new RecordingSink(release);
    }

    RecordingSink failingFirst(int count) {
        failuresRemaining.set(count);
        return this;
    }

    RecordingSink failingAlways() {
        failAll = true;
        return this;
    }

    @Override
    public void write(String line) throws IOException {
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            writerThreads.add(Thread.currentThread().getName());
            firstWriteEntered.countDown();
            if (release != null) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("write interrupted");
                }
            }
            Thread.yield();
            if (failAll || failuresRemaining.getAndDecrement() > 0) {
                throw new IOException("simulated disk failure");
            }
            lines.add(line);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public void flush() {
        flushes.incrementAndGet();
    }

    @Override
    public void close() {
        closed = true;
    }

    List<String> snapshot() {
        synchronized (lines) {
            return new ArrayList<>(lines);
        }
    }
}
