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

import java.io.Closeable;
import java.time.Duration;

/**
 * Thread-safe front end of a {@link LogSink}.
 * <p>
 * Any number of threads may call {@link #writeLine(String)} concurrently; the
 * implementation guarantees the underlying sink is only ever driven by one of
 * them at a time, so lines are never interleaved at the byte level.
 *
 * @see SyncWriter
 * @see AsyncWriter
 */
public interface LineWriter extends Closeable {

    /**
     * Writes (or enqueues) one rendered line.
     *
     * @throws LogWriteException synchronous implementations only, if the write failed
     */
    void writeLine(String line);

    /**
     * Waits until every line accepted so far has reached the file and forces it
     * to the device where supported.
     *
     * @param timeout upper bound on the wait
     * @return true if everything was flushed within the timeout
     */
    boolean flush(Duration timeout);

    /**
     * Stops accepting lines, writes out what is pending within {@code timeout}
     * and closes the sink. Idempotent.
     *
     * @return true if nothing was lost
     */
    boolean shutdown(Duration timeout);

    /**
     * @return current counters
     */
    WriterStats stats();

    /**
     * @return true once {@link #shutdown(Duration)} or {@link #close()} has been called
     */
    boolean isClosed();

    /**
     * Shuts down with the writer's configured drain timeout.
     */
    @Override
    void close();
}
