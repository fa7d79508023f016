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
import java.io.IOException;

/**
 * Destination for rendered log lines.
 * <p>
 * Implementations are <b>not</b> thread-safe. Exactly one owner may call into a
 * sink at a time: {@link SyncWriter} under its lock, or the single consumer
 * thread of {@link AsyncWriter}.
 *
 * @see FileSink
 */
public interface LogSink extends Closeable {

    /**
     * Appends one line. The sink adds the line terminator.
     *
     * @param line rendered line without terminator
     * @throws IOException if the line could not be written
     */
    void write(String line) throws IOException;

    /**
     * Forces written lines to the storage device.
     */
    void flush() throws IOException;

    @Override
    void close() throws IOException;
}
