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

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Renders a {@link LogRecord} as one line of the on-disk format:
 * <pre>
 * YYYY-MM-DD HH:MM:SS.mmm [level][tttt] message
 * </pre>
 * The level is lower case, padded to five characters; {@code tttt} is a
 * four-digit hash of the thread id. The line terminator is added by the sink.
 * <p>
 * Stateless and thread-safe.
 */
public final class LogFormatter {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    /** Thread tags are reduced modulo this value. */
    static final int THREAD_TAG_MODULUS = 10_000;

    private final DateTimeFormatter timestampFormat;

    /**
     * Formatter using the JVM's default time zone.
     */
    public LogFormatter() {
        this(ZoneId.systemDefault());
    }

    /**
     * Formatter rendering timestamps in {@code zone}.
     */
    public LogFormatter(ZoneId zone) {
        this.timestampFormat = TIMESTAMP.withZone(zone);
    }

    public String format(LogRecord record) {
        return format(record.timestampMillis(), record.threadId(), record.level(), record.message());
    }

    public String format(long timestampMillis, long threadId, LogLevel level, String message) {
        StringBuilder sb = new StringBuilder(32 + (message == null ? 4 : message.length()));
        timestampFormat.formatTo(Instant.ofEpochMilli(timestampMillis), sb);
        sb.append(" [").append(level.tag()).append("][").append(threadTag(threadId)).append("] ");
        sb.append(message);
        return sb.toString();
    }

    /**
     * Fixed-width numeric tag for a thread id, stable for the life of the thread.
     */
    static String threadTag(long threadId) {
        // Mix the bits so consecutive ids do not map to consecutive tags
        long mixed = threadId * 0x9E3779B97F4A7C15L;
        int tag = (int) Math.floorMod(mixed ^ (mixed >>> 32), (long) THREAD_TAG_MODULUS);
        return String.format("%04d", tag);
    }
}
