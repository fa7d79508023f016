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

import java.util.Locale;

/**
 * Severity of a log line, in ascending order.
 * <p>
 * There is no FATAL level: {@link RollingLogger#fatal(String)} writes an
 * {@link #ERROR} line prefixed with {@code "FATAL: "}.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    /** Width every level tag is padded to. */
    static final int TAG_WIDTH = 5;

    private final String tag;

    LogLevel() {
        StringBuilder sb = new StringBuilder(name().toLowerCase(Locale.ROOT));
        while (sb.length() < TAG_WIDTH) {
            sb.append(' ');
        }
        this.tag = sb.toString();
    }

    /**
     * @return true if a line at this level passes a logger whose minimum is {@code minimum}
     */
    public boolean isAtLeast(LogLevel minimum) {
        return compareTo(minimum) >= 0;
    }

    /**
     * @return lower-case name padded to a fixed width, e.g. {@code "info "}
     */
    public String tag() {
        return tag;
    }

    /**
     * Parses a level name, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException if the name is not a level
     */
    public static LogLevel parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Log level must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        // Common aliases from other logging stacks
        if (normalized.equals("WARNING")) {
            return WARN;
        }
        return LogLevel.valueOf(normalized);
    }
}
