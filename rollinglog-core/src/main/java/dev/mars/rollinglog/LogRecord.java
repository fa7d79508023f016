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

/**
 * One log event before rendering. Never persisted: only its rendered line is.
 *
 * @param timestampMillis epoch milliseconds at the call site
 * @param threadId        platform id of the calling thread
 * @param level           severity
 * @param message         already formatted message text
 */
public record LogRecord(long timestampMillis, long threadId, LogLevel level, String message) {

    /**
     * Stamps a record with the current time and thread.
     */
    public static LogRecord capture(LogLevel level, String message) {
        return new LogRecord(System.currentTimeMillis(), Thread.currentThread().getId(), level, message);
    }
}
