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

/**
 * Thrown to the caller when a synchronous write fails.
 * <p>
 * Asynchronous writes never throw this: the caller has already returned by the
 * time the line reaches the file, so failures are counted in {@link WriterStats}.
 */
public class LogWriteException extends RuntimeException {

    public LogWriteException(String message) {
        super(message);
    }

    public LogWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
