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
 * The only way this library ends the process, used by {@link RollingLogger#fatal(String)}.
 * <p>
 * Kept as a seam so that nothing else in the library can call {@link System#exit(int)}
 * and so tests can observe a fatal call without dying.
 */
@FunctionalInterface
public interface ProcessTerminator {

    /** Exit status used after a fatal line. */
    int FATAL_EXIT_CODE = 1;

    /** Terminates the JVM via {@link System#exit(int)}, running shutdown hooks. */
    ProcessTerminator SYSTEM_EXIT = System::exit;

    /**
     * Ends the process with {@code status}.
     */
    void terminate(int status);
}
