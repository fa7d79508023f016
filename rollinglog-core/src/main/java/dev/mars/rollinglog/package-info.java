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
/**
 * Rolling file logging with independent, named instances.
 * <p>
 * Entry points:
 * <ul>
 *   <li>{@link dev.mars.rollinglog.LogConfig} - per-instance configuration</li>
 *   <li>{@link dev.mars.rollinglog.LoggerRegistry} - creates and tracks named instances</li>
 *   <li>{@link dev.mars.rollinglog.RollingLogger} - the handle callers log through</li>
 * </ul>
 * <p>
 * <b>Line format:</b>
 * <pre>
 * 2026-01-31 14:02:11.042 [info ][0427] Server started on port 8080
 * </pre>
 * <p>
 * The write path itself lives in {@link dev.mars.rollinglog.sink}.
 */
package dev.mars.rollinglog;
