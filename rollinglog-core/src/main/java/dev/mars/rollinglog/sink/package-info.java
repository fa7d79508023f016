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
 * Write path and rotation engine.
 * <p>
 * This package turns rendered lines into size-bounded, rotated files:
 * <ul>
 *   <li>{@link dev.mars.rollinglog.sink.RotationPolicy} - pure rotation decisions and plans</li>
 *   <li>{@link dev.mars.rollinglog.sink.FileSink} - active file, cached size, rotation execution</li>
 *   <li>{@link dev.mars.rollinglog.sink.SyncWriter} - sink behind a lock, caller's thread writes</li>
 *   <li>{@link dev.mars.rollinglog.sink.AsyncWriter} - sink behind a bounded queue and one consumer</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Single owner:</b> a sink is driven by exactly one thread at a time</li>
 *   <li><b>Soft threshold:</b> rotation is checked before a write, lines are never split</li>
 *   <li><b>Descending shift:</b> backups are renamed highest suffix first</li>
 *   <li><b>Rotation never blocks logging:</b> a failed rename leaves the active file writable</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * logs/
 *  ├─ app.log      // active file
 *  ├─ app.1.log    // newest backup
 *  └─ app.N.log    // oldest backup, N = maxFiles
 * </pre>
 *
 * @see dev.mars.rollinglog.sink.LineWriter
 */
package dev.mars.rollinglog.sink;
