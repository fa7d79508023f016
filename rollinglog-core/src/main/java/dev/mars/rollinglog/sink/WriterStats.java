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
 * Point-in-time counters of a {@link LineWriter}.
 *
 * @param linesWritten      lines that reached the sink
 * @param writeFailures     lines the sink failed to write (I/O error)
 * @param droppedOnOverflow lines rejected because the queue stayed full, or offered after shutdown
 * @param lostOnShutdown    lines still queued when the drain timeout elapsed
 * @param queued            lines waiting in the queue at the time of the snapshot
 */
public record WriterStats(
        long linesWritten,
        long writeFailures,
        long droppedOnOverflow,
        long lostOnShutdown,
        int queued
) {

    /**
     * @return true if any line was dropped, lost or failed
     */
    public boolean hasLoss() {
        return writeFailures > 0 || droppedOnOverflow > 0 || lostOnShutdown > 0;
    }
}
