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

import java.util.Collections;
import java.util.List;

/**
 * The file operations needed to rotate one rolling log.
 * <p>
 * A plan is computed without touching the filesystem (see
 * {@link RotationPolicy#planRotation}) and executed afterwards by
 * {@link FileSink}. Operations must be executed in list order:
 * <ol>
 *   <li>every name in {@link #deletions()} is removed</li>
 *   <li>every {@link Rename} in {@link #renames()} is applied, highest suffix first,
 *       the last one always moving the active file to suffix 1</li>
 * </ol>
 * <b>Descending order is what keeps data safe:</b> renaming {@code 1 -> 2} before
 * {@code 2 -> 3} would overwrite the older backup.
 *
 * @param deletions backup file names to delete before any rename
 * @param renames   source/target file name pairs, in execution order
 */
public record RotationPlan(
        List<String> deletions,
        List<Rename> renames
) {

    public RotationPlan {
        deletions = deletions == null ? Collections.emptyList() : List.copyOf(deletions);
        renames = renames == null ? Collections.emptyList() : List.copyOf(renames);
    }

    /**
     * A single rename within the directory of the log.
     *
     * @param source the existing file name
     * @param target the new file name, which must not exist yet
     */
    public record Rename(String source, String target) {
    }

    /**
     * @return true if at least one backup is evicted by this plan
     */
    public boolean evictsBackups() {
        return !deletions.isEmpty();
    }

    /**
     * @return total number of filesystem operations in the plan
     */
    public int operationCount() {
        return deletions.size() + renames.size();
    }
}
