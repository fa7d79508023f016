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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.OptionalInt;
import java.util.TreeSet;

/**
 * Pure rotation decisions for a size-rotated log.
 * <p>
 * <b>File naming:</b>
 * <pre>
 * {base}.log      // active file, always the one being written
 * {base}.1.log    // most recently rotated backup
 * {base}.2.log
 * ...
 * {base}.N.log    // oldest backup kept, N = maxFiles
 * </pre>
 * <p>
 * Nothing in this class touches the filesystem; {@link FileSink} lists the
 * directory, asks for a plan and executes it.
 */
public final class RotationPolicy {

    /** Extension shared by the active file and every backup. */
    public static final String EXTENSION = ".log";

    private RotationPolicy() {
    }

    /**
     * Decides whether the active file must be rotated before writing the next line.
     * <p>
     * The threshold is soft: it is only consulted before a write, so a single line
     * larger than {@code maxSize} is still written whole.
     *
     * @param currentSize  bytes already in the active file
     * @param incomingSize bytes about to be written (line plus terminator)
     * @param maxSize      rotation threshold in bytes
     * @return true iff {@code currentSize + incomingSize > maxSize}
     */
    public static boolean shouldRotate(long currentSize, long incomingSize, long maxSize) {
        return currentSize + incomingSize > maxSize;
    }

    /**
     * Computes the delete/rename sequence for the next rotation.
     * <p>
     * Algorithm:
     * <ol>
     *   <li>Every existing backup with suffix {@code >= maxFiles} is deleted (it would
     *       fall off the end of the retention window after the shift)</li>
     *   <li>Each remaining backup {@code i} is renamed to {@code i + 1}, from
     *       {@code maxFiles - 1} down to 1</li>
     *   <li>The active file is renamed to suffix 1</li>
     * </ol>
     * With {@code maxFiles = 3} and backups 1, 2, 3 present this yields:
     * delete 3, rename 2 to 3, rename 1 to 2, rename active to 1.
     *
     * @param baseName        log base name, without extension
     * @param existingBackups suffixes of the backups currently on disk
     * @param maxFiles        number of backups to retain, at least 1
     * @return the plan, never null
     */
    public static RotationPlan planRotation(String baseName,
                                            Collection<Integer> existingBackups,
                                            int maxFiles) {
        if (maxFiles < 1) {
            throw new IllegalArgumentException("maxFiles must be at least 1, got " + maxFiles);
        }
        TreeSet<Integer> existing = existingBackups == null
                ? new TreeSet<>()
                : new TreeSet<>(existingBackups);

        List<String> deletions = new ArrayList<>();
        for (Integer suffix : existing.descendingSet()) {
            if (suffix >= maxFiles) {
                deletions.add(backupFileName(baseName, suffix));
            }
        }

        List<RotationPlan.Rename> renames = new ArrayList<>();
        for (int i = maxFiles - 1; i >= 1; i--) {
            if (existing.contains(i)) {
                renames.add(new RotationPlan.Rename(
                        backupFileName(baseName, i),
                        backupFileName(baseName, i + 1)));
            }
        }
        renames.add(new RotationPlan.Rename(activeFileName(baseName), backupFileName(baseName, 1)));

        return new RotationPlan(deletions, renames);
    }

    /**
     * @return the active file name for {@code baseName}, e.g. {@code app.log}
     */
    public static String activeFileName(String baseName) {
        return baseName + EXTENSION;
    }

    /**
     * @return the backup file name for {@code baseName} and {@code suffix}, e.g. {@code app.2.log}
     */
    public static String backupFileName(String baseName, int suffix) {
        return baseName + "." + suffix + EXTENSION;
    }

    /**
     * Extracts the backup suffix from a file name belonging to {@code baseName}.
     *
     * @return the suffix, or empty if the name is not a backup of this log
     */
    public static OptionalInt parseBackupSuffix(String baseName, String fileName) {
        String prefix = baseName + ".";
        if (!fileName.startsWith(prefix) || !fileName.endsWith(EXTENSION)) {
            return OptionalInt.empty();
        }
        int start = prefix.length();
        int end = fileName.length() - EXTENSION.length();
        if (end <= start) {
            return OptionalInt.empty();
        }
        String digits = fileName.substring(start, end);
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                return OptionalInt.empty();
            }
        }
        if (digits.length() > 9 || digits.charAt(0) == '0') {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(digits));
    }
}
