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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Size-rotated log file.
 * <p>
 * Owns the open {@link FileChannel} of the active file and a cached byte count
 * for it. The count is updated by the bytes actually written, never re-read from
 * the filesystem on the write path; it is resynchronised from the file length
 * whenever the active file is (re)opened.
 * <p>
 * <b>Files:</b>
 * <pre>
 * directory/
 *  ├─ app.log      // active file
 *  ├─ app.1.log    // newest backup
 *  └─ app.2.log    // older backup, up to maxFiles
 * </pre>
 * <p>
 * <b>Thread Safety:</b> none. See {@link LogSink}.
 * <p>
 * <b>Rotation failures:</b> a failed delete or rename aborts the rest of the plan,
 * is logged and counted, and the active file is reopened for appending. Writing
 * continues on the (now oversized) active file. The next automatic attempt waits
 * until the active file has grown by another {@code maxFileSize}, so a persistent
 * obstacle costs one attempt per threshold's worth of data rather than one per line.
 *
 * @see RotationPolicy
 */
public final class FileSink implements LogSink {

    private static final Logger LOG = LoggerFactory.getLogger(FileSink.class);

    private static final byte[] LINE_TERMINATOR = {'\n'};

    /** Rotation failures are logged at WARN for the first, then every Nth. */
    private static final long WARN_EVERY = 100;

    private final Path directory;
    private final String baseName;
    private final Path activePath;
    private final long maxFileSize;
    private final int maxFiles;
    private final boolean instantFlush;

    private FileChannel channel;
    private long size;
    private long rotations;
    private long rotationFailures;
    /** Size the active file must reach before rotation is retried after a failure; 0 when not backing off. */
    private long retryRotationAtSize;
    private boolean closed;

    /**
     * Creates the directory if needed and opens (or creates) the active file.
     *
     * @param directory    directory holding the active file and its backups
     * @param baseName     file base name without extension
     * @param maxFileSize  soft rotation threshold in bytes
     * @param maxFiles     number of backups to retain
     * @param instantFlush if true, every write is forced to the device before returning
     * @throws IOException if the directory or the active file cannot be created
     */
    public FileSink(Path directory, String baseName, long maxFileSize, int maxFiles,
                    boolean instantFlush) throws IOException {
        if (maxFileSize <= 0) {
            throw new IllegalArgumentException("maxFileSize must be positive, got " + maxFileSize);
        }
        if (maxFiles < 1) {
            throw new IllegalArgumentException("maxFiles must be at least 1, got " + maxFiles);
        }
        this.directory = directory;
        this.baseName = baseName;
        this.activePath = directory.resolve(RotationPolicy.activeFileName(baseName));
        this.maxFileSize = maxFileSize;
        this.maxFiles = maxFiles;
        this.instantFlush = instantFlush;

        Files.createDirectories(directory);
        LOG.debug("Created/verified log directory: {}", directory);
        openActive();
        LOG.info("FileSink opened: path={}, size={} bytes, maxFileSize={}, maxFiles={}, instantFlush={}",
                activePath, size, maxFileSize, maxFiles, instantFlush);
    }

    @Override
    public void write(String line) throws IOException {
        if (closed) {
            throw new IOException("FileSink is closed: " + activePath);
        }
        byte[] payload = line.getBytes(StandardCharsets.UTF_8);
        long incoming = payload.length + LINE_TERMINATOR.length;

        if (channel == null) {
            // A previous reopen failed; try again before giving up on this line
            openActive();
        }

        // An empty active file is never rotated: the line goes in whole regardless of size
        if (size > 0 && size >= retryRotationAtSize && RotationPolicy.shouldRotate(size, incoming, maxFileSize)) {
            rotate();
        }

        ByteBuffer buf = ByteBuffer.allocate(payload.length + LINE_TERMINATOR.length);
        buf.put(payload);
        buf.put(LINE_TERMINATOR);
        buf.flip();
        while (buf.hasRemaining()) {
            size += channel.write(buf);
        }

        if (instantFlush) {
            channel.force(false);
        }
        LOG.trace("Wrote {} bytes to {}, size now {}", incoming, activePath, size);
    }

    @Override
    public void flush() throws IOException {
        if (channel != null && channel.isOpen()) {
            channel.force(false);
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (channel != null) {
            try {
                channel.force(false);
            } finally {
                channel.close();
                channel = null;
            }
        }
        LOG.debug("FileSink closed: {}", activePath);
    }

    /**
     * Rotates the active file now, regardless of its size.
     * <p>
     * Never throws for a failed delete or rename; see the class notes. Only a
     * failure to reopen the active file afterwards is reported. An explicit call
     * ignores any backoff left by an earlier failure.
     *
     * @throws IOException if the active file cannot be reopened
     */
    public void rotate() throws IOException {
        if (closed) {
            throw new IOException("FileSink is closed: " + activePath);
        }
        closeActive();
        boolean failed = false;
        try {
            SortedSet<Integer> backups = existingBackups();
            RotationPlan plan = RotationPolicy.planRotation(baseName, backups, maxFiles);
            LOG.debug("Rotating {} ({} bytes): {} deletions, {} renames",
                    activePath, size, plan.deletions().size(), plan.renames().size());
            execute(plan);
            rotations++;
            retryRotationAtSize = 0;
            LOG.info("Rotated {}: {} backups retained", activePath, backups.headSet(maxFiles).size() + 1);
        } catch (IOException e) {
            failed = true;
            rotationFailures++;
            if (rotationFailures == 1 || rotationFailures % WARN_EVERY == 0) {
                LOG.warn("Rotation of {} failed ({} so far), continuing on the active file: {}",
                        activePath, rotationFailures, e.toString());
            } else {
                LOG.debug("Rotation of {} failed again: {}", activePath, e.toString());
            }
        }
        openActive();
        if (failed) {
            retryRotationAtSize = maxFileSize > Long.MAX_VALUE - size ? Long.MAX_VALUE : size + maxFileSize;
            LOG.debug("Next rotation attempt for {} at {} bytes", activePath, retryRotationAtSize);
        }
    }

    /** Path of the active file. */
    public Path activePath() {
        return activePath;
    }

    /** Cached size of the active file in bytes. */
    public long size() {
        return size;
    }

    /** Number of completed rotations since this sink was opened. */
    public long rotations() {
        return rotations;
    }

    /** Number of rotations that failed and left the active file in place. */
    public long rotationFailures() {
        return rotationFailures;
    }

    /**
     * Lists the backup suffixes currently present in the directory.
     */
    SortedSet<Integer> existingBackups() throws IOException {
        SortedSet<Integer> suffixes = new TreeSet<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                OptionalInt suffix = RotationPolicy.parseBackupSuffix(baseName, entry.getFileName().toString());
                if (suffix.isPresent()) {
                    suffixes.add(suffix.getAsInt());
                }
            }
        }
        return suffixes;
    }

    private void execute(RotationPlan plan) throws IOException {
        for (String name : plan.deletions()) {
            Files.deleteIfExists(directory.resolve(name));
            LOG.trace("Deleted backup {}", name);
        }
        for (RotationPlan.Rename rename : plan.renames()) {
            // No REPLACE_EXISTING: an unexpected target aborts the rotation instead of destroying it
            Files.move(directory.resolve(rename.source()), directory.resolve(rename.target()));
            LOG.trace("Renamed {} -> {}", rename.source(), rename.target());
        }
    }

    private void openActive() throws IOException {
        channel = FileChannel.open(activePath,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.APPEND);
        size = channel.size();
    }

    private void closeActive() {
        if (channel == null) {
            return;
        }
        try {
            channel.force(false);
        } catch (IOException e) {
            LOG.warn("Could not force {} before rotation: {}", activePath, e.getMessage());
        } finally {
            try {
                channel.close();
            } catch (IOException e) {
                LOG.warn("Could not close {} before rotation: {}", activePath, e.getMessage());
            }
            channel = null;
        }
    }
}
