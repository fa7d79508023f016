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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FileSink}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Append and size tracking</li>
 *   <li>Rotation correctness (content moves byte-for-byte to suffix 1)</li>
 *   <li>Retention bound across many rotations</li>
 *   <li>Oversized lines are never split</li>
 *   <li>Rotation failures leave the active file writable</li>
 * </ul>
 */
class FileSinkTest {

    @TempDir
    Path tempDir;

    private final List<FileSink> opened = new ArrayList<>();

    @AfterEach
    void tearDown() throws IOException {
        for (FileSink sink : opened) {
            sink.close();
        }
    }

    private FileSink open(String name, long maxFileSize, int maxFiles) throws IOException {
        return open(tempDir, name, maxFileSize, maxFiles, false);
    }

    private FileSink open(Path dir, String name, long maxFileSize, int maxFiles, boolean instantFlush)
            throws IOException {
        FileSink sink = new FileSink(dir, name, maxFileSize, maxFiles, instantFlush);
        opened.add(sink);
        return sink;
    }

    private String read(String fileName) throws IOException {
        return Files.readString(tempDir.resolve(fileName), StandardCharsets.UTF_8);
    }

    /** A line of exactly {@code bytes} bytes including the terminator. */
    private static String line(String tag, int bytes) {
        StringBuilder sb = new StringBuilder(tag);
        while (sb.length() < bytes - 1) {
            sb.append('.');
        }
        return sb.toString();
    }

    private List<Integer> backups(FileSink sink) throws IOException {
        return new ArrayList<>(sink.existingBackups());
    }

    // ========================================================================
    // Basic Writes
    // ========================================================================

    @Nested
    @DisplayName("Basic writes")
    class BasicWriteTests {

        @Test
        @DisplayName("Opening creates directory and empty active file")
        void testOpen_CreatesDirectoryAndFile() throws Exception {
            Path dir = tempDir.resolve("nested").resolve("logs");

            FileSink sink = open(dir, "app", 1024, 3, false);

            assertTrue(Files.isDirectory(dir));
            assertTrue(Files.exists(dir.resolve("app.log")));
            assertEquals(dir.resolve("app.log"), sink.activePath());
            assertEquals(0, sink.size());
        }

        @Test
        @DisplayName("Each write appends the line and a newline")
        void testWrite_AppendsWithTerminator() throws Exception {
            FileSink sink = open("app", 1024, 3);

            sink.write("first");
            sink.write("second");

            assertEquals("first\nsecond\n", read("app.log"));
            assertEquals(13, sink.size());
        }

        @Test
        @DisplayName("Size counts UTF-8 bytes, not characters")
        void testWrite_SizeInBytes() throws Exception {
            FileSink sink = open("app", 1024, 3);

            sink.write("héllo €");

            long expected = "héllo €\n".getBytes(StandardCharsets.UTF_8).length;
            assertEquals(expected, sink.size());
            assertEquals(expected, Files.size(sink.activePath()));
        }

        @Test
        @DisplayName("Reopening an existing file appends and resynchronises size")
        void testOpen_ExistingFileAppends() throws Exception {
            Files.writeString(tempDir.resolve("app.log"), "old content\n");

            FileSink sink = open("app", 1024, 3);
            assertEquals(12, sink.size());

            sink.write("new");
            assertEquals("old content\nnew\n", read("app.log"));
            assertEquals(16, sink.size());
        }

        @Test
        @DisplayName("Instant flush writes are readable immediately")
        void testWrite_InstantFlush() throws Exception {
            FileSink sink = open(tempDir, "app", 1024, 3, true);

            sink.write("durable");

            assertEquals("durable\n", read("app.log"));
        }

        @Test
        @DisplayName("Write after close fails")
        void testWrite_AfterClose() throws Exception {
            FileSink sink = open("app", 1024, 3);
            sink.close();

            assertThrows(IOException.class, () -> sink.write("too late"));
            assertThrows(IOException.class, sink::rotate);
        }

        @Test
        @DisplayName("Close is idempotent")
        void testClose_Idempotent() throws Exception {
            FileSink sink = open("app", 1024, 3);
            sink.write("x");

            sink.close();
            assertDoesNotThrow(sink::close);
        }

        @Test
        @DisplayName("Invalid limits are rejected")
        void testConstructor_InvalidLimits() {
            assertThrows(IllegalArgumentException.class, () -> new FileSink(tempDir, "a", 0, 3, false));
            assertThrows(IllegalArgumentException.class, () -> new FileSink(tempDir, "a", 100, 0, false));
        }

        @Test
        @DisplayName("Directory that cannot be created fails construction")
        void testConstructor_DirectoryBlockedByFile() throws Exception {
            Path blocker = tempDir.resolve("blocker");
            Files.writeString(blocker, "not a directory");

            assertThrows(IOException.class, () -> new FileSink(blocker.resolve("logs"), "a", 100, 3, false));
        }
    }

    // ========================================================================
    // Rotation
    // ========================================================================

    @Nested
    @DisplayName("Rotation")
    class RotationTests {

        @Test
        @DisplayName("Crossing the threshold once moves prior content to .1 byte-for-byte")
        void testRotation_MovesContentToFirstBackup() throws Exception {
            FileSink sink = open("app", 100, 3);
            sink.write(line("a", 40));
            sink.write(line("b", 40));
            String before = read("app.log");

            sink.write(line("c", 40));

            assertEquals(before, read("app.1.log"));
            assertEquals(line("c", 40) + "\n", read("app.log"));
            assertEquals(40, sink.size());
            assertEquals(List.of(1), backups(sink));
            assertEquals(1, sink.rotations());
        }

        @Test
        @DisplayName("Filling exactly to the threshold does not rotate")
        void testRotation_ExactFitStays() throws Exception {
            FileSink sink = open("app", 100, 3);
            for (int i = 0; i < 5; i++) {
                sink.write(line("x" + i, 20));
            }

            assertEquals(100, sink.size());
            assertEquals(0, sink.rotations());
            assertFalse(Files.exists(tempDir.resolve("app.1.log")));
        }

        @Test
        @DisplayName("Scenario: 100 byte limit, 2 backups, six 34-byte lines")
        void testRotation_Scenario() throws Exception {
            FileSink sink = open("t", 100, 2);
            List<String> lines = new ArrayList<>();
            for (int i = 1; i <= 6; i++) {
                lines.add(line("line-" + i, 34));
            }

            for (String l : lines) {
                sink.write(l);
            }

            assertEquals(lines.get(4) + "\n" + lines.get(5) + "\n", read("t.log"));
            assertEquals(lines.get(2) + "\n" + lines.get(3) + "\n", read("t.1.log"));
            assertEquals(lines.get(0) + "\n" + lines.get(1) + "\n", read("t.2.log"));
            assertFalse(Files.exists(tempDir.resolve("t.3.log")));
        }

        @Test
        @DisplayName("Retention: never more than maxFiles backups, suffix 1 is newest")
        void testRotation_RetentionBound() throws Exception {
            int maxFiles = 3;
            // Each 7-byte line forces a rotation on the next write
            FileSink sink = open("gen", 10, maxFiles);

            for (int i = 0; i < 20; i++) {
                sink.write(String.format("gen-%02d", i));
                assertTrue(backups(sink).size() <= maxFiles, "too many backups after write " + i);
            }

            assertEquals(List.of(1, 2, 3), backups(sink));
            assertEquals("gen-19\n", read("gen.log"));
            assertEquals("gen-18\n", read("gen.1.log"));
            assertEquals("gen-17\n", read("gen.2.log"));
            assertEquals("gen-16\n", read("gen.3.log"));
            assertEquals(19, sink.rotations());
        }

        @Test
        @DisplayName("Explicit rotate() with an empty active file still produces a contiguous set")
        void testRotate_Explicit() throws Exception {
            FileSink sink = open("app", 1000, 2);
            sink.write("one");
            sink.rotate();
            sink.write("two");
            sink.rotate();
            sink.write("three");
            sink.rotate();

            assertEquals(List.of(1, 2), backups(sink));
            assertEquals("three\n", read("app.1.log"));
            assertEquals("two\n", read("app.2.log"));
            assertEquals("", read("app.log"));
            assertEquals(0, sink.size());
        }

        @Test
        @DisplayName("Stale backups beyond maxFiles are evicted on the next rotation")
        void testRotation_EvictsStaleBackups() throws Exception {
            for (int i = 1; i <= 5; i++) {
                Files.writeString(tempDir.resolve("app." + i + ".log"), "old-" + i + "\n");
            }
            FileSink sink = open("app", 1000, 2);
            sink.write("current");

            sink.rotate();

            assertEquals(List.of(1, 2), backups(sink));
            assertEquals("current\n", read("app.1.log"));
            assertEquals("old-1\n", read("app.2.log"));
        }

        @Test
        @DisplayName("Unrelated files in the directory are left alone")
        void testRotation_IgnoresOtherFiles() throws Exception {
            Files.writeString(tempDir.resolve("other.1.log"), "keep");
            Files.writeString(tempDir.resolve("app.txt"), "keep");
            FileSink sink = open("app", 1000, 1);
            sink.write("x");

            sink.rotate();
            sink.write("y");
            sink.rotate();

            assertEquals("keep", read("other.1.log"));
            assertEquals("keep", read("app.txt"));
            assertEquals("y\n", read("app.1.log"));
        }
    }

    // ========================================================================
    // Oversized Lines
    // ========================================================================

    @Nested
    @DisplayName("Oversized lines")
    class OversizedLineTests {

        @Test
        @DisplayName("Oversized line into an empty file is written whole without rotating")
        void testOversized_EmptyFile() throws Exception {
            FileSink sink = open("app", 50, 3);
            String big = line("big", 500);

            sink.write(big);

            assertEquals(big + "\n", read("app.log"));
            assertEquals(500, sink.size());
            assertEquals(0, sink.rotations());
        }

        @Test
        @DisplayName("Oversized line after content rotates first, then is written whole")
        void testOversized_AfterContent() throws Exception {
            FileSink sink = open("app", 50, 3);
            sink.write("small");
            String big = line("big", 500);

            sink.write(big);

            assertEquals("small\n", read("app.1.log"));
            assertEquals(big + "\n", read("app.log"));
        }

        @Test
        @DisplayName("Line after an oversized one rotates it out")
        void testOversized_NextLineRotates() throws Exception {
            FileSink sink = open("app", 50, 3);
            String big = line("big", 500);
            sink.write(big);

            sink.write("next");

            assertEquals(big + "\n", read("app.1.log"));
            assertEquals("next\n", read("app.log"));
        }
    }

    // ========================================================================
    // Rotation Failures
    // ========================================================================

    @Nested
    @DisplayName("Rotation failures")
    class RotationFailureTests {

        @Test
        @DisplayName("Failed eviction keeps logging on the active file")
        void testRotationFailure_ActiveStaysWritable() throws Exception {
            // A non-empty directory named like the oldest backup cannot be deleted
            Path blocker = tempDir.resolve("app.1.log");
            Files.createDirectory(blocker);
            Files.writeString(blocker.resolve("pin"), "x");

            FileSink sink = open("app", 20, 1);
            for (int i = 0; i < 5; i++) {
                sink.write("line-" + i + "-padding");
            }

            assertTrue(sink.rotationFailures() > 0);
            assertEquals(0, sink.rotations());
            String content = read("app.log");
            for (int i = 0; i < 5; i++) {
                assertTrue(content.contains("line-" + i + "-padding\n"), "missing line " + i);
            }
            assertEquals(Files.size(sink.activePath()), sink.size());
        }

        @Test
        @DisplayName("Rotation resumes once the obstacle is gone")
        void testRotationFailure_Recovers() throws Exception {
            Path blocker = tempDir.resolve("app.1.log");
            Files.createDirectory(blocker);
            Files.writeString(blocker.resolve("pin"), "x");

            FileSink sink = open("app", 20, 1);
            sink.write("aaaaaaaaaaaaaaa");
            sink.write("bbbbbbbbbbbbbbb");
            assertTrue(sink.rotationFailures() > 0);

            Files.delete(blocker.resolve("pin"));
            Files.delete(blocker);
            // Failure at 16 bytes defers the next attempt until 36 bytes
            sink.write("ccccccccccccccc");
            assertEquals(0, sink.rotations());
            sink.write("ddddddddddddddd");

            assertEquals(1, sink.rotations());
            assertEquals("aaaaaaaaaaaaaaa\nbbbbbbbbbbbbbbb\nccccccccccccccc\n", read("app.1.log"));
            assertEquals("ddddddddddddddd\n", read("app.log"));
        }

        @Test
        @DisplayName("After a failure rotation is retried once per maxFileSize of growth, not on every write")
        void testRotationFailure_BacksOff() throws Exception {
            Path blocker = tempDir.resolve("app.1.log");
            Files.createDirectory(blocker);
            Files.writeString(blocker.resolve("pin"), "x");

            // 10-byte lines, threshold 100: attempts at 100, 200, ..., 1900 bytes
            FileSink sink = open("app", 100, 1);
            for (int i = 0; i < 200; i++) {
                sink.write(String.format("line-%04d", i));
            }

            assertEquals(19, sink.rotationFailures());
            assertEquals(0, sink.rotations());
            assertEquals(2000, sink.size());
            assertEquals(2000, Files.size(sink.activePath()));

            Files.delete(blocker.resolve("pin"));
            Files.delete(blocker);
            sink.write("line-0200");

            assertEquals(1, sink.rotations());
            assertEquals(2000, Files.size(tempDir.resolve("app.1.log")));
            assertEquals("line-0200\n", read("app.log"));
        }

        @Test
        @DisplayName("Explicit rotate ignores the backoff")
        void testRotationFailure_ExplicitRotateRetries() throws Exception {
            Path blocker = tempDir.resolve("app.1.log");
            Files.createDirectory(blocker);
            Files.writeString(blocker.resolve("pin"), "x");

            FileSink sink = open("app", 20, 1);
            sink.write("aaaaaaaaaaaaaaa");
            sink.write("bbbbbbbbbbbbbbb");
            assertEquals(1, sink.rotationFailures());

            Files.delete(blocker.resolve("pin"));
            Files.delete(blocker);
            sink.rotate();

            assertEquals(1, sink.rotations());
            assertEquals(0, Files.size(sink.activePath()));
            sink.write("ccccccccccccccc");
            sink.write("ddddddddddddddd");
            assertEquals(2, sink.rotations());
        }

        @Test
        @DisplayName("Failed eviction leaves existing backups untouched")
        void testRotationFailure_BackupsUntouched() throws Exception {
            // Non-empty directory in the eviction slot aborts the plan before any rename
            Files.writeString(tempDir.resolve("app.1.log"), "precious\n");
            Path evictionSlot = tempDir.resolve("app.2.log");
            Files.createDirectory(evictionSlot);
            Files.writeString(evictionSlot.resolve("pin"), "x");

            FileSink sink = open("app", 1000, 2);
            sink.write("active");
            sink.rotate();

            assertEquals(1, sink.rotationFailures());
            assertEquals("precious\n", read("app.1.log"));
            assertEquals("active\n", read("app.log"));
            sink.write("more");
            assertEquals("active\nmore\n", read("app.log"));
        }
    }

    @Test
    @DisplayName("existingBackups only reports this log's suffixes")
    void testExistingBackups() throws Exception {
        Files.writeString(tempDir.resolve("app.3.log"), "");
        Files.writeString(tempDir.resolve("app.1.log"), "");
        Files.writeString(tempDir.resolve("apple.2.log"), "");
        FileSink sink = open("app", 100, 5);

        assertEquals(Set.of(1, 3), sink.existingBackups());
    }
}
