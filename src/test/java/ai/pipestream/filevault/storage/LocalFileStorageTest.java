package ai.pipestream.filevault.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests LocalFileStorage against a real temporary directory.
 */
class LocalFileStorageTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path dir;

    private final LocalFileStorage storage = new LocalFileStorage();

    @Test
    void testWriteThenReadInChunks() throws Exception {
        Path file = dir.resolve("data.bin");
        FileSink sink = storage.openForWrite(file).await().atMost(TIMEOUT);
        sink.write(ByteBuffer.wrap("0123".getBytes(StandardCharsets.UTF_8))).await().atMost(TIMEOUT);
        sink.write(ByteBuffer.wrap("456789".getBytes(StandardCharsets.UTF_8))).await().atMost(TIMEOUT);
        sink.close().await().atMost(TIMEOUT);

        assertEquals(10, sink.bytesWritten());
        assertEquals("0123456789", Files.readString(file));

        List<byte[]> chunks = storage.read(file, 4).collect().asList().await().atMost(TIMEOUT);

        assertEquals(3, chunks.size());
        assertEquals("0123", new String(chunks.get(0), StandardCharsets.UTF_8));
        assertEquals("4567", new String(chunks.get(1), StandardCharsets.UTF_8));
        assertEquals("89", new String(chunks.get(2), StandardCharsets.UTF_8));
    }

    @Test
    void testEmptyFileProducesNoChunks() throws Exception {
        Path file = Files.createFile(dir.resolve("empty.bin"));

        List<byte[]> chunks = storage.read(file, 4).collect().asList().await().atMost(TIMEOUT);

        assertTrue(chunks.isEmpty());
    }

    @Test
    void testReadMissingFileFails() {
        UncheckedIOException ex = assertThrows(UncheckedIOException.class, () ->
                storage.read(dir.resolve("missing"), 4).collect().asList().await().atMost(TIMEOUT));
        assertInstanceOf(NoSuchFileException.class, ex.getCause());
    }

    @Test
    void testOpenForWriteRefusesExistingFile() throws Exception {
        Path file = Files.writeString(dir.resolve("taken"), "original");

        CompletionException ex = assertThrows(CompletionException.class, () ->
                storage.openForWrite(file).await().atMost(TIMEOUT));

        assertInstanceOf(FileAlreadyExistsException.class, ex.getCause());
        assertEquals("original", Files.readString(file));
    }

    @Test
    void testMovePublishesAndRemovesSource() throws Exception {
        Path source = Files.writeString(dir.resolve("upload.tmp"), "payload");
        Path destination = dir.resolve("final");

        storage.move(source, destination).await().atMost(TIMEOUT);

        assertFalse(Files.exists(source));
        assertEquals("payload", Files.readString(destination));
    }

    @Test
    void testMoveNeverReplacesExistingDestination() throws Exception {
        Path source = Files.writeString(dir.resolve("upload.tmp"), "new");
        Path destination = Files.writeString(dir.resolve("final"), "old");

        CompletionException ex = assertThrows(CompletionException.class, () ->
                storage.move(source, destination).await().atMost(TIMEOUT));

        assertInstanceOf(FileAlreadyExistsException.class, ex.getCause());
        assertEquals("old", Files.readString(destination));
        assertEquals("new", Files.readString(source));
    }

    @Test
    void testDeleteReportsWhetherAFileWasRemoved() throws Exception {
        Path file = Files.writeString(dir.resolve("victim"), "x");

        assertTrue(storage.delete(file).await().atMost(TIMEOUT));
        assertFalse(storage.delete(file).await().atMost(TIMEOUT));
        assertFalse(Files.exists(file));
    }

    @Test
    void testDirectoriesAreNotObjects() throws Exception {
        Path sub = Files.createDirectory(dir.resolve("sub"));

        assertFalse(storage.exists(sub).await().atMost(TIMEOUT));
        assertFalse(storage.delete(sub).await().atMost(TIMEOUT));
        assertTrue(Files.isDirectory(sub));
    }

    @Test
    void testEnsureDirectoryCreatesParents() {
        Path nested = dir.resolve("a").resolve("b").resolve("c");

        storage.ensureDirectory(nested).await().atMost(TIMEOUT);
        storage.ensureDirectory(nested).await().atMost(TIMEOUT);

        assertTrue(Files.isDirectory(nested));
    }

    @Test
    void testSize() throws Exception {
        Path file = Files.write(dir.resolve("sized"), new byte[1234]);

        assertEquals(1234L, storage.size(file).await().atMost(TIMEOUT));
    }

    @Test
    void testVolumeUsageOfWritableDirectory() {
        VolumeUsage usage = storage.volumeUsage(dir).await().atMost(TIMEOUT);

        assertTrue(usage.ready());
        assertTrue(usage.totalBytes() > 0);
        assertTrue(usage.freeBytes() <= usage.totalBytes());
    }

    @Test
    void testAbortedSinkLeavesFileForCaller() throws Exception {
        Path file = dir.resolve("aborted");
        FileSink sink = storage.openForWrite(file).await().atMost(TIMEOUT);
        sink.abort();
        sink.abort();

        assertTrue(Files.exists(file));
        assertTrue(storage.delete(file).await().atMost(TIMEOUT));
    }
}
