package ai.pipestream.filevault.storage;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;

import static org.junit.jupiter.api.Assertions.*;

class StorageFailuresTest {

    @Test
    void testEnospcReasonIsOutOfSpace() {
        assertTrue(StorageFailures.isOutOfSpace(
                new FileSystemException("/data/tmp/a.uploading", null, "No space left on device")));
    }

    @Test
    void testQuotaMessageIsOutOfSpace() {
        assertTrue(StorageFailures.isOutOfSpace(new IOException("Disk quota exceeded")));
    }

    @Test
    void testNestedCauseIsInspected() {
        IOException root = new IOException("No space left on device");
        assertTrue(StorageFailures.isOutOfSpace(new UncheckedIOException("write failed", root)));
    }

    @Test
    void testLooseDiskOrSpaceMessageFallsBack() {
        assertTrue(StorageFailures.isOutOfSpace(new IOException("disk full")));
    }

    @Test
    void testUnrelatedFailuresAreNotOutOfSpace() {
        assertFalse(StorageFailures.isOutOfSpace(new AccessDeniedException("/data/x")));
        assertFalse(StorageFailures.isOutOfSpace(new IOException("Broken pipe")));
        assertFalse(StorageFailures.isOutOfSpace(new IOException()));
    }

    @Test
    void testFilePathsMentioningDiskOrSpaceAreIgnored() {
        assertFalse(StorageFailures.isOutOfSpace(new AccessDeniedException("/mnt/disk1/tmp/report_1.uploading")));
        assertFalse(StorageFailures.isOutOfSpace(
                new FileSystemException("/data/tmp/workspace.pdf_1.uploading", null, "Input/output error")));
        assertFalse(StorageFailures.isOutOfSpace(new UncheckedIOException(
                new FileSystemException("/mnt/disk1/ab/cd/a.bin", null, "Input/output error"))));
    }

    @Test
    void testReasonStillMatchesUnderDiskPath() {
        assertTrue(StorageFailures.isOutOfSpace(
                new FileSystemException("/mnt/disk1/tmp/a.uploading", null, "No space left on device")));
        assertTrue(StorageFailures.isOutOfSpace(new UncheckedIOException(
                new FileSystemException("/mnt/disk1/tmp/a.uploading", null, "No space left on device"))));
    }
}
