package ai.pipestream.filevault.storage;

import io.smallrye.mutiny.Uni;

import java.nio.ByteBuffer;

/**
 * An exclusively opened file receiving an upload, written strictly in call order.
 */
public interface FileSink {

    /**
     * Write all remaining bytes of the buffer.
     *
     * @return Uni completing once the bytes were handed to the filesystem
     */
    Uni<Void> write(ByteBuffer data);

    /**
     * Flush to stable storage and close.
     */
    Uni<Void> close();

    /**
     * Close without flushing, ignoring errors. Used on abandoned uploads.
     */
    void abort();

    long bytesWritten();
}
