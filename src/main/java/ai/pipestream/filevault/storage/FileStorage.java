package ai.pipestream.filevault.storage;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import java.nio.file.Path;

/**
 * Asynchronous filesystem primitives used by the upload, download and delete pipelines.
 * <p>
 * Implementations must never block the caller's thread; failures surface as the
 * {@link java.io.IOException} reported by the underlying filesystem.
 * </p>
 */
public interface FileStorage {

    /**
     * Create a new file for writing. Fails if the file already exists.
     * Cancelling before the sink is delivered closes and removes the file.
     *
     * @param path file to create
     * @return Uni emitting the open sink
     */
    Uni<FileSink> openForWrite(Path path);

    /**
     * Stream a file in order, in chunks of at most {@code chunkSize} bytes.
     * An empty file produces no chunks.
     *
     * @param path      file to read
     * @param chunkSize maximum bytes per emitted chunk
     * @return Multi of chunks, closing the file on completion, failure or cancellation
     */
    Multi<byte[]> read(Path path, int chunkSize);

    /**
     * Delete a regular file.
     *
     * @return Uni emitting true if a file was removed, false if there was none
     */
    Uni<Boolean> delete(Path path);

    Uni<Boolean> exists(Path path);

    Uni<Long> size(Path path);

    /**
     * Atomically publish {@code source} at {@code destination} on the same volume.
     * Never replaces an existing destination; fails with
     * {@link java.nio.file.FileAlreadyExistsException} instead.
     */
    Uni<Void> move(Path source, Path destination);

    /**
     * Create a directory and any missing parents.
     */
    Uni<Void> ensureDirectory(Path directory);

    /**
     * Readiness and capacity of the volume holding {@code path}.
     */
    Uni<VolumeUsage> volumeUsage(Path path);
}
