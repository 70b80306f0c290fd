package ai.pipestream.filevault.storage;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Local filesystem implementation of {@link FileStorage}.
 * <p>
 * Every call is a blocking NIO operation shifted onto the worker pool, so callers on the event
 * loop are never blocked. Files are published by hard-linking the temp file into place, which
 * fails atomically when the destination exists, then unlinking the temp name.
 * </p>
 */
public class LocalFileStorage implements FileStorage {

    private static final Logger LOG = Logger.getLogger(LocalFileStorage.class);

    private final Executor executor;

    public LocalFileStorage() {
        this(Infrastructure.getDefaultWorkerPool());
    }

    public LocalFileStorage(Executor executor) {
        this.executor = executor;
    }

    @Override
    public Uni<FileSink> openForWrite(Path path) {
        return Uni.createFrom().deferred(() -> {
            AtomicBoolean cancelled = new AtomicBoolean(false);
            AtomicReference<ChannelSink> opened = new AtomicReference<>();
            return onWorker(() -> {
                        ChannelSink sink = new ChannelSink(path,
                                FileChannel.open(path, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE));
                        opened.set(sink);
                        if (cancelled.get()) {
                            abandon(sink, path);
                        }
                        return (FileSink) sink;
                    })
                    .onCancellation().invoke(() -> {
                        cancelled.set(true);
                        ChannelSink sink = opened.get();
                        if (sink != null) {
                            abandon(sink, path);
                        }
                    });
        });
    }

    @Override
    public Multi<byte[]> read(Path path, int chunkSize) {
        if (chunkSize <= 0) {
            return Multi.createFrom().failure(new IllegalArgumentException("chunkSize must be positive"));
        }
        return Multi.createFrom().resource(
                        () -> openForRead(path),
                        channel -> Multi.createBy().repeating()
                                .uni(() -> onWorker(() -> readChunk(channel, chunkSize)))
                                .until(chunk -> chunk.length == 0))
                .withFinalizer(channel -> {
                    closeQuietly(channel, path);
                })
                .select().where(chunk -> chunk.length > 0)
                .runSubscriptionOn(executor);
    }

    @Override
    public Uni<Boolean> delete(Path path) {
        return onWorker(() -> {
            if (Files.isDirectory(path)) {
                return false;
            }
            return Files.deleteIfExists(path);
        });
    }

    @Override
    public Uni<Boolean> exists(Path path) {
        return onWorker(() -> Files.isRegularFile(path));
    }

    @Override
    public Uni<Long> size(Path path) {
        return onWorker(() -> Files.size(path));
    }

    @Override
    public Uni<Void> move(Path source, Path destination) {
        return onWorker(() -> {
            publish(source, destination);
            return null;
        });
    }

    @Override
    public Uni<Void> ensureDirectory(Path directory) {
        return onWorker(() -> {
            Files.createDirectories(directory);
            return null;
        });
    }

    @Override
    public Uni<VolumeUsage> volumeUsage(Path path) {
        return onWorker(() -> {
            boolean ready = Files.isDirectory(path) && Files.isWritable(path);
            FileStore store = Files.getFileStore(path);
            return new VolumeUsage(ready, store.getUsableSpace(), store.getTotalSpace());
        });
    }

    private static void publish(Path source, Path destination) throws IOException {
        try {
            // link(2) refuses an existing destination, rename(2) would silently replace it
            Files.createLink(destination, source);
        } catch (UnsupportedOperationException e) {
            if (Files.exists(destination)) {
                throw new FileAlreadyExistsException(destination.toString());
            }
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE);
            return;
        }
        try {
            Files.delete(source);
        } catch (IOException e) {
            // the object is already visible at its destination
            LOG.warnf(e, "Published %s but could not unlink temp file %s", destination, source);
        }
    }

    // opened for a subscriber that is gone
    private static void abandon(FileSink sink, Path path) {
        sink.abort();
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warnf(e, "Failed to remove abandoned file %s", path);
        }
    }

    private static FileChannel openForRead(Path path) {
        try {
            return FileChannel.open(path, StandardOpenOption.READ);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static byte[] readChunk(FileChannel channel, int chunkSize) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(chunkSize);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                break;
            }
        }
        return buffer.position() == chunkSize ? buffer.array() : Arrays.copyOf(buffer.array(), buffer.position());
    }

    private static void closeQuietly(FileChannel channel, Path path) {
        try {
            channel.close();
        } catch (IOException e) {
            LOG.debugf("Failed to close %s: %s", path, e.getMessage());
        }
    }

    private <T> Uni<T> onWorker(IoCall<T> call) {
        return Uni.createFrom().<T>emitter(emitter -> {
            try {
                emitter.complete(call.run());
            } catch (IOException e) {
                emitter.fail(e);
            }
        }).runSubscriptionOn(executor);
    }

    @FunctionalInterface
    private interface IoCall<T> {
        T run() throws IOException;
    }

    private final class ChannelSink implements FileSink {

        private final Path path;
        private final FileChannel channel;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private volatile long bytesWritten;

        ChannelSink(Path path, FileChannel channel) {
            this.path = path;
            this.channel = channel;
        }

        @Override
        public Uni<Void> write(ByteBuffer data) {
            return onWorker(() -> {
                long written = 0;
                while (data.hasRemaining()) {
                    written += channel.write(data);
                }
                bytesWritten += written;
                return null;
            });
        }

        @Override
        public Uni<Void> close() {
            return onWorker(() -> {
                if (closed.compareAndSet(false, true)) {
                    try {
                        channel.force(true);
                    } finally {
                        channel.close();
                    }
                }
                return null;
            });
        }

        @Override
        public void abort() {
            if (closed.compareAndSet(false, true)) {
                try {
                    channel.close();
                } catch (IOException e) {
                    LOG.debugf("Failed to close abandoned sink %s: %s", path, e.getMessage());
                }
            }
        }

        @Override
        public long bytesWritten() {
            return bytesWritten;
        }
    }
}
