package ai.pipestream.filevault.node;

import ai.pipestream.filevault.concurrency.ConcurrencyAdmission;
import ai.pipestream.filevault.exception.ObjectNotFoundException;
import ai.pipestream.filevault.node.v1.ChunkData;
import ai.pipestream.filevault.node.v1.DownloadRequest;
import ai.pipestream.filevault.storage.FileStorage;
import ai.pipestream.filevault.storage.ObjectPathMapper;
import com.google.protobuf.UnsafeByteOperations;
import io.smallrye.mutiny.Multi;
import org.jboss.logging.Logger;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streams a stored object back to the caller in bounded chunks.
 * <p>
 * Holds a download slot for the lifetime of the stream. Chunks are read lazily, so a slow
 * consumer slows the reads down instead of buffering the whole file. The file handle and the slot
 * are released on completion, failure and cancellation alike.
 * </p>
 */
public class DownloadStreamer {

    private static final Logger LOG = Logger.getLogger(DownloadStreamer.class);
    private static final String OPERATION = "download";

    private final ObjectPathMapper paths;
    private final TargetResolver resolver;
    private final FileStorage storage;
    private final ConcurrencyAdmission admission;
    private final NodeAgentMetrics metrics;
    private final int chunkSizeBytes;

    public DownloadStreamer(ObjectPathMapper paths,
                            FileStorage storage,
                            ConcurrencyAdmission admission,
                            NodeAgentMetrics metrics,
                            int chunkSizeBytes) {
        if (chunkSizeBytes <= 0) {
            throw new IllegalArgumentException("chunkSizeBytes must be positive, got " + chunkSizeBytes);
        }
        this.paths = paths;
        this.resolver = new TargetResolver(paths);
        this.storage = storage;
        this.admission = admission;
        this.metrics = metrics;
        this.chunkSizeBytes = chunkSizeBytes;
    }

    /**
     * Stream the object addressed by the request.
     *
     * @param request object id or final path
     * @return Multi of chunks, failing with {@link ObjectNotFoundException} if there is no such file
     */
    public Multi<ChunkData> download(DownloadRequest request) {
        return admission.acquireDownload()
                .onItem().transformToMulti(slot -> stream(request).onTermination().invoke(slot::release));
    }

    private Multi<ChunkData> stream(DownloadRequest request) {
        return Multi.createFrom().deferred(() -> {
            Path target = resolver.resolve(request.getObjectId(), request.getFinalPath(), OPERATION);
            String objectId = request.getObjectId();
            String location = paths.relativize(target);
            AtomicLong bytesSent = new AtomicLong();

            return storage.exists(target)
                    .onItem().transformToMulti(found -> {
                        if (!found) {
                            LOG.warnf("File not found for download: %s", target);
                            metrics.recordDownloadNotFound();
                            return Multi.createFrom().<byte[]>failure(new ObjectNotFoundException(OPERATION, location));
                        }
                        LOG.infof("Starting download for objectId: %s, path: %s", objectId, location);
                        return storage.read(target, chunkSizeBytes);
                    })
                    .onItem().transform(bytes -> {
                        bytesSent.addAndGet(bytes.length);
                        return ChunkData.newBuilder().setData(UnsafeByteOperations.unsafeWrap(bytes)).build();
                    })
                    .onCompletion().invoke(() -> {
                        metrics.recordDownloadCompleted(bytesSent.get());
                        LOG.infof("Download completed for objectId: %s, bytes sent: %d", objectId, bytesSent.get());
                    })
                    .onCancellation().invoke(() ->
                            LOG.warnf("Download cancelled for objectId: %s after %d bytes", objectId, bytesSent.get()))
                    .onFailure().transform(failure -> classify(failure, objectId, location));
        });
    }

    private Throwable classify(Throwable failure, String objectId, String location) {
        if (failure instanceof ObjectNotFoundException) {
            return failure;
        }
        // removed between the existence check and the open
        if (OperationFailures.ioCause(failure) instanceof NoSuchFileException) {
            metrics.recordDownloadNotFound();
            return new ObjectNotFoundException(OPERATION, location, failure);
        }
        return OperationFailures.classify(OPERATION, objectId, failure);
    }
}
