package ai.pipestream.filevault.node;

import ai.pipestream.filevault.concurrency.ConcurrencyAdmission;
import ai.pipestream.filevault.concurrency.KeyLock;
import ai.pipestream.filevault.concurrency.KeyedLockManager;
import ai.pipestream.filevault.exception.FileVaultException;
import ai.pipestream.filevault.exception.ProtocolViolationException;
import ai.pipestream.filevault.exception.UploadCancelledException;
import ai.pipestream.filevault.node.v1.UploadMetadata;
import ai.pipestream.filevault.node.v1.UploadRequest;
import ai.pipestream.filevault.node.v1.UploadResult;
import ai.pipestream.filevault.storage.FileSink;
import ai.pipestream.filevault.storage.FileStorage;
import ai.pipestream.filevault.storage.ObjectPathMapper;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.protobuf.ByteString;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * Turns an inbound upload stream into an atomically committed file.
 * <p>
 * Per call: take an upload slot, validate the metadata unit, take the object's key lock, stream
 * payload chunks into a fresh temp file while hashing them, then publish the temp file at the
 * canonical path (or the first free {@code _N} version of it). Validation problems come back as
 * an unsuccessful {@link UploadResult}; everything else fails the {@link Uni} with a
 * {@link FileVaultException}. The slot and the lock are released exactly once whichever way the
 * call ends, and a temp file that was not published is removed.
 * </p>
 */
public class UploadCoordinator {

    private static final Logger LOG = Logger.getLogger(UploadCoordinator.class);
    private static final String OPERATION = "upload";

    static final DateTimeFormatter CREATED_AT_FORMAT = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSS'Z'")
            .withResolverStyle(ResolverStyle.STRICT);

    private final ObjectPathMapper paths;
    private final FileStorage storage;
    private final ConcurrencyAdmission admission;
    private final KeyedLockManager locks;
    private final NodeAgentMetrics metrics;

    public UploadCoordinator(ObjectPathMapper paths,
                             FileStorage storage,
                             ConcurrencyAdmission admission,
                             KeyedLockManager locks,
                             NodeAgentMetrics metrics) {
        this.paths = paths;
        this.storage = storage;
        this.admission = admission;
        this.locks = locks;
        this.metrics = metrics;
    }

    /**
     * Store one object from a stream of upload units.
     *
     * @param units metadata first, then payload chunks in order
     * @return Uni with the upload result
     */
    public Uni<UploadResult> upload(Multi<UploadRequest> units) {
        return admission.acquireUpload()
                .onItem().transformToUni(slot -> new UploadSession().run(units).eventually(slot::release));
    }

    /**
     * Check an upload's metadata unit.
     *
     * @return the reason the metadata is unacceptable, or empty if it is valid
     */
    static Optional<String> validate(UploadMetadata metadata) {
        String objectId = metadata.getObjectId();
        if (objectId.isBlank()) {
            return Optional.of("ObjectId is required");
        }
        if (!ObjectPathMapper.isSafeObjectId(objectId)) {
            return Optional.of("ObjectId must not contain path separators");
        }
        String createdAtUtc = metadata.getCreatedAtUtc();
        if (createdAtUtc.isBlank()) {
            return Optional.of("CreatedAtUtc is required");
        }
        try {
            LocalDateTime.parse(createdAtUtc, CREATED_AT_FORMAT);
        } catch (DateTimeParseException e) {
            return Optional.of("CreatedAtUtc must be in ISO-8601 format with Z suffix");
        }
        return Optional.empty();
    }

    enum UploadState {
        AWAIT_METADATA,
        STREAMING,
        FINALIZING,
        COMMITTED,
        REJECTED,
        FAILED,
        CANCELLED
    }

    /**
     * State of a single upload call. Units are handled strictly one after another.
     */
    private final class UploadSession {

        private final Hasher hasher = Hashing.sha256().newHasher();
        private volatile UploadState state = UploadState.AWAIT_METADATA;
        private String objectId;
        private long sizeBytes;

        // guarded by this, shared with the cancellation path
        private KeyLock lock;
        private Path tempPath;
        private FileSink sink;
        private boolean lockClosed;

        // set once the commit starts; the key lock and the temp file outlive a cancel until it settles
        private volatile Uni<UploadResult> publishing;

        Uni<UploadResult> run(Multi<UploadRequest> units) {
            return units
                    .onItem().transformToUniAndConcatenate(this::accept)
                    .onItem().ignoreAsUni()
                    .onItem().transformToUni(ignored -> commit())
                    .onFailure(MetadataRejected.class).recoverWithItem(this::reject)
                    .onFailure().call(this::discard)
                    .onFailure().transform(this::classify)
                    .onCancellation().invoke(this::cancel)
                    .eventually(this::releaseLock);
        }

        private Uni<Void> accept(UploadRequest unit) {
            UploadRequest.UnitCase kind = unit.getUnitCase();
            if (state == UploadState.AWAIT_METADATA) {
                switch (kind) {
                    case METADATA:
                        return begin(unit.getMetadata());
                    case CHUNK:
                        return Uni.createFrom().failure(ProtocolViolationException.chunkBeforeMetadata());
                    default:
                        return Uni.createFrom().failure(ProtocolViolationException.emptyUnit());
                }
            }
            switch (kind) {
                case CHUNK:
                    return append(unit.getChunk());
                case METADATA:
                    return Uni.createFrom().failure(ProtocolViolationException.duplicateMetadata());
                default:
                    return Uni.createFrom().failure(ProtocolViolationException.emptyUnit());
            }
        }

        private Uni<Void> begin(UploadMetadata metadata) {
            Optional<String> problem = validate(metadata);
            if (problem.isPresent()) {
                return Uni.createFrom().failure(new MetadataRejected(problem.get()));
            }
            objectId = metadata.getObjectId();
            LOG.infof("Starting upload for objectId: %s, contentType: %s, originalFilename: %s",
                    objectId, metadata.getContentType(), metadata.getOriginalFilename());

            return locks.lock(paths.lockKey(objectId))
                    .onItem().transformToUni(held -> {
                        if (!adoptLock(held)) {
                            return Uni.createFrom().failure(cancelled());
                        }
                        Path temp = paths.tempPath(objectId);
                        synchronized (this) {
                            tempPath = temp;
                        }
                        return storage.openForWrite(temp);
                    })
                    .onItem().transformToUni(this::adoptSink);
        }

        private Uni<Void> append(ByteString chunk) {
            if (chunk.isEmpty()) {
                return Uni.createFrom().voidItem();
            }
            return sink.write(chunk.asReadOnlyByteBuffer())
                    .invoke(() -> {
                        hasher.putBytes(chunk.asReadOnlyByteBuffer());
                        sizeBytes += chunk.size();
                    });
        }

        private Uni<UploadResult> commit() {
            if (state != UploadState.STREAMING) {
                return Uni.createFrom().failure(ProtocolViolationException.missingMetadata());
            }
            state = UploadState.FINALIZING;
            String checksum = hasher.hash().toString();
            Path canonical = paths.finalPath(objectId);

            Path temp = tempPath;
            // shared and never cancelled by the caller; storage calls run to completion
            Uni<UploadResult> publish = sink.close()
                    .chain(() -> chooseDestination(canonical))
                    .chain(destination -> storage.ensureDirectory(destination.getParent())
                            .chain(() -> storage.move(temp, destination))
                            .replaceWith(destination))
                    .map(destination -> committed(destination, canonical, checksum))
                    .memoize().indefinitely();
            publishing = publish;
            return publish;
        }

        /**
         * The canonical path if free, otherwise the lowest {@code _N} suffix not in use.
         */
        private Uni<Path> chooseDestination(Path canonical) {
            return storage.exists(canonical).chain(taken -> {
                if (!taken) {
                    return Uni.createFrom().item(canonical);
                }
                return Multi.createFrom().range(1, Integer.MAX_VALUE)
                        .onItem().transformToUniAndConcatenate(version -> {
                            Path candidate = paths.versionedPath(canonical, version);
                            return storage.exists(candidate)
                                    .map(exists -> exists ? Optional.<Path>empty() : Optional.of(candidate));
                        })
                        .select().where(Optional::isPresent)
                        .toUni()
                        .map(Optional::get)
                        .invoke(candidate -> LOG.infof("File exists, using versioned path: %s", candidate));
            });
        }

        private UploadResult committed(Path destination, Path canonical, String checksum) {
            synchronized (this) {
                tempPath = null;
                sink = null;
            }
            if (state == UploadState.CANCELLED) {
                LOG.warnf("Upload for objectId: %s was cancelled after publishing started; keeping %s",
                        objectId, destination);
            }
            state = UploadState.COMMITTED;
            String relativePath = paths.relativize(destination);
            metrics.recordUploadCommitted(sizeBytes, !destination.equals(canonical));
            LOG.infof("Upload completed for objectId: %s, path: %s, size: %d, checksum: %s",
                    objectId, relativePath, sizeBytes, checksum);
            return UploadResult.newBuilder()
                    .setSuccess(true)
                    .setFinalPath(relativePath)
                    .setSizeBytes(sizeBytes)
                    .setChecksum(checksum)
                    .build();
        }

        private UploadResult reject(Throwable rejection) {
            state = UploadState.REJECTED;
            metrics.recordUploadRejected();
            LOG.warnf("Upload rejected: %s", rejection.getMessage());
            return UploadResult.newBuilder()
                    .setSuccess(false)
                    .setErrorMessage(rejection.getMessage())
                    .build();
        }

        private Throwable classify(Throwable failure) {
            if (OperationFailures.isCancellation(failure)) {
                markCancelled();
                return failure instanceof UploadCancelledException ? failure : new UploadCancelledException(failure);
            }
            state = UploadState.FAILED;
            metrics.recordUploadFailed();
            if (failure instanceof ProtocolViolationException) {
                LOG.warnf("Protocol violation during upload for objectId: %s: %s", objectId, failure.getMessage());
                return failure;
            }
            return OperationFailures.classify(OPERATION, objectId, failure);
        }

        private void cancel() {
            markCancelled();
            settled().chain(() -> discard(null)).subscribe().with(
                    ignored -> { },
                    failure -> LOG.warnf(failure, "Clean-up after cancelled upload failed for objectId: %s", objectId));
        }

        private void markCancelled() {
            if (state != UploadState.CANCELLED) {
                state = UploadState.CANCELLED;
                metrics.recordUploadCancelled();
                LOG.warnf("Upload cancelled for objectId: %s", objectId);
            }
        }

        /**
         * Close and remove the temp file if it was not published. Never fails.
         */
        private Uni<Void> discard(Throwable cause) {
            Path temp;
            FileSink open;
            synchronized (this) {
                temp = tempPath;
                open = sink;
                tempPath = null;
                sink = null;
            }
            if (open != null) {
                open.abort();
            }
            if (temp == null) {
                return Uni.createFrom().voidItem();
            }
            return storage.delete(temp)
                    .invoke(deleted -> LOG.debugf("Cleaned up temp file: %s", temp))
                    .onFailure().invoke(e -> LOG.warnf(e, "Failed to clean up temp file: %s", temp))
                    .onFailure().recoverWithNull()
                    .replaceWithVoid();
        }

        private synchronized boolean adoptLock(KeyLock held) {
            if (lockClosed) {
                held.release();
                return false;
            }
            lock = held;
            return true;
        }

        private Uni<Void> adoptSink(FileSink opened) {
            synchronized (this) {
                if (state != UploadState.CANCELLED && tempPath != null) {
                    sink = opened;
                    state = UploadState.STREAMING;
                    return Uni.createFrom().voidItem();
                }
            }
            opened.abort();
            return Uni.createFrom().failure(cancelled());
        }

        /**
         * Completes once no storage call of this upload is in flight. Never fails.
         */
        private Uni<Void> settled() {
            Uni<UploadResult> inFlight = publishing;
            if (inFlight == null) {
                return Uni.createFrom().voidItem();
            }
            return inFlight.onItemOrFailure().transform((result, failure) -> null).replaceWithVoid();
        }

        private void releaseLock() {
            UploadState current = state;
            if (publishing != null && (current == UploadState.FINALIZING || current == UploadState.CANCELLED)) {
                settled().subscribe().with(ignored -> releaseLockNow());
                return;
            }
            releaseLockNow();
        }

        private void releaseLockNow() {
            KeyLock held;
            synchronized (this) {
                lockClosed = true;
                held = lock;
                lock = null;
            }
            if (held != null) {
                held.release();
            }
        }

        private UploadCancelledException cancelled() {
            return new UploadCancelledException(objectId);
        }
    }

    /**
     * Control-flow signal for metadata that fails validation; becomes an unsuccessful result.
     */
    private static final class MetadataRejected extends RuntimeException {
        MetadataRejected(String message) {
            super(message, null, false, false);
        }
    }
}
