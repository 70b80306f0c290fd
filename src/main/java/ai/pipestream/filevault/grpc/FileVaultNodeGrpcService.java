package ai.pipestream.filevault.grpc;

import ai.pipestream.filevault.exception.FileVaultException;
import ai.pipestream.filevault.exception.InvalidRequestException;
import ai.pipestream.filevault.exception.ObjectNotFoundException;
import ai.pipestream.filevault.exception.StorageExhaustedException;
import ai.pipestream.filevault.exception.UploadCancelledException;
import ai.pipestream.filevault.node.DeletionHandler;
import ai.pipestream.filevault.node.DownloadStreamer;
import ai.pipestream.filevault.node.HealthProbe;
import ai.pipestream.filevault.node.NodeAgentMetrics;
import ai.pipestream.filevault.node.UploadCoordinator;
import ai.pipestream.filevault.node.v1.ChunkData;
import ai.pipestream.filevault.node.v1.DeleteRequest;
import ai.pipestream.filevault.node.v1.DeleteResult;
import ai.pipestream.filevault.node.v1.DownloadRequest;
import ai.pipestream.filevault.node.v1.HealthRequest;
import ai.pipestream.filevault.node.v1.MutinyFileVaultNodeGrpc;
import ai.pipestream.filevault.node.v1.NodeStatus;
import ai.pipestream.filevault.node.v1.UploadRequest;
import ai.pipestream.filevault.node.v1.UploadResult;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import io.micrometer.core.instrument.Timer;
import io.quarkus.grpc.GrpcService;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.CancellationException;

/**
 * gRPC surface of the storage node agent.
 * <p>
 * Thin adapter: each RPC delegates to its coordinator and maps domain failures onto gRPC status
 * codes. Metadata validation failures of Upload are not errors at this level; they come back as
 * an unsuccessful {@link UploadResult}.
 * </p>
 */
@GrpcService
public class FileVaultNodeGrpcService extends MutinyFileVaultNodeGrpc.FileVaultNodeImplBase {

    private static final Logger LOG = Logger.getLogger(FileVaultNodeGrpcService.class);

    /** Trailer carrying the stable error code of a failed call, e.g. {@code OBJECT_NOT_FOUND}. */
    public static final Metadata.Key<String> ERROR_CODE_KEY =
            Metadata.Key.of("filevault-error-code", Metadata.ASCII_STRING_MARSHALLER);

    /** Trailer naming the operation that failed. */
    public static final Metadata.Key<String> OPERATION_KEY =
            Metadata.Key.of("filevault-operation", Metadata.ASCII_STRING_MARSHALLER);

    @Inject
    UploadCoordinator uploadCoordinator;

    @Inject
    DownloadStreamer downloadStreamer;

    @Inject
    DeletionHandler deletionHandler;

    @Inject
    HealthProbe healthProbe;

    @Inject
    NodeAgentMetrics metrics;

    @Override
    public Uni<UploadResult> upload(Multi<UploadRequest> request) {
        Timer.Sample timerSample = metrics.startTimer();
        return uploadCoordinator.upload(request)
                .onFailure().transform(FileVaultNodeGrpcService::toStatus)
                .eventually(() -> metrics.stopUploadTimer(timerSample));
    }

    @Override
    public Multi<ChunkData> download(DownloadRequest request) {
        Timer.Sample timerSample = metrics.startTimer();
        return downloadStreamer.download(request)
                .onFailure().transform(FileVaultNodeGrpcService::toStatus)
                .onTermination().invoke(() -> metrics.stopDownloadTimer(timerSample));
    }

    @Override
    public Uni<DeleteResult> delete(DeleteRequest request) {
        Timer.Sample timerSample = metrics.startTimer();
        return deletionHandler.delete(request)
                .onFailure().transform(FileVaultNodeGrpcService::toStatus)
                .eventually(() -> metrics.stopDeleteTimer(timerSample));
    }

    @Override
    public Uni<NodeStatus> getHealth(HealthRequest request) {
        return healthProbe.probe();
    }

    static Throwable toStatus(Throwable failure) {
        if (failure instanceof StatusRuntimeException || failure instanceof StatusException) {
            return failure;
        }
        if (failure instanceof InvalidRequestException) {
            return withTrailers(Status.INVALID_ARGUMENT, failure);
        }
        if (failure instanceof ObjectNotFoundException) {
            return withTrailers(Status.NOT_FOUND, failure);
        }
        if (failure instanceof StorageExhaustedException) {
            return withTrailers(Status.RESOURCE_EXHAUSTED, failure);
        }
        if (failure instanceof UploadCancelledException || failure instanceof CancellationException) {
            return withTrailers(Status.CANCELLED, failure);
        }
        if (failure instanceof FileVaultException) {
            LOG.errorf(failure, "%s failed", ((FileVaultException) failure).getOperation());
        } else {
            LOG.errorf(failure, "Request failed");
        }
        return withTrailers(Status.INTERNAL.withCause(failure), failure);
    }

    /**
     * Status with the failure's message as description and, for domain failures, the error code
     * and operation as trailers.
     */
    private static StatusRuntimeException withTrailers(Status status, Throwable failure) {
        Metadata trailers = new Metadata();
        if (failure instanceof FileVaultException) {
            FileVaultException domainFailure = (FileVaultException) failure;
            trailers.put(ERROR_CODE_KEY, domainFailure.getErrorCode());
            trailers.put(OPERATION_KEY, domainFailure.getOperation());
        }
        return status.withDescription(failure.getMessage()).asRuntimeException(trailers);
    }
}
