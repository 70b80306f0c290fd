package ai.pipestream.filevault.node;

import ai.pipestream.filevault.exception.FileVaultException;
import ai.pipestream.filevault.exception.StorageExhaustedException;
import ai.pipestream.filevault.exception.StorageFailureException;
import ai.pipestream.filevault.exception.UploadCancelledException;
import ai.pipestream.filevault.storage.StorageFailures;
import io.grpc.Status;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CancellationException;

/**
 * Maps raw failures from storage pipelines onto the {@link FileVaultException} family.
 */
final class OperationFailures {

    private static final Logger LOG = Logger.getLogger(OperationFailures.class);

    private OperationFailures() {
    }

    /**
     * Whether a failure means the caller went away rather than something broke.
     */
    static boolean isCancellation(Throwable failure) {
        if (failure instanceof UploadCancelledException || failure instanceof CancellationException) {
            return true;
        }
        return Status.fromThrowable(failure).getCode() == Status.Code.CANCELLED;
    }

    static FileVaultException classify(String operation, String objectId, Throwable failure) {
        if (failure instanceof FileVaultException) {
            LOG.errorf(failure, "%s failed for objectId: %s", operation, objectId);
            return (FileVaultException) failure;
        }
        IOException io = ioCause(failure);
        if (io != null) {
            if (StorageFailures.isOutOfSpace(io)) {
                LOG.errorf(io, "Insufficient disk space during %s for objectId: %s", operation, objectId);
                return new StorageExhaustedException(operation, io);
            }
            LOG.errorf(io, "IO error during %s for objectId: %s", operation, objectId);
            return StorageFailureException.io(operation, io);
        }
        LOG.errorf(failure, "Unexpected error during %s for objectId: %s", operation, objectId);
        return StorageFailureException.unexpected(operation, failure);
    }

    static IOException ioCause(Throwable failure) {
        if (failure instanceof UncheckedIOException) {
            return ((UncheckedIOException) failure).getCause();
        }
        if (failure instanceof IOException) {
            return (IOException) failure;
        }
        return null;
    }
}
