package ai.pipestream.filevault.exception;

/**
 * Thrown when the storage volume rejects a write for lack of space or quota.
 * Callers are expected to back off rather than retry immediately.
 */
public class StorageExhaustedException extends FileVaultException {

    public StorageExhaustedException(String operation, Throwable cause) {
        super("STORAGE_EXHAUSTED", operation, "Insufficient disk space", cause);
    }
}
