package ai.pipestream.filevault.exception;

/**
 * Thrown for I/O and unexpected failures that have no more specific classification.
 */
public class StorageFailureException extends FileVaultException {

    public StorageFailureException(String operation, String message, Throwable cause) {
        super("STORAGE_FAILURE", operation, message, cause);
    }

    public static StorageFailureException io(String operation, Throwable cause) {
        return new StorageFailureException(operation, "IO error: " + cause.getMessage(), cause);
    }

    public static StorageFailureException unexpected(String operation, Throwable cause) {
        return new StorageFailureException(operation, "Unexpected error: " + cause.getMessage(), cause);
    }
}
