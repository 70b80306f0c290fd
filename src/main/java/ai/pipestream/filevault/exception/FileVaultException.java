package ai.pipestream.filevault.exception;

/**
 * Base exception for node agent operations.
 * Carries a stable error code and the operation that failed so the gRPC layer can classify it.
 */
public class FileVaultException extends RuntimeException {

    private final String errorCode;
    private final String operation;

    public FileVaultException(String errorCode, String operation, String message) {
        super(String.format("[%s] %s: %s", errorCode, operation, message));
        this.errorCode = errorCode;
        this.operation = operation;
    }

    public FileVaultException(String errorCode, String operation, String message, Throwable cause) {
        super(String.format("[%s] %s: %s", errorCode, operation, message), cause);
        this.errorCode = errorCode;
        this.operation = operation;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getOperation() {
        return operation;
    }
}
