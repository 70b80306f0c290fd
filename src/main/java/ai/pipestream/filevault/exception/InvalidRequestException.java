package ai.pipestream.filevault.exception;

/**
 * Thrown when a request cannot be served as addressed.
 */
public class InvalidRequestException extends FileVaultException {

    public InvalidRequestException(String operation, String message) {
        super("INVALID_REQUEST", operation, message);
    }

    protected InvalidRequestException(String errorCode, String operation, String message) {
        super(errorCode, operation, message);
    }

    public static InvalidRequestException missingTarget(String operation) {
        return new InvalidRequestException(operation, "Either ObjectId or FinalPath must be provided");
    }

    public static InvalidRequestException invalidFinalPath(String operation, String finalPath, String reason) {
        return new InvalidRequestException(operation,
                String.format("FinalPath '%s' is invalid: %s", finalPath, reason));
    }
}
