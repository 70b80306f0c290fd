package ai.pipestream.filevault.exception;

/**
 * Thrown when a resolved object path does not exist.
 */
public class ObjectNotFoundException extends FileVaultException {

    public ObjectNotFoundException(String operation, String location) {
        super("OBJECT_NOT_FOUND", operation, "File not found: " + location);
    }

    public ObjectNotFoundException(String operation, String location, Throwable cause) {
        super("OBJECT_NOT_FOUND", operation, "File not found: " + location, cause);
    }
}
