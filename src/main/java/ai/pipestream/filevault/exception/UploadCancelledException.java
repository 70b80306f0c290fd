package ai.pipestream.filevault.exception;

/**
 * Thrown when the caller abandons an upload before it is committed.
 */
public class UploadCancelledException extends FileVaultException {

    public UploadCancelledException(String objectId) {
        super("UPLOAD_CANCELLED", "upload", "Upload cancelled for objectId: " + objectId);
    }

    public UploadCancelledException(Throwable cause) {
        super("UPLOAD_CANCELLED", "upload", "Upload cancelled by caller", cause);
    }
}
