package ai.pipestream.filevault.exception;

/**
 * Thrown when upload units arrive out of order: payload before metadata, metadata twice,
 * an empty unit, or a stream that ends without metadata.
 */
public class ProtocolViolationException extends InvalidRequestException {

    public ProtocolViolationException(String message) {
        super("PROTOCOL_VIOLATION", "upload", message);
    }

    public static ProtocolViolationException chunkBeforeMetadata() {
        return new ProtocolViolationException("First upload unit must be metadata, got a payload chunk");
    }

    public static ProtocolViolationException duplicateMetadata() {
        return new ProtocolViolationException("Metadata may only be sent once, as the first upload unit");
    }

    public static ProtocolViolationException emptyUnit() {
        return new ProtocolViolationException("Upload unit carries neither metadata nor a payload chunk");
    }

    public static ProtocolViolationException missingMetadata() {
        return new ProtocolViolationException("Upload stream ended before metadata was received");
    }
}
