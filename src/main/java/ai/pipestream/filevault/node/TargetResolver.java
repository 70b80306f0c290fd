package ai.pipestream.filevault.node;

import ai.pipestream.filevault.exception.InvalidRequestException;
import ai.pipestream.filevault.storage.ObjectPathMapper;

import java.nio.file.Path;

/**
 * Resolves the file addressed by a download or delete request.
 * A non-blank final path wins; otherwise the object id's canonical path is used.
 */
public class TargetResolver {

    private final ObjectPathMapper paths;

    public TargetResolver(ObjectPathMapper paths) {
        this.paths = paths;
    }

    public Path resolve(String objectId, String finalPath, String operation) {
        if (finalPath != null && !finalPath.isBlank()) {
            try {
                return paths.resolveRelative(finalPath);
            } catch (IllegalArgumentException e) {
                throw InvalidRequestException.invalidFinalPath(operation, finalPath, e.getMessage());
            }
        }
        if (objectId != null && !objectId.isBlank()) {
            try {
                return paths.finalPath(objectId);
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestException(operation, e.getMessage());
            }
        }
        throw InvalidRequestException.missingTarget(operation);
    }
}
