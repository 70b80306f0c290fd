package ai.pipestream.filevault.node;

import ai.pipestream.filevault.node.v1.DeleteRequest;
import ai.pipestream.filevault.node.v1.DeleteResult;
import ai.pipestream.filevault.storage.FileStorage;
import ai.pipestream.filevault.storage.ObjectPathMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.nio.file.Path;

/**
 * Removes a stored object. Deleting an absent object is not an error.
 */
public class DeletionHandler {

    private static final Logger LOG = Logger.getLogger(DeletionHandler.class);
    private static final String OPERATION = "delete";

    private final ObjectPathMapper paths;
    private final TargetResolver resolver;
    private final FileStorage storage;
    private final NodeAgentMetrics metrics;

    public DeletionHandler(ObjectPathMapper paths, FileStorage storage, NodeAgentMetrics metrics) {
        this.paths = paths;
        this.resolver = new TargetResolver(paths);
        this.storage = storage;
        this.metrics = metrics;
    }

    public Uni<DeleteResult> delete(DeleteRequest request) {
        return Uni.createFrom().deferred(() -> {
            Path target = resolver.resolve(request.getObjectId(), request.getFinalPath(), OPERATION);
            String location = paths.relativize(target);
            return storage.delete(target)
                    .invoke(deleted -> {
                        metrics.recordDelete(deleted);
                        if (deleted) {
                            LOG.infof("Deleted file for objectId: %s, path: %s", request.getObjectId(), location);
                        } else {
                            LOG.warnf("File not found for deletion: %s", location);
                        }
                    })
                    .map(deleted -> DeleteResult.newBuilder().setDeleted(deleted).build())
                    .onFailure().transform(failure ->
                            OperationFailures.classify(OPERATION, request.getObjectId(), failure));
        });
    }
}
