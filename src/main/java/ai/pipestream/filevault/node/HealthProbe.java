package ai.pipestream.filevault.node;

import ai.pipestream.filevault.node.v1.NodeStatus;
import ai.pipestream.filevault.storage.FileStorage;
import ai.pipestream.filevault.storage.VolumeUsage;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.nio.file.Path;

/**
 * Reports liveness and capacity of the storage volume. Never fails: a probe error is reported
 * as a dead node with zero capacity.
 */
public class HealthProbe {

    private static final Logger LOG = Logger.getLogger(HealthProbe.class);

    private final String nodeId;
    private final String nodeName;
    private final Path basePath;
    private final FileStorage storage;

    public HealthProbe(String nodeId, String nodeName, Path basePath, FileStorage storage) {
        this.nodeId = nodeId;
        this.nodeName = nodeName;
        this.basePath = basePath;
        this.storage = storage;
    }

    public Uni<NodeStatus> probe() {
        return Uni.createFrom().deferred(() -> storage.volumeUsage(basePath))
                .onFailure().recoverWithItem(failure -> {
                    LOG.errorf(failure, "Error during health check of %s", basePath);
                    return VolumeUsage.unavailable();
                })
                .map(usage -> NodeStatus.newBuilder()
                        .setNodeId(nodeId)
                        .setNodeName(nodeName)
                        .setIsAlive(usage.ready())
                        .setDataPathFreeBytes(usage.freeBytes())
                        .setDataPathTotalBytes(usage.totalBytes())
                        .build())
                .invoke(status -> LOG.debugf("Health probe: alive=%s, free=%d, total=%d",
                        status.getIsAlive(), status.getDataPathFreeBytes(), status.getDataPathTotalBytes()));
    }

    public String nodeId() {
        return nodeId;
    }
}
