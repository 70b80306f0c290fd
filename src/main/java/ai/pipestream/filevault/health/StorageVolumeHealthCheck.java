package ai.pipestream.filevault.health;

import ai.pipestream.filevault.node.HealthProbe;
import ai.pipestream.filevault.node.v1.NodeStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import java.time.Duration;

/**
 * Health check for the storage volume.
 * Ready while the base path is a writable directory.
 */
@Readiness
@ApplicationScoped
public class StorageVolumeHealthCheck implements HealthCheck {

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    @Inject
    HealthProbe healthProbe;

    @Override
    public HealthCheckResponse call() {
        try {
            NodeStatus status = healthProbe.probe().await().atMost(PROBE_TIMEOUT);
            HealthCheckResponseBuilder builder = HealthCheckResponse.named("filevault-node-agent")
                    .withData("nodeId", status.getNodeId())
                    .withData("freeBytes", status.getDataPathFreeBytes())
                    .withData("totalBytes", status.getDataPathTotalBytes());
            return status.getIsAlive() ? builder.up().build() : builder.down().build();
        } catch (Exception e) {
            return HealthCheckResponse.named("filevault-node-agent")
                    .withData("nodeId", healthProbe.nodeId())
                    .withData("error", String.valueOf(e.getMessage()))
                    .down()
                    .build();
        }
    }
}
