package ai.pipestream.filevault.health;

import ai.pipestream.filevault.util.StorageVolumeTestResource;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
@QuarkusTestResource(StorageVolumeTestResource.class)
class StorageVolumeHealthCheckTest {

    @Inject
    @Readiness
    StorageVolumeHealthCheck healthCheck;

    @Test
    void writableVolumeIsReady() {
        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        Map<String, Object> data = response.getData().orElseThrow();
        assertEquals("test-node-001", data.get("nodeId"));
        assertTrue(((Number) data.get("totalBytes")).longValue() > 0);
    }
}
