package ai.pipestream.filevault.config;

import ai.pipestream.filevault.storage.ObjectPathMapper;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Refuses to start a node whose configuration cannot work, then prepares the temp directory.
 */
@ApplicationScoped
public class NodeAgentStartup {

    private static final Logger LOG = Logger.getLogger(NodeAgentStartup.class);

    @Inject
    NodeAgentConfig config;

    @Inject
    ObjectPathMapper paths;

    void onStart(@Observes StartupEvent ev) {
        validate(config);
        try {
            Files.createDirectories(paths.tempDirectory());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create temp directory " + paths.tempDirectory(), e);
        }
        LOG.infof("Node Agent initialized: nodeId=%s, nodeName=%s, basePath=%s",
                config.nodeId(), config.nodeName(), paths.basePath());
    }

    /**
     * @throws IllegalStateException describing the first problem found
     */
    static void validate(NodeAgentConfig config) {
        if (isBlank(config.nodeId())) {
            throw new IllegalStateException("filevault.node.node-id is required");
        }
        if (isBlank(config.nodeName())) {
            throw new IllegalStateException("filevault.node.node-name is required");
        }
        if (isBlank(config.basePath())) {
            throw new IllegalStateException("filevault.node.base-path is required");
        }
        Path basePath = Path.of(config.basePath());
        if (!Files.isDirectory(basePath)) {
            throw new IllegalStateException("Base path does not exist or is not a directory: " + basePath);
        }
        if (isBlank(config.tempDirName()) || !ObjectPathMapper.isSafeObjectId(config.tempDirName())) {
            throw new IllegalStateException("filevault.node.temp-dir-name must be a plain directory name");
        }
        requirePositive("max-concurrent-uploads", config.maxConcurrentUploads());
        requirePositive("max-concurrent-downloads", config.maxConcurrentDownloads());
        requirePositive("chunk-size-bytes", config.chunkSizeBytes());
        requirePositive("shard.symbol-count", config.shard().symbolCount());
        requirePositive("shard.level-count", config.shard().levelCount());
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalStateException(String.format("filevault.node.%s must be positive, got %d", key, value));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
