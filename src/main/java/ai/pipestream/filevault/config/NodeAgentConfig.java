package ai.pipestream.filevault.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for the storage node agent.
 * All keys are namespaced under {@code filevault.node.*}.
 */
@ConfigMapping(prefix = "filevault.node")
public interface NodeAgentConfig {

    /**
     * Unique identifier for this node.
     */
    String nodeId();

    /**
     * Human-readable name for this node.
     */
    String nodeName();

    /**
     * Root directory of the storage volume, e.g. {@code /mnt/192.168.1.10/2025}.
     * Must exist before startup.
     */
    String basePath();

    /**
     * Name of the temp directory for in-flight uploads, created under {@link #basePath()} so
     * that the final rename stays on the same volume.
     * Default: tmp.
     */
    @WithDefault("tmp")
    String tempDirName();

    /**
     * Maximum number of concurrent uploads.
     * Default: 16.
     */
    @WithDefault("16")
    int maxConcurrentUploads();

    /**
     * Maximum number of concurrent downloads.
     * Default: 32.
     */
    @WithDefault("32")
    int maxConcurrentDownloads();

    /**
     * Size of download chunks in bytes.
     * Default: 256KB.
     */
    @WithDefault("262144")
    int chunkSizeBytes();

    /**
     * Shard directory layout.
     */
    Shard shard();

    interface Shard {
        /**
         * Number of hex characters per shard level.
         * Default: 2.
         */
        @WithDefault("2")
        int symbolCount();

        /**
         * Number of shard directory levels.
         * Default: 2.
         */
        @WithDefault("2")
        int levelCount();
    }
}
