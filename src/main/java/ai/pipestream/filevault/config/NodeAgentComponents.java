package ai.pipestream.filevault.config;

import ai.pipestream.filevault.concurrency.ConcurrencyAdmission;
import ai.pipestream.filevault.concurrency.KeyedLockManager;
import ai.pipestream.filevault.node.DeletionHandler;
import ai.pipestream.filevault.node.DownloadStreamer;
import ai.pipestream.filevault.node.HealthProbe;
import ai.pipestream.filevault.node.NodeAgentMetrics;
import ai.pipestream.filevault.node.UploadCoordinator;
import ai.pipestream.filevault.storage.FileStorage;
import ai.pipestream.filevault.storage.LocalFileStorage;
import ai.pipestream.filevault.storage.ObjectPathMapper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.nio.file.Path;

/**
 * Wires the node agent's components from {@link NodeAgentConfig}.
 * One instance of each per process; the concurrency gates in particular must be shared.
 */
@ApplicationScoped
public class NodeAgentComponents {

    @Produces
    @Singleton
    public ObjectPathMapper objectPathMapper(NodeAgentConfig config) {
        return new ObjectPathMapper(Path.of(config.basePath()), config.tempDirName(),
                config.shard().symbolCount(), config.shard().levelCount());
    }

    @Produces
    @Singleton
    public FileStorage fileStorage() {
        return new LocalFileStorage();
    }

    @Produces
    @Singleton
    public ConcurrencyAdmission concurrencyAdmission(NodeAgentConfig config) {
        return new ConcurrencyAdmission(config.maxConcurrentUploads(), config.maxConcurrentDownloads());
    }

    @Produces
    @Singleton
    public KeyedLockManager keyedLockManager() {
        return new KeyedLockManager();
    }

    @Produces
    @Singleton
    public NodeAgentMetrics nodeAgentMetrics(MeterRegistry registry,
                                             ConcurrencyAdmission admission,
                                             KeyedLockManager locks) {
        NodeAgentMetrics metrics = new NodeAgentMetrics(registry);
        metrics.bindConcurrency(admission, locks);
        return metrics;
    }

    @Produces
    @Singleton
    public UploadCoordinator uploadCoordinator(ObjectPathMapper paths,
                                               FileStorage storage,
                                               ConcurrencyAdmission admission,
                                               KeyedLockManager locks,
                                               NodeAgentMetrics metrics) {
        return new UploadCoordinator(paths, storage, admission, locks, metrics);
    }

    @Produces
    @Singleton
    public DownloadStreamer downloadStreamer(NodeAgentConfig config,
                                             ObjectPathMapper paths,
                                             FileStorage storage,
                                             ConcurrencyAdmission admission,
                                             NodeAgentMetrics metrics) {
        return new DownloadStreamer(paths, storage, admission, metrics, config.chunkSizeBytes());
    }

    @Produces
    @Singleton
    public DeletionHandler deletionHandler(ObjectPathMapper paths, FileStorage storage, NodeAgentMetrics metrics) {
        return new DeletionHandler(paths, storage, metrics);
    }

    @Produces
    @Singleton
    public HealthProbe healthProbe(NodeAgentConfig config, ObjectPathMapper paths, FileStorage storage) {
        return new HealthProbe(config.nodeId(), config.nodeName(), paths.basePath(), storage);
    }
}
