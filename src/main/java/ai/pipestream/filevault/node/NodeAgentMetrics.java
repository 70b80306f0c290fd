package ai.pipestream.filevault.node;

import ai.pipestream.filevault.concurrency.ConcurrencyAdmission;
import ai.pipestream.filevault.concurrency.KeyedLockManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Metrics for node agent operations.
 * Exposes counters, timers, histograms and gauges via Micrometer.
 */
public class NodeAgentMetrics {

    private final MeterRegistry registry;

    private final Counter uploadCommittedTotal;
    private final Counter uploadVersionedTotal;
    private final Counter uploadRejectedTotal;
    private final Counter uploadFailedTotal;
    private final Counter uploadCancelledTotal;
    private final Counter downloadCompletedTotal;
    private final Counter downloadNotFoundTotal;
    private final Counter downloadBytesTotal;
    private final Counter deleteRemovedTotal;
    private final Counter deleteAbsentTotal;

    private final Timer rpcUploadLatency;
    private final Timer rpcDownloadLatency;
    private final Timer rpcDeleteLatency;

    private final DistributionSummary uploadObjectBytes;

    public NodeAgentMetrics(MeterRegistry registry) {
        this.registry = registry;

        // Counters
        uploadCommittedTotal = Counter.builder("upload_committed_total")
                .description("Total number of uploads committed to their final path")
                .register(registry);

        uploadVersionedTotal = Counter.builder("upload_versioned_total")
                .description("Total number of uploads stored under a versioned path")
                .register(registry);

        uploadRejectedTotal = Counter.builder("upload_rejected_total")
                .description("Total number of uploads rejected by metadata validation")
                .register(registry);

        uploadFailedTotal = Counter.builder("upload_failed_total")
                .description("Total number of uploads that failed after validation")
                .register(registry);

        uploadCancelledTotal = Counter.builder("upload_cancelled_total")
                .description("Total number of uploads cancelled by the caller")
                .register(registry);

        downloadCompletedTotal = Counter.builder("download_completed_total")
                .description("Total number of downloads streamed to completion")
                .register(registry);

        downloadNotFoundTotal = Counter.builder("download_not_found_total")
                .description("Total number of downloads for absent objects")
                .register(registry);

        downloadBytesTotal = Counter.builder("download_bytes_total")
                .description("Total number of bytes streamed to download callers")
                .register(registry);

        deleteRemovedTotal = Counter.builder("delete_total")
                .tag("outcome", "removed")
                .description("Total number of delete requests")
                .register(registry);

        deleteAbsentTotal = Counter.builder("delete_total")
                .tag("outcome", "absent")
                .description("Total number of delete requests")
                .register(registry);

        // Timers
        rpcUploadLatency = Timer.builder("rpc_upload_latency_ms")
                .description("Latency of Upload RPC, from first unit to result")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        rpcDownloadLatency = Timer.builder("rpc_download_latency_ms")
                .description("Latency of Download RPC, until the last chunk")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        rpcDeleteLatency = Timer.builder("rpc_delete_latency_ms")
                .description("Latency of Delete RPC")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        // Distribution Summaries
        uploadObjectBytes = DistributionSummary.builder("upload_object_bytes")
                .description("Distribution of committed object sizes in bytes")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    /**
     * Register gauges over the admission gates and the key lock table.
     */
    public void bindConcurrency(ConcurrencyAdmission admission, KeyedLockManager locks) {
        Gauge.builder("upload_slots_available", admission, ConcurrencyAdmission::availableUploadSlots)
                .description("Free upload slots")
                .register(registry);
        Gauge.builder("download_slots_available", admission, ConcurrencyAdmission::availableDownloadSlots)
                .description("Free download slots")
                .register(registry);
        Gauge.builder("key_locks_active", locks, KeyedLockManager::activeKeys)
                .description("Object ids currently locked or waited on")
                .register(registry);
    }

    public void recordUploadCommitted(long bytes, boolean versioned) {
        uploadCommittedTotal.increment();
        uploadObjectBytes.record(bytes);
        if (versioned) {
            uploadVersionedTotal.increment();
        }
    }

    public void recordUploadRejected() {
        uploadRejectedTotal.increment();
    }

    public void recordUploadFailed() {
        uploadFailedTotal.increment();
    }

    public void recordUploadCancelled() {
        uploadCancelledTotal.increment();
    }

    public void recordDownloadCompleted(long bytes) {
        downloadCompletedTotal.increment();
        downloadBytesTotal.increment(bytes);
    }

    public void recordDownloadNotFound() {
        downloadNotFoundTotal.increment();
    }

    public void recordDelete(boolean removed) {
        if (removed) {
            deleteRemovedTotal.increment();
        } else {
            deleteAbsentTotal.increment();
        }
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopUploadTimer(Timer.Sample sample) {
        sample.stop(rpcUploadLatency);
    }

    public void stopDownloadTimer(Timer.Sample sample) {
        sample.stop(rpcDownloadLatency);
    }

    public void stopDeleteTimer(Timer.Sample sample) {
        sample.stop(rpcDeleteLatency);
    }

    public double uploadsCommitted() {
        return uploadCommittedTotal.count();
    }

    public double uploadsRejected() {
        return uploadRejectedTotal.count();
    }

    public double uploadsFailed() {
        return uploadFailedTotal.count();
    }

    public double uploadsCancelled() {
        return uploadCancelledTotal.count();
    }
}
