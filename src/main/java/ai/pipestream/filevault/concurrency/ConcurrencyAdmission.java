package ai.pipestream.filevault.concurrency;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Admission control for transfers: two independent gates, so saturated uploads never hold up
 * downloads and vice versa.
 */
public class ConcurrencyAdmission {

    private static final Logger LOG = Logger.getLogger(ConcurrencyAdmission.class);

    private final AsyncSemaphore uploads;
    private final AsyncSemaphore downloads;

    public ConcurrencyAdmission(int maxConcurrentUploads, int maxConcurrentDownloads) {
        this.uploads = new AsyncSemaphore(maxConcurrentUploads);
        this.downloads = new AsyncSemaphore(maxConcurrentDownloads);
        LOG.infof("ConcurrencyAdmission initialized: maxUploads=%d, maxDownloads=%d",
                maxConcurrentUploads, maxConcurrentDownloads);
    }

    /**
     * Wait for an upload slot.
     *
     * @return Uni emitting the slot once free; cancelling it while queued consumes nothing
     */
    public Uni<Permit> acquireUpload() {
        return uploads.acquire();
    }

    /**
     * Wait for a download slot.
     *
     * @return Uni emitting the slot once free; cancelling it while queued consumes nothing
     */
    public Uni<Permit> acquireDownload() {
        return downloads.acquire();
    }

    public int availableUploadSlots() {
        return uploads.availablePermits();
    }

    public int availableDownloadSlots() {
        return downloads.availablePermits();
    }

    public int queuedUploads() {
        return uploads.queueLength();
    }

    public int queuedDownloads() {
        return downloads.queueLength();
    }
}
