package ai.pipestream.filevault.storage;

/**
 * Capacity snapshot of a storage volume.
 *
 * @param ready      the storage directory exists and is writable
 * @param freeBytes  bytes available to this process
 * @param totalBytes size of the volume
 */
public record VolumeUsage(boolean ready, long freeBytes, long totalBytes) {

    public static VolumeUsage unavailable() {
        return new VolumeUsage(false, 0L, 0L);
    }
}
