package ai.pipestream.filevault.concurrency;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-key asynchronous mutual exclusion.
 * <p>
 * Each key maps to a single-permit {@link AsyncSemaphore} plus a count of the holders and
 * waiters currently referencing it. The entry is dropped as soon as that count reaches zero, so
 * the table only ever contains keys that are locked or being waited on, however many distinct
 * keys pass through it.
 * </p>
 */
public class KeyedLockManager {

    private static final Logger LOG = Logger.getLogger(KeyedLockManager.class);

    private final ConcurrentHashMap<String, LockEntry> entries = new ConcurrentHashMap<>();

    /**
     * Acquire the lock for a key, suspending while another holder has it.
     *
     * @param key the lock key
     * @return Uni emitting the held lock; the holder must call {@link KeyLock#release()}
     */
    public Uni<KeyLock> lock(String key) {
        if (key == null) {
            return Uni.createFrom().failure(new IllegalArgumentException("key must not be null"));
        }
        return Uni.createFrom().deferred(() -> {
            LockEntry entry = entries.compute(key, (k, existing) -> {
                LockEntry e = existing != null ? existing : new LockEntry();
                e.references++;
                return e;
            });
            KeyLock lock = new KeyLock(this, key, entry);
            if (entry.mutex.availablePermits() == 0) {
                LOG.debugf("Waiting for key lock: key=%s", key);
            }
            return entry.mutex.acquire()
                    .onItem().transform(lock::grant)
                    .onCancellation().invoke(lock::release)
                    .onFailure().invoke(failure -> lock.release());
        });
    }

    /**
     * Number of keys currently held or waited on.
     */
    public int activeKeys() {
        return entries.size();
    }

    void dereference(String key, LockEntry entry) {
        entries.computeIfPresent(key, (k, current) -> {
            if (current != entry) {
                return current;
            }
            current.references--;
            return current.references == 0 ? null : current;
        });
    }

    static final class LockEntry {
        final AsyncSemaphore mutex = new AsyncSemaphore(1);
        // guarded by the map's per-key compute
        int references;
    }
}
