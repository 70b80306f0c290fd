package ai.pipestream.filevault.concurrency;

/**
 * A held per-key lock from {@link KeyedLockManager}.
 * {@link #release()} is idempotent.
 */
public final class KeyLock {

    private final KeyedLockManager manager;
    private final String key;
    private final KeyedLockManager.LockEntry entry;
    private Permit permit;
    private boolean released;

    KeyLock(KeyedLockManager manager, String key, KeyedLockManager.LockEntry entry) {
        this.manager = manager;
        this.key = key;
        this.entry = entry;
    }

    public String key() {
        return key;
    }

    KeyLock grant(Permit granted) {
        boolean alreadyReleased;
        synchronized (this) {
            alreadyReleased = released;
            if (!alreadyReleased) {
                permit = granted;
            }
        }
        if (alreadyReleased) {
            granted.release();
        }
        return this;
    }

    public void release() {
        Permit held;
        synchronized (this) {
            if (released) {
                return;
            }
            released = true;
            held = permit;
        }
        if (held != null) {
            held.release();
        }
        manager.dereference(key, entry);
    }

    public synchronized boolean isReleased() {
        return released;
    }
}
