package ai.pipestream.filevault.concurrency;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One unit of capacity taken from an {@link AsyncSemaphore}.
 * Releasing more than once is a no-op, so every exit path may call {@link #release()}.
 */
public final class Permit {

    private final AsyncSemaphore owner;
    private final AtomicBoolean released = new AtomicBoolean(false);

    Permit(AsyncSemaphore owner) {
        this.owner = owner;
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            owner.returnPermit();
        }
    }

    public boolean isReleased() {
        return released.get();
    }
}
