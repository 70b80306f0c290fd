package ai.pipestream.filevault.concurrency;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.UniEmitter;

import java.util.ArrayDeque;

/**
 * Non-blocking counting semaphore for Mutiny pipelines.
 * <p>
 * {@link #acquire()} never parks a thread: callers that find no free permit are queued (FIFO)
 * and resumed when a holder releases. Cancelling the returned {@link Uni} before the grant
 * removes the waiter without consuming a permit; a permit granted to a subscriber that cancelled
 * in the meantime is handed back immediately.
 * </p>
 */
public final class AsyncSemaphore {

    private final int capacity;
    private final ArrayDeque<Waiter> waiters = new ArrayDeque<>();
    private int available;

    public AsyncSemaphore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.available = capacity;
    }

    /**
     * Acquire one permit, suspending until one is free.
     *
     * @return Uni emitting the granted permit; the holder must call {@link Permit#release()}
     */
    public Uni<Permit> acquire() {
        return Uni.createFrom().deferred(() -> {
            Waiter waiter = new Waiter();
            return Uni.createFrom().<Permit>emitter(emitter -> enqueue(waiter, emitter))
                    .onCancellation().invoke(() -> abandon(waiter));
        });
    }

    public int capacity() {
        return capacity;
    }

    public synchronized int availablePermits() {
        return available;
    }

    public synchronized int queueLength() {
        return waiters.size();
    }

    private void enqueue(Waiter waiter, UniEmitter<? super Permit> emitter) {
        Permit granted = null;
        synchronized (this) {
            waiter.emitter = emitter;
            if (available > 0 && waiters.isEmpty()) {
                available--;
                granted = new Permit(this);
                waiter.permit = granted;
            } else {
                waiters.addLast(waiter);
            }
        }
        if (granted != null) {
            emitter.complete(granted);
        }
    }

    /**
     * Hand a returned permit to the oldest waiter, or put it back in the pool.
     */
    void returnPermit() {
        Waiter next;
        synchronized (this) {
            next = waiters.pollFirst();
            if (next == null) {
                available++;
                return;
            }
            next.permit = new Permit(this);
        }
        next.emitter.complete(next.permit);
    }

    private void abandon(Waiter waiter) {
        Permit orphan;
        synchronized (this) {
            if (waiters.remove(waiter)) {
                return;
            }
            orphan = waiter.permit;
        }
        // granted concurrently with the cancellation, the subscriber will never see it
        if (orphan != null) {
            orphan.release();
        }
    }

    private static final class Waiter {
        UniEmitter<? super Permit> emitter;
        Permit permit;
    }
}
