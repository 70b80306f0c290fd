package ai.pipestream.filevault.concurrency;

import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AsyncSemaphore.
 * Tests permit accounting, FIFO hand-over and cancellation of waiters.
 */
class AsyncSemaphoreTest {

    @Test
    void testPermitsAreGrantedUpToCapacity() {
        AsyncSemaphore semaphore = new AsyncSemaphore(2);

        Permit first = semaphore.acquire().await().atMost(Duration.ofSeconds(1));
        Permit second = semaphore.acquire().await().atMost(Duration.ofSeconds(1));

        assertNotNull(first);
        assertNotNull(second);
        assertEquals(0, semaphore.availablePermits());
        assertEquals(2, semaphore.capacity());
    }

    @Test
    void testWaiterIsResumedOnRelease() {
        AsyncSemaphore semaphore = new AsyncSemaphore(1);
        Permit held = semaphore.acquire().await().indefinitely();

        UniAssertSubscriber<Permit> waiter = semaphore.acquire()
                .subscribe().withSubscriber(UniAssertSubscriber.create());

        waiter.assertNotTerminated();
        assertEquals(1, semaphore.queueLength());

        held.release();

        waiter.assertCompleted();
        assertNotNull(waiter.getItem());
        assertEquals(0, semaphore.availablePermits());
        assertEquals(0, semaphore.queueLength());
    }

    @Test
    void testWaitersAreServedInArrivalOrder() {
        AsyncSemaphore semaphore = new AsyncSemaphore(1);
        Permit held = semaphore.acquire().await().indefinitely();

        UniAssertSubscriber<Permit> first = semaphore.acquire()
                .subscribe().withSubscriber(UniAssertSubscriber.create());
        UniAssertSubscriber<Permit> second = semaphore.acquire()
                .subscribe().withSubscriber(UniAssertSubscriber.create());

        held.release();

        first.assertCompleted();
        second.assertNotTerminated();

        first.getItem().release();

        second.assertCompleted();
    }

    @Test
    void testCancelledWaiterDoesNotConsumeAPermit() {
        AsyncSemaphore semaphore = new AsyncSemaphore(1);
        Permit held = semaphore.acquire().await().indefinitely();

        UniAssertSubscriber<Permit> waiter = semaphore.acquire()
                .subscribe().withSubscriber(UniAssertSubscriber.create());
        assertEquals(1, semaphore.queueLength());

        waiter.cancel();

        assertEquals(0, semaphore.queueLength());
        held.release();
        assertEquals(1, semaphore.availablePermits());
    }

    @Test
    void testReleaseIsIdempotent() {
        AsyncSemaphore semaphore = new AsyncSemaphore(1);
        Permit permit = semaphore.acquire().await().indefinitely();

        permit.release();
        permit.release();

        assertTrue(permit.isReleased());
        assertEquals(1, semaphore.availablePermits());
    }

    @Test
    void testCapacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new AsyncSemaphore(0));
    }
}
