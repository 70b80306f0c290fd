package ai.pipestream.filevault.concurrency;

import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KeyedLockManager.
 */
class KeyedLockManagerTest {

    private final KeyedLockManager locks = new KeyedLockManager();

    @Test
    void testSameKeyIsSerialized() {
        KeyLock first = locks.lock("doc-1").await().indefinitely();

        UniAssertSubscriber<KeyLock> second = locks.lock("doc-1")
                .subscribe().withSubscriber(UniAssertSubscriber.create());
        second.assertNotTerminated();

        first.release();

        second.assertCompleted();
        assertEquals("doc-1", second.getItem().key());
        second.getItem().release();
        assertEquals(0, locks.activeKeys());
    }

    @Test
    void testDistinctKeysDoNotBlockEachOther() {
        KeyLock a = locks.lock("doc-a").await().indefinitely();

        UniAssertSubscriber<KeyLock> b = locks.lock("doc-b")
                .subscribe().withSubscriber(UniAssertSubscriber.create());

        b.assertCompleted();
        assertEquals(2, locks.activeKeys());

        a.release();
        b.getItem().release();
        assertEquals(0, locks.activeKeys());
    }

    @Test
    void testEntriesAreDroppedOnceUnused() {
        for (int i = 0; i < 10_000; i++) {
            locks.lock("key-" + i).await().indefinitely().release();
        }

        assertEquals(0, locks.activeKeys());
    }

    @Test
    void testCancelledWaiterReleasesItsReference() {
        KeyLock held = locks.lock("doc-1").await().indefinitely();
        UniAssertSubscriber<KeyLock> waiter = locks.lock("doc-1")
                .subscribe().withSubscriber(UniAssertSubscriber.create());

        waiter.cancel();
        assertEquals(1, locks.activeKeys());

        held.release();
        assertEquals(0, locks.activeKeys());

        KeyLock again = locks.lock("doc-1").await().indefinitely();
        assertNotNull(again);
        again.release();
    }

    @Test
    void testReleaseIsIdempotent() {
        KeyLock held = locks.lock("doc-1").await().indefinitely();
        UniAssertSubscriber<KeyLock> waiter = locks.lock("doc-1")
                .subscribe().withSubscriber(UniAssertSubscriber.create());

        held.release();
        held.release();

        assertTrue(held.isReleased());
        waiter.assertCompleted();
        // the second release must not let a third holder in
        UniAssertSubscriber<KeyLock> third = locks.lock("doc-1")
                .subscribe().withSubscriber(UniAssertSubscriber.create());
        third.assertNotTerminated();

        waiter.getItem().release();
        third.assertCompleted();
        third.getItem().release();
        assertEquals(0, locks.activeKeys());
    }

    @Test
    void testNullKeyFails() {
        assertThrows(IllegalArgumentException.class, () -> locks.lock(null).await().indefinitely());
    }
}
