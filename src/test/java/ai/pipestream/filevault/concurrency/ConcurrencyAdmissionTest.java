package ai.pipestream.filevault.concurrency;

import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyAdmissionTest {

    @Test
    void testUploadAndDownloadGatesAreIndependent() {
        ConcurrencyAdmission admission = new ConcurrencyAdmission(1, 2);

        Permit upload = admission.acquireUpload().await().indefinitely();
        Permit download1 = admission.acquireDownload().await().indefinitely();
        Permit download2 = admission.acquireDownload().await().indefinitely();

        assertEquals(0, admission.availableUploadSlots());
        assertEquals(0, admission.availableDownloadSlots());

        UniAssertSubscriber<Permit> queuedUpload = admission.acquireUpload()
                .subscribe().withSubscriber(UniAssertSubscriber.create());
        assertEquals(1, admission.queuedUploads());
        assertEquals(0, admission.queuedDownloads());

        download1.release();
        queuedUpload.assertNotTerminated();

        upload.release();
        queuedUpload.assertCompleted();

        queuedUpload.getItem().release();
        download2.release();
        assertEquals(1, admission.availableUploadSlots());
        assertEquals(2, admission.availableDownloadSlots());
    }

    @Test
    void testLimitsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ConcurrencyAdmission(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new ConcurrencyAdmission(1, 0));
    }
}
