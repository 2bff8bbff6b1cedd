package com.bulksubmit.recipient.transfer.service;

import com.bulksubmit.recipient.transfer.fetch.ManifestFetcher;
import com.bulksubmit.recipient.transfer.fetch.ManifestFetcherListener;
import com.bulksubmit.recipient.transfer.model.IssueType;
import com.bulksubmit.recipient.transfer.model.JobStatus;
import com.bulksubmit.recipient.transfer.model.TransferErrorContext;
import com.bulksubmit.recipient.transfer.model.TransferException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransferJobTest {
    private static final String MANIFEST_URL = "https://sender.example.org/manifest.json";

    @Mock
    private ManifestFetcher fetcher;

    @Mock
    private TransferJobListener owner;

    private TransferJob job;

    @BeforeEach
    void setUp() {
        job = new TransferJob("job-1", "sub-1", MANIFEST_URL, "application/fhir+ndjson", fetcher, Runnable::run);
    }

    @Test
    void startMovesToInProgressAndRunsFetcher() throws Exception {
        job.start(owner).get(1, TimeUnit.SECONDS);

        assertEquals(JobStatus.IN_PROGRESS, job.getStatus());
        verify(fetcher).run(MANIFEST_URL);
    }

    @Test
    void startTwiceIsRejected() {
        job.start(owner);

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> job.start(owner));
        assertEquals("Job job-1 has already been started.", error.getMessage());
    }

    @Test
    void startWithoutManifestUrlIsRejected() {
        TransferJob blank = new TransferJob("job-2", "sub-1", " ", "ndjson", fetcher, Runnable::run);

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> blank.start(owner));
        assertEquals("Job job-2 has no manifestUrl.", error.getMessage());
        verifyNoInteractions(fetcher);
    }

    @Test
    void fetcherEventsDriveJobState() {
        job.start(owner);
        ManifestFetcherListener events = capturedListener();

        events.onProgress(1, 4);
        assertEquals(25, job.getProgress());

        TransferException failure = new TransferException("Failed to download file a.ndjson: broken", TransferErrorContext.of(IssueType.PROCESSING));
        events.onError(failure);
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals("Failed to download file a.ndjson: broken", job.getError());
        verify(owner).onError(job, failure);

        events.onDownloadComplete("https://sender.example.org/b.ndjson", 7);
        verify(owner).onFileComplete(job, "https://sender.example.org/b.ndjson", 7);

        events.onComplete();
        assertEquals(JobStatus.COMPLETE, job.getStatus());
        assertEquals(100, job.getProgress());
        when(fetcher.status()).thenReturn("All files downloaded");
        assertThat(job.toView().error()).isEqualTo("Failed to download file a.ndjson: broken");
        assertThat(job.toView().fetcherStatus()).isEqualTo("All files downloaded");
    }

    @Test
    void abortIsIdempotentAndDetachesListener() {
        job.start(owner);
        ManifestFetcherListener events = capturedListener();

        job.abort();
        job.abort();

        assertEquals(JobStatus.ABORTED, job.getStatus());
        verify(fetcher, times(1)).abort();
        verify(fetcher).removeListener(events);

        events.onError(new TransferException("late failure", TransferErrorContext.of(IssueType.PROCESSING)));
        assertEquals(JobStatus.ABORTED, job.getStatus());
        verifyNoInteractions(owner);
    }

    @Test
    void abortedJobCanBeRestarted() {
        job.start(owner);
        job.abort();

        job.start(owner);

        assertEquals(JobStatus.IN_PROGRESS, job.getStatus());
        verify(fetcher, times(2)).run(MANIFEST_URL);
    }

    @Test
    void failedJobCannotRestartWhileItsRunIsActive() throws Exception {
        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            TransferJob threaded = new TransferJob("job-3", "sub-1", MANIFEST_URL, "ndjson", fetcher, runner);
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            doAnswer(invocation -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return null;
            }).doNothing().when(fetcher).run(MANIFEST_URL);

            CompletableFuture<Void> firstRun = threaded.start(owner);
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            capturedListener().onError(new TransferException("broken", TransferErrorContext.of(IssueType.PROCESSING)));

            assertEquals(JobStatus.FAILED, threaded.getStatus());
            assertTrue(threaded.isRunning());
            IllegalStateException error = assertThrows(IllegalStateException.class, () -> threaded.start(owner));
            assertEquals("Job job-3 is still running.", error.getMessage());

            release.countDown();
            firstRun.get(5, TimeUnit.SECONDS);
            assertFalse(threaded.isRunning());

            threaded.start(owner).get(5, TimeUnit.SECONDS);
            assertEquals(JobStatus.IN_PROGRESS, threaded.getStatus());
            verify(fetcher, times(2)).run(MANIFEST_URL);
            verify(fetcher, times(2)).reset();
        } finally {
            runner.shutdownNow();
        }
    }

    @Test
    void rollbackUndoesManifestFiles() throws Exception {
        when(fetcher.undoAll(MANIFEST_URL)).thenReturn(3);

        assertEquals(3, job.rollback().get(1, TimeUnit.SECONDS));
    }

    private ManifestFetcherListener capturedListener() {
        ArgumentCaptor<ManifestFetcherListener> captor = ArgumentCaptor.forClass(ManifestFetcherListener.class);
        verify(fetcher, atLeastOnce()).addListener(captor.capture());
        return captor.getValue();
    }
}
