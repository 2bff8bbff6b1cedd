package com.bulksubmit.recipient.transfer.service;

import com.bulksubmit.recipient.transfer.model.IssueType;
import com.bulksubmit.recipient.transfer.model.JobStatus;
import com.bulksubmit.recipient.transfer.model.SubmissionStatus;
import com.bulksubmit.recipient.transfer.model.SubmissionSummary;
import com.bulksubmit.recipient.transfer.model.SubmitterIdentity;
import com.bulksubmit.recipient.transfer.model.TransferErrorContext;
import com.bulksubmit.recipient.transfer.model.TransferException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SubmissionTest {
    private static final SubmitterIdentity SUBMITTER = new SubmitterIdentity("https://sender.example.org", "acme");

    @TempDir
    Path tempDir;

    private Submission submission;

    @BeforeEach
    void setUp() {
        submission = new Submission("sub-1", SUBMITTER, tempDir, "http://recipient.test", new ObjectMapper());
    }

    @Test
    void slugIsSha256OfSubmitterAndSubmissionId() {
        assertEquals(
            "9d453d6af8d9bd3543129040081c8ea1d3160dbfefccc3925410364f37e4f732",
            Submission.computeSlug("sub-1", SUBMITTER)
        );
        assertEquals(Submission.computeSlug("sub-1", SUBMITTER), submission.getSlug());
        assertEquals(tempDir.resolve(submission.getSlug()), submission.getDirectory());
    }

    @Test
    void progressIsMeanOfJobsRoundedToTwoDecimals() {
        assertEquals(0d, submission.getProgress());

        submission.addJob(job("a", "https://s/a.json", JobStatus.COMPLETE, 100));
        submission.addJob(job("b", "https://s/b.json", JobStatus.IN_PROGRESS, 0));
        submission.addJob(job("c", "https://s/c.json", JobStatus.IN_PROGRESS, 0));

        assertEquals(33.33d, submission.getProgress());
    }

    @Test
    void startOnlyStartsRestartableJobs() {
        TransferJob pending = job("a", "https://s/a.json", JobStatus.PENDING, 0);
        TransferJob running = job("b", "https://s/b.json", JobStatus.IN_PROGRESS, 10);
        TransferJob failed = job("c", "https://s/c.json", JobStatus.FAILED, 10);
        submission.addJob(pending);
        submission.addJob(running);
        submission.addJob(failed);

        submission.start();

        verify(pending).start(any());
        verify(failed).start(any());
        verify(running, never()).start(any());
    }

    @Test
    void startSkipsFailedJobWhosePreviousRunIsStillActive() {
        TransferJob failed = job("a", "https://s/a.json", JobStatus.FAILED, 10);
        when(failed.isRunning()).thenReturn(true);
        submission.addJob(failed);

        submission.start();

        verify(failed, never()).start(any());
    }

    @Test
    void jobOutcomesAreRecordedInErrorManifest() throws Exception {
        TransferJob pending = job("a", "https://s/a.json", JobStatus.PENDING, 0);
        submission.addJob(pending);
        submission.start();
        ArgumentCaptor<TransferJobListener> captor = ArgumentCaptor.forClass(TransferJobListener.class);
        verify(pending).start(captor.capture());

        captor.getValue().onFileComplete(pending, "https://s/Patient.ndjson", 2);
        captor.getValue().onError(pending, new TransferException("bad", TransferErrorContext.of(IssueType.INVALID)));

        ErrorManifest errors = submission.getErrorManifest();
        assertEquals(1, errors.getSuccessCount("https://s/a.json"));
        assertEquals(1, errors.getErrorCount("https://s/a.json"));
    }

    @Test
    void abortStopsAndRollsBackEveryJob() {
        TransferJob first = job("a", "https://s/a.json", JobStatus.IN_PROGRESS, 50);
        TransferJob second = job("b", "https://s/b.json", JobStatus.COMPLETE, 100);
        submission.addJob(first);
        submission.addJob(second);

        submission.abort();

        assertEquals(SubmissionStatus.ABORTED, submission.getStatus());
        verify(first).abort();
        verify(first).rollback();
        verify(second).abort();
        verify(second).rollback();
    }

    @Test
    void replaceManifestSwapsJobAndDropsStatusEntry() throws Exception {
        TransferJob old = job("a", "https://s/old.json", JobStatus.IN_PROGRESS, 50);
        TransferJob replacement = job("b", "https://s/new.json", JobStatus.PENDING, 0);
        submission.addJob(old);
        submission.getErrorManifest().addSuccess("https://s/old.json");

        submission.replaceManifest("https://s/old.json", replacement);

        verify(old).abort();
        verify(old).rollback();
        verify(replacement).start(any());
        assertThat(submission.getJobs()).containsExactly(replacement);
        assertThat(submission.findJobByManifestUrl("https://s/old.json")).isEmpty();
        assertThat(submission.getErrorManifest().hasManifestUrl("https://s/old.json")).isFalse();
    }

    @Test
    void summaryListsJobs() {
        TransferJob first = job("a", "https://s/a.json", JobStatus.COMPLETE, 100);
        submission.addJob(first);
        submission.complete();

        SubmissionSummary summary = submission.toSummary();

        assertEquals(submission.getSlug(), summary.slug());
        assertEquals(SubmissionStatus.COMPLETE, summary.status());
        assertEquals(100d, summary.progress());
        assertThat(summary.jobs()).hasSize(1);
    }

    private static TransferJob job(String id, String manifestUrl, JobStatus status, int progress) {
        TransferJob job = mock(TransferJob.class);
        when(job.getJobId()).thenReturn(id);
        when(job.getManifestUrl()).thenReturn(manifestUrl);
        when(job.getStatus()).thenReturn(status);
        when(job.getProgress()).thenReturn(progress);
        return job;
    }
}
