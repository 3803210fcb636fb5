package org.buaa.imagesearch.ingest;

import org.buaa.imagesearch.common.convention.exception.NotFoundException;
import org.buaa.imagesearch.config.IngestionProperties;
import org.buaa.imagesearch.dto.SourceItem;
import org.buaa.imagesearch.service.impl.InMemoryProgressStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProgressTrackerTest {

    private static final SourceItem A = SourceItem.of("http://example.com/a.jpg");
    private static final SourceItem B = SourceItem.of("http://example.com/b.jpg");
    private static final SourceItem C = SourceItem.of("http://example.com/c.jpg");

    private ProgressTracker tracker;
    private BatchJob job;

    @BeforeEach
    void setUp() {
        tracker = new ProgressTracker(new InMemoryProgressStore(new IngestionProperties()));
        job = BatchJob.create(List.of(A, B, C), 2);
    }

    @Test
    void testCreatedRecordIsQueuedAndEmpty() {
        ProgressRecord record = tracker.create(job);

        assertEquals(JobStatus.QUEUED, record.getStatus());
        assertEquals(3, record.getTotalCount());
        assertEquals(0, record.getProcessedCount());
        assertNull(record.getCurrentItem());
        assertTrue(record.getFailures().isEmpty());
    }

    @Test
    void testBatchesAccumulateCountsAndFailures() {
        tracker.create(job);
        tracker.markRunning(job.getId());

        tracker.recordBatch(job.getId(), A,
            List.of(ItemOutcome.success(A, "id-a"), ItemOutcome.failure(B, "HTTP 404")));
        ProgressRecord record = tracker.recordBatch(job.getId(), C, List.of(ItemOutcome.success(C, "id-c")));

        assertEquals(3, record.getProcessedCount());
        assertEquals(2, record.getSucceededCount());
        assertEquals(C, record.getCurrentItem());
        assertEquals(List.of(new ItemFailure(B, "HTTP 404")), record.getFailures());
        assertEquals(record.getProcessedCount(), record.getSucceededCount() + record.getFailedCount());
    }

    @Test
    void testProcessedCountCannotExceedTotal() {
        tracker.create(job);
        tracker.markRunning(job.getId());
        tracker.recordBatch(job.getId(), A, List.of(ItemOutcome.success(A, "1"), ItemOutcome.success(B, "2")));

        assertThrows(IllegalStateException.class, () -> tracker.recordBatch(job.getId(), C,
            List.of(ItemOutcome.success(C, "3"), ItemOutcome.success(A, "4"))));
        assertEquals(2, tracker.get(job.getId()).getProcessedCount());
    }

    @Test
    void testStatusNeverMovesBackwards() {
        tracker.create(job);
        tracker.markRunning(job.getId());
        tracker.markCompleted(job.getId());

        assertThrows(IllegalStateException.class, () -> tracker.markRunning(job.getId()));
        assertThrows(IllegalStateException.class, () -> tracker.markCancelled(job.getId()));
        assertThrows(IllegalStateException.class,
            () -> tracker.recordBatch(job.getId(), A, List.of(ItemOutcome.success(A, "1"))));
        assertEquals(JobStatus.COMPLETED, tracker.get(job.getId()).getStatus());
    }

    @Test
    void testMarkFailedAddsEntryForEveryUnstartedItem() {
        tracker.create(job);

        ProgressRecord record = tracker.markFailed(job.getId(), job.getItems(), "storage unavailable");

        assertEquals(JobStatus.FAILED, record.getStatus());
        assertEquals(3, record.getFailures().size());
        assertTrue(record.getFailures().stream().allMatch(f -> "storage unavailable".equals(f.getError())));
    }

    @Test
    void testUnknownJobIsNotFound() {
        assertThrows(NotFoundException.class, () -> tracker.get("missing"));
        assertFalse(tracker.find("missing").isPresent());
    }

    @Test
    void testRemoveDropsRecord() {
        tracker.create(job);

        assertTrue(tracker.remove(job.getId()));
        assertFalse(tracker.find(job.getId()).isPresent());
    }
}
