package org.buaa.imagesearch.service.impl;

import org.buaa.imagesearch.config.IngestionProperties;
import org.buaa.imagesearch.dto.SourceItem;
import org.buaa.imagesearch.ingest.BatchJob;
import org.buaa.imagesearch.ingest.JobStatus;
import org.buaa.imagesearch.ingest.ProgressRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryProgressStoreTest {

    private static ProgressRecord queued(String jobId) {
        return ProgressRecord.queued(BatchJob.create(jobId, List.of(SourceItem.of("http://example.com/a.jpg")), 1));
    }

    private static ProgressRecord completed(String jobId) {
        return queued(jobId).withStatus(JobStatus.RUNNING).withStatus(JobStatus.COMPLETED);
    }

    @Test
    void testPutGetAndRemove() {
        InMemoryProgressStore store = new InMemoryProgressStore(new IngestionProperties());

        store.put(queued("job-1"));

        assertTrue(store.get("job-1").isPresent());
        assertEquals(1, store.size());
        assertTrue(store.remove("job-1"));
        assertFalse(store.remove("job-1"));
        assertTrue(store.get("job-1").isEmpty());
    }

    @Test
    void testOldestFinishedEntriesAreEvictedBeyondCapacity() {
        IngestionProperties properties = new IngestionProperties();
        properties.getProgress().setMaxJobs(2);
        InMemoryProgressStore store = new InMemoryProgressStore(properties);

        store.put(completed("job-1"));
        store.put(completed("job-2"));
        store.put(completed("job-3"));

        assertEquals(2, store.size());
        assertTrue(store.get("job-3").isPresent());
    }

    @Test
    void testQueuedJobSurvivesNewerSubmissionsBeyondCapacity() {
        IngestionProperties properties = new IngestionProperties();
        properties.getProgress().setMaxJobs(2);
        InMemoryProgressStore store = new InMemoryProgressStore(properties);

        store.put(queued("job-a"));
        for (int i = 0; i < 5; i++) {
            store.put(completed("job-" + i));
        }
        store.put(queued("job-b"));
        store.put(queued("job-c"));

        assertEquals(JobStatus.QUEUED, store.get("job-a").get().getStatus());
        assertTrue(store.get("job-b").isPresent());
        assertTrue(store.get("job-c").isPresent());
    }

    @Test
    void testFinishedEntriesExpireAfterRetention() throws InterruptedException {
        IngestionProperties properties = new IngestionProperties();
        properties.getProgress().setRetention(Duration.ofMillis(50));
        InMemoryProgressStore store = new InMemoryProgressStore(properties);

        store.put(completed("job-1"));
        store.put(queued("job-2"));
        Thread.sleep(120);

        assertTrue(store.get("job-1").isEmpty());
        assertTrue(store.get("job-2").isPresent());
    }

    @Test
    void testTerminalUpdateMovesRecordOutOfActiveSet() {
        InMemoryProgressStore store = new InMemoryProgressStore(new IngestionProperties());

        store.put(queued("job-1"));
        store.put(completed("job-1"));

        assertEquals(1, store.size());
        assertEquals(JobStatus.COMPLETED, store.get("job-1").get().getStatus());
    }
}
