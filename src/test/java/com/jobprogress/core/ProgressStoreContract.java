package com.jobprogress.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link ProgressBackend} must show through a {@link ProgressStore}.
 *
 * <p>Subclasses supply fresh, empty storage per test. The page size is kept at 2 so the
 * lazy listings need several round-trips.</p>
 */
public abstract class ProgressStoreContract {

    protected ProgressStore store;

    private final List<Map<String, String>> parts = List.of(
            Map.of("source", "a.tif"),
            Map.of("source", "b.tif"),
            Map.of("source", "c.tif"));

    /** Prepare empty storage for the next test. */
    protected abstract void resetStorage() throws Exception;

    /** Open a backend on the storage prepared by {@link #resetStorage()}. */
    protected abstract ProgressBackend openBackend();

    @BeforeEach
    public void setUp() throws Exception {
        resetStorage();
        store = newStore(false);
    }

    @AfterEach
    public void tearDown() {
        store.close();
    }

    protected ProgressStore newStore(boolean deleteWhenDone) {
        return new ProgressStore(openBackend(), "abc123", deleteWhenDone, 2);
    }

    private static <T> List<T> toList(Iterable<T> iterable) {
        List<T> list = new ArrayList<>();
        iterable.forEach(list::add);
        return list;
    }

    @Test
    public void testStatusWithoutTotal() {
        JobDoesNotExistException e = assertThrows(JobDoesNotExistException.class, () -> store.status("123"));
        assertEquals("123", e.getJobId());
    }

    /** A new job shows all parts remaining. */
    @Test
    public void testStatusOfNewJob() {
        store.setTotal("123", parts);

        JobStatus status = store.status("123");
        assertEquals(3, status.getTotal());
        assertEquals(3, status.getRemaining());
        assertEquals(0.0, status.getProgress());
        assertFalse(status.isFailed());
        assertFalse(status.isComplete());
        assertTrue(status.getMetadata().isEmpty());
    }

    @Test
    public void testPartStatus() {
        store.setTotal("123", parts);
        assertFalse(store.status("123", 0).isComplete());

        store.completePart("123", 0);

        assertTrue(store.status("123", 0).isComplete());
        assertFalse(store.status("123", 1).isComplete());
    }

    @Test
    public void testPartStatusRejectsInvalidIndex() {
        store.setTotal("123", parts);

        assertThrows(IllegalArgumentException.class, () -> store.status("123", 3));
        assertThrows(IllegalArgumentException.class, () -> store.status("123", -1));
        assertThrows(JobDoesNotExistException.class, () -> store.status("nope", 0));
    }

    /** One of three parts done gives one third progress. */
    @Test
    public void testPartialProgress() {
        store.setTotal("123", parts);

        boolean doneYet = store.completePart("123", 0);

        assertFalse(doneYet);
        JobStatus status = store.status("123");
        assertEquals(3, status.getTotal());
        assertEquals(2, status.getRemaining());
        assertEquals(1.0 / 3, status.getProgress());
    }

    @Test
    public void testCompletingAllParts() {
        store.setTotal("123", parts);

        List<Boolean> results = new ArrayList<>();
        for (int i = 0; i < parts.size(); i++) {
            results.add(store.completePart("123", i));
        }

        assertEquals(List.of(false, false, true), results);
        JobStatus status = store.status("123");
        assertEquals(0, status.getRemaining());
        assertEquals(1.0, status.getProgress());
        assertTrue(status.isComplete());
    }

    @Test
    public void testCompletionOrderDoesNotMatter() {
        store.setTotal("123", parts);

        assertFalse(store.completePart("123", 2));
        assertFalse(store.completePart("123", 0));
        assertTrue(store.completePart("123", 1));
    }

    /** Completing the same part twice never decrements twice. */
    @Test
    public void testDuplicateCompletionIsIgnored() {
        store.setTotal("123", parts);

        assertFalse(store.completePart("123", 1));
        assertFalse(store.completePart("123", 1));
        assertEquals(2, store.status("123").getRemaining());

        store.completePart("123", 0);
        assertTrue(store.completePart("123", 2));
        assertFalse(store.completePart("123", 2), "Only the first completion may report the job done");
        assertEquals(0, store.status("123").getRemaining());
    }

    @Test
    public void testCompletePartRejectsInvalidIndex() {
        store.setTotal("123", parts);

        assertThrows(IllegalArgumentException.class, () -> store.completePart("123", -1));
        assertThrows(IllegalArgumentException.class, () -> store.completePart("123", 3));
        assertEquals(3, store.status("123").getRemaining());
    }

    @Test
    public void testCompletePartOfUnknownJob() {
        assertThrows(JobDoesNotExistException.class, () -> store.completePart("nope", 0));
    }

    @Test
    public void testFailJob() {
        store.setTotal("123", parts);
        store.completePart("123", 0);

        store.failJob("123", "epic fail");

        JobStatus status = store.status("123");
        assertTrue(status.isFailed());
        assertEquals(2, status.getRemaining());
        assertEquals("epic fail", status.getFailureReason());
    }

    /** Failure does not stop completion tracking. */
    @Test
    public void testFailedJobStillCompletes() {
        store.setTotal("123", parts);
        store.failJob("123", "epic fail");

        store.completePart("123", 0);
        store.completePart("123", 1);
        assertTrue(store.completePart("123", 2));

        JobStatus status = store.status("123");
        assertTrue(status.isFailed());
        assertTrue(status.isComplete());
    }

    @Test
    public void testFailUnknownJob() {
        assertThrows(JobDoesNotExistException.class, () -> store.failJob("nope", "reason"));
    }

    @Test
    public void testMetadata() {
        store.setTotal("123", parts);

        store.setMetadata("123", Map.of("test", "foo"));
        assertEquals("foo", store.status("123").getMetadata().get("test"));

        store.setMetadata("123", Map.of("other", "bar"));
        Map<String, String> metadata = store.status("123").getMetadata();
        assertEquals("foo", metadata.get("test"), "First key must survive the second merge");
        assertEquals("bar", metadata.get("other"));

        store.setMetadata("123", Map.of("test", "baz"));
        assertEquals("baz", store.status("123").getMetadata().get("test"));
    }

    @Test
    public void testMetadataOnUnknownJob() {
        assertThrows(JobDoesNotExistException.class, () -> store.setMetadata("nope", Map.of("k", "v")));
    }

    @Test
    public void testListJobIds() {
        store.setTotal("job1", parts);
        store.setTotal("job2", parts);

        assertEquals(List.of("job1", "job2"), toList(store.listJobIds()));
    }

    /** Five jobs with a page size of two spans three pages. */
    @Test
    public void testListJobIdsAcrossPages() {
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            store.setTotal("job" + i, parts);
            expected.add("job" + i);
        }

        assertEquals(expected, toList(store.listJobIds()));
    }

    @Test
    public void testListJobsWithStatus() {
        store.setTotal("job1", parts);
        store.setTotal("job2", parts);
        store.completePart("job2", 0);

        List<JobListing> jobs = toList(store.listJobs());

        assertEquals(2, jobs.size());
        assertEquals("job1", jobs.get(0).getJobId());
        assertEquals(3, jobs.get(0).getStatus().getRemaining());
        assertEquals("job2", jobs.get(1).getJobId());
        assertEquals(2, jobs.get(1).getStatus().getRemaining());
    }

    /** A completed job has no pending parts left but is still listed. */
    @Test
    public void testListJobsIncludesCompletedJobs() {
        store.setTotal("job1", parts);
        store.setTotal("job2", parts);
        for (int i = 0; i < parts.size(); i++) {
            store.completePart("job1", i);
        }

        assertEquals(2, toList(store.listJobs()).size());
        assertEquals(List.of("job1", "job2"), toList(store.listJobIds()));
    }

    @Test
    public void testListJobsSkipsDeletedJobs() {
        store.setTotal("job1", parts);
        store.setTotal("job2", parts);
        store.delete("job1");

        List<JobListing> jobs = toList(store.listJobs());
        assertEquals(1, jobs.size());
        assertEquals("job2", jobs.get(0).getJobId());
    }

    @Test
    public void testListPendingParts() {
        store.setTotal("123", parts);
        assertEquals(3, toList(store.listPendingParts("123")).size());

        store.completePart("123", 0);
        assertEquals(2, toList(store.listPendingParts("123")).size());

        store.completePart("123", 0);
        assertEquals(2, toList(store.listPendingParts("123")).size(), "Duplicates must not shrink the list");
    }

    @Test
    public void testListPendingPartsReturnsDescriptorsInOrder() {
        store.setTotal("123", parts);
        store.completePart("123", 1);

        List<Map<String, Object>> pending = toList(store.listPendingParts("123"));

        assertEquals(2, pending.size());
        assertEquals("a.tif", pending.get(0).get("source"));
        assertEquals("c.tif", pending.get(1).get("source"));
    }

    /** Each iteration starts from scratch and sees completions made in between. */
    @Test
    public void testListPendingPartsIsRestartable() {
        store.setTotal("123", parts);
        Iterable<Map<String, Object>> pending = store.listPendingParts("123");

        assertEquals(3, toList(pending).size());
        store.completePart("123", 2);
        assertEquals(2, toList(pending).size());
    }

    @Test
    public void testListPendingPartsOfCompletedJobIsEmpty() {
        store.setTotal("123", parts);
        for (int i = 0; i < parts.size(); i++) {
            store.completePart("123", i);
        }

        assertTrue(toList(store.listPendingParts("123")).isEmpty());
    }

    @Test
    public void testListPendingPartsAfterDelete() {
        store.setTotal("123", parts);
        assertEquals(3, toList(store.listPendingParts("123")).size());

        store.delete("123");

        assertThrows(JobDoesNotExistException.class, () -> store.listPendingParts("123"));
    }

    @Test
    public void testDelete() {
        store.setTotal("123", parts);
        assertEquals(3, store.status("123").getTotal());

        store.delete("123");

        assertThrows(JobDoesNotExistException.class, () -> store.status("123"));
        assertThrows(JobDoesNotExistException.class, () -> store.completePart("123", 0));
        assertThrows(JobDoesNotExistException.class, () -> store.listPendingParts("123"));
        assertTrue(toList(store.listJobIds()).isEmpty());
    }

    @Test
    public void testDeleteIsIdempotent() {
        store.delete("never-created");
        store.setTotal("123", parts);
        store.delete("123");
        store.delete("123");

        assertThrows(JobDoesNotExistException.class, () -> store.status("123"));
    }

    @Test
    public void testDeleteWhenDone() {
        ProgressStore autoDelete = newStore(true);
        autoDelete.setTotal("123", List.of(parts.get(0)));
        assertEquals(1, toList(autoDelete.listPendingParts("123")).size());

        assertTrue(autoDelete.completePart("123", 0));

        assertThrows(JobDoesNotExistException.class, () -> autoDelete.status("123"));
        assertThrows(JobDoesNotExistException.class, () -> autoDelete.status("123", 0));
        assertThrows(JobDoesNotExistException.class, () -> autoDelete.completePart("123", 0));
        assertTrue(toList(autoDelete.listJobIds()).isEmpty());
    }

    @Test
    public void testNoDeleteWhenDone() {
        store.setTotal("123", List.of(parts.get(0)));
        assertEquals(1, toList(store.listPendingParts("123")).size());

        store.completePart("123", 0);

        assertEquals(0, store.status("123").getRemaining());
        assertTrue(store.status("123", 0).isComplete());
    }

    @Test
    public void testZeroParts() {
        store.setTotal("empty", List.of());

        JobStatus status = store.status("empty");
        assertEquals(0, status.getTotal());
        assertEquals(0, status.getRemaining());
        assertEquals(0.0, status.getProgress());
        assertTrue(status.isComplete());
        assertTrue(toList(store.listPendingParts("empty")).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> store.completePart("empty", 0));
    }

    /** Registering an id again resets the job but keeps its place in the listing. */
    @Test
    public void testSetTotalResetsExistingJob() {
        store.setTotal("job1", parts);
        store.setTotal("job2", parts);
        store.completePart("job1", 0);
        store.failJob("job1", "broken");
        store.setMetadata("job1", Map.of("k", "v"));

        store.setTotal("job1", List.of(parts.get(0), parts.get(1)));

        JobStatus status = store.status("job1");
        assertEquals(2, status.getTotal());
        assertEquals(2, status.getRemaining());
        assertFalse(status.isFailed());
        assertTrue(status.getMetadata().isEmpty());
        assertFalse(store.status("job1", 0).isComplete());
        assertEquals(List.of("job1", "job2"), toList(store.listJobIds()));
    }

    @Test
    public void testCreateJobGeneratesId() {
        String jobId = store.createJob(parts, Map.of("owner", "tiler"));

        assertNotNull(jobId);
        JobStatus status = store.status(jobId);
        assertEquals(3, status.getTotal());
        assertEquals("tiler", status.getMetadata().get("owner"));
        assertNotEquals(jobId, store.createJob(parts, Map.of()));
    }

    @Test
    public void testRejectsEmptyJobId() {
        assertThrows(IllegalArgumentException.class, () -> store.setTotal("", parts));
        assertThrows(IllegalArgumentException.class, () -> store.status(null));
    }

    @Test
    public void testDescriptorNumbersKeepJavaTypes() {
        store.setTotal("123", List.of(Map.of("zoom", 12, "scale", 1.5, "name", "tile")));

        Map<String, Object> descriptor = toList(store.listPendingParts("123")).get(0);

        assertEquals(12, descriptor.get("zoom"));
        assertEquals(1.5, descriptor.get("scale"));
        assertEquals("tile", descriptor.get("name"));
    }

    @Test
    public void testEmptyMetadataValueIsKept() {
        store.setTotal("123", parts);
        store.setMetadata("123", Map.of("note", ""));

        assertEquals("", store.status("123").getMetadata().get("note"));
    }

    /** Only a delete that removed something is worth an INFO line. */
    @Test
    public void testDeleteLogLevelReflectsRemoval() {
        Logger logger = Logger.getLogger(ProgressStore.class.getName());
        List<LogRecord> records = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Level previous = logger.getLevel();
        logger.setLevel(Level.ALL);
        logger.addHandler(handler);
        try {
            store.delete("never-created");
            assertEquals(1, records.size());
            assertEquals(Level.FINE, records.get(0).getLevel());

            store.setTotal("123", parts);
            records.clear();
            store.delete("123");
            assertEquals(1, records.size());
            assertEquals(Level.INFO, records.get(0).getLevel());
        } finally {
            logger.removeHandler(handler);
            logger.setLevel(previous);
        }
    }
}
