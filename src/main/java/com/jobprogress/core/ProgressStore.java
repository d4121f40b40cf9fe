package com.jobprogress.core;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Authoritative progress ledger for fan-out jobs.
 *
 * <p>A job owner registers a job with {@link #setTotal(String, List)}. Workers, which never
 * talk to each other, report finished parts with {@link #completePart(String, int)}. Anyone
 * may query {@link #status(String)}, {@link #listJobs()} or {@link #listPendingParts(String)}.
 * {@link #failJob(String, String)} and {@link #delete(String)} are administrative.</p>
 *
 * <p><b>Completion protocol:</b> removing the pending entry of a part is the gate for
 * decrementing the remaining count. The backend performs the remove, the conditional
 * decrement and the optional purge as one atomic unit, so duplicate deliveries never
 * decrement twice and exactly one call observes the job reaching zero.</p>
 *
 * <p><b>Job lifecycle:</b></p>
 * <ul>
 *   <li>Absent → Active: {@code setTotal}</li>
 *   <li>Active → Active: {@code completePart} with parts left, {@code setMetadata},
 *       repeated {@code setTotal}</li>
 *   <li>Active → Completed: the {@code completePart} that drives remaining to 0</li>
 *   <li>Completed → Absent: automatic when delete-when-done is enabled</li>
 *   <li>any → Failed flag: {@code failJob}, orthogonal to completion</li>
 *   <li>any → Absent: {@code delete}</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> This class holds no mutable state of its own. All coordination
 * happens in the backing store, so one instance may be shared by many threads and many
 * processes may run their own instances against the same store.</p>
 *
 * @see ProgressBackend
 * @see JobDoesNotExistException
 */
public class ProgressStore implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ProgressStore.class.getName());

    /** Metadata key under which {@link #failJob(String, String)} records its reason. */
    public static final String FAILURE_REASON_KEY = "failure_reason";

    static final int DEFAULT_PAGE_SIZE = 100;

    private final ProgressBackend backend;
    private final String topic;
    private final boolean deleteWhenDone;
    private final int pageSize;

    /**
     * Create a store over an explicitly owned backend.
     *
     * @param backend the backing store handle; closed together with this store
     * @param topic correlation topic recorded on every job, may be null
     * @param deleteWhenDone purge a job as soon as its last part completes
     */
    public ProgressStore(ProgressBackend backend, String topic, boolean deleteWhenDone) {
        this(backend, topic, deleteWhenDone, DEFAULT_PAGE_SIZE);
    }

    /**
     * Create a store over an explicitly owned backend.
     *
     * @param backend the backing store handle; closed together with this store
     * @param topic correlation topic recorded on every job, may be null
     * @param deleteWhenDone purge a job as soon as its last part completes
     * @param pageSize number of entries fetched per round-trip by the lazy listings
     */
    public ProgressStore(ProgressBackend backend, String topic, boolean deleteWhenDone, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        this.backend = Objects.requireNonNull(backend, "backend");
        this.topic = topic;
        this.deleteWhenDone = deleteWhenDone;
        this.pageSize = pageSize;
    }

    /**
     * Register a job and its parts, resetting any job with the same id.
     *
     * <p>Writes total and remaining equal to the number of parts, clears the failed flag
     * and metadata, and records one pending entry per index. A job with zero parts is
     * accepted and reports itself complete right away.</p>
     *
     * @param jobId the job identifier
     * @param parts part descriptors in index order
     */
    public void setTotal(String jobId, List<? extends Map<String, ?>> parts) {
        requireJobId(jobId);
        Objects.requireNonNull(parts, "parts");

        List<String> encoded = new ArrayList<>(parts.size());
        for (Map<String, ?> part : parts) {
            encoded.add(JsonCodec.encode(Objects.requireNonNull(part, "part descriptor")));
        }
        backend.createJob(jobId, topic, encoded);
        logger.info("Registered job " + jobId + " with " + encoded.size() + " parts");
    }

    /**
     * Register a job under a freshly generated id and attach initial metadata.
     *
     * @param parts part descriptors in index order
     * @param metadata initial metadata, may be empty
     * @return the generated job id
     */
    public String createJob(List<? extends Map<String, ?>> parts, Map<String, String> metadata) {
        String jobId = UUID.randomUUID().toString();
        setTotal(jobId, parts);
        if (metadata != null && !metadata.isEmpty()) {
            setMetadata(jobId, metadata);
        }
        return jobId;
    }

    /**
     * Mark one part complete.
     *
     * <p>Calling this more than once for the same index is harmless: only the call that
     * actually removes the pending entry decrements the remaining count.</p>
     *
     * @param jobId the job identifier
     * @param index the zero-based part index
     * @return true if and only if this call completed the job
     * @throws JobDoesNotExistException if the job does not exist
     * @throws IllegalArgumentException if the index is outside {@code [0, total)}
     */
    public boolean completePart(String jobId, int index) {
        requireJobId(jobId);
        requireIndex(index);

        CompletionOutcome outcome = backend.completePart(jobId, index, deleteWhenDone);
        switch (outcome) {
            case NO_SUCH_JOB:
                throw new JobDoesNotExistException(jobId);
            case INDEX_OUT_OF_RANGE:
                throw new IllegalArgumentException("Part " + index + " is out of range for job " + jobId);
            case ALREADY_COMPLETE:
                logger.fine("Duplicate completion of part " + index + " for job " + jobId);
                return false;
            case PART_COMPLETED:
                logger.fine("Completed part " + index + " of job " + jobId);
                return false;
            case JOB_COMPLETED:
                logger.info("Job " + jobId + " completed with part " + index
                        + (deleteWhenDone ? ", job deleted" : ""));
                return true;
            default:
                throw new IllegalStateException("Unhandled outcome: " + outcome);
        }
    }

    /**
     * Flag a job as failed and record why.
     *
     * <p>The reason lands in the metadata under {@link #FAILURE_REASON_KEY}. Remaining and
     * total are untouched and parts can still be completed.</p>
     *
     * @param jobId the job identifier
     * @param reason human-readable cause, may be null
     * @throws JobDoesNotExistException if the job does not exist
     */
    public void failJob(String jobId, String reason) {
        requireJobId(jobId);
        Map<String, String> updates = reason == null ? Map.of() : Map.of(FAILURE_REASON_KEY, reason);
        if (!backend.mergeMetadata(jobId, updates, true)) {
            throw new JobDoesNotExistException(jobId);
        }
        logger.warning("Job " + jobId + " marked failed: " + reason);
    }

    /**
     * Merge keys into a job's metadata. Keys not mentioned keep their values.
     *
     * @param jobId the job identifier
     * @param metadata keys to overwrite
     * @throws JobDoesNotExistException if the job does not exist
     */
    public void setMetadata(String jobId, Map<String, String> metadata) {
        requireJobId(jobId);
        Objects.requireNonNull(metadata, "metadata");
        if (!backend.mergeMetadata(jobId, metadata, false)) {
            throw new JobDoesNotExistException(jobId);
        }
    }

    /**
     * Read the progress of a job.
     *
     * @param jobId the job identifier
     * @return total, remaining, progress, failed flag and metadata
     * @throws JobDoesNotExistException if the job does not exist
     */
    public JobStatus status(String jobId) {
        requireJobId(jobId);
        return backend.readJob(jobId)
                .map(JobStatus::new)
                .orElseThrow(() -> new JobDoesNotExistException(jobId));
    }

    /**
     * Read the completion state of one part.
     *
     * @param jobId the job identifier
     * @param part the zero-based part index
     * @return whether the part is complete
     * @throws JobDoesNotExistException if the job does not exist, including after auto-delete
     * @throws IllegalArgumentException if the index is outside {@code [0, total)}
     */
    public PartStatus status(String jobId, int part) {
        requireJobId(jobId);
        requireIndex(part);

        ProgressBackend.PartState state = backend.partState(jobId, part);
        switch (state) {
            case NO_SUCH_JOB:
                throw new JobDoesNotExistException(jobId);
            case INDEX_OUT_OF_RANGE:
                throw new IllegalArgumentException("Part " + part + " is out of range for job " + jobId);
            case PENDING:
                return new PartStatus(part, false);
            case COMPLETE:
                return new PartStatus(part, true);
            default:
                throw new IllegalStateException("Unhandled part state: " + state);
        }
    }

    /**
     * Enumerate the ids of all existing jobs in creation order.
     *
     * <p>Enumeration is driven off the job records, so completed jobs that were not
     * deleted are included. Pages are fetched lazily while iterating.</p>
     *
     * @return a lazy, restartable sequence of job ids
     */
    public Iterable<String> listJobIds() {
        return () -> new Iterator<String>() {
            private final Iterator<ProgressBackend.JobRef> refs = jobRefs();

            @Override
            public boolean hasNext() {
                return refs.hasNext();
            }

            @Override
            public String next() {
                return refs.next().getJobId();
            }
        };
    }

    /**
     * Enumerate all existing jobs with a status snapshot each.
     *
     * <p>Each snapshot is read separately and is not atomic with the enumeration. A job
     * deleted between being listed and being read is skipped.</p>
     *
     * @return a lazy, restartable sequence of job listings
     */
    public Iterable<JobListing> listJobs() {
        return () -> new Iterator<JobListing>() {
            private final Iterator<ProgressBackend.JobRef> refs = jobRefs();
            private JobListing lookahead;

            @Override
            public boolean hasNext() {
                while (lookahead == null && refs.hasNext()) {
                    String jobId = refs.next().getJobId();
                    Optional<JobRecord> record = backend.readJob(jobId);
                    if (record.isPresent()) {
                        lookahead = new JobListing(jobId, new JobStatus(record.get()));
                    } else {
                        logger.fine("Job " + jobId + " vanished during listing");
                    }
                }
                return lookahead != null;
            }

            @Override
            public JobListing next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                JobListing result = lookahead;
                lookahead = null;
                return result;
            }
        };
    }

    /**
     * Enumerate the descriptors of parts that are still pending, in index order.
     *
     * <p>Existence is checked when this method is called. Each iteration starts over and
     * reflects completions made in the meantime.</p>
     *
     * <p>Descriptors pass through JSON, so numbers come back as {@link Integer}, {@link Long}
     * or {@link Double} whatever numeric type was registered.</p>
     *
     * @param jobId the job identifier
     * @return a lazy, restartable sequence of descriptors; empty if nothing is pending
     * @throws JobDoesNotExistException if the job does not exist
     */
    public Iterable<Map<String, Object>> listPendingParts(String jobId) {
        requireJobId(jobId);
        if (backend.readJob(jobId).isEmpty()) {
            throw new JobDoesNotExistException(jobId);
        }
        return () -> new PagedIterator<Map<String, Object>>() {
            private int lastIndex = -1;

            @Override
            protected List<Map<String, Object>> nextPage() {
                List<ProgressBackend.PendingPart> parts = backend.pendingParts(jobId, lastIndex, pageSize);
                List<Map<String, Object>> descriptors = new ArrayList<>(parts.size());
                for (ProgressBackend.PendingPart part : parts) {
                    descriptors.add(JsonCodec.decode(part.getDescriptor()));
                    lastIndex = part.getIndex();
                }
                return descriptors;
            }
        };
    }

    /**
     * Remove a job and its pending parts. Deleting an absent job does nothing.
     *
     * @param jobId the job identifier
     */
    public void delete(String jobId) {
        requireJobId(jobId);
        if (backend.deleteJob(jobId)) {
            logger.info("Deleted job " + jobId);
        } else {
            logger.fine("Nothing to delete for job " + jobId);
        }
    }

    public String getTopic() {
        return topic;
    }

    public boolean isDeleteWhenDone() {
        return deleteWhenDone;
    }

    /** Close the owned backend and its connections. */
    @Override
    public void close() {
        backend.close();
    }

    private Iterator<ProgressBackend.JobRef> jobRefs() {
        return new PagedIterator<ProgressBackend.JobRef>() {
            private long lastSequence = 0;

            @Override
            protected List<ProgressBackend.JobRef> nextPage() {
                List<ProgressBackend.JobRef> refs = backend.jobIds(lastSequence, pageSize);
                if (!refs.isEmpty()) {
                    lastSequence = refs.get(refs.size() - 1).getSequence();
                }
                return refs;
            }
        };
    }

    private static void requireJobId(String jobId) {
        if (jobId == null || jobId.isEmpty()) {
            throw new IllegalArgumentException("jobId must not be empty");
        }
    }

    private static void requireIndex(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Part index must not be negative: " + index);
        }
    }
}
