package com.jobprogress.core;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage seam between {@link ProgressStore} and a shared backing store.
 *
 * <p>Every method is one atomic unit against the store. Implementations must guarantee
 * that {@link #completePart} runs its check-remove-decrement sequence linearizably per
 * job, using a transaction or a server-side script, and never as a read followed by an
 * independent write. Operations on different job ids must not block each other.</p>
 *
 * <p>Values crossing this interface are already encoded: descriptors are JSON text and
 * metadata is a flat string map.</p>
 */
public interface ProgressBackend extends AutoCloseable {

    /**
     * Register a job, replacing any state held under the same id.
     *
     * @param jobId the job identifier
     * @param topic correlation topic stored verbatim, may be null
     * @param encodedParts descriptor JSON per part, in index order
     */
    void createJob(String jobId, String topic, List<String> encodedParts);

    /**
     * Remove a pending part and, only if it was present, decrement remaining.
     *
     * @param jobId the job identifier
     * @param index the zero-based part index, already checked to be non-negative
     * @param deleteWhenDone purge the job in the same unit when remaining reaches zero
     * @return what the step did
     */
    CompletionOutcome completePart(String jobId, int index, boolean deleteWhenDone);

    /**
     * Read the job record.
     *
     * @param jobId the job identifier
     * @return the record, or empty if the job does not exist
     */
    Optional<JobRecord> readJob(String jobId);

    /**
     * Merge metadata into an existing job and optionally set the failed flag.
     *
     * @param jobId the job identifier
     * @param updates keys to overwrite
     * @param markFailed whether to set failed to true
     * @return false if the job does not exist, in which case nothing is written
     */
    boolean mergeMetadata(String jobId, Map<String, String> updates, boolean markFailed);

    /**
     * Look up one part.
     *
     * @param jobId the job identifier
     * @param index the zero-based part index, already checked to be non-negative
     * @return the state of the part
     */
    PartState partState(String jobId, int index);

    /**
     * Fetch a page of pending parts in index order.
     *
     * @param jobId the job identifier
     * @param afterIndex only parts with a greater index are returned; pass -1 to start
     * @param limit maximum number of parts to return
     * @return the page, empty when nothing is left or the job is gone
     */
    List<PendingPart> pendingParts(String jobId, int afterIndex, int limit);

    /**
     * Fetch a page of job ids in creation order.
     *
     * @param afterSequence only jobs created after this sequence are returned; pass 0 to start
     * @param limit maximum number of ids to return
     * @return the page, empty when enumeration is finished
     */
    List<JobRef> jobIds(long afterSequence, int limit);

    /**
     * Delete the job record and its pending parts. Deleting a missing job is a no-op.
     *
     * @param jobId the job identifier
     * @return true if a job record was removed
     */
    boolean deleteJob(String jobId);

    /** Release the connection resources held by this backend. */
    @Override
    void close();

    /** Answer of {@link #partState(String, int)}. */
    enum PartState {
        NO_SUCH_JOB,
        INDEX_OUT_OF_RANGE,
        PENDING,
        COMPLETE
    }

    /** A pending part with its still-encoded descriptor. */
    final class PendingPart {
        private final int index;
        private final String descriptor;

        public PendingPart(int index, String descriptor) {
            this.index = index;
            this.descriptor = descriptor;
        }

        public int getIndex() { return index; }

        public String getDescriptor() { return descriptor; }
    }

    /** A job id with the creation sequence used as enumeration cursor. */
    final class JobRef {
        private final String jobId;
        private final long sequence;

        public JobRef(String jobId, long sequence) {
            this.jobId = jobId;
            this.sequence = sequence;
        }

        public String getJobId() { return jobId; }

        public long getSequence() { return sequence; }
    }
}
