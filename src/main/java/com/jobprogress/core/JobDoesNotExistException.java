package com.jobprogress.core;

/**
 * Exception thrown when an operation needs a job that the store does not hold.
 *
 * <p>This is the only domain error raised by {@link ProgressStore}. A job is missing when
 * it was never registered, was deleted explicitly, or was purged automatically because
 * its last part completed while the store runs with delete-when-done enabled.</p>
 *
 * <p><b>Recovery:</b> The caller decides what absence means. Typical reactions are
 * re-registering the job with {@link ProgressStore#setTotal(String, java.util.List)} or
 * treating the job as finished and cleaned up.</p>
 *
 * <p><b>Example Handling:</b></p>
 * <pre>{@code
 * try {
 *     store.completePart(jobId, index);
 * } catch (JobDoesNotExistException e) {
 *     logger.info("Job " + e.getJobId() + " is gone, dropping duplicate signal");
 * }
 * }</pre>
 *
 * @see ProgressStore
 */
public class JobDoesNotExistException extends RuntimeException {

    private final String jobId;

    /**
     * Create a new JobDoesNotExistException for the given job.
     *
     * @param jobId the identifier that has no job record
     */
    public JobDoesNotExistException(String jobId) {
        super("Job does not exist: " + jobId);
        this.jobId = jobId;
    }

    /**
     * Get the identifier of the missing job.
     *
     * @return the job id passed to the failed operation
     */
    public String getJobId() {
        return jobId;
    }
}
