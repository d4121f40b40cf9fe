package com.jobprogress.engine;

/**
 * The business logic for one part of a fan-out job.
 *
 * <p>Implementations should throw InterruptedException when they stop because the
 * worker is shutting down; {@link PartRunner} treats that as a cancellation rather than
 * a failure of the job.</p>
 */
@FunctionalInterface
public interface PartWork {

    /**
     * Process one part.
     *
     * @param jobId the job the part belongs to
     * @param index the zero-based part index
     * @throws Exception if processing failed
     */
    void execute(String jobId, int index) throws Exception;
}
