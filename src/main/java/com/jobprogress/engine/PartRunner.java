package com.jobprogress.engine;

import com.jobprogress.core.JobDoesNotExistException;
import com.jobprogress.core.ProgressStore;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the work of a single part and records the result in a {@link ProgressStore}.
 *
 * <p>A worker that received a "process part" message hands the work to
 * {@link #run(String, int, PartWork)}, which handles every outcome:</p>
 * <ul>
 *   <li>Job already failed → work skipped, nothing recorded</li>
 *   <li>Work succeeded → part completed, outcome tells whether the job is now done</li>
 *   <li>InterruptedException → part left pending so a redelivery can pick it up</li>
 *   <li>Any other Exception → job marked failed with the error as reason, exception rethrown</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> Stateless apart from the store, which is itself safe for
 * concurrent use. One runner can serve a whole worker pool.</p>
 *
 * @see ProgressStore#completePart(String, int)
 * @see ProgressStore#failJob(String, String)
 */
public class PartRunner {
    private static final Logger logger = Logger.getLogger(PartRunner.class.getName());

    private final ProgressStore store;

    public PartRunner(ProgressStore store) {
        this.store = store;
    }

    /**
     * Execute one part.
     *
     * @param jobId the job the part belongs to
     * @param index the zero-based part index
     * @param work the business logic
     * @return what happened to the part
     * @throws JobDoesNotExistException if the job does not exist
     * @throws PartExecutionException if the work threw
     */
    public PartOutcome run(String jobId, int index, PartWork work) throws PartExecutionException {
        if (store.status(jobId).isFailed()) {
            logger.info("Skipping part " + index + " of failed job " + jobId);
            return PartOutcome.SKIPPED_JOB_FAILED;
        }

        try {
            work.execute(jobId, index);
        } catch (InterruptedException e) {
            logger.warning("Part " + index + " of job " + jobId + " was cancelled");
            Thread.currentThread().interrupt();
            throw new PartExecutionException(jobId, index, true, e);
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Part " + index + " of job " + jobId + " failed", e);
            String reason = e.getClass().getSimpleName() + ": " + e.getMessage();
            try {
                store.failJob(jobId, reason);
            } catch (RuntimeException ex) {
                e.addSuppressed(ex);
            }
            throw new PartExecutionException(jobId, index, false, e);
        }

        boolean jobDone = store.completePart(jobId, index);
        return jobDone ? PartOutcome.JOB_COMPLETED : PartOutcome.PART_COMPLETED;
    }
}
