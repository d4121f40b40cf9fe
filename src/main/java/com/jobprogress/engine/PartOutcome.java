package com.jobprogress.engine;

/** What {@link PartRunner#run} did with a part. */
public enum PartOutcome {
    /** The job was already failed, so the work was not started. */
    SKIPPED_JOB_FAILED,
    /** The work ran and the part was recorded; other parts are still pending. */
    PART_COMPLETED,
    /** The work ran and this part was the last one pending. */
    JOB_COMPLETED;

    public boolean isJobComplete() {
        return this == JOB_COMPLETED;
    }
}
