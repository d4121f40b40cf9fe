package com.jobprogress.engine;

/**
 * Raised by {@link PartRunner} when the work of a part threw.
 *
 * <p>The original exception is the cause. {@link #isCancelled()} tells a cancellation
 * (the job was left untouched) apart from a failure (the job was marked failed).</p>
 */
public class PartExecutionException extends Exception {

    private final String jobId;
    private final int index;
    private final boolean cancelled;

    public PartExecutionException(String jobId, int index, boolean cancelled, Throwable cause) {
        super((cancelled ? "Cancelled" : "Failed") + " part " + index + " of job " + jobId, cause);
        this.jobId = jobId;
        this.index = index;
        this.cancelled = cancelled;
    }

    public String getJobId() {
        return jobId;
    }

    public int getIndex() {
        return index;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
