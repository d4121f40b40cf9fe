package com.jobprogress.core;

import org.json.JSONObject;

import java.util.Map;

/**
 * Point-in-time view of a job's progress as returned by {@link ProgressStore#status(String)}.
 *
 * <p>Completion and failure are independent axes: a failed job keeps counting completed
 * parts, and a completed job can still be marked failed afterwards.</p>
 *
 * <p>State summary:</p>
 * <ul>
 *   <li>Active: {@code remaining > 0}</li>
 *   <li>Completed: {@code remaining == 0}</li>
 *   <li>Failed: {@code failed == true}, combinable with either of the above</li>
 * </ul>
 *
 * <p>Thread Safety: instances are immutable.</p>
 */
public final class JobStatus {
    private final int total;
    private final int remaining;
    private final boolean failed;
    private final Map<String, String> metadata;

    JobStatus(JobRecord record) {
        this.total = record.getTotal();
        this.remaining = record.getRemaining();
        this.failed = record.isFailed();
        this.metadata = record.getMetadata();
    }

    /**
     * Number of parts the job was registered with.
     *
     * @return the total part count
     */
    public int getTotal() {
        return total;
    }

    /**
     * Number of parts not yet marked complete.
     *
     * @return the remaining part count, between 0 and {@link #getTotal()}
     */
    public int getRemaining() {
        return remaining;
    }

    /**
     * Fraction of parts completed.
     *
     * <p>Computed as {@code (total - remaining) / total}. A job registered with zero parts
     * reports 0 so callers never see a division by zero.</p>
     *
     * @return progress in the range [0, 1]
     */
    public double getProgress() {
        if (total == 0) {
            return 0.0;
        }
        return (double) (total - remaining) / total;
    }

    public boolean isFailed() {
        return failed;
    }

    /**
     * Whether every part has been completed.
     *
     * @return true when no parts remain
     */
    public boolean isComplete() {
        return remaining == 0;
    }

    /**
     * Job metadata, including the failure reason once {@link ProgressStore#failJob} ran.
     *
     * @return an unmodifiable metadata map
     */
    public Map<String, String> getMetadata() {
        return metadata;
    }

    /**
     * Reason recorded by {@link ProgressStore#failJob(String, String)}.
     *
     * @return the reason, or null if none was recorded
     */
    public String getFailureReason() {
        return metadata.get(ProgressStore.FAILURE_REASON_KEY);
    }

    /**
     * Render the status the way it is exchanged with other services.
     *
     * @return a JSON object with total, remaining, progress, failed and metadata
     */
    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("total", total);
        json.put("remaining", remaining);
        json.put("progress", getProgress());
        json.put("failed", failed);
        json.put("metadata", new JSONObject(metadata));
        return json;
    }

    @Override
    public String toString() {
        return "JobStatus{total=" + total + ", remaining=" + remaining + ", failed=" + failed + "}";
    }
}
