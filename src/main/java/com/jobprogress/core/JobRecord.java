package com.jobprogress.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-job summary state as persisted by a backend.
 *
 * <p>Instances are immutable snapshots. They are produced by
 * {@link ProgressBackend#readJob(String)} and turned into a {@link JobStatus} by the store.</p>
 */
public final class JobRecord {
    private final String jobId;
    private final int total;
    private final int remaining;
    private final boolean failed;
    private final Map<String, String> metadata;
    private final String topic;

    public JobRecord(String jobId, int total, int remaining, boolean failed,
                     Map<String, String> metadata, String topic) {
        this.jobId = jobId;
        this.total = total;
        this.remaining = remaining;
        this.failed = failed;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.topic = topic;
    }

    public String getJobId() { return jobId; }

    public int getTotal() { return total; }

    public int getRemaining() { return remaining; }

    public boolean isFailed() { return failed; }

    public Map<String, String> getMetadata() { return metadata; }

    public String getTopic() { return topic; }

    @Override
    public String toString() {
        return "JobRecord{jobId='" + jobId + "', total=" + total + ", remaining=" + remaining
                + ", failed=" + failed + "}";
    }
}
