package com.jobprogress.core;

/** A job id paired with a best-effort status snapshot, yielded by {@link ProgressStore#listJobs()}. */
public final class JobListing {
    private final String jobId;
    private final JobStatus status;

    JobListing(String jobId, JobStatus status) {
        this.jobId = jobId;
        this.status = status;
    }

    public String getJobId() {
        return jobId;
    }

    public JobStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "JobListing{jobId='" + jobId + "', status=" + status + "}";
    }
}
