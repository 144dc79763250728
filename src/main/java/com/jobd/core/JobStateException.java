package com.jobd.core;

/**
 * The requested operation does not fit the job's current state.
 */
public class JobStateException extends RuntimeException {
    private final String jobId;

    public JobStateException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
