package com.jobd.repo;

public class JobNotFoundException extends RuntimeException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job " + jobId + " not found");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
