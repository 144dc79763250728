package com.jobd.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a synchronous, manually triggered run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TriggerResult {
    private boolean success;
    private String jobId;
    private String executionId;
    private JobStatus status;
    private Integer exitCode;
    private String output;
    private String error;

    public TriggerResult() {}

    public static TriggerResult of(Job job, Execution last) {
        TriggerResult r = new TriggerResult();
        r.jobId = job.getId();
        r.status = job.getStatus();
        r.success = job.getStatus() == JobStatus.COMPLETED;
        if (last != null) {
            r.executionId = last.getExecutionId();
            r.exitCode = last.getExitCode();
            r.output = last.getStdout();
            r.error = last.getErrorMessage() != null ? last.getErrorMessage() : emptyToNull(last.getStderr());
        }
        return r;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }

    public String getExecutionId() { return executionId; }
    public void setExecutionId(String executionId) { this.executionId = executionId; }

    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }

    public Integer getExitCode() { return exitCode; }
    public void setExitCode(Integer exitCode) { this.exitCode = exitCode; }

    public String getOutput() { return output; }
    public void setOutput(String output) { this.output = output; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
}
