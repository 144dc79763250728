package com.jobd.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * One run attempt of a job. Written when the attempt starts and once more when it ends.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Execution {
    private String executionId;
    private String jobId;
    private String jobName;
    private String command;
    private int attempt;
    private Instant startTime;
    private Instant endTime;
    private ExecutionStatus status;
    private Integer exitCode;
    private String stdout;
    private String stderr;
    private String errorMessage;

    public Execution() {}

    public static Execution started(String executionId, Job job, int attempt, Instant startTime) {
        Execution e = new Execution();
        e.executionId = executionId;
        e.jobId = job.getId();
        e.jobName = job.getName();
        e.command = job.getCommand();
        e.attempt = attempt;
        e.startTime = startTime;
        e.status = ExecutionStatus.RUNNING;
        return e;
    }

    /** Returns a finished copy of this running record. */
    public Execution finish(Instant endTime, ExecutionStatus status, Integer exitCode,
                            String stdout, String stderr, String errorMessage) {
        Execution e = copy();
        e.endTime = endTime;
        e.status = status;
        e.exitCode = exitCode;
        e.stdout = stdout;
        e.stderr = stderr;
        e.errorMessage = errorMessage;
        return e;
    }

    public Execution copy() {
        Execution e = new Execution();
        e.executionId = executionId;
        e.jobId = jobId;
        e.jobName = jobName;
        e.command = command;
        e.attempt = attempt;
        e.startTime = startTime;
        e.endTime = endTime;
        e.status = status;
        e.exitCode = exitCode;
        e.stdout = stdout;
        e.stderr = stderr;
        e.errorMessage = errorMessage;
        return e;
    }

    /** Milliseconds between start and end, or null while running. */
    @JsonProperty(value = "duration", access = JsonProperty.Access.READ_ONLY)
    public Long getDuration() {
        if (startTime == null || endTime == null) return null;
        return Duration.between(startTime, endTime).toMillis();
    }

    public String getExecutionId() { return executionId; }
    public void setExecutionId(String executionId) { this.executionId = executionId; }

    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }

    public String getJobName() { return jobName; }
    public void setJobName(String jobName) { this.jobName = jobName; }

    public String getCommand() { return command; }
    public void setCommand(String command) { this.command = command; }

    public int getAttempt() { return attempt; }
    public void setAttempt(int attempt) { this.attempt = attempt; }

    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }

    public Instant getEndTime() { return endTime; }
    public void setEndTime(Instant endTime) { this.endTime = endTime; }

    public ExecutionStatus getStatus() { return status; }
    public void setStatus(ExecutionStatus status) { this.status = status; }

    public Integer getExitCode() { return exitCode; }
    public void setExitCode(Integer exitCode) { this.exitCode = exitCode; }

    public String getStdout() { return stdout; }
    public void setStdout(String stdout) { this.stdout = stdout; }

    public String getStderr() { return stderr; }
    public void setStderr(String stderr) { this.stderr = stderr; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    @Override
    public String toString() {
        return "Execution{" +
                "executionId='" + executionId + '\'' +
                ", jobId='" + jobId + '\'' +
                ", attempt=" + attempt +
                ", status=" + status +
                ", exitCode=" + exitCode +
                ", startTime=" + startTime +
                ", endTime=" + endTime +
                '}';
    }
}
