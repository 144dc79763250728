package com.jobd.audit;

import java.time.Instant;

/**
 * One client-side action on a job, mirrored to durable storage independently of the daemon.
 */
public class AuditRecord {
    private String userName;
    private String sessionId;
    private String jobId;
    private String command;
    private String status;
    private String workingDirectory;
    private Instant startedAt;
    private Instant completedAt;
    private Integer exitCode;
    private String output;
    private String error;

    public AuditRecord() {}

    public AuditRecord(String userName, String sessionId, String jobId, String command, String status) {
        this.userName = userName;
        this.sessionId = sessionId;
        this.jobId = jobId;
        this.command = command;
        this.status = status;
    }

    public String getUserName() { return userName; }
    public void setUserName(String userName) { this.userName = userName; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }

    public String getCommand() { return command; }
    public void setCommand(String command) { this.command = command; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getWorkingDirectory() { return workingDirectory; }
    public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public Integer getExitCode() { return exitCode; }
    public void setExitCode(Integer exitCode) { this.exitCode = exitCode; }

    public String getOutput() { return output; }
    public void setOutput(String output) { this.output = output; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    @Override
    public String toString() {
        return "AuditRecord{jobId='" + jobId + "', status='" + status + "', sessionId='" + sessionId + "'}";
    }
}
