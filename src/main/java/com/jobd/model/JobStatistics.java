package com.jobd.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobStatistics {
    static final int COMMON_ERROR_LIMIT = 5;

    private String jobId;
    private String jobName;
    private int totalExecutions;
    private int successfulExecutions;
    private int failedExecutions;
    private double successRate;
    private double averageDuration;
    private Instant lastExecution;
    private Instant lastSuccess;
    private Instant lastFailure;
    private List<ErrorCount> commonErrors = new ArrayList<>();

    /** A failure message and how many failed executions reported it. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ErrorCount {
        private String error;
        private int count;

        public ErrorCount() {}

        public ErrorCount(String error, int count) {
            this.error = error;
            this.count = count;
        }

        public String getError() { return error; }
        public void setError(String error) { this.error = error; }

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }
    }

    public JobStatistics() {}

    /**
     * Summarises {@code executions}, which must be ordered newest first.
     */
    public static JobStatistics of(Job job, List<Execution> executions) {
        JobStatistics s = new JobStatistics();
        s.jobId = job.getId();
        s.jobName = job.getName();
        s.totalExecutions = executions.size();
        long durationSum = 0;
        int finished = 0;
        Map<String, Integer> errors = new LinkedHashMap<>();
        for (Execution e : executions) {
            if (e.getStatus() == ExecutionStatus.COMPLETED) {
                s.successfulExecutions++;
                if (s.lastSuccess == null) s.lastSuccess = e.getStartTime();
            } else if (e.getStatus() == ExecutionStatus.FAILED || e.getStatus() == ExecutionStatus.TIMEOUT) {
                s.failedExecutions++;
                if (s.lastFailure == null) s.lastFailure = e.getStartTime();
                String error = failureMessage(e);
                if (error != null) errors.merge(error, 1, Integer::sum);
            }
            if (e.getDuration() != null) {
                durationSum += e.getDuration();
                finished++;
            }
        }
        s.successRate = s.totalExecutions > 0 ? (s.successfulExecutions * 100.0) / s.totalExecutions : 0;
        s.averageDuration = finished > 0 ? (double) durationSum / finished : 0;
        s.lastExecution = executions.isEmpty() ? null : executions.get(0).getStartTime();
        errors.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(COMMON_ERROR_LIMIT)
                .forEach(en -> s.commonErrors.add(new ErrorCount(en.getKey(), en.getValue())));
        return s;
    }

    // error message first, stderr as fallback
    private static String failureMessage(Execution e) {
        if (e.getErrorMessage() != null && !e.getErrorMessage().isBlank()) return e.getErrorMessage().trim();
        if (e.getStderr() != null && !e.getStderr().isBlank()) return e.getStderr().trim();
        return null;
    }

    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }

    public String getJobName() { return jobName; }
    public void setJobName(String jobName) { this.jobName = jobName; }

    public int getTotalExecutions() { return totalExecutions; }
    public void setTotalExecutions(int totalExecutions) { this.totalExecutions = totalExecutions; }

    public int getSuccessfulExecutions() { return successfulExecutions; }
    public void setSuccessfulExecutions(int successfulExecutions) { this.successfulExecutions = successfulExecutions; }

    public int getFailedExecutions() { return failedExecutions; }
    public void setFailedExecutions(int failedExecutions) { this.failedExecutions = failedExecutions; }

    public double getSuccessRate() { return successRate; }
    public void setSuccessRate(double successRate) { this.successRate = successRate; }

    public double getAverageDuration() { return averageDuration; }
    public void setAverageDuration(double averageDuration) { this.averageDuration = averageDuration; }

    public Instant getLastExecution() { return lastExecution; }
    public void setLastExecution(Instant lastExecution) { this.lastExecution = lastExecution; }

    public Instant getLastSuccess() { return lastSuccess; }
    public void setLastSuccess(Instant lastSuccess) { this.lastSuccess = lastSuccess; }

    public Instant getLastFailure() { return lastFailure; }
    public void setLastFailure(Instant lastFailure) { this.lastFailure = lastFailure; }

    public List<ErrorCount> getCommonErrors() { return commonErrors; }
    public void setCommonErrors(List<ErrorCount> commonErrors) { this.commonErrors = commonErrors; }
}
