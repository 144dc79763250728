package com.jobd.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot answered by the {@code status} command.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DaemonStatus {
    private boolean running;
    private long pid;
    private long uptime;
    private String socketPath;
    private String storeType;
    private JobCounts jobs = new JobCounts();
    private int executions;
    private MemoryUsage memory = new MemoryUsage();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobCounts {
        private int total;
        private int running;
        private int completed;
        private int failed;
        private Map<String, Integer> byStatus = new LinkedHashMap<>();

        public int getTotal() { return total; }
        public void setTotal(int total) { this.total = total; }

        public int getRunning() { return running; }
        public void setRunning(int running) { this.running = running; }

        public int getCompleted() { return completed; }
        public void setCompleted(int completed) { this.completed = completed; }

        public int getFailed() { return failed; }
        public void setFailed(int failed) { this.failed = failed; }

        public Map<String, Integer> getByStatus() { return byStatus; }
        public void setByStatus(Map<String, Integer> byStatus) { this.byStatus = byStatus; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MemoryUsage {
        private long heapUsed;
        private long heapTotal;
        private long heapMax;

        public long getHeapUsed() { return heapUsed; }
        public void setHeapUsed(long heapUsed) { this.heapUsed = heapUsed; }

        public long getHeapTotal() { return heapTotal; }
        public void setHeapTotal(long heapTotal) { this.heapTotal = heapTotal; }

        public long getHeapMax() { return heapMax; }
        public void setHeapMax(long heapMax) { this.heapMax = heapMax; }
    }

    // Getters and setters
    public boolean isRunning() { return running; }
    public void setRunning(boolean running) { this.running = running; }

    public long getPid() { return pid; }
    public void setPid(long pid) { this.pid = pid; }

    /** Seconds since the daemon started. */
    public long getUptime() { return uptime; }
    public void setUptime(long uptime) { this.uptime = uptime; }

    public String getSocketPath() { return socketPath; }
    public void setSocketPath(String socketPath) { this.socketPath = socketPath; }

    public String getStoreType() { return storeType; }
    public void setStoreType(String storeType) { this.storeType = storeType; }

    public JobCounts getJobs() { return jobs; }
    public void setJobs(JobCounts jobs) { this.jobs = jobs; }

    public int getExecutions() { return executions; }
    public void setExecutions(int executions) { this.executions = executions; }

    public MemoryUsage getMemory() { return memory; }
    public void setMemory(MemoryUsage memory) { this.memory = memory; }
}
