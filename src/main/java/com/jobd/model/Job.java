package com.jobd.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Job {
    private String id;
    private String name;
    private String description;
    private String command;
    @JsonAlias("cwd")
    private String workingDirectory;
    @JsonAlias("env")
    private Map<String, String> environment = new LinkedHashMap<>();
    private Set<String> tags = new LinkedHashSet<>();
    private String user;
    private Integer priority;
    private Integer maxRetries;
    private Long timeout;
    private JobSchedule schedule;
    private Boolean enabled;

    private JobStatus status;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant lastRunAt;
    private int retryCount;
    private Long pid;
    private Integer exitCode;
    private String stdout;
    private String stderr;

    public Job() {}

    public Job(String id, String name, String command) {
        this.id = id;
        this.name = name;
        this.command = command;
    }

    /** Deep copy; the collections and the schedule are not shared with the original. */
    public Job copy() {
        Job j = new Job(id, name, command);
        j.description = description;
        j.workingDirectory = workingDirectory;
        j.environment = environment == null ? new LinkedHashMap<>() : new LinkedHashMap<>(environment);
        j.tags = tags == null ? new LinkedHashSet<>() : new LinkedHashSet<>(tags);
        j.user = user;
        j.priority = priority;
        j.maxRetries = maxRetries;
        j.timeout = timeout;
        j.schedule = schedule == null ? null : schedule.copy();
        j.enabled = enabled;
        j.status = status;
        j.createdAt = createdAt;
        j.startedAt = startedAt;
        j.completedAt = completedAt;
        j.lastRunAt = lastRunAt;
        j.retryCount = retryCount;
        j.pid = pid;
        j.exitCode = exitCode;
        j.stdout = stdout;
        j.stderr = stderr;
        return j;
    }

    public boolean isEnabled() { return enabled == null || enabled; }

    @JsonIgnore
    public boolean isScheduled() { return schedule != null && !schedule.isEmpty(); }

    public int maxRetriesOrZero() { return maxRetries == null ? 0 : maxRetries; }

    public long timeoutOrZero() { return timeout == null ? 0L : timeout; }

    // Getters and setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getCommand() { return command; }
    public void setCommand(String command) { this.command = command; }

    public String getWorkingDirectory() { return workingDirectory; }
    public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }

    public Map<String, String> getEnvironment() { return environment; }
    public void setEnvironment(Map<String, String> environment) { this.environment = environment; }

    public Set<String> getTags() { return tags; }
    public void setTags(Set<String> tags) { this.tags = tags; }

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }

    public Integer getPriority() { return priority; }
    public void setPriority(Integer priority) { this.priority = priority; }

    public Integer getMaxRetries() { return maxRetries; }
    public void setMaxRetries(Integer maxRetries) { this.maxRetries = maxRetries; }

    public Long getTimeout() { return timeout; }
    public void setTimeout(Long timeout) { this.timeout = timeout; }

    public JobSchedule getSchedule() { return schedule; }
    public void setSchedule(JobSchedule schedule) { this.schedule = schedule; }

    public Boolean getEnabled() { return enabled; }
    public void setEnabled(Boolean enabled) { this.enabled = enabled; }

    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public Instant getLastRunAt() { return lastRunAt; }
    public void setLastRunAt(Instant lastRunAt) { this.lastRunAt = lastRunAt; }

    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

    public Long getPid() { return pid; }
    public void setPid(Long pid) { this.pid = pid; }

    public Integer getExitCode() { return exitCode; }
    public void setExitCode(Integer exitCode) { this.exitCode = exitCode; }

    public String getStdout() { return stdout; }
    public void setStdout(String stdout) { this.stdout = stdout; }

    public String getStderr() { return stderr; }
    public void setStderr(String stderr) { this.stderr = stderr; }

    @Override
    public String toString() {
        return "Job{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", command='" + command + '\'' +
                ", status=" + status +
                ", retryCount=" + retryCount +
                ", maxRetries=" + maxRetries +
                ", pid=" + pid +
                ", exitCode=" + exitCode +
                '}';
    }
}
