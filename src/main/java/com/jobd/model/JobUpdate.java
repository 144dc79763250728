package com.jobd.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Partial change to a stored job. Only fields that were set are applied;
 * the {@code clear*} flags null out a field explicitly.
 */
public class JobUpdate {
    private String name;
    private String description;
    private String command;
    private String workingDirectory;
    private Map<String, String> environment;
    private Set<String> tags;
    private Integer priority;
    private Integer maxRetries;
    private Long timeout;
    private JobSchedule schedule;
    private Boolean enabled;
    private JobStatus status;
    private Instant startedAt;
    private Instant completedAt;
    private Instant lastRunAt;
    private Integer retryCount;
    private Long pid;
    private Integer exitCode;
    private String stdout;
    private String stderr;
    private boolean clearPid;
    private boolean clearCompletedAt;
    private boolean clearExitCode;

    public static JobUpdate create() {
        return new JobUpdate();
    }

    public JobUpdate name(String name) { this.name = name; return this; }
    public JobUpdate description(String description) { this.description = description; return this; }
    public JobUpdate command(String command) { this.command = command; return this; }
    public JobUpdate workingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; return this; }
    public JobUpdate environment(Map<String, String> environment) { this.environment = environment; return this; }
    public JobUpdate tags(Set<String> tags) { this.tags = tags; return this; }
    public JobUpdate priority(int priority) { this.priority = priority; return this; }
    public JobUpdate maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
    public JobUpdate timeout(long timeout) { this.timeout = timeout; return this; }
    public JobUpdate schedule(JobSchedule schedule) { this.schedule = schedule; return this; }
    public JobUpdate enabled(boolean enabled) { this.enabled = enabled; return this; }
    public JobUpdate status(JobStatus status) { this.status = status; return this; }
    public JobUpdate startedAt(Instant startedAt) { this.startedAt = startedAt; return this; }
    public JobUpdate completedAt(Instant completedAt) { this.completedAt = completedAt; return this; }
    public JobUpdate lastRunAt(Instant lastRunAt) { this.lastRunAt = lastRunAt; return this; }
    public JobUpdate retryCount(int retryCount) { this.retryCount = retryCount; return this; }
    public JobUpdate pid(long pid) { this.pid = pid; return this; }
    public JobUpdate exitCode(Integer exitCode) { this.exitCode = exitCode; return this; }
    public JobUpdate stdout(String stdout) { this.stdout = stdout; return this; }
    public JobUpdate stderr(String stderr) { this.stderr = stderr; return this; }
    public JobUpdate clearPid() { this.clearPid = true; return this; }
    public JobUpdate clearCompletedAt() { this.clearCompletedAt = true; return this; }
    public JobUpdate clearExitCode() { this.clearExitCode = true; return this; }

    /** Applies this change to {@code job} in place and returns it. */
    public Job applyTo(Job job) {
        if (name != null) job.setName(name);
        if (description != null) job.setDescription(description);
        if (command != null) job.setCommand(command);
        if (workingDirectory != null) job.setWorkingDirectory(workingDirectory);
        if (environment != null) job.setEnvironment(new LinkedHashMap<>(environment));
        if (tags != null) job.setTags(new LinkedHashSet<>(tags));
        if (priority != null) job.setPriority(priority);
        if (maxRetries != null) job.setMaxRetries(maxRetries);
        if (timeout != null) job.setTimeout(timeout);
        if (schedule != null) job.setSchedule(schedule.copy());
        if (enabled != null) job.setEnabled(enabled);
        if (status != null) job.setStatus(status);
        if (startedAt != null) job.setStartedAt(startedAt);
        if (completedAt != null) job.setCompletedAt(completedAt);
        if (lastRunAt != null) job.setLastRunAt(lastRunAt);
        if (retryCount != null) job.setRetryCount(retryCount);
        if (pid != null) job.setPid(pid);
        if (exitCode != null) job.setExitCode(exitCode);
        if (stdout != null) job.setStdout(stdout);
        if (stderr != null) job.setStderr(stderr);
        if (clearPid) job.setPid(null);
        if (clearCompletedAt) job.setCompletedAt(null);
        if (clearExitCode) job.setExitCode(null);
        return job;
    }
}
