package com.jobd.core;

import com.jobd.model.Execution;
import com.jobd.model.Job;
import com.jobd.model.JobFilter;
import com.jobd.model.JobSchedule;
import com.jobd.model.JobStatistics;
import com.jobd.model.JobStatus;
import com.jobd.model.JobUpdate;
import com.jobd.model.ReportFormat;
import com.jobd.model.TriggerResult;
import com.jobd.repo.JobNotFoundException;
import com.jobd.repo.JobStore;
import com.jobd.util.Ids;
import com.jobd.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Job operations as the daemon exposes them: validation and defaults on the way in,
 * lifecycle rules on every state change.
 */
public class JobService {
    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    public static final int DEFAULT_PRIORITY = 5;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_EXECUTION_LIMIT = 50;

    private final JobStore store;
    private final JobExecutor executor;
    private final ScheduleCalculator calculator;
    private final int defaultListLimit;
    private final ExecutionReports reports = new ExecutionReports();

    public JobService(JobStore store, JobExecutor executor, ScheduleCalculator calculator, int defaultListLimit) {
        this.store = store;
        this.executor = executor;
        this.calculator = calculator;
        this.defaultListLimit = defaultListLimit;
    }

    public JobStore getStore() {
        return store;
    }

    public JobExecutor getExecutor() {
        return executor;
    }

    /**
     * Validates {@code spec}, fills in defaults and stores it as a new {@code created} job.
     *
     * @throws IllegalArgumentException when the spec is incomplete or inconsistent
     */
    public Job addJob(Job spec) {
        if (spec == null) throw new IllegalArgumentException("Job spec is required");
        if (isBlank(spec.getName())) throw new IllegalArgumentException("Job name is required");
        if (isBlank(spec.getCommand())) throw new IllegalArgumentException("Job command is required");
        if (spec.getMaxRetries() != null && spec.getMaxRetries() < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + spec.getMaxRetries());
        }
        if (spec.getTimeout() != null && spec.getTimeout() < 0) {
            throw new IllegalArgumentException("timeout must not be negative: " + spec.getTimeout());
        }
        calculator.validate(spec.getSchedule());

        Job job = spec.copy();
        if (isBlank(job.getId())) {
            job.setId(Ids.generate("job"));
        }
        if (isBlank(job.getWorkingDirectory())) job.setWorkingDirectory(System.getProperty("user.dir"));
        if (job.getEnvironment() == null) job.setEnvironment(new LinkedHashMap<>());
        if (job.getTags() == null) job.setTags(new LinkedHashSet<>());
        if (isBlank(job.getUser())) job.setUser(System.getProperty("user.name"));
        if (job.getPriority() == null) job.setPriority(DEFAULT_PRIORITY);
        if (job.getMaxRetries() == null) job.setMaxRetries(DEFAULT_MAX_RETRIES);
        if (job.getTimeout() == null) job.setTimeout(0L);
        if (job.getEnabled() == null) job.setEnabled(true);

        Instant now = Timestamps.now();
        job.setStatus(JobStatus.CREATED);
        job.setCreatedAt(now);
        job.setStartedAt(null);
        job.setCompletedAt(null);
        job.setLastRunAt(null);
        job.setRetryCount(0);
        job.setPid(null);
        job.setExitCode(null);
        job.setStdout(null);
        job.setStderr(null);

        JobSchedule schedule = job.getSchedule();
        if (schedule != null && schedule.isEmpty()) {
            job.setSchedule(null);
        } else if (schedule != null) {
            schedule.setNextRun(calculator.nextRun(job, now));
        }

        if (!store.insert(job)) {
            throw new IllegalArgumentException("Job " + job.getId() + " already exists");
        }
        log.info("Added job {} ({})", job.getId(), job.getName());
        return store.get(job.getId()).orElse(job);
    }

    public Job getJob(String jobId) {
        requireId(jobId);
        return store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /** Jobs matching {@code filter}, newest first, at most {@code limit} (or the default limit when not positive). */
    public List<Job> listJobs(JobFilter filter, int limit) {
        List<Job> jobs = store.list(filter);
        int max = limit > 0 ? limit : defaultListLimit;
        return jobs.size() > max ? jobs.subList(0, max) : jobs;
    }

    /** Dispatches the job in the background, ignoring its schedule and enabled flag. */
    public Job startJob(String jobId) {
        getJob(jobId);
        return executor.start(jobId);
    }

    /** Runs the job to completion, ignoring its schedule and enabled flag. */
    public TriggerResult triggerJob(String jobId) {
        getJob(jobId);
        Job finished = executor.run(jobId);
        if (finished == null) {
            throw new JobNotFoundException(jobId);
        }
        List<Execution> last = store.getExecutions(jobId, 1);
        return TriggerResult.of(finished, last.isEmpty() ? null : last.get(0));
    }

    public Job stopJob(String jobId, String signal) {
        getJob(jobId);
        Job stopped = executor.stop(jobId, signal);
        if (stopped == null) throw new JobNotFoundException(jobId);
        return stopped;
    }

    public Job pauseJob(String jobId) {
        getJob(jobId);
        return executor.pause(jobId);
    }

    public Job resumeJob(String jobId) {
        getJob(jobId);
        return executor.resume(jobId);
    }

    /**
     * Deletes the job and its history. A running job is only removed with {@code force},
     * which stops its process first.
     */
    public void removeJob(String jobId, boolean force) {
        Job job = getJob(jobId);
        boolean live = executor.isRunning(jobId)
                || job.getStatus() == JobStatus.RUNNING
                || job.getStatus() == JobStatus.PAUSED;
        if (live && !force) {
            throw new JobStateException(jobId, "Job " + jobId + " is running. Use force to remove.");
        }
        if (executor.isRunning(jobId)) {
            try {
                executor.stop(jobId, "TERM");
            } catch (JobStateException e) {
                log.debug("Job {} finished before it could be stopped", jobId);
            }
        }
        store.delete(jobId);
        log.info("Removed job {}", jobId);
    }

    public List<Execution> getExecutions(String jobId, int limit) {
        getJob(jobId);
        return store.getExecutions(jobId, limit > 0 ? limit : DEFAULT_EXECUTION_LIMIT);
    }

    public JobStatistics getStatistics(String jobId) {
        Job job = getJob(jobId);
        return JobStatistics.of(job, store.getExecutions(jobId, Integer.MAX_VALUE));
    }

    /**
     * Execution report of one job, or of every job when {@code jobId} is null, limited to
     * executions that started within {@code [from, to]}. Either bound may be null.
     */
    public String generateReport(String jobId, Instant from, Instant to, ReportFormat format) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("Report range starts after it ends: " + from + " > " + to);
        }
        List<Execution> executions = new ArrayList<>();
        if (jobId != null) {
            getJob(jobId);
            executions.addAll(store.getExecutions(jobId, Integer.MAX_VALUE));
        } else {
            for (Job job : store.list(null)) {
                executions.addAll(store.getExecutions(job.getId(), Integer.MAX_VALUE));
            }
        }
        executions.removeIf(e -> e.getStartTime() == null
                || (from != null && e.getStartTime().isBefore(from))
                || (to != null && e.getStartTime().isAfter(to)));
        executions.sort(Comparator.comparing(Execution::getStartTime).reversed());
        return reports.report(executions, format == null ? ReportFormat.TEXT : format, Timestamps.now());
    }

    /** Every job with its statistics, busiest first, as JSON or CSV. */
    public String exportJobs(ReportFormat format) {
        List<Job> jobs = store.list(null);
        List<JobStatistics> statistics = new ArrayList<>();
        for (Job job : jobs) {
            statistics.add(JobStatistics.of(job, store.getExecutions(job.getId(), Integer.MAX_VALUE)));
        }
        statistics.sort(Comparator.comparingInt(JobStatistics::getTotalExecutions).reversed());
        return reports.export(jobs, statistics, format == null ? ReportFormat.JSON : format, Timestamps.now());
    }

    /**
     * Marks jobs that a previous daemon left running or paused as stopped. Their processes
     * are no longer ours to track.
     */
    public int recoverInterrupted() {
        int recovered = 0;
        for (Job job : store.list(JobFilter.byStatus(JobStatus.RUNNING, JobStatus.PAUSED))) {
            if (executor.isRunning(job.getId())) continue;
            store.update(job.getId(), JobUpdate.create()
                    .status(JobStatus.STOPPED)
                    .completedAt(Timestamps.now())
                    .clearPid());
            recovered++;
        }
        if (recovered > 0) log.info("Marked {} interrupted job(s) as stopped", recovered);
        return recovered;
    }

    private static void requireId(String jobId) {
        if (isBlank(jobId)) throw new IllegalArgumentException("jobId is required");
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
