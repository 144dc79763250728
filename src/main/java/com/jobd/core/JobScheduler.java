package com.jobd.core;

import com.jobd.model.Job;
import com.jobd.model.JobSchedule;
import com.jobd.model.JobStatus;
import com.jobd.model.JobUpdate;
import com.jobd.repo.JobNotFoundException;
import com.jobd.repo.JobStore;
import com.jobd.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically dispatches scheduled jobs whose next run time has come, and removes old
 * finished one-off jobs.
 */
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    /** Statuses from which a scheduled job is dispatched again. Stopped and paused jobs stay put. */
    static final Set<JobStatus> DISPATCHABLE =
            EnumSet.of(JobStatus.CREATED, JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.KILLED);

    private static final Duration CLEANUP_EVERY = Duration.ofHours(1);

    private final JobStore store;
    private final JobExecutor executor;
    private final ScheduleCalculator calculator;
    private final Duration checkInterval;
    private final int cleanupMaxAgeHours;

    private ScheduledExecutorService timer;
    private ScheduledFuture<?> task;
    private Instant lastCleanup = Instant.EPOCH;

    public JobScheduler(JobStore store, JobExecutor executor, ScheduleCalculator calculator,
                        Duration checkInterval, int cleanupMaxAgeHours) {
        this.store = store;
        this.executor = executor;
        this.calculator = calculator;
        this.checkInterval = checkInterval;
        this.cleanupMaxAgeHours = cleanupMaxAgeHours;
    }

    public synchronized void start() {
        if (task != null) return;
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "jobd-scheduler");
            t.setDaemon(true);
            return t;
        });
        task = timer.scheduleWithFixedDelay(this::safeTick, 0, checkInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Scheduler started, checking every {} ms", checkInterval.toMillis());
    }

    public synchronized void stop() {
        if (task == null) return;
        task.cancel(false);
        timer.shutdownNow();
        task = null;
        timer = null;
        log.info("Scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    private void safeTick() {
        try {
            tick(Timestamps.now());
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }

    /** One scheduling pass at {@code now}. Returns the number of jobs dispatched. */
    public int tick(Instant now) {
        int dispatched = 0;
        for (Job job : store.list(null)) {
            try {
                if (!isDue(job, now)) continue;
                advance(job, now);
                executor.start(job.getId());
                dispatched++;
                log.debug("Dispatched scheduled job {}", job.getId());
            } catch (JobStateException | JobNotFoundException e) {
                log.debug("Skipping job {}: {}", job.getId(), e.getMessage());
            } catch (IllegalArgumentException e) {
                log.warn("Job {} has an unusable schedule: {}", job.getId(), e.getMessage());
            }
        }
        if (cleanupMaxAgeHours > 0 && !now.isBefore(lastCleanup.plus(CLEANUP_EVERY))) {
            lastCleanup = now;
            cleanup(now);
        }
        return dispatched;
    }

    /**
     * A job without a stored next run gets one computed and saved here. When that time
     * lies ahead the job waits for a later tick to reach it.
     */
    boolean isDue(Job job, Instant now) {
        if (!job.isScheduled() || !job.isEnabled()) return false;
        if (!DISPATCHABLE.contains(job.getStatus())) return false;
        if (executor.isRunning(job.getId())) return false;
        Instant next = job.getSchedule().getNextRun();
        if (next == null) {
            next = calculator.nextRun(job, now);
            if (next != null && next.isAfter(now)) {
                JobSchedule schedule = job.getSchedule().copy();
                schedule.setNextRun(next);
                store.update(job.getId(), JobUpdate.create().schedule(schedule));
                log.debug("Job {} next runs at {}", job.getId(), next);
                return false;
            }
        }
        return next != null && !next.isAfter(now);
    }

    /** Persists the run after this one before the job is dispatched. */
    private void advance(Job job, Instant now) {
        JobSchedule schedule = job.getSchedule().copy();
        schedule.setNextRun(schedule.isCron()
                ? calculator.nextCronRun(schedule, now)
                : now.plusMillis(schedule.getInterval()));
        store.update(job.getId(), JobUpdate.create().schedule(schedule));
    }

    /** Deletes finished unscheduled jobs that completed more than the configured age ago. */
    public int cleanup(Instant now) {
        Instant cutoff = now.minus(Duration.ofHours(cleanupMaxAgeHours));
        int removed = 0;
        for (Job job : store.list(null)) {
            if (job.isScheduled() || job.getStatus() == null || !job.getStatus().isTerminal()) continue;
            if (job.getCompletedAt() == null || !job.getCompletedAt().isBefore(cutoff)) continue;
            try {
                store.delete(job.getId());
                removed++;
            } catch (JobNotFoundException e) {
                log.debug("Job {} already removed", job.getId());
            }
        }
        if (removed > 0) log.info("Cleaned up {} finished job(s)", removed);
        return removed;
    }
}
