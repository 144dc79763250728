package com.jobd.core;

import com.jobd.model.Execution;
import com.jobd.model.ExecutionStatus;
import com.jobd.model.Job;
import com.jobd.model.JobFilter;
import com.jobd.model.JobSchedule;
import com.jobd.model.JobStatistics;
import com.jobd.model.JobStatus;
import com.jobd.model.ReportFormat;
import com.jobd.model.TriggerResult;
import com.jobd.repo.JobNotFoundException;
import com.jobd.repo.MemoryJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobServiceTest {

    private MemoryJobStore store;
    private JobExecutor executor;
    private JobService service;

    @BeforeEach
    void setup() {
        store = new MemoryJobStore();
        executor = new JobExecutor(store, new JobProcessor(), Duration.ofMillis(10));
        service = new JobService(store, executor, new ScheduleCalculator(ZoneOffset.UTC), 2);
    }

    @AfterEach
    void teardown() {
        executor.shutdown();
    }

    private static Job spec(String name, String command) {
        return new Job(null, name, command);
    }

    @Test
    void addJobFillsDefaults() {
        Job added = service.addJob(spec("backup", "echo backup"));

        assertTrue(added.getId().startsWith("job_"));
        assertEquals(JobStatus.CREATED, added.getStatus());
        assertNotNull(added.getCreatedAt());
        assertEquals(JobService.DEFAULT_PRIORITY, added.getPriority());
        assertEquals(JobService.DEFAULT_MAX_RETRIES, added.getMaxRetries());
        assertEquals(0L, added.getTimeout());
        assertTrue(added.isEnabled());
        assertEquals(System.getProperty("user.dir"), added.getWorkingDirectory());
        assertEquals(System.getProperty("user.name"), added.getUser());
        assertTrue(added.getEnvironment().isEmpty());
        assertNull(added.getSchedule());
        assertTrue(store.get(added.getId()).isPresent());
    }

    @Test
    void addJobIgnoresLifecycleFieldsFromCaller() {
        Job s = spec("x", "true");
        s.setStatus(JobStatus.COMPLETED);
        s.setPid(99L);
        s.setRetryCount(4);

        Job added = service.addJob(s);

        assertEquals(JobStatus.CREATED, added.getStatus());
        assertNull(added.getPid());
        assertEquals(0, added.getRetryCount());
    }

    @Test
    void addJobRejectsIncompleteSpecs() {
        assertEquals("Job spec is required",
                assertThrows(IllegalArgumentException.class, () -> service.addJob(null)).getMessage());
        assertEquals("Job name is required",
                assertThrows(IllegalArgumentException.class, () -> service.addJob(spec(" ", "true"))).getMessage());
        assertEquals("Job command is required",
                assertThrows(IllegalArgumentException.class, () -> service.addJob(spec("n", null))).getMessage());

        Job negative = spec("n", "true");
        negative.setMaxRetries(-1);
        assertThrows(IllegalArgumentException.class, () -> service.addJob(negative));
        assertEquals(0, store.countJobs());
    }

    @Test
    void addJobRejectsDuplicateId() {
        Job first = spec("n", "true");
        first.setId("fixed");
        service.addJob(first);

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> service.addJob(first));
        assertEquals("Job fixed already exists", ex.getMessage());
    }

    @Test
    void concurrentAddsWithTheSameIdLetOnlyOneThrough() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                Job s = spec("writer " + t, "true");
                s.setId("shared");
                results.add(pool.submit(() -> {
                    go.await();
                    try {
                        service.addJob(s);
                        return true;
                    } catch (IllegalArgumentException ex) {
                        return false;
                    }
                }));
            }
            go.countDown();
            int added = 0;
            for (Future<Boolean> f : results) {
                if (f.get(10, TimeUnit.SECONDS)) added++;
            }
            assertEquals(1, added);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, store.countJobs());
    }

    @Test
    void addJobRejectsBadCron() {
        Job s = spec("n", "true");
        s.setSchedule(JobSchedule.cron("not a cron", null));

        assertThrows(IllegalArgumentException.class, () -> service.addJob(s));
    }

    @Test
    void scheduledJobGetsNextRun() {
        Job interval = spec("every", "true");
        interval.setSchedule(JobSchedule.every(60_000));
        Job addedInterval = service.addJob(interval);
        assertEquals(addedInterval.getCreatedAt(), addedInterval.getSchedule().getNextRun());

        Job cron = spec("hourly", "true");
        cron.setSchedule(JobSchedule.cron("0 * * * *", "UTC"));
        Job addedCron = service.addJob(cron);
        Instant next = addedCron.getSchedule().getNextRun();
        assertTrue(next.isAfter(addedCron.getCreatedAt()));
        assertEquals(0, next.getEpochSecond() % 3600);
    }

    @Test
    void emptyScheduleIsDropped() {
        Job s = spec("n", "true");
        s.setSchedule(new JobSchedule());

        assertNull(service.addJob(s).getSchedule());
    }

    @Test
    void getJobValidatesId() {
        assertEquals("jobId is required",
                assertThrows(IllegalArgumentException.class, () -> service.getJob("")).getMessage());
        assertThrows(JobNotFoundException.class, () -> service.getJob("nope"));
    }

    @Test
    void listJobsAppliesLimitOrDefault() {
        for (int i = 0; i < 5; i++) service.addJob(spec("j" + i, "true"));

        assertEquals(2, service.listJobs(null, 0).size());
        assertEquals(4, service.listJobs(JobFilter.all(), 4).size());
        assertEquals(5, service.listJobs(null, 100).size());
    }

    @Test
    void triggerRunsDisabledJobOnce() {
        Job s = spec("manual", "echo triggered");
        s.setEnabled(false);
        Job added = service.addJob(s);

        TriggerResult result = service.triggerJob(added.getId());

        assertTrue(result.isSuccess());
        assertEquals(JobStatus.COMPLETED, result.getStatus());
        assertEquals(0, result.getExitCode());
        assertTrue(result.getOutput().contains("triggered"));
        assertEquals(1, store.countExecutions(added.getId()));
        assertFalse(store.get(added.getId()).orElseThrow().isEnabled());
    }

    @Test
    void triggerReportsFailure() {
        Job s = spec("broken", "exit 3");
        s.setMaxRetries(0);
        Job added = service.addJob(s);

        TriggerResult result = service.triggerJob(added.getId());

        assertFalse(result.isSuccess());
        assertEquals(JobStatus.FAILED, result.getStatus());
        assertEquals(3, result.getExitCode());
        assertNotNull(result.getError());
    }

    @Test
    void statisticsSummariseHistory() {
        Job s = spec("stats", "true");
        Job added = service.addJob(s);
        service.triggerJob(added.getId());
        service.triggerJob(added.getId());

        JobStatistics stats = service.getStatistics(added.getId());

        assertEquals(2, stats.getTotalExecutions());
        assertEquals(2, stats.getSuccessfulExecutions());
        assertEquals(100.0, stats.getSuccessRate());
    }

    @Test
    void removeRunningJobNeedsForce() throws Exception {
        Job added = service.addJob(spec("long", "sleep 30"));
        service.startJob(added.getId());
        long deadline = System.currentTimeMillis() + 10_000;
        while (store.get(added.getId()).orElseThrow().getPid() == null && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        JobStateException ex = assertThrows(JobStateException.class, () -> service.removeJob(added.getId(), false));
        assertEquals("Job " + added.getId() + " is running. Use force to remove.", ex.getMessage());
        assertTrue(store.get(added.getId()).isPresent());

        service.removeJob(added.getId(), true);

        assertFalse(store.get(added.getId()).isPresent());
        assertFalse(executor.isRunning(added.getId()));
        assertEquals(0, store.countExecutions(added.getId()));
    }

    @Test
    void removeFinishedJob() {
        Job added = service.addJob(spec("done", "true"));
        service.triggerJob(added.getId());

        service.removeJob(added.getId(), false);

        assertThrows(JobNotFoundException.class, () -> service.getJob(added.getId()));
    }

    @Test
    void stopOfIdleJobIsAStateError() {
        Job added = service.addJob(spec("idle", "true"));

        assertThrows(JobStateException.class, () -> service.stopJob(added.getId(), "TERM"));
        assertThrows(JobNotFoundException.class, () -> service.stopJob("ghost", "TERM"));
    }

    @Test
    void interruptedJobsAreMarkedStopped() {
        Job orphan = new Job("orphan", "orphan", "sleep 100");
        orphan.setStatus(JobStatus.RUNNING);
        orphan.setPid(123456L);
        store.save(orphan);
        Job paused = new Job("paused", "paused", "sleep 100");
        paused.setStatus(JobStatus.PAUSED);
        store.save(paused);
        Job done = new Job("done", "done", "true");
        done.setStatus(JobStatus.COMPLETED);
        store.save(done);

        assertEquals(2, service.recoverInterrupted());

        Job recovered = store.get("orphan").orElseThrow();
        assertEquals(JobStatus.STOPPED, recovered.getStatus());
        assertNull(recovered.getPid());
        assertNotNull(recovered.getCompletedAt());
        assertEquals(JobStatus.STOPPED, store.get("paused").orElseThrow().getStatus());
        assertEquals(JobStatus.COMPLETED, store.get("done").orElseThrow().getStatus());
    }

    private void history(Job job, Instant start, ExecutionStatus status) {
        Execution started = Execution.started(job.getId() + "-" + start.getEpochSecond(), job, 1, start);
        store.saveExecution(started.finish(start.plusMillis(10), status,
                status == ExecutionStatus.COMPLETED ? 0 : 1, "", "", null));
    }

    @Test
    void reportCoversOneJobWithinTheTimeRange() {
        Instant t0 = Instant.parse("2024-05-01T10:00:00Z");
        Job a = new Job("a", "alpha", "true");
        Job b = new Job("b", "beta", "true");
        store.save(a);
        store.save(b);
        history(a, t0, ExecutionStatus.COMPLETED);
        history(a, t0.plusSeconds(60), ExecutionStatus.FAILED);
        history(a, t0.plusSeconds(120), ExecutionStatus.COMPLETED);
        history(b, t0.plusSeconds(60), ExecutionStatus.COMPLETED);

        String csv = service.generateReport("a", t0.plusSeconds(30), t0.plusSeconds(120), ReportFormat.CSV);

        String[] lines = csv.split("\n");
        assertEquals(3, lines.length);
        assertTrue(lines[1].startsWith("a-" + t0.plusSeconds(120).getEpochSecond() + ",a,alpha,"));
        assertTrue(lines[2].startsWith("a-" + t0.plusSeconds(60).getEpochSecond() + ",a,alpha,"));
    }

    @Test
    void reportWithoutJobIdCoversEveryJobNewestFirst() {
        Instant t0 = Instant.parse("2024-05-01T10:00:00Z");
        Job a = new Job("a", "alpha", "true");
        Job b = new Job("b", "beta", "true");
        store.save(a);
        store.save(b);
        history(a, t0, ExecutionStatus.COMPLETED);
        history(b, t0.plusSeconds(60), ExecutionStatus.FAILED);

        String text = service.generateReport(null, null, null, null);

        assertTrue(text.contains("Total Executions: 2"));
        assertTrue(text.indexOf("| beta |") < text.indexOf("| alpha |"));
    }

    @Test
    void reportRejectsUnknownJobAndInvertedRange() {
        Instant t0 = Instant.parse("2024-05-01T10:00:00Z");

        assertThrows(JobNotFoundException.class, () -> service.generateReport("ghost", null, null, ReportFormat.TEXT));
        assertThrows(IllegalArgumentException.class,
                () -> service.generateReport(null, t0.plusSeconds(1), t0, ReportFormat.TEXT));
    }

    @Test
    void exportListsBusiestJobFirst() {
        Instant t0 = Instant.parse("2024-05-01T10:00:00Z");
        Job quiet = new Job("quiet", "quiet", "true");
        quiet.setCreatedAt(t0.plusSeconds(5));
        Job busy = new Job("busy", "busy", "true");
        busy.setCreatedAt(t0);
        store.save(quiet);
        store.save(busy);
        history(busy, t0, ExecutionStatus.COMPLETED);
        history(busy, t0.plusSeconds(60), ExecutionStatus.COMPLETED);

        String csv = service.exportJobs(ReportFormat.CSV);

        String[] lines = csv.split("\n");
        assertEquals(3, lines.length);
        assertTrue(lines[1].startsWith("busy,busy,"));
        assertTrue(lines[2].startsWith("quiet,quiet,"));
        assertThrows(IllegalArgumentException.class, () -> service.exportJobs(ReportFormat.TEXT));
    }
}
