package com.jobd.core;

import com.jobd.model.Job;
import com.jobd.model.JobSchedule;
import com.jobd.model.JobStatus;
import com.jobd.repo.MemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private MemoryJobStore store;
    private JobExecutor executor;
    private JobScheduler scheduler;

    @BeforeEach
    void setup() {
        store = new MemoryJobStore();
        executor = Mockito.mock(JobExecutor.class);
        scheduler = new JobScheduler(store, executor, new ScheduleCalculator(ZoneOffset.UTC),
                Duration.ofSeconds(1), 24);
    }

    private Job intervalJob(String id, JobStatus status, Instant nextRun) {
        Job j = new Job(id, id, "true");
        j.setStatus(status);
        j.setCreatedAt(NOW.minusSeconds(3600));
        JobSchedule s = JobSchedule.every(60_000);
        s.setNextRun(nextRun);
        j.setSchedule(s);
        store.save(j);
        return j;
    }

    @Test
    void dueJobIsDispatchedAndNextRunAdvanced() {
        intervalJob("a", JobStatus.CREATED, NOW.minusSeconds(1));

        assertEquals(1, scheduler.tick(NOW));

        Mockito.verify(executor).start("a");
        assertEquals(NOW.plusSeconds(60), store.get("a").orElseThrow().getSchedule().getNextRun());
    }

    @Test
    void finishedJobsAreDispatchedAgain() {
        intervalJob("c", JobStatus.COMPLETED, NOW);
        intervalJob("f", JobStatus.FAILED, NOW);
        intervalJob("k", JobStatus.KILLED, NOW);

        assertEquals(3, scheduler.tick(NOW));
    }

    @Test
    void stoppedPausedAndRunningJobsAreLeftAlone() {
        intervalJob("s", JobStatus.STOPPED, NOW.minusSeconds(1));
        intervalJob("p", JobStatus.PAUSED, NOW.minusSeconds(1));
        intervalJob("r", JobStatus.RUNNING, NOW.minusSeconds(1));

        assertEquals(0, scheduler.tick(NOW));
        Mockito.verify(executor, Mockito.never()).start(Mockito.anyString());
    }

    @Test
    void disabledJobIsNotDispatched() {
        Job j = intervalJob("a", JobStatus.CREATED, NOW.minusSeconds(1));
        j.setEnabled(false);
        store.save(j);

        assertEquals(0, scheduler.tick(NOW));
    }

    @Test
    void futureRunIsNotDue() {
        intervalJob("a", JobStatus.CREATED, NOW.plusSeconds(1));

        assertEquals(0, scheduler.tick(NOW));
        assertEquals(NOW.plusSeconds(1), store.get("a").orElseThrow().getSchedule().getNextRun());
    }

    @Test
    void jobAlreadyInFlightIsSkipped() {
        Job j = intervalJob("a", JobStatus.COMPLETED, NOW.minusSeconds(1));
        Mockito.when(executor.isRunning("a")).thenReturn(true);

        assertFalse(scheduler.isDue(j, NOW));
        assertEquals(0, scheduler.tick(NOW));
    }

    @Test
    void unscheduledJobIsNeverDue() {
        Job j = new Job("once", "once", "true");
        j.setStatus(JobStatus.CREATED);
        store.save(j);

        assertEquals(0, scheduler.tick(NOW));
    }

    @Test
    void cronJobAdvancesToTheFollowingFireTime() {
        Job j = new Job("cron", "cron", "true");
        j.setStatus(JobStatus.CREATED);
        JobSchedule s = JobSchedule.cron("*/5 * * * *", "UTC");
        s.setNextRun(NOW);
        j.setSchedule(s);
        store.save(j);

        assertEquals(1, scheduler.tick(NOW));
        assertEquals(NOW.plusSeconds(300), store.get("cron").orElseThrow().getSchedule().getNextRun());
    }

    @Test
    void cronJobWithoutNextRunFiresOnceItsTimeComes() {
        Job j = new Job("fresh", "fresh", "true");
        j.setStatus(JobStatus.CREATED);
        j.setSchedule(JobSchedule.cron("*/5 * * * *", "UTC"));
        store.save(j);
        Instant tick = NOW.plusSeconds(30);

        assertEquals(0, scheduler.tick(tick));
        Instant saved = store.get("fresh").orElseThrow().getSchedule().getNextRun();
        assertEquals(NOW.plusSeconds(300), saved);

        assertEquals(0, scheduler.tick(saved.minusSeconds(1)));
        assertEquals(1, scheduler.tick(saved));
        Mockito.verify(executor).start("fresh");
        assertEquals(NOW.plusSeconds(600), store.get("fresh").orElseThrow().getSchedule().getNextRun());
    }

    @Test
    void raceWithManualStartIsTolerated() {
        intervalJob("a", JobStatus.CREATED, NOW.minusSeconds(1));
        Mockito.when(executor.start("a")).thenThrow(new JobStateException("a", "Job a is already running"));

        assertEquals(0, scheduler.tick(NOW));
    }

    @Test
    void cleanupRemovesOldFinishedOneOffJobsOnly() {
        Job old = new Job("old", "old", "true");
        old.setStatus(JobStatus.COMPLETED);
        old.setCompletedAt(NOW.minus(Duration.ofHours(25)));
        store.save(old);

        Job recent = new Job("recent", "recent", "true");
        recent.setStatus(JobStatus.FAILED);
        recent.setCompletedAt(NOW.minus(Duration.ofHours(1)));
        store.save(recent);

        Job scheduled = intervalJob("sched", JobStatus.COMPLETED, NOW.plusSeconds(60));
        scheduled.setCompletedAt(NOW.minus(Duration.ofHours(48)));
        store.save(scheduled);

        Job running = new Job("running", "running", "sleep 1");
        running.setStatus(JobStatus.RUNNING);
        store.save(running);

        assertEquals(1, scheduler.cleanup(NOW));
        assertFalse(store.get("old").isPresent());
        assertTrue(store.get("recent").isPresent());
        assertTrue(store.get("sched").isPresent());
        assertTrue(store.get("running").isPresent());
    }

    @Test
    void tickAlsoCleansUp() {
        Job old = new Job("old", "old", "true");
        old.setStatus(JobStatus.KILLED);
        old.setCompletedAt(NOW.minus(Duration.ofDays(3)));
        store.save(old);

        scheduler.tick(NOW);

        assertFalse(store.get("old").isPresent());
    }

    @Test
    void startAndStopToggleRunning() {
        assertFalse(scheduler.isRunning());
        scheduler.start();
        assertTrue(scheduler.isRunning());
        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }
}
