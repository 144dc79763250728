package com.jobd.core;

import com.jobd.model.Execution;
import com.jobd.model.ExecutionStatus;
import com.jobd.model.Job;
import com.jobd.model.JobStatus;
import com.jobd.repo.JobNotFoundException;
import com.jobd.repo.MemoryJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs real shell commands through bash.
 */
class JobExecutorTest {

    private MemoryJobStore store;
    private JobExecutor executor;

    @BeforeEach
    void setup() {
        store = new MemoryJobStore();
        executor = new JobExecutor(store, new JobProcessor(), Duration.ofMillis(10));
    }

    @AfterEach
    void teardown() {
        executor.shutdown();
    }

    private Job save(String id, String command, int maxRetries) {
        Job j = new Job(id, id, command);
        j.setStatus(JobStatus.CREATED);
        j.setMaxRetries(maxRetries);
        j.setTimeout(0L);
        store.save(j);
        return j;
    }

    private void awaitPid(String id) throws InterruptedException {
        waitFor(() -> store.get(id).map(j -> j.getPid() != null).orElse(false));
    }

    @Test
    void successfulCommandCompletes() {
        save("ok", "echo hello", 3);

        Job done = executor.run("ok");

        assertEquals(JobStatus.COMPLETED, done.getStatus());
        assertEquals(0, done.getExitCode());
        assertTrue(done.getStdout().contains("hello"));
        assertNull(done.getPid());
        assertEquals(0, done.getRetryCount());
        List<Execution> history = store.getExecutions("ok", 10);
        assertEquals(1, history.size());
        assertEquals(ExecutionStatus.COMPLETED, history.get(0).getStatus());
        assertEquals(1, history.get(0).getAttempt());
        assertFalse(executor.isRunning("ok"));
    }

    @Test
    void failingCommandIsRetriedThenFails() {
        save("bad", "echo oops >&2; exit 1", 2);

        Job done = executor.run("bad");

        assertEquals(JobStatus.FAILED, done.getStatus());
        assertEquals(1, done.getExitCode());
        assertEquals(2, done.getRetryCount());
        assertTrue(done.getStderr().contains("oops"));
        List<Execution> history = store.getExecutions("bad", 10);
        assertEquals(3, history.size());
        for (Execution e : history) {
            assertEquals(ExecutionStatus.FAILED, e.getStatus());
            assertEquals(1, e.getExitCode());
        }
    }

    @Test
    void noRetriesMeansOneAttempt() {
        save("once", "exit 7", 0);

        Job done = executor.run("once");

        assertEquals(JobStatus.FAILED, done.getStatus());
        assertEquals(7, done.getExitCode());
        assertEquals(1, store.countExecutions("once"));
    }

    @Test
    void timeoutKillsTheJob() {
        Job j = save("slow", "sleep 10", 0);
        j.setTimeout(200L);
        store.save(j);

        long started = System.currentTimeMillis();
        Job done = executor.run("slow");

        assertTrue(System.currentTimeMillis() - started < 5000);
        assertEquals(JobStatus.KILLED, done.getStatus());
        Execution last = store.getExecutions("slow", 1).get(0);
        assertEquals(ExecutionStatus.TIMEOUT, last.getStatus());
        assertTrue(last.getErrorMessage().contains("200"));
    }

    @Test
    void timeoutKillsTheWholeProcessGroup(@TempDir Path dir) throws Exception {
        Path pidFile = dir.resolve("child.pid");
        Job j = save("group", "sleep 300 & echo $! > '" + pidFile + "'; wait", 0);
        j.setTimeout(300L);
        store.save(j);

        Job done = executor.run("group");

        assertEquals(JobStatus.KILLED, done.getStatus());
        long childPid = Long.parseLong(Files.readString(pidFile).trim());
        waitFor(() -> !ProcessHandle.of(childPid).map(ProcessHandle::isAlive).orElse(false));
    }

    @Test
    void environmentAndWorkingDirectoryAreApplied(@TempDir Path dir) throws Exception {
        Job j = save("env", "echo \"$JOBD_TEST_VALUE\"; pwd", 0);
        j.getEnvironment().put("JOBD_TEST_VALUE", "from-env");
        j.setWorkingDirectory(dir.toString());
        store.save(j);

        Job done = executor.run("env");

        assertTrue(done.getStdout().contains("from-env"));
        assertTrue(done.getStdout().contains(dir.toRealPath().getFileName().toString()));
    }

    @Test
    void stopEndsTheRunWithoutRetry() throws Exception {
        save("long", "sleep 30", 3);

        Job started = executor.start("long");
        assertEquals(JobStatus.RUNNING, started.getStatus());
        awaitPid("long");

        Job stopped = executor.stop("long", "SIGTERM");

        assertEquals(JobStatus.STOPPED, stopped.getStatus());
        assertNull(stopped.getPid());
        assertFalse(executor.isRunning("long"));
        List<Execution> history = store.getExecutions("long", 10);
        assertEquals(1, history.size());
        assertEquals(ExecutionStatus.STOPPED, history.get(0).getStatus());
    }

    @Test
    void stopDeliversTheRequestedSignal(@TempDir Path dir) throws Exception {
        Path ready = dir.resolve("ready");
        Path marker = dir.resolve("usr1");
        save("trap", trapUsr1(ready, marker), 3);

        executor.start("trap");
        waitFor(() -> Files.exists(ready));

        Job stopped = executor.stop("trap", "SIGUSR1");

        assertEquals(JobStatus.STOPPED, stopped.getStatus());
        assertTrue(Files.exists(marker));
        assertEquals(1, store.countExecutions("trap"));
    }

    @Test
    void stopArrivingWhileSpawningSendsTheRequestedSignal(@TempDir Path dir) throws Exception {
        Path ready = dir.resolve("ready");
        Path marker = dir.resolve("usr1");
        AtomicReference<JobExecutor> self = new AtomicReference<>();
        AtomicReference<Job> stopResult = new AtomicReference<>();
        AtomicReference<Thread> stopper = new AtomicReference<>();
        JobProcessor stopDuringSpawn = new JobProcessor() {
            @Override
            public RunningProcess start(String command, String workingDirectory, Map<String, String> environment)
                    throws IOException {
                RunningProcess process = super.start(command, workingDirectory, environment);
                try {
                    waitFor(() -> Files.exists(ready));
                    Thread t = new Thread(() -> stopResult.set(self.get().stop("spawn", "USR1")));
                    stopper.set(t);
                    t.start();
                    // the stopping thread parks once the stop is registered
                    waitFor(() -> t.getState() == Thread.State.TIMED_WAITING);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException();
                }
                return process;
            }
        };
        JobExecutor spawning = new JobExecutor(store, stopDuringSpawn, Duration.ofMillis(10));
        self.set(spawning);
        try {
            save("spawn", trapUsr1(ready, marker), 3);

            Job done = spawning.run("spawn");
            stopper.get().join(10_000);

            assertEquals(JobStatus.STOPPED, done.getStatus());
            assertEquals(JobStatus.STOPPED, stopResult.get().getStatus());
            assertTrue(Files.exists(marker));
        } finally {
            spawning.shutdown();
        }
    }

    private static String trapUsr1(Path ready, Path marker) {
        return "trap 'touch \"" + marker + "\"; exit 0' USR1; touch \"" + ready + "\"; "
                + "while true; do sleep 0.1; done";
    }

    @Test
    void stopDuringRetryBackoffEndsTheRun() throws Exception {
        MemoryJobStore slowStore = new MemoryJobStore();
        JobExecutor slowRetries = new JobExecutor(slowStore, new JobProcessor(), Duration.ofSeconds(30));
        try {
            Job j = new Job("retry", "retry", "exit 1");
            j.setStatus(JobStatus.CREATED);
            j.setMaxRetries(5);
            slowStore.save(j);

            slowRetries.start("retry");
            waitFor(() -> slowStore.get("retry").map(x -> x.getRetryCount() == 1).orElse(false));

            Job stopped = slowRetries.stop("retry", null);

            assertEquals(JobStatus.STOPPED, stopped.getStatus());
            assertEquals(1, slowStore.countExecutions("retry"));
        } finally {
            slowRetries.shutdown();
        }
    }

    @Test
    void secondStartOfRunningJobIsRejected() throws Exception {
        save("busy", "sleep 30", 0);
        executor.start("busy");

        JobStateException ex = assertThrows(JobStateException.class, () -> executor.start("busy"));

        assertEquals("busy", ex.getJobId());
        assertTrue(ex.getMessage().contains("already running"));
        awaitPid("busy");
        executor.stop("busy", "KILL");
    }

    @Test
    void stoppingIdleJobIsRejected() {
        save("idle", "true", 0);

        assertThrows(JobStateException.class, () -> executor.stop("idle", "TERM"));
    }

    @Test
    void unsupportedSignalIsRejected() {
        save("idle", "true", 0);

        assertThrows(IllegalArgumentException.class, () -> executor.stop("idle", "SEGV"));
    }

    @Test
    void pauseAndResumeMoveBetweenStates() throws Exception {
        save("p", "sleep 30", 0);
        executor.start("p");
        awaitPid("p");

        assertEquals(JobStatus.PAUSED, executor.pause("p").getStatus());
        assertThrows(JobStateException.class, () -> executor.pause("p"));
        assertEquals(JobStatus.RUNNING, executor.resume("p").getStatus());
        assertThrows(JobStateException.class, () -> executor.resume("p"));

        assertEquals(JobStatus.STOPPED, executor.stop("p", "TERM").getStatus());
    }

    @Test
    void stoppingPausedJobStillTerminates() throws Exception {
        save("frozen", "sleep 30", 0);
        executor.start("frozen");
        awaitPid("frozen");
        executor.pause("frozen");

        assertEquals(JobStatus.STOPPED, executor.stop("frozen", "TERM").getStatus());
    }

    @Test
    void runningUnknownJobFailsAndReleasesTheClaim() {
        assertThrows(JobNotFoundException.class, () -> executor.run("ghost"));
        assertFalse(executor.isRunning("ghost"));
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(condition.getAsBoolean(), "condition not met in time");
    }
}
