package com.jobd.core;

import com.jobd.model.Execution;
import com.jobd.model.ExecutionStatus;
import com.jobd.model.Job;
import com.jobd.model.JobStatus;
import com.jobd.model.JobUpdate;
import com.jobd.repo.JobNotFoundException;
import com.jobd.repo.JobStore;
import com.jobd.util.Ids;
import com.jobd.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs jobs: one dispatch per start, with failed attempts retried inside the dispatch.
 * <p>
 * A job has at most one live process. Each attempt leaves exactly one {@link Execution}
 * behind, written as {@code running} when it starts and completed once when it ends.
 */
public class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private static final long STOP_GRACE_MS = 5000;

    private final JobStore store;
    private final JobProcessor processor;
    private final Duration retryBackoff;
    private final ExecutorService pool;
    private final Map<String, RunState> running = new ConcurrentHashMap<>();

    private static final class RunState {
        final CompletableFuture<Job> done = new CompletableFuture<>();
        final CountDownLatch wakeup = new CountDownLatch(1);
        volatile JobProcessor.RunningProcess process;
        volatile String stopSignal = "TERM";
        volatile boolean stopRequested;
        volatile boolean paused;
    }

    private static final class Attempt {
        ExecutionStatus status;
        Integer exitCode;
        String stdout = "";
        String stderr = "";
        String error;
    }

    public JobExecutor(JobStore store, JobProcessor processor, Duration retryBackoff) {
        this.store = store;
        this.processor = processor;
        this.retryBackoff = retryBackoff;
        AtomicInteger seq = new AtomicInteger();
        this.pool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "jobd-exec-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public boolean isRunning(String jobId) {
        return running.containsKey(jobId);
    }

    public int runningCount() {
        return running.size();
    }

    /**
     * Marks the job running and executes it in the background.
     *
     * @return the job as it is once marked running
     */
    public Job start(String jobId) {
        RunState state = claim(jobId);
        Job job;
        try {
            job = begin(jobId);
        } catch (RuntimeException e) {
            release(jobId, state, null);
            throw e;
        }
        try {
            pool.execute(() -> execute(state, job));
        } catch (RejectedExecutionException e) {
            finish(job.getId(), JobStatus.STOPPED, new Attempt());
            release(jobId, state, null);
            throw new JobStateException(jobId, "Executor is shut down");
        }
        return job;
    }

    /** Runs the job in the calling thread and returns it in its final state. */
    public Job run(String jobId) {
        RunState state = claim(jobId);
        Job job;
        try {
            job = begin(jobId);
        } catch (RuntimeException e) {
            release(jobId, state, null);
            throw e;
        }
        return execute(state, job);
    }

    private RunState claim(String jobId) {
        RunState state = new RunState();
        if (running.putIfAbsent(jobId, state) != null) {
            throw new JobStateException(jobId, "Job " + jobId + " is already running");
        }
        return state;
    }

    private Job begin(String jobId) {
        Instant now = Timestamps.now();
        return store.update(jobId, JobUpdate.create()
                .status(JobStatus.RUNNING)
                .startedAt(now)
                .lastRunAt(now)
                .retryCount(0)
                .clearCompletedAt()
                .clearExitCode()
                .clearPid());
    }

    private Job execute(RunState state, Job job) {
        Job result = null;
        try {
            log.info("Processing job {} ({})", job.getId(), job.getCommand());
            int attemptNo = 1;
            JobStatus finalStatus;
            Attempt attempt;
            while (true) {
                attempt = runAttempt(state, job, attemptNo);
                if (attempt.status == ExecutionStatus.COMPLETED) {
                    finalStatus = JobStatus.COMPLETED;
                    log.info("Completed job {}", job.getId());
                    break;
                }
                if (state.stopRequested) {
                    finalStatus = JobStatus.STOPPED;
                    log.info("Stopped job {}", job.getId());
                    break;
                }
                if (attemptNo - 1 < job.maxRetriesOrZero()) {
                    store.update(job.getId(), JobUpdate.create().retryCount(attemptNo));
                    log.info("Job {} failed (attempt {}), retrying in {} ms", job.getId(), attemptNo, retryBackoff.toMillis());
                    if (state.wakeup.await(retryBackoff.toMillis(), TimeUnit.MILLISECONDS) || state.stopRequested) {
                        finalStatus = JobStatus.STOPPED;
                        log.info("Stopped job {} while waiting to retry", job.getId());
                        break;
                    }
                    attemptNo++;
                    continue;
                }
                finalStatus = attempt.status == ExecutionStatus.TIMEOUT ? JobStatus.KILLED : JobStatus.FAILED;
                log.info("Job {} {} after {} attempt(s)", job.getId(), finalStatus.wireName(), attemptNo);
                break;
            }
            result = finish(job.getId(), finalStatus, attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = finish(job.getId(), JobStatus.STOPPED, new Attempt());
        } catch (JobNotFoundException e) {
            log.info("Job {} was removed while running", job.getId());
        } catch (RuntimeException e) {
            log.error("Error running job {}: {}", job.getId(), e.getMessage(), e);
            Attempt failed = new Attempt();
            failed.error = e.getMessage();
            result = finish(job.getId(), JobStatus.FAILED, failed);
        } finally {
            release(job.getId(), state, result);
        }
        return result;
    }

    private Attempt runAttempt(RunState state, Job job, int attemptNo) throws InterruptedException {
        Execution execution = Execution.started(Ids.generate("exec"), job, attemptNo, Timestamps.now());
        store.saveExecution(execution);

        Attempt attempt = new Attempt();
        try {
            JobProcessor.RunningProcess process = processor.start(job.getCommand(), job.getWorkingDirectory(), job.getEnvironment());
            state.process = process;
            store.update(job.getId(), JobUpdate.create().pid(process.pid()));
            // a stop that landed while the process was spawning
            if (state.stopRequested) process.signal(state.stopSignal);

            JobProcessor.Result r = process.await(job.timeoutOrZero());
            attempt.exitCode = r.exitCode;
            attempt.stdout = r.stdout;
            attempt.stderr = r.stderr;
            if (state.stopRequested) {
                attempt.status = ExecutionStatus.STOPPED;
            } else if (r.timedOut) {
                attempt.status = ExecutionStatus.TIMEOUT;
                attempt.error = "Timed out after " + job.timeoutOrZero() + " ms";
            } else if (r.exitCode == 0) {
                attempt.status = ExecutionStatus.COMPLETED;
            } else {
                attempt.status = ExecutionStatus.FAILED;
                attempt.error = "Exited with code " + r.exitCode;
            }
        } catch (IOException e) {
            attempt.status = state.stopRequested ? ExecutionStatus.STOPPED : ExecutionStatus.FAILED;
            attempt.error = "Failed to start process: " + e.getMessage();
            log.warn("Job {} could not be started: {}", job.getId(), e.getMessage());
        } finally {
            state.process = null;
            if (attempt.status == null) {
                attempt.status = ExecutionStatus.STOPPED;
                attempt.error = "Interrupted";
            }
            store.saveExecution(execution.finish(Timestamps.now(), attempt.status, attempt.exitCode,
                    attempt.stdout, attempt.stderr, attempt.error));
        }
        return attempt;
    }

    private Job finish(String jobId, JobStatus status, Attempt attempt) {
        try {
            JobUpdate update = JobUpdate.create()
                    .status(status)
                    .completedAt(Timestamps.now())
                    .clearPid()
                    .stdout(attempt.stdout)
                    .stderr(attempt.stderr);
            if (attempt.exitCode != null) update.exitCode(attempt.exitCode);
            return store.update(jobId, update);
        } catch (JobNotFoundException e) {
            log.info("Job {} was removed before its result could be saved", jobId);
            return null;
        }
    }

    private void release(String jobId, RunState state, Job result) {
        running.remove(jobId, state);
        state.done.complete(result);
    }

    /**
     * Signals the job's process group and waits for the dispatch to end. The running
     * attempt is recorded as stopped and not retried. A process still alive after the
     * grace period is killed.
     */
    public Job stop(String jobId, String signal) {
        String sig = JobProcessor.normalizeSignal(signal);
        RunState state = running.get(jobId);
        if (state == null) {
            throw new JobStateException(jobId, "Job " + jobId + " is not running");
        }
        state.stopSignal = sig;
        state.stopRequested = true;
        state.wakeup.countDown();
        JobProcessor.RunningProcess process = state.process;
        if (process != null) {
            process.signal(sig);
            if (state.paused) process.signal("CONT");
        }
        awaitDone(jobId, state);
        return store.get(jobId).orElse(null);
    }

    private void awaitDone(String jobId, RunState state) {
        try {
            state.done.get(STOP_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            JobProcessor.RunningProcess process = state.process;
            if (process != null) {
                log.warn("Job {} did not stop within {} ms, killing it", jobId, STOP_GRACE_MS);
                process.signal("KILL");
            }
            try {
                state.done.get(STOP_GRACE_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException | ExecutionException again) {
                log.warn("Job {} is still winding down: {}", jobId, again.toString());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        } catch (ExecutionException e) {
            log.warn("Job {} ended with an error: {}", jobId, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Suspends the live process group with SIGSTOP. */
    public Job pause(String jobId) {
        RunState state = running.get(jobId);
        JobProcessor.RunningProcess process = state == null ? null : state.process;
        if (process == null || state.paused) {
            throw new JobStateException(jobId, "Job " + jobId + " has no running process to pause");
        }
        process.signal("STOP");
        state.paused = true;
        return store.update(jobId, JobUpdate.create().status(JobStatus.PAUSED));
    }

    /** Continues a paused process group with SIGCONT. */
    public Job resume(String jobId) {
        RunState state = running.get(jobId);
        JobProcessor.RunningProcess process = state == null ? null : state.process;
        if (process == null || !state.paused) {
            throw new JobStateException(jobId, "Job " + jobId + " is not paused");
        }
        process.signal("CONT");
        state.paused = false;
        return store.update(jobId, JobUpdate.create().status(JobStatus.RUNNING));
    }

    /** Sends SIGTERM to every running job, waits for them and stops accepting work. */
    public void shutdown() {
        List<String> ids = new ArrayList<>(running.keySet());
        for (String id : ids) {
            try {
                stop(id, "TERM");
            } catch (JobStateException e) {
                log.debug("Job {} finished before shutdown reached it", id);
            }
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(STOP_GRACE_MS, TimeUnit.MILLISECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
