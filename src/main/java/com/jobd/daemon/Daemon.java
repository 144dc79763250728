package com.jobd.daemon;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobd.config.DaemonConfig;
import com.jobd.core.JobExecutor;
import com.jobd.core.JobProcessor;
import com.jobd.core.JobScheduler;
import com.jobd.core.JobService;
import com.jobd.core.ScheduleCalculator;
import com.jobd.ipc.DaemonServer;
import com.jobd.ipc.RequestDispatcher;
import com.jobd.model.DaemonStatus;
import com.jobd.model.JobStatus;
import com.jobd.repo.JobStore;
import com.jobd.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * The running daemon: owns the store, executor, scheduler and socket server and wires
 * them together. Nothing here is global; tests create as many daemons as they need.
 */
public class Daemon implements RequestDispatcher.DaemonControl {
    private static final Logger log = LoggerFactory.getLogger(Daemon.class);

    private final DaemonConfig config;
    private final JobStore store;
    private final JobExecutor executor;
    private final JobScheduler scheduler;
    private final JobService service;
    private final DaemonServer server;
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile Instant startedAt;
    private volatile boolean running;

    public Daemon(DaemonConfig config) {
        this(config, JobStores.create(config));
    }

    public Daemon(DaemonConfig config, JobStore store) {
        this.config = config;
        this.store = store;
        ObjectMapper mapper = Json.newMapper();
        ScheduleCalculator calculator = new ScheduleCalculator();
        this.executor = new JobExecutor(store, new JobProcessor(config.shell(), config.outputLimitBytes()),
                config.retryBackoff());
        this.scheduler = new JobScheduler(store, executor, calculator, config.checkInterval(),
                config.cleanupMaxAgeHours());
        this.service = new JobService(store, executor, calculator, config.listLimit());
        this.server = new DaemonServer(Path.of(config.socketPath()), new RequestDispatcher(service, this, mapper),
                mapper, config.maxBufferBytes());
    }

    public synchronized void start() throws IOException {
        if (running) return;
        service.recoverInterrupted();
        server.start();
        scheduler.start();
        startedAt = Instant.now();
        running = true;
        log.info("Daemon started (pid {}, store {})", ProcessHandle.current().pid(), store.type());
    }

    @Override
    public DaemonStatus status() {
        DaemonStatus s = new DaemonStatus();
        s.setRunning(running);
        s.setPid(ProcessHandle.current().pid());
        s.setUptime(startedAt == null ? 0 : Duration.between(startedAt, Instant.now()).getSeconds());
        s.setSocketPath(config.socketPath());
        s.setStoreType(store.type());

        Map<JobStatus, Integer> counts = store.countByStatus();
        DaemonStatus.JobCounts jobs = s.getJobs();
        jobs.setTotal(store.countJobs());
        jobs.setRunning(counts.getOrDefault(JobStatus.RUNNING, 0));
        jobs.setCompleted(counts.getOrDefault(JobStatus.COMPLETED, 0));
        jobs.setFailed(counts.getOrDefault(JobStatus.FAILED, 0));
        counts.forEach((status, n) -> jobs.getByStatus().put(status.wireName(), n));
        s.setExecutions(store.countExecutions());

        Runtime rt = Runtime.getRuntime();
        s.getMemory().setHeapUsed(rt.totalMemory() - rt.freeMemory());
        s.getMemory().setHeapTotal(rt.totalMemory());
        s.getMemory().setHeapMax(rt.maxMemory());
        return s;
    }

    /** Rebinds the socket and restarts the scheduler. Running jobs keep running. */
    @Override
    public synchronized void restart() {
        if (!running) return;
        log.info("Restarting daemon");
        scheduler.stop();
        server.stop();
        try {
            server.start();
            scheduler.start();
        } catch (IOException e) {
            log.error("Restart failed, shutting down: {}", e.getMessage(), e);
            shutdown();
        }
    }

    /** Stops running jobs with SIGTERM, closes the server and releases the store. */
    @Override
    public synchronized void shutdown() {
        if (!running) return;
        running = false;
        log.info("Shutting down daemon");
        scheduler.stop();
        executor.shutdown();
        server.stop();
        store.cleanup();
        terminated.countDown();
        log.info("Daemon stopped");
    }

    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    public boolean isRunning() {
        return running;
    }

    public DaemonConfig getConfig() {
        return config;
    }

    public JobService getService() {
        return service;
    }

    public JobScheduler getScheduler() {
        return scheduler;
    }

    public JobStore getStore() {
        return store;
    }
}
