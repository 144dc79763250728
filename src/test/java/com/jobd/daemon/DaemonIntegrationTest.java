package com.jobd.daemon;

import com.jobd.config.DaemonConfig;
import com.jobd.ipc.DaemonClient;
import com.jobd.ipc.DaemonConnectionException;
import com.jobd.ipc.DaemonRequestException;
import com.jobd.model.DaemonStatus;
import com.jobd.model.Execution;
import com.jobd.model.Job;
import com.jobd.model.JobFilter;
import com.jobd.model.JobSchedule;
import com.jobd.model.JobStatistics;
import com.jobd.model.JobStatus;
import com.jobd.model.TriggerResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * A real daemon on a temporary socket with the in-memory store, driven through the client.
 */
class DaemonIntegrationTest {

    @TempDir
    Path dir;

    private Path socket;
    private Daemon daemon;
    private DaemonClient client;

    @BeforeEach
    void startDaemon() throws Exception {
        socket = dir.resolve("jobd.sock");
        Properties p = new Properties();
        p.setProperty(DaemonConfig.SOCKET_PATH, socket.toString());
        p.setProperty(DaemonConfig.STORE_TYPE, "memory");
        p.setProperty(DaemonConfig.CHECK_INTERVAL_MS, "50");
        p.setProperty(DaemonConfig.RETRY_BACKOFF_MS, "10");
        daemon = new Daemon(DaemonConfig.of(p));
        daemon.start();
        client = new DaemonClient(socket.toString(), Duration.ofSeconds(10), null);
        client.connect();
    }

    @AfterEach
    void stopDaemon() {
        client.close();
        daemon.shutdown();
    }

    private static Job spec(String name, String command) {
        Job j = new Job(null, name, command);
        j.setMaxRetries(0);
        return j;
    }

    @Test
    void socketIsPrivateToTheOwner() throws Exception {
        assertEquals("rw-------", PosixFilePermissions.toString(Files.getPosixFilePermissions(socket)));
    }

    @Test
    void addTriggerAndInspect() {
        Job added = client.addJob(spec("greet", "echo hello from jobd"));
        assertEquals(JobStatus.CREATED, added.getStatus());

        TriggerResult result = client.triggerJob(added.getId());
        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("hello from jobd"));

        Job job = client.getJob(added.getId());
        assertEquals(JobStatus.COMPLETED, job.getStatus());

        List<Execution> history = client.getExecutions(added.getId(), 10);
        assertEquals(1, history.size());
        JobStatistics stats = client.getStatistics(added.getId());
        assertEquals(1, stats.getSuccessfulExecutions());

        List<Job> completed = client.listJobs(JobFilter.byStatus(JobStatus.COMPLETED));
        assertEquals(1, completed.size());
        assertTrue(client.listJobs(JobFilter.byStatus(JobStatus.FAILED)).isEmpty());
    }

    @Test
    void unknownJobIsAnError() {
        DaemonRequestException ex = assertThrows(DaemonRequestException.class, () -> client.getJob("ghost"));
        assertEquals("Job ghost not found", ex.getMessage());
    }

    @Test
    void invalidSpecIsAnError() {
        DaemonRequestException ex = assertThrows(DaemonRequestException.class, () -> client.addJob(spec("", "true")));
        assertEquals("Job name is required", ex.getMessage());
    }

    @Test
    void startedJobCanBeStopped() throws Exception {
        Job added = client.addJob(spec("sleeper", "sleep 30"));

        Job running = client.startJob(added.getId());
        assertEquals(JobStatus.RUNNING, running.getStatus());
        waitFor(() -> client.getJob(added.getId()).getPid() != null);

        Job stopped = client.stopJob(added.getId());
        assertEquals(JobStatus.STOPPED, stopped.getStatus());
    }

    @Test
    void removeRequiresForceWhileRunning() throws Exception {
        Job added = client.addJob(spec("sleeper", "sleep 30"));
        client.startJob(added.getId());
        waitFor(() -> client.getJob(added.getId()).getPid() != null);

        DaemonRequestException ex = assertThrows(DaemonRequestException.class,
                () -> client.removeJob(added.getId(), false));
        assertTrue(ex.getMessage().contains("Use force to remove"));

        assertTrue(client.removeJob(added.getId(), true));
        assertThrows(DaemonRequestException.class, () -> client.getJob(added.getId()));
    }

    @Test
    void intervalJobRunsRepeatedly() throws Exception {
        Job s = spec("ticker", "true");
        s.setSchedule(JobSchedule.every(100));
        Job added = client.createCronJob(s, false);

        waitFor(() -> daemon.getStore().countExecutions(added.getId()) >= 2);
    }

    @Test
    void statusReportsCounts() {
        Job added = client.addJob(spec("one", "true"));
        client.triggerJob(added.getId());

        DaemonStatus status = client.getStatus();

        assertTrue(status.isRunning());
        assertEquals("memory", status.getStoreType());
        assertEquals(socket.toString(), status.getSocketPath());
        assertEquals(1, status.getJobs().getTotal());
        assertEquals(1, status.getJobs().getCompleted());
        assertEquals(1, status.getExecutions());
    }

    @Test
    void stopRequestShutsTheDaemonDown() throws Exception {
        client.stopDaemon();

        assertTrue(daemon.awaitTermination(10, TimeUnit.SECONDS));
        assertFalse(daemon.isRunning());
        waitFor(() -> !Files.exists(socket));

        DaemonClient late = new DaemonClient(socket.toString());
        DaemonConnectionException ex = assertThrows(DaemonConnectionException.class, late::connect);
        assertEquals(DaemonConnectionException.Reason.NOT_RUNNING, ex.getReason());
        late.close();
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(condition.getAsBoolean(), "condition not met in time");
    }
}
