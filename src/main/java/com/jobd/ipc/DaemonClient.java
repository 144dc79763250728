package com.jobd.ipc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jobd.audit.AuditRecord;
import com.jobd.audit.AuditSink;
import com.jobd.config.DaemonConfig;
import com.jobd.model.DaemonStatus;
import com.jobd.model.Execution;
import com.jobd.model.Job;
import com.jobd.model.JobFilter;
import com.jobd.model.JobStatistics;
import com.jobd.model.ReportFormat;
import com.jobd.model.TriggerResult;
import com.jobd.util.Ids;
import com.jobd.util.Json;
import com.jobd.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Talks to a running daemon over its Unix socket.
 * <p>
 * Requests carry a monotonically increasing id and are matched to responses by that id,
 * so several calls may be in flight at once. Every request is bounded by the configured
 * timeout; a timed-out request leaves no trace behind.
 */
public class DaemonClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DaemonClient.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final String socketPath;
    private final Duration requestTimeout;
    private final AuditSink auditSink;
    private final String sessionId = Ids.generate("session");
    private final ObjectMapper mapper;
    private final int maxBufferBytes;
    private final AtomicLong messageId = new AtomicLong();
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "jobd-client-timer");
        t.setDaemon(true);
        return t;
    });

    private volatile SocketChannel channel;
    // per connection: bytes left over from a dropped connection must not prefix the next one
    private volatile MessageFramer framer;
    private volatile boolean connected;
    private Thread reader;

    private static final class Pending {
        final String command;
        final CompletableFuture<JsonNode> future = new CompletableFuture<>();
        volatile ScheduledFuture<?> timeout;

        Pending(String command) {
            this.command = command;
        }
    }

    public DaemonClient(String socketPath) {
        this(socketPath, DEFAULT_TIMEOUT, null);
    }

    public DaemonClient(String socketPath, Duration requestTimeout, AuditSink auditSink) {
        this(socketPath, requestTimeout, auditSink, MessageFramer.DEFAULT_MAX_BUFFER);
    }

    public DaemonClient(String socketPath, Duration requestTimeout, AuditSink auditSink, int maxBufferBytes) {
        this.socketPath = socketPath;
        this.requestTimeout = requestTimeout;
        this.auditSink = auditSink;
        this.mapper = Json.newMapper();
        this.maxBufferBytes = maxBufferBytes;
        this.framer = new MessageFramer(mapper, maxBufferBytes);
    }

    public static DaemonClient fromConfig(DaemonConfig config, AuditSink auditSink) {
        return new DaemonClient(config.socketPath(), config.requestTimeout(), auditSink, config.maxBufferBytes());
    }

    public String getSocketPath() {
        return socketPath;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Opens the connection. Calling it on a connected client does nothing.
     *
     * @throws DaemonConnectionException when the daemon cannot be reached; never retried
     */
    public synchronized void connect() {
        if (connected) return;

        Path path = Path.of(socketPath);
        if (!Files.exists(path)) {
            throw DaemonConnectionException.notRunning(socketPath, null);
        }
        if (!Files.isReadable(path) || !Files.isWritable(path)) {
            throw DaemonConnectionException.permissionDenied(socketPath, ownerOf(path), null);
        }

        SocketChannel ch = null;
        try {
            ch = SocketChannel.open(StandardProtocolFamily.UNIX);
            ch.connect(UnixDomainSocketAddress.of(path));
        } catch (IOException e) {
            closeQuietly(ch);
            throw classify(path, e);
        }

        MessageFramer fresh = new MessageFramer(mapper, maxBufferBytes);
        SocketChannel opened = ch;
        framer = fresh;
        channel = opened;
        connected = true;
        reader = new Thread(() -> readLoop(opened, fresh), "jobd-client-reader");
        reader.setDaemon(true);
        reader.start();
        log.debug("Connected to daemon at {}", socketPath);
    }

    private DaemonConnectionException classify(Path path, IOException e) {
        if (e instanceof NoSuchFileException) {
            return DaemonConnectionException.notRunning(socketPath, e);
        }
        if (e instanceof AccessDeniedException || String.valueOf(e.getMessage()).contains("Permission denied")) {
            return DaemonConnectionException.permissionDenied(socketPath, ownerOf(path), e);
        }
        // ConnectException: the file is there but nobody accepts on it
        return DaemonConnectionException.refused(socketPath, e);
    }

    private static String ownerOf(Path path) {
        try {
            String owner = Files.getOwner(path).getName();
            return owner.equals(System.getProperty("user.name")) ? "you (" + owner + ")" : "another user (" + owner + ")";
        } catch (IOException e) {
            return "another user";
        }
    }

    public boolean isConnected() {
        return connected;
    }

    /** True when a socket file this user can use exists; does not open a connection. */
    public boolean isDaemonRunning() {
        Path path = Path.of(socketPath);
        return Files.exists(path) && Files.isReadable(path) && Files.isWritable(path);
    }

    /** Requests still waiting for a response. */
    public int pendingCount() {
        return pending.size();
    }

    /** Bytes of an incomplete response held for the current connection. */
    int bufferedBytes() {
        return framer.bufferedBytes();
    }

    private void readLoop(SocketChannel ch, MessageFramer incoming) {
        ByteBuffer buffer = ByteBuffer.allocate(8192);
        try {
            while (connected && channel == ch) {
                buffer.clear();
                int n = ch.read(buffer);
                if (n < 0) break;
                for (JsonNode message : incoming.frameIncoming(buffer.array(), 0, n)) {
                    handleMessage(message);
                }
            }
        } catch (IOException e) {
            if (connected) log.debug("Daemon connection lost: {}", e.getMessage());
        } finally {
            if (channel == ch) {
                connectionClosed();
            } else {
                closeQuietly(ch);
            }
        }
    }

    void handleMessage(JsonNode message) {
        DaemonResponse response;
        try {
            response = mapper.treeToValue(message, DaemonResponse.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable response: {}", e.getOriginalMessage());
            return;
        }
        Pending p = response.getId() == null ? null : pending.remove(response.getId());
        if (p == null) {
            log.debug("Dropping response for unknown request id {}", response.getId());
            return;
        }
        cancelTimeout(p);
        if (response.isSuccess()) {
            p.future.complete(response.getData());
        } else {
            p.future.completeExceptionally(new DaemonRequestException(p.command, response.getError()));
        }
    }

    private void connectionClosed() {
        boolean wasConnected = connected;
        connected = false;
        closeQuietly(channel);
        for (String id : pending.keySet()) {
            Pending p = pending.remove(id);
            if (p != null) {
                cancelTimeout(p);
                p.future.completeExceptionally(DaemonConnectionException.disconnected(socketPath));
            }
        }
        if (wasConnected) log.debug("Disconnected from daemon at {}", socketPath);
    }

    /**
     * Sends a request and returns a future for the response {@code data}. The future fails
     * with {@link DaemonTimeoutException}, {@link DaemonRequestException} or
     * {@link DaemonConnectionException}.
     */
    public CompletableFuture<JsonNode> sendAsync(RequestType type, ObjectNode args) {
        if (!connected) connect();

        String id = Long.toString(messageId.incrementAndGet());
        Pending p = new Pending(type.wireName());
        pending.put(id, p);
        p.timeout = timer.schedule(() -> {
            if (pending.remove(id, p)) {
                p.future.completeExceptionally(new DaemonTimeoutException(p.command, requestTimeout));
            }
        }, requestTimeout.toMillis(), TimeUnit.MILLISECONDS);

        byte[] bytes = framer.encode(new DaemonRequest(type.wireName(), args == null ? mapper.createObjectNode() : args, id));
        try {
            synchronized (writeLock) {
                ByteBuffer out = ByteBuffer.wrap(bytes);
                while (out.hasRemaining()) channel.write(out);
            }
        } catch (IOException e) {
            if (pending.remove(id, p)) {
                cancelTimeout(p);
                p.future.completeExceptionally(DaemonConnectionException.disconnected(socketPath));
            }
        }
        return p.future;
    }

    /** Blocking form of {@link #sendAsync}. */
    public JsonNode send(RequestType type, ObjectNode args) {
        try {
            return sendAsync(type, args).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DaemonException("Interrupted while waiting for " + type.wireName(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DaemonException) throw (DaemonException) cause;
            throw new DaemonException("Request failed: " + type.wireName(), cause);
        }
    }

    private static void cancelTimeout(Pending p) {
        ScheduledFuture<?> t = p.timeout;
        if (t != null) t.cancel(false);
    }

    // ---- typed operations ----

    public DaemonStatus getStatus() {
        return convert(send(RequestType.STATUS, null), DaemonStatus.class);
    }

    public Job addJob(Job job) {
        ObjectNode args = mapper.createObjectNode();
        args.set("jobSpec", mapper.valueToTree(job));
        return convert(send(RequestType.ADD_JOB, args), Job.class);
    }

    /**
     * Adds a scheduled job. With {@code databaseSync} and an audit sink configured, the
     * creation is also written to the audit log.
     */
    public Job createCronJob(Job spec, boolean databaseSync) {
        if (spec.getSchedule() == null || spec.getSchedule().isEmpty()) {
            throw new IllegalArgumentException("A cron job needs a cron expression or an interval");
        }
        if (spec.getWorkingDirectory() == null) spec.setWorkingDirectory(System.getProperty("user.dir"));
        if (spec.getUser() == null) spec.setUser(System.getProperty("user.name"));
        if (spec.getEnabled() == null) spec.setEnabled(true);

        Job created = addJob(spec);
        if (databaseSync) {
            AuditRecord record = auditRecord(created, "created");
            record.setStartedAt(created.getCreatedAt());
            audit(record);
        }
        return created;
    }

    public Job startJob(String jobId) {
        Job job = convert(send(RequestType.START_JOB, idArgs(jobId)), Job.class);
        AuditRecord record = auditRecord(job, "running");
        record.setStartedAt(job.getStartedAt());
        audit(record);
        return job;
    }

    public TriggerResult triggerJob(String jobId) {
        TriggerResult result = convert(send(RequestType.TRIGGER_JOB, idArgs(jobId)), TriggerResult.class);
        AuditRecord record = new AuditRecord(user(), sessionId, jobId, null,
                result.getStatus() == null ? (result.isSuccess() ? "completed" : "failed") : result.getStatus().wireName());
        record.setCompletedAt(Timestamps.now());
        record.setExitCode(result.getExitCode());
        record.setOutput(result.getOutput());
        record.setError(result.getError());
        audit(record);
        return result;
    }

    public Job stopJob(String jobId) {
        return stopJob(jobId, "SIGTERM");
    }

    public Job stopJob(String jobId, String signal) {
        ObjectNode args = idArgs(jobId);
        if (signal != null) args.put("signal", signal);
        return convert(send(RequestType.STOP_JOB, args), Job.class);
    }

    public Job pauseJob(String jobId) {
        return convert(send(RequestType.PAUSE_JOB, idArgs(jobId)), Job.class);
    }

    public Job resumeJob(String jobId) {
        return convert(send(RequestType.RESUME_JOB, idArgs(jobId)), Job.class);
    }

    public List<Job> listJobs(JobFilter filter) {
        return listJobs(filter, 0);
    }

    /** Never throws: any failure is logged and reported as an empty list. */
    public List<Job> listJobs(JobFilter filter, int limit) {
        try {
            ObjectNode args = mapper.createObjectNode();
            if (filter != null) args.set("filter", mapper.valueToTree(filter));
            if (limit > 0) args.put("limit", limit);
            JsonNode data = send(RequestType.LIST_JOBS, args);
            return mapper.convertValue(data, new TypeReference<List<Job>>() {});
        } catch (RuntimeException e) {
            log.warn("Failed to list jobs: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    public Job getJob(String jobId) {
        return convert(send(RequestType.GET_JOB, idArgs(jobId)), Job.class);
    }

    public List<Execution> getExecutions(String jobId, int limit) {
        ObjectNode args = idArgs(jobId);
        if (limit > 0) args.put("limit", limit);
        return mapper.convertValue(send(RequestType.GET_EXECUTIONS, args), new TypeReference<List<Execution>>() {});
    }

    public JobStatistics getStatistics(String jobId) {
        return convert(send(RequestType.GET_STATISTICS, idArgs(jobId)), JobStatistics.class);
    }

    public boolean removeJob(String jobId, boolean force) {
        ObjectNode args = idArgs(jobId);
        args.put("force", force);
        JsonNode data = send(RequestType.REMOVE_JOB, args);
        return data == null || data.path("removed").asBoolean(true);
    }

    /**
     * Renders the execution report on the daemon side. A null {@code jobId} covers every
     * job; null bounds leave that side of the time range open.
     */
    public String generateReport(String jobId, Instant from, Instant to, ReportFormat format) {
        ObjectNode args = mapper.createObjectNode();
        if (jobId != null) args.put("jobId", jobId);
        if (from != null) args.put("from", from.toString());
        if (to != null) args.put("to", to.toString());
        if (format != null) args.put("format", format.wireName());
        return send(RequestType.GENERATE_REPORT, args).asText();
    }

    public String exportJobs(ReportFormat format) {
        ObjectNode args = mapper.createObjectNode();
        if (format != null) args.put("format", format.wireName());
        return send(RequestType.EXPORT_JOBS, args).asText();
    }

    public void restartDaemon() {
        send(RequestType.RESTART, null);
    }

    public void stopDaemon() {
        send(RequestType.STOP, null);
    }

    private ObjectNode idArgs(String jobId) {
        ObjectNode args = mapper.createObjectNode();
        args.put("jobId", jobId);
        return args;
    }

    private <T> T convert(JsonNode data, Class<T> type) {
        try {
            return mapper.treeToValue(data, type);
        } catch (JsonProcessingException e) {
            throw new DaemonException("Unexpected response payload: " + e.getOriginalMessage(), e);
        }
    }

    private AuditRecord auditRecord(Job job, String status) {
        AuditRecord record = new AuditRecord(user(), sessionId, job.getId(), job.getCommand(), status);
        record.setWorkingDirectory(job.getWorkingDirectory());
        return record;
    }

    private void audit(AuditRecord record) {
        if (auditSink == null) return;
        try {
            auditSink.record(record);
        } catch (RuntimeException e) {
            log.warn("Failed to write audit record for job {}: {}", record.getJobId(), e.getMessage());
        }
    }

    private static String user() {
        return System.getProperty("user.name");
    }

    public void disconnect() {
        if (!connected) return;
        connected = false;
        closeQuietly(channel);
        Thread r = reader;
        if (r != null && r != Thread.currentThread()) {
            try {
                r.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        connectionClosed();
    }

    @Override
    public void close() {
        disconnect();
        timer.shutdownNow();
        if (auditSink != null) auditSink.close();
    }

    private static void closeQuietly(SocketChannel ch) {
        if (ch == null) return;
        try {
            ch.close();
        } catch (IOException e) {
            log.debug("Error closing socket channel: {}", e.getMessage());
        }
    }
}
