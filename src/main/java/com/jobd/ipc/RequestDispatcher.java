package com.jobd.ipc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jobd.core.JobService;
import com.jobd.core.JobStateException;
import com.jobd.model.DaemonStatus;
import com.jobd.model.Job;
import com.jobd.model.JobFilter;
import com.jobd.model.ReportFormat;
import com.jobd.repo.JobNotFoundException;
import com.jobd.repo.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Turns one decoded request into one response.
 * <p>
 * {@code restart} and {@code stop} are answered before they take effect: their action is
 * returned as a follow-up for the server to run once the response is written.
 */
public class RequestDispatcher {
    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    /** Daemon-level operations the dispatcher cannot perform on its own. */
    public interface DaemonControl {
        DaemonStatus status();

        void restart();

        void shutdown();
    }

    /** A response plus whatever has to happen after it was sent. */
    public static final class Reply {
        private final DaemonResponse response;
        private final Runnable followUp;

        Reply(DaemonResponse response, Runnable followUp) {
            this.response = response;
            this.followUp = followUp;
        }

        public DaemonResponse getResponse() {
            return response;
        }

        public Optional<Runnable> getFollowUp() {
            return Optional.ofNullable(followUp);
        }
    }

    private final JobService service;
    private final DaemonControl control;
    private final ObjectMapper mapper;

    public RequestDispatcher(JobService service, DaemonControl control, ObjectMapper mapper) {
        this.service = service;
        this.control = control;
        this.mapper = mapper;
    }

    public Reply dispatch(JsonNode message) {
        String id = message.hasNonNull("id") ? message.get("id").asText() : null;
        String command = message.hasNonNull("command") ? message.get("command").asText() : null;
        JsonNode rawArgs = message.get("args");
        ObjectNode args = rawArgs instanceof ObjectNode ? (ObjectNode) rawArgs : mapper.createObjectNode();

        Optional<RequestType> type = RequestType.fromWire(command);
        if (type.isEmpty()) {
            log.warn("Unknown command received: {}", command);
            return new Reply(DaemonResponse.failure(id, "Unknown command: " + command), null);
        }

        try {
            Runnable[] followUp = new Runnable[1];
            JsonNode data = switch (type.get()) {
                case STATUS -> mapper.valueToTree(control.status());
                case ADD_JOB -> mapper.valueToTree(service.addJob(jobSpec(args)));
                case START_JOB -> mapper.valueToTree(service.startJob(jobId(args)));
                case TRIGGER_JOB -> mapper.valueToTree(service.triggerJob(jobId(args)));
                case STOP_JOB -> mapper.valueToTree(service.stopJob(jobId(args), text(args, "signal")));
                case PAUSE_JOB -> mapper.valueToTree(service.pauseJob(jobId(args)));
                case RESUME_JOB -> mapper.valueToTree(service.resumeJob(jobId(args)));
                case LIST_JOBS -> mapper.valueToTree(service.listJobs(filter(args), args.path("limit").asInt(0)));
                case GET_JOB -> mapper.valueToTree(service.getJob(jobId(args)));
                case GET_EXECUTIONS -> mapper.valueToTree(service.getExecutions(jobId(args), args.path("limit").asInt(0)));
                case GET_STATISTICS -> mapper.valueToTree(service.getStatistics(jobId(args)));
                case GENERATE_REPORT -> mapper.getNodeFactory().textNode(service.generateReport(
                        text(args, "jobId"), instant(args, "from"), instant(args, "to"),
                        ReportFormat.fromWire(text(args, "format"))));
                case EXPORT_JOBS -> {
                    String format = text(args, "format");
                    yield mapper.getNodeFactory().textNode(service.exportJobs(
                            format == null ? ReportFormat.JSON : ReportFormat.fromWire(format)));
                }
                case REMOVE_JOB -> {
                    service.removeJob(jobId(args), args.path("force").asBoolean(false));
                    yield mapper.createObjectNode().put("removed", true);
                }
                case RESTART -> {
                    followUp[0] = control::restart;
                    yield mapper.createObjectNode().put("message", "Daemon restarting");
                }
                case STOP -> {
                    followUp[0] = control::shutdown;
                    yield mapper.createObjectNode().put("message", "Daemon stopping");
                }
            };
            return new Reply(DaemonResponse.ok(id, data), followUp[0]);
        } catch (JobNotFoundException | JobStateException | IllegalArgumentException e) {
            log.debug("Request {} ({}) rejected: {}", id, command, e.getMessage());
            return new Reply(DaemonResponse.failure(id, e.getMessage()), null);
        } catch (StorageException e) {
            log.error("Storage failure handling {}: {}", command, e.getMessage(), e);
            return new Reply(DaemonResponse.failure(id, e.getMessage()), null);
        } catch (JsonProcessingException e) {
            return new Reply(DaemonResponse.failure(id, "Invalid arguments for " + command + ": " + e.getOriginalMessage()), null);
        } catch (RuntimeException e) {
            log.error("Unexpected error handling {}: {}", command, e.getMessage(), e);
            return new Reply(DaemonResponse.failure(id, e.getMessage() == null ? e.toString() : e.getMessage()), null);
        }
    }

    private Job jobSpec(ObjectNode args) throws JsonProcessingException {
        JsonNode spec = args.get("jobSpec");
        if (spec == null || !spec.isObject()) {
            throw new IllegalArgumentException("jobSpec is required");
        }
        return mapper.treeToValue(spec, Job.class);
    }

    private JobFilter filter(ObjectNode args) throws JsonProcessingException {
        JsonNode filter = args.get("filter");
        return filter == null || filter.isNull() ? null : mapper.treeToValue(filter, JobFilter.class);
    }

    private static String jobId(ObjectNode args) {
        String id = text(args, "jobId");
        if (id == null || id.isBlank()) throw new IllegalArgumentException("jobId is required");
        return id;
    }

    private static Instant instant(ObjectNode args, String field) {
        String value = text(args, field);
        if (value == null || value.isBlank()) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + field + " time: " + value);
        }
    }

    private static String text(ObjectNode args, String field) {
        JsonNode node = args.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
