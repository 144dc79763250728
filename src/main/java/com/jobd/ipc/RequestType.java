package com.jobd.ipc;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Commands understood by the daemon, keyed by their wire name.
 */
public enum RequestType {
    STATUS("status"),
    ADD_JOB("addJob"),
    START_JOB("startJob"),
    TRIGGER_JOB("triggerJob"),
    STOP_JOB("stopJob"),
    PAUSE_JOB("pauseJob"),
    RESUME_JOB("resumeJob"),
    LIST_JOBS("listJobs"),
    GET_JOB("getJob"),
    GET_EXECUTIONS("getExecutions"),
    GET_STATISTICS("getStatistics"),
    REMOVE_JOB("removeJob"),
    GENERATE_REPORT("generateReport"),
    EXPORT_JOBS("exportJobs"),
    RESTART("restart"),
    STOP("stop");

    private static final Map<String, RequestType> BY_WIRE_NAME = new HashMap<>();

    static {
        for (RequestType t : values()) BY_WIRE_NAME.put(t.wireName, t);
    }

    private final String wireName;

    RequestType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<RequestType> fromWire(String name) {
        return Optional.ofNullable(name == null ? null : BY_WIRE_NAME.get(name));
    }
}
