package com.jobd.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle states of a job.
 * <p>
 * {@code created -> running -> {completed, failed, stopped, killed, paused}};
 * {@code paused} goes back to {@code running} on resume.
 */
public enum JobStatus {
    CREATED,
    RUNNING,
    COMPLETED,
    FAILED,
    STOPPED,
    KILLED,
    PAUSED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED || this == KILLED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromWire(String value) {
        if (value == null) return null;
        try {
            return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown job status: " + value);
        }
    }
}
