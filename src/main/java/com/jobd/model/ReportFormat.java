package com.jobd.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Output formats of execution reports and job exports. */
public enum ReportFormat {
    TEXT,
    CSV,
    JSON;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Null or blank means {@code text}. */
    @JsonCreator
    public static ReportFormat fromWire(String value) {
        if (value == null || value.isBlank()) return TEXT;
        try {
            return ReportFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report format: " + value + " (use text, csv or json)");
        }
    }
}
