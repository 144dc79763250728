package com.jobd.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * When a job runs on its own: either a cron expression (with optional timezone)
 * or a fixed interval in milliseconds, never both.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobSchedule {
    private String cron;
    private String timezone;
    private Long interval;
    private Instant nextRun;

    public JobSchedule() {}

    public static JobSchedule cron(String expression, String timezone) {
        JobSchedule s = new JobSchedule();
        s.setCron(expression);
        s.setTimezone(timezone);
        return s;
    }

    public static JobSchedule every(long intervalMillis) {
        JobSchedule s = new JobSchedule();
        s.setInterval(intervalMillis);
        return s;
    }

    @JsonIgnore
    public boolean isCron() {
        return cron != null && !cron.isBlank();
    }

    @JsonIgnore
    public boolean isInterval() {
        return interval != null && interval > 0;
    }

    /** Neither a cron expression nor a positive interval. */
    @JsonIgnore
    public boolean isEmpty() {
        return !isCron() && !isInterval();
    }

    public JobSchedule copy() {
        JobSchedule s = new JobSchedule();
        s.cron = cron;
        s.timezone = timezone;
        s.interval = interval;
        s.nextRun = nextRun;
        return s;
    }

    public String getCron() { return cron; }
    public void setCron(String cron) { this.cron = cron; }

    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }

    public Long getInterval() { return interval; }
    public void setInterval(Long interval) { this.interval = interval; }

    public Instant getNextRun() { return nextRun; }
    public void setNextRun(Instant nextRun) { this.nextRun = nextRun; }

    @Override
    public String toString() {
        return isCron()
                ? "cron '" + cron + "'" + (timezone != null ? " (" + timezone + ")" : "")
                : "every " + interval + "ms";
    }
}
