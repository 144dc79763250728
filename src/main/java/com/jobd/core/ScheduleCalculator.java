package com.jobd.core;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.jobd.model.Job;
import com.jobd.model.JobSchedule;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Next-run arithmetic for cron and interval schedules.
 * <p>
 * Five-field expressions are read as classic Unix cron; six fields add a leading seconds
 * field (Spring flavour). A missing timezone means the daemon's own zone.
 */
public class ScheduleCalculator {

    private final CronParser unixParser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private final CronParser springParser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));
    private final ZoneId defaultZone;

    public ScheduleCalculator() {
        this(ZoneId.systemDefault());
    }

    public ScheduleCalculator(ZoneId defaultZone) {
        this.defaultZone = defaultZone;
    }

    /**
     * Throws {@link IllegalArgumentException} if the schedule cannot produce run times.
     */
    public void validate(JobSchedule schedule) {
        if (schedule == null) return;
        boolean hasCron = schedule.getCron() != null && !schedule.getCron().isBlank();
        boolean hasInterval = schedule.getInterval() != null && schedule.getInterval() != 0;
        if (hasCron && hasInterval) {
            throw new IllegalArgumentException("Schedule must have either a cron expression or an interval, not both");
        }
        if (hasInterval && schedule.getInterval() < 0) {
            throw new IllegalArgumentException("Schedule interval must be positive: " + schedule.getInterval());
        }
        if (hasCron) {
            zoneOf(schedule);
            parse(schedule.getCron());
        }
    }

    /**
     * First run time strictly after {@code now} for a cron schedule; for an interval
     * schedule, {@code lastRun + interval}, or {@code now} if the job has never run.
     * Returns null for a job without a schedule.
     */
    public Instant nextRun(Job job, Instant now) {
        JobSchedule schedule = job.getSchedule();
        if (schedule == null || schedule.isEmpty()) return null;
        if (schedule.isCron()) {
            return nextCronRun(schedule, now);
        }
        Instant lastRun = job.getLastRunAt();
        return lastRun == null ? now : lastRun.plusMillis(schedule.getInterval());
    }

    public Instant nextCronRun(JobSchedule schedule, Instant after) {
        ExecutionTime executionTime = ExecutionTime.forCron(parse(schedule.getCron()));
        ZonedDateTime base = ZonedDateTime.ofInstant(after, zoneOf(schedule));
        return executionTime.nextExecution(base)
                .map(ZonedDateTime::toInstant)
                .map(i -> i.truncatedTo(ChronoUnit.MILLIS))
                .orElseThrow(() -> new IllegalArgumentException("Cron expression has no next execution: " + schedule.getCron()));
    }

    private Cron parse(String expression) {
        String expr = expression.trim();
        int fields = expr.split("\\s+").length;
        CronParser parser;
        if (fields == 5) parser = unixParser;
        else if (fields == 6) parser = springParser;
        else throw new IllegalArgumentException("Cron expression must have 5 or 6 fields: " + expression);
        try {
            Cron cron = parser.parse(expr);
            cron.validate();
            return cron;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    private ZoneId zoneOf(JobSchedule schedule) {
        String tz = schedule.getTimezone();
        if (tz == null || tz.isBlank()) return defaultZone;
        try {
            return ZoneId.of(tz.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid timezone: " + tz, e);
        }
    }
}
