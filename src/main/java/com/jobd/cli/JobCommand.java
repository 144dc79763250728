package com.jobd.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.jobd.ipc.DaemonClient;
import com.jobd.model.Execution;
import com.jobd.model.Job;
import com.jobd.model.JobStatistics;
import com.jobd.model.ReportFormat;
import com.jobd.model.TriggerResult;
import com.jobd.util.Json;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "job", description = "Commands for a single job",
        subcommands = {JobCommand.Show.class, JobCommand.Start.class, JobCommand.Trigger.class,
                JobCommand.Stop.class, JobCommand.Pause.class, JobCommand.Resume.class,
                JobCommand.Remove.class, JobCommand.History.class, JobCommand.Stats.class,
                JobCommand.Report.class})
public class JobCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Use subcommands: show | start | trigger | stop | pause | resume | remove | history | stats <jobId>, report [jobId]");
        return 0;
    }

    /** Connects, runs the action and maps failures to exit code 2. */
    abstract static class JobAction implements Callable<Integer> {
        @CommandLine.Mixin
        ClientOptions options;

        @CommandLine.Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            try (DaemonClient client = options.open()) {
                return run(client);
            } catch (Exception ex) {
                System.err.println(ex.getMessage());
                return 2;
            }
        }

        abstract int run(DaemonClient client) throws Exception;
    }

    @CommandLine.Command(name = "show", description = "Show a job as JSON")
    static class Show extends JobAction {
        private final ObjectMapper mapper = Json.newMapper().enable(SerializationFeature.INDENT_OUTPUT);

        @Override
        int run(DaemonClient client) throws Exception {
            System.out.println(mapper.writeValueAsString(client.getJob(jobId)));
            return 0;
        }
    }

    @CommandLine.Command(name = "start", description = "Start a job in the background")
    static class Start extends JobAction {
        @Override
        int run(DaemonClient client) {
            Job job = client.startJob(jobId);
            System.out.println("Started job " + job.getId() + (job.getPid() == null ? "" : " (pid " + job.getPid() + ")"));
            return 0;
        }
    }

    @CommandLine.Command(name = "trigger", description = "Run a job now and wait for the result")
    static class Trigger extends JobAction {
        @Override
        int run(DaemonClient client) {
            TriggerResult r = client.triggerJob(jobId);
            if (r.getOutput() != null && !r.getOutput().isEmpty()) System.out.print(r.getOutput());
            if (r.getError() != null) System.err.println(r.getError());
            System.out.println("Job " + jobId + " " + (r.getStatus() == null ? "-" : r.getStatus().wireName())
                    + (r.getExitCode() == null ? "" : " (exit " + r.getExitCode() + ")"));
            return r.isSuccess() ? 0 : 1;
        }
    }

    @CommandLine.Command(name = "stop", description = "Stop a running job")
    static class Stop extends JobAction {
        @CommandLine.Option(names = {"--signal"}, description = "Signal to send", defaultValue = "SIGTERM")
        String signal;

        @Override
        int run(DaemonClient client) {
            Job job = client.stopJob(jobId, signal);
            System.out.println("Job " + job.getId() + " " + job.getStatus().wireName());
            return 0;
        }
    }

    @CommandLine.Command(name = "pause", description = "Suspend a running job")
    static class Pause extends JobAction {
        @Override
        int run(DaemonClient client) {
            client.pauseJob(jobId);
            System.out.println("Paused job " + jobId);
            return 0;
        }
    }

    @CommandLine.Command(name = "resume", description = "Continue a paused job")
    static class Resume extends JobAction {
        @Override
        int run(DaemonClient client) {
            client.resumeJob(jobId);
            System.out.println("Resumed job " + jobId);
            return 0;
        }
    }

    @CommandLine.Command(name = "remove", description = "Remove a job and its history")
    static class Remove extends JobAction {
        @CommandLine.Option(names = {"--force", "-f"}, description = "Stop the job first if it is running")
        boolean force;

        @Override
        int run(DaemonClient client) {
            client.removeJob(jobId, force);
            System.out.println("Removed job " + jobId);
            return 0;
        }
    }

    @CommandLine.Command(name = "history", description = "List recent executions of a job")
    static class History extends JobAction {
        @CommandLine.Option(names = {"--limit"}, description = "Number of executions", defaultValue = "20")
        int limit;

        @Override
        int run(DaemonClient client) {
            List<Execution> executions = client.getExecutions(jobId, limit);
            if (executions.isEmpty()) {
                System.out.println("No executions for job " + jobId);
                return 0;
            }
            System.out.printf("%-32s %-8s %-10s %-6s %-10s %s%n", "execution", "attempt", "status", "exit", "duration", "started");
            for (Execution e : executions) {
                System.out.printf("%-32s %-8d %-10s %-6s %-10s %s%n",
                        e.getExecutionId(), e.getAttempt(), e.getStatus().wireName(),
                        e.getExitCode() == null ? "-" : e.getExitCode().toString(),
                        e.getDuration() == null ? "-" : e.getDuration() + "ms",
                        e.getStartTime());
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "stats", description = "Show execution statistics of a job")
    static class Stats extends JobAction {
        @Override
        int run(DaemonClient client) {
            JobStatistics s = client.getStatistics(jobId);
            System.out.printf("%-14s %d%n", "executions", s.getTotalExecutions());
            System.out.printf("%-14s %d%n", "successful", s.getSuccessfulExecutions());
            System.out.printf("%-14s %d%n", "failed", s.getFailedExecutions());
            System.out.printf("%-14s %.1f%%%n", "success rate", s.getSuccessRate());
            System.out.printf("%-14s %.0fms%n", "avg duration", s.getAverageDuration());
            System.out.printf("%-14s %s%n", "last run", s.getLastExecution() == null ? "-" : s.getLastExecution());
            if (!s.getCommonErrors().isEmpty()) {
                System.out.println("common errors");
                for (JobStatistics.ErrorCount e : s.getCommonErrors()) {
                    System.out.printf("  %s (%d times)%n", e.getError(), e.getCount());
                }
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "report", description = "Execution report of one job, or of all jobs")
    static class Report implements Callable<Integer> {
        @CommandLine.Mixin
        ClientOptions options;

        @CommandLine.Parameters(index = "0", arity = "0..1", description = "Job id (default: all jobs)")
        String jobId;

        @CommandLine.Option(names = {"--format"}, description = "text, csv or json", defaultValue = "text")
        String format;

        @CommandLine.Option(names = {"--from"}, description = "Only executions started at or after this ISO-8601 instant")
        String from;

        @CommandLine.Option(names = {"--to"}, description = "Only executions started at or before this ISO-8601 instant")
        String to;

        @CommandLine.Option(names = {"--output", "-o"}, description = "Write the report to this file")
        Path output;

        @Override
        public Integer call() {
            try {
                ReportFormat reportFormat = ReportFormat.fromWire(format);
                Instant fromTime = parseInstant("--from", from);
                Instant toTime = parseInstant("--to", to);
                try (DaemonClient client = options.open()) {
                    return write(client.generateReport(jobId, fromTime, toTime, reportFormat), output);
                }
            } catch (Exception ex) {
                System.err.println(ex.getMessage());
                return 2;
            }
        }
    }

    static Instant parseInstant(String option, String value) {
        if (value == null) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + option + " value: " + value + " (expected e.g. 2024-05-01T00:00:00Z)");
        }
    }

    /** Prints {@code content}, or writes it to {@code output} when one is given. */
    static int write(String content, Path output) throws IOException {
        if (output == null) {
            System.out.print(content);
        } else {
            Files.writeString(output, content, StandardCharsets.UTF_8);
            System.out.println("Wrote " + output);
        }
        return 0;
    }
}
