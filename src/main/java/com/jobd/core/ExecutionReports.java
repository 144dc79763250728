package com.jobd.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jobd.model.Execution;
import com.jobd.model.ExecutionStatus;
import com.jobd.model.Job;
import com.jobd.model.JobStatistics;
import com.jobd.model.ReportFormat;
import com.jobd.util.Json;

import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders execution history and job summaries as text, CSV or JSON.
 */
public class ExecutionReports {
    static final int RECENT_LIMIT = 20;

    static final String EXECUTION_CSV_HEADER =
            "executionId,jobId,jobName,command,attempt,startTime,endTime,duration,status,exitCode,errorMessage";
    static final String JOB_CSV_HEADER = "Job ID,Name,Status,Executions,Success Rate,Last Execution";

    private final ObjectMapper mapper = Json.newMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /** Renders {@code executions}, which must be ordered newest first. */
    public String report(List<Execution> executions, ReportFormat format, Instant generatedAt) {
        return switch (format) {
            case JSON -> writeJson(executions);
            case CSV -> executionCsv(executions);
            case TEXT -> executionText(executions, generatedAt);
        };
    }

    /**
     * Renders every job with its statistics. Only JSON and CSV are supported.
     *
     * @throws IllegalArgumentException for {@link ReportFormat#TEXT}
     */
    public String export(List<Job> jobs, List<JobStatistics> statistics, ReportFormat format, Instant exportedAt) {
        if (format == ReportFormat.JSON) {
            ObjectNode root = mapper.createObjectNode();
            root.set("jobs", mapper.valueToTree(jobs));
            root.set("reports", mapper.valueToTree(statistics));
            root.put("exportedAt", exportedAt.toString());
            return writeJson(root);
        }
        if (format == ReportFormat.CSV) {
            Map<String, Job> byId = new HashMap<>();
            for (Job j : jobs) byId.put(j.getId(), j);
            StringBuilder sb = new StringBuilder(JOB_CSV_HEADER).append('\n');
            for (JobStatistics s : statistics) {
                Job job = byId.get(s.getJobId());
                row(sb, s.getJobId(),
                        job == null ? "" : job.getName(),
                        job == null || job.getStatus() == null ? "" : job.getStatus().wireName(),
                        Integer.toString(s.getTotalExecutions()),
                        String.format(Locale.ROOT, "%.1f", s.getSuccessRate()),
                        s.getLastExecution() == null ? "" : s.getLastExecution().toString());
            }
            return sb.toString();
        }
        throw new IllegalArgumentException("Export format must be json or csv");
    }

    private String executionText(List<Execution> executions, Instant generatedAt) {
        Map<ExecutionStatus, Integer> byStatus = new EnumMap<>(ExecutionStatus.class);
        for (Execution e : executions) {
            if (e.getStatus() != null) byStatus.merge(e.getStatus(), 1, Integer::sum);
        }

        StringBuilder sb = new StringBuilder("Job Execution Report\n");
        sb.append("Generated: ").append(generatedAt).append('\n');
        sb.append("Total Executions: ").append(executions.size()).append("\n\n");
        sb.append("Status Summary:\n");
        byStatus.forEach((status, count) -> sb.append("  ").append(status.wireName()).append(": ").append(count).append('\n'));
        sb.append("\nRecent Executions:\n");
        for (Execution e : executions.subList(0, Math.min(RECENT_LIMIT, executions.size()))) {
            sb.append(e.getStartTime()).append(" | ")
                    .append(e.getJobName()).append(" | ")
                    .append(e.getStatus() == null ? "-" : e.getStatus().wireName()).append(" | ")
                    .append(e.getDuration() == null ? 0 : e.getDuration()).append("ms\n");
        }
        return sb.toString();
    }

    private String executionCsv(List<Execution> executions) {
        StringBuilder sb = new StringBuilder(EXECUTION_CSV_HEADER).append('\n');
        for (Execution e : executions) {
            row(sb, e.getExecutionId(), e.getJobId(), e.getJobName(), e.getCommand(),
                    Integer.toString(e.getAttempt()),
                    e.getStartTime() == null ? "" : e.getStartTime().toString(),
                    e.getEndTime() == null ? "" : e.getEndTime().toString(),
                    e.getDuration() == null ? "" : e.getDuration().toString(),
                    e.getStatus() == null ? "" : e.getStatus().wireName(),
                    e.getExitCode() == null ? "" : e.getExitCode().toString(),
                    e.getErrorMessage());
        }
        return sb.toString();
    }

    private static void row(StringBuilder sb, String... values) {
        for (int i = 0; i < values.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(csvField(values[i]));
        }
        sb.append('\n');
    }

    /** Quotes a field holding a comma, quote or line break; quotes inside are doubled. */
    static String csvField(String value) {
        if (value == null) return "";
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    private String writeJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render report: " + e.getOriginalMessage(), e);
        }
    }
}
