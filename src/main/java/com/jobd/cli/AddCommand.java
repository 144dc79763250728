package com.jobd.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobd.core.JobTemplates;
import com.jobd.ipc.DaemonClient;
import com.jobd.model.Job;
import com.jobd.model.JobSchedule;
import com.jobd.util.Json;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "add", description = "Add a job (pass JSON, unquoted key:value parts, or @file; "
        + "with --template the JSON only overrides template fields)")
public class AddCommand implements Callable<Integer> {

    @CommandLine.Mixin
    ClientOptions options;

    @CommandLine.Parameters(arity = "0..*", description = "Job JSON string; you can pass it split by shell (will be joined). Use @file to read from file.")
    private String[] jobJsonParts;

    @CommandLine.Option(names = {"--cron"}, description = "Cron expression (5 fields, or 6 with seconds)")
    private String cron;

    @CommandLine.Option(names = {"--timezone"}, description = "Timezone for the cron expression")
    private String timezone;

    @CommandLine.Option(names = {"--every"}, description = "Run interval in milliseconds")
    private Long every;

    @CommandLine.Option(names = {"--template"}, description = "Start from a predefined job (see: jobd templates)")
    private String template;

    @CommandLine.Option(names = {"--sync"}, description = "Also record the scheduled job in the audit log")
    private boolean sync;

    private static final ObjectMapper mapper = Json.newMapper();

    @Override
    public Integer call() {
        try {
            String json = readJsonFromArgsOrStdin(jobJsonParts);
            if ((json == null || json.isBlank()) && template == null) {
                System.err.println("No job JSON supplied (argument, @file, or stdin).");
                return 2;
            }
            Job job = resolveJob(json, template, template == null ? null : JobTemplates.load());
            if (cron != null) job.setSchedule(JobSchedule.cron(cron, timezone));
            else if (every != null) job.setSchedule(JobSchedule.every(every));

            try (DaemonClient client = options.open()) {
                Job added = job.isScheduled() ? client.createCronJob(job, sync) : client.addJob(job);
                System.out.println("Added job: " + added.getId());
                if (added.isScheduled() && added.getSchedule().getNextRun() != null) {
                    System.out.println("Next run: " + added.getSchedule().getNextRun());
                }
            }
            return 0;
        } catch (Exception ex) {
            System.err.println("Failed to add job: " + ex.getMessage());
            return 2;
        }
    }

    /**
     * The job to add: the parsed JSON, or with a template the template's job with the
     * parsed JSON's fields laid over it.
     *
     * @throws IllegalArgumentException when the JSON cannot be parsed or the template is unknown
     */
    static Job resolveJob(String json, String templateId, JobTemplates templates) {
        Job parsed = null;
        if (json != null && !json.isBlank()) {
            parsed = parseJob(json);
            if (parsed == null) throw new IllegalArgumentException("invalid JSON.");
        }
        return templateId == null ? parsed : templates.instantiate(templateId, parsed);
    }

    /**
     * Strict JSON first, then the unquoted {@code {name:x,command:y}} form that some
     * shells leave behind, then single quotes swapped for double quotes.
     */
    static Job parseJob(String json) {
        Job job = tryParse(json);
        if (job == null) job = tryParse(normalizeMaybeUnquotedJson(json));
        if (job == null) job = tryParse(json.replace('\'', '"'));
        return job;
    }

    private static Job tryParse(String json) {
        try {
            return mapper.readValue(json, Job.class);
        } catch (IOException e) {
            return null;
        }
    }

    private String readJsonFromArgsOrStdin(String[] parts) throws IOException {
        if (parts != null && parts.length > 0) {
            if (parts.length == 1 && parts[0].startsWith("@")) {
                String path = parts[0].substring(1);
                File f = new File(path);
                if (!f.exists()) throw new IllegalArgumentException("File not found: " + path);
                return Files.readString(f.toPath(), StandardCharsets.UTF_8);
            }
            return String.join(" ", parts).trim();
        }

        if (System.in.available() > 0) {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
                StringBuilder sb = new StringBuilder();
                String line;
                while ((line = br.readLine()) != null) sb.append(line).append("\n");
                return sb.toString().trim();
            }
        }
        return null;
    }

    static String normalizeMaybeUnquotedJson(String input) {
        String s = input.trim();
        if (s.startsWith("{") && s.endsWith("}")) s = s.substring(1, s.length() - 1);
        StringBuilder out = new StringBuilder("{");
        boolean first = true;
        for (String pair : s.split("\\s*,\\s*")) {
            if (pair == null || pair.isBlank()) continue;
            if (!first) out.append(", ");
            first = false;

            int idx = pair.indexOf(':');
            if (idx < 0) {
                out.append(pair.trim());
                continue;
            }
            String key = pair.substring(0, idx).trim().replaceAll("^[\"']|[\"']$", "");
            String val = pair.substring(idx + 1).trim();
            String lower = val.toLowerCase();
            boolean literal = "null".equals(lower) || "true".equals(lower) || "false".equals(lower)
                    || val.matches("^-?\\d+(\\.\\d+)?$");
            if (!literal) {
                boolean quoted = (val.startsWith("\"") && val.endsWith("\"")) || (val.startsWith("'") && val.endsWith("'"));
                if (quoted && val.length() >= 2) {
                    val = val.substring(1, val.length() - 1);
                }
                val = "\"" + val.replace("\"", "\\\"") + "\"";
            }
            out.append('"').append(key).append("\":").append(val);
        }
        return out.append("}").toString();
    }
}
