package com.jobd.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobd.model.Job;
import com.jobd.model.JobSchedule;
import com.jobd.model.JobTemplate;
import com.jobd.util.Ids;
import com.jobd.util.Json;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalogue of predefined cron jobs, read from {@code job-templates.json} on the classpath.
 */
public class JobTemplates {
    public static final String RESOURCE = "job-templates.json";

    private final Map<String, JobTemplate> templates = new LinkedHashMap<>();

    public JobTemplates(List<JobTemplate> templates) {
        for (JobTemplate t : templates) this.templates.put(t.getId(), t);
    }

    public static JobTemplates load() {
        return load(RESOURCE);
    }

    public static JobTemplates load(String resource) {
        ObjectMapper mapper = Json.newMapper();
        try (InputStream in = JobTemplates.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException(resource + " not found on classpath");
            return new JobTemplates(mapper.readValue(in, new TypeReference<List<JobTemplate>>() {}));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + resource, e);
        }
    }

    public List<JobTemplate> list() {
        return Collections.unmodifiableList(new ArrayList<>(templates.values()));
    }

    public Optional<JobTemplate> get(String templateId) {
        return Optional.ofNullable(templateId == null ? null : templates.get(templateId));
    }

    /**
     * Builds a job spec from the template. Every field set in {@code overrides} wins over the
     * template's value; a schedule in {@code overrides} replaces the template's cron
     * expression, though a timezone on its own is applied to the template's expression.
     *
     * @throws IllegalArgumentException if there is no such template
     */
    public Job instantiate(String templateId, Job overrides) {
        JobTemplate t = get(templateId)
                .orElseThrow(() -> new IllegalArgumentException("Template " + templateId + " not found"));
        Job o = overrides == null ? new Job() : overrides;

        Job job = new Job();
        job.setId(o.getId() != null ? o.getId() : Ids.generate("job_" + t.getId()));
        job.setName(o.getName() != null ? o.getName() : t.getName());
        job.setDescription(o.getDescription() != null ? o.getDescription() : t.getDescription());
        job.setCommand(o.getCommand() != null ? o.getCommand() : t.getCommand());
        job.setWorkingDirectory(o.getWorkingDirectory() != null ? o.getWorkingDirectory() : t.getWorkingDirectory());
        job.setEnvironment(notEmpty(o.getEnvironment()) ? new LinkedHashMap<>(o.getEnvironment())
                : new LinkedHashMap<>(t.getEnvironment() == null ? Map.of() : t.getEnvironment()));
        job.setTags(notEmpty(o.getTags()) ? new LinkedHashSet<>(o.getTags())
                : new LinkedHashSet<>(t.getTags() == null ? List.of() : t.getTags()));
        job.setUser(o.getUser());
        job.setPriority(o.getPriority() != null ? o.getPriority() : t.getPriority());
        job.setMaxRetries(o.getMaxRetries() != null ? o.getMaxRetries() : t.getMaxRetries());
        job.setTimeout(o.getTimeout() != null ? o.getTimeout() : t.getTimeout());
        job.setEnabled(o.getEnabled());

        JobSchedule s = o.getSchedule();
        if (s != null && !s.isEmpty()) {
            job.setSchedule(s.copy());
        } else {
            job.setSchedule(JobSchedule.cron(t.getSchedule(), s == null ? null : s.getTimezone()));
        }
        return job;
    }

    private static boolean notEmpty(Map<?, ?> m) {
        return m != null && !m.isEmpty();
    }

    private static boolean notEmpty(Collection<?> c) {
        return c != null && !c.isEmpty();
    }
}
