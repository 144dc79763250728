package com.jobd.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Criteria for listing jobs. Every criterion that is set must match; the status list
 * and the tag list each match when any of their entries does.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobFilter {
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<JobStatus> status = new ArrayList<>();
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> tags = new ArrayList<>();
    private String user;
    private String namePattern;
    private Boolean enabled;

    public JobFilter() {}

    public static JobFilter all() {
        return new JobFilter();
    }

    public static JobFilter byStatus(JobStatus... statuses) {
        JobFilter f = new JobFilter();
        f.setStatus(new ArrayList<>(Arrays.asList(statuses)));
        return f;
    }

    public boolean hasStatus() {
        return status != null && !status.isEmpty();
    }

    public boolean matches(Job job) {
        if (hasStatus() && !status.contains(job.getStatus())) return false;
        if (tags != null && !tags.isEmpty()) {
            if (job.getTags() == null || tags.stream().noneMatch(job.getTags()::contains)) return false;
        }
        if (user != null && !user.equals(job.getUser())) return false;
        if (namePattern != null && !namePattern.isEmpty()) {
            if (job.getName() == null || !Pattern.compile(namePattern).matcher(job.getName()).find()) return false;
        }
        if (enabled != null && enabled != job.isEnabled()) return false;
        return true;
    }

    public List<JobStatus> getStatus() { return status; }
    public void setStatus(List<JobStatus> status) { this.status = status; }

    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags; }

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }

    public String getNamePattern() { return namePattern; }
    public void setNamePattern(String namePattern) { this.namePattern = namePattern; }

    public Boolean getEnabled() { return enabled; }
    public void setEnabled(Boolean enabled) { this.enabled = enabled; }
}
