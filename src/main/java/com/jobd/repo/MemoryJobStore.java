package com.jobd.repo;

import com.jobd.model.Execution;
import com.jobd.model.Job;
import com.jobd.model.JobFilter;
import com.jobd.model.JobStatus;
import com.jobd.model.JobUpdate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-process store. Contents live as long as the daemon process.
 */
public class MemoryJobStore implements JobStore {

    static final Comparator<Execution> NEWEST_FIRST = Comparator
            .comparing(Execution::getStartTime, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(Execution::getExecutionId, Comparator.nullsLast(Comparator.reverseOrder()));

    static final Comparator<Job> JOBS_NEWEST_FIRST = Comparator
            .comparing(Job::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(Job::getId);

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Map<String, List<Execution>> executions = new ConcurrentHashMap<>();
    private final int maxExecutionsPerJob;

    public MemoryJobStore() {
        this(100);
    }

    public MemoryJobStore(int maxExecutionsPerJob) {
        if (maxExecutionsPerJob <= 0) throw new IllegalArgumentException("maxExecutionsPerJob must be positive");
        this.maxExecutionsPerJob = maxExecutionsPerJob;
    }

    @Override
    public void save(Job job) {
        jobs.put(job.getId(), job.copy());
    }

    @Override
    public boolean insert(Job job) {
        return jobs.putIfAbsent(job.getId(), job.copy()) == null;
    }

    @Override
    public Optional<Job> get(String id) {
        Job job = jobs.get(id);
        return job == null ? Optional.empty() : Optional.of(job.copy());
    }

    @Override
    public List<Job> list(JobFilter filter) {
        return jobs.values().stream()
                .filter(j -> filter == null || filter.matches(j))
                .map(Job::copy)
                .sorted(JOBS_NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    @Override
    public Job update(String id, JobUpdate update) {
        Job updated = jobs.computeIfPresent(id, (k, existing) -> update.applyTo(existing.copy()));
        if (updated == null) throw new JobNotFoundException(id);
        return updated.copy();
    }

    @Override
    public void delete(String id) {
        if (jobs.remove(id) == null) throw new JobNotFoundException(id);
        executions.remove(id);
    }

    @Override
    public void saveExecution(Execution execution) {
        Execution stored = execution.copy();
        executions.compute(execution.getJobId(), (jobId, list) -> {
            List<Execution> next = list == null ? new ArrayList<>() : list;
            next.removeIf(e -> e.getExecutionId().equals(stored.getExecutionId()));
            next.add(stored);
            if (next.size() > maxExecutionsPerJob) {
                next.sort(NEWEST_FIRST);
                next.subList(maxExecutionsPerJob, next.size()).clear();
            }
            return next;
        });
    }

    @Override
    public List<Execution> getExecutions(String jobId, int limit) {
        List<Execution> out = new ArrayList<>();
        executions.computeIfPresent(jobId, (k, list) -> {
            list.stream().sorted(NEWEST_FIRST).limit(limit).map(Execution::copy).forEach(out::add);
            return list;
        });
        return out;
    }

    @Override
    public void cleanup() {
        // nothing to release
    }

    @Override
    public int countJobs() {
        return jobs.size();
    }

    @Override
    public Map<JobStatus, Integer> countByStatus() {
        Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
        for (Job j : jobs.values()) {
            if (j.getStatus() != null) counts.merge(j.getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    @Override
    public int countExecutions() {
        int total = 0;
        for (String jobId : executions.keySet()) total += countExecutions(jobId);
        return total;
    }

    @Override
    public int countExecutions(String jobId) {
        int[] count = {0};
        executions.computeIfPresent(jobId, (k, list) -> {
            count[0] = list.size();
            return list;
        });
        return count[0];
    }

    @Override
    public String type() {
        return "memory";
    }
}
