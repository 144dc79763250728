package com.jobd.repo;

import com.jobd.model.Execution;
import com.jobd.model.Job;
import com.jobd.model.JobFilter;
import com.jobd.model.JobStatus;
import com.jobd.model.JobUpdate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single source of truth for jobs and their execution history.
 * <p>
 * Implementations never hand out references to their internal state: callers
 * always receive copies, and mutating them has no effect on stored data.
 */
public interface JobStore {

    /** Inserts the job, or replaces the stored job with the same id. */
    void save(Job job);

    /**
     * Inserts the job only if no job with the same id is stored. The check and the
     * insert are a single atomic step.
     *
     * @return false if a job with this id already exists
     */
    boolean insert(Job job);

    Optional<Job> get(String id);

    /** Jobs matching {@code filter}, newest first; a null filter returns every job. */
    List<Job> list(JobFilter filter);

    /**
     * Applies a partial change and returns the resulting job.
     *
     * @throws JobNotFoundException if no job has this id
     */
    Job update(String id, JobUpdate update);

    /**
     * Removes the job and all of its executions.
     *
     * @throws JobNotFoundException if no job has this id
     */
    void delete(String id);

    /**
     * Inserts an execution, or replaces the record with the same execution id.
     * Afterwards only the newest {@code maxExecutionsPerJob} records of that job are kept.
     */
    void saveExecution(Execution execution);

    /** Executions of a job ordered by start time, newest first. */
    List<Execution> getExecutions(String jobId, int limit);

    /** Releases resources held by the store. Stored data is kept. */
    void cleanup();

    int countJobs();

    Map<JobStatus, Integer> countByStatus();

    int countExecutions();

    int countExecutions(String jobId);

    /** Short name of the backend, reported by the daemon status. */
    String type();
}
