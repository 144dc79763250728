package com.jobd.repo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobd.model.Execution;
import com.jobd.model.ExecutionStatus;
import com.jobd.model.Job;
import com.jobd.model.JobFilter;
import com.jobd.model.JobSchedule;
import com.jobd.model.JobStatus;
import com.jobd.model.JobUpdate;
import com.jobd.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.jobd.util.Timestamps.fromSql;
import static com.jobd.util.Timestamps.toSql;

/**
 * Durable store on top of a JDBC data source.
 * <p>
 * Rows are always written whole: a partial {@link JobUpdate} reads the current row,
 * merges the change and writes the merged row back in the same transaction.
 */
public class JobStoreJdbc implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(JobStoreJdbc.class);

    private static final String JOB_COLUMNS = "id, name, description, command, working_directory, environment, tags, " +
            "user_name, priority, max_retries, timeout_ms, cron_expression, time_zone, interval_ms, next_run_at, " +
            "enabled, status, created_at, started_at, completed_at, last_run_at, retry_count, pid, exit_code, stdout, stderr";

    private static final String INSERT_JOB = "INSERT INTO jobs (" + JOB_COLUMNS + ") " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_JOB = "UPDATE jobs SET name = ?, description = ?, command = ?, " +
            "working_directory = ?, environment = ?, tags = ?, user_name = ?, priority = ?, max_retries = ?, " +
            "timeout_ms = ?, cron_expression = ?, time_zone = ?, interval_ms = ?, next_run_at = ?, enabled = ?, " +
            "status = ?, created_at = ?, started_at = ?, completed_at = ?, last_run_at = ?, retry_count = ?, " +
            "pid = ?, exit_code = ?, stdout = ?, stderr = ? WHERE id = ?";

    private static final String EXEC_COLUMNS = "execution_id, job_id, job_name, command, attempt, start_time, " +
            "end_time, status, exit_code, stdout, stderr, error_message";

    private static final TypeReference<LinkedHashMap<String, String>> ENV_TYPE = new TypeReference<>() {};
    private static final TypeReference<LinkedHashSet<String>> TAGS_TYPE = new TypeReference<>() {};

    private final DataSource ds;
    private final int maxExecutionsPerJob;
    private final ObjectMapper mapper = Json.newMapper();

    public JobStoreJdbc(DataSource ds, int maxExecutionsPerJob) {
        if (maxExecutionsPerJob <= 0) throw new IllegalArgumentException("maxExecutionsPerJob must be positive");
        this.ds = ds;
        this.maxExecutionsPerJob = maxExecutionsPerJob;
    }

    @Override
    public void save(Job job) {
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try {
                writeJob(c, job);
                c.commit();
            } catch (SQLException ex) {
                c.rollback();
                throw ex;
            }
            log.debug("Job saved: {}", job.getId());
        } catch (SQLException ex) {
            throw new StorageException("Failed to save job: " + job.getId(), ex);
        }
    }

    @Override
    public boolean insert(Job job) {
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement(INSERT_JOB)) {
                    ps.setString(1, job.getId());
                    bindJobFields(ps, job, 2);
                    ps.executeUpdate();
                }
                c.commit();
            } catch (SQLException ex) {
                c.rollback();
                if (isDuplicateKey(ex)) {
                    log.debug("Job already exists: {}", job.getId());
                    return false;
                }
                throw ex;
            }
            log.debug("Job inserted: {}", job.getId());
            return true;
        } catch (SQLException ex) {
            throw new StorageException("Failed to insert job: " + job.getId(), ex);
        }
    }

    @Override
    public Optional<Job> get(String id) {
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(true);
            return findJob(c, id, false);
        } catch (SQLException ex) {
            throw new StorageException("Failed to find job: " + id, ex);
        }
    }

    @Override
    public List<Job> list(JobFilter filter) {
        boolean byStatus = filter != null && filter.hasStatus();
        String sql = byStatus
                ? "SELECT * FROM jobs WHERE status IN (" +
                  filter.getStatus().stream().map(s -> "?").collect(Collectors.joining(", ")) +
                  ") ORDER BY created_at DESC, id"
                : "SELECT * FROM jobs ORDER BY created_at DESC, id";
        List<Job> out = new ArrayList<>();
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(true);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                if (byStatus) {
                    int i = 1;
                    for (JobStatus s : filter.getStatus()) ps.setString(i++, s.wireName());
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        Job j = rowToJob(rs);
                        if (filter == null || filter.matches(j)) out.add(j);
                    }
                }
            }
        } catch (SQLException ex) {
            throw new StorageException("Failed to list jobs", ex);
        }
        return out;
    }

    @Override
    public Job update(String id, JobUpdate update) {
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try {
                Job existing = findJob(c, id, true).orElseThrow(() -> new JobNotFoundException(id));
                Job merged = update.applyTo(existing);
                writeJob(c, merged);
                c.commit();
                return merged;
            } catch (SQLException | RuntimeException ex) {
                c.rollback();
                throw ex;
            }
        } catch (SQLException ex) {
            throw new StorageException("Failed to update job: " + id, ex);
        }
    }

    @Override
    public void delete(String id) {
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement execs = c.prepareStatement("DELETE FROM job_executions WHERE job_id = ?");
                 PreparedStatement job = c.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
                execs.setString(1, id);
                int removedExecutions = execs.executeUpdate();
                job.setString(1, id);
                if (job.executeUpdate() == 0) {
                    c.rollback();
                    throw new JobNotFoundException(id);
                }
                c.commit();
                log.debug("Job deleted: {} ({} executions)", id, removedExecutions);
            } catch (SQLException ex) {
                c.rollback();
                throw ex;
            }
        } catch (SQLException ex) {
            throw new StorageException("Failed to delete job: " + id, ex);
        }
    }

    @Override
    public void saveExecution(Execution e) {
        String update = "UPDATE job_executions SET job_id = ?, job_name = ?, command = ?, attempt = ?, start_time = ?, " +
                "end_time = ?, status = ?, exit_code = ?, stdout = ?, stderr = ?, error_message = ? WHERE execution_id = ?";
        String insert = "INSERT INTO job_executions (job_id, job_name, command, attempt, start_time, end_time, status, " +
                "exit_code, stdout, stderr, error_message, execution_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try {
                int rows;
                try (PreparedStatement ps = c.prepareStatement(update)) {
                    bindExecution(ps, e);
                    rows = ps.executeUpdate();
                }
                if (rows == 0) {
                    try (PreparedStatement ps = c.prepareStatement(insert)) {
                        bindExecution(ps, e);
                        ps.executeUpdate();
                    }
                }
                trimExecutions(c, e.getJobId());
                c.commit();
            } catch (SQLException ex) {
                c.rollback();
                throw ex;
            }
        } catch (SQLException ex) {
            throw new StorageException("Failed to save execution: " + e.getExecutionId(), ex);
        }
    }

    @Override
    public List<Execution> getExecutions(String jobId, int limit) {
        String sql = "SELECT " + EXEC_COLUMNS + " FROM job_executions WHERE job_id = ? " +
                "ORDER BY start_time DESC, execution_id DESC";
        List<Execution> out = new ArrayList<>();
        if (limit <= 0) return out;
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(true);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, jobId);
                ps.setMaxRows(limit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(rowToExecution(rs));
                }
            }
        } catch (SQLException ex) {
            throw new StorageException("Failed to read executions of job: " + jobId, ex);
        }
        return out;
    }

    @Override
    public void cleanup() {
        if (ds instanceof AutoCloseable) {
            try {
                ((AutoCloseable) ds).close();
            } catch (Exception ex) {
                throw new StorageException("Failed to close data source", ex);
            }
        }
    }

    @Override
    public int countJobs() {
        return count("SELECT COUNT(*) FROM jobs", null);
    }

    @Override
    public Map<JobStatus, Integer> countByStatus() {
        String sql = "SELECT status, COUNT(*) cnt FROM jobs GROUP BY status";
        Map<JobStatus, Integer> map = new EnumMap<>(JobStatus.class);
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(true);
            try (PreparedStatement ps = c.prepareStatement(sql);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    map.put(JobStatus.fromWire(rs.getString("status")), rs.getInt("cnt"));
                }
            }
        } catch (SQLException ex) {
            throw new StorageException("Failed to count jobs by status", ex);
        }
        return map;
    }

    @Override
    public int countExecutions() {
        return count("SELECT COUNT(*) FROM job_executions", null);
    }

    @Override
    public int countExecutions(String jobId) {
        return count("SELECT COUNT(*) FROM job_executions WHERE job_id = ?", jobId);
    }

    @Override
    public String type() {
        return "jdbc";
    }

    private int count(String sql, String param) {
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(true);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                if (param != null) ps.setString(1, param);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        } catch (SQLException ex) {
            throw new StorageException("Failed to count rows", ex);
        }
    }

    private Optional<Job> findJob(Connection c, String id, boolean forUpdate) throws SQLException {
        String sql = "SELECT * FROM jobs WHERE id = ?" + (forUpdate ? " FOR UPDATE" : "");
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(rowToJob(rs));
            }
        }
        return Optional.empty();
    }

    /** Update-or-insert of the whole row. */
    private void writeJob(Connection c, Job job) throws SQLException {
        int rows;
        try (PreparedStatement ps = c.prepareStatement(UPDATE_JOB)) {
            bindJobFields(ps, job, 1);
            ps.setString(26, job.getId());
            rows = ps.executeUpdate();
        }
        if (rows == 0) {
            try (PreparedStatement ps = c.prepareStatement(INSERT_JOB)) {
                ps.setString(1, job.getId());
                bindJobFields(ps, job, 2);
                ps.executeUpdate();
            }
        }
    }

    // SQLState class 23 is integrity constraint violation
    private static boolean isDuplicateKey(SQLException ex) {
        return ex instanceof SQLIntegrityConstraintViolationException
                || (ex.getSQLState() != null && ex.getSQLState().startsWith("23"));
    }

    /** Binds every column except {@code id}, starting at parameter {@code i}. */
    private void bindJobFields(PreparedStatement ps, Job job, int i) throws SQLException {
        JobSchedule schedule = job.getSchedule();
        ps.setString(i++, job.getName());
        ps.setString(i++, job.getDescription());
        ps.setString(i++, job.getCommand());
        ps.setString(i++, job.getWorkingDirectory());
        ps.setString(i++, toJson(job.getEnvironment() == null ? Collections.emptyMap() : job.getEnvironment()));
        ps.setString(i++, toJson(job.getTags() == null ? Collections.emptySet() : job.getTags()));
        ps.setString(i++, job.getUser());
        setInt(ps, i++, job.getPriority());
        setInt(ps, i++, job.getMaxRetries());
        setLong(ps, i++, job.getTimeout());
        ps.setString(i++, schedule == null ? null : schedule.getCron());
        ps.setString(i++, schedule == null ? null : schedule.getTimezone());
        setLong(ps, i++, schedule == null ? null : schedule.getInterval());
        ps.setTimestamp(i++, toSql(schedule == null ? null : schedule.getNextRun()));
        ps.setBoolean(i++, job.isEnabled());
        ps.setString(i++, job.getStatus() == null ? JobStatus.CREATED.wireName() : job.getStatus().wireName());
        ps.setTimestamp(i++, toSql(job.getCreatedAt()));
        ps.setTimestamp(i++, toSql(job.getStartedAt()));
        ps.setTimestamp(i++, toSql(job.getCompletedAt()));
        ps.setTimestamp(i++, toSql(job.getLastRunAt()));
        ps.setInt(i++, job.getRetryCount());
        setLong(ps, i++, job.getPid());
        setInt(ps, i++, job.getExitCode());
        ps.setString(i++, job.getStdout());
        ps.setString(i, job.getStderr());
    }

    private void bindExecution(PreparedStatement ps, Execution e) throws SQLException {
        ps.setString(1, e.getJobId());
        ps.setString(2, e.getJobName());
        ps.setString(3, e.getCommand());
        ps.setInt(4, e.getAttempt());
        ps.setTimestamp(5, toSql(e.getStartTime()));
        ps.setTimestamp(6, toSql(e.getEndTime()));
        ps.setString(7, e.getStatus().wireName());
        setInt(ps, 8, e.getExitCode());
        ps.setString(9, e.getStdout());
        ps.setString(10, e.getStderr());
        ps.setString(11, e.getErrorMessage());
        ps.setString(12, e.getExecutionId());
    }

    /** Deletes everything past the newest {@code maxExecutionsPerJob} records, by start time. */
    private void trimExecutions(Connection c, String jobId) throws SQLException {
        List<String> evict = new ArrayList<>();
        String sql = "SELECT execution_id FROM job_executions WHERE job_id = ? ORDER BY start_time DESC, execution_id DESC";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                int seen = 0;
                while (rs.next()) {
                    if (++seen > maxExecutionsPerJob) evict.add(rs.getString(1));
                }
            }
        }
        if (evict.isEmpty()) return;
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM job_executions WHERE execution_id = ?")) {
            for (String id : evict) {
                ps.setString(1, id);
                ps.addBatch();
            }
            ps.executeBatch();
        }
        log.debug("Evicted {} old executions of job {}", evict.size(), jobId);
    }

    private Job rowToJob(ResultSet rs) throws SQLException {
        Job j = new Job();
        j.setId(rs.getString("id"));
        j.setName(rs.getString("name"));
        j.setDescription(rs.getString("description"));
        j.setCommand(rs.getString("command"));
        j.setWorkingDirectory(rs.getString("working_directory"));
        j.setEnvironment(fromJson(rs.getString("environment"), ENV_TYPE, new LinkedHashMap<>()));
        j.setTags(fromJson(rs.getString("tags"), TAGS_TYPE, new LinkedHashSet<>()));
        j.setUser(rs.getString("user_name"));
        j.setPriority(getInt(rs, "priority"));
        j.setMaxRetries(getInt(rs, "max_retries"));
        j.setTimeout(getLong(rs, "timeout_ms"));

        String cron = rs.getString("cron_expression");
        Long interval = getLong(rs, "interval_ms");
        if (cron != null || interval != null) {
            JobSchedule s = new JobSchedule();
            s.setCron(cron);
            s.setTimezone(rs.getString("time_zone"));
            s.setInterval(interval);
            s.setNextRun(fromSql(rs.getTimestamp("next_run_at")));
            j.setSchedule(s);
        }

        j.setEnabled(rs.getBoolean("enabled"));
        j.setStatus(JobStatus.fromWire(rs.getString("status")));
        j.setCreatedAt(fromSql(rs.getTimestamp("created_at")));
        j.setStartedAt(fromSql(rs.getTimestamp("started_at")));
        j.setCompletedAt(fromSql(rs.getTimestamp("completed_at")));
        j.setLastRunAt(fromSql(rs.getTimestamp("last_run_at")));
        j.setRetryCount(rs.getInt("retry_count"));
        j.setPid(getLong(rs, "pid"));
        j.setExitCode(getInt(rs, "exit_code"));
        j.setStdout(rs.getString("stdout"));
        j.setStderr(rs.getString("stderr"));
        return j;
    }

    private Execution rowToExecution(ResultSet rs) throws SQLException {
        Execution e = new Execution();
        e.setExecutionId(rs.getString("execution_id"));
        e.setJobId(rs.getString("job_id"));
        e.setJobName(rs.getString("job_name"));
        e.setCommand(rs.getString("command"));
        e.setAttempt(rs.getInt("attempt"));
        e.setStartTime(fromSql(rs.getTimestamp("start_time")));
        e.setEndTime(fromSql(rs.getTimestamp("end_time")));
        e.setStatus(ExecutionStatus.fromWire(rs.getString("status")));
        e.setExitCode(getInt(rs, "exit_code"));
        e.setStdout(rs.getString("stdout"));
        e.setStderr(rs.getString("stderr"));
        e.setErrorMessage(rs.getString("error_message"));
        return e;
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new StorageException("Failed to encode column value", ex);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, T empty) {
        if (json == null || json.isBlank()) return empty;
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new StorageException("Failed to decode column value: " + json, ex);
        }
    }

    private static void setInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) ps.setNull(index, Types.INTEGER);
        else ps.setInt(index, value);
    }

    private static void setLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) ps.setNull(index, Types.BIGINT);
        else ps.setLong(index, value);
    }

    private static Integer getInt(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    private static Long getLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }
}
