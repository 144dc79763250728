package com.jobd.audit;

import com.jobd.repo.StorageException;
import com.jobd.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;

import static com.jobd.util.Timestamps.toSql;

/**
 * Appends audit records to the {@code job_audit} table.
 */
public class JdbcAuditSink implements AuditSink {
    private static final Logger log = LoggerFactory.getLogger(JdbcAuditSink.class);

    private final DataSource ds;

    public JdbcAuditSink(DataSource ds) {
        this.ds = ds;
    }

    @Override
    public void record(AuditRecord r) {
        String sql = "INSERT INTO job_audit (user_name, session_id, job_id, command, status, working_directory, " +
                "started_at, completed_at, exit_code, output, error, recorded_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(true);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, r.getUserName());
                ps.setString(2, r.getSessionId());
                ps.setString(3, r.getJobId());
                ps.setString(4, r.getCommand());
                ps.setString(5, r.getStatus());
                ps.setString(6, r.getWorkingDirectory());
                ps.setTimestamp(7, toSql(r.getStartedAt()));
                ps.setTimestamp(8, toSql(r.getCompletedAt()));
                if (r.getExitCode() == null) ps.setNull(9, Types.INTEGER);
                else ps.setInt(9, r.getExitCode());
                ps.setString(10, r.getOutput());
                ps.setString(11, r.getError());
                ps.setTimestamp(12, toSql(Timestamps.now()));
                ps.executeUpdate();
            }
            log.debug("Audit record written: {}", r);
        } catch (SQLException ex) {
            throw new StorageException("Failed to write audit record for job: " + r.getJobId(), ex);
        }
    }

    @Override
    public void close() {
        if (ds instanceof AutoCloseable) {
            try {
                ((AutoCloseable) ds).close();
            } catch (Exception ex) {
                log.warn("Failed to close audit data source: {}", ex.getMessage());
            }
        }
    }
}
