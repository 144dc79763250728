package com.jobd.audit;

import com.jobd.config.DaemonConfig;
import com.jobd.repo.StorageException;
import com.jobd.util.DataSourceFactory;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Instant;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcAuditSinkTest {

    private HikariDataSource ds;
    private JdbcAuditSink sink;

    @BeforeEach
    void setup() {
        Properties p = new Properties();
        p.setProperty(DaemonConfig.DB_URL, "jdbc:h2:mem:audit_" + UUID.randomUUID().toString().replace("-", "")
                + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
        p.setProperty(DaemonConfig.DB_USER, "sa");
        ds = DataSourceFactory.create(DaemonConfig.of(p), "jobd-audit-test");
        DataSourceFactory.applySchema(ds, "db/schema.sql");
        sink = new JdbcAuditSink(ds);
    }

    @AfterEach
    void teardown() {
        sink.close();
    }

    @Test
    void recordIsAppended() throws Exception {
        AuditRecord r = new AuditRecord("alice", "session_1", "job_1", "echo hi", "completed");
        r.setWorkingDirectory("/tmp");
        r.setCompletedAt(Instant.parse("2024-05-01T10:00:00Z"));
        r.setExitCode(0);
        r.setOutput("hi\n");

        sink.record(r);
        sink.record(new AuditRecord("alice", "session_1", "job_1", "echo hi", "running"));

        try (Connection c = ds.getConnection(); Statement s = c.createStatement();
             ResultSet rs = s.executeQuery("SELECT status, exit_code, output FROM job_audit WHERE job_id = 'job_1' ORDER BY id")) {
            assertTrue(rs.next());
            assertEquals("completed", rs.getString("status"));
            assertEquals(0, rs.getInt("exit_code"));
            assertEquals("hi\n", rs.getString("output"));
            assertTrue(rs.next());
            assertEquals("running", rs.getString("status"));
            rs.getInt("exit_code");
            assertTrue(rs.wasNull());
        }
    }

    @Test
    void sqlFailureIsWrapped() {
        // status is NOT NULL
        AuditRecord broken = new AuditRecord("alice", "session_1", "job_1", "true", null);

        StorageException ex = assertThrows(StorageException.class, () -> sink.record(broken));
        assertTrue(ex.getMessage().contains("job_1"));
    }
}
