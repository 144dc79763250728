package com.jobd.util;

import com.jobd.config.DaemonConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public class DataSourceFactory {
    private static final Logger log = LoggerFactory.getLogger(DataSourceFactory.class);

    private DataSourceFactory() {}

    public static HikariDataSource create(DaemonConfig config, String poolName) {
        String jdbcUrl = config.get(DaemonConfig.DB_URL);
        if (jdbcUrl == null) throw new IllegalStateException(DaemonConfig.DB_URL + " is not set");

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(jdbcUrl);
        cfg.setUsername(config.get(DaemonConfig.DB_USER));
        cfg.setPassword(config.get(DaemonConfig.DB_PASSWORD));
        cfg.setMaximumPoolSize(config.getInt(DaemonConfig.DB_POOL_SIZE, 10));
        cfg.setAutoCommit(false);
        cfg.setPoolName(poolName);

        HikariDataSource ds = new HikariDataSource(cfg);
        log.info("Opened connection pool {} for {}", poolName, jdbcUrl);
        return ds;
    }

    /**
     * Runs the {@code ;}-separated DDL statements of a classpath script.
     */
    public static void applySchema(DataSource ds, String resource) {
        String script;
        try (InputStream in = DataSourceFactory.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException(resource + " not found on classpath");
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + resource, e);
        }

        try (Connection c = ds.getConnection(); Statement s = c.createStatement()) {
            c.setAutoCommit(true);
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) s.execute(sql.trim());
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to apply schema " + resource, e);
        }
        log.debug("Applied schema {}", resource);
    }
}
