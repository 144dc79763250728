package com.jobd.daemon;

import com.jobd.config.DaemonConfig;
import com.jobd.repo.JobStore;
import com.jobd.repo.JobStoreJdbc;
import com.jobd.repo.MemoryJobStore;
import com.jobd.util.DataSourceFactory;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the job store named by {@code store.type}.
 */
public final class JobStores {
    private static final Logger log = LoggerFactory.getLogger(JobStores.class);

    static final String SCHEMA_RESOURCE = "db/schema.sql";

    private JobStores() {}

    public static JobStore create(DaemonConfig config) {
        String type = config.storeType();
        switch (type) {
            case "memory":
                log.info("Using in-memory job store (jobs are lost when the daemon exits)");
                return new MemoryJobStore(config.maxExecutionsPerJob());
            case "jdbc":
            case "mysql":
                HikariDataSource ds = DataSourceFactory.create(config, "jobd-store");
                if (config.getBoolean(DaemonConfig.DB_SCHEMA_INIT, true)) {
                    DataSourceFactory.applySchema(ds, SCHEMA_RESOURCE);
                }
                log.info("Using JDBC job store at {}", ds.getJdbcUrl());
                return new JobStoreJdbc(ds, config.maxExecutionsPerJob());
            default:
                throw new IllegalArgumentException("Unknown store type: " + type + " (expected memory or jdbc)");
        }
    }
}
