package com.jobd.repo;

import com.jobd.config.DaemonConfig;
import com.jobd.util.DataSourceFactory;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.Test;

import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Runs the store contract against H2 in MySQL compatibility mode, using the production schema.
 */
class JobStoreJdbcTest extends JobStoreContractTest {

    @Override
    JobStore newStore(int maxExecutionsPerJob) {
        Properties p = new Properties();
        p.setProperty(DaemonConfig.DB_URL, "jdbc:h2:mem:jobd_" + UUID.randomUUID().toString().replace("-", "")
                + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
        p.setProperty(DaemonConfig.DB_USER, "sa");
        p.setProperty(DaemonConfig.DB_PASSWORD, "");
        p.setProperty(DaemonConfig.DB_POOL_SIZE, "4");
        HikariDataSource ds = DataSourceFactory.create(DaemonConfig.of(p), "jobd-test");
        DataSourceFactory.applySchema(ds, "db/schema.sql");
        return new JobStoreJdbc(ds, maxExecutionsPerJob);
    }

    @Test
    void typeIsJdbc() {
        assertEquals("jdbc", store.type());
    }
}
