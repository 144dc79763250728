package com.jobd.cli;

import com.jobd.audit.AuditSink;
import com.jobd.audit.JdbcAuditSink;
import com.jobd.config.DaemonConfig;
import com.jobd.ipc.DaemonClient;
import com.jobd.util.DataSourceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.util.Map;

/**
 * Options shared by every command that talks to the daemon.
 */
public class ClientOptions {
    private static final Logger log = LoggerFactory.getLogger(ClientOptions.class);

    @CommandLine.Option(names = {"--socket"}, description = "Daemon socket path (default: /tmp/jobd-<user>.sock)")
    String socket;

    DaemonConfig config() {
        DaemonConfig config = DaemonConfig.load();
        return socket == null ? config : config.with(Map.of(DaemonConfig.SOCKET_PATH, socket));
    }

    DaemonClient open() {
        DaemonConfig config = config();
        DaemonClient client = DaemonClient.fromConfig(config, auditSink(config));
        client.connect();
        return client;
    }

    private static AuditSink auditSink(DaemonConfig config) {
        if (!config.auditEnabled()) return null;
        try {
            return new JdbcAuditSink(DataSourceFactory.create(config, "jobd-audit"));
        } catch (RuntimeException e) {
            log.warn("Audit log unavailable: {}", e.getMessage());
            return null;
        }
    }
}
