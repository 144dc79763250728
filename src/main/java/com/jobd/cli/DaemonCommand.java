package com.jobd.cli;

import com.jobd.config.DaemonConfig;
import com.jobd.daemon.Daemon;
import com.jobd.ipc.DaemonClient;
import com.jobd.ipc.DaemonConnectionException;
import com.jobd.model.DaemonStatus;
import picocli.CommandLine;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "daemon", description = "Start, stop and inspect the job daemon",
        subcommands = {DaemonCommand.Start.class, DaemonCommand.Stop.class,
                DaemonCommand.Restart.class, DaemonCommand.Status.class})
public class DaemonCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Use subcommands: start | stop | restart | status");
        return 0;
    }

    @CommandLine.Command(name = "start", description = "Start the daemon (in the foreground unless --detach)")
    static class Start implements Callable<Integer> {
        @CommandLine.Mixin
        ClientOptions options;

        @CommandLine.Option(names = {"--detach", "-d"}, description = "Run the daemon in the background")
        boolean detach;

        @Override
        public Integer call() {
            try {
                DaemonConfig config = options.config();
                try (DaemonClient existing = DaemonClient.fromConfig(config, null)) {
                    if (existing.isDaemonRunning() && answers(existing)) {
                        System.err.println("Daemon already running at " + config.socketPath());
                        return 1;
                    }
                }
                return detach ? spawn(config) : runForeground(config);
            } catch (Exception ex) {
                System.err.println("Failed to start daemon: " + ex.getMessage());
                return 2;
            }
        }

        /** A socket file nobody answers on was left by a crashed daemon; the server replaces it. */
        private static boolean answers(DaemonClient existing) {
            try {
                existing.connect();
                return true;
            } catch (DaemonConnectionException e) {
                return false;
            }
        }

        private int runForeground(DaemonConfig config) throws Exception {
            Daemon daemon = new Daemon(config);
            Runtime.getRuntime().addShutdownHook(new Thread(daemon::shutdown, "jobd-shutdown"));
            daemon.start();
            System.out.println("Daemon listening on " + config.socketPath());
            daemon.awaitTermination();
            return 0;
        }

        private int spawn(DaemonConfig config) throws Exception {
            String java = ProcessHandle.current().info().command().orElse("java");
            List<String> cmd = new ArrayList<>();
            cmd.add(java);
            cmd.add("-cp");
            cmd.add(System.getProperty("java.class.path"));
            cmd.add("-D" + DaemonConfig.SOCKET_PATH + "=" + config.socketPath());
            cmd.add("com.jobd.JobdApplication");
            cmd.add("daemon");
            cmd.add("start");

            File log = new File(System.getProperty("java.io.tmpdir"), "jobd-" + System.getProperty("user.name") + ".out");
            Process p = new ProcessBuilder(cmd)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(log))
                    .redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")))
                    .start();

            Path socket = Path.of(config.socketPath());
            for (int i = 0; i < 100 && p.isAlive(); i++) {
                if (Files.exists(socket)) {
                    System.out.println("Daemon started (pid " + p.pid() + "), listening on " + socket);
                    return 0;
                }
                Thread.sleep(100);
            }
            System.err.println("Daemon did not come up, see " + log);
            return 2;
        }
    }

    @CommandLine.Command(name = "stop", description = "Stop the running daemon")
    static class Stop implements Callable<Integer> {
        @CommandLine.Mixin
        ClientOptions options;

        @Override
        public Integer call() {
            try (DaemonClient client = options.open()) {
                client.stopDaemon();
                System.out.println("Daemon stopping");
                return 0;
            } catch (Exception ex) {
                System.err.println("Failed to stop daemon: " + ex.getMessage());
                return 2;
            }
        }
    }

    @CommandLine.Command(name = "restart", description = "Restart the daemon's server and scheduler")
    static class Restart implements Callable<Integer> {
        @CommandLine.Mixin
        ClientOptions options;

        @Override
        public Integer call() {
            try (DaemonClient client = options.open()) {
                client.restartDaemon();
                System.out.println("Daemon restarting");
                return 0;
            } catch (Exception ex) {
                System.err.println("Failed to restart daemon: " + ex.getMessage());
                return 2;
            }
        }
    }

    @CommandLine.Command(name = "status", description = "Show daemon status")
    static class Status implements Callable<Integer> {
        @CommandLine.Mixin
        ClientOptions options;

        @Override
        public Integer call() {
            try (DaemonClient client = options.open()) {
                DaemonStatus s = client.getStatus();
                System.out.printf("%-12s %s%n", "running", s.isRunning());
                System.out.printf("%-12s %d%n", "pid", s.getPid());
                System.out.printf("%-12s %ds%n", "uptime", s.getUptime());
                System.out.printf("%-12s %s%n", "socket", s.getSocketPath());
                System.out.printf("%-12s %s%n", "store", s.getStoreType());
                System.out.printf("%-12s %d%n", "jobs", s.getJobs().getTotal());
                System.out.printf("%-12s %d%n", "executions", s.getExecutions());
                System.out.printf("%-12s %d MB%n", "heap used", s.getMemory().getHeapUsed() / (1024 * 1024));
                return 0;
            } catch (Exception ex) {
                System.err.println(ex.getMessage());
                return 2;
            }
        }
    }
}
