package com.jobd.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Runs shell command lines as child processes.
 * <p>
 * When {@code setsid} is available each command starts in a session of its own, so its
 * pid is also its process group id and signals reach every process it spawned.
 */
public class JobProcessor {
    private static final Logger log = LoggerFactory.getLogger(JobProcessor.class);

    static final Set<String> SIGNALS = Set.of("TERM", "KILL", "INT", "HUP", "QUIT", "USR1", "USR2", "STOP", "CONT");

    private static final long READER_JOIN_MS = 2000;

    public static class Result {
        public final int exitCode;
        public final String stdout;
        public final String stderr;
        public final boolean timedOut;

        public Result(int exitCode, String stdout, String stderr, boolean timedOut) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderr = stderr;
            this.timedOut = timedOut;
        }
    }

    private final String shell;
    private final int outputLimit;
    private final String setsid;

    public JobProcessor() {
        this("bash", 64 * 1024);
    }

    public JobProcessor(String shell, int outputLimit) {
        this.shell = shell;
        this.outputLimit = outputLimit;
        this.setsid = findSetsid();
    }

    private static String findSetsid() {
        for (String candidate : new String[]{"/usr/bin/setsid", "/bin/setsid"}) {
            if (Files.isExecutable(Path.of(candidate))) return candidate;
        }
        log.warn("setsid not found, signals will only reach the shell and its known descendants");
        return null;
    }

    /**
     * Spawns {@code command} under the configured shell. {@code environment} is laid over
     * the daemon's own environment.
     */
    public RunningProcess start(String command, String workingDirectory, Map<String, String> environment) throws IOException {
        ProcessBuilder pb = setsid != null
                ? new ProcessBuilder(setsid, shell, "-c", command)
                : new ProcessBuilder(shell, "-c", command);
        if (workingDirectory != null && !workingDirectory.isBlank()) {
            pb.directory(new File(workingDirectory));
        }
        if (environment != null) {
            pb.environment().putAll(environment);
        }
        pb.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));

        Process process = pb.start();
        return new RunningProcess(process, setsid != null, outputLimit);
    }

    /**
     * Upper-case signal name without the {@code SIG} prefix.
     *
     * @throws IllegalArgumentException for a signal jobs cannot be sent
     */
    public static String normalizeSignal(String signal) {
        if (signal == null || signal.isBlank()) return "TERM";
        String s = signal.trim().toUpperCase(Locale.ROOT);
        if (s.startsWith("SIG")) s = s.substring(3);
        if (!SIGNALS.contains(s)) {
            throw new IllegalArgumentException("Unsupported signal: " + signal);
        }
        return s;
    }

    public static class RunningProcess {
        private final Process process;
        private final boolean groupLeader;
        private final OutputCollector stdout;
        private final OutputCollector stderr;

        RunningProcess(Process process, boolean groupLeader, int outputLimit) {
            this.process = process;
            this.groupLeader = groupLeader;
            this.stdout = new OutputCollector(process.getInputStream(), outputLimit, "stdout-" + process.pid());
            this.stderr = new OutputCollector(process.getErrorStream(), outputLimit, "stderr-" + process.pid());
            this.stdout.start();
            this.stderr.start();
        }

        public long pid() {
            return process.pid();
        }

        public boolean isAlive() {
            return process.isAlive();
        }

        /**
         * Waits for the process to exit. With a positive {@code timeoutMillis} the whole
         * process group is killed once the time is up.
         */
        public Result await(long timeoutMillis) throws InterruptedException {
            boolean timedOut = false;
            if (timeoutMillis > 0) {
                if (!process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
                    timedOut = true;
                    log.info("Process {} exceeded its {} ms timeout, killing its process group", pid(), timeoutMillis);
                    signal("KILL");
                    process.waitFor();
                }
            } else {
                process.waitFor();
            }
            stdout.join(READER_JOIN_MS);
            stderr.join(READER_JOIN_MS);
            return new Result(process.exitValue(), stdout.text(), stderr.text(), timedOut);
        }

        /** Sends {@code signal} to the process group, or to the process tree without setsid. */
        public void signal(String signal) {
            String sig = normalizeSignal(signal);
            if (!process.isAlive()) return;
            if (groupLeader && runKill(sig, "-" + pid())) return;
            if (sig.equals("KILL")) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            } else if (sig.equals("TERM")) {
                process.descendants().forEach(ProcessHandle::destroy);
                process.destroy();
            } else {
                runKill(sig, Long.toString(pid()));
            }
        }

        private static boolean runKill(String sig, String target) {
            try {
                Process kill = new ProcessBuilder("kill", "-s", sig, "--", target)
                        .redirectErrorStream(true)
                        .start();
                kill.getInputStream().readAllBytes();
                return kill.waitFor(5, TimeUnit.SECONDS) && kill.exitValue() == 0;
            } catch (IOException e) {
                log.warn("Failed to send SIG{} to {}: {}", sig, target, e.getMessage());
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    /** Drains a stream on its own thread, keeping only the newest {@code limit} characters. */
    static class OutputCollector extends Thread {
        private final InputStream in;
        private final int limit;
        private final StringBuilder buffer = new StringBuilder();

        OutputCollector(InputStream in, int limit, String name) {
            super(name);
            setDaemon(true);
            this.in = in;
            this.limit = limit;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (buffer) {
                        buffer.append(line).append('\n');
                        if (buffer.length() > limit) {
                            buffer.delete(0, buffer.length() - limit);
                        }
                    }
                }
            } catch (IOException e) {
                log.debug("Output stream {} closed: {}", getName(), e.getMessage());
            }
        }

        String text() {
            synchronized (buffer) {
                return buffer.toString();
            }
        }
    }
}
