package com.jobd.ipc;

import java.time.Duration;

/**
 * No response arrived in time. The daemon may still be working on the request.
 */
public class DaemonTimeoutException extends DaemonException {
    private final String command;

    public DaemonTimeoutException(String command, Duration timeout) {
        super("Request timeout after " + timeout.toMillis() + " ms for command: " + command);
        this.command = command;
    }

    public String getCommand() {
        return command;
    }
}
