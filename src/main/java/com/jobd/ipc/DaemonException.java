package com.jobd.ipc;

/**
 * Base class for failures talking to the daemon.
 */
public class DaemonException extends RuntimeException {
    public DaemonException(String message) {
        super(message);
    }

    public DaemonException(String message, Throwable cause) {
        super(message, cause);
    }
}
