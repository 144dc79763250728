package com.jobd.ipc;

/**
 * The daemon socket could not be reached. The message tells the user what to do about it.
 */
public class DaemonConnectionException extends DaemonException {

    public enum Reason {
        /** No socket file: the daemon was never started or has exited. */
        NOT_RUNNING,
        /** The socket exists but belongs to another user. */
        PERMISSION_DENIED,
        /** The socket file is stale: nothing is listening behind it. */
        CONNECTION_REFUSED,
        /** An established connection was closed. */
        DISCONNECTED
    }

    private final Reason reason;
    private final String socketPath;

    public DaemonConnectionException(Reason reason, String socketPath, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.socketPath = socketPath;
    }

    public static DaemonConnectionException notRunning(String socketPath, Throwable cause) {
        return new DaemonConnectionException(Reason.NOT_RUNNING, socketPath,
                "Daemon socket not found at " + socketPath + ". Start the daemon with: jobd daemon start", cause);
    }

    public static DaemonConnectionException permissionDenied(String socketPath, String owner, Throwable cause) {
        return new DaemonConnectionException(Reason.PERMISSION_DENIED, socketPath,
                "Permission denied to access daemon socket at " + socketPath + ". Socket is owned by " + owner +
                        ". Start your own daemon with: jobd daemon start", cause);
    }

    public static DaemonConnectionException refused(String socketPath, Throwable cause) {
        return new DaemonConnectionException(Reason.CONNECTION_REFUSED, socketPath,
                "Daemon is not responding at " + socketPath + ". It may have crashed. Restart it with: jobd daemon restart",
                cause);
    }

    public static DaemonConnectionException disconnected(String socketPath) {
        return new DaemonConnectionException(Reason.DISCONNECTED, socketPath,
                "Connection to daemon at " + socketPath + " was closed", null);
    }

    public Reason getReason() {
        return reason;
    }

    public String getSocketPath() {
        return socketPath;
    }
}
