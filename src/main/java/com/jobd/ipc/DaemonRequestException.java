package com.jobd.ipc;

/**
 * The daemon answered the request with {@code success: false}.
 */
public class DaemonRequestException extends DaemonException {
    private final String command;

    public DaemonRequestException(String command, String error) {
        super(error == null ? "Unknown error" : error);
        this.command = command;
    }

    public String getCommand() {
        return command;
    }
}
