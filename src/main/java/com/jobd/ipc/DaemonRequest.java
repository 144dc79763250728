package com.jobd.ipc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * {@code {"command": "...", "args": {...}, "id": "..."}}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DaemonRequest {
    private String command;
    private ObjectNode args;
    private String id;

    public DaemonRequest() {}

    public DaemonRequest(String command, ObjectNode args, String id) {
        this.command = command;
        this.args = args;
        this.id = id;
    }

    public String getCommand() { return command; }
    public void setCommand(String command) { this.command = command; }

    public ObjectNode getArgs() { return args; }
    public void setArgs(ObjectNode args) { this.args = args; }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    @Override
    public String toString() {
        return "DaemonRequest{command='" + command + "', id='" + id + "'}";
    }
}
