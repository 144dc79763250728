package com.jobd.ipc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code {"success": true|false, "data": ..., "error": "...", "id": "..."}}; {@code id}
 * echoes the request it answers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DaemonResponse {
    private boolean success;
    private JsonNode data;
    private String error;
    private String id;

    public DaemonResponse() {}

    public static DaemonResponse ok(String id, JsonNode data) {
        DaemonResponse r = new DaemonResponse();
        r.success = true;
        r.data = data;
        r.id = id;
        return r;
    }

    public static DaemonResponse failure(String id, String error) {
        DaemonResponse r = new DaemonResponse();
        r.success = false;
        r.error = error;
        r.id = id;
        return r;
    }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public JsonNode getData() { return data; }
    public void setData(JsonNode data) { this.data = data; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
}
