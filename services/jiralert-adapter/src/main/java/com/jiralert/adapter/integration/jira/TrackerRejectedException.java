package com.jiralert.adapter.integration.jira;

/**
 * Jira answered a call with an error status. The response body is kept because
 * Jira puts the reason (missing field, unknown issue type, ...) there.
 */
public class TrackerRejectedException extends RuntimeException {

    private final String action;
    private final int statusCode;
    private final String responseBody;

    public TrackerRejectedException(String action, int statusCode, String responseBody, Throwable cause) {
        super("Jira rejected '%s' with status %d: %s".formatted(action, statusCode, responseBody), cause);
        this.action = action;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public String getAction() {
        return action;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
