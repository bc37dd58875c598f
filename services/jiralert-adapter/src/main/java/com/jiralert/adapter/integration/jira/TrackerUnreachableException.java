package com.jiralert.adapter.integration.jira;

/**
 * Jira could not be reached: connection refused, DNS failure or timeout.
 */
public class TrackerUnreachableException extends RuntimeException {

    private final String action;

    public TrackerUnreachableException(String action, Throwable cause) {
        super("Jira unreachable during '%s': %s".formatted(action, describe(cause)), cause);
        this.action = action;
    }

    public String getAction() {
        return action;
    }

    /**
     * First message in the cause chain, or the class name of the innermost
     * cause when none carries one (Netty timeouts don't).
     */
    static String describe(Throwable cause) {
        Throwable current = cause;
        while (current != null) {
            if (current.getMessage() != null) {
                return current.getMessage();
            }
            if (current.getCause() == null || current.getCause() == current) {
                return current.getClass().getSimpleName();
            }
            current = current.getCause();
        }
        return "unknown error";
    }
}
