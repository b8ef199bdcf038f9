package com.elssolution.unlockwatch.integration.status;

/**
 * Outcome of one status query for one account. Never persisted.
 *
 * @param ok       transport succeeded and HTTP status was below 400
 * @param unlocked the unlock signal read from the body (false when absent)
 * @param status   HTTP status code as text, or {@link #NOT_CONFIGURED} / {@link #ERROR}
 * @param raw      response body text, or the error description
 */
public record ProbeResult(boolean ok, boolean unlocked, String status, String raw) {

    public static final String NOT_CONFIGURED = "not-configured";
    public static final String ERROR = "error";

    public static ProbeResult notConfigured() {
        return new ProbeResult(false, false, NOT_CONFIGURED, null);
    }

    public static ProbeResult error(String description) {
        return new ProbeResult(false, false, ERROR, description);
    }

    public static ProbeResult http(int statusCode, boolean unlocked, String body) {
        return new ProbeResult(statusCode < 400, unlocked, String.valueOf(statusCode), body);
    }

    public boolean isNotConfigured() { return NOT_CONFIGURED.equals(status); }

    public boolean isTransportError() { return ERROR.equals(status); }
}
