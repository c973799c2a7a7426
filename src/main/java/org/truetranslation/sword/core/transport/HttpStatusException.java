package org.truetranslation.sword.core.transport;

import java.io.IOException;

/**
 * An HTTP response with a status code of 400 or above.
 */
public class HttpStatusException extends IOException {
    private final int statusCode;
    private final String status;

    public HttpStatusException(int statusCode, String status) {
        super("HTTP error: " + (status == null || status.isEmpty() ? String.valueOf(statusCode) : status));
        this.statusCode = statusCode;
        this.status = status;
    }

    public int getStatusCode() { return statusCode; }
    public String getStatus() { return status; }

    /** 4xx responses will not change on retry. */
    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
