package com.example.orderdesk.infrastructure.exception;

/**
 * Failure of a collaborator service (identity, notification delivery).
 */
public abstract class DownstreamServiceException extends RuntimeException {

    private final String serviceName;
    private final int statusCode;

    protected DownstreamServiceException(String serviceName, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
        this.statusCode = statusCode;
    }

    public String getServiceName() {
        return serviceName;
    }

    /**
     * HTTP status returned by the service, or 0 when no response arrived.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
