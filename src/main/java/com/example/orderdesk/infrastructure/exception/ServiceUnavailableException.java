package com.example.orderdesk.infrastructure.exception;

/**
 * Final failure after retries are exhausted or while the circuit breaker is open.
 */
public class ServiceUnavailableException extends DownstreamServiceException {

    public ServiceUnavailableException(String serviceName, String message) {
        super(serviceName, 0, message, null);
    }

    public ServiceUnavailableException(String serviceName, String message, Throwable cause) {
        super(serviceName, 0, message, cause);
    }
}
