package com.example.orderdesk.infrastructure.exception;

/**
 * The service rejected the request itself (4xx). Retrying would get the same answer.
 */
public class NonRetryableServiceException extends DownstreamServiceException {

    public NonRetryableServiceException(String serviceName, int statusCode, String message) {
        super(serviceName, statusCode, message, null);
    }
}
