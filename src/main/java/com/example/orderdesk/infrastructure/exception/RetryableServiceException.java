package com.example.orderdesk.infrastructure.exception;

/**
 * 5xx or transport failure. Listed in the retry instances' retry-exceptions.
 */
public class RetryableServiceException extends DownstreamServiceException {

    public RetryableServiceException(String serviceName, int statusCode, String message) {
        super(serviceName, statusCode, message, null);
    }
}
