package com.ehrgateway.exception;

/**
 * The upstream call never produced a usable response: timeout, connection
 * failure or an undecodable body.
 */
public class UpstreamTransportException extends RuntimeException {

    public UpstreamTransportException(String message) {
        super(message);
    }

    public UpstreamTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
