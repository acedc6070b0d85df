package com.ehrgateway.exception;

/**
 * Invalid OAuth request detected locally, before anything is sent upstream.
 */
public class OAuthRequestException extends RuntimeException {

    public OAuthRequestException(String message) {
        super(message);
    }
}
