package com.ehrgateway.exception;

public class MissingBearerTokenException extends RuntimeException {

    public MissingBearerTokenException() {
        super("Authorization header with Bearer token required");
    }
}
