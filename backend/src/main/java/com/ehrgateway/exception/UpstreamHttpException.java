package com.ehrgateway.exception;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * OpenEMR answered with a non-2xx status. The status and the parsed body
 * are relayed to the caller unchanged.
 */
public class UpstreamHttpException extends RuntimeException {

    private final int statusCode;
    private final transient JsonNode body;

    public UpstreamHttpException(int statusCode, JsonNode body) {
        super("OpenEMR responded with HTTP " + statusCode);
        this.statusCode = statusCode;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public JsonNode getBody() {
        return body;
    }
}
