package com.ehrgateway.security;

import java.util.Optional;

import com.ehrgateway.exception.MissingBearerTokenException;

/**
 * Reads the caller's bearer token from the Authorization header. The token is
 * opaque to the gateway and only forwarded to OpenEMR.
 */
public final class BearerTokens {

    // case-sensitive, as OpenEMR clients send it
    public static final String PREFIX = "Bearer ";

    private BearerTokens() {
    }

    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(PREFIX.length());
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    public static String require(String authorizationHeader) {
        return extract(authorizationHeader).orElseThrow(MissingBearerTokenException::new);
    }
}
