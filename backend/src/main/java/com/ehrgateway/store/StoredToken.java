package com.ehrgateway.store;

import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.Builder;
import lombok.Value;

/**
 * Entry of the token store: either a marker for an OAuth state value the
 * gateway generated, or a token record issued through the callback.
 */
@Value
@Builder
public class StoredToken {

    public enum Kind {
        OAUTH_STATE,
        ACCESS_TOKEN
    }

    Kind kind;
    JsonNode tokenData;
    Instant expiresAt;

    public static StoredToken oauthState() {
        return StoredToken.builder().kind(Kind.OAUTH_STATE).build();
    }

    public static StoredToken issued(JsonNode tokenData, Instant expiresAt) {
        return StoredToken.builder()
                .kind(Kind.ACCESS_TOKEN)
                .tokenData(tokenData)
                .expiresAt(expiresAt)
                .build();
    }
}
