package com.ehrgateway.dto;

import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/**
 * Collects upstream query parameters, dropping absent and empty values.
 */
public final class QueryParams {

    private final MultiValueMap<String, String> params = new LinkedMultiValueMap<>();

    private QueryParams() {
    }

    public static QueryParams create() {
        return new QueryParams();
    }

    public QueryParams add(String wireName, Object value) {
        if (value != null) {
            String text = value.toString();
            if (!text.isEmpty()) {
                params.add(wireName, text);
            }
        }
        return this;
    }

    public MultiValueMap<String, String> build() {
        return params;
    }
}
