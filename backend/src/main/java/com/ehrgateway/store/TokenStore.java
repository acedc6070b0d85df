package com.ehrgateway.store;

import java.util.Optional;

/**
 * Process-local memory of OAuth state values and issued tokens.
 */
public interface TokenStore {

    void put(String key, StoredToken entry);

    Optional<StoredToken> get(String key);

    boolean contains(String key);

    int size();
}
