package com.ehrgateway.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

/**
 * Unbounded in-memory token store.
 *
 * <p>Entries are never evicted, even after {@code expiresAt} has passed, and
 * are lost on restart. Not suitable for more than one gateway instance;
 * replace with a shared cache behind {@link TokenStore} for that.</p>
 *
 * <p>Callers do check-then-put without coordination, so concurrent writes to
 * the same key may overwrite each other.</p>
 */
@Component
public class InMemoryTokenStore implements TokenStore {

    private final Map<String, StoredToken> entries = new ConcurrentHashMap<>();

    @Override
    public void put(String key, StoredToken entry) {
        entries.put(key, entry);
    }

    @Override
    public Optional<StoredToken> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    @Override
    public int size() {
        return entries.size();
    }
}
