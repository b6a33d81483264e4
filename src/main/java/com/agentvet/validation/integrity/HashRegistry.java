package com.agentvet.validation.integrity;

import java.util.Optional;

/**
 * Path-keyed store of last-known content hashes. The only state that
 * outlives a validation call. Implementations must serialize concurrent
 * upserts so no update is lost.
 */
public interface HashRegistry {

    /** Normalizes a component path into the key used for lookups and upserts. */
    String keyFor(String componentPath);

    Optional<HashRegistryEntry> find(String key);

    void upsert(String key, HashRegistryEntry entry);

    int size();
}
