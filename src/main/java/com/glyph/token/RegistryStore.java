package com.glyph.token;

import com.glyph.exception.RegistryPersistenceException;

/**
 * Backing medium for a {@link TokenRegistry}.
 */
public interface RegistryStore {

    /**
     * Load the persisted registry.
     *
     * @return Stored snapshot, or an empty snapshot if nothing has been stored yet
     * @throws RegistryPersistenceException if the medium exists but cannot be read
     */
    RegistrySnapshot load();

    /**
     * Replace the persisted registry with the given snapshot.
     *
     * @throws RegistryPersistenceException if the medium cannot be written
     */
    void save(RegistrySnapshot snapshot);

    /**
     * Human-readable location, used in log messages.
     */
    String describe();
}
