package com.equitiesai.settings;

import java.io.IOException;
import java.util.Map;

/**
 * Persistence for provider credentials (provider id to API key).
 */
public interface CredentialStore {

    /**
     * Load stored credentials. Returns an empty map when nothing is stored yet.
     */
    Map<String, String> load() throws IOException;

    void save(Map<String, String> credentials) throws IOException;
}
