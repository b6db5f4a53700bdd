package com.equitiesai.settings;

import com.equitiesai.AppLogger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Provider credentials owned by one gateway. Loaded from the store on construction and
 * written back after every change. Secrets never appear in {@link #toString()}.
 */
public class CredentialSet {
    private final CredentialStore store;
    private final Map<String, String> keys;

    public CredentialSet(CredentialStore store) {
        this.store = store;
        this.keys = new LinkedHashMap<>(loadFrom(store));
    }

    private static Map<String, String> loadFrom(CredentialStore store) {
        try {
            return store.load();
        } catch (IOException e) {
            AppLogger.get().error("Could not load stored credentials, starting empty: " + e.getMessage());
            return Collections.emptyMap();
        }
    }

    public synchronized String get(String providerId) {
        return keys.get(providerId);
    }

    public synchronized boolean has(String providerId) {
        String key = keys.get(providerId);
        return key != null && !key.isBlank();
    }

    /**
     * Set or replace a provider's key and persist. A blank key removes it.
     *
     * @throws UncheckedIOException if the store cannot be written; the previous value is
     *                              restored first
     */
    public synchronized void set(String providerId, String apiKey) {
        if (providerId == null || providerId.isBlank()) {
            throw new IllegalArgumentException("Provider is required.");
        }
        String previous = apiKey == null || apiKey.isBlank()
            ? keys.remove(providerId)
            : keys.put(providerId, apiKey.trim());
        try {
            persist();
        } catch (UncheckedIOException e) {
            restore(providerId, previous);
            throw e;
        }
    }

    public synchronized void remove(String providerId) {
        String previous = keys.remove(providerId);
        if (previous == null) {
            return;
        }
        try {
            persist();
        } catch (UncheckedIOException e) {
            restore(providerId, previous);
            throw e;
        }
    }

    public synchronized Set<String> providers() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(keys.keySet()));
    }

    private void persist() {
        try {
            store.save(new LinkedHashMap<>(keys));
        } catch (IOException e) {
            AppLogger.get().error("Could not save credentials: " + e.getMessage());
            throw new UncheckedIOException("Could not save credentials", e);
        }
    }

    private void restore(String providerId, String previous) {
        if (previous == null) {
            keys.remove(providerId);
        } else {
            keys.put(providerId, previous);
        }
    }

    @Override
    public synchronized String toString() {
        return "CredentialSet" + keys.keySet();
    }
}
