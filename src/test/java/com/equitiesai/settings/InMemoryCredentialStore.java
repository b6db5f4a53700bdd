package com.equitiesai.settings;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Credential store that keeps every saved snapshot in memory.
 */
public class InMemoryCredentialStore implements CredentialStore {
    private final Map<String, String> initial;
    private final List<Map<String, String>> saves = new ArrayList<>();
    private boolean failOnSave;

    public InMemoryCredentialStore() {
        this(Map.of());
    }

    public InMemoryCredentialStore(Map<String, String> initial) {
        this.initial = new LinkedHashMap<>(initial);
    }

    @Override
    public Map<String, String> load() {
        return new LinkedHashMap<>(initial);
    }

    @Override
    public void save(Map<String, String> credentials) throws IOException {
        if (failOnSave) {
            throw new IOException("disk full");
        }
        saves.add(new LinkedHashMap<>(credentials));
    }

    public List<Map<String, String>> getSaves() {
        return saves;
    }

    public Map<String, String> lastSaved() {
        return saves.isEmpty() ? null : saves.get(saves.size() - 1);
    }

    public void setFailOnSave(boolean failOnSave) {
        this.failOnSave = failOnSave;
    }
}
