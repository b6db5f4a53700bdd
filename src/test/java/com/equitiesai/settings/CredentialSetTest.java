package com.equitiesai.settings;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CredentialSetTest {

    @Test
    void loadsStoredKeysOnConstruction() {
        CredentialSet set = new CredentialSet(new InMemoryCredentialStore(Map.of("openai", "sk-one")));
        assertEquals("sk-one", set.get("openai"));
        assertTrue(set.has("openai"));
        assertFalse(set.has("anthropic"));
    }

    @Test
    void persistsAfterEveryMutation() {
        InMemoryCredentialStore store = new InMemoryCredentialStore();
        CredentialSet set = new CredentialSet(store);

        set.set("openai", "sk-one");
        set.set("anthropic", " sk-ant ");
        set.remove("openai");

        assertEquals(3, store.getSaves().size());
        assertEquals(Map.of("openai", "sk-one"), store.getSaves().get(0));
        assertEquals(Map.of("anthropic", "sk-ant"), store.lastSaved());
    }

    @Test
    void blankKeyRemovesProvider() {
        InMemoryCredentialStore store = new InMemoryCredentialStore(Map.of("xai", "xai-key"));
        CredentialSet set = new CredentialSet(store);
        set.set("xai", "  ");
        assertNull(set.get("xai"));
        assertEquals(Map.of(), store.lastSaved());
    }

    @Test
    void toStringNeverShowsSecrets() {
        CredentialSet set = new CredentialSet(new InMemoryCredentialStore(Map.of("openai", "sk-very-secret")));
        assertFalse(set.toString().contains("sk-very-secret"));
        assertTrue(set.toString().contains("openai"));
    }

    @Test
    void saveFailureSurfaces() {
        InMemoryCredentialStore store = new InMemoryCredentialStore();
        store.setFailOnSave(true);
        CredentialSet set = new CredentialSet(store);
        assertThrows(UncheckedIOException.class, () -> set.set("openai", "sk-one"));
        assertFalse(set.has("openai"));
        assertNull(set.get("openai"));
        assertTrue(set.providers().isEmpty());
    }

    @Test
    void failedSaveKeepsPreviousKeys() {
        InMemoryCredentialStore store = new InMemoryCredentialStore(Map.of("openai", "sk-old", "xai", "xai-key"));
        CredentialSet set = new CredentialSet(store);
        store.setFailOnSave(true);

        assertThrows(UncheckedIOException.class, () -> set.set("openai", "sk-new"));
        assertThrows(UncheckedIOException.class, () -> set.set("xai", ""));
        assertThrows(UncheckedIOException.class, () -> set.remove("openai"));

        assertEquals("sk-old", set.get("openai"));
        assertEquals("xai-key", set.get("xai"));
        assertTrue(store.getSaves().isEmpty());

        store.setFailOnSave(false);
        set.set("openai", "sk-new");
        assertEquals(Map.of("openai", "sk-new", "xai", "xai-key"), store.lastSaved());
    }

    @Test
    void unreadableStoreStartsEmpty() {
        CredentialStore broken = new CredentialStore() {
            @Override
            public Map<String, String> load() throws IOException {
                throw new IOException("corrupt");
            }

            @Override
            public void save(Map<String, String> credentials) {
            }
        };
        CredentialSet set = new CredentialSet(broken);
        assertTrue(set.providers().isEmpty());
    }
}
