package com.equitiesai.settings;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileCredentialStoreTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void missingFileLoadsEmpty() throws Exception {
        JsonFileCredentialStore store = new JsonFileCredentialStore(tempDir.resolve("keys.json"), mapper);
        assertTrue(store.load().isEmpty());
    }

    @Test
    void saveThenLoadRestoresKeys() throws Exception {
        Path file = tempDir.resolve("nested").resolve("keys.json");
        JsonFileCredentialStore store = new JsonFileCredentialStore(file, mapper);
        Map<String, String> keys = new LinkedHashMap<>();
        keys.put("google", "g-key");
        keys.put("anthropic", "a-key");

        store.save(keys);

        assertTrue(Files.exists(file));
        JsonNode onDisk = mapper.readTree(file.toFile());
        assertEquals(1, onDisk.path("version").asInt());
        assertEquals("g-key", onDisk.path("providers").path("google").asText());
        assertEquals(keys, new JsonFileCredentialStore(file, mapper).load());
    }

    @Test
    void credentialSetWritesThroughToFile() throws Exception {
        Path file = tempDir.resolve("keys.json");
        CredentialSet set = new CredentialSet(new JsonFileCredentialStore(file, mapper));
        set.set("mistral", "m-key");

        CredentialSet reloaded = new CredentialSet(new JsonFileCredentialStore(file, mapper));
        assertEquals("m-key", reloaded.get("mistral"));
    }

    @Test
    void corruptFileIsKeptAsideAndNotQuoted() throws Exception {
        Path file = tempDir.resolve("keys.json");
        String original = "{\"version\":1,\"providers\":{\"openai\":\"sk-live-secret\"";
        Files.writeString(file, original);
        JsonFileCredentialStore store = new JsonFileCredentialStore(file, mapper);

        IOException error = assertThrows(IOException.class, store::load);

        assertFalse(error.getMessage().contains("sk-live-secret"));
        assertFalse(Files.exists(file));
        Path backup = corruptBackup();
        assertEquals(original, Files.readString(backup));

        CredentialSet set = new CredentialSet(store);
        assertTrue(set.providers().isEmpty());
        set.set("google", "g-key");
        assertEquals(original, Files.readString(backup));
        assertEquals(Map.of("google", "g-key"), store.load());
    }

    private Path corruptBackup() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            List<Path> backups = files
                .filter(p -> p.getFileName().toString().startsWith("keys.json.corrupt-"))
                .collect(Collectors.toList());
            assertEquals(1, backups.size());
            return backups.get(0);
        }
    }
}
