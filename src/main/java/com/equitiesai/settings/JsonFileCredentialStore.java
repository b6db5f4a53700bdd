package com.equitiesai.settings;

import com.equitiesai.AppLogger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handles plaintext credential file storage.
 */
public class JsonFileCredentialStore implements CredentialStore {
    private final Path keysPath;
    private final ObjectMapper mapper;

    public JsonFileCredentialStore(Path keysPath, ObjectMapper mapper) {
        this.keysPath = keysPath;
        this.mapper = mapper;
    }

    public Path getPath() {
        return keysPath;
    }

    @Override
    public Map<String, String> load() throws IOException {
        if (!Files.exists(keysPath)) {
            return new LinkedHashMap<>();
        }
        CredentialsFile file;
        try {
            file = mapper.readValue(keysPath.toFile(), CredentialsFile.class);
        } catch (JsonProcessingException e) {
            // Parser messages can quote file content, so only the backup name is reported.
            Path backup = moveAside();
            throw new IOException("Unreadable credentials file moved to " + backup.getFileName(), e);
        }
        if (file == null || file.getProviders() == null) {
            return new LinkedHashMap<>();
        }
        return new LinkedHashMap<>(file.getProviders());
    }

    private Path moveAside() throws IOException {
        Path backup = keysPath.resolveSibling(keysPath.getFileName() + ".corrupt-" + System.currentTimeMillis());
        Files.move(keysPath, backup, StandardCopyOption.REPLACE_EXISTING);
        AppLogger.get().error("Credentials file could not be parsed; kept as " + backup);
        return backup;
    }

    @Override
    public void save(Map<String, String> credentials) throws IOException {
        CredentialsFile file = new CredentialsFile();
        file.setProviders(new LinkedHashMap<>(credentials));
        Path parent = keysPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = keysPath.resolveSibling(keysPath.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), file);
        Files.move(temp, keysPath, StandardCopyOption.REPLACE_EXISTING);
        AppLogger.get().info("Saved credentials for " + credentials.size() + " provider(s)");
    }
}
