package com.equitiesai;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration handling platform-specific paths and settings.
 */
public class AppConfig {

    private static final String APP_NAME = "EquitiesAI";

    private final Path dataPath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;
    private final String provider;
    private final String model;

    private AppConfig(Path dataPath, Path logPath, int port, boolean devMode, String provider, String model) {
        this.dataPath = dataPath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
        this.provider = provider;
        this.model = model;
    }

    /** Directory holding the credentials file. */
    public Path getDataPath() {
        return dataPath;
    }

    public Path getCredentialsPath() {
        return dataPath.resolve("ai-keys.json");
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /** Provider selected at startup, or null for the built-in default. */
    public String getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    /**
     * Get the default data directory based on the operating system.
     * Windows: %APPDATA%\EquitiesAI
     * macOS: ~/Library/Application Support/EquitiesAI
     * Linux: ~/.config/EquitiesAI
     */
    public static Path getDefaultDataPath() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME);
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Application Support", APP_NAME);
        } else {
            return Paths.get(userHome, ".config", APP_NAME);
        }
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\EquitiesAI\logs
     * macOS: ~/Library/Logs/EquitiesAI
     * Linux: ~/.local/share/EquitiesAI/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("ai-gateway.log");
    }

    /**
     * Ensure the log directory exists and return the log file path.
     */
    public static Path ensureLogDirectory() throws IOException {
        Path logDir = getLogDirectory();
        Files.createDirectories(logDir);
        return getLogFilePath();
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path dataPath = null;
        private int port = 8000;
        private boolean devMode = false;
        private String provider = null;
        private String model = null;

        public Builder dataPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.dataPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = blankToNull(provider);
            return this;
        }

        public Builder model(String model) {
            this.model = blankToNull(model);
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--data-dir=")) {
                    dataPath(arg.substring("--data-dir=".length()));
                } else if ("--data-dir".equals(arg) && i + 1 < args.length) {
                    dataPath(args[++i]);
                }

                else if (arg.startsWith("--port=")) {
                    parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    parsePort(args[++i]);
                }

                else if (arg.startsWith("--provider=")) {
                    provider(arg.substring("--provider=".length()));
                } else if ("--provider".equals(arg) && i + 1 < args.length) {
                    provider(args[++i]);
                }

                else if (arg.startsWith("--model=")) {
                    model(arg.substring("--model=".length()));
                } else if ("--model".equals(arg) && i + 1 < args.length) {
                    model(args[++i]);
                }

                else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        private void parsePort(String value) {
            try {
                this.port = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                AppLogger.get().warn("Ignoring invalid port: " + value);
            }
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value.trim();
        }

        /**
         * Build without touching the file system.
         */
        public AppConfig buildDetached() {
            Path data = dataPath != null ? dataPath : getDefaultDataPath();
            return new AppConfig(data, getLogFilePath(), port, devMode, provider, model);
        }

        public AppConfig build() throws IOException {
            Path data = dataPath != null ? dataPath : getDefaultDataPath();
            Files.createDirectories(data);
            Path logPath = ensureLogDirectory();
            return new AppConfig(data, logPath, port, devMode, provider, model);
        }
    }
}
