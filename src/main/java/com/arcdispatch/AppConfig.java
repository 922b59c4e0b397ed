package com.arcdispatch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration handling platform-specific paths and settings.
 */
public class AppConfig {

    public static final String APP_NAME = "ARC-Dispatch";
    private static final int DEFAULT_PORT = 7070;
    private static final long DEFAULT_RETENTION_MINUTES = 5;

    private final Path dataPath;
    private final Path puzzlesPath;
    private final Path providersFile;
    private final Path logPath;
    private final int port;
    private final long retentionMinutes;
    private final boolean devMode;

    private AppConfig(Builder builder, Path dataPath, Path logPath) {
        this.dataPath = dataPath;
        this.puzzlesPath = builder.puzzlesPath != null ? builder.puzzlesPath : dataPath.resolve("puzzles");
        this.providersFile = builder.providersFile;
        this.logPath = logPath;
        this.port = builder.port;
        this.retentionMinutes = builder.retentionMinutes;
        this.devMode = builder.devMode;
    }

    public Path getDataPath() {
        return dataPath;
    }

    public Path getPuzzlesPath() {
        return puzzlesPath;
    }

    /**
     * Provider endpoint file given on the command line, or null to use the bundled defaults.
     */
    public Path getProvidersFile() {
        return providersFile;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public long getRetentionMinutes() {
        return retentionMinutes;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Default data directory.
     * Windows: %USERPROFILE%\Documents\ARC-Dispatch\data
     * macOS: ~/Documents/ARC-Dispatch/data
     * Linux: ~/ARC-Dispatch/data
     */
    public static Path getDefaultDataPath() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String documents = System.getenv("USERPROFILE");
            if (documents == null) {
                documents = userHome;
            }
            return Paths.get(documents, "Documents", APP_NAME, "data");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Documents", APP_NAME, "data");
        } else {
            return Paths.get(userHome, APP_NAME, "data");
        }
    }

    /**
     * Log directory per platform.
     * Windows: %APPDATA%\ARC-Dispatch\logs
     * macOS: ~/Library/Logs/ARC-Dispatch
     * Linux: ~/.local/share/ARC-Dispatch/logs
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

    public static Path ensureLogDirectory() throws IOException {
        Path logDir = getLogDirectory();
        Files.createDirectories(logDir);
        return logDir.resolve("arc-dispatch.log");
    }

    public static class Builder {
        private Path dataPath = null;
        private Path puzzlesPath = null;
        private Path providersFile = null;
        private int port = DEFAULT_PORT;
        private long retentionMinutes = DEFAULT_RETENTION_MINUTES;
        private boolean devMode = false;

        public Builder dataPath(String path) {
            this.dataPath = toPath(path);
            return this;
        }

        public Builder puzzlesPath(String path) {
            this.puzzlesPath = toPath(path);
            return this;
        }

        public Builder providersFile(String path) {
            this.providersFile = toPath(path);
            return this;
        }

        public Builder port(int port) {
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder retentionMinutes(long minutes) {
            if (minutes <= 0) {
                throw new IllegalArgumentException("Retention must be positive: " + minutes);
            }
            this.retentionMinutes = minutes;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        /**
         * Accepts {@code --name=value} and {@code --name value}. Unknown arguments are ignored.
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if ("--dev".equals(arg)) {
                    this.devMode = true;
                    continue;
                }
                String name;
                String value;
                int eq = arg.indexOf('=');
                if (arg.startsWith("--") && eq > 0) {
                    name = arg.substring(0, eq);
                    value = arg.substring(eq + 1);
                } else if (arg.startsWith("--") && i + 1 < args.length) {
                    name = arg;
                    value = args[++i];
                } else {
                    continue;
                }
                apply(name, value);
            }
            return this;
        }

        private void apply(String name, String value) {
            switch (name) {
                case "--port":
                    port(parseNumber(name, value));
                    break;
                case "--data":
                    dataPath(value);
                    break;
                case "--puzzles":
                    puzzlesPath(value);
                    break;
                case "--providers":
                    providersFile(value);
                    break;
                case "--retention-minutes":
                    retentionMinutes(parseNumber(name, value));
                    break;
                default:
                    break;
            }
        }

        public AppConfig build() throws IOException {
            Path data = dataPath != null ? dataPath : getDefaultDataPath();
            Files.createDirectories(data);
            return new AppConfig(this, data, ensureLogDirectory());
        }

        private static Path toPath(String path) {
            if (path == null || path.isEmpty()) {
                return null;
            }
            return Paths.get(path).toAbsolutePath().normalize();
        }

        private static int parseNumber(String name, String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + name + ": " + value, e);
            }
        }
    }
}
