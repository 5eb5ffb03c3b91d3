package com.orion.para;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Store configuration: where the PARA namespace lives and where logs go.
 */
public class AppConfig {

    private static final String APP_NAME = "Orion";

    public static final String DEFAULT_ROOT_NAME = "Orion";
    public static final String DEFAULT_SCHEME = "para";

    private final Path baseDirectory;
    private final String rootName;
    private final String scheme;
    private final Path logPath;
    private final boolean consoleLog;

    private AppConfig(Path baseDirectory, String rootName, String scheme, Path logPath, boolean consoleLog) {
        this.baseDirectory = baseDirectory;
        this.rootName = rootName;
        this.scheme = scheme;
        this.logPath = logPath;
        this.consoleLog = consoleLog;
    }

    /**
     * Directory the namespace root is resolved against (the user's home by default).
     */
    public Path getBaseDirectory() {
        return baseDirectory;
    }

    public String getRootName() {
        return rootName;
    }

    public String getScheme() {
        return scheme;
    }

    public Path getLogPath() {
        return logPath;
    }

    public boolean isConsoleLog() {
        return consoleLog;
    }

    /**
     * Absolute path of the namespace root, e.g. ~/Orion.
     */
    public Path getRootPath() {
        return baseDirectory.resolve(rootName);
    }

    public static Path getDefaultBaseDirectory() {
        return Paths.get(System.getProperty("user.home")).toAbsolutePath().normalize();
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\Orion\logs
     * macOS: ~/Library/Logs/Orion
     * Linux: ~/.local/share/Orion/logs
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
        return getLogDirectory().resolve("orion-para.log");
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path baseDirectory = null;
        private String rootName = DEFAULT_ROOT_NAME;
        private String scheme = DEFAULT_SCHEME;
        private Path logPath = null;
        private boolean consoleLog = false;

        public Builder baseDirectory(String path) {
            if (path != null && !path.isEmpty()) {
                this.baseDirectory = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder baseDirectory(Path path) {
            if (path != null) {
                this.baseDirectory = path.toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder rootName(String rootName) {
            if (rootName != null && !rootName.isBlank() && !rootName.contains("/")) {
                this.rootName = rootName.trim();
            }
            return this;
        }

        public Builder scheme(String scheme) {
            if (scheme != null && scheme.matches("[A-Za-z][A-Za-z0-9+.-]*")) {
                this.scheme = scheme.toLowerCase();
            }
            return this;
        }

        public Builder logPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.logPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder consoleLog(boolean consoleLog) {
            this.consoleLog = consoleLog;
            return this;
        }

        public Builder parseArgs(String[] args) {
            if (args == null) {
                return this;
            }
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                // Handle --base-dir=value or --base-dir value
                if (arg.startsWith("--base-dir=")) {
                    baseDirectory(arg.substring("--base-dir=".length()));
                } else if ("--base-dir".equals(arg) && i + 1 < args.length) {
                    baseDirectory(args[++i]);
                }

                else if (arg.startsWith("--root=")) {
                    rootName(arg.substring("--root=".length()));
                } else if ("--root".equals(arg) && i + 1 < args.length) {
                    rootName(args[++i]);
                }

                else if (arg.startsWith("--scheme=")) {
                    scheme(arg.substring("--scheme=".length()));
                } else if ("--scheme".equals(arg) && i + 1 < args.length) {
                    scheme(args[++i]);
                }

                else if (arg.startsWith("--log=")) {
                    logPath(arg.substring("--log=".length()));
                } else if ("--log".equals(arg) && i + 1 < args.length) {
                    logPath(args[++i]);
                }

                else if ("--verbose".equals(arg)) {
                    this.consoleLog = true;
                }
            }
            return this;
        }

        public AppConfig build() {
            Path base = baseDirectory != null ? baseDirectory : getDefaultBaseDirectory();
            Path log = logPath != null ? logPath : getLogFilePath();
            return new AppConfig(base, rootName, scheme, log, consoleLog);
        }
    }
}
