package com.agentrelay;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Relay configuration: listening address, restart behaviour and task timing bounds.
 */
public class AppConfig {

    private static final String APP_NAME = "Agent-Relay";

    public static final int DEFAULT_PORT = 8765;
    public static final String DEFAULT_HOST = "localhost";

    private final String host;
    private final int port;
    private final boolean restartMode;
    private final boolean devMode;
    private final Path logPath;
    private final Duration interventionTimeout;
    private final int bindAttempts;
    private final Duration bindBackoff;
    private final Duration reclaimGracePeriod;
    private final Duration socketIdleTimeout;
    private final int agentMaxFailures;
    private final boolean killFallbackToAll;

    private AppConfig(Builder builder, Path logPath) {
        this.host = builder.host;
        this.port = builder.port;
        this.restartMode = builder.restartMode;
        this.devMode = builder.devMode;
        this.logPath = logPath;
        this.interventionTimeout = builder.interventionTimeout;
        this.bindAttempts = builder.bindAttempts;
        this.bindBackoff = builder.bindBackoff;
        this.reclaimGracePeriod = builder.reclaimGracePeriod;
        this.socketIdleTimeout = builder.socketIdleTimeout;
        this.agentMaxFailures = builder.agentMaxFailures;
        this.killFallbackToAll = builder.killFallbackToAll;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public boolean isRestartMode() {
        return restartMode;
    }

    public boolean isDevMode() {
        return devMode;
    }

    public Path getLogPath() {
        return logPath;
    }

    public Duration getInterventionTimeout() {
        return interventionTimeout;
    }

    public int getBindAttempts() {
        return bindAttempts;
    }

    public Duration getBindBackoff() {
        return bindBackoff;
    }

    public Duration getReclaimGracePeriod() {
        return reclaimGracePeriod;
    }

    public Duration getSocketIdleTimeout() {
        return socketIdleTimeout;
    }

    /**
     * Failure count written into a stopping agent's state so its own retry loop gives up.
     */
    public int getAgentMaxFailures() {
        return agentMaxFailures;
    }

    /**
     * Whether a kill for a task key with no live task cancels every live task instead.
     */
    public boolean isKillFallbackToAll() {
        return killFallbackToAll;
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\Agent-Relay\logs
     * macOS: ~/Library/Logs/Agent-Relay
     * Linux: ~/.local/share/Agent-Relay/logs
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
        return getLogDirectory().resolve("agent-relay.log");
    }

    /**
     * Ensure the log directory exists and return the log file path.
     */
    public static Path ensureLogDirectory() throws IOException {
        Files.createDirectories(getLogDirectory());
        return getLogFilePath();
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private boolean restartMode = false;
        private boolean devMode = false;
        private Path logPath = null;
        // Operators may take hours to answer; roughly eight by default
        private Duration interventionTimeout = Duration.ofSeconds(30000);
        private int bindAttempts = 5;
        private Duration bindBackoff = Duration.ofMillis(500);
        private Duration reclaimGracePeriod = Duration.ofSeconds(1);
        private Duration socketIdleTimeout = Duration.ofHours(1);
        private int agentMaxFailures = 3;
        private boolean killFallbackToAll = true;

        public Builder host(String host) {
            if (host != null && !host.isBlank()) {
                this.host = host;
            }
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder restartMode(boolean restartMode) {
            this.restartMode = restartMode;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder logPath(Path logPath) {
            this.logPath = logPath;
            return this;
        }

        public Builder interventionTimeout(Duration timeout) {
            if (timeout != null && !timeout.isNegative() && !timeout.isZero()) {
                this.interventionTimeout = timeout;
            }
            return this;
        }

        public Builder bindAttempts(int attempts) {
            if (attempts > 0) {
                this.bindAttempts = attempts;
            }
            return this;
        }

        public Builder bindBackoff(Duration backoff) {
            if (backoff != null && !backoff.isNegative()) {
                this.bindBackoff = backoff;
            }
            return this;
        }

        public Builder reclaimGracePeriod(Duration grace) {
            if (grace != null && !grace.isNegative()) {
                this.reclaimGracePeriod = grace;
            }
            return this;
        }

        public Builder socketIdleTimeout(Duration idle) {
            if (idle != null && !idle.isNegative() && !idle.isZero()) {
                this.socketIdleTimeout = idle;
            }
            return this;
        }

        public Builder agentMaxFailures(int maxFailures) {
            if (maxFailures > 0) {
                this.agentMaxFailures = maxFailures;
            }
            return this;
        }

        public Builder killFallbackToAll(boolean fallback) {
            this.killFallbackToAll = fallback;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--host=")) {
                    host(arg.substring("--host=".length()));
                } else if ("--host".equals(arg) && i + 1 < args.length) {
                    host(args[++i]);
                }

                else if (arg.startsWith("--port=")) {
                    this.port = parseInt(arg.substring("--port=".length()), port);
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    this.port = parseInt(args[++i], port);
                }

                else if (arg.startsWith("--intervention-timeout=")) {
                    interventionTimeout(Duration.ofSeconds(
                        parseInt(arg.substring("--intervention-timeout=".length()), -1)));
                } else if ("--intervention-timeout".equals(arg) && i + 1 < args.length) {
                    interventionTimeout(Duration.ofSeconds(parseInt(args[++i], -1)));
                }

                else if (arg.startsWith("--bind-attempts=")) {
                    bindAttempts(parseInt(arg.substring("--bind-attempts=".length()), -1));
                } else if ("--bind-attempts".equals(arg) && i + 1 < args.length) {
                    bindAttempts(parseInt(args[++i], -1));
                }

                else if (arg.startsWith("--bind-backoff-ms=")) {
                    bindBackoff(Duration.ofMillis(parseInt(arg.substring("--bind-backoff-ms=".length()), -1)));
                } else if ("--bind-backoff-ms".equals(arg) && i + 1 < args.length) {
                    bindBackoff(Duration.ofMillis(parseInt(args[++i], -1)));
                }

                else if ("--restart".equals(arg)) {
                    this.restartMode = true;
                } else if ("--no-kill-fallback".equals(arg)) {
                    this.killFallbackToAll = false;
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        public AppConfig build() throws IOException {
            Path resolvedLog = logPath != null ? logPath : ensureLogDirectory();
            return new AppConfig(this, resolvedLog);
        }

        private static int parseInt(String value, int fallback) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
    }
}
