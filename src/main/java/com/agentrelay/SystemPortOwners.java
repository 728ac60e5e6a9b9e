package com.agentrelay;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Finds port owners with the platform's tools ({@code lsof} on macOS and Linux,
 * {@code netstat -ano} on Windows) and terminates them through {@link ProcessHandle},
 * falling back to {@code kill -9} / {@code taskkill /F}.
 */
class SystemPortOwners implements PortReclaimer.PortOwners {

    private final Duration gracePeriod;
    private final boolean windows;
    private final AppLogger logger = AppLogger.get();

    SystemPortOwners(Duration gracePeriod) {
        this.gracePeriod = gracePeriod;
        this.windows = System.getProperty("os.name").toLowerCase().contains("win");
    }

    @Override
    public List<Long> findOwners(int port) throws IOException {
        if (windows) {
            return parseNetstat(run("netstat", "-ano", "-p", "tcp"), port);
        }
        return parsePidLines(run("lsof", "-nP", "-t", "-iTCP:" + port, "-sTCP:LISTEN"));
    }

    @Override
    public boolean terminate(long pid) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            return true;
        }
        ProcessHandle process = handle.get();

        // Polite first, so the old relay can close its sockets
        if (process.destroy() && waitForExit(process, gracePeriod)) {
            return true;
        }
        if (process.destroyForcibly() && waitForExit(process, gracePeriod)) {
            return true;
        }

        try {
            if (windows) {
                run("taskkill", "/F", "/PID", Long.toString(pid));
            } else {
                run("kill", "-9", Long.toString(pid));
            }
        } catch (IOException e) {
            if (logger != null) {
                logger.warn("[PortReclaimer] Forced kill of " + pid + " failed: " + e.getMessage());
            }
        }
        return waitForExit(process, gracePeriod);
    }

    static List<Long> parsePidLines(List<String> lines) {
        Set<Long> pids = new LinkedHashSet<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                pids.add(Long.parseLong(trimmed));
            } catch (NumberFormatException ignored) {
                // lsof warnings share stdout on some systems
            }
        }
        return new ArrayList<>(pids);
    }

    static List<Long> parseNetstat(List<String> lines, int port) {
        Set<Long> pids = new LinkedHashSet<>();
        String suffix = ":" + port;
        for (String line : lines) {
            String[] cols = line.trim().split("\\s+");
            // Proto  Local Address  Foreign Address  State  PID
            if (cols.length < 5 || !"LISTENING".equalsIgnoreCase(cols[3]) || !cols[1].endsWith(suffix)) {
                continue;
            }
            try {
                pids.add(Long.parseLong(cols[4]));
            } catch (NumberFormatException ignored) {
                // header or truncated row
            }
        }
        return new ArrayList<>(pids);
    }

    private static boolean waitForExit(ProcessHandle process, Duration timeout) {
        try {
            process.onExit().get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        } catch (Exception e) {
            return !process.isAlive();
        }
    }

    private static List<String> run(String... command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        Process process = pb.start();
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        }
        try {
            process.waitFor(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while running " + command[0], e);
        }
        return lines;
    }
}
