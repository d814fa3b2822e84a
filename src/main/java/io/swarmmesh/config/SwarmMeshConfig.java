package io.swarmmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class SwarmMeshConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE_NAME = "swarmmesh-settings.json";

    public static final long DEFAULT_MESSAGE_TICK_MS = 100L;
    public static final int DEFAULT_MESSAGE_BATCH_PER_PRIORITY = 10;
    public static final int DEFAULT_MAX_MESSAGE_HISTORY = 10_000;
    public static final long DEFAULT_MESSAGE_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_COMPRESSION_THRESHOLD_BYTES = 1_024;
    public static final int DEFAULT_COMPRESSION_LEVEL = 6;
    public static final int DEFAULT_MAX_HOPS = 10;
    public static final double DEFAULT_RELIABILITY = 0.95;
    public static final long DEFAULT_GOSSIP_INTERVAL_MS = 5_000L;
    public static final int DEFAULT_GOSSIP_FANOUT = 3;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 10_000L;
    public static final long DEFAULT_CONSENSUS_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_DISTRIBUTION_TICK_MS = 1_000L;
    public static final int DEFAULT_MAX_CONCURRENT_TASKS = 100;
    public static final double DEFAULT_MIN_TRUST_SCORE = 0.5;
    public static final double DEFAULT_IMBALANCE_DEVIATION = 0.3;
    public static final double DEFAULT_REBALANCE_SEVERITY = 0.3;
    public static final double DEFAULT_STUCK_TASK_MULTIPLIER = 2.0;
    public static final long DEFAULT_NO_PROGRESS_ESCALATION_MS = 15L * 60L * 1000L;

    private final Path rootDir;

    public SwarmMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static SwarmMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new SwarmMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path journalDir() {
        return rootDir.resolve("journal");
    }

    public Path journalFile() {
        return journalDir().resolve("events.log");
    }

    public Path securityDir() {
        return rootDir.resolve("security");
    }

    public Path payloadKeyFile() {
        return securityDir().resolve("payload-keys.json");
    }
}
