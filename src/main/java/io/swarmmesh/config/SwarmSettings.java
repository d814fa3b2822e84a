package io.swarmmesh.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swarmmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

public record SwarmSettings(
        long messageTickMs,
        int messageBatchPerPriority,
        int maxMessageHistory,
        long messageTimeoutMs,
        int compressionThresholdBytes,
        int compressionLevel,
        boolean encryptionEnabled,
        int maxHops,
        double defaultReliability,
        long gossipIntervalMs,
        int gossipFanout,
        long heartbeatIntervalMs,
        long consensusTimeoutMs,
        String consensusPolicy,
        long distributionTickMs,
        int maxConcurrentTasks,
        double minTrustScore,
        double imbalanceDeviation,
        double rebalanceSeverityThreshold,
        boolean enableDynamicRebalancing,
        String rebalanceStrategy,
        double stuckTaskMultiplier,
        long noProgressEscalationMs,
        String journalSigningSecret
) {
    public static final Set<String> REBALANCE_STRATEGIES = Set.of("log", "reassign");

    public static SwarmSettings defaults() {
        return new SwarmSettings(
                SwarmMeshConfig.DEFAULT_MESSAGE_TICK_MS,
                SwarmMeshConfig.DEFAULT_MESSAGE_BATCH_PER_PRIORITY,
                SwarmMeshConfig.DEFAULT_MAX_MESSAGE_HISTORY,
                SwarmMeshConfig.DEFAULT_MESSAGE_TIMEOUT_MS,
                SwarmMeshConfig.DEFAULT_COMPRESSION_THRESHOLD_BYTES,
                SwarmMeshConfig.DEFAULT_COMPRESSION_LEVEL,
                false,
                SwarmMeshConfig.DEFAULT_MAX_HOPS,
                SwarmMeshConfig.DEFAULT_RELIABILITY,
                SwarmMeshConfig.DEFAULT_GOSSIP_INTERVAL_MS,
                SwarmMeshConfig.DEFAULT_GOSSIP_FANOUT,
                SwarmMeshConfig.DEFAULT_HEARTBEAT_INTERVAL_MS,
                SwarmMeshConfig.DEFAULT_CONSENSUS_TIMEOUT_MS,
                "accept",
                SwarmMeshConfig.DEFAULT_DISTRIBUTION_TICK_MS,
                SwarmMeshConfig.DEFAULT_MAX_CONCURRENT_TASKS,
                SwarmMeshConfig.DEFAULT_MIN_TRUST_SCORE,
                SwarmMeshConfig.DEFAULT_IMBALANCE_DEVIATION,
                SwarmMeshConfig.DEFAULT_REBALANCE_SEVERITY,
                true,
                "log",
                SwarmMeshConfig.DEFAULT_STUCK_TASK_MULTIPLIER,
                SwarmMeshConfig.DEFAULT_NO_PROGRESS_ESCALATION_MS,
                ""
        );
    }

    public static SwarmSettings load(SwarmMeshConfig config) {
        return load(config.settingsFile());
    }

    public static SwarmSettings load(Path file) {
        SwarmSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SwarmSettingsFile raw = Jsons.mapper().readValue(file.toFile(), SwarmSettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load swarm settings: " + file, e);
        }
    }

    public static SwarmSettings fromFile(SwarmSettingsFile file, SwarmSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long messageTick = sanitizeLong(file.messageTickMs(), defaults.messageTickMs(), 1L);
        int batch = sanitizeInt(file.messageBatchPerPriority(), defaults.messageBatchPerPriority(), 1);
        int history = sanitizeInt(file.maxMessageHistory(), defaults.maxMessageHistory(), 16);
        long messageTimeout = sanitizeLong(file.messageTimeoutMs(), defaults.messageTimeoutMs(), 100L);
        int threshold = sanitizeInt(file.compressionThresholdBytes(), defaults.compressionThresholdBytes(), 0);
        int level = Math.min(9, sanitizeInt(file.compressionLevel(), defaults.compressionLevel(), 1));
        boolean encryption = sanitizeBoolean(file.encryptionEnabled(), defaults.encryptionEnabled());
        int maxHops = sanitizeInt(file.maxHops(), defaults.maxHops(), 1);
        double reliability = sanitizeRatio(file.defaultReliability(), defaults.defaultReliability());
        long gossipInterval = sanitizeLong(file.gossipIntervalMs(), defaults.gossipIntervalMs(), 10L);
        int fanout = sanitizeInt(file.gossipFanout(), defaults.gossipFanout(), 1);
        long heartbeat = sanitizeLong(file.heartbeatIntervalMs(), defaults.heartbeatIntervalMs(), 10L);
        long consensusTimeout = sanitizeLong(file.consensusTimeoutMs(), defaults.consensusTimeoutMs(), 100L);
        String consensusPolicy = sanitizeName(file.consensusPolicy(), defaults.consensusPolicy());
        long distributionTick = sanitizeLong(file.distributionTickMs(), defaults.distributionTickMs(), 10L);
        int maxConcurrent = sanitizeInt(file.maxConcurrentTasks(), defaults.maxConcurrentTasks(), 1);
        double minTrust = sanitizeRatio(file.minTrustScore(), defaults.minTrustScore());
        double deviation = sanitizeRatio(file.imbalanceDeviation(), defaults.imbalanceDeviation());
        double severity = sanitizeRatio(file.rebalanceSeverityThreshold(), defaults.rebalanceSeverityThreshold());
        boolean rebalancing = sanitizeBoolean(file.enableDynamicRebalancing(), defaults.enableDynamicRebalancing());
        String strategy = sanitizeName(file.rebalanceStrategy(), defaults.rebalanceStrategy());
        if (!REBALANCE_STRATEGIES.contains(strategy)) {
            strategy = defaults.rebalanceStrategy();
        }
        double stuckMultiplier = file.stuckTaskMultiplier() == null
                ? defaults.stuckTaskMultiplier()
                : Math.max(1.0, file.stuckTaskMultiplier());
        long noProgress = sanitizeLong(file.noProgressEscalationMs(), defaults.noProgressEscalationMs(), 1_000L);
        String secret = sanitizeSecret(file.journalSigningSecret(), defaults.journalSigningSecret());
        return new SwarmSettings(
                messageTick,
                batch,
                history,
                messageTimeout,
                threshold,
                level,
                encryption,
                maxHops,
                reliability,
                gossipInterval,
                fanout,
                heartbeat,
                consensusTimeout,
                consensusPolicy,
                distributionTick,
                maxConcurrent,
                minTrust,
                deviation,
                severity,
                rebalancing,
                strategy,
                stuckMultiplier,
                noProgress,
                secret
        );
    }

    public SettingsView toView() {
        return new SettingsView(
                messageTickMs,
                messageBatchPerPriority,
                maxMessageHistory,
                messageTimeoutMs,
                compressionThresholdBytes,
                compressionLevel,
                encryptionEnabled,
                maxHops,
                defaultReliability,
                gossipIntervalMs,
                gossipFanout,
                heartbeatIntervalMs,
                consensusTimeoutMs,
                consensusPolicy,
                distributionTickMs,
                maxConcurrentTasks,
                minTrustScore,
                imbalanceDeviation,
                rebalanceSeverityThreshold,
                enableDynamicRebalancing,
                rebalanceStrategy,
                stuckTaskMultiplier,
                noProgressEscalationMs,
                journalSigningSecret != null && !journalSigningSecret.isBlank()
        );
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    private static double sanitizeRatio(Double raw, double fallback) {
        if (raw == null || raw.isNaN()) {
            return fallback;
        }
        return Math.max(0.0, Math.min(1.0, raw));
    }

    private static String sanitizeName(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    private static String sanitizeSecret(String raw, String fallback) {
        if (raw == null) {
            return fallback == null ? "" : fallback;
        }
        return raw.trim();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SwarmSettingsFile(
            Long messageTickMs,
            Integer messageBatchPerPriority,
            Integer maxMessageHistory,
            Long messageTimeoutMs,
            Integer compressionThresholdBytes,
            Integer compressionLevel,
            Boolean encryptionEnabled,
            Integer maxHops,
            Double defaultReliability,
            Long gossipIntervalMs,
            Integer gossipFanout,
            Long heartbeatIntervalMs,
            Long consensusTimeoutMs,
            String consensusPolicy,
            Long distributionTickMs,
            Integer maxConcurrentTasks,
            Double minTrustScore,
            Double imbalanceDeviation,
            Double rebalanceSeverityThreshold,
            Boolean enableDynamicRebalancing,
            String rebalanceStrategy,
            Double stuckTaskMultiplier,
            Long noProgressEscalationMs,
            String journalSigningSecret
    ) {
    }

    public record SettingsView(
            long messageTickMs,
            int messageBatchPerPriority,
            int maxMessageHistory,
            long messageTimeoutMs,
            int compressionThresholdBytes,
            int compressionLevel,
            boolean encryptionEnabled,
            int maxHops,
            double defaultReliability,
            long gossipIntervalMs,
            int gossipFanout,
            long heartbeatIntervalMs,
            long consensusTimeoutMs,
            String consensusPolicy,
            long distributionTickMs,
            int maxConcurrentTasks,
            double minTrustScore,
            double imbalanceDeviation,
            double rebalanceSeverityThreshold,
            boolean enableDynamicRebalancing,
            String rebalanceStrategy,
            double stuckTaskMultiplier,
            long noProgressEscalationMs,
            boolean journalSigningEnabled
    ) {
    }
}
