package io.swarmmesh.model;

import io.swarmmesh.util.Hashing;
import io.swarmmesh.util.Jsons;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Message(
        String id,
        MessageType type,
        String sender,
        List<String> recipients,
        MessagePayload payload,
        MessagePriority priority,
        long timestampMs,
        long ttlMs,
        String checksum,
        Routing routing,
        Compression compression,
        Encryption encryption,
        Qos qos
) {
    public Message {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }

    public Message withPayload(MessagePayload value) {
        return new Message(id, type, sender, recipients, value, priority, timestampMs, ttlMs, checksum,
                routing, compression, encryption, qos);
    }

    public boolean expired(long nowMs) {
        return ttlMs > 0L && nowMs - timestampMs > ttlMs;
    }

    public String computeChecksum() {
        return computeChecksum(sender, recipients, payload, timestampMs);
    }

    public boolean checksumValid() {
        return checksum != null && checksum.equals(computeChecksum());
    }

    public static String computeChecksum(String sender, List<String> recipients, MessagePayload payload, long timestampMs) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("sender", sender);
        content.put("recipients", recipients == null ? List.of() : recipients);
        content.put("payload", payload);
        content.put("timestamp", timestampMs);
        return Hashing.sha256Hex(Jsons.toCanonicalJson(content));
    }

    public record Routing(
            RoutingStrategy strategy,
            int maxHops,
            ReliabilityMode reliabilityMode,
            boolean acknowledgment,
            long timeoutMs
    ) {
    }

    public record Compression(boolean enabled, String algorithm, int level, int thresholdBytes) {
        public static final String GZIP = "gzip";
        public static final String NONE = "none";

        public boolean gzip() {
            return enabled && GZIP.equalsIgnoreCase(algorithm);
        }
    }

    public record Encryption(boolean enabled, String algorithm, String keyId) {
        public static final String AES_GCM = "aes-256-gcm";

        public static Encryption disabled() {
            return new Encryption(false, AES_GCM, null);
        }
    }

    public record Qos(double bandwidth, long latencyMs, double reliability, boolean ordering, boolean deduplication) {
    }
}
