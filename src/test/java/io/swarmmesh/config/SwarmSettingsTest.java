package io.swarmmesh.config;

import io.swarmmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class SwarmSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-settings-");
        try {
            SwarmSettings settings = SwarmSettings.load(SwarmMeshConfig.fromRoot(root.toString()));
            Assertions.assertEquals(SwarmSettings.defaults(), settings);
            Assertions.assertEquals(100L, settings.messageTickMs());
            Assertions.assertEquals(3, settings.gossipFanout());
            Assertions.assertFalse(settings.encryptionEnabled());
            Assertions.assertEquals("log", settings.rebalanceStrategy());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void valuesAreSanitized() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-settings-sanitize-");
        try {
            SwarmMeshConfig config = SwarmMeshConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), """
                    {
                      "messageTickMs": 0,
                      "messageBatchPerPriority": -3,
                      "maxMessageHistory": 2,
                      "compressionLevel": 42,
                      "minTrustScore": 1.7,
                      "imbalanceDeviation": -0.2,
                      "consensusPolicy": "  Threshold:score:0.5 ",
                      "rebalanceStrategy": "shuffle",
                      "stuckTaskMultiplier": 0.5,
                      "noProgressEscalationMs": 10,
                      "journalSigningSecret": "  abc  ",
                      "unknownField": true
                    }
                    """, StandardCharsets.UTF_8);

            SwarmSettings settings = SwarmSettings.load(config);
            Assertions.assertEquals(1L, settings.messageTickMs());
            Assertions.assertEquals(1, settings.messageBatchPerPriority());
            Assertions.assertEquals(16, settings.maxMessageHistory());
            Assertions.assertEquals(9, settings.compressionLevel());
            Assertions.assertEquals(1.0, settings.minTrustScore());
            Assertions.assertEquals(0.0, settings.imbalanceDeviation());
            Assertions.assertEquals("threshold:score:0.5", settings.consensusPolicy());
            Assertions.assertEquals("log", settings.rebalanceStrategy());
            Assertions.assertEquals(1.0, settings.stuckTaskMultiplier());
            Assertions.assertEquals(1_000L, settings.noProgressEscalationMs());
            Assertions.assertEquals("abc", settings.journalSigningSecret());
            // untouched fields fall back to defaults
            Assertions.assertEquals(SwarmMeshConfig.DEFAULT_HEARTBEAT_INTERVAL_MS, settings.heartbeatIntervalMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void viewDoesNotExposeSecret() {
        SwarmSettings settings = SwarmSettings.fromFile(new SwarmSettings.SwarmSettingsFile(
                null, null, null, null, null, null, true, null, null, null, null, null, null, null,
                null, null, null, null, null, null, "reassign", null, null, "top-secret"), SwarmSettings.defaults());

        SwarmSettings.SettingsView view = settings.toView();
        Assertions.assertTrue(view.journalSigningEnabled());
        Assertions.assertTrue(view.encryptionEnabled());
        Assertions.assertEquals("reassign", view.rebalanceStrategy());
        Assertions.assertFalse(Jsons.toJson(view).contains("top-secret"));
        Assertions.assertFalse(SwarmSettings.defaults().toView().journalSigningEnabled());
    }

    @Test
    void malformedFileFailsLoudly() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-settings-bad-");
        try {
            Path file = root.resolve("settings.json");
            Files.writeString(file, "{not json", StandardCharsets.UTF_8);
            RuntimeException error = Assertions.assertThrows(RuntimeException.class, () -> SwarmSettings.load(file));
            Assertions.assertTrue(error.getMessage().startsWith("Failed to load swarm settings"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
