package io.swarmmesh.security;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swarmmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.stream.Stream;

final class PayloadCryptoTest {

    @Test
    void encryptsIntoVersionedEnvelope() throws Exception {
        PayloadCrypto crypto = PayloadCrypto.inMemory();
        String envelope = crypto.encrypt("{\"plan\":\"ship it\"}");

        Assertions.assertFalse(envelope.contains("ship it"));
        Assertions.assertEquals(PayloadCrypto.SCHEMA, Jsons.mapper().readTree(envelope).path("enc").asText());
        Assertions.assertEquals("k1", Jsons.mapper().readTree(envelope).path("kid").asText());
        Assertions.assertEquals("{\"plan\":\"ship it\"}", crypto.decrypt(envelope));
    }

    @Test
    void rotationKeepsOlderKeysReadable() {
        PayloadCrypto crypto = PayloadCrypto.inMemory();
        String before = crypto.encrypt("old");
        String kid = crypto.rotate();

        Assertions.assertEquals("k2", kid);
        Assertions.assertEquals(kid, crypto.activeKeyId());
        Assertions.assertEquals(2, crypto.keyCount());
        Assertions.assertEquals("old", crypto.decrypt(before));
        Assertions.assertEquals("new", crypto.decrypt(crypto.encrypt("new")));
    }

    @Test
    void tamperedCiphertextIsRejected() throws Exception {
        PayloadCrypto crypto = PayloadCrypto.inMemory();
        ObjectNode envelope = (ObjectNode) Jsons.mapper().readTree(crypto.encrypt("payload"));
        envelope.put("ct", Base64.getEncoder().encodeToString("not the ciphertext".getBytes(StandardCharsets.UTF_8)));

        Assertions.assertThrows(IllegalStateException.class, () -> crypto.decrypt(Jsons.toCompactJson(envelope)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> crypto.decrypt("plain text"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> crypto.decrypt("{\"enc\":\"other\"}"));
    }

    @Test
    void separateKeyringsCannotReadEachOther() {
        String envelope = PayloadCrypto.inMemory().encrypt("secret plan");
        Assertions.assertThrows(IllegalStateException.class, () -> PayloadCrypto.inMemory().decrypt(envelope));
    }

    @Test
    void fileBackedKeyringSurvivesReload() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-keys-");
        try {
            Path keyFile = root.resolve("security").resolve("payload-keys.json");
            PayloadCrypto first = PayloadCrypto.fileBacked(keyFile);
            String early = first.encrypt("early");
            first.rotate();
            String late = first.encrypt("late");
            Assertions.assertTrue(Files.exists(keyFile));

            PayloadCrypto reloaded = PayloadCrypto.fileBacked(keyFile);
            Assertions.assertEquals(first.activeKeyId(), reloaded.activeKeyId());
            Assertions.assertEquals(2, reloaded.keyCount());
            Assertions.assertEquals("early", reloaded.decrypt(early));
            Assertions.assertEquals("late", reloaded.decrypt(late));
            Assertions.assertEquals("k3", reloaded.rotate());
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
