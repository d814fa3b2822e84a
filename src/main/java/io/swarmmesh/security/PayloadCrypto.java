package io.swarmmesh.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swarmmesh.util.Jsons;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

public final class PayloadCrypto {
    public static final String SCHEMA = "swarmmesh.aesgcm.v1";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;
    private static final int KEY_BYTES = 32;

    private final Path keyFile;
    private final SecureRandom secureRandom;
    private int generation;
    private volatile Keyring keyring;

    private PayloadCrypto(Path keyFile) {
        this.keyFile = keyFile;
        this.secureRandom = new SecureRandom();
        this.keyring = keyFile == null ? bootstrapKeyring() : loadOrCreateKeyring();
    }

    public static PayloadCrypto inMemory() {
        return new PayloadCrypto(null);
    }

    public static PayloadCrypto fileBacked(Path keyFile) {
        return new PayloadCrypto(keyFile);
    }

    public String activeKeyId() {
        return keyring.activeKid();
    }

    public String encrypt(String plaintext) {
        Keyring ring = keyring;
        SecretKeySpec key = ring.keys().get(ring.activeKid());
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] cipherText = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            ObjectNode row = Jsons.mapper().createObjectNode();
            row.put("enc", SCHEMA);
            row.put("kid", ring.activeKid());
            row.put("iv", Base64.getEncoder().encodeToString(iv));
            row.put("ct", Base64.getEncoder().encodeToString(cipherText));
            return Jsons.toCompactJson(row);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt payload", e);
        }
    }

    public String decrypt(String envelope) {
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(envelope);
        } catch (IOException e) {
            throw new IllegalArgumentException("Encrypted payload is not a JSON envelope", e);
        }
        if (!SCHEMA.equals(node.path("enc").asText(""))) {
            throw new IllegalArgumentException("Unsupported encryption envelope: " + node.path("enc").asText(""));
        }
        String ivBase64 = node.path("iv").asText("");
        String ctBase64 = node.path("ct").asText("");
        if (ivBase64.isBlank() || ctBase64.isBlank()) {
            throw new IllegalArgumentException("Invalid encrypted payload format: missing iv/ct");
        }
        byte[] iv = Base64.getDecoder().decode(ivBase64);
        byte[] cipherText = Base64.getDecoder().decode(ctBase64);
        Keyring ring = keyring;
        String kid = node.path("kid").asText("");
        SecretKeySpec exact = ring.keys().get(kid);
        if (exact != null) {
            return decrypt(cipherText, iv, exact);
        }
        for (SecretKeySpec key : ring.keys().values()) {
            try {
                return decrypt(cipherText, iv, key);
            } catch (IllegalStateException ignored) {
                // next key in rotation
            }
        }
        throw new IllegalStateException("Unable to decrypt payload with current keyring");
    }

    public synchronized String rotate() {
        LinkedHashMap<String, SecretKeySpec> next = new LinkedHashMap<>(keyring.keys());
        String kid = nextKid();
        next.put(kid, newKey());
        Keyring rotated = new Keyring(kid, next);
        if (keyFile != null) {
            persistKeyring(rotated);
        }
        keyring = rotated;
        return kid;
    }

    public int keyCount() {
        return keyring.keys().size();
    }

    private String decrypt(byte[] cipherText, byte[] iv, SecretKeySpec key) {
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            return new String(cipher.doFinal(cipherText), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to decrypt payload", e);
        }
    }

    private Keyring loadOrCreateKeyring() {
        if (!Files.exists(keyFile)) {
            Keyring created = bootstrapKeyring();
            persistKeyring(created);
            return created;
        }
        try {
            JsonNode node = Jsons.mapper().readTree(Files.readString(keyFile, StandardCharsets.UTF_8));
            String active = node.path("active_kid").asText("");
            JsonNode keysNode = node.path("keys");
            LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
            keysNode.fieldNames().forEachRemaining(kid -> {
                String raw = keysNode.path(kid).asText("");
                if (!raw.isBlank()) {
                    keys.put(kid, new SecretKeySpec(Base64.getDecoder().decode(raw), "AES"));
                }
            });
            if (keys.isEmpty()) {
                Keyring created = bootstrapKeyring();
                persistKeyring(created);
                return created;
            }
            if (!keys.containsKey(active)) {
                active = keys.keySet().iterator().next();
            }
            generation = keys.size();
            return new Keyring(active, keys);
        } catch (IOException | IllegalArgumentException e) {
            throw new RuntimeException("Failed to load payload keyring: " + keyFile, e);
        }
    }

    private Keyring bootstrapKeyring() {
        LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
        String kid = nextKid();
        keys.put(kid, newKey());
        return new Keyring(kid, keys);
    }

    private String nextKid() {
        generation++;
        return "k" + generation;
    }

    private SecretKeySpec newKey() {
        byte[] raw = new byte[KEY_BYTES];
        secureRandom.nextBytes(raw);
        return new SecretKeySpec(raw, "AES");
    }

    private void persistKeyring(Keyring ring) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            LinkedHashMap<String, String> keys = new LinkedHashMap<>();
            for (Map.Entry<String, SecretKeySpec> entry : ring.keys().entrySet()) {
                keys.put(entry.getKey(), Base64.getEncoder().encodeToString(entry.getValue().getEncoded()));
            }
            ObjectNode root = Jsons.mapper().createObjectNode();
            root.put("schema", "swarmmesh.payload.keys.v1");
            root.put("active_kid", ring.activeKid());
            root.set("keys", Jsons.mapper().valueToTree(keys));
            Files.writeString(keyFile, Jsons.toJson(root), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to persist payload keyring: " + keyFile, e);
        }
    }

    private record Keyring(String activeKid, LinkedHashMap<String, SecretKeySpec> keys) {
    }
}
