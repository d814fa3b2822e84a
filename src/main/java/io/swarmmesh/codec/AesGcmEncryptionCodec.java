package io.swarmmesh.codec;

import com.fasterxml.jackson.databind.node.TextNode;
import io.swarmmesh.model.Message;
import io.swarmmesh.model.MessagePayload;
import io.swarmmesh.security.PayloadCrypto;
import io.swarmmesh.util.Jsons;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

public final class AesGcmEncryptionCodec implements PayloadCodec {
    public static final String ENCRYPTED = "encrypted";
    public static final String KEY_ID = "keyId";

    private final PayloadCrypto crypto;

    public AesGcmEncryptionCodec(PayloadCrypto crypto) {
        this.crypto = crypto;
    }

    @Override
    public String name() {
        return Message.Encryption.AES_GCM;
    }

    @Override
    public MessagePayload encode(MessagePayload payload, Message.Compression compression, Message.Encryption encryption) {
        if (encryption == null || !encryption.enabled() || payload.flag(ENCRYPTED)) {
            return payload;
        }
        String envelope = crypto.encrypt(Jsons.toCompactJson(payload.data()));
        Map<String, Object> metadata = new LinkedHashMap<>(payload.metadata());
        metadata.put(ENCRYPTED, true);
        metadata.put(KEY_ID, crypto.activeKeyId());
        metadata.put("encryptionAlgorithm", Message.Encryption.AES_GCM);
        return payload.withContent(TextNode.valueOf(envelope), metadata, payload.encoding());
    }

    @Override
    public MessagePayload decode(MessagePayload payload) {
        if (!payload.flag(ENCRYPTED)) {
            return payload;
        }
        try {
            String plaintext = crypto.decrypt(payload.data().asText(""));
            Map<String, Object> metadata = new LinkedHashMap<>(payload.metadata());
            metadata.remove(ENCRYPTED);
            metadata.remove(KEY_ID);
            metadata.remove("encryptionAlgorithm");
            return payload.withContent(Jsons.mapper().readTree(plaintext), metadata, payload.encoding());
        } catch (IOException | RuntimeException e) {
            throw new CodecException("Failed to decrypt payload", e);
        }
    }
}
