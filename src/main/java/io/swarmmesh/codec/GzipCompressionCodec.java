package io.swarmmesh.codec;

import com.fasterxml.jackson.databind.node.TextNode;
import io.swarmmesh.model.Message;
import io.swarmmesh.model.MessagePayload;
import io.swarmmesh.util.Jsons;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

public final class GzipCompressionCodec implements PayloadCodec {
    public static final String COMPRESSED = "compressed";
    public static final String ORIGINAL_SIZE = "originalSize";

    @Override
    public String name() {
        return Message.Compression.GZIP;
    }

    @Override
    public MessagePayload encode(MessagePayload payload, Message.Compression compression, Message.Encryption encryption) {
        if (compression == null || !compression.gzip() || payload.flag(COMPRESSED)) {
            return payload;
        }
        byte[] raw = Jsons.toCompactJson(payload.data()).getBytes(StandardCharsets.UTF_8);
        if (raw.length < compression.thresholdBytes()) {
            return payload;
        }
        byte[] packed = gzip(raw, compression.level());
        Map<String, Object> metadata = new LinkedHashMap<>(payload.metadata());
        metadata.put(COMPRESSED, true);
        metadata.put("compression", Message.Compression.GZIP);
        metadata.put(ORIGINAL_SIZE, raw.length);
        return payload.withContent(TextNode.valueOf(Base64.getEncoder().encodeToString(packed)), metadata, "base64");
    }

    @Override
    public MessagePayload decode(MessagePayload payload) {
        if (!payload.flag(COMPRESSED)) {
            return payload;
        }
        try {
            byte[] packed = Base64.getDecoder().decode(payload.data().asText(""));
            byte[] raw = gunzip(packed);
            Map<String, Object> metadata = new LinkedHashMap<>(payload.metadata());
            metadata.remove(COMPRESSED);
            metadata.remove("compression");
            metadata.remove(ORIGINAL_SIZE);
            return payload.withContent(Jsons.mapper().readTree(raw), metadata, MessagePayload.DEFAULT_ENCODING);
        } catch (IOException | IllegalArgumentException e) {
            throw new CodecException("Failed to decompress payload", e);
        }
    }

    private static byte[] gzip(byte[] raw, int level) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, raw.length / 2));
        try (GZIPOutputStream gz = new LeveledGzipOutputStream(out, level)) {
            gz.write(raw);
        } catch (IOException e) {
            throw new CodecException("Failed to compress payload", e);
        }
        return out.toByteArray();
    }

    private static byte[] gunzip(byte[] packed) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(packed))) {
            return in.readAllBytes();
        }
    }

    private static final class LeveledGzipOutputStream extends GZIPOutputStream {
        private LeveledGzipOutputStream(ByteArrayOutputStream out, int level) throws IOException {
            super(out);
            def.setLevel(Math.max(1, Math.min(9, level)));
        }
    }
}
