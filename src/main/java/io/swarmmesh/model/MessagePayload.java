package io.swarmmesh.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.swarmmesh.util.Jsons;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record MessagePayload(
        JsonNode data,
        Map<String, Object> metadata,
        String contentType,
        String encoding,
        String version
) {
    public static final String DEFAULT_CONTENT_TYPE = "application/json";
    public static final String DEFAULT_ENCODING = "utf8";
    public static final String DEFAULT_VERSION = "1.0";

    public MessagePayload {
        data = data == null ? NullNode.getInstance() : data;
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        contentType = contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType;
        encoding = encoding == null || encoding.isBlank() ? DEFAULT_ENCODING : encoding;
        version = version == null || version.isBlank() ? DEFAULT_VERSION : version;
    }

    public static MessagePayload of(Object data) {
        return new MessagePayload(Jsons.toTree(data), Map.of(), null, null, null);
    }

    public static MessagePayload of(Object data, Map<String, Object> metadata) {
        return new MessagePayload(Jsons.toTree(data), metadata, null, null, null);
    }

    public MessagePayload withContent(JsonNode newData, Map<String, Object> newMetadata, String newEncoding) {
        return new MessagePayload(newData, newMetadata, contentType, newEncoding, version);
    }

    public boolean flag(String key) {
        Object value = metadata.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && "true".equalsIgnoreCase(String.valueOf(value));
    }
}
