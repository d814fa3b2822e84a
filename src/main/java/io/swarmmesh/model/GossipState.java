package io.swarmmesh.model;

import com.fasterxml.jackson.databind.JsonNode;

public record GossipState(long version, JsonNode data, long timestampMs, String checksum) {
}
