package io.swarmmesh.model;

import java.util.List;

public record MessageDraft(
        MessageType type,
        List<String> recipients,
        MessagePayload payload,
        MessagePriority priority,
        Message.Routing routing,
        Message.Compression compression,
        Message.Encryption encryption,
        Message.Qos qos,
        Long ttlMs
) {
    public MessageDraft {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }

    public static MessageDraft of(MessageType type, List<String> recipients, MessagePayload payload) {
        return new MessageDraft(type, recipients, payload, null, null, null, null, null, null);
    }

    public static MessageDraft of(MessageType type, List<String> recipients, MessagePayload payload, MessagePriority priority) {
        return new MessageDraft(type, recipients, payload, priority, null, null, null, null, null);
    }

    public MessageDraft withPriority(MessagePriority value) {
        return new MessageDraft(type, recipients, payload, value, routing, compression, encryption, qos, ttlMs);
    }

    public MessageDraft withEncryption(Message.Encryption value) {
        return new MessageDraft(type, recipients, payload, priority, routing, compression, value, qos, ttlMs);
    }

    public MessageDraft withCompression(Message.Compression value) {
        return new MessageDraft(type, recipients, payload, priority, routing, value, encryption, qos, ttlMs);
    }

    public MessageDraft withTtlMs(long value) {
        return new MessageDraft(type, recipients, payload, priority, routing, compression, encryption, qos, value);
    }
}
