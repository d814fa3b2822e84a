package io.swarmmesh.codec;

import io.swarmmesh.model.Message;
import io.swarmmesh.model.MessagePayload;

public interface PayloadCodec {
    String name();

    MessagePayload encode(MessagePayload payload, Message.Compression compression, Message.Encryption encryption);

    MessagePayload decode(MessagePayload payload);
}
