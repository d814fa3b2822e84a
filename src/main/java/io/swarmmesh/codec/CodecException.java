package io.swarmmesh.codec;

import io.swarmmesh.error.SwarmException;

public class CodecException extends SwarmException {
    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
