package io.swarmmesh.error;

public class ChecksumMismatchException extends SwarmException {
    private final String messageId;

    public ChecksumMismatchException(String messageId, String expected, String actual) {
        super("Checksum mismatch for message " + messageId + ": expected " + expected + ", got " + actual);
        this.messageId = messageId;
    }

    public String messageId() {
        return messageId;
    }
}
