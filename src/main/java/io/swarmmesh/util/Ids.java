package io.swarmmesh.util;

import java.security.SecureRandom;

public final class Ids {
    private static final SecureRandom RANDOM = new SecureRandom();

    private Ids() {
    }

    public static String messageId(long nowMs) {
        return "msg_" + nowMs + "_" + randomHex(6);
    }

    public static String taskId(long nowMs) {
        return "task_" + nowMs + "_" + randomHex(6);
    }

    public static String proposalId(long nowMs) {
        return "proposal_" + nowMs + "_" + randomHex(6);
    }

    public static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : value) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
