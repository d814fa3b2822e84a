package io.swarmmesh.observability;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

final class StructuredLoggerTest {

    @Test
    void rendersContextAsCompactJsonInInsertionOrder() {
        String line = StructuredLogger.render("Task assigned", StructuredLogger.fields(
                "taskId", "task-1",
                "agentId", "worker-1",
                "score", 2
        ));
        assertEquals("Task assigned {\"taskId\":\"task-1\",\"agentId\":\"worker-1\",\"score\":2}", line);
    }

    @Test
    void masksSecretsInContext() {
        String line = StructuredLogger.render("Loaded settings", StructuredLogger.fields(
                "journalSigningSecret", "hunter2",
                "keyId", "k1"
        ));
        assertEquals("Loaded settings {\"journalSigningSecret\":\"***\",\"keyId\":\"k1\"}", line);
    }

    @Test
    void emptyContextLeavesMessageAlone() {
        assertEquals("tick", StructuredLogger.render("tick", Map.of()));
        assertEquals("tick", StructuredLogger.render("tick", null));
    }

    @Test
    void oddFieldCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> StructuredLogger.fields("only-key"));
    }
}
