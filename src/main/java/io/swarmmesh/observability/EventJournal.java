package io.swarmmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swarmmesh.event.SwarmEvent;
import io.swarmmesh.event.SwarmEventBus;
import io.swarmmesh.security.SensitiveDataMasker;
import io.swarmmesh.util.Hashing;
import io.swarmmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

public final class EventJournal {
    private final Path journalFile;
    private final String signingSecret;
    private String previousHash;

    public EventJournal(Path journalFile, String signingSecret) {
        this.journalFile = journalFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(journalFile.getParent());
            if (!Files.exists(journalFile)) {
                try {
                    Files.createFile(journalFile);
                } catch (FileAlreadyExistsException ignored) {
                    // created concurrently
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize event journal: " + journalFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public EventJournal attach(SwarmEventBus bus) {
        bus.subscribeAll(this::append);
        return this;
    }

    public synchronized void append(SwarmEvent event) {
        ObjectNode row = Jsons.mapper().createObjectNode();
        row.put("timestamp", Instant.now().toString());
        row.put("node", event.nodeId());
        row.put("type", event.type().wire());
        row.set("event", SensitiveDataMasker.masked(Jsons.toTree(event)));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        try {
            Files.writeString(journalFile, Jsons.toCompactJson(row) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write event journal: " + journalFile, e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path file() {
        return journalFile;
    }

    public VerifyOutcome verify() {
        return verify(journalFile, signingSecret);
    }

    public static VerifyOutcome verify(Path journalFile, String signingSecret) {
        if (!Files.exists(journalFile)) {
            return new VerifyOutcome(true, 0, -1, "journal does not exist");
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(journalFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read event journal: " + journalFile, e);
        }
        String secret = signingSecret == null ? "" : signingSecret.trim();
        String expectedPrev = "";
        int entries = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            int lineNo = i + 1;
            ObjectNode row;
            try {
                JsonNode parsed = Jsons.mapper().readTree(line);
                if (!parsed.isObject()) {
                    return new VerifyOutcome(false, entries, lineNo, "row is not a JSON object");
                }
                row = (ObjectNode) parsed;
            } catch (IOException e) {
                return new VerifyOutcome(false, entries, lineNo, "unparseable row");
            }
            String hash = row.path("hash").asText("");
            String signature = row.path("signature").asText("");
            if (!expectedPrev.equals(row.path("prev_hash").asText(""))) {
                return new VerifyOutcome(false, entries, lineNo, "prev_hash does not match previous row");
            }
            row.remove("hash");
            row.remove("signature");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                return new VerifyOutcome(false, entries, lineNo, "row hash mismatch");
            }
            if (!secret.isBlank() && !Hashing.hmacSha256Hex(secret, hash).equals(signature)) {
                return new VerifyOutcome(false, entries, lineNo, "signature mismatch");
            }
            expectedPrev = hash;
            entries++;
        }
        return new VerifyOutcome(true, entries, -1, "ok");
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(journalFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read event journal: " + journalFile, e);
        }
    }

    public record VerifyOutcome(boolean valid, int entries, int brokenAtLine, String reason) {
    }
}
