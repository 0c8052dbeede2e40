package io.facetrelay.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.facetrelay.security.SensitiveDataMasker;
import io.facetrelay.util.Hashing;
import io.facetrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL record of everything the unit emits. Each row carries the hash of the
 * previous row and, when a signing secret is present, an HMAC of its own hash.
 */
public final class AuditLogger {
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper().findAndRegisterModules();
    private final Path auditFile;
    private final String namespace;
    private final String signingSecret;
    private String previousHash;

    public AuditLogger(Path auditFile, String namespace, String signingSecret) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently by another runtime on the same root.
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("trace_id", event.traceId());
        row.put("message_id", event.messageId());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized List<String> tail(int lines) {
        List<String> all = readLines();
        int n = Math.max(1, lines);
        return new ArrayList<>(all.subList(Math.max(0, all.size() - n), all.size()));
    }

    /**
     * Re-walks the chain from the first row and stops at the first row whose link, hash or
     * signature does not check out.
     */
    public synchronized IntegrityReport verify() {
        List<String> lines = readLines();
        int checked = 0;
        String expectedPrev = "";
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            JsonNode parsed;
            try {
                parsed = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return new IntegrityReport(false, checked, i + 1, "invalid_json", expectedPrev);
            }
            String hash = parsed.path("hash").asText("");
            if (!parsed.path("prev_hash").asText("").equals(expectedPrev)) {
                return new IntegrityReport(false, checked, i + 1, "prev_hash_mismatch", expectedPrev);
            }
            ObjectNode canonical = parsed.deepCopy();
            canonical.remove("hash");
            canonical.remove("signature");
            if (!Hashing.sha256Hex(toCompactJson(canonical)).equals(hash)) {
                return new IntegrityReport(false, checked, i + 1, "hash_mismatch", expectedPrev);
            }
            String signature = parsed.path("signature").asText("");
            if (!signingSecret.isBlank() && !Hashing.hmacSha256Hex(signingSecret, hash).equals(signature)) {
                return new IntegrityReport(false, checked, i + 1, "signature_mismatch", expectedPrev);
            }
            checked++;
            expectedPrev = hash;
        }
        return new IntegrityReport(true, checked, 0, "", expectedPrev);
    }

    private List<String> readLines() {
        try {
            return Files.exists(auditFile) ? Files.readAllLines(auditFile, StandardCharsets.UTF_8) : List.of();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        String last = "";
        for (String line : readLines()) {
            if (line != null && !line.isBlank()) {
                last = line;
            }
        }
        if (last.isBlank()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Audit log tail is not valid JSON: " + auditFile, e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        return Jsons.mapper().convertValue(SensitiveDataMasker.masked(node), Map.class);
    }

    private String toCompactJson(Object row) {
        try {
            return COMPACT_MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize audit row", e);
        }
    }

    public record IntegrityReport(boolean ok, int checkedRows, int brokenLine, String reason, String tailHash) {
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String traceId,
            String messageId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                String traceId,
                String messageId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, traceId, messageId,
                    details == null ? Map.of() : details);
        }
    }
}
