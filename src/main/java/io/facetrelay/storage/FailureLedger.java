package io.facetrelay.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.facetrelay.model.ChainSelectors;
import io.facetrelay.model.FailedMessage;
import io.facetrelay.model.InboundMessage;
import io.facetrelay.model.MessageErrorCode;
import io.facetrelay.model.TokenAmount;
import io.facetrelay.util.Jsons;

import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable record of inbound messages whose application failed. A row exists exactly while
 * the message is pending recovery.
 */
public final class FailureLedger {
    private static final TypeReference<List<Map<String, String>>> TOKEN_AMOUNTS = new TypeReference<>() {
    };

    private final Database database;
    private final String namespace;

    public FailureLedger(Database database) {
        this.database = database;
        this.namespace = database.namespace();
    }

    public void recordFailure(InboundMessage message, String reason, long nowMs) {
        String sql = """
                INSERT INTO failed_messages(message_id,namespace,error_code,reason,source_chain,sender,data_b64,token_amounts,attempts,failed_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,1,?,?)
                ON CONFLICT(message_id) DO UPDATE SET reason=excluded.reason, attempts=attempts+1, updated_at_ms=excluded.updated_at_ms
                """;
        try {
            database.withConnection(c -> {
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    ps.setString(1, message.messageId());
                    ps.setString(2, namespace);
                    ps.setString(3, MessageErrorCode.BASIC.name());
                    ps.setString(4, nonEmptyReason(reason));
                    ps.setString(5, ChainSelectors.format(message.sourceChainSelector()));
                    ps.setString(6, message.sender());
                    ps.setString(7, Base64.getEncoder().encodeToString(message.data()));
                    ps.setString(8, encodeTokenAmounts(message.destTokenAmounts()));
                    ps.setLong(9, nowMs);
                    ps.setLong(10, nowMs);
                    return ps.executeUpdate();
                }
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record failed message: " + message.messageId(), e);
        }
    }

    public boolean recordRetryFailure(String messageId, String reason, long nowMs) {
        String sql = "UPDATE failed_messages SET reason=?, attempts=attempts+1, updated_at_ms=? WHERE message_id=?";
        try {
            return database.withConnection(c -> {
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    ps.setString(1, nonEmptyReason(reason));
                    ps.setLong(2, nowMs);
                    ps.setString(3, messageId);
                    return ps.executeUpdate() == 1;
                }
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update failed message: " + messageId, e);
        }
    }

    /**
     * Removes the failure record and appends a recovery trail row in one transaction.
     *
     * @return {@code false} when no record existed
     */
    public boolean resolve(String messageId, String recoveredBy, long nowMs) {
        try {
            return database.withTransaction(c -> {
                try (PreparedStatement select = c.prepareStatement(
                        "SELECT attempts FROM failed_messages WHERE message_id=?");
                     PreparedStatement delete = c.prepareStatement(
                             "DELETE FROM failed_messages WHERE message_id=?");
                     PreparedStatement trail = c.prepareStatement(
                             "INSERT INTO recovered_messages(message_id,namespace,recovered_by,attempts,recovered_at_ms) VALUES(?,?,?,?,?)")) {
                    select.setString(1, messageId);
                    int attempts;
                    try (ResultSet rs = select.executeQuery()) {
                        if (!rs.next()) {
                            return false;
                        }
                        attempts = rs.getInt("attempts");
                    }
                    delete.setString(1, messageId);
                    delete.executeUpdate();
                    trail.setString(1, messageId);
                    trail.setString(2, namespace);
                    trail.setString(3, recoveredBy);
                    trail.setInt(4, attempts + 1);
                    trail.setLong(5, nowMs);
                    trail.executeUpdate();
                    return true;
                }
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to resolve failed message: " + messageId, e);
        }
    }

    public boolean contains(String messageId) {
        return get(messageId).isPresent();
    }

    public Optional<FailedMessage> get(String messageId) {
        String sql = """
                SELECT message_id,error_code,reason,source_chain,sender,data_b64,token_amounts,attempts,failed_at_ms,updated_at_ms
                FROM failed_messages WHERE message_id=?
                """;
        try {
            return database.withConnection(c -> {
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    ps.setString(1, messageId);
                    try (ResultSet rs = ps.executeQuery()) {
                        return rs.next() ? Optional.of(readRow(rs)) : Optional.<FailedMessage>empty();
                    }
                }
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read failed message: " + messageId, e);
        }
    }

    public List<FailedMessage> list(int offset, int limit) {
        String sql = """
                SELECT message_id,error_code,reason,source_chain,sender,data_b64,token_amounts,attempts,failed_at_ms,updated_at_ms
                FROM failed_messages ORDER BY failed_at_ms ASC, message_id ASC LIMIT ? OFFSET ?
                """;
        try {
            return database.withConnection(c -> {
                List<FailedMessage> out = new ArrayList<>();
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    ps.setInt(1, Math.max(1, limit));
                    ps.setInt(2, Math.max(0, offset));
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            out.add(readRow(rs));
                        }
                    }
                }
                return out;
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list failed messages", e);
        }
    }

    public int count() {
        return countRows("SELECT COUNT(*) FROM failed_messages");
    }

    public int recoveredCount() {
        return countRows("SELECT COUNT(*) FROM recovered_messages");
    }

    private int countRows(String sql) {
        try {
            return database.withConnection(c -> {
                try (PreparedStatement ps = c.prepareStatement(sql);
                     ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count ledger rows", e);
        }
    }

    private FailedMessage readRow(ResultSet rs) throws SQLException {
        return new FailedMessage(
                rs.getString("message_id"),
                rs.getString("reason"),
                MessageErrorCode.valueOf(rs.getString("error_code")),
                ChainSelectors.parse(rs.getString("source_chain")),
                rs.getString("sender"),
                Base64.getDecoder().decode(rs.getString("data_b64")),
                decodeTokenAmounts(rs.getString("token_amounts")),
                rs.getInt("attempts"),
                rs.getLong("failed_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private String nonEmptyReason(String reason) {
        return reason == null || reason.isBlank() ? "unspecified failure" : reason;
    }

    private String encodeTokenAmounts(List<TokenAmount> amounts) {
        List<Map<String, String>> rows = new ArrayList<>();
        for (TokenAmount amount : amounts) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put("token", amount.token());
            row.put("amount", amount.amount().toString());
            rows.add(row);
        }
        return Jsons.toCompactJson(rows);
    }

    private List<TokenAmount> decodeTokenAmounts(String raw) {
        try {
            List<Map<String, String>> rows = Jsons.mapper().readValue(raw, TOKEN_AMOUNTS);
            List<TokenAmount> out = new ArrayList<>();
            for (Map<String, String> row : rows) {
                out.add(new TokenAmount(row.get("token"), new BigInteger(row.get("amount"))));
            }
            return out;
        } catch (Exception e) {
            throw new RuntimeException("Corrupt token amounts in failure ledger", e);
        }
    }
}
