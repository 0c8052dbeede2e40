package io.facetrelay.storage;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Key/value rows describing the unit itself: initialization marker, router, collection metadata.
 */
public final class UnitStateStore {
    public static final String KEY_INITIALIZED = "initialized";
    public static final String KEY_ROUTER = "router";
    public static final String KEY_FEE_TOKEN = "fee_token";
    public static final String KEY_NAME = "name";
    public static final String KEY_SYMBOL = "symbol";
    public static final String KEY_BASE_URI = "base_uri";

    private final Database database;

    public UnitStateStore(Database database) {
        this.database = database;
    }

    public Optional<String> get(String key) {
        try {
            return database.withConnection(c -> {
                try (PreparedStatement ps = c.prepareStatement("SELECT state_value FROM unit_state WHERE state_key=?")) {
                    ps.setString(1, key);
                    try (ResultSet rs = ps.executeQuery()) {
                        return rs.next() ? Optional.of(rs.getString(1)) : Optional.<String>empty();
                    }
                }
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read unit state: " + key, e);
        }
    }

    public void put(String key, String value, long nowMs) {
        write("INSERT OR REPLACE INTO unit_state(state_key,state_value,updated_at_ms) VALUES(?,?,?)", key, value, nowMs);
    }

    /**
     * @return {@code false} when the key already had a value
     */
    public boolean putIfAbsent(String key, String value, long nowMs) {
        return write("INSERT OR IGNORE INTO unit_state(state_key,state_value,updated_at_ms) VALUES(?,?,?)",
                key, value, nowMs);
    }

    private boolean write(String sql, String key, String value, long nowMs) {
        try {
            return database.withConnection(c -> {
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    ps.setString(1, key);
                    ps.setString(2, value);
                    ps.setLong(3, nowMs);
                    return ps.executeUpdate() > 0;
                }
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write unit state: " + key, e);
        }
    }
}
