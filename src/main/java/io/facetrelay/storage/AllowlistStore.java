package io.facetrelay.storage;

import io.facetrelay.model.ChainSelectors;
import io.facetrelay.util.Addresses;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Destination, source and per-source sender allowlists. A missing row means deny.
 * Callers are expected to hold the admin role before invoking a setter.
 */
public final class AllowlistStore {
    private final Database database;

    public AllowlistStore(Database database) {
        this.database = database;
    }

    public boolean isDestinationAllowed(long chainSelector) {
        return exists("SELECT 1 FROM allowed_destination_chains WHERE chain_selector=?",
                ChainSelectors.format(chainSelector), null);
    }

    public boolean isSourceAllowed(long chainSelector) {
        return exists("SELECT 1 FROM allowed_source_chains WHERE chain_selector=?",
                ChainSelectors.format(chainSelector), null);
    }

    public boolean isSenderAllowed(long sourceChainSelector, String sender) {
        if (!Addresses.isValid(sender)) {
            return false;
        }
        return exists("SELECT 1 FROM allowed_senders WHERE chain_selector=? AND sender=?",
                ChainSelectors.format(sourceChainSelector), Addresses.normalize(sender));
    }

    /**
     * @return {@code true} when the stored value changed
     */
    public boolean setDestinationAllowed(long chainSelector, boolean allowed, String actor, long nowMs) {
        return toggleChain("allowed_destination_chains", chainSelector, allowed, actor, nowMs);
    }

    public boolean setSourceAllowed(long chainSelector, boolean allowed, String actor, long nowMs) {
        return toggleChain("allowed_source_chains", chainSelector, allowed, actor, nowMs);
    }

    public boolean setSenderAllowed(long sourceChainSelector, String sender, boolean allowed, String actor, long nowMs) {
        String chain = ChainSelectors.format(sourceChainSelector);
        String normalized = Addresses.normalize(sender);
        String sql = allowed
                ? "INSERT OR IGNORE INTO allowed_senders(chain_selector,sender,updated_by,updated_at_ms) VALUES(?,?,?,?)"
                : "DELETE FROM allowed_senders WHERE chain_selector=? AND sender=?";
        try {
            return database.withConnection(c -> {
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    ps.setString(1, chain);
                    ps.setString(2, normalized);
                    if (allowed) {
                        ps.setString(3, actor);
                        ps.setLong(4, nowMs);
                    }
                    return ps.executeUpdate() > 0;
                }
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update sender allowlist", e);
        }
    }

    public List<Long> allowedDestinations() {
        return listChains("SELECT chain_selector FROM allowed_destination_chains ORDER BY updated_at_ms ASC");
    }

    public List<Long> allowedSources() {
        return listChains("SELECT chain_selector FROM allowed_source_chains ORDER BY updated_at_ms ASC");
    }

    public List<AllowedSender> allowedSenders() {
        try {
            return database.withConnection(c -> {
                List<AllowedSender> out = new ArrayList<>();
                try (PreparedStatement ps = c.prepareStatement(
                        "SELECT chain_selector,sender FROM allowed_senders ORDER BY updated_at_ms ASC");
                     ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new AllowedSender(ChainSelectors.parse(rs.getString("chain_selector")),
                                rs.getString("sender")));
                    }
                }
                return out;
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list allowed senders", e);
        }
    }

    private boolean toggleChain(String table, long chainSelector, boolean allowed, String actor, long nowMs) {
        String sql = allowed
                ? "INSERT OR IGNORE INTO " + table + "(chain_selector,updated_by,updated_at_ms) VALUES(?,?,?)"
                : "DELETE FROM " + table + " WHERE chain_selector=?";
        try {
            return database.withConnection(c -> {
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    ps.setString(1, ChainSelectors.format(chainSelector));
                    if (allowed) {
                        ps.setString(2, actor);
                        ps.setLong(3, nowMs);
                    }
                    return ps.executeUpdate() > 0;
                }
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update allowlist " + table, e);
        }
    }

    private boolean exists(String sql, String first, String second) {
        try {
            return database.withConnection(c -> {
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    ps.setString(1, first);
                    if (second != null) {
                        ps.setString(2, second);
                    }
                    try (ResultSet rs = ps.executeQuery()) {
                        return rs.next();
                    }
                }
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read allowlist", e);
        }
    }

    private List<Long> listChains(String sql) {
        try {
            return database.withConnection(c -> {
                List<Long> out = new ArrayList<>();
                try (PreparedStatement ps = c.prepareStatement(sql);
                     ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(ChainSelectors.parse(rs.getString(1)));
                    }
                }
                return out;
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list allowlist", e);
        }
    }

    public record AllowedSender(long chainSelector, String sender) {
    }
}
