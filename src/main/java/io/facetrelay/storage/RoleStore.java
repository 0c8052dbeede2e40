package io.facetrelay.storage;

import io.facetrelay.util.Addresses;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

public final class RoleStore {
    public static final String ADMIN_ROLE = "DEFAULT_ADMIN_ROLE";
    public static final String MINTER_ROLE = "MINTER_ROLE";

    private final Database database;

    public RoleStore(Database database) {
        this.database = database;
    }

    public boolean hasRole(String role, String account) {
        if (role == null || !Addresses.isValid(account)) {
            return false;
        }
        try {
            return database.withConnection(c -> {
                try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM roles WHERE role=? AND account=?")) {
                    ps.setString(1, role);
                    ps.setString(2, Addresses.normalize(account));
                    try (ResultSet rs = ps.executeQuery()) {
                        return rs.next();
                    }
                }
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read role", e);
        }
    }

    public boolean grantRole(String role, String account, String grantedBy, long nowMs) {
        try {
            return database.withConnection(c -> {
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT OR IGNORE INTO roles(role,account,granted_by,granted_at_ms) VALUES(?,?,?,?)")) {
                    ps.setString(1, role);
                    ps.setString(2, Addresses.normalize(account));
                    ps.setString(3, grantedBy);
                    ps.setLong(4, nowMs);
                    return ps.executeUpdate() > 0;
                }
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to grant role", e);
        }
    }

    public boolean revokeRole(String role, String account) {
        try {
            return database.withConnection(c -> {
                try (PreparedStatement ps = c.prepareStatement("DELETE FROM roles WHERE role=? AND account=?")) {
                    ps.setString(1, role);
                    ps.setString(2, Addresses.normalize(account));
                    return ps.executeUpdate() > 0;
                }
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to revoke role", e);
        }
    }
}
