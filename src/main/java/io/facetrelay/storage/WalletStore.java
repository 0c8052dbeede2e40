package io.facetrelay.storage;

import io.facetrelay.error.RelayError;
import io.facetrelay.error.RelayException;
import io.facetrelay.router.FeeWallet;
import io.facetrelay.util.Addresses;

import java.math.BigInteger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

public final class WalletStore implements FeeWallet {
    private final Database database;

    public WalletStore(Database database) {
        this.database = database;
    }

    @Override
    public BigInteger balanceOf(String asset) {
        try {
            return database.withConnection(c -> readBalance(c, Addresses.normalize(asset)));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read balance", e);
        }
    }

    @Override
    public void credit(String asset, BigInteger amount) {
        requireNonNegative(amount);
        String key = Addresses.normalize(asset);
        try {
            database.withTransaction(c -> {
                writeBalance(c, key, readBalance(c, key).add(amount));
                return null;
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to credit balance", e);
        }
    }

    @Override
    public void approve(String asset, String spender, BigInteger amount) {
        requireNonNegative(amount);
        try {
            database.withConnection(c -> {
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT OR REPLACE INTO wallet_allowances(asset,spender,amount,updated_at_ms) VALUES(?,?,?,?)")) {
                    ps.setString(1, Addresses.normalize(asset));
                    ps.setString(2, Addresses.normalize(spender));
                    ps.setString(3, amount.toString());
                    ps.setLong(4, Instant.now().toEpochMilli());
                    return ps.executeUpdate();
                }
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to approve spender", e);
        }
    }

    @Override
    public BigInteger allowance(String asset, String spender) {
        try {
            return database.withConnection(c ->
                    readAllowance(c, Addresses.normalize(asset), Addresses.normalize(spender)));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read allowance", e);
        }
    }

    @Override
    public void payNative(BigInteger amount) {
        requireNonNegative(amount);
        try {
            database.withTransaction(c -> {
                BigInteger balance = readBalance(c, NATIVE);
                if (balance.compareTo(amount) < 0) {
                    throw RelayException.of(RelayError.INSUFFICIENT_BALANCE,
                            "native balance " + balance + " < " + amount);
                }
                writeBalance(c, NATIVE, balance.subtract(amount));
                return null;
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to pay native value", e);
        }
    }

    @Override
    public void transferFrom(String asset, String spender, BigInteger amount) {
        requireNonNegative(amount);
        String token = Addresses.normalize(asset);
        String who = Addresses.normalize(spender);
        try {
            database.withTransaction(c -> {
                BigInteger allowance = readAllowance(c, token, who);
                if (allowance.compareTo(amount) < 0) {
                    throw RelayException.of(RelayError.INSUFFICIENT_BALANCE,
                            "allowance " + allowance + " < " + amount + " for spender " + who);
                }
                BigInteger balance = readBalance(c, token);
                if (balance.compareTo(amount) < 0) {
                    throw RelayException.of(RelayError.INSUFFICIENT_BALANCE,
                            "token balance " + balance + " < " + amount);
                }
                writeBalance(c, token, balance.subtract(amount));
                try (PreparedStatement ps = c.prepareStatement(
                        "UPDATE wallet_allowances SET amount=?, updated_at_ms=? WHERE asset=? AND spender=?")) {
                    ps.setString(1, allowance.subtract(amount).toString());
                    ps.setLong(2, Instant.now().toEpochMilli());
                    ps.setString(3, token);
                    ps.setString(4, who);
                    ps.executeUpdate();
                }
                return null;
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to transfer fee token", e);
        }
    }

    private BigInteger readBalance(Connection c, String asset) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT amount FROM wallet_balances WHERE asset=?")) {
            ps.setString(1, asset);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? new BigInteger(rs.getString(1)) : BigInteger.ZERO;
            }
        }
    }

    private void writeBalance(Connection c, String asset, BigInteger amount) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT OR REPLACE INTO wallet_balances(asset,amount,updated_at_ms) VALUES(?,?,?)")) {
            ps.setString(1, asset);
            ps.setString(2, amount.toString());
            ps.setLong(3, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private BigInteger readAllowance(Connection c, String asset, String spender) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT amount FROM wallet_allowances WHERE asset=? AND spender=?")) {
            ps.setString(1, asset);
            ps.setString(2, spender);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? new BigInteger(rs.getString(1)) : BigInteger.ZERO;
            }
        }
    }

    private void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be non-negative: " + amount);
        }
    }
}
