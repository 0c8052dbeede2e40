package io.facetrelay.facet;

import java.math.BigInteger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

/**
 * Token ownership rows shared by the collection facets. All methods run on the caller's transaction.
 */
final class NftTokens {
    private NftTokens() {
    }

    static void ensureSchema(Connection c) throws SQLException {
        try (Statement st = c.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS nft_tokens (
                        token_id TEXT PRIMARY KEY,
                        owner TEXT NOT NULL,
                        minted_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS nft_mint_sequence (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        minted_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_nft_tokens_owner ON nft_tokens(owner)");
        }
    }

    static Optional<String> ownerOf(Connection c, BigInteger tokenId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT owner FROM nft_tokens WHERE token_id=?")) {
            ps.setString(1, tokenId.toString());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        }
    }

    static long balanceOf(Connection c, String owner) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM nft_tokens WHERE owner=?")) {
            ps.setString(1, owner);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    /**
     * Mints the next sequence id to {@code owner}. Ids already taken by bridged-in tokens are skipped.
     */
    static BigInteger mintNext(Connection c, String owner, long nowMs) throws SQLException {
        BigInteger tokenId;
        do {
            tokenId = nextTokenId(c, nowMs);
        } while (!insert(c, tokenId, owner, nowMs));
        return tokenId;
    }

    private static BigInteger nextTokenId(Connection c, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("INSERT INTO nft_mint_sequence(minted_at_ms) VALUES(?)")) {
            ps.setLong(1, nowMs);
            ps.executeUpdate();
        }
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            return BigInteger.valueOf(rs.getLong(1));
        }
    }

    /**
     * @return {@code false} when the token id already exists
     */
    static boolean insert(Connection c, BigInteger tokenId, String owner, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT OR IGNORE INTO nft_tokens(token_id,owner,minted_at_ms) VALUES(?,?,?)")) {
            ps.setString(1, tokenId.toString());
            ps.setString(2, owner);
            ps.setLong(3, nowMs);
            return ps.executeUpdate() == 1;
        }
    }

    static boolean delete(Connection c, BigInteger tokenId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM nft_tokens WHERE token_id=?")) {
            ps.setString(1, tokenId.toString());
            return ps.executeUpdate() == 1;
        }
    }
}
