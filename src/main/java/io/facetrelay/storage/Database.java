package io.facetrelay.storage;

import io.facetrelay.config.FacetRelayConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * SQLite access for one unit. {@link #inTransaction} binds a unit of work to the calling
 * thread; while bound, {@link #withConnection} and {@link #withTransaction} run on that
 * unit's connection and leave commit, rollback and close to it.
 */
public final class Database implements TransactionHooks {
    private static final String MIGRATION_SCHEMA_VERSION = "facetrelay.schema.migration.v1";
    private final FacetRelayConfig config;
    private final String jdbcUrl;
    private final ThreadLocal<UnitOfWork> bound = new ThreadLocal<>();
    private final AtomicLong completionFailures = new AtomicLong(0L);
    private volatile String lastCompletionFailure = "";

    public Database(FacetRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public String namespace() {
        return config.namespace();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public boolean inTransaction() {
        return bound.get() != null;
    }

    /**
     * Runs {@code work} on the bound unit of work's connection, or on a connection opened and
     * closed for this call.
     */
    public <T> T withConnection(SqlWork<T> work) throws SQLException {
        UnitOfWork unit = bound.get();
        if (unit != null) {
            return work.run(unit.connection);
        }
        try (Connection c = openRawConnection()) {
            return work.run(c);
        }
    }

    /**
     * Runs {@code work} atomically. Inside a bound unit of work it joins that transaction;
     * otherwise it commits on return and rolls back on any exception.
     */
    public <T> T withTransaction(SqlWork<T> work) throws SQLException {
        UnitOfWork unit = bound.get();
        if (unit != null) {
            return work.run(unit.connection);
        }
        try (Connection c = openRawConnection()) {
            c.setAutoCommit(false);
            try {
                T result = work.run(c);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            }
        }
    }

    public <T> T inTransaction(TransactionWork<T> work) {
        return inTransaction(work, result -> true);
    }

    /**
     * Runs {@code work} in one transaction, committing only when {@code commitIf} accepts the
     * result. A nested call joins the outer unit of work and leaves the decision to it.
     * Completion hooks run after the outcome is final and cannot change it.
     */
    public <T> T inTransaction(TransactionWork<T> work, Predicate<T> commitIf) {
        UnitOfWork outer = bound.get();
        if (outer != null) {
            try {
                return work.run(outer.connection);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new RuntimeException("Transactional work failed", e);
            }
        }
        Connection raw;
        try {
            raw = openRawConnection();
            raw.setAutoCommit(false);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to begin transaction", e);
        }
        UnitOfWork unit = new UnitOfWork(raw);
        bound.set(unit);
        boolean committed = false;
        try {
            T result = work.run(raw);
            if (commitIf.test(result)) {
                raw.commit();
                committed = true;
            } else {
                raw.rollback();
            }
            return result;
        } catch (Exception e) {
            rollbackQuietly(raw, e);
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new RuntimeException("Transactional work failed", e);
        } finally {
            bound.remove();
            closeQuietly(raw);
            unit.complete(committed);
        }
    }

    @Override
    public void afterCompletion(Runnable onCommit, Runnable onRollback) {
        UnitOfWork work = bound.get();
        if (work == null) {
            onCommit.run();
            return;
        }
        work.onCommit.add(onCommit);
        work.onRollback.add(onRollback);
    }

    /**
     * Counts a side effect that failed after its transaction had already reached its outcome.
     */
    public void recordCompletionFailure(String stage, RuntimeException error) {
        completionFailures.incrementAndGet();
        String message = error.getMessage();
        lastCompletionFailure = stage + ": " + error.getClass().getSimpleName()
                + (message == null || message.isBlank() ? "" : ": " + message);
    }

    public long completionFailures() {
        return completionFailures.get();
    }

    public String lastCompletionFailure() {
        return lastCompletionFailure;
    }

    private Connection openRawConnection() throws SQLException {
        Connection c = DriverManager.getConnection(jdbcUrl);
        try (Statement st = c.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
        }
        return c;
    }

    private void rollbackQuietly(Connection raw, Exception cause) {
        try {
            raw.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private void closeQuietly(Connection raw) {
        try {
            raw.close();
        } catch (SQLException e) {
            recordCompletionFailure("close", new RuntimeException("Failed to close transaction connection", e));
        }
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.securityRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openRawConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS unit_state (
                        state_key TEXT PRIMARY KEY,
                        state_value TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS roles (
                        role TEXT NOT NULL,
                        account TEXT NOT NULL,
                        granted_by TEXT NOT NULL,
                        granted_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(role, account)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS allowed_destination_chains (
                        chain_selector TEXT PRIMARY KEY,
                        updated_by TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS allowed_source_chains (
                        chain_selector TEXT PRIMARY KEY,
                        updated_by TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS allowed_senders (
                        chain_selector TEXT NOT NULL,
                        sender TEXT NOT NULL,
                        updated_by TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(chain_selector, sender)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS failed_messages (
                        message_id TEXT PRIMARY KEY,
                        namespace TEXT NOT NULL DEFAULT 'default',
                        error_code TEXT NOT NULL,
                        reason TEXT NOT NULL,
                        source_chain TEXT NOT NULL,
                        sender TEXT NOT NULL,
                        data_b64 TEXT NOT NULL,
                        token_amounts TEXT NOT NULL,
                        attempts INTEGER NOT NULL,
                        failed_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS recovered_messages (
                        message_id TEXT NOT NULL,
                        namespace TEXT NOT NULL DEFAULT 'default',
                        recovered_by TEXT NOT NULL,
                        attempts INTEGER NOT NULL,
                        recovered_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS wallet_balances (
                        asset TEXT PRIMARY KEY,
                        amount TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS wallet_allowances (
                        asset TEXT NOT NULL,
                        spender TEXT NOT NULL,
                        amount TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(asset, spender)
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_failed_messages_failed_at ON failed_messages(failed_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_recovered_messages_id ON recovered_messages(message_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_roles_account ON roles(account)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20260301_001_ledger_namespace_indexes",
                "Add namespace indexes for failure ledger and recovery trail",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_failed_messages_namespace ON failed_messages(namespace, failed_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_recovered_messages_namespace ON recovered_messages(namespace, recovered_at_ms)"
                )
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    @FunctionalInterface
    public interface TransactionWork<T> {
        T run(Connection connection) throws Exception;
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    private final class UnitOfWork {
        private final Connection connection;
        private final List<Runnable> onCommit = new ArrayList<>();
        private final List<Runnable> onRollback = new ArrayList<>();

        private UnitOfWork(Connection connection) {
            this.connection = connection;
        }

        private void complete(boolean committed) {
            for (Runnable action : committed ? onCommit : onRollback) {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    recordCompletionFailure(committed ? "after-commit" : "after-rollback", e);
                }
            }
        }
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openRawConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
