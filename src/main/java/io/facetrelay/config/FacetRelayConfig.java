package io.facetrelay.config;

import io.facetrelay.util.Addresses;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class FacetRelayConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_NAMESPACES_DIR = "namespaces";
    public static final String SETTINGS_FILE = "facetrelay-settings.json";
    public static final long DEFAULT_CHAIN_SELECTOR = 1L;
    public static final long DEFAULT_GAS_LIMIT = 200_000L;
    public static final long DEFAULT_BASE_FEE = 1_000L;
    public static final long DEFAULT_FEE_PER_BYTE = 10L;
    public static final int DEFAULT_MAX_PAYLOAD_BYTES = 64 * 1024;
    public static final int DEFAULT_FAILED_PAGE_SIZE = 50;

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String namespace;

    public FacetRelayConfig(Path rootDir, Path rootBaseDir, String namespace) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.namespace = namespace;
    }

    public static FacetRelayConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static FacetRelayConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = sanitizeNamespace(namespace);
        Path scoped = DEFAULT_NAMESPACE.equals(safeNamespace)
                ? base
                : base.resolve(DEFAULT_NAMESPACES_DIR).resolve(safeNamespace);
        return new FacetRelayConfig(scoped, base, safeNamespace);
    }

    private static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        if (value.isBlank()) {
            return DEFAULT_NAMESPACE;
        }
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public String namespace() {
        return namespace;
    }

    /**
     * Address used when the settings file does not pin one; stable per data root.
     */
    public String defaultUnitAddress() {
        return Addresses.fromSeed("facetrelay-unit:" + rootDir);
    }

    public String defaultRouterAddress() {
        return Addresses.fromSeed("facetrelay-router:" + relaySpoolDir());
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path dbFile() {
        return rootDir.resolve("facetrelay.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path relaySpoolDir() {
        return rootBaseDir.resolve("relay");
    }
}
