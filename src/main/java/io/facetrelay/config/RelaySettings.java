package io.facetrelay.config;

import io.facetrelay.util.Addresses;
import io.facetrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Effective runtime settings, resolved from {@code facetrelay-settings.json} over defaults.
 */
public record RelaySettings(
        String unitAddress,
        long chainSelector,
        String routerAddress,
        String relaySpoolDir,
        long baseFee,
        long feePerByte,
        long gasLimit,
        int maxPayloadBytes,
        boolean retryRequiresAdmin
) {
    public static RelaySettings defaults(FacetRelayConfig config) {
        return new RelaySettings(
                config.defaultUnitAddress(),
                FacetRelayConfig.DEFAULT_CHAIN_SELECTOR,
                config.defaultRouterAddress(),
                config.relaySpoolDir().toString(),
                FacetRelayConfig.DEFAULT_BASE_FEE,
                FacetRelayConfig.DEFAULT_FEE_PER_BYTE,
                FacetRelayConfig.DEFAULT_GAS_LIMIT,
                FacetRelayConfig.DEFAULT_MAX_PAYLOAD_BYTES,
                true
        );
    }

    public static RelaySettings load(FacetRelayConfig config) {
        RelaySettings defaults = defaults(config);
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(parsed, defaults, config);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load relay settings: " + file, e);
        }
    }

    static RelaySettings fromFile(SettingsFile file, RelaySettings defaults, FacetRelayConfig config) {
        if (file == null) {
            return defaults;
        }
        String unitAddress = sanitizeAddress(file.unitAddress(), defaults.unitAddress());
        long chainSelector = file.chainSelector() == null || file.chainSelector().isBlank()
                ? defaults.chainSelector()
                : Long.parseUnsignedLong(file.chainSelector().trim());
        String spoolDir = file.relaySpoolDir() == null || file.relaySpoolDir().isBlank()
                ? defaults.relaySpoolDir()
                : config.rootDir().resolve(file.relaySpoolDir().trim()).normalize().toString();
        String routerAddress = sanitizeAddress(
                file.routerAddress(),
                file.relaySpoolDir() == null || file.relaySpoolDir().isBlank()
                        ? defaults.routerAddress()
                        : Addresses.fromSeed("facetrelay-router:" + Path.of(spoolDir))
        );
        long baseFee = sanitizeLong(file.baseFee(), defaults.baseFee(), 0L);
        long feePerByte = sanitizeLong(file.feePerByte(), defaults.feePerByte(), 0L);
        long gasLimit = sanitizeLong(file.gasLimit(), defaults.gasLimit(), 21_000L);
        int maxPayloadBytes = file.maxPayloadBytes() == null
                ? defaults.maxPayloadBytes()
                : Math.max(4, file.maxPayloadBytes());
        boolean retryRequiresAdmin = file.retryRequiresAdmin() == null
                ? defaults.retryRequiresAdmin()
                : file.retryRequiresAdmin();
        return new RelaySettings(
                unitAddress,
                chainSelector,
                routerAddress,
                spoolDir,
                baseFee,
                feePerByte,
                gasLimit,
                maxPayloadBytes,
                retryRequiresAdmin
        );
    }

    public List<String> diff(RelaySettings other) {
        List<String> changed = new ArrayList<>();
        if (other == null) {
            return changed;
        }
        if (!unitAddress.equals(other.unitAddress)) changed.add("unitAddress");
        if (chainSelector != other.chainSelector) changed.add("chainSelector");
        if (!routerAddress.equals(other.routerAddress)) changed.add("routerAddress");
        if (!relaySpoolDir.equals(other.relaySpoolDir)) changed.add("relaySpoolDir");
        if (baseFee != other.baseFee) changed.add("baseFee");
        if (feePerByte != other.feePerByte) changed.add("feePerByte");
        if (gasLimit != other.gasLimit) changed.add("gasLimit");
        if (maxPayloadBytes != other.maxPayloadBytes) changed.add("maxPayloadBytes");
        if (retryRequiresAdmin != other.retryRequiresAdmin) changed.add("retryRequiresAdmin");
        return changed;
    }

    private static String sanitizeAddress(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return Addresses.normalize(raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            String unitAddress,
            String chainSelector,
            String routerAddress,
            String relaySpoolDir,
            Long baseFee,
            Long feePerByte,
            Long gasLimit,
            Integer maxPayloadBytes,
            Boolean retryRequiresAdmin
    ) {
    }
}
