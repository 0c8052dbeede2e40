package io.facetrelay.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class RelaySettingsTest {

    @Test
    void defaultsApplyWithoutSettingsFile() throws Exception {
        Path root = Files.createTempDirectory("facetrelay-test-settings-");
        try {
            FacetRelayConfig config = FacetRelayConfig.fromRoot(root.toString());
            RelaySettings settings = RelaySettings.load(config);

            Assertions.assertEquals(RelaySettings.defaults(config), settings);
            Assertions.assertEquals(FacetRelayConfig.DEFAULT_CHAIN_SELECTOR, settings.chainSelector());
            Assertions.assertEquals(config.relaySpoolDir().toString(), settings.relaySpoolDir());
            Assertions.assertTrue(settings.retryRequiresAdmin());
            Assertions.assertTrue(settings.unitAddress().matches("^0x[0-9a-f]{40}$"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesAreSanitizedAndRelativeSpoolResolvesAgainstRoot() throws Exception {
        Path root = Files.createTempDirectory("facetrelay-test-settings-");
        try {
            Files.writeString(root.resolve("facetrelay-settings.json"), """
                    {
                      "unitAddress": "0xABCDEFABCDEFABCDEFABCDEFABCDEFABCDEFABCD",
                      "chainSelector": "22",
                      "relaySpoolDir": "../shared-relay",
                      "gasLimit": 10,
                      "maxPayloadBytes": 1,
                      "baseFee": -4
                    }
                    """, StandardCharsets.UTF_8);
            FacetRelayConfig config = FacetRelayConfig.fromRoot(root.toString());

            RelaySettings settings = RelaySettings.load(config);

            Assertions.assertEquals("0xabcdefabcdefabcdefabcdefabcdefabcdefabcd", settings.unitAddress());
            Assertions.assertEquals(22L, settings.chainSelector());
            Assertions.assertEquals(root.getParent().resolve("shared-relay").toAbsolutePath().normalize().toString(),
                    settings.relaySpoolDir());
            Assertions.assertEquals(21_000L, settings.gasLimit());
            Assertions.assertEquals(4, settings.maxPayloadBytes());
            Assertions.assertEquals(0L, settings.baseFee());
            Assertions.assertNotEquals(RelaySettings.defaults(config).routerAddress(), settings.routerAddress());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidFileFailsLoudly() throws Exception {
        Path root = Files.createTempDirectory("facetrelay-test-settings-");
        try {
            Files.writeString(root.resolve("facetrelay-settings.json"), "{ not json", StandardCharsets.UTF_8);
            FacetRelayConfig config = FacetRelayConfig.fromRoot(root.toString());

            Assertions.assertThrows(RuntimeException.class, () -> RelaySettings.load(config));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
