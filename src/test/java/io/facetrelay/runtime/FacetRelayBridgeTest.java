package io.facetrelay.runtime;

import io.facetrelay.codec.CallData;
import io.facetrelay.config.FacetRelayConfig;
import io.facetrelay.error.RelayError;
import io.facetrelay.error.RelayException;
import io.facetrelay.facet.NftBridgeFacet;
import io.facetrelay.facet.NftFacet;
import io.facetrelay.router.FeeWallet;
import io.facetrelay.router.FileRelayRouter;
import io.facetrelay.util.Addresses;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class FacetRelayBridgeTest {
    private static final String ADMIN = "0x" + "a".repeat(40);
    private static final String ALICE = "0x" + "1".repeat(40);
    private static final String STRANGER = "0x" + "d".repeat(40);

    @Test
    void tokenMovesBetweenUnitsSharingASpool() throws Exception {
        Path base = Files.createTempDirectory("facetrelay-test-bridge-");
        try {
            Path spool = base.resolve("shared-relay");
            FacetRelayRuntime unitA = newUnit(base.resolve("a"), "11", spool);
            FacetRelayRuntime unitB = newUnit(base.resolve("b"), "22", spool);
            Assertions.assertEquals(unitA.settings().routerAddress(), unitB.settings().routerAddress());
            Assertions.assertNotEquals(unitA.unitAddress(), unitB.unitAddress());

            unitA.setDestinationAllowed(ADMIN, 22L, true);
            unitA.fund(FeeWallet.NATIVE, BigInteger.valueOf(10_000_000));
            unitB.setSourceAllowed(ADMIN, 11L, true);
            unitB.setSenderAllowed(ADMIN, 11L, unitA.unitAddress(), true);

            unitA.call(ADMIN, CallData.encode(NftFacet.MINT, ALICE));
            FacetRelayRuntime.CallOutcome transfer = unitA.call(ALICE, CallData.encode(
                    NftBridgeFacet.CROSS_CHAIN_TRANSFER, 22L, unitB.unitAddress(), 1, Addresses.ZERO));
            Assertions.assertTrue(transfer.output().contains("\"message_id\":\"0x"));

            RelayException burned = Assertions.assertThrows(RelayException.class,
                    () -> unitA.call(STRANGER, CallData.encode(NftFacet.OWNER_OF, 1)));
            Assertions.assertEquals(RelayError.FACET_CALL_FAILED, burned.error());
            Assertions.assertTrue(unitA.wallet().balanceOf(FeeWallet.NATIVE).compareTo(BigInteger.valueOf(10_000_000)) < 0);

            FileRelayRouter.DeliverySummary summary = unitB.deliverPending(10);

            Assertions.assertEquals(1, summary.applied());
            Assertions.assertEquals(0, summary.rejected());
            Assertions.assertEquals("{\"owner\":\"" + ALICE + "\"}",
                    unitB.call(STRANGER, CallData.encode(NftFacet.OWNER_OF, 1)).output());
            Assertions.assertEquals(0, unitB.deliverPending(10).delivered());
        } finally {
            deleteRecursively(base);
        }
    }

    @Test
    void failedSendKeepsTheTokenAtHome() throws Exception {
        Path base = Files.createTempDirectory("facetrelay-test-bridge-");
        try {
            Path spool = base.resolve("shared-relay");
            FacetRelayRuntime unitA = newUnit(base.resolve("a"), "11", spool);
            unitA.fund(FeeWallet.NATIVE, BigInteger.valueOf(10_000_000));
            unitA.call(ADMIN, CallData.encode(NftFacet.MINT, ALICE));

            RelayException e = Assertions.assertThrows(RelayException.class, () -> unitA.call(ALICE, CallData.encode(
                    NftBridgeFacet.CROSS_CHAIN_TRANSFER, 22L, ADMIN, 1, Addresses.ZERO)));

            Assertions.assertEquals(RelayError.DESTINATION_CHAIN_NOT_ALLOWLISTED, e.error());
            Assertions.assertEquals("{\"owner\":\"" + ALICE + "\"}",
                    unitA.call(STRANGER, CallData.encode(NftFacet.OWNER_OF, 1)).output());
            Assertions.assertEquals(BigInteger.valueOf(10_000_000), unitA.wallet().balanceOf(FeeWallet.NATIVE));
        } finally {
            deleteRecursively(base);
        }
    }

    @Test
    void deliveryFromUnknownSenderIsRejectedAndSetAside() throws Exception {
        Path base = Files.createTempDirectory("facetrelay-test-bridge-");
        try {
            Path spool = base.resolve("shared-relay");
            FacetRelayRuntime unitA = newUnit(base.resolve("a"), "11", spool);
            FacetRelayRuntime unitB = newUnit(base.resolve("b"), "22", spool);
            unitA.setDestinationAllowed(ADMIN, 22L, true);
            unitA.fund(FeeWallet.NATIVE, BigInteger.valueOf(10_000_000));
            unitB.setSourceAllowed(ADMIN, 11L, true);
            unitA.sendText(ADMIN, 22L, unitB.unitAddress(), "hello", null, null, null);

            FileRelayRouter.DeliverySummary summary = unitB.deliverPending(10);

            Assertions.assertEquals(1, summary.rejected());
            Assertions.assertTrue(summary.records().get(0).error().startsWith("SenderNotAllowed"));
            try (Stream<Path> rejected = Files.list(spool.resolve("22").resolve("rejected"))) {
                Assertions.assertEquals(1L, rejected.count());
            }
        } finally {
            deleteRecursively(base);
        }
    }

    private static FacetRelayRuntime newUnit(Path root, String chainSelector, Path spool) throws IOException {
        Files.createDirectories(root);
        Files.writeString(root.resolve("facetrelay-settings.json"), """
                {
                  "chainSelector": "%s",
                  "relaySpoolDir": "%s"
                }
                """.formatted(chainSelector, spool.toAbsolutePath().toString().replace("\\", "/")), StandardCharsets.UTF_8);
        FacetRelayRuntime runtime = new FacetRelayRuntime(FacetRelayConfig.fromRoot(root.toString()));
        runtime.init();
        runtime.initialize(ADMIN, "Relay", "RLY", "ipfs://base/", null, null);
        return runtime;
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
