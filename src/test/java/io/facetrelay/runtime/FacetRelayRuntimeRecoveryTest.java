package io.facetrelay.runtime;

import io.facetrelay.codec.CallData;
import io.facetrelay.config.FacetRelayConfig;
import io.facetrelay.error.RelayError;
import io.facetrelay.error.RelayException;
import io.facetrelay.facet.NftBridgeFacet;
import io.facetrelay.facet.NftFacet;
import io.facetrelay.model.InboundMessage;
import io.facetrelay.model.MessageErrorCode;
import io.facetrelay.model.ReceiveStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class FacetRelayRuntimeRecoveryTest {
    private static final String ADMIN = "0x" + "a".repeat(40);
    private static final String ALICE = "0x" + "1".repeat(40);
    private static final String BOB = "0x" + "b".repeat(40);
    private static final String REMOTE_UNIT = "0x" + "c".repeat(40);
    private static final String STRANGER = "0x" + "d".repeat(40);
    private static final long SOURCE = 11L;

    @Test
    void retryWithReplacementPayloadRecoversExactlyOnce() throws Exception {
        Path root = Files.createTempDirectory("facetrelay-test-recovery-");
        try {
            FacetRelayRuntime runtime = newRuntime(root);
            InboundMessage failing = message(1, CallData.encode(NftFacet.BURN, 99));
            Assertions.assertEquals(ReceiveStatus.FAILED,
                    runtime.ccipReceive(runtime.settings().routerAddress(), failing).status());

            FacetRelayRuntime.RetryOutcome recovered = runtime.retryFailedMessage(ADMIN, failing.messageId(),
                    CallData.encode(NftBridgeFacet.CROSS_CHAIN_MINT, BOB, 7));

            Assertions.assertTrue(recovered.recovered());
            Assertions.assertEquals(MessageErrorCode.RESOLVED, runtime.errorCodeOf(failing.messageId()));
            Assertions.assertEquals("{\"owner\":\"" + BOB + "\"}",
                    runtime.call(STRANGER, CallData.encode(NftFacet.OWNER_OF, 7)).output());

            RelayException second = Assertions.assertThrows(RelayException.class,
                    () -> runtime.retryFailedMessage(ADMIN, failing.messageId(),
                            CallData.encode(NftBridgeFacet.CROSS_CHAIN_MINT, BOB, 8)));
            Assertions.assertEquals(RelayError.MESSAGE_NOT_FAILED, second.error());
            Assertions.assertEquals("{\"balance\":\"1\"}",
                    runtime.call(STRANGER, CallData.encode(NftFacet.BALANCE_OF, BOB)).output());

            FacetRelayRuntime.StatsOutcome stats = runtime.stats();
            Assertions.assertEquals(0, stats.pendingFailures());
            Assertions.assertEquals(1, stats.recoveredRecords());
            Assertions.assertEquals(1L, stats.recoveredTotal());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void retryWithoutPayloadReappliesTheStoredMessage() throws Exception {
        Path root = Files.createTempDirectory("facetrelay-test-recovery-");
        try {
            FacetRelayRuntime runtime = newRuntime(root);
            Assertions.assertEquals("{\"token_id\":\"1\"}",
                    runtime.call(ADMIN, CallData.encode(NftFacet.MINT, ALICE)).output());
            InboundMessage blocked = message(2, CallData.encode(NftBridgeFacet.CROSS_CHAIN_MINT, BOB, 1));

            FacetRelayRuntime.ReceiveOutcome outcome = runtime.ccipReceive(runtime.settings().routerAddress(), blocked);
            Assertions.assertEquals(ReceiveStatus.FAILED, outcome.status());
            Assertions.assertTrue(outcome.reason().contains("already exists"));

            FacetRelayRuntime.RetryOutcome stillBlocked = runtime.retryFailedMessage(ADMIN, blocked.messageId(), null);
            Assertions.assertFalse(stillBlocked.recovered());
            Assertions.assertEquals(2, stillBlocked.attempts());
            Assertions.assertEquals(2, runtime.failedMessage(blocked.messageId()).orElseThrow().attempts());

            runtime.call(ALICE, CallData.encode(NftFacet.BURN, 1));
            FacetRelayRuntime.RetryOutcome recovered = runtime.retryFailedMessage(ADMIN, blocked.messageId(), null);

            Assertions.assertTrue(recovered.recovered());
            Assertions.assertEquals("{\"owner\":\"" + BOB + "\"}",
                    runtime.call(STRANGER, CallData.encode(NftFacet.OWNER_OF, 1)).output());
            Assertions.assertTrue(runtime.failedMessages(0, 10).isEmpty());
            Assertions.assertEquals(1L, runtime.stats().retryFailedTotal());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void retryIsAdminGatedUnlessSettingsOpenIt() throws Exception {
        Path root = Files.createTempDirectory("facetrelay-test-recovery-");
        try {
            FacetRelayRuntime runtime = newRuntime(root);
            InboundMessage failing = message(3, CallData.encode(NftFacet.BURN, 5));
            runtime.ccipReceive(runtime.settings().routerAddress(), failing);

            RelayException denied = Assertions.assertThrows(RelayException.class,
                    () -> runtime.retryFailedMessage(STRANGER, failing.messageId(), null));
            Assertions.assertEquals(RelayError.UNAUTHORIZED, denied.error());

            RelayException unknown = Assertions.assertThrows(RelayException.class,
                    () -> runtime.retryFailedMessage(ADMIN, message(4, new byte[0]).messageId(), null));
            Assertions.assertEquals(RelayError.MESSAGE_NOT_FAILED, unknown.error());

            Files.writeString(root.resolve("facetrelay-settings.json"), """
                    {
                      "retryRequiresAdmin": false
                    }
                    """, StandardCharsets.UTF_8);
            FacetRelayRuntime.SettingsReloadOutcome reload = runtime.reloadSettings();
            Assertions.assertEquals(List.of("retryRequiresAdmin"), reload.changedFields());

            FacetRelayRuntime.RetryOutcome retried = runtime.retryFailedMessage(STRANGER, failing.messageId(),
                    CallData.encode(NftBridgeFacet.CROSS_CHAIN_MINT, STRANGER, 5));
            Assertions.assertTrue(retried.recovered());
        } finally {
            deleteRecursively(root);
        }
    }

    private static FacetRelayRuntime newRuntime(Path root) {
        FacetRelayRuntime runtime = new FacetRelayRuntime(FacetRelayConfig.fromRoot(root.toString()));
        runtime.init();
        runtime.initialize(ADMIN, "Relay", "RLY", "ipfs://base/", null, null);
        runtime.setSourceAllowed(ADMIN, SOURCE, true);
        runtime.setSenderAllowed(ADMIN, SOURCE, REMOTE_UNIT, true);
        return runtime;
    }

    private static InboundMessage message(int seed, byte[] data) {
        return new InboundMessage("0x" + String.format("%064x", seed), SOURCE, REMOTE_UNIT, data, List.of());
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
