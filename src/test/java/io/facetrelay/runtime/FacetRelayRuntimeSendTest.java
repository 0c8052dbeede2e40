package io.facetrelay.runtime;

import io.facetrelay.config.FacetRelayConfig;
import io.facetrelay.error.RelayError;
import io.facetrelay.error.RelayException;
import io.facetrelay.model.OutboundMessage;
import io.facetrelay.router.FeeWallet;
import io.facetrelay.router.RelayRouter;
import io.facetrelay.storage.RoleStore;
import io.facetrelay.util.Addresses;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class FacetRelayRuntimeSendTest {
    private static final String ADMIN = "0x" + "a".repeat(40);
    private static final String OUTSIDER = "0x" + "9".repeat(40);
    private static final String RECEIVER = "0x" + "b".repeat(40);
    private static final String LINK = "0x" + "f".repeat(40);

    @Test
    void sendsOnlyToAllowlistedDestinations() throws Exception {
        Path root = Files.createTempDirectory("facetrelay-test-send-");
        try {
            FacetRelayRuntime runtime = new FacetRelayRuntime(FacetRelayConfig.fromRoot(root.toString()));
            runtime.init();
            runtime.initialize(ADMIN, "Relay", "RLY", "ipfs://base/", null, null);
            runtime.setDestinationAllowed(ADMIN, 7L, true);
            runtime.fund(FeeWallet.NATIVE, BigInteger.valueOf(1_000_000));

            FacetRelayRuntime.SendOutcome sent = runtime.sendText(ADMIN, 7L, RECEIVER, "hello", null, null, null);

            Assertions.assertTrue(sent.messageId().matches("^0x[0-9a-f]{64}$"));
            Assertions.assertEquals("7", sent.destinationChain());
            Assertions.assertEquals(Addresses.ZERO, sent.feeToken());
            BigInteger fee = new BigInteger(sent.fee());
            Assertions.assertEquals(BigInteger.valueOf(1_000_000).subtract(fee), runtime.wallet().balanceOf(FeeWallet.NATIVE));
            Assertions.assertEquals(fee, runtime.quoteFee(7L, RECEIVER,
                    "hello".getBytes(StandardCharsets.UTF_8), null, null, null));

            RelayException denied = Assertions.assertThrows(RelayException.class,
                    () -> runtime.sendText(ADMIN, 9L, RECEIVER, "hello", null, null, null));
            Assertions.assertEquals(RelayError.DESTINATION_CHAIN_NOT_ALLOWLISTED, denied.error());
            Assertions.assertTrue(denied.getMessage().startsWith("DestinationChainNotAllowlisted"));
            Assertions.assertEquals(BigInteger.valueOf(1_000_000).subtract(fee), runtime.wallet().balanceOf(FeeWallet.NATIVE));

            FacetRelayRuntime.StatsOutcome stats = runtime.stats();
            Assertions.assertEquals(1L, stats.sentTotal());
            Assertions.assertEquals(1L, stats.rejectedTotal());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void uninitializedUnitCannotSend() throws Exception {
        Path root = Files.createTempDirectory("facetrelay-test-send-");
        try {
            FacetRelayRuntime runtime = new FacetRelayRuntime(FacetRelayConfig.fromRoot(root.toString()));
            runtime.init();

            RelayException e = Assertions.assertThrows(RelayException.class,
                    () -> runtime.sendText(ADMIN, 7L, RECEIVER, "hello", null, null, null));
            Assertions.assertEquals(RelayError.NOT_INITIALIZED, e.error());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void insufficientBalanceLeavesWalletUntouched() throws Exception {
        Path root = Files.createTempDirectory("facetrelay-test-send-");
        try {
            FacetRelayRuntime runtime = new FacetRelayRuntime(FacetRelayConfig.fromRoot(root.toString()));
            runtime.init();
            runtime.initialize(ADMIN, "Relay", "RLY", "", null, null);
            runtime.setDestinationAllowed(ADMIN, 7L, true);
            runtime.fund(FeeWallet.NATIVE, BigInteger.valueOf(10));

            RelayException e = Assertions.assertThrows(RelayException.class,
                    () -> runtime.sendText(ADMIN, 7L, RECEIVER, "hello", null, null, null));

            Assertions.assertEquals(RelayError.INSUFFICIENT_BALANCE, e.error());
            Assertions.assertEquals(BigInteger.TEN, runtime.wallet().balanceOf(FeeWallet.NATIVE));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void routerFailureRollsBackFeeDebitAndApproval() throws Exception {
        Path root = Files.createTempDirectory("facetrelay-test-send-");
        try {
            FailingRouter router = new FailingRouter();
            FacetRelayRuntime runtime = new FacetRelayRuntime(FacetRelayConfig.fromRoot(root.toString()), router);
            runtime.init();
            runtime.initialize(ADMIN, "Relay", "RLY", "", router.address(), LINK);
            runtime.setDestinationAllowed(ADMIN, 7L, true);
            runtime.fund(FeeWallet.NATIVE, BigInteger.valueOf(5_000));
            runtime.fund(LINK, BigInteger.valueOf(5_000));

            RelayException tokenFailure = Assertions.assertThrows(RelayException.class,
                    () -> runtime.sendText(ADMIN, 7L, RECEIVER, "hello", null, null, null));
            Assertions.assertEquals(RelayError.RELAY_SUBMISSION_FAILED, tokenFailure.error());
            Assertions.assertEquals(BigInteger.valueOf(5_000), runtime.wallet().balanceOf(LINK));
            Assertions.assertEquals(BigInteger.ZERO, runtime.wallet().allowance(LINK, router.address()));

            RelayException nativeFailure = Assertions.assertThrows(RelayException.class,
                    () -> runtime.sendText(ADMIN, 7L, RECEIVER, "hello", null, null, Addresses.ZERO));
            Assertions.assertEquals(RelayError.RELAY_SUBMISSION_FAILED, nativeFailure.error());
            Assertions.assertEquals(BigInteger.valueOf(5_000), runtime.wallet().balanceOf(FeeWallet.NATIVE));
            Assertions.assertEquals(2, router.attempts);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void configurationRequiresAdminRole() throws Exception {
        Path root = Files.createTempDirectory("facetrelay-test-send-");
        try {
            FacetRelayRuntime runtime = new FacetRelayRuntime(FacetRelayConfig.fromRoot(root.toString()));
            runtime.init();
            runtime.initialize(ADMIN, "Relay", "RLY", "", null, null);

            RelayException again = Assertions.assertThrows(RelayException.class,
                    () -> runtime.initialize(OUTSIDER, "Other", "OTH", "", null, null));
            Assertions.assertEquals(RelayError.ALREADY_INITIALIZED, again.error());

            RelayException denied = Assertions.assertThrows(RelayException.class,
                    () -> runtime.setDestinationAllowed(OUTSIDER, 7L, true));
            Assertions.assertEquals(RelayError.UNAUTHORIZED, denied.error());
            Assertions.assertFalse(runtime.isDestinationAllowed(7L));

            FacetRelayRuntime.AllowlistUpdateOutcome first = runtime.setSenderAllowed(ADMIN, 11L, RECEIVER, true);
            FacetRelayRuntime.AllowlistUpdateOutcome second = runtime.setSenderAllowed(ADMIN, 11L, RECEIVER, true);
            Assertions.assertTrue(first.changed());
            Assertions.assertFalse(second.changed());
            Assertions.assertEquals(List.of("11:" + RECEIVER), runtime.allowlist().senders());

            runtime.grantRole(ADMIN, RoleStore.ADMIN_ROLE, OUTSIDER);
            runtime.setDestinationAllowed(OUTSIDER, 7L, true);
            Assertions.assertTrue(runtime.isDestinationAllowed(7L));

            FacetRelayRuntime.RouterUpdateOutcome router = runtime.setRouter(ADMIN, RECEIVER);
            Assertions.assertTrue(router.changed());
            Assertions.assertEquals(RECEIVER, runtime.registeredRouter().orElseThrow());
        } finally {
            deleteRecursively(root);
        }
    }

    private static final class FailingRouter implements RelayRouter {
        private int attempts;

        @Override
        public String address() {
            return "0x" + "e".repeat(40);
        }

        @Override
        public boolean isChainSupported(long chainSelector) {
            return true;
        }

        @Override
        public BigInteger getFee(long destinationChainSelector, OutboundMessage message) {
            return BigInteger.valueOf(500);
        }

        @Override
        public String send(long sourceChainSelector, long destinationChainSelector, String sender,
                           OutboundMessage message, FeeWallet payer, BigInteger nativeValue) {
            attempts++;
            if (Addresses.isZero(message.feeToken())) {
                payer.payNative(BigInteger.valueOf(500));
            } else {
                payer.transferFrom(message.feeToken(), address(), BigInteger.valueOf(500));
            }
            throw new IllegalStateException("relay offline");
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
