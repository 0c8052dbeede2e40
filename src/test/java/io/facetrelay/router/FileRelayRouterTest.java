package io.facetrelay.router;

import io.facetrelay.codec.MessageCodec;
import io.facetrelay.error.RelayError;
import io.facetrelay.error.RelayException;
import io.facetrelay.model.InboundMessage;
import io.facetrelay.model.OutboundMessage;
import io.facetrelay.model.ReceiveStatus;
import io.facetrelay.storage.TransactionHooks;
import io.facetrelay.util.Addresses;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

final class FileRelayRouterTest {
    private static final String ROUTER = "0x" + "e".repeat(40);
    private static final String SENDER = "0x" + "a".repeat(40);
    private static final String RECEIVER = "0x" + "b".repeat(40);
    private static final String LINK = "0x" + "f".repeat(40);
    private static final TransactionHooks IMMEDIATE = (onCommit, onRollback) -> onCommit.run();

    private final MessageCodec codec = new MessageCodec(200_000L, 4096);

    @Test
    void feeGrowsWithPayloadSize() throws Exception {
        Path spool = Files.createTempDirectory("facetrelay-test-spool-");
        try {
            FileRelayRouter router = newRouter(spool, IMMEDIATE, Set.of());
            BigInteger small = router.getFee(7L, text("a"));
            BigInteger large = router.getFee(7L, text("a".repeat(100)));

            Assertions.assertTrue(small.compareTo(BigInteger.valueOf(1_000)) > 0);
            Assertions.assertTrue(large.compareTo(small) > 0);
            Assertions.assertEquals(small, router.getFee(9L, text("a")));
        } finally {
            deleteRecursively(spool);
        }
    }

    @Test
    void nativeSendChargesFeeAndPublishesToTheDestinationQueue() throws Exception {
        Path spool = Files.createTempDirectory("facetrelay-test-spool-");
        try {
            FileRelayRouter router = newRouter(spool, IMMEDIATE, Set.of());
            MemoryWallet wallet = new MemoryWallet();
            wallet.credit(FeeWallet.NATIVE, BigInteger.valueOf(1_000_000));
            OutboundMessage message = text("hello");
            BigInteger fee = router.getFee(7L, message);

            String id = router.send(1L, 7L, SENDER, message, wallet, fee);

            Assertions.assertTrue(id.matches("^0x[0-9a-f]{64}$"));
            Assertions.assertEquals(BigInteger.valueOf(1_000_000).subtract(fee), wallet.balanceOf(FeeWallet.NATIVE));
            Assertions.assertEquals(1, router.pendingCount(7L));
            Assertions.assertEquals(0, router.pendingCount(9L));

            List<InboundMessage> seen = new ArrayList<>();
            FileRelayRouter.DeliverySummary summary = router.deliver(7L, (caller, wire) -> {
                Assertions.assertEquals(ROUTER, caller);
                seen.add(codec.decode(wire));
                return ReceiveStatus.APPLIED;
            }, 10);

            Assertions.assertEquals(1, summary.delivered());
            Assertions.assertEquals(1, summary.applied());
            Assertions.assertEquals(0, router.pendingCount(7L));
            Assertions.assertEquals(id, seen.get(0).messageId());
            Assertions.assertEquals(1L, seen.get(0).sourceChainSelector());
            Assertions.assertEquals(SENDER, seen.get(0).sender());
            Assertions.assertEquals("hello", new String(seen.get(0).data(), StandardCharsets.UTF_8));
        } finally {
            deleteRecursively(spool);
        }
    }

    @Test
    void underpaidNativeSendLeavesNoMessageAndNoDebit() throws Exception {
        Path spool = Files.createTempDirectory("facetrelay-test-spool-");
        try {
            FileRelayRouter router = newRouter(spool, IMMEDIATE, Set.of());
            MemoryWallet wallet = new MemoryWallet();
            wallet.credit(FeeWallet.NATIVE, BigInteger.valueOf(1_000_000));
            OutboundMessage message = text("hello");
            BigInteger fee = router.getFee(7L, message);

            RelayException e = Assertions.assertThrows(RelayException.class,
                    () -> router.send(1L, 7L, SENDER, message, wallet, fee.subtract(BigInteger.ONE)));

            Assertions.assertEquals(RelayError.INSUFFICIENT_BALANCE, e.error());
            Assertions.assertEquals(BigInteger.valueOf(1_000_000), wallet.balanceOf(FeeWallet.NATIVE));
            Assertions.assertEquals(0, router.pendingCount(7L));
            try (Stream<Path> staged = Files.list(spool.resolve("7").resolve("staging"))) {
                Assertions.assertEquals(0L, staged.count());
            }
        } finally {
            deleteRecursively(spool);
        }
    }

    @Test
    void tokenFeeIsPulledThroughTheAllowance() throws Exception {
        Path spool = Files.createTempDirectory("facetrelay-test-spool-");
        try {
            FileRelayRouter router = newRouter(spool, IMMEDIATE, Set.of());
            MemoryWallet wallet = new MemoryWallet();
            wallet.credit(LINK, BigInteger.valueOf(50_000));
            OutboundMessage message = codec.encodeText(RECEIVER, "pay in token", Addresses.ZERO, BigInteger.ZERO, LINK);
            BigInteger fee = router.getFee(7L, message);

            RelayException noAllowance = Assertions.assertThrows(RelayException.class,
                    () -> router.send(1L, 7L, SENDER, message, wallet, BigInteger.ZERO));
            Assertions.assertEquals(RelayError.INSUFFICIENT_BALANCE, noAllowance.error());

            wallet.approve(LINK, ROUTER, fee);
            router.send(1L, 7L, SENDER, message, wallet, BigInteger.ZERO);

            Assertions.assertEquals(BigInteger.valueOf(50_000).subtract(fee), wallet.balanceOf(LINK));
            Assertions.assertEquals(BigInteger.ZERO, wallet.allowance(LINK, ROUTER));
            Assertions.assertEquals(1, router.pendingCount(7L));
        } finally {
            deleteRecursively(spool);
        }
    }

    @Test
    void rolledBackSendIsNeverPublished() throws Exception {
        Path spool = Files.createTempDirectory("facetrelay-test-spool-");
        try {
            List<Runnable> rollbacks = new ArrayList<>();
            FileRelayRouter router = newRouter(spool, (onCommit, onRollback) -> rollbacks.add(onRollback), Set.of());
            MemoryWallet wallet = new MemoryWallet();
            wallet.credit(FeeWallet.NATIVE, BigInteger.valueOf(1_000_000));

            router.send(1L, 7L, SENDER, text("undo me"), wallet, BigInteger.valueOf(1_000_000));
            rollbacks.forEach(Runnable::run);

            Assertions.assertEquals(0, router.pendingCount(7L));
            try (Stream<Path> staged = Files.list(spool.resolve("7").resolve("staging"))) {
                Assertions.assertEquals(0L, staged.count());
            }
        } finally {
            deleteRecursively(spool);
        }
    }

    @Test
    void unsupportedDestinationFailsSubmission() throws Exception {
        Path spool = Files.createTempDirectory("facetrelay-test-spool-");
        try {
            FileRelayRouter router = newRouter(spool, IMMEDIATE, Set.of(7L));
            MemoryWallet wallet = new MemoryWallet();

            Assertions.assertTrue(router.isChainSupported(7L));
            RelayException e = Assertions.assertThrows(RelayException.class,
                    () -> router.send(1L, 9L, SENDER, text("x"), wallet, BigInteger.TEN));
            Assertions.assertEquals(RelayError.RELAY_SUBMISSION_FAILED, e.error());
        } finally {
            deleteRecursively(spool);
        }
    }

    @Test
    void deliverySortsOutcomesIntoDoneAndRejected() throws Exception {
        Path spool = Files.createTempDirectory("facetrelay-test-spool-");
        try {
            FileRelayRouter router = newRouter(spool, IMMEDIATE, Set.of());
            MemoryWallet wallet = new MemoryWallet();
            wallet.credit(FeeWallet.NATIVE, BigInteger.valueOf(10_000_000));
            for (String body : List.of("ok", "fails", "rejected")) {
                router.send(1L, 7L, SENDER, text(body), wallet, BigInteger.valueOf(1_000_000));
            }

            FileRelayRouter.DeliverySummary summary = router.deliver(7L, (caller, wire) -> {
                String body = new String(codec.decode(wire).data(), StandardCharsets.UTF_8);
                if (body.equals("rejected")) {
                    throw RelayException.of(RelayError.SENDER_NOT_ALLOWED, "unknown sender");
                }
                return body.equals("ok") ? ReceiveStatus.APPLIED : ReceiveStatus.FAILED;
            }, 10);

            Assertions.assertEquals(3, summary.delivered());
            Assertions.assertEquals(1, summary.applied());
            Assertions.assertEquals(1, summary.failed());
            Assertions.assertEquals(1, summary.rejected());
            Assertions.assertTrue(summary.records().get(2).error().startsWith("SenderNotAllowed"));
            try (Stream<Path> done = Files.list(spool.resolve("7").resolve("done"));
                 Stream<Path> rejected = Files.list(spool.resolve("7").resolve("rejected"))) {
                Assertions.assertEquals(2L, done.count());
                Assertions.assertEquals(1L, rejected.count());
            }
        } finally {
            deleteRecursively(spool);
        }
    }

    @Test
    void infrastructureFailureReturnsTheMessageToPending() throws Exception {
        Path spool = Files.createTempDirectory("facetrelay-test-spool-");
        try {
            FileRelayRouter router = newRouter(spool, IMMEDIATE, Set.of());
            MemoryWallet wallet = new MemoryWallet();
            wallet.credit(FeeWallet.NATIVE, BigInteger.valueOf(1_000_000));
            router.send(1L, 7L, SENDER, text("retry later"), wallet, BigInteger.valueOf(1_000_000));

            Assertions.assertThrows(IllegalStateException.class, () -> router.deliver(7L, (caller, wire) -> {
                throw new IllegalStateException("database locked");
            }, 10));

            Assertions.assertEquals(1, router.pendingCount(7L));
        } finally {
            deleteRecursively(spool);
        }
    }

    @Test
    void unreadableMessageIsReturnedToPendingWithoutDelivery() throws Exception {
        Path spool = Files.createTempDirectory("facetrelay-test-spool-");
        try {
            FileRelayRouter router = newRouter(spool, IMMEDIATE, Set.of());
            Files.createDirectories(spool.resolve("7").resolve("pending").resolve("0000000000001_00000001_broken.msg.json"));
            int[] calls = {0};

            Assertions.assertThrows(RuntimeException.class, () -> router.deliver(7L, (caller, wire) -> {
                calls[0]++;
                return ReceiveStatus.APPLIED;
            }, 10));

            Assertions.assertEquals(0, calls[0]);
            Assertions.assertEquals(1, router.pendingCount(7L));
            try (Stream<Path> processing = Files.list(spool.resolve("7").resolve("processing"))) {
                Assertions.assertEquals(0L, processing.count());
            }
        } finally {
            deleteRecursively(spool);
        }
    }

    private FileRelayRouter newRouter(Path spool, TransactionHooks hooks, Set<Long> chains) {
        return new FileRelayRouter(ROUTER, spool, 1_000L, 10L, codec, hooks, chains);
    }

    private OutboundMessage text(String body) {
        return codec.encodeText(RECEIVER, body, Addresses.ZERO, BigInteger.ZERO, Addresses.ZERO);
    }

    private static final class MemoryWallet implements FeeWallet {
        private final Map<String, BigInteger> balances = new HashMap<>();
        private final Map<String, BigInteger> allowances = new HashMap<>();

        @Override
        public BigInteger balanceOf(String asset) {
            return balances.getOrDefault(asset, BigInteger.ZERO);
        }

        @Override
        public void credit(String asset, BigInteger amount) {
            balances.put(asset, balanceOf(asset).add(amount));
        }

        @Override
        public void approve(String asset, String spender, BigInteger amount) {
            allowances.put(asset + "|" + spender, amount);
        }

        @Override
        public BigInteger allowance(String asset, String spender) {
            return allowances.getOrDefault(asset + "|" + spender, BigInteger.ZERO);
        }

        @Override
        public void payNative(BigInteger amount) {
            if (balanceOf(NATIVE).compareTo(amount) < 0) {
                throw RelayException.of(RelayError.INSUFFICIENT_BALANCE, "native");
            }
            balances.put(NATIVE, balanceOf(NATIVE).subtract(amount));
        }

        @Override
        public void transferFrom(String asset, String spender, BigInteger amount) {
            if (allowance(asset, spender).compareTo(amount) < 0 || balanceOf(asset).compareTo(amount) < 0) {
                throw RelayException.of(RelayError.INSUFFICIENT_BALANCE, "token");
            }
            allowances.put(asset + "|" + spender, allowance(asset, spender).subtract(amount));
            balances.put(asset, balanceOf(asset).subtract(amount));
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
