package io.facetrelay.router;

import io.facetrelay.codec.MessageCodec;
import io.facetrelay.error.RelayError;
import io.facetrelay.error.RelayException;
import io.facetrelay.model.ChainSelectors;
import io.facetrelay.model.InboundMessage;
import io.facetrelay.model.OutboundMessage;
import io.facetrelay.model.ReceiveStatus;
import io.facetrelay.storage.TransactionHooks;
import io.facetrelay.util.Addresses;
import io.facetrelay.util.Hashing;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Spool-directory relay shared by every unit that points at the same directory.
 *
 * <p>Layout per destination chain: {@code <spool>/<chain>/staging}, {@code pending},
 * {@code processing}, {@code done}, {@code rejected}. A message is staged while the sending
 * unit's transaction is open and published to {@code pending} only when it commits.
 */
public final class FileRelayRouter implements RelayRouter {
    private static final String SUFFIX = ".msg.json";
    private static final String FEE_BASIS_ID = "0x" + "0".repeat(64);

    private final String address;
    private final Path spoolDir;
    private final BigInteger baseFee;
    private final BigInteger feePerByte;
    private final MessageCodec codec;
    private final TransactionHooks hooks;
    private final Set<Long> supportedChains;
    private final AtomicLong sequence = new AtomicLong(0L);

    /**
     * @param supportedChains destinations this router serves; empty means every chain
     */
    public FileRelayRouter(
            String address,
            Path spoolDir,
            long baseFee,
            long feePerByte,
            MessageCodec codec,
            TransactionHooks hooks,
            Set<Long> supportedChains
    ) {
        this.address = Addresses.normalize(address);
        this.spoolDir = spoolDir;
        this.baseFee = BigInteger.valueOf(baseFee);
        this.feePerByte = BigInteger.valueOf(feePerByte);
        this.codec = codec;
        this.hooks = hooks;
        this.supportedChains = Set.copyOf(supportedChains);
    }

    @Override
    public String address() {
        return address;
    }

    @Override
    public boolean isChainSupported(long chainSelector) {
        return supportedChains.isEmpty() || supportedChains.contains(chainSelector);
    }

    @Override
    public BigInteger getFee(long destinationChainSelector, OutboundMessage message) {
        InboundMessage basis = new InboundMessage(
                FEE_BASIS_ID, 0L, Addresses.ZERO, message.data(), message.tokenAmounts());
        int wireLength = codec.toWire(basis).length;
        return baseFee.add(feePerByte.multiply(BigInteger.valueOf(wireLength)));
    }

    @Override
    public String send(long sourceChainSelector, long destinationChainSelector, String sender,
                       OutboundMessage message, FeeWallet payer, BigInteger nativeValue) {
        if (!isChainSupported(destinationChainSelector)) {
            throw RelayException.of(RelayError.RELAY_SUBMISSION_FAILED,
                    "router does not serve chain " + ChainSelectors.format(destinationChainSelector));
        }
        BigInteger fee = getFee(destinationChainSelector, message);
        long createdAtMs = Instant.now().toEpochMilli();
        long seq = sequence.incrementAndGet();
        String messageId = "0x" + Hashing.sha256Hex(
                ChainSelectors.format(sourceChainSelector) + "|"
                        + ChainSelectors.format(destinationChainSelector) + "|"
                        + Addresses.normalize(sender) + "|"
                        + createdAtMs + "|" + seq + "|"
                        + Hashing.toHex(message.data())
        );
        byte[] wire = codec.toWire(new InboundMessage(
                messageId, sourceChainSelector, sender, message.data(), message.tokenAmounts()));

        Path chainDir = chainDir(destinationChainSelector);
        String fileName = String.format("%013d_%08d_%s%s", createdAtMs, seq, messageId.substring(2, 18), SUFFIX);
        Path staged = chainDir.resolve("staging").resolve(fileName);
        try {
            Files.createDirectories(staged.getParent());
            Files.createDirectories(chainDir.resolve("pending"));
            Files.write(staged, wire);
        } catch (IOException e) {
            throw new RelayException(RelayError.RELAY_SUBMISSION_FAILED,
                    "failed to stage message " + messageId, e);
        }
        try {
            collectFee(message.feeToken(), fee, payer, nativeValue);
        } catch (RuntimeException e) {
            deleteStaged(staged, e);
            throw e;
        }
        hooks.afterCompletion(
                () -> publish(staged, chainDir.resolve("pending").resolve(fileName)),
                () -> deleteStaged(staged, null)
        );
        return messageId;
    }

    /**
     * Hands every pending message for {@code chainSelector} to {@code endpoint}, oldest first.
     */
    public DeliverySummary deliver(long chainSelector, InboundEndpoint endpoint, int maxMessages) {
        Path chainDir = chainDir(chainSelector);
        List<DeliveryRecord> records = new ArrayList<>();
        int applied = 0;
        int failed = 0;
        int rejected = 0;
        for (Path pending : listMessages(chainDir.resolve("pending"))) {
            if (records.size() >= Math.max(1, maxMessages)) {
                break;
            }
            Path claimed = claim(pending, chainDir.resolve("processing"));
            if (claimed == null) {
                continue;
            }
            String file = claimed.getFileName().toString();
            ReceiveStatus status;
            try {
                status = endpoint.receiveWire(address, readWire(claimed));
            } catch (RelayException e) {
                archive(claimed, chainDir.resolve("rejected"), records, new DeliveryRecord(file, "REJECTED", e.getMessage()));
                rejected++;
                continue;
            } catch (RuntimeException e) {
                // Nothing was accepted yet: leave the message deliverable.
                move(claimed, chainDir.resolve("pending"));
                throw e;
            }
            if (status == ReceiveStatus.APPLIED) {
                applied++;
            } else {
                failed++;
            }
            archive(claimed, chainDir.resolve("done"), records, new DeliveryRecord(file, status.name(), ""));
        }
        return new DeliverySummary(ChainSelectors.format(chainSelector), records.size(), applied, failed, rejected, records);
    }

    public int pendingCount(long chainSelector) {
        return listMessages(chainDir(chainSelector).resolve("pending")).size();
    }

    private void collectFee(String feeToken, BigInteger fee, FeeWallet payer, BigInteger nativeValue) {
        if (Addresses.isZero(feeToken)) {
            BigInteger attached = nativeValue == null ? BigInteger.ZERO : nativeValue;
            if (attached.compareTo(fee) < 0) {
                throw RelayException.of(RelayError.INSUFFICIENT_BALANCE,
                        "native value " + attached + " < fee " + fee);
            }
            payer.payNative(fee);
            return;
        }
        payer.transferFrom(feeToken, address, fee);
    }

    private void publish(Path staged, Path target) {
        try {
            Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException atomicFailure) {
            try {
                Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                e.addSuppressed(atomicFailure);
                throw new RuntimeException("Failed to publish relay message: " + staged, e);
            }
        }
    }

    private void deleteStaged(Path staged, RuntimeException cause) {
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            if (cause != null) {
                cause.addSuppressed(e);
                return;
            }
            throw new RuntimeException("Failed to discard staged relay message: " + staged, e);
        }
    }

    /**
     * Files a handled message. The endpoint has already answered, so a failed move leaves the
     * file in {@code processing} instead of redelivering it.
     */
    private void archive(Path claimed, Path dir, List<DeliveryRecord> records, DeliveryRecord record) {
        try {
            move(claimed, dir);
            records.add(record);
        } catch (RuntimeException e) {
            String reason = e.getCause() == null ? e.getMessage() : e.getMessage() + ": " + e.getCause().getMessage();
            records.add(new DeliveryRecord(record.file(), record.status(),
                    record.error().isEmpty() ? reason : record.error() + "; " + reason));
        }
    }

    private Path claim(Path candidate, Path processingDir) {
        try {
            Files.createDirectories(processingDir);
            Path claimed = processingDir.resolve(candidate.getFileName().toString());
            Files.move(candidate, claimed, StandardCopyOption.ATOMIC_MOVE);
            return claimed;
        } catch (IOException e) {
            // Another deliverer claimed it first.
            return null;
        }
    }

    private byte[] readWire(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read relay message: " + file, e);
        }
    }

    private void move(Path file, Path dir) {
        try {
            Files.createDirectories(dir);
            Files.move(file, dir.resolve(file.getFileName().toString()), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new RuntimeException("Failed to move relay message to " + dir, e);
        }
    }

    private List<Path> listMessages(Path dir) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path path : stream) {
                files.add(path);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list relay spool: " + dir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    private Path chainDir(long chainSelector) {
        return spoolDir.resolve(ChainSelectors.format(chainSelector));
    }

    public record DeliveryRecord(String file, String status, String error) {
    }

    public record DeliverySummary(
            String chainSelector,
            int delivered,
            int applied,
            int failed,
            int rejected,
            List<DeliveryRecord> records
    ) {
    }
}
