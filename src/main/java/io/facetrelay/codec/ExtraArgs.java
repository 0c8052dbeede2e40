package io.facetrelay.codec;

import io.facetrelay.error.RelayError;
import io.facetrelay.error.RelayException;
import io.facetrelay.util.Hashing;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Transport-specific arguments: a 4-byte version tag followed by the 8-byte execution
 * gas ceiling for the receiving side.
 */
public record ExtraArgs(long gasLimit) {
    private static final byte[] TAG_V1 = Arrays.copyOf(
            Hashing.sha256("FacetRelayExtraArgsV1".getBytes(StandardCharsets.UTF_8)), 4);
    private static final int ENCODED_LENGTH = TAG_V1.length + Long.BYTES;

    public ExtraArgs {
        if (gasLimit <= 0) {
            throw new IllegalArgumentException("gasLimit must be positive: " + gasLimit);
        }
    }

    public static byte[] tagV1() {
        return TAG_V1.clone();
    }

    public byte[] encode() {
        return ByteBuffer.allocate(ENCODED_LENGTH).put(TAG_V1).putLong(gasLimit).array();
    }

    public static ExtraArgs decode(byte[] raw) {
        if (raw == null || raw.length != ENCODED_LENGTH) {
            throw RelayException.of(RelayError.MALFORMED_PAYLOAD, "extra args must be " + ENCODED_LENGTH + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(raw);
        byte[] tag = new byte[TAG_V1.length];
        buffer.get(tag);
        if (!Arrays.equals(tag, TAG_V1)) {
            throw RelayException.of(RelayError.MALFORMED_PAYLOAD, "unknown extra args tag 0x" + Hashing.toHex(tag));
        }
        return new ExtraArgs(buffer.getLong());
    }
}
