package io.facetrelay.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.facetrelay.error.RelayError;
import io.facetrelay.error.RelayException;
import io.facetrelay.util.Addresses;
import io.facetrelay.util.Hashing;
import io.facetrelay.util.Jsons;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Call data layout: 4-byte selector followed by a UTF-8 JSON array of positional arguments.
 * The selector is the first four bytes of SHA-256 over the canonical signature,
 * e.g. {@code crossChainMint(address,uint256)}.
 */
public final class CallData {
    public static final int SELECTOR_BYTES = 4;

    private CallData() {
    }

    public static String selector(String signature) {
        if (signature == null || signature.isBlank() || !signature.contains("(") || !signature.endsWith(")")) {
            throw new IllegalArgumentException("Invalid function signature: " + signature);
        }
        byte[] digest = Hashing.sha256(signature.replace(" ", "").getBytes(StandardCharsets.UTF_8));
        return "0x" + Hashing.toHex(Arrays.copyOf(digest, SELECTOR_BYTES));
    }

    public static byte[] encode(String signature, Object... args) {
        ArrayNode array = Jsons.compactMapper().createArrayNode();
        for (Object arg : args) {
            if (arg == null) {
                array.addNull();
            } else {
                array.add(arg.toString());
            }
        }
        byte[] selector = Hashing.fromHex(selector(signature));
        byte[] body = Jsons.toCompactJson(array).getBytes(StandardCharsets.UTF_8);
        byte[] out = new byte[SELECTOR_BYTES + body.length];
        System.arraycopy(selector, 0, out, 0, SELECTOR_BYTES);
        System.arraycopy(body, 0, out, SELECTOR_BYTES, body.length);
        return out;
    }

    public static Call decode(byte[] data) {
        if (data == null || data.length < SELECTOR_BYTES) {
            throw RelayException.of(RelayError.MALFORMED_PAYLOAD, "call data shorter than selector");
        }
        String selector = "0x" + Hashing.toHex(Arrays.copyOf(data, SELECTOR_BYTES));
        if (data.length == SELECTOR_BYTES) {
            return new Call(selector, Jsons.compactMapper().createArrayNode());
        }
        String body = new String(data, SELECTOR_BYTES, data.length - SELECTOR_BYTES, StandardCharsets.UTF_8);
        try {
            JsonNode node = Jsons.compactMapper().readTree(body);
            if (node == null || !node.isArray()) {
                throw RelayException.of(RelayError.MALFORMED_PAYLOAD, "call arguments must be a JSON array");
            }
            return new Call(selector, node);
        } catch (RelayException e) {
            throw e;
        } catch (Exception e) {
            throw new RelayException(RelayError.MALFORMED_PAYLOAD, "call arguments are not valid JSON", e);
        }
    }

    /**
     * Decoded call. Argument accessors fail with {@link IllegalArgumentException} on type mismatch.
     */
    public record Call(String selector, JsonNode args) {
        public int size() {
            return args.size();
        }

        public String address(int index) {
            String raw = text(index);
            if (!Addresses.isValid(raw)) {
                throw new IllegalArgumentException("argument " + index + " is not an address: " + raw);
            }
            return Addresses.normalize(raw);
        }

        public BigInteger uint(int index) {
            String raw = text(index);
            try {
                BigInteger value = new BigInteger(raw);
                if (value.signum() < 0) {
                    throw new IllegalArgumentException("argument " + index + " must be unsigned: " + raw);
                }
                return value;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("argument " + index + " is not an integer: " + raw, e);
            }
        }

        public long uint64(int index) {
            String raw = text(index);
            try {
                return Long.parseUnsignedLong(raw);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("argument " + index + " is not a uint64: " + raw, e);
            }
        }

        public String text(int index) {
            JsonNode node = args.get(index);
            if (node == null || node.isNull()) {
                throw new IllegalArgumentException("missing argument " + index);
            }
            return node.asText();
        }
    }
}
