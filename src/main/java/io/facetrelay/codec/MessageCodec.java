package io.facetrelay.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.facetrelay.error.RelayError;
import io.facetrelay.error.RelayException;
import io.facetrelay.model.ChainSelectors;
import io.facetrelay.model.InboundMessage;
import io.facetrelay.model.OutboundMessage;
import io.facetrelay.model.TokenAmount;
import io.facetrelay.util.Addresses;
import io.facetrelay.util.Jsons;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds outbound messages and converts delivered messages to and from the relay wire layout.
 *
 * <p>Wire layout ({@value #SCHEMA_VERSION}), a compact JSON object with exactly these fields:
 *
 * <ul>
 *   <li>{@code schema}: the schema version string</li>
 *   <li>{@code message_id}: {@code 0x} + 64 hex digits</li>
 *   <li>{@code source_chain}: unsigned 64-bit decimal string</li>
 *   <li>{@code sender}: address of the sending unit</li>
 *   <li>{@code data}: base64 call data</li>
 *   <li>{@code token_amounts}: array of {@code {token, amount}} with decimal amounts</li>
 * </ul>
 */
public final class MessageCodec {
    public static final String SCHEMA_VERSION = "facetrelay.message.v1";
    private static final Set<String> WIRE_FIELDS = Set.of(
            "schema", "message_id", "source_chain", "sender", "data", "token_amounts");
    private static final Set<String> TOKEN_FIELDS = Set.of("token", "amount");
    private static final Pattern MESSAGE_ID = Pattern.compile("^0x[0-9a-f]{64}$");
    private static final Pattern UNSIGNED_DECIMAL = Pattern.compile("^[0-9]{1,78}$");

    private final long gasLimit;
    private final int maxPayloadBytes;

    public MessageCodec(long gasLimit, int maxPayloadBytes) {
        this.gasLimit = gasLimit;
        this.maxPayloadBytes = maxPayloadBytes;
    }

    public OutboundMessage encode(String receiver, byte[] data, String token, BigInteger amount, String feeToken) {
        byte[] payload = data == null ? new byte[0] : data;
        if (payload.length > maxPayloadBytes) {
            throw new IllegalArgumentException(
                    "Payload too large: " + payload.length + " bytes, max=" + maxPayloadBytes);
        }
        TokenAmount tokenAmount = new TokenAmount(token, amount == null ? BigInteger.ZERO : amount);
        return new OutboundMessage(
                Addresses.normalize(receiver),
                payload,
                List.of(tokenAmount),
                Addresses.normalize(feeToken),
                new ExtraArgs(gasLimit).encode()
        );
    }

    public OutboundMessage encodeText(String receiver, String text, String token, BigInteger amount, String feeToken) {
        byte[] data = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
        return encode(receiver, data, token, amount, feeToken);
    }

    public byte[] toWire(InboundMessage message) {
        ObjectNode root = Jsons.compactMapper().createObjectNode();
        root.put("schema", SCHEMA_VERSION);
        root.put("message_id", message.messageId());
        root.put("source_chain", ChainSelectors.format(message.sourceChainSelector()));
        root.put("sender", Addresses.normalize(message.sender()));
        root.put("data", Base64.getEncoder().encodeToString(message.data()));
        ArrayNode amounts = root.putArray("token_amounts");
        for (TokenAmount amount : message.destTokenAmounts()) {
            ObjectNode row = amounts.addObject();
            row.put("token", amount.token());
            row.put("amount", amount.amount().toString());
        }
        return Jsons.toCompactJson(root).getBytes(StandardCharsets.UTF_8);
    }

    public InboundMessage decode(byte[] wire) {
        if (wire == null || wire.length == 0) {
            throw malformed("empty message");
        }
        JsonNode root;
        try {
            root = Jsons.compactMapper().readTree(new String(wire, StandardCharsets.UTF_8));
        } catch (Exception e) {
            throw new RelayException(RelayError.MALFORMED_PAYLOAD, "message is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw malformed("message must be a JSON object");
        }
        requireExactFields(root, WIRE_FIELDS, "message");
        if (!SCHEMA_VERSION.equals(textField(root, "schema"))) {
            throw malformed("unsupported schema " + root.path("schema").asText());
        }
        String messageId = textField(root, "message_id");
        if (!MESSAGE_ID.matcher(messageId).matches()) {
            throw malformed("message_id must be 0x followed by 64 lowercase hex digits");
        }
        String sourceChain = textField(root, "source_chain");
        if (!UNSIGNED_DECIMAL.matcher(sourceChain).matches()) {
            throw malformed("source_chain must be an unsigned decimal string");
        }
        long sourceSelector;
        try {
            sourceSelector = Long.parseUnsignedLong(sourceChain);
        } catch (NumberFormatException e) {
            throw new RelayException(RelayError.MALFORMED_PAYLOAD, "source_chain exceeds 64 bits", e);
        }
        String sender = textField(root, "sender");
        if (!Addresses.isValid(sender)) {
            throw malformed("sender is not an address");
        }
        byte[] data;
        try {
            data = Base64.getDecoder().decode(textField(root, "data"));
        } catch (IllegalArgumentException e) {
            throw new RelayException(RelayError.MALFORMED_PAYLOAD, "data is not base64", e);
        }
        if (data.length > maxPayloadBytes) {
            throw malformed("data exceeds " + maxPayloadBytes + " bytes");
        }
        JsonNode amounts = root.get("token_amounts");
        if (!amounts.isArray()) {
            throw malformed("token_amounts must be an array");
        }
        List<TokenAmount> tokenAmounts = new ArrayList<>();
        for (JsonNode row : amounts) {
            tokenAmounts.add(decodeTokenAmount(row));
        }
        return new InboundMessage(messageId, sourceSelector, Addresses.normalize(sender), data, tokenAmounts);
    }

    private TokenAmount decodeTokenAmount(JsonNode row) {
        if (!row.isObject()) {
            throw malformed("token amount must be an object");
        }
        requireExactFields(row, TOKEN_FIELDS, "token amount");
        String token = textField(row, "token");
        if (!Addresses.isValid(token)) {
            throw malformed("token is not an address");
        }
        String amount = textField(row, "amount");
        if (!UNSIGNED_DECIMAL.matcher(amount).matches()) {
            throw malformed("amount must be an unsigned decimal string");
        }
        return new TokenAmount(token, new BigInteger(amount));
    }

    private void requireExactFields(JsonNode node, Set<String> expected, String what) {
        Iterator<String> names = node.fieldNames();
        int seen = 0;
        while (names.hasNext()) {
            String name = names.next();
            if (!expected.contains(name)) {
                throw malformed(what + " has unexpected field '" + name + "'");
            }
            seen++;
        }
        if (seen != expected.size()) {
            throw malformed(what + " is missing fields, expected " + expected);
        }
    }

    private String textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw malformed(field + " must be a string");
        }
        return value.asText();
    }

    private RelayException malformed(String message) {
        return RelayException.of(RelayError.MALFORMED_PAYLOAD, message);
    }
}
