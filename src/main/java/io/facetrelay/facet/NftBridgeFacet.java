package io.facetrelay.facet;

import io.facetrelay.codec.CallData;
import io.facetrelay.model.ChainSelectors;
import io.facetrelay.util.Addresses;
import io.facetrelay.util.Jsons;

import java.math.BigInteger;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Burn-and-mint bridge for the collection. The outbound half burns locally and sends a
 * {@value #CROSS_CHAIN_MINT} call to the receiving unit; the inbound half is reachable only
 * through the unit's own dispatch of a relayed message.
 */
public final class NftBridgeFacet implements Facet {
    public static final String CROSS_CHAIN_TRANSFER = "crossChainTransfer(uint64,address,uint256,address)";
    public static final String CROSS_CHAIN_MINT = "crossChainMint(address,uint256)";

    @Override
    public String id() {
        return "nft-bridge";
    }

    @Override
    public List<String> signatures() {
        return List.of(CROSS_CHAIN_TRANSFER, CROSS_CHAIN_MINT);
    }

    @Override
    public void initSchema(Connection connection) throws SQLException {
        NftTokens.ensureSchema(connection);
    }

    @Override
    public DispatchResult invoke(FacetCall call) throws Exception {
        if (CROSS_CHAIN_TRANSFER.equals(call.signature())) {
            return transfer(call);
        }
        if (CROSS_CHAIN_MINT.equals(call.signature())) {
            return mint(call);
        }
        return DispatchResult.fail("bridge facet does not serve " + call.signature());
    }

    private DispatchResult transfer(FacetCall call) throws SQLException {
        long destination = call.call().uint64(0);
        String receiver = call.call().address(1);
        BigInteger tokenId = call.call().uint(2);
        String feeToken = call.call().address(3);
        Connection c = call.connection();

        Optional<String> owner = NftTokens.ownerOf(c, tokenId);
        if (owner.isEmpty()) {
            return DispatchResult.fail("nonexistent token " + tokenId);
        }
        if (!Addresses.same(owner.get(), call.caller())) {
            return DispatchResult.fail("caller is not the owner of token " + tokenId);
        }
        NftTokens.delete(c, tokenId);
        byte[] payload = CallData.encode(CROSS_CHAIN_MINT, Addresses.normalize(call.caller()), tokenId);
        // Send last: a send failure throws and rolls the burn back with the facet transaction.
        String messageId = call.services().send(
                call.unitAddress(),
                destination,
                receiver,
                payload,
                Addresses.ZERO,
                BigInteger.ZERO,
                feeToken
        );
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("message_id", messageId);
        out.put("token_id", tokenId.toString());
        out.put("destination_chain", ChainSelectors.format(destination));
        return DispatchResult.ok(Jsons.toCompactJson(out));
    }

    private DispatchResult mint(FacetCall call) throws SQLException {
        if (!call.isSelfCall()) {
            return DispatchResult.fail(CROSS_CHAIN_MINT + " is callable only by the unit itself");
        }
        String to = call.call().address(0);
        BigInteger tokenId = call.call().uint(1);
        if (!NftTokens.insert(call.connection(), tokenId, to, Instant.now().toEpochMilli())) {
            return DispatchResult.fail("token " + tokenId + " already exists");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("minted", tokenId.toString());
        out.put("owner", to);
        return DispatchResult.ok(Jsons.toCompactJson(out));
    }
}
