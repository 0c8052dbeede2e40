package io.facetrelay.facet;

import io.facetrelay.storage.RoleStore;
import io.facetrelay.storage.UnitStateStore;
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
 * Minimal non-fungible collection: metadata, ownership queries, admin mint and owner burn.
 */
public final class NftFacet implements Facet {
    public static final String NAME = "name()";
    public static final String SYMBOL = "symbol()";
    public static final String TOKEN_URI = "tokenURI(uint256)";
    public static final String OWNER_OF = "ownerOf(uint256)";
    public static final String BALANCE_OF = "balanceOf(address)";
    public static final String MINT = "mint(address)";
    public static final String BURN = "burn(uint256)";

    @Override
    public String id() {
        return "nft";
    }

    @Override
    public List<String> signatures() {
        return List.of(NAME, SYMBOL, TOKEN_URI, OWNER_OF, BALANCE_OF, MINT, BURN);
    }

    @Override
    public void initSchema(Connection connection) throws SQLException {
        NftTokens.ensureSchema(connection);
    }

    @Override
    public DispatchResult invoke(FacetCall call) throws Exception {
        Connection c = call.connection();
        switch (call.signature()) {
            case NAME -> {
                return result("name", call.services().unitState(UnitStateStore.KEY_NAME).orElse(""));
            }
            case SYMBOL -> {
                return result("symbol", call.services().unitState(UnitStateStore.KEY_SYMBOL).orElse(""));
            }
            case TOKEN_URI -> {
                BigInteger tokenId = call.call().uint(0);
                if (NftTokens.ownerOf(c, tokenId).isEmpty()) {
                    return DispatchResult.fail("nonexistent token " + tokenId);
                }
                String base = call.services().unitState(UnitStateStore.KEY_BASE_URI).orElse("");
                return result("token_uri", base + tokenId);
            }
            case OWNER_OF -> {
                BigInteger tokenId = call.call().uint(0);
                Optional<String> owner = NftTokens.ownerOf(c, tokenId);
                if (owner.isEmpty()) {
                    return DispatchResult.fail("nonexistent token " + tokenId);
                }
                return result("owner", owner.get());
            }
            case BALANCE_OF -> {
                return result("balance", String.valueOf(NftTokens.balanceOf(c, call.call().address(0))));
            }
            case MINT -> {
                if (!call.isSelfCall()
                        && !call.services().hasRole(RoleStore.MINTER_ROLE, call.caller())
                        && !call.services().hasRole(RoleStore.ADMIN_ROLE, call.caller())) {
                    return DispatchResult.fail("caller " + call.caller() + " may not mint");
                }
                BigInteger tokenId = NftTokens.mintNext(c, call.call().address(0), Instant.now().toEpochMilli());
                return result("token_id", tokenId.toString());
            }
            case BURN -> {
                BigInteger tokenId = call.call().uint(0);
                Optional<String> owner = NftTokens.ownerOf(c, tokenId);
                if (owner.isEmpty()) {
                    return DispatchResult.fail("nonexistent token " + tokenId);
                }
                if (!Addresses.same(owner.get(), call.caller())) {
                    return DispatchResult.fail("caller is not the owner of token " + tokenId);
                }
                NftTokens.delete(c, tokenId);
                return result("burned", tokenId.toString());
            }
            default -> {
                return DispatchResult.fail("nft facet does not serve " + call.signature());
            }
        }
    }

    private DispatchResult result(String key, String value) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(key, value);
        return DispatchResult.ok(Jsons.toCompactJson(out));
    }
}
