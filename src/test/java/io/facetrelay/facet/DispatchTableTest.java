package io.facetrelay.facet;

import io.facetrelay.codec.CallData;
import io.facetrelay.error.RelayError;
import io.facetrelay.error.RelayException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class DispatchTableTest {

    @Test
    void registeredFacetsAreFoundBySelector() {
        DispatchTable table = new DispatchTable();
        table.register(new NftFacet());
        table.register(new NftBridgeFacet());

        DispatchTable.Route route = table.find(CallData.selector(NftBridgeFacet.CROSS_CHAIN_MINT)).orElseThrow();
        Assertions.assertEquals("nft-bridge", route.facet().id());
        Assertions.assertEquals(NftBridgeFacet.CROSS_CHAIN_MINT, route.signature());
        Assertions.assertEquals(2, table.facets().size());
        Assertions.assertEquals(9, table.selectors().size());
        Assertions.assertTrue(table.find(CallData.selector("transferFrom(address,address,uint256)")).isEmpty());
    }

    @Test
    void addRejectsSelectorCollisionWithoutPartialCut() {
        DispatchTable table = new DispatchTable();
        table.register(new NftFacet());

        RelayException e = Assertions.assertThrows(RelayException.class,
                () -> table.cut(FacetCutAction.ADD, new StubFacet("dup", List.of("other()", NftFacet.NAME))));
        Assertions.assertEquals(RelayError.SELECTOR_CONFLICT, e.error());
        Assertions.assertTrue(table.find(CallData.selector("other()")).isEmpty());
    }

    @Test
    void replaceAndRemoveRequireExistingRoutes() {
        DispatchTable table = new DispatchTable();
        NftFacet nft = new NftFacet();
        table.register(nft);

        StubFacet replacement = new StubFacet("name-v2", List.of(NftFacet.NAME));
        table.cut(FacetCutAction.REPLACE, replacement);
        Assertions.assertSame(replacement, table.find(CallData.selector(NftFacet.NAME)).orElseThrow().facet());

        RelayException sameInstance = Assertions.assertThrows(RelayException.class,
                () -> table.cut(FacetCutAction.REPLACE, replacement));
        Assertions.assertEquals(RelayError.SELECTOR_CONFLICT, sameInstance.error());

        RelayException missing = Assertions.assertThrows(RelayException.class,
                () -> table.cut(FacetCutAction.REPLACE, new StubFacet("x", List.of("missing()"))));
        Assertions.assertEquals(RelayError.UNKNOWN_SELECTOR, missing.error());

        table.cut(FacetCutAction.REMOVE, replacement);
        Assertions.assertTrue(table.find(CallData.selector(NftFacet.NAME)).isEmpty());
        RelayException removedTwice = Assertions.assertThrows(RelayException.class,
                () -> table.cut(FacetCutAction.REMOVE, replacement));
        Assertions.assertEquals(RelayError.UNKNOWN_SELECTOR, removedTwice.error());
    }

    @Test
    void cutActionParsesCaseInsensitively() {
        Assertions.assertEquals(FacetCutAction.REPLACE, FacetCutAction.fromString("replace"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> FacetCutAction.fromString("upsert"));
    }

    private record StubFacet(String id, List<String> signatures) implements Facet {
        @Override
        public DispatchResult invoke(FacetCall call) {
            return DispatchResult.ok(id);
        }
    }
}
