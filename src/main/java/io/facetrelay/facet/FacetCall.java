package io.facetrelay.facet;

import io.facetrelay.codec.CallData;
import io.facetrelay.util.Addresses;

import java.sql.Connection;

/**
 * One invocation routed to a facet. {@code connection} is the transaction the call runs in;
 * it is committed only when the facet reports success.
 */
public record FacetCall(
        String signature,
        CallData.Call call,
        String caller,
        String unitAddress,
        Connection connection,
        FacetServices services,
        String traceId
) {
    public boolean isSelfCall() {
        return Addresses.same(caller, unitAddress);
    }
}
