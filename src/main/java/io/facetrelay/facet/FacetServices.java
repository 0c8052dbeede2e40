package io.facetrelay.facet;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Unit capabilities a facet may use while handling a call.
 */
public interface FacetServices {
    boolean hasRole(String role, String account);

    Optional<String> unitState(String key);

    /**
     * Sends a cross-chain message on behalf of the unit and returns the relay message id.
     */
    String send(String caller, long destinationChainSelector, String receiver, byte[] data,
                String token, BigInteger amount, String feeToken);
}
