package io.facetrelay.router;

import io.facetrelay.model.OutboundMessage;

import java.math.BigInteger;

/**
 * Transport between chains. Only {@link #address()} may call a unit's receive callback.
 */
public interface RelayRouter {
    String address();

    boolean isChainSupported(long chainSelector);

    BigInteger getFee(long destinationChainSelector, OutboundMessage message);

    /**
     * Collects the fee from {@code payer} and queues the message for delivery.
     *
     * @param nativeValue native amount attached to the call; zero when paying in a token
     * @return relay-assigned message id
     */
    String send(long sourceChainSelector, long destinationChainSelector, String sender,
                OutboundMessage message, FeeWallet payer, BigInteger nativeValue);
}
