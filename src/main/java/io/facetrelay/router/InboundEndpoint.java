package io.facetrelay.router;

import io.facetrelay.model.ReceiveStatus;

/**
 * Receive side of a unit as seen by the router. Precondition failures are thrown as
 * {@link io.facetrelay.error.RelayException}.
 */
@FunctionalInterface
public interface InboundEndpoint {
    ReceiveStatus receiveWire(String caller, byte[] wire);
}
