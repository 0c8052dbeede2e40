package io.facetrelay.model;

/**
 * Terminal state of one accepted inbound message. Rejected deliveries never reach a status.
 */
public enum ReceiveStatus {
    APPLIED,
    FAILED
}
