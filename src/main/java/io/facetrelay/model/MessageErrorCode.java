package io.facetrelay.model;

/**
 * Outcome classification of an inbound message. {@code RESOLVED} comes first so that
 * a message with no failure record reads as resolved.
 */
public enum MessageErrorCode {
    RESOLVED,
    BASIC
}
