package io.facetrelay.error;

public enum RelayError {
    DESTINATION_CHAIN_NOT_ALLOWLISTED("DestinationChainNotAllowlisted"),
    SOURCE_CHAIN_NOT_ALLOWED("SourceChainNotAllowed"),
    SENDER_NOT_ALLOWED("SenderNotAllowed"),
    INVALID_ROUTER("InvalidRouter"),
    INSUFFICIENT_BALANCE("InsufficientBalance"),
    MESSAGE_NOT_FAILED("MessageNotFailed"),
    MALFORMED_PAYLOAD("MalformedPayload"),
    UNAUTHORIZED("AccessDenied"),
    ALREADY_INITIALIZED("AlreadyInitialized"),
    NOT_INITIALIZED("NotInitialized"),
    UNKNOWN_SELECTOR("FunctionNotFound"),
    SELECTOR_CONFLICT("SelectorConflict"),
    REENTRANT_CALL("ReentrantCall"),
    RELAY_SUBMISSION_FAILED("RelaySubmissionFailed"),
    FACET_CALL_FAILED("FacetCallFailed");

    private final String wireName;

    RelayError(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
