package io.facetrelay.model;

import java.util.List;

public record FailedMessage(
        String messageId,
        String reason,
        MessageErrorCode errorCode,
        long sourceChainSelector,
        String sender,
        byte[] data,
        List<TokenAmount> tokenAmounts,
        int attempts,
        long failedAtMs,
        long updatedAtMs
) {
    public FailedMessage {
        data = data == null ? new byte[0] : data.clone();
        tokenAmounts = tokenAmounts == null ? List.of() : List.copyOf(tokenAmounts);
    }

    @Override
    public byte[] data() {
        return data.clone();
    }
}
