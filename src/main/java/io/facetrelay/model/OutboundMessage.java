package io.facetrelay.model;

import java.util.List;

/**
 * Message handed to the relay router. Built per send call and never persisted.
 */
public record OutboundMessage(
        String receiver,
        byte[] data,
        List<TokenAmount> tokenAmounts,
        String feeToken,
        byte[] extraArgs
) {
    public OutboundMessage {
        data = data == null ? new byte[0] : data.clone();
        tokenAmounts = List.copyOf(tokenAmounts);
        extraArgs = extraArgs == null ? new byte[0] : extraArgs.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public byte[] extraArgs() {
        return extraArgs.clone();
    }
}
