package io.facetrelay.model;

import java.util.List;

public record InboundMessage(
        String messageId,
        long sourceChainSelector,
        String sender,
        byte[] data,
        List<TokenAmount> destTokenAmounts
) {
    public InboundMessage {
        data = data == null ? new byte[0] : data.clone();
        destTokenAmounts = destTokenAmounts == null ? List.of() : List.copyOf(destTokenAmounts);
    }

    @Override
    public byte[] data() {
        return data.clone();
    }
}
