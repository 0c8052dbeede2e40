package io.facetrelay.model;

import io.facetrelay.util.Addresses;

import java.math.BigInteger;

public record TokenAmount(String token, BigInteger amount) {
    public TokenAmount {
        token = Addresses.normalize(token);
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("token amount must be non-negative: " + amount);
        }
    }
}
