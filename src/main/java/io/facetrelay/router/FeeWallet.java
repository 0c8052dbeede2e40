package io.facetrelay.router;

import io.facetrelay.util.Addresses;

import java.math.BigInteger;

/**
 * Balances held by a unit for paying relay fees. {@link #NATIVE} names the native asset;
 * every other asset is an allowance-based token.
 */
public interface FeeWallet {
    String NATIVE = Addresses.ZERO;

    BigInteger balanceOf(String asset);

    void credit(String asset, BigInteger amount);

    void approve(String asset, String spender, BigInteger amount);

    BigInteger allowance(String asset, String spender);

    /**
     * Debits the native balance; fails with {@code INSUFFICIENT_BALANCE} leaving it unchanged.
     */
    void payNative(BigInteger amount);

    /**
     * Consumes {@code amount} of the spender's allowance and debits the balance atomically.
     */
    void transferFrom(String asset, String spender, BigInteger amount);
}
