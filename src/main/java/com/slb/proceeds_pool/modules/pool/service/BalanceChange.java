package com.slb.proceeds_pool.modules.pool.service;

import java.math.BigInteger;

/**
 * 一次份额余额变化。old* 为账本变更前的余额；mint 时 from 为空，burn 时 to 为空。
 */
public record BalanceChange(
        Kind kind,
        String from,
        String to,
        BigInteger amount,
        BigInteger oldFromBalance,
        BigInteger oldToBalance
) {

    public enum Kind {
        MINT,
        BURN,
        TRANSFER
    }

    public static BalanceChange mint(String to, BigInteger amount, BigInteger oldToBalance) {
        return new BalanceChange(Kind.MINT, null, to, amount, BigInteger.ZERO, oldToBalance);
    }

    public static BalanceChange burn(String from, BigInteger amount, BigInteger oldFromBalance) {
        return new BalanceChange(Kind.BURN, from, null, amount, oldFromBalance, BigInteger.ZERO);
    }

    public static BalanceChange transfer(String from, String to, BigInteger amount,
                                         BigInteger oldFromBalance, BigInteger oldToBalance) {
        return new BalanceChange(Kind.TRANSFER, from, to, amount, oldFromBalance, oldToBalance);
    }
}
