package com.slb.proceeds_pool.modules.pool.event;

import org.springframework.lang.Nullable;

import java.math.BigInteger;

/**
 * 池子状态变化事件，在操作事务内同步发布。
 *
 * @param cumulativeRewardPerShare 事件发生后的每份额累计收益
 */
public record PoolActivityEvent(
        Long poolId,
        PoolEventType type,
        String account,
        @Nullable String counterparty,
        BigInteger amount,
        BigInteger cumulativeRewardPerShare
) {

    public static PoolActivityEvent of(Long poolId, PoolEventType type, String account,
                                       BigInteger amount, BigInteger cumulativeRewardPerShare) {
        return new PoolActivityEvent(poolId, type, account, null, amount, cumulativeRewardPerShare);
    }
}
