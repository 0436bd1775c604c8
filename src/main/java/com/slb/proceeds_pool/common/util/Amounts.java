package com.slb.proceeds_pool.common.util;

import com.slb.proceeds_pool.common.exception.BizException;
import com.slb.proceeds_pool.common.exception.PoolErrorCode;

import java.math.BigInteger;

/**
 * 金额校验：必须为正；外部入口的单笔金额另受 {@link #MAX_AMOUNT} 限制。
 */
public final class Amounts {

    /**
     * 单笔上限 10^36。金额与每份额累计值都落在 DECIMAL(65,0) 列上，
     * 累计值单次增量最多 amount * 10^18，上限保证至少 10^11 次满额注入不溢出。
     */
    public static final BigInteger MAX_AMOUNT = BigInteger.TEN.pow(36);

    private Amounts() {
    }

    /**
     * 外部入口金额：为正且不超过上限。
     */
    public static BigInteger require(BigInteger amount) {
        requirePositive(amount);
        if (amount.compareTo(MAX_AMOUNT) > 0) {
            throw new BizException(PoolErrorCode.AMOUNT_TOO_LARGE, "单笔金额不能超过 " + MAX_AMOUNT);
        }
        return amount;
    }

    /**
     * 内部划转金额只校验为正：收益发放可能是多笔注入的累计，允许超过单笔上限。
     */
    public static BigInteger requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new BizException(PoolErrorCode.ZERO_AMOUNT);
        }
        return amount;
    }
}
