package com.slb.proceeds_pool.modules.pool.service;

import com.slb.proceeds_pool.modules.pool.entity.AccountRewardState;
import com.slb.proceeds_pool.modules.pool.entity.PoolLedger;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * 每份额累计收益的计算规则。
 * <p>
 * 所有除法均向下取整：单次注入最多损失 totalShares - 1 个最小单位，这部分永久无人可领。
 */
@Component
public class RewardAccumulator {

    /** 累计值放大倍数 10^18 */
    public static final BigInteger PRECISION = BigInteger.TEN.pow(18);

    /**
     * 记入一次收益注入。
     * totalShares 为 0 时收益进入零份额托管，累计值不变；否则累计值增加 amount * PRECISION / totalShares。
     *
     * @return 本次累计值增量（托管时为 0）
     */
    public BigInteger accrue(PoolLedger ledger, BigInteger amount, BigInteger totalShares) {
        BigInteger increment = BigInteger.ZERO;
        if (totalShares.signum() == 0) {
            ledger.setPendingZeroSupplyProceeds(ledger.getPendingZeroSupplyProceeds().add(amount));
        } else {
            increment = amount.multiply(PRECISION).divide(totalShares);
            ledger.setCumulativeRewardPerShare(ledger.getCumulativeRewardPerShare().add(increment));
        }
        ledger.setTotalProceedsDeposited(ledger.getTotalProceedsDeposited().add(amount));
        return increment;
    }

    /**
     * 自 checkpoint 以来 balance 份额新产生的收益。
     */
    public BigInteger accruedSince(BigInteger cumulativeRewardPerShare, BigInteger checkpoint, BigInteger balance) {
        if (balance.signum() == 0) {
            return BigInteger.ZERO;
        }
        return cumulativeRewardPerShare.subtract(checkpoint).multiply(balance).divide(PRECISION);
    }

    /**
     * pending = locked + (acc - checkpoint) * balance / PRECISION
     */
    public BigInteger pendingProceeds(PoolLedger ledger, AccountRewardState state, BigInteger balance) {
        return state.getLockedProceeds()
                .add(accruedSince(ledger.getCumulativeRewardPerShare(), state.getCheckpoint(), balance));
    }
}
