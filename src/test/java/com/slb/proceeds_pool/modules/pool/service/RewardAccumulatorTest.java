package com.slb.proceeds_pool.modules.pool.service;

import com.slb.proceeds_pool.modules.pool.entity.AccountRewardState;
import com.slb.proceeds_pool.modules.pool.entity.PoolLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class RewardAccumulatorTest {

    private final RewardAccumulator accumulator = new RewardAccumulator();
    private PoolLedger ledger;

    @BeforeEach
    void setup() {
        ledger = new PoolLedger();
        ledger.setId(1L);
        ledger.setCumulativeRewardPerShare(BigInteger.ZERO);
        ledger.setTotalProceedsDeposited(BigInteger.ZERO);
        ledger.setPendingZeroSupplyProceeds(BigInteger.ZERO);
        ledger.setTotalProceedsPaid(BigInteger.ZERO);
    }

    @Test
    void accrue_withShares_raisesAccumulatorByFlooredQuotient() {
        BigInteger increment = accumulator.accrue(ledger, BigInteger.valueOf(10), BigInteger.valueOf(3));

        // 10 * 1e18 / 3 = 3333333333333333333.33...
        assertEquals(new BigInteger("3333333333333333333"), increment);
        assertEquals(increment, ledger.getCumulativeRewardPerShare());
        assertEquals(BigInteger.valueOf(10), ledger.getTotalProceedsDeposited());
        assertEquals(BigInteger.ZERO, ledger.getPendingZeroSupplyProceeds());
    }

    @Test
    void accrue_withoutShares_escrowsAndKeepsAccumulator() {
        ledger.setCumulativeRewardPerShare(BigInteger.valueOf(5));

        BigInteger increment = accumulator.accrue(ledger, BigInteger.valueOf(40), BigInteger.ZERO);
        accumulator.accrue(ledger, BigInteger.valueOf(2), BigInteger.ZERO);

        assertEquals(BigInteger.ZERO, increment);
        assertEquals(BigInteger.valueOf(5), ledger.getCumulativeRewardPerShare());
        assertEquals(BigInteger.valueOf(42), ledger.getPendingZeroSupplyProceeds());
        assertEquals(BigInteger.valueOf(42), ledger.getTotalProceedsDeposited());
    }

    @Test
    void accrue_tinyAmountOverHugeSupply_isAllDust() {
        BigInteger totalShares = RewardAccumulator.PRECISION.multiply(BigInteger.TEN);

        BigInteger increment = accumulator.accrue(ledger, BigInteger.ONE, totalShares);

        assertEquals(BigInteger.ZERO, increment);
        assertEquals(BigInteger.ONE, ledger.getTotalProceedsDeposited());
        assertEquals(BigInteger.ZERO, ledger.getPendingZeroSupplyProceeds());
    }

    @Test
    void pendingProceeds_addsLockedToFlooredAccrual() {
        ledger.setCumulativeRewardPerShare(new BigInteger("3333333333333333333"));
        AccountRewardState state = AccountRewardState.zero(1L, "0xabc");
        state.setLockedProceeds(BigInteger.valueOf(7));

        BigInteger pending = accumulator.pendingProceeds(ledger, state, BigInteger.ONE);

        // 3.33 向下取整为 3
        assertEquals(BigInteger.valueOf(10), pending);
    }

    @Test
    void accruedSince_isZeroForEmptyBalanceOrCurrentCheckpoint() {
        BigInteger acc = BigInteger.valueOf(123).multiply(RewardAccumulator.PRECISION);

        assertEquals(BigInteger.ZERO, accumulator.accruedSince(acc, BigInteger.ZERO, BigInteger.ZERO));
        assertEquals(BigInteger.ZERO, accumulator.accruedSince(acc, acc, BigInteger.valueOf(1000)));
        assertEquals(BigInteger.valueOf(1230), accumulator.accruedSince(acc, BigInteger.ZERO, BigInteger.TEN));
    }
}
