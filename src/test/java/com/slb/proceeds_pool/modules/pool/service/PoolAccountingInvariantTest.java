package com.slb.proceeds_pool.modules.pool.service;

import com.slb.proceeds_pool.common.exception.BizException;
import com.slb.proceeds_pool.modules.pool.event.PoolEventType;
import com.slb.proceeds_pool.modules.pool.vo.PoolInfoVo;
import com.slb.proceeds_pool.modules.pool.vo.PoolOperationVo;
import com.slb.proceeds_pool.support.PoolTestHarness;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.List;
import java.util.Random;

import static com.slb.proceeds_pool.support.PoolTestHarness.units;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 随机操作序列下的记账不变量：不超发、托管始终足额、转让不损失发送方收益、取回/领取后无残留。
 */
class PoolAccountingInvariantTest {

    private static final String OWNER = "0x00000000000000000000000000000000000000aa";
    private static final List<String> ACCOUNTS = List.of(
            "0x0000000000000000000000000000000000000001",
            "0x0000000000000000000000000000000000000002",
            "0x0000000000000000000000000000000000000003",
            "0x0000000000000000000000000000000000000004");
    private static final int STEPS = 400;

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L, 20240601L})
    void randomOperationSequence_keepsLedgerConsistent(long seed) {
        Random random = new Random(seed);
        PoolTestHarness pool = new PoolTestHarness();
        Long poolId = pool.createPool("random", OWNER);
        pool.fund(OWNER, 10_000_000);
        ACCOUNTS.forEach(account -> pool.fund(account, 1_000_000));

        long dustBound = ACCOUNTS.size();
        for (int step = 0; step < STEPS; step++) {
            String account = ACCOUNTS.get(random.nextInt(ACCOUNTS.size()));
            BigInteger shares = pool.shares(poolId, account);
            BigInteger pendingBefore = pool.pending(poolId, account);

            switch (random.nextInt(5)) {
                case 0 -> {
                    BigInteger amount = units(1 + random.nextInt(5_000));
                    pool.operations.deposit(poolId, account, amount);
                    BigInteger expected = shares.signum() == 0 ? pendingBefore : BigInteger.ZERO;
                    assertEquals(expected, pool.pending(poolId, account), "deposit settles old shares");
                }
                case 1 -> {
                    if (shares.signum() == 0) {
                        assertThrows(BizException.class,
                                () -> pool.operations.withdraw(poolId, account, BigInteger.ONE));
                        continue;
                    }
                    BigInteger amount = randomUpTo(random, shares);
                    PoolOperationVo result = pool.operations.withdraw(poolId, account, amount);
                    assertEquals(pendingBefore, result.getProceedsPaid());
                    assertEquals(BigInteger.ZERO, pool.pending(poolId, account), "withdraw leaves no residue");
                }
                case 2 -> pool.operations.depositProceeds(poolId, OWNER, units(1 + random.nextInt(997)));
                case 3 -> {
                    PoolOperationVo result = pool.operations.claimProceeds(poolId, account);
                    assertEquals(pendingBefore, result.getProceedsPaid());
                    assertEquals(BigInteger.ZERO, pool.pending(poolId, account));
                }
                default -> {
                    if (shares.signum() == 0) {
                        continue;
                    }
                    String to = ACCOUNTS.get((ACCOUNTS.indexOf(account) + 1 + random.nextInt(ACCOUNTS.size() - 1))
                            % ACCOUNTS.size());
                    BigInteger receiverPendingBefore = pool.pending(poolId, to);
                    BigInteger receiverUnderlyingBefore = pool.underlying(to);

                    pool.operations.transfer(poolId, account, to, randomUpTo(random, shares));

                    assertEquals(pendingBefore, pool.pending(poolId, account), "sender keeps its proceeds");
                    assertEquals(BigInteger.ZERO, pool.pending(poolId, to));
                    assertEquals(receiverUnderlyingBefore.add(receiverPendingBefore), pool.underlying(to));
                }
            }
            // 每步最多产生两个账户结算段的取整损失，外加一次注入的取整
            dustBound += 3;
            assertConserved(pool, poolId, dustBound);
        }
    }

    private static void assertConserved(PoolTestHarness pool, Long poolId, long dustBound) {
        PoolInfoVo info = pool.operations.getContractInfo(poolId);
        BigInteger pendingSum = BigInteger.ZERO;
        BigInteger sharesSum = BigInteger.ZERO;
        for (String account : ACCOUNTS) {
            pendingSum = pendingSum.add(pool.pending(poolId, account));
            sharesSum = sharesSum.add(pool.shares(poolId, account));
        }
        BigInteger bonusPaid = pool.events.stream()
                .filter(e -> e.type() == PoolEventType.FIRST_DEPOSITOR_BONUS)
                .map(e -> e.amount())
                .reduce(BigInteger.ZERO, BigInteger::add);

        assertEquals(info.getTotalShares(), sharesSum);

        BigInteger distributable = info.getTotalProceedsDeposited().subtract(info.getPendingZeroSupplyProceeds());
        BigInteger accounted = pendingSum.add(info.getTotalProceedsPaid()).add(bonusPaid);
        BigInteger dust = distributable.subtract(accounted);
        assertTrue(dust.signum() >= 0, "proceeds over-distributed by " + dust.negate());
        assertTrue(dust.compareTo(BigInteger.valueOf(dustBound)) <= 0, "dust too large: " + dust);

        BigInteger owed = sharesSum.add(pendingSum).add(info.getPendingZeroSupplyProceeds());
        assertTrue(info.getTotalUnderlyingHeld().compareTo(owed) >= 0, "custody is insolvent");
    }

    private static BigInteger randomUpTo(Random random, BigInteger max) {
        long bound = max.min(BigInteger.valueOf(Integer.MAX_VALUE)).longValue();
        return BigInteger.valueOf(1 + random.nextInt((int) bound));
    }
}
