package com.slb.proceeds_pool.modules.pool.service;

import com.slb.proceeds_pool.modules.asset.entity.AssetRefType;
import com.slb.proceeds_pool.modules.asset.service.AssetMover;
import com.slb.proceeds_pool.modules.pool.entity.AccountRewardState;
import com.slb.proceeds_pool.modules.pool.entity.PoolLedger;
import com.slb.proceeds_pool.modules.pool.event.PoolActivityEvent;
import com.slb.proceeds_pool.modules.pool.event.PoolEventType;
import com.slb.proceeds_pool.modules.pool.mapper.AccountRewardStateMapper;
import com.slb.proceeds_pool.modules.pool.mapper.ClaimBalanceMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * 账户收益结算：checkpoint / lockedProceeds 只在这里被修改。
 * <p>
 * 调用方负责事务与池子行锁，传入的 PoolLedger 即本次操作中持锁读出的那一份。
 */
@Service
@Slf4j
public class SettlementService implements BalanceChangeHook {

    private final AccountRewardStateMapper rewardStateMapper;
    private final ClaimBalanceMapper claimBalanceMapper;
    private final RewardAccumulator rewardAccumulator;
    private final AssetMover assetMover;
    private final ApplicationEventPublisher eventPublisher;

    public SettlementService(AccountRewardStateMapper rewardStateMapper,
                             ClaimBalanceMapper claimBalanceMapper,
                             RewardAccumulator rewardAccumulator,
                             AssetMover assetMover,
                             ApplicationEventPublisher eventPublisher) {
        this.rewardStateMapper = rewardStateMapper;
        this.claimBalanceMapper = claimBalanceMapper;
        this.rewardAccumulator = rewardAccumulator;
        this.assetMover = assetMover;
        this.eventPublisher = eventPublisher;
    }

    public AccountRewardState loadState(Long poolId, String account) {
        return rewardStateMapper.selectOne(poolId, account)
                .orElseGet(() -> AccountRewardState.zero(poolId, account));
    }

    public BigInteger pendingProceeds(PoolLedger ledger, String account) {
        return rewardAccumulator.pendingProceeds(ledger, loadState(ledger.getId(), account),
                currentBalance(ledger.getId(), account));
    }

    /**
     * 按当前份额结算并发放账户全部待领收益。
     *
     * @return 实际发放金额，无待领收益时为 0
     */
    public BigInteger settle(PoolLedger ledger, String account) {
        return settle(ledger, account, currentBalance(ledger.getId(), account));
    }

    /**
     * 按给定份额（通常是账本变更前的旧余额）结算。待领为 0 时不做任何写入。
     */
    BigInteger settle(PoolLedger ledger, String account, BigInteger balance) {
        AccountRewardState state = loadState(ledger.getId(), account);
        BigInteger pending = rewardAccumulator.pendingProceeds(ledger, state, balance);
        if (pending.signum() == 0) {
            return BigInteger.ZERO;
        }
        // 先划转：失败时直接抛出，记账状态保持不变
        assetMover.transfer(ledger.getId(), ledger.getCustodyAccount(), account, pending, AssetRefType.PAYOUT);

        state.setCheckpoint(ledger.getCumulativeRewardPerShare());
        state.setLockedProceeds(BigInteger.ZERO);
        state.setTotalClaimed(state.getTotalClaimed().add(pending));
        rewardStateMapper.upsert(state);
        ledger.setTotalProceedsPaid(ledger.getTotalProceedsPaid().add(pending));

        log.info("Proceeds settled: pool={}, account={}, balance={}, paid={}",
                ledger.getId(), account, balance, pending);
        eventPublisher.publishEvent(PoolActivityEvent.of(ledger.getId(), PoolEventType.PROCEEDS_PAID,
                account, pending, ledger.getCumulativeRewardPerShare()));
        return pending;
    }

    @Override
    public void beforeBalanceChange(PoolLedger ledger, BalanceChange change) {
        switch (change.kind()) {
            case MINT -> {
                // 追加存入：先按旧份额结清，新份额不参与历史收益
                if (change.oldToBalance().signum() > 0) {
                    settle(ledger, change.to(), change.oldToBalance());
                }
            }
            case BURN -> {
                // 只有 withdraw 会 burn，且 withdraw 已先行结算
            }
            case TRANSFER -> {
                lockSenderProceeds(ledger, change.from(), change.oldFromBalance());
                settle(ledger, change.to(), change.oldToBalance());
            }
        }
    }

    @Override
    public void afterBalanceChange(PoolLedger ledger, BalanceChange change) {
        if (change.kind() == BalanceChange.Kind.MINT || change.kind() == BalanceChange.Kind.TRANSFER) {
            resetCheckpoint(ledger, change.to());
        }
    }

    /**
     * 发送方即将失去的份额上已产生的收益转入 locked（累加），转账不会让发送方损失任何待领收益。
     */
    private void lockSenderProceeds(PoolLedger ledger, String sender, BigInteger oldFromBalance) {
        AccountRewardState state = loadState(ledger.getId(), sender);
        BigInteger newProceeds = rewardAccumulator.accruedSince(
                ledger.getCumulativeRewardPerShare(), state.getCheckpoint(), oldFromBalance);
        state.setLockedProceeds(state.getLockedProceeds().add(newProceeds));
        state.setCheckpoint(ledger.getCumulativeRewardPerShare());
        rewardStateMapper.upsert(state);
    }

    private void resetCheckpoint(PoolLedger ledger, String account) {
        AccountRewardState state = loadState(ledger.getId(), account);
        state.setCheckpoint(ledger.getCumulativeRewardPerShare());
        rewardStateMapper.upsert(state);
    }

    private BigInteger currentBalance(Long poolId, String account) {
        BigInteger balance = claimBalanceMapper.selectBalance(poolId, account);
        return balance != null ? balance : BigInteger.ZERO;
    }
}
