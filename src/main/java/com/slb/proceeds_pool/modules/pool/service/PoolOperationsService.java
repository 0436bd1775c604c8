package com.slb.proceeds_pool.modules.pool.service;

import com.slb.proceeds_pool.common.exception.BizException;
import com.slb.proceeds_pool.common.exception.PoolErrorCode;
import com.slb.proceeds_pool.common.util.AccountAddress;
import com.slb.proceeds_pool.common.util.Amounts;
import com.slb.proceeds_pool.modules.asset.entity.AssetRefType;
import com.slb.proceeds_pool.modules.asset.service.AssetMover;
import com.slb.proceeds_pool.modules.pool.entity.AccountRewardState;
import com.slb.proceeds_pool.modules.pool.entity.PoolLedger;
import com.slb.proceeds_pool.modules.pool.event.PoolActivityEvent;
import com.slb.proceeds_pool.modules.pool.event.PoolEventType;
import com.slb.proceeds_pool.modules.pool.vo.PendingProceedsVo;
import com.slb.proceeds_pool.modules.pool.vo.PoolInfoVo;
import com.slb.proceeds_pool.modules.pool.vo.PoolOperationVo;
import com.slb.proceeds_pool.modules.pool.vo.UserInfoVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * 池子对外操作：deposit / withdraw / depositProceeds / claimProceeds / transfer 与只读视图。
 * <p>
 * 每个写操作：先做参数校验，再在同一事务内锁定池子行、执行全部变更并回写；
 * 任一资产划转失败都会抛出 BizException 使整个事务回滚。
 */
@Service
@Slf4j
public class PoolOperationsService {

    private final PoolService poolService;
    private final ClaimLedgerService claimLedgerService;
    private final SettlementService settlementService;
    private final RewardAccumulator rewardAccumulator;
    private final AssetMover assetMover;
    private final ApplicationEventPublisher eventPublisher;

    public PoolOperationsService(PoolService poolService,
                                 ClaimLedgerService claimLedgerService,
                                 SettlementService settlementService,
                                 RewardAccumulator rewardAccumulator,
                                 AssetMover assetMover,
                                 ApplicationEventPublisher eventPublisher) {
        this.poolService = poolService;
        this.claimLedgerService = claimLedgerService;
        this.settlementService = settlementService;
        this.rewardAccumulator = rewardAccumulator;
        this.assetMover = assetMover;
        this.eventPublisher = eventPublisher;
    }

    @Transactional
    public PoolOperationVo deposit(Long poolId, String rawCaller, BigInteger amount) {
        String caller = poolService.requireExternalAccount(AccountAddress.require(rawCaller));
        Amounts.require(amount);

        PoolLedger ledger = poolService.lockForUpdate(poolId);
        BigInteger paidBefore = ledger.getTotalProceedsPaid();
        // 零份额托管收益只在此处被取出：记下金额，份额铸造后整笔发放
        BigInteger bonus = BigInteger.ZERO;
        if (claimLedgerService.totalSupply(poolId).signum() == 0
                && ledger.getPendingZeroSupplyProceeds().signum() > 0) {
            bonus = ledger.getPendingZeroSupplyProceeds();
        }

        assetMover.transfer(poolId, caller, ledger.getCustodyAccount(), amount, AssetRefType.DEPOSIT);
        claimLedgerService.mint(ledger, caller, amount);

        if (bonus.signum() > 0) {
            assetMover.transfer(poolId, ledger.getCustodyAccount(), caller, bonus, AssetRefType.BONUS);
            ledger.setPendingZeroSupplyProceeds(BigInteger.ZERO);
            eventPublisher.publishEvent(PoolActivityEvent.of(poolId, PoolEventType.FIRST_DEPOSITOR_BONUS,
                    caller, bonus, ledger.getCumulativeRewardPerShare()));
        }
        poolService.saveAccounting(ledger);

        eventPublisher.publishEvent(PoolActivityEvent.of(poolId, PoolEventType.DEPOSIT,
                caller, amount, ledger.getCumulativeRewardPerShare()));
        log.info("Deposit done: pool={}, account={}, amount={}, bonus={}", poolId, caller, amount, bonus);
        return result(ledger, caller, "DEPOSIT", amount, paidBefore, bonus);
    }

    @Transactional
    public PoolOperationVo withdraw(Long poolId, String rawCaller, BigInteger amount) {
        String caller = poolService.requireExternalAccount(AccountAddress.require(rawCaller));
        Amounts.require(amount);

        PoolLedger ledger = poolService.lockForUpdate(poolId);
        BigInteger balance = claimLedgerService.balanceOf(poolId, caller);
        if (amount.compareTo(balance) > 0) {
            throw new BizException(PoolErrorCode.INSUFFICIENT_BALANCE,
                    "份额余额不足：当前 " + balance + "，申请取回 " + amount);
        }
        BigInteger paidBefore = ledger.getTotalProceedsPaid();

        // 先结清收益，保证取回后待领收益为 0
        settlementService.settle(ledger, caller);
        claimLedgerService.burn(ledger, caller, amount);
        assetMover.transfer(poolId, ledger.getCustodyAccount(), caller, amount, AssetRefType.WITHDRAW);
        poolService.saveAccounting(ledger);

        eventPublisher.publishEvent(PoolActivityEvent.of(poolId, PoolEventType.WITHDRAW,
                caller, amount, ledger.getCumulativeRewardPerShare()));
        log.info("Withdraw done: pool={}, account={}, amount={}", poolId, caller, amount);
        return result(ledger, caller, "WITHDRAW", amount, paidBefore, BigInteger.ZERO);
    }

    @Transactional
    public PoolOperationVo depositProceeds(Long poolId, String rawCaller, BigInteger amount) {
        String caller = poolService.requireExternalAccount(AccountAddress.require(rawCaller));
        Amounts.require(amount);

        PoolLedger ledger = poolService.lockForUpdate(poolId);
        if (!caller.equals(ledger.getOwnerAccount())) {
            throw new BizException(PoolErrorCode.NOT_PRIVILEGED);
        }
        BigInteger paidBefore = ledger.getTotalProceedsPaid();

        assetMover.transfer(poolId, caller, ledger.getCustodyAccount(), amount, AssetRefType.PROCEEDS);
        BigInteger totalShares = claimLedgerService.totalSupply(poolId);
        BigInteger increment = rewardAccumulator.accrue(ledger, amount, totalShares);
        poolService.saveAccounting(ledger);

        eventPublisher.publishEvent(PoolActivityEvent.of(poolId, PoolEventType.PROCEEDS_DEPOSITED,
                caller, amount, ledger.getCumulativeRewardPerShare()));
        log.info("Proceeds deposited: pool={}, amount={}, totalShares={}, increment={}, escrow={}, accRewardPerShare={}",
                poolId, amount, totalShares, increment, ledger.getPendingZeroSupplyProceeds(),
                ledger.getCumulativeRewardPerShare());
        return result(ledger, caller, "PROCEEDS", amount, paidBefore, BigInteger.ZERO);
    }

    /**
     * 领取全部待领收益；无待领收益时静默成功。
     */
    @Transactional
    public PoolOperationVo claimProceeds(Long poolId, String rawCaller) {
        String caller = poolService.requireExternalAccount(AccountAddress.require(rawCaller));

        PoolLedger ledger = poolService.lockForUpdate(poolId);
        BigInteger paidBefore = ledger.getTotalProceedsPaid();
        BigInteger paid = settlementService.settle(ledger, caller);
        if (paid.signum() > 0) {
            poolService.saveAccounting(ledger);
        }
        return result(ledger, caller, "CLAIM", BigInteger.ZERO, paidBefore, BigInteger.ZERO);
    }

    @Transactional
    public PoolOperationVo transfer(Long poolId, String rawCaller, String rawTo, BigInteger amount) {
        String caller = poolService.requireExternalAccount(AccountAddress.require(rawCaller));
        String to = poolService.requireExternalAccount(AccountAddress.require(rawTo));
        Amounts.require(amount);

        PoolLedger ledger = poolService.lockForUpdate(poolId);
        BigInteger paidBefore = ledger.getTotalProceedsPaid();
        claimLedgerService.transfer(ledger, caller, to, amount);
        poolService.saveAccounting(ledger);

        eventPublisher.publishEvent(new PoolActivityEvent(poolId, PoolEventType.CLAIM_TRANSFER,
                caller, to, amount, ledger.getCumulativeRewardPerShare()));
        log.info("Claim transfer done: pool={}, from={}, to={}, amount={}", poolId, caller, to, amount);
        return result(ledger, caller, "TRANSFER", amount, paidBefore, BigInteger.ZERO);
    }

    public PendingProceedsVo getPendingProceeds(Long poolId, String rawAccount) {
        String account = AccountAddress.require(rawAccount);
        PoolLedger ledger = poolService.getPool(poolId);
        return new PendingProceedsVo(poolId, account, settlementService.pendingProceeds(ledger, account));
    }

    public PoolInfoVo getContractInfo(Long poolId) {
        return poolService.toInfo(poolService.getPool(poolId));
    }

    public UserInfoVo getUserInfo(Long poolId, String rawAccount) {
        String account = AccountAddress.require(rawAccount);
        PoolLedger ledger = poolService.getPool(poolId);
        AccountRewardState state = settlementService.loadState(poolId, account);
        BigInteger balance = claimLedgerService.balanceOf(poolId, account);

        UserInfoVo vo = new UserInfoVo();
        vo.setPoolId(poolId);
        vo.setAccount(account);
        vo.setBalance(balance);
        vo.setPendingProceeds(rewardAccumulator.pendingProceeds(ledger, state, balance));
        vo.setCheckpoint(state.getCheckpoint());
        vo.setLockedProceeds(state.getLockedProceeds());
        vo.setTotalClaimed(state.getTotalClaimed());
        return vo;
    }

    private PoolOperationVo result(PoolLedger ledger, String account, String operation, BigInteger amount,
                                   BigInteger paidBefore, BigInteger bonus) {
        PoolOperationVo vo = new PoolOperationVo();
        vo.setPoolId(ledger.getId());
        vo.setAccount(account);
        vo.setOperation(operation);
        vo.setAmount(amount);
        vo.setProceedsPaid(ledger.getTotalProceedsPaid().subtract(paidBefore));
        vo.setBonusPaid(bonus);
        vo.setBalanceAfter(claimLedgerService.balanceOf(ledger.getId(), account));
        vo.setCumulativeRewardPerShare(ledger.getCumulativeRewardPerShare());
        return vo;
    }
}
