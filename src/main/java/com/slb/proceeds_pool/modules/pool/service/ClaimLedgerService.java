package com.slb.proceeds_pool.modules.pool.service;

import com.slb.proceeds_pool.common.exception.BizException;
import com.slb.proceeds_pool.common.exception.PoolErrorCode;
import com.slb.proceeds_pool.common.util.Amounts;
import com.slb.proceeds_pool.modules.pool.entity.PoolLedger;
import com.slb.proceeds_pool.modules.pool.mapper.ClaimBalanceMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * 份额账本：维护账户份额与总份额，每次余额变化前后回调 {@link BalanceChangeHook}。
 */
@Service
@Slf4j
public class ClaimLedgerService {

    private final ClaimBalanceMapper claimBalanceMapper;
    private final BalanceChangeHook balanceChangeHook;

    public ClaimLedgerService(ClaimBalanceMapper claimBalanceMapper, BalanceChangeHook balanceChangeHook) {
        this.claimBalanceMapper = claimBalanceMapper;
        this.balanceChangeHook = balanceChangeHook;
    }

    public BigInteger balanceOf(Long poolId, String account) {
        BigInteger balance = claimBalanceMapper.selectBalance(poolId, account);
        return balance != null ? balance : BigInteger.ZERO;
    }

    public BigInteger totalSupply(Long poolId) {
        BigInteger supply = claimBalanceMapper.selectTotalSupply(poolId);
        return supply != null ? supply : BigInteger.ZERO;
    }

    public void initSupply(Long poolId) {
        claimBalanceMapper.insertSupply(poolId);
    }

    public void mint(PoolLedger ledger, String to, BigInteger amount) {
        Amounts.requirePositive(amount);
        Long poolId = ledger.getId();
        BalanceChange change = BalanceChange.mint(to, amount, balanceOf(poolId, to));

        balanceChangeHook.beforeBalanceChange(ledger, change);
        claimBalanceMapper.increaseBalance(poolId, to, amount);
        claimBalanceMapper.changeTotalSupply(poolId, amount);
        balanceChangeHook.afterBalanceChange(ledger, change);
    }

    public void burn(PoolLedger ledger, String from, BigInteger amount) {
        Amounts.requirePositive(amount);
        Long poolId = ledger.getId();
        BigInteger oldFrom = balanceOf(poolId, from);
        if (amount.compareTo(oldFrom) > 0) {
            throw new BizException(PoolErrorCode.INSUFFICIENT_BALANCE);
        }
        BalanceChange change = BalanceChange.burn(from, amount, oldFrom);

        balanceChangeHook.beforeBalanceChange(ledger, change);
        decrease(poolId, from, amount);
        claimBalanceMapper.changeTotalSupply(poolId, amount.negate());
        balanceChangeHook.afterBalanceChange(ledger, change);
    }

    /**
     * 份额转让。自转自仅做校验，不改变任何状态。
     */
    public void transfer(PoolLedger ledger, String from, String to, BigInteger amount) {
        Amounts.requirePositive(amount);
        Long poolId = ledger.getId();
        BigInteger oldFrom = balanceOf(poolId, from);
        if (amount.compareTo(oldFrom) > 0) {
            throw new BizException(PoolErrorCode.INSUFFICIENT_BALANCE);
        }
        if (from.equals(to)) {
            log.debug("Self transfer ignored: pool={}, account={}, amount={}", poolId, from, amount);
            return;
        }
        BalanceChange change = BalanceChange.transfer(from, to, amount, oldFrom, balanceOf(poolId, to));

        balanceChangeHook.beforeBalanceChange(ledger, change);
        decrease(poolId, from, amount);
        claimBalanceMapper.increaseBalance(poolId, to, amount);
        balanceChangeHook.afterBalanceChange(ledger, change);
    }

    private void decrease(Long poolId, String account, BigInteger amount) {
        if (claimBalanceMapper.decreaseBalance(poolId, account, amount) != 1) {
            throw new BizException(PoolErrorCode.INSUFFICIENT_BALANCE);
        }
    }
}
