package com.slb.proceeds_pool.modules.pool.service;

import com.slb.proceeds_pool.modules.pool.entity.PoolLedger;

/**
 * 份额账本在每次 mint / burn / transfer 时同步回调的结算钩子。
 * 账本必须先调用 {@link #beforeBalanceChange}，写入新余额后再调用 {@link #afterBalanceChange}。
 */
public interface BalanceChangeHook {

    void beforeBalanceChange(PoolLedger ledger, BalanceChange change);

    void afterBalanceChange(PoolLedger ledger, BalanceChange change);
}
