package com.slb.proceeds_pool.modules.asset.entity;

import java.util.Locale;

/**
 * asset_ledger.ref_type 取值。
 */
public enum AssetRefType {
    /** 存入池子 */
    DEPOSIT,
    /** 从池子取回本金 */
    WITHDRAW,
    /** 管理账户注入收益 */
    PROCEEDS,
    /** 结算发放收益 */
    PAYOUT,
    /** 零份额期间托管收益，发放给首个存入者 */
    BONUS,
    /** 后台入金 */
    CREDIT;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
