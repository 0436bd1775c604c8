package com.slb.proceeds_pool.modules.pool.event;

/**
 * 池子事件类型，写入 pool_event.event_type。
 */
public enum PoolEventType {
    DEPOSIT,
    WITHDRAW,
    /** 收益注入；零份额时进入托管 */
    PROCEEDS_DEPOSITED,
    /** 结算发放收益 */
    PROCEEDS_PAID,
    /** 零份额托管收益发放给首个存入者 */
    FIRST_DEPOSITOR_BONUS,
    CLAIM_TRANSFER
}
