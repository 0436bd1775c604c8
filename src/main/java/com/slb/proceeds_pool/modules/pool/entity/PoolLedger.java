package com.slb.proceeds_pool.modules.pool.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * 池子全局记账状态，对应表：pool_ledger。
 * 每个操作开始时以 FOR UPDATE 锁定本行，在同一事务内读写并回写。
 */
@Data
public class PoolLedger implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;

    /** 池子唯一编码 */
    private String poolCode;

    /** 唯一有权注入收益的账户 */
    private String ownerAccount;

    /** 托管底层资产的账户 */
    private String custodyAccount;

    /** 每份额累计收益，按 PRECISION 放大；只增不减 */
    private BigInteger cumulativeRewardPerShare;

    /** 累计注入收益（含零份额托管部分） */
    private BigInteger totalProceedsDeposited;

    /** 零份额期间注入、等待首个存入者领取的收益 */
    private BigInteger pendingZeroSupplyProceeds;

    /** 累计已结算发放的收益（不含首存奖励） */
    private BigInteger totalProceedsPaid;

    private LocalDateTime createdTime;
    private LocalDateTime updatedTime;
}
