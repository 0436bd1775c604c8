package com.slb.proceeds_pool.modules.pool.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * 池子事件审计记录，对应表：pool_event。
 */
@Data
public class PoolEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private Long poolId;
    /** 见 PoolEventType */
    private String eventType;
    private String account;
    /** 份额转让的接收方 */
    private String counterparty;
    private BigInteger amount;
    /** 事件发生后的每份额累计收益 */
    private BigInteger cumulativeRewardPerShare;
    private String traceId;
    private LocalDateTime createdTime;
}
