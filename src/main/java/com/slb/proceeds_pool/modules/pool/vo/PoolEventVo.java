package com.slb.proceeds_pool.modules.pool.vo;

import com.slb.proceeds_pool.modules.pool.entity.PoolEvent;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;
import java.time.LocalDateTime;

@Data
@Schema(description = "池子事件 / Pool audit event")
public class PoolEventVo {
    private Long id;
    private Long poolId;
    @Schema(description = "DEPOSIT / WITHDRAW / PROCEEDS_DEPOSITED / PROCEEDS_PAID / FIRST_DEPOSITOR_BONUS / CLAIM_TRANSFER",
            example = "PROCEEDS_DEPOSITED")
    private String eventType;
    private String account;
    private String counterparty;
    private BigInteger amount;
    private BigInteger cumulativeRewardPerShare;
    private String traceId;
    private LocalDateTime createdTime;

    public static PoolEventVo from(PoolEvent event) {
        PoolEventVo vo = new PoolEventVo();
        vo.setId(event.getId());
        vo.setPoolId(event.getPoolId());
        vo.setEventType(event.getEventType());
        vo.setAccount(event.getAccount());
        vo.setCounterparty(event.getCounterparty());
        vo.setAmount(event.getAmount());
        vo.setCumulativeRewardPerShare(event.getCumulativeRewardPerShare());
        vo.setTraceId(event.getTraceId());
        vo.setCreatedTime(event.getCreatedTime());
        return vo;
    }
}
