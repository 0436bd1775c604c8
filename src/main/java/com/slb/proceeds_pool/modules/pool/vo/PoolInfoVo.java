package com.slb.proceeds_pool.modules.pool.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;
import java.time.LocalDateTime;

@Data
@Schema(description = "池子概况 / Pool contract info")
public class PoolInfoVo {
    private Long poolId;
    @Schema(description = "池子编码", example = "main")
    private String poolCode;
    @Schema(description = "唯一有权注入收益的账户")
    private String ownerAccount;
    @Schema(description = "托管账户", example = "pool:main")
    private String custodyAccount;
    @Schema(description = "底层资产展示符号", example = "UNIT")
    private String assetSymbol;
    @Schema(description = "总份额", example = "3000")
    private BigInteger totalShares;
    @Schema(description = "托管账户当前持有的底层资产", example = "3300")
    private BigInteger totalUnderlyingHeld;
    @Schema(description = "累计注入收益", example = "300")
    private BigInteger totalProceedsDeposited;
    @Schema(description = "零份额期间托管、等待首个存入者的收益", example = "0")
    private BigInteger pendingZeroSupplyProceeds;
    @Schema(description = "累计已结算发放的收益（不含首存奖励）", example = "0")
    private BigInteger totalProceedsPaid;
    @Schema(description = "每份额累计收益（按 precision 放大）", example = "100000000000000000")
    private BigInteger cumulativeRewardPerShare;
    @Schema(description = "累计值放大倍数", example = "1000000000000000000")
    private BigInteger precision;
    private LocalDateTime createdTime;
}
