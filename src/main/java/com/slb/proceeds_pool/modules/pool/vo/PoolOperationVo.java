package com.slb.proceeds_pool.modules.pool.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "池子操作结果 / Result of a pool operation")
public class PoolOperationVo {
    private Long poolId;
    @Schema(description = "发起账户")
    private String account;
    @Schema(description = "操作：DEPOSIT / WITHDRAW / PROCEEDS / CLAIM / TRANSFER", example = "DEPOSIT")
    private String operation;
    @Schema(description = "操作金额（claim 时为 0）", example = "1000")
    private BigInteger amount;
    @Schema(description = "本次操作中结算发放的收益（含转让接收方被动结算）", example = "0")
    private BigInteger proceedsPaid;
    @Schema(description = "本次操作中发放的首存奖励", example = "0")
    private BigInteger bonusPaid;
    @Schema(description = "操作后发起账户的份额余额", example = "1000")
    private BigInteger balanceAfter;
    @Schema(description = "操作后的每份额累计收益")
    private BigInteger cumulativeRewardPerShare;
}
