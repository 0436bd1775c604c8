package com.slb.proceeds_pool.modules.pool.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "账户在池子中的状态 / Account state in a pool")
public class UserInfoVo {
    private Long poolId;
    private String account;
    @Schema(description = "份额余额", example = "1000")
    private BigInteger balance;
    @Schema(description = "待领收益 = locked + (acc - checkpoint) * balance / precision", example = "100")
    private BigInteger pendingProceeds;
    @Schema(description = "上次结算时的每份额累计收益")
    private BigInteger checkpoint;
    @Schema(description = "转出份额前已产生、尚未领取的收益", example = "0")
    private BigInteger lockedProceeds;
    @Schema(description = "累计已领取收益", example = "0")
    private BigInteger totalClaimed;
}
