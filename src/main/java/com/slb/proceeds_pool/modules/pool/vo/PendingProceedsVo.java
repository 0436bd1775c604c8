package com.slb.proceeds_pool.modules.pool.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "待领收益 / Pending proceeds")
public class PendingProceedsVo {
    private Long poolId;
    private String account;
    @Schema(description = "待领收益（最小单位）", example = "150")
    private BigInteger pendingProceeds;
}
