package com.slb.proceeds_pool.modules.pool.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

/**
 * deposit / withdraw / proceeds 共用的金额请求体。金额为 0 由业务层返回 ZERO_AMOUNT。
 */
@Data
@Schema(description = "金额请求 / Amount request")
public class AmountDto {
    @NotNull(message = "amount 不能为空")
    @Schema(description = "金额（底层资产最小单位，必须大于 0）", requiredMode = Schema.RequiredMode.REQUIRED, example = "1000")
    private BigInteger amount;
}
