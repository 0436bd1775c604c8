package com.slb.proceeds_pool.modules.pool.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "份额转让请求 / Claim transfer request")
public class TransferDto {
    @Schema(description = "接收方账户地址；为空或零地址时返回 ZERO_ADDRESS", requiredMode = Schema.RequiredMode.REQUIRED, example = "0xcd34...")
    private String to;

    @NotNull(message = "amount 不能为空")
    @Schema(description = "转让份额数量（必须大于 0）", requiredMode = Schema.RequiredMode.REQUIRED, example = "500")
    private BigInteger amount;
}
