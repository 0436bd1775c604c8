package com.slb.proceeds_pool.modules.asset.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "后台入金请求 / Admin credit request")
public class AssetCreditDto {
    @NotBlank(message = "account 不能为空")
    @Schema(description = "入金账户地址", requiredMode = Schema.RequiredMode.REQUIRED, example = "0xab12...")
    private String account;

    @NotNull(message = "amount 不能为空")
    @Schema(description = "入金数量（最小单位，必须大于 0）", requiredMode = Schema.RequiredMode.REQUIRED, example = "5000")
    private BigInteger amount;

    @Size(max = 255, message = "remark 过长")
    @Schema(description = "备注（可选）")
    private String remark;
}
