package com.slb.proceeds_pool.modules.asset.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "底层资产余额 / Underlying asset balance")
public class AssetBalanceVo {
    @Schema(description = "账户地址", example = "0xab12...")
    private String account;
    @Schema(description = "余额（最小单位）", example = "1000")
    private BigInteger balance;
}
