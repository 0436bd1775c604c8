package com.slb.proceeds_pool.modules.asset.vo;

import com.slb.proceeds_pool.modules.asset.entity.AssetLedger;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigInteger;
import java.time.LocalDateTime;

@Data
@Schema(description = "资产流水 / Asset ledger entry")
public class AssetLedgerVo {
    private Long id;
    @Schema(description = "关联池子 ID（后台入金为空）")
    private Long poolId;
    private String fromAccount;
    private String toAccount;
    private BigInteger amount;
    @Schema(description = "流水类型：deposit / withdraw / proceeds / payout / bonus / credit", example = "payout")
    private String refType;
    private String remark;
    private LocalDateTime createdTime;

    public static AssetLedgerVo from(AssetLedger ledger) {
        AssetLedgerVo vo = new AssetLedgerVo();
        vo.setId(ledger.getId());
        vo.setPoolId(ledger.getPoolId());
        vo.setFromAccount(ledger.getFromAccount());
        vo.setToAccount(ledger.getToAccount());
        vo.setAmount(ledger.getAmount());
        vo.setRefType(ledger.getRefType());
        vo.setRemark(ledger.getRemark());
        vo.setCreatedTime(ledger.getCreatedTime());
        return vo;
    }
}
