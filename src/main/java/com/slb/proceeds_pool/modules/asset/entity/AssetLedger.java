package com.slb.proceeds_pool.modules.asset.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * 底层资产流水记录，每一次资产划转一行。
 * 对应 asset_ledger 表。
 */
@Data
public class AssetLedger implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    /** 关联池子（后台入金为空） */
    private Long poolId;
    /** 转出账户（后台入金为空） */
    private String fromAccount;
    private String toAccount;
    /** 最小单位整数 */
    private BigInteger amount;
    /** 流水类型，见 AssetRefType */
    private String refType;
    private String remark;
    /** 发起请求的 traceId，便于与日志对齐 */
    private String traceId;
    private LocalDateTime createdTime;
}
