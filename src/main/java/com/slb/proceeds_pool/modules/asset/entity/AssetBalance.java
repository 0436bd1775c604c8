package com.slb.proceeds_pool.modules.asset.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * 对应表：asset_balance（账户持有的底层资产，池子托管地址同样在此表中记账）
 */
@Data
public class AssetBalance implements Serializable {
    private static final long serialVersionUID = 1L;

    private String account;
    private BigInteger balance;
    private LocalDateTime updatedTime;
}
