package com.slb.proceeds_pool.modules.pool.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 池子相关配置（app.pool.*）。
 */
@Component
@ConfigurationProperties(prefix = "app.pool")
@Data
public class PoolProperties {

    /**
     * 底层资产展示符号，仅用于接口展示。
     */
    private String assetSymbol = "UNIT";

    /**
     * 托管地址前缀：池子托管账户为 prefix + poolCode。
     */
    private String custodyPrefix = "pool:";

    /**
     * 分页接口的最大页大小。
     */
    private int maxPageSize = 100;

    public int clampPageSize(int size) {
        if (size <= 0) {
            return 1;
        }
        return Math.min(size, maxPageSize);
    }
}
