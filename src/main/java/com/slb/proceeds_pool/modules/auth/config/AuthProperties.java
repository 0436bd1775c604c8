package com.slb.proceeds_pool.modules.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 认证相关配置（app.auth.*）。
 */
@Component
@ConfigurationProperties(prefix = "app.auth")
@Data
public class AuthProperties {

    /**
     * 启动时为该地址签发一次 ADMIN 令牌并写入日志；留空则不签发。
     */
    private String bootstrapAdmin;
}
