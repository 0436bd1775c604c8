package com.slb.proceeds_pool.modules.auth.service;

import com.slb.proceeds_pool.common.util.AccountAddress;
import com.slb.proceeds_pool.common.util.JwtUtil;
import com.slb.proceeds_pool.modules.auth.config.AuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 签发令牌的接口本身要求 ADMIN，首个管理员令牌只能在启动时按配置签发。
 */
@Service
@Slf4j
public class BootstrapAdminTokenIssuer {

    public static final String ROLE_ADMIN = "ADMIN";

    private final AuthProperties authProperties;
    private final JwtUtil jwtUtil;

    public BootstrapAdminTokenIssuer(AuthProperties authProperties, JwtUtil jwtUtil) {
        this.authProperties = authProperties;
        this.jwtUtil = jwtUtil;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        issueBootstrapToken().ifPresentOrElse(
                token -> log.warn("Bootstrap admin token issued: address={}, expiresIn={}s, token={}",
                        AccountAddress.normalize(authProperties.getBootstrapAdmin()),
                        jwtUtil.getAccessTokenExpire(), token),
                () -> log.info("No bootstrap admin configured, skip issuing admin token"));
    }

    public Optional<String> issueBootstrapToken() {
        String configured = authProperties.getBootstrapAdmin();
        if (AccountAddress.isZero(configured)) {
            return Optional.empty();
        }
        return Optional.of(jwtUtil.generateAccessToken(AccountAddress.normalize(configured), ROLE_ADMIN));
    }
}
