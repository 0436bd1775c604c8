package com.slb.proceeds_pool.modules.auth.service;

import com.slb.proceeds_pool.common.util.JwtUtil;
import com.slb.proceeds_pool.modules.auth.config.AuthProperties;
import io.jsonwebtoken.Claims;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BootstrapAdminTokenIssuerTest {

    private final AuthProperties authProperties = new AuthProperties();
    private JwtUtil jwtUtil;
    private BootstrapAdminTokenIssuer issuer;

    @BeforeEach
    void setup() {
        jwtUtil = new JwtUtil();
        ReflectionTestUtils.setField(jwtUtil, "secret", "unit-test-secret-unit-test-secret-0123456789");
        ReflectionTestUtils.setField(jwtUtil, "accessTokenExpire", 3600L);
        jwtUtil.init();
        issuer = new BootstrapAdminTokenIssuer(authProperties, jwtUtil);
    }

    @Test
    void configuredAddress_getsAdminToken() {
        authProperties.setBootstrapAdmin(" 0xAD00000000000000000000000000000000000001 ");

        Optional<String> token = issuer.issueBootstrapToken();

        assertTrue(token.isPresent());
        Claims claims = jwtUtil.parseAccessClaims(token.get());
        assertEquals("0xad00000000000000000000000000000000000001", claims.getSubject());
        assertEquals("ADMIN", claims.get(JwtUtil.CLAIM_ROLE, String.class));
    }

    @Test
    void blankOrZeroAddress_issuesNothing() {
        authProperties.setBootstrapAdmin(null);
        assertTrue(issuer.issueBootstrapToken().isEmpty());

        authProperties.setBootstrapAdmin("  ");
        assertTrue(issuer.issueBootstrapToken().isEmpty());

        authProperties.setBootstrapAdmin("0x0000");
        assertTrue(issuer.issueBootstrapToken().isEmpty());

        // 未配置时启动回调只打日志
        assertDoesNotThrow(issuer::onReady);
    }
}
