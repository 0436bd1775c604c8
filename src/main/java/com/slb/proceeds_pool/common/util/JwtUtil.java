package com.slb.proceeds_pool.common.util;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

@Component
public class JwtUtil {

    public static final String CLAIM_TYP = "typ";
    public static final String CLAIM_ROLE = "role";
    private static final String TOKEN_TYPE_ACCESS = "access";

    @Value("${security.jwt.secret}")
    private String secret;

    @Value("${security.jwt.access-token-expire}")
    private long accessTokenExpire;  // seconds

    private Key key;

    @PostConstruct
    public void init() {
        // HS256 要求 secret 至少 32 bytes
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /** 生成 AccessToken：subject=账户地址，claim 写入 typ / role(可选) */
    public String generateAccessToken(String address, @Nullable String role) {
        Map<String, Object> claims = new HashMap<>();
        claims.put(CLAIM_TYP, TOKEN_TYPE_ACCESS);
        if (StringUtils.hasText(role)) {
            claims.put(CLAIM_ROLE, role);
        }
        Date now = new Date();
        Date exp = new Date(now.getTime() + accessTokenExpire * 1000);
        return Jwts.builder()
                .setClaims(claims)
                .setSubject(AccountAddress.normalize(address))
                .setIssuedAt(now)
                .setExpiration(exp)
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * 解析并校验 access token；签名错误/过期/类型不符时抛出 JwtException 子类。
     */
    public Claims parseAccessClaims(String token) {
        Claims claims = Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token).getBody();
        String tokenType = claims.get(CLAIM_TYP, String.class);
        if (!TOKEN_TYPE_ACCESS.equalsIgnoreCase(tokenType)) {
            throw new UnsupportedJwtException("Wrong token type: " + tokenType);
        }
        return claims;
    }

    public long getAccessTokenExpire() {
        return accessTokenExpire;
    }
}
