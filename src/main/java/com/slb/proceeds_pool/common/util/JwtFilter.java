package com.slb.proceeds_pool.common.util;

import com.slb.proceeds_pool.common.security.AuthErrorType;
import com.slb.proceeds_pool.common.security.AuthProblemSupport;
import com.slb.proceeds_pool.common.security.CustomUserDetails;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;

@Component
public class JwtFilter extends OncePerRequestFilter {

    private static final String BEARER = "Bearer ";

    private final JwtUtil jwtUtil;

    public JwtFilter(JwtUtil jwtUtil) {
        this.jwtUtil = jwtUtil;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            processAuthentication(request);
        }
        filterChain.doFilter(request, response);
    }

    private void processAuthentication(HttpServletRequest request) {
        String authHeader = request.getHeader("Authorization");
        // 没有 Authorization 头直接放行，由后续授权规则决定接口是否必须登录
        if (!StringUtils.hasText(authHeader)) {
            return;
        }
        if (!authHeader.startsWith(BEARER)) {
            AuthProblemSupport.flag(request, AuthErrorType.BAD_AUTHORIZATION_HEADER,
                    "Malformed Authorization header",
                    Map.of("Authorization", "Expected 'Authorization: Bearer <token>' format"));
            return;
        }
        String token = authHeader.substring(BEARER.length()).trim();
        if (!StringUtils.hasText(token)) {
            AuthProblemSupport.flag(request, AuthErrorType.BAD_AUTHORIZATION_HEADER,
                    "Missing bearer token", Map.of("Authorization", "Bearer token value is missing"));
            return;
        }

        try {
            Claims claims = jwtUtil.parseAccessClaims(token);
            if (AccountAddress.isZero(claims.getSubject())) {
                AuthProblemSupport.flag(request, AuthErrorType.INVALID_TOKEN,
                        "Token subject is not a valid account address", Map.of("token", "principal_missing"));
                return;
            }
            CustomUserDetails userDetails = new CustomUserDetails(
                    AccountAddress.normalize(claims.getSubject()),
                    claims.get(JwtUtil.CLAIM_ROLE, String.class));
            UsernamePasswordAuthenticationToken authToken = new UsernamePasswordAuthenticationToken(
                    userDetails, null, userDetails.getAuthorities());
            authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authToken);
        } catch (ExpiredJwtException e) {
            AuthProblemSupport.flag(request, AuthErrorType.TOKEN_EXPIRED,
                    "The bearer token is expired at " + e.getClaims().getExpiration(), Map.of("token", "expired"));
        } catch (JwtException | IllegalArgumentException e) {
            AuthProblemSupport.flag(request, AuthErrorType.INVALID_TOKEN,
                    "Invalid token: " + e.getMessage(), Map.of("token", "invalid"));
        }
    }
}
