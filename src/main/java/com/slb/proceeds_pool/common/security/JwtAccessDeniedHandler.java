package com.slb.proceeds_pool.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

@Component
public class JwtAccessDeniedHandler implements AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    public JwtAccessDeniedHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        // 403 语义固定，不复用过滤器阶段的 401 上下文
        AuthErrorContext context = new AuthErrorContext(
                AuthErrorType.INSUFFICIENT_SCOPE,
                accessDeniedException != null ? accessDeniedException.getMessage() : null,
                Map.of("scope", "insufficient"));
        AuthProblemSupport.writeApiResponse(response, context, objectMapper);
    }
}
