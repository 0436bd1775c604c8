package com.slb.proceeds_pool.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.proceeds_pool.common.api.ApiResponse;
import com.slb.proceeds_pool.common.trace.TraceIdHolder;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

/**
 * 记录过滤器阶段发现的鉴权问题，并在入口点/拒绝处理器中以 ApiResponse 输出。
 */
public final class AuthProblemSupport {

    public static final String AUTH_ERROR_CONTEXT_ATTR = AuthProblemSupport.class.getName() + ".CONTEXT";

    private AuthProblemSupport() {
    }

    /**
     * 只保留第一次标记的问题，后续标记忽略。
     */
    public static void flag(HttpServletRequest request, AuthErrorType type, @Nullable String detail,
                            @Nullable Map<String, String> errors) {
        if (request.getAttribute(AUTH_ERROR_CONTEXT_ATTR) == null) {
            request.setAttribute(AUTH_ERROR_CONTEXT_ATTR, new AuthErrorContext(type, detail, errors));
        }
    }

    @Nullable
    public static AuthErrorContext get(HttpServletRequest request) {
        Object context = request.getAttribute(AUTH_ERROR_CONTEXT_ATTR);
        if (context instanceof AuthErrorContext authErrorContext) {
            return authErrorContext;
        }
        return null;
    }

    public static void writeApiResponse(HttpServletResponse response, AuthErrorContext context,
                                        ObjectMapper mapper) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        AuthErrorType type = context.type();
        int status = type.getStatus().value();
        Map<String, String> errors = context.errors() != null ? context.errors() : Collections.emptyMap();

        response.setStatus(status);
        response.setContentType("application/json;charset=UTF-8");
        response.setHeader(TraceIdHolder.TRACE_ID_HEADER, TraceIdHolder.require());
        if (status == 401) {
            response.setHeader("WWW-Authenticate",
                    "Bearer error=\"invalid_token\", error_description=\"" + type.getDefaultDetail() + "\"");
        }

        ApiResponse<Void> body = ApiResponse.error(status, type.getCode(), type.getDisplayMessage(), errors);
        if (StringUtils.hasText(context.detail()) && body.getError() != null) {
            body.getError().setDetail(context.detail());
        }
        mapper.writeValue(response.getOutputStream(), body);
    }
}
