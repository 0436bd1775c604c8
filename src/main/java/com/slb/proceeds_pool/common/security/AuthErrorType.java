package com.slb.proceeds_pool.common.security;

import org.springframework.http.HttpStatus;

/**
 * Catalogue of authentication/authorization failure types.
 */
public enum AuthErrorType {
    MISSING_AUTHORIZATION(HttpStatus.UNAUTHORIZED, "AUTH_MISSING_AUTHZ", "Authorization header is required",
            "未登录或登录信息缺失，请先获取访问令牌"),
    BAD_AUTHORIZATION_HEADER(HttpStatus.BAD_REQUEST, "AUTH_BAD_HEADER", "Malformed Authorization header",
            "登录信息格式错误，请使用 Authorization: Bearer <token>"),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "AUTH_INVALID_TOKEN", "Invalid access token",
            "访问令牌无效"),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "AUTH_TOKEN_EXPIRED", "Token expired",
            "访问令牌已过期"),
    INSUFFICIENT_SCOPE(HttpStatus.FORBIDDEN, "AUTH_INSUFFICIENT_SCOPE", "Insufficient scope",
            "权限不足");

    private final HttpStatus status;
    private final String code;
    private final String defaultDetail;
    private final String displayMessage;

    AuthErrorType(HttpStatus status, String code, String defaultDetail, String displayMessage) {
        this.status = status;
        this.code = code;
        this.defaultDetail = defaultDetail;
        this.displayMessage = displayMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultDetail() {
        return defaultDetail;
    }

    public String getDisplayMessage() {
        return displayMessage;
    }
}
