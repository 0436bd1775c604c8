package com.slb.proceeds_pool.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 池子业务错误目录：code 为稳定机器码，displayMessage 用于前端展示。
 */
public enum PoolErrorCode {
    ZERO_AMOUNT(HttpStatus.BAD_REQUEST, "ZERO_AMOUNT", "金额必须大于 0"),
    ZERO_ADDRESS(HttpStatus.BAD_REQUEST, "ZERO_ADDRESS", "账户地址不能为空或为零地址"),
    RESERVED_ADDRESS(HttpStatus.BAD_REQUEST, "RESERVED_ADDRESS", "池子托管地址不能作为操作账户或接收方"),
    AMOUNT_TOO_LARGE(HttpStatus.BAD_REQUEST, "AMOUNT_TOO_LARGE", "金额超出允许范围"),
    INSUFFICIENT_BALANCE(HttpStatus.BAD_REQUEST, "INSUFFICIENT_BALANCE", "份额余额不足"),
    TRANSFER_FAILED(HttpStatus.CONFLICT, "TRANSFER_FAILED", "资产划转失败（余额不足）"),
    NOT_PRIVILEGED(HttpStatus.FORBIDDEN, "NOT_PRIVILEGED", "仅池子管理账户可执行该操作"),
    POOL_NOT_FOUND(HttpStatus.NOT_FOUND, "POOL_NOT_FOUND", "池子不存在"),
    POOL_ALREADY_EXISTS(HttpStatus.CONFLICT, "POOL_ALREADY_EXISTS", "池子编码已存在");

    private final HttpStatus status;
    private final String code;
    private final String displayMessage;

    PoolErrorCode(HttpStatus status, String code, String displayMessage) {
        this.status = status;
        this.code = code;
        this.displayMessage = displayMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayMessage() {
        return displayMessage;
    }
}
