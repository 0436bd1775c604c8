package com.slb.proceeds_pool.common.exception;

public class BizException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // HTTP 语义的状态码
    private final int code;

    // 稳定机器码（可为空，兼容只带文案的业务错误）
    private final PoolErrorCode errorCode;

    public BizException(String message) {
        super(message);
        this.code = 400; // 默认400 - 业务错误
        this.errorCode = null;
    }

    public BizException(int code, String message) {
        super(message);
        this.code = code;
        this.errorCode = null;
    }

    public BizException(PoolErrorCode errorCode) {
        this(errorCode, errorCode.getDisplayMessage());
    }

    public BizException(PoolErrorCode errorCode, String message) {
        super(message);
        this.code = errorCode.getStatus().value();
        this.errorCode = errorCode;
    }

    public int getCode() {
        return code;
    }

    public PoolErrorCode getErrorCode() {
        return errorCode;
    }
}
