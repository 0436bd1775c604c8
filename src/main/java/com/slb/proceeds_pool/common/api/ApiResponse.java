package com.slb.proceeds_pool.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.slb.proceeds_pool.common.exception.PoolErrorCode;
import com.slb.proceeds_pool.common.trace.TraceIdHolder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 统一响应封装结构 / Unified API response envelope.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "统一响应结构，所有接口（成功或异常）均返回该结构 / Unified response envelope used by all APIs.")
public class ApiResponse<T> {

    @Schema(description = "业务状态码，0 表示成功；失败时与 HTTP 状态码一致。/ 0 on success, HTTP status on failure.", example = "0")
    private int code;

    @Schema(description = "成功时为 'ok'；失败时为稳定机器码（如 ZERO_AMOUNT）或错误原因。/ 'ok' or a machine code.", example = "ok")
    private String message;

    @Schema(description = "展示用文案 / Display message for UI.", nullable = true)
    private String displayMessage;

    @Schema(description = "业务数据载体 / Business payload.", nullable = true)
    private T data;

    @Schema(description = "请求链路追踪 ID / Trace identifier for request correlation.", example = "b3f7e6c9a1d24c31")
    private String traceId;

    @Schema(description = "错误扩展信息（可选）/ Optional structured error details.", nullable = true)
    private ErrorBody error;

    private ApiResponse(int code, String message, T data, String traceId) {
        this.code = code;
        this.message = message;
        this.data = data;
        this.traceId = traceId;
    }

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(0, "ok", data, TraceIdHolder.require());
    }

    public static ApiResponse<Void> ok() {
        return ok(null);
    }

    public static ApiResponse<Void> error(int code, String message) {
        return new ApiResponse<>(code, message, null, TraceIdHolder.require());
    }

    /**
     * 池子业务错误：message 使用稳定机器码，displayMessage 为具体原因。
     */
    public static ApiResponse<Void> error(PoolErrorCode errorCode, String detail) {
        ApiResponse<Void> resp = error(errorCode.getStatus().value(), errorCode.getCode());
        resp.setDisplayMessage(detail != null ? detail : errorCode.getDisplayMessage());
        resp.setError(new ErrorBody(errorCode.getCode(), resp.getDisplayMessage(), null, null));
        return resp;
    }

    /**
     * 鉴权/授权/参数错误统一返回（可带字段级错误详情）。
     */
    public static ApiResponse<Void> error(int httpStatus, String machineCode, String displayMessage,
                                          Map<String, String> errors) {
        ApiResponse<Void> resp = error(httpStatus, machineCode);
        resp.setDisplayMessage(displayMessage);
        resp.setError(new ErrorBody(machineCode, displayMessage, errors, null));
        return resp;
    }

    @Data
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(description = "错误扩展结构 / Structured error details.")
    public static class ErrorBody {
        @Schema(description = "稳定机器错误码 / Stable machine-readable error code.", example = "INSUFFICIENT_BALANCE")
        private String code;

        @Schema(description = "展示文案 / Display message for UI.", example = "份额余额不足")
        private String displayMessage;

        @Schema(description = "字段级错误明细（可选）/ Field-level errors (optional).", nullable = true)
        private Map<String, String> errors;

        @Schema(description = "调试详情（可选）/ Debug detail (optional).", nullable = true)
        private String detail;

        public ErrorBody(String code, String displayMessage, Map<String, String> errors, String detail) {
            this.code = code;
            this.displayMessage = displayMessage;
            this.errors = errors;
            this.detail = detail;
        }
    }
}
