package com.slb.proceeds_pool.modules.pool.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
@Schema(description = "创建池子请求 / Create pool request")
public class PoolCreateDto {
    @NotBlank(message = "poolCode 不能为空")
    @Pattern(regexp = "^[a-z0-9][a-z0-9_-]{0,63}$", message = "poolCode 仅允许小写字母、数字、下划线与中划线，最长 64 位")
    @Schema(description = "池子编码，全局唯一", requiredMode = Schema.RequiredMode.REQUIRED, example = "main")
    private String poolCode;

    @Schema(description = "唯一有权注入收益的账户地址", requiredMode = Schema.RequiredMode.REQUIRED, example = "0xab12...")
    private String ownerAccount;
}
