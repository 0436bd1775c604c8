package com.slb.proceeds_pool.modules.auth.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
@Schema(description = "签发访问令牌请求 / Issue access token request")
public class TokenIssueDto {
    @Schema(description = "账户地址；为空或零地址时返回 ZERO_ADDRESS", requiredMode = Schema.RequiredMode.REQUIRED, example = "0xab12...")
    private String address;

    @Pattern(regexp = "^(ADMIN)?$", message = "role 仅支持 ADMIN 或留空")
    @Schema(description = "角色（可选）：ADMIN", example = "ADMIN")
    private String role;
}
