package com.slb.proceeds_pool.modules.auth.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "访问令牌 / Access token")
public class TokenVo {
    @Schema(description = "规范化后的账户地址")
    private String address;
    private String role;
    @Schema(description = "访问令牌", example = "eyJhbGciOiJIUzI1NiJ9...")
    private String accessToken;
    @Schema(description = "有效期（秒）", example = "86400")
    private long expiresIn;
}
