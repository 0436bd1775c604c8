package com.slb.proceeds_pool.modules.auth.controller;

import com.slb.proceeds_pool.common.api.ApiResponse;
import com.slb.proceeds_pool.common.util.AccountAddress;
import com.slb.proceeds_pool.common.util.JwtUtil;
import com.slb.proceeds_pool.modules.auth.dto.TokenIssueDto;
import com.slb.proceeds_pool.modules.auth.vo.TokenVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/tokens")
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "管理员/访问令牌", description = "为账户地址签发访问令牌")
@Slf4j
public class AdminTokenController {

    private final JwtUtil jwtUtil;

    public AdminTokenController(JwtUtil jwtUtil) {
        this.jwtUtil = jwtUtil;
    }

    @PostMapping
    @Operation(summary = "签发访问令牌", description = "subject 为规范化后的账户地址；role=ADMIN 时令牌可访问管理接口。")
    public ApiResponse<TokenVo> issue(@Valid @RequestBody TokenIssueDto dto) {
        String address = AccountAddress.require(dto.getAddress());
        String role = StringUtils.hasText(dto.getRole()) ? dto.getRole() : null;
        String token = jwtUtil.generateAccessToken(address, role);
        log.info("Access token issued: address={}, role={}", address, role);
        return ApiResponse.ok(new TokenVo(address, role, token, jwtUtil.getAccessTokenExpire()));
    }
}
