package com.slb.proceeds_pool.modules.pool.controller;

import com.slb.proceeds_pool.common.api.ApiResponse;
import com.slb.proceeds_pool.modules.pool.dto.PoolCreateDto;
import com.slb.proceeds_pool.modules.pool.service.PoolService;
import com.slb.proceeds_pool.modules.pool.vo.PoolInfoVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/pools")
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "管理员/收益池", description = "创建收益池")
public class AdminPoolController {

    private final PoolService poolService;

    public AdminPoolController(PoolService poolService) {
        this.poolService = poolService;
    }

    @PostMapping
    @Operation(summary = "创建池子", description = "ownerAccount 为该池唯一有权注入收益的账户；托管账户为 custodyPrefix + poolCode。")
    public ApiResponse<PoolInfoVo> createPool(@Valid @RequestBody PoolCreateDto dto) {
        return ApiResponse.ok(poolService.createPool(dto));
    }
}
