package com.slb.proceeds_pool.modules.asset.controller;

import com.slb.proceeds_pool.common.api.ApiResponse;
import com.slb.proceeds_pool.common.security.CustomUserDetails;
import com.slb.proceeds_pool.common.vo.PageVo;
import com.slb.proceeds_pool.modules.asset.service.AssetAccountService;
import com.slb.proceeds_pool.modules.asset.service.AssetLedgerService;
import com.slb.proceeds_pool.modules.asset.vo.AssetBalanceVo;
import com.slb.proceeds_pool.modules.asset.vo.AssetLedgerVo;
import com.slb.proceeds_pool.modules.pool.config.PoolProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/assets")
@Tag(name = "用户端/底层资产", description = "查询当前账户的底层资产余额与流水")
public class AssetController {

    private final AssetAccountService assetAccountService;
    private final AssetLedgerService assetLedgerService;
    private final PoolProperties poolProperties;

    public AssetController(AssetAccountService assetAccountService,
                           AssetLedgerService assetLedgerService,
                           PoolProperties poolProperties) {
        this.assetAccountService = assetAccountService;
        this.assetLedgerService = assetLedgerService;
        this.poolProperties = poolProperties;
    }

    @GetMapping("/balance")
    @Operation(summary = "当前账户底层资产余额")
    public ApiResponse<AssetBalanceVo> balance(@AuthenticationPrincipal CustomUserDetails principal) {
        return ApiResponse.ok(assetAccountService.balanceOf(principal.getAddress()));
    }

    @GetMapping("/ledger")
    @Operation(summary = "当前账户资产流水（转入与转出，按时间倒序）")
    public ApiResponse<PageVo<AssetLedgerVo>> ledger(
            @AuthenticationPrincipal CustomUserDetails principal,
            @Parameter(description = "页码，从 1 开始", example = "1")
            @RequestParam(defaultValue = "1") int page,
            @Parameter(description = "每页数量", example = "20")
            @RequestParam(defaultValue = "20") int size) {
        return ApiResponse.ok(assetLedgerService.listByAccount(
                principal.getAddress(), Math.max(page, 1), poolProperties.clampPageSize(size)));
    }
}
