package com.slb.proceeds_pool.modules.asset.controller;

import com.slb.proceeds_pool.common.api.ApiResponse;
import com.slb.proceeds_pool.modules.asset.dto.AssetCreditDto;
import com.slb.proceeds_pool.modules.asset.service.AssetAccountService;
import com.slb.proceeds_pool.modules.asset.vo.AssetBalanceVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/assets")
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "管理员/底层资产", description = "为账户入金底层资产")
public class AdminAssetController {

    private final AssetAccountService assetAccountService;

    public AdminAssetController(AssetAccountService assetAccountService) {
        this.assetAccountService = assetAccountService;
    }

    @PostMapping("/credit")
    @Operation(summary = "后台入金", description = "为指定账户增加底层资产，并写入 credit 类型流水。")
    public ApiResponse<AssetBalanceVo> credit(@Valid @RequestBody AssetCreditDto dto) {
        return ApiResponse.ok(assetAccountService.credit(dto.getAccount(), dto.getAmount(), dto.getRemark()));
    }
}
