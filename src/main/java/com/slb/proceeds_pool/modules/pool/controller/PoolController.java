package com.slb.proceeds_pool.modules.pool.controller;

import com.slb.proceeds_pool.common.api.ApiResponse;
import com.slb.proceeds_pool.common.security.CustomUserDetails;
import com.slb.proceeds_pool.common.vo.PageVo;
import com.slb.proceeds_pool.modules.pool.config.PoolProperties;
import com.slb.proceeds_pool.modules.pool.dto.AmountDto;
import com.slb.proceeds_pool.modules.pool.dto.TransferDto;
import com.slb.proceeds_pool.modules.pool.event.PoolEventType;
import com.slb.proceeds_pool.modules.pool.service.PoolEventService;
import com.slb.proceeds_pool.modules.pool.service.PoolOperationsService;
import com.slb.proceeds_pool.modules.pool.service.PoolService;
import com.slb.proceeds_pool.modules.pool.vo.PendingProceedsVo;
import com.slb.proceeds_pool.modules.pool.vo.PoolEventVo;
import com.slb.proceeds_pool.modules.pool.vo.PoolInfoVo;
import com.slb.proceeds_pool.modules.pool.vo.PoolOperationVo;
import com.slb.proceeds_pool.modules.pool.vo.UserInfoVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/pools")
@Tag(name = "用户端/收益池", description = "存入、取回、注入收益、领取收益、份额转让与池子/账户查询")
@Slf4j
public class PoolController {

    private final PoolOperationsService poolOperationsService;
    private final PoolService poolService;
    private final PoolEventService poolEventService;
    private final PoolProperties poolProperties;

    public PoolController(PoolOperationsService poolOperationsService,
                          PoolService poolService,
                          PoolEventService poolEventService,
                          PoolProperties poolProperties) {
        this.poolOperationsService = poolOperationsService;
        this.poolService = poolService;
        this.poolEventService = poolEventService;
        this.poolProperties = poolProperties;
    }

    @GetMapping
    @Operation(summary = "池子列表")
    public ApiResponse<List<PoolInfoVo>> listPools() {
        return ApiResponse.ok(poolService.listPools());
    }

    @GetMapping("/{poolId}")
    @Operation(summary = "池子概况",
            description = "总份额、托管资产、累计注入收益、零份额托管收益、每份额累计收益等。")
    public ApiResponse<PoolInfoVo> getContractInfo(@PathVariable Long poolId) {
        return ApiResponse.ok(poolOperationsService.getContractInfo(poolId));
    }

    @GetMapping("/{poolId}/accounts/{account}")
    @Operation(summary = "账户在池子中的状态", description = "份额、待领收益、checkpoint、locked 与累计已领取。")
    public ApiResponse<UserInfoVo> getUserInfo(@PathVariable Long poolId, @PathVariable String account) {
        return ApiResponse.ok(poolOperationsService.getUserInfo(poolId, account));
    }

    @GetMapping("/{poolId}/accounts/{account}/pending")
    @Operation(summary = "账户待领收益")
    public ApiResponse<PendingProceedsVo> getPendingProceeds(@PathVariable Long poolId, @PathVariable String account) {
        return ApiResponse.ok(poolOperationsService.getPendingProceeds(poolId, account));
    }

    @GetMapping("/{poolId}/events")
    @Operation(summary = "池子事件（审计）", description = "按时间倒序分页，可按事件类型过滤。")
    public ApiResponse<PageVo<PoolEventVo>> listEvents(
            @PathVariable Long poolId,
            @Parameter(description = "事件类型（可选）", example = "PROCEEDS_DEPOSITED")
            @RequestParam(required = false) PoolEventType type,
            @Parameter(description = "页码，从 1 开始", example = "1")
            @RequestParam(defaultValue = "1") int page,
            @Parameter(description = "每页数量", example = "20")
            @RequestParam(defaultValue = "20") int size) {
        poolService.getPool(poolId);
        return ApiResponse.ok(poolEventService.listEvents(
                poolId, type, Math.max(page, 1), poolProperties.clampPageSize(size)));
    }

    @PostMapping("/{poolId}/deposit")
    @Operation(summary = "存入",
            description = """
                    从当前账户划转 amount 底层资产到池子托管，并 1:1 铸造份额。
                    - 追加存入时先按旧份额结清待领收益；新份额不参与历史收益。
                    - 若池子总份额为 0 且存在零份额托管收益，本次存入者一次性获得全部托管收益（bonusPaid）。
                    """)
    public ApiResponse<PoolOperationVo> deposit(@PathVariable Long poolId,
                                                @Valid @RequestBody AmountDto dto,
                                                @AuthenticationPrincipal CustomUserDetails principal) {
        return ApiResponse.ok(poolOperationsService.deposit(poolId, principal.getAddress(), dto.getAmount()));
    }

    @PostMapping("/{poolId}/withdraw")
    @Operation(summary = "取回", description = "先结清全部待领收益，再销毁 amount 份额并 1:1 返还底层资产。")
    public ApiResponse<PoolOperationVo> withdraw(@PathVariable Long poolId,
                                                 @Valid @RequestBody AmountDto dto,
                                                 @AuthenticationPrincipal CustomUserDetails principal) {
        return ApiResponse.ok(poolOperationsService.withdraw(poolId, principal.getAddress(), dto.getAmount()));
    }

    @PostMapping("/{poolId}/proceeds")
    @Operation(summary = "注入收益",
            description = "仅池子管理账户可调用；按注入时刻的份额比例分配。总份额为 0 时进入零份额托管。")
    public ApiResponse<PoolOperationVo> depositProceeds(@PathVariable Long poolId,
                                                        @Valid @RequestBody AmountDto dto,
                                                        @AuthenticationPrincipal CustomUserDetails principal) {
        return ApiResponse.ok(poolOperationsService.depositProceeds(poolId, principal.getAddress(), dto.getAmount()));
    }

    @PostMapping("/{poolId}/claim")
    @Operation(summary = "领取收益", description = "发放全部待领收益；无待领收益时静默成功（proceedsPaid=0）。")
    public ApiResponse<PoolOperationVo> claimProceeds(@PathVariable Long poolId,
                                                      @AuthenticationPrincipal CustomUserDetails principal) {
        return ApiResponse.ok(poolOperationsService.claimProceeds(poolId, principal.getAddress()));
    }

    @PostMapping("/{poolId}/transfer")
    @Operation(summary = "份额转让",
            description = "发送方已产生的收益被锁定保留；接收方按转让前份额先被结算，之后新份额从当前累计值开始计息。")
    public ApiResponse<PoolOperationVo> transfer(@PathVariable Long poolId,
                                                 @Valid @RequestBody TransferDto dto,
                                                 @AuthenticationPrincipal CustomUserDetails principal) {
        return ApiResponse.ok(poolOperationsService.transfer(
                poolId, principal.getAddress(), dto.getTo(), dto.getAmount()));
    }
}
