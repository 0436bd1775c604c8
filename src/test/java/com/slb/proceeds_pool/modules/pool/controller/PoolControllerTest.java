package com.slb.proceeds_pool.modules.pool.controller;

import com.slb.proceeds_pool.common.api.GlobalExceptionHandler;
import com.slb.proceeds_pool.common.exception.BizException;
import com.slb.proceeds_pool.common.exception.PoolErrorCode;
import com.slb.proceeds_pool.common.security.CustomUserDetails;
import com.slb.proceeds_pool.common.trace.TraceIdFilter;
import com.slb.proceeds_pool.common.trace.TraceIdHolder;
import com.slb.proceeds_pool.modules.pool.config.PoolProperties;
import com.slb.proceeds_pool.modules.pool.service.PoolEventService;
import com.slb.proceeds_pool.modules.pool.service.PoolOperationsService;
import com.slb.proceeds_pool.modules.pool.service.PoolService;
import com.slb.proceeds_pool.modules.pool.vo.PendingProceedsVo;
import com.slb.proceeds_pool.modules.pool.vo.PoolOperationVo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigInteger;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class PoolControllerTest {

    private static final String ALICE = "0xa11ce";

    @Mock
    private PoolOperationsService poolOperationsService;
    @Mock
    private PoolService poolService;
    @Mock
    private PoolEventService poolEventService;

    private MockMvc mockMvc;

    @BeforeEach
    void setup() {
        PoolController controller = new PoolController(
                poolOperationsService, poolService, poolEventService, new PoolProperties());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .addFilters(new TraceIdFilter())
                .build();

        CustomUserDetails principal = new CustomUserDetails(ALICE, null);
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities()));
    }

    @AfterEach
    void clear() {
        SecurityContextHolder.clearContext();
        TraceIdHolder.clear();
    }

    @Test
    void deposit_usesAuthenticatedAccountAndWrapsResult() throws Exception {
        PoolOperationVo vo = new PoolOperationVo();
        vo.setPoolId(1L);
        vo.setAccount(ALICE);
        vo.setOperation("DEPOSIT");
        vo.setAmount(BigInteger.valueOf(1000));
        vo.setBalanceAfter(BigInteger.valueOf(1000));
        when(poolOperationsService.deposit(1L, ALICE, BigInteger.valueOf(1000))).thenReturn(vo);

        mockMvc.perform(post("/api/v1/pools/1/deposit")
                        .header(TraceIdHolder.TRACE_ID_HEADER, "trace-deposit-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":1000}"))
                .andExpect(status().isOk())
                .andExpect(header().string(TraceIdHolder.TRACE_ID_HEADER, "trace-deposit-1"))
                .andExpect(jsonPath("$.code").value(0))
                .andExpect(jsonPath("$.traceId").value("trace-deposit-1"))
                .andExpect(jsonPath("$.data.operation").value("DEPOSIT"))
                .andExpect(jsonPath("$.data.balanceAfter").value(1000));
    }

    @Test
    void deposit_missingAmount_isInvalidArgument() throws Exception {
        mockMvc.perform(post("/api/v1/pools/1/deposit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("INVALID_ARGUMENT"))
                .andExpect(jsonPath("$.error.errors.amount").exists());

        verifyNoInteractions(poolOperationsService);
    }

    @Test
    void withdraw_businessRejection_rendersMachineCode() throws Exception {
        when(poolOperationsService.withdraw(eq(1L), eq(ALICE), any()))
                .thenThrow(new BizException(PoolErrorCode.INSUFFICIENT_BALANCE));

        mockMvc.perform(post("/api/v1/pools/1/withdraw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400))
                .andExpect(jsonPath("$.message").value("INSUFFICIENT_BALANCE"))
                .andExpect(jsonPath("$.error.code").value("INSUFFICIENT_BALANCE"))
                .andExpect(jsonPath("$.traceId").exists());
    }

    @Test
    void depositProceeds_byNonOwner_isForbidden() throws Exception {
        when(poolOperationsService.depositProceeds(eq(1L), eq(ALICE), any()))
                .thenThrow(new BizException(PoolErrorCode.NOT_PRIVILEGED));

        mockMvc.perform(post("/api/v1/pools/1/proceeds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":300}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("NOT_PRIVILEGED"));
    }

    @Test
    void transfer_forwardsRecipient() throws Exception {
        when(poolOperationsService.transfer(1L, ALICE, "0xb0b", BigInteger.valueOf(500)))
                .thenReturn(new PoolOperationVo());

        mockMvc.perform(post("/api/v1/pools/1/transfer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"to\":\"0xb0b\",\"amount\":500}"))
                .andExpect(status().isOk());

        verify(poolOperationsService).transfer(1L, ALICE, "0xb0b", BigInteger.valueOf(500));
    }

    @Test
    void pending_isPublicView() throws Exception {
        when(poolOperationsService.getPendingProceeds(1L, "0xb0b"))
                .thenReturn(new PendingProceedsVo(1L, "0xb0b", BigInteger.valueOf(250)));

        mockMvc.perform(get("/api/v1/pools/1/accounts/0xb0b/pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.pendingProceeds").value(250));
    }

    @Test
    void unknownPool_isNotFound() throws Exception {
        when(poolOperationsService.getContractInfo(42L))
                .thenThrow(new BizException(PoolErrorCode.POOL_NOT_FOUND, "池子不存在：42"));

        mockMvc.perform(get("/api/v1/pools/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.displayMessage").value("池子不存在：42"));
    }
}
