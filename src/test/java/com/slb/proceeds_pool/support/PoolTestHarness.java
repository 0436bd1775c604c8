package com.slb.proceeds_pool.support;

import com.slb.proceeds_pool.modules.asset.service.AssetAccountService;
import com.slb.proceeds_pool.modules.asset.service.AssetLedgerService;
import com.slb.proceeds_pool.modules.asset.service.LedgerAssetMover;
import com.slb.proceeds_pool.modules.pool.config.PoolProperties;
import com.slb.proceeds_pool.modules.pool.dto.PoolCreateDto;
import com.slb.proceeds_pool.modules.pool.event.PoolActivityEvent;
import com.slb.proceeds_pool.modules.pool.service.ClaimLedgerService;
import com.slb.proceeds_pool.modules.pool.service.PoolEventService;
import com.slb.proceeds_pool.modules.pool.service.PoolOperationsService;
import com.slb.proceeds_pool.modules.pool.service.PoolService;
import com.slb.proceeds_pool.modules.pool.service.RewardAccumulator;
import com.slb.proceeds_pool.modules.pool.service.SettlementService;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 用真实的服务类 + 内存 mapper 组装出完整的池子，供有状态的场景测试使用。
 */
public class PoolTestHarness {

    public final InMemoryPoolLedgerMapper poolLedgerMapper = new InMemoryPoolLedgerMapper();
    public final InMemoryAccountRewardStateMapper rewardStateMapper = new InMemoryAccountRewardStateMapper();
    public final InMemoryClaimBalanceMapper claimBalanceMapper = new InMemoryClaimBalanceMapper();
    public final InMemoryAssetBalanceMapper assetBalanceMapper = new InMemoryAssetBalanceMapper();
    public final InMemoryAssetLedgerMapper assetLedgerMapper = new InMemoryAssetLedgerMapper();
    public final InMemoryPoolEventMapper poolEventMapper = new InMemoryPoolEventMapper();

    public final List<PoolActivityEvent> events = new ArrayList<>();

    public final RewardAccumulator rewardAccumulator = new RewardAccumulator();
    public final PoolProperties poolProperties = new PoolProperties();
    public final PoolEventService poolEventService = new PoolEventService(poolEventMapper);
    public final AssetLedgerService assetLedgerService = new AssetLedgerService(assetLedgerMapper);
    public final LedgerAssetMover assetMover = new LedgerAssetMover(assetBalanceMapper, assetLedgerService);
    public final AssetAccountService assetAccountService =
            new AssetAccountService(assetBalanceMapper, assetLedgerService, assetMover);

    public final SettlementService settlementService;
    public final ClaimLedgerService claimLedgerService;
    public final PoolService poolService;
    public final PoolOperationsService operations;

    public PoolTestHarness() {
        ApplicationEventPublisher publisher = event -> {
            if (event instanceof PoolActivityEvent activity) {
                events.add(activity);
                poolEventService.onPoolActivity(activity);
            }
        };
        settlementService = new SettlementService(rewardStateMapper, claimBalanceMapper,
                rewardAccumulator, assetMover, publisher);
        claimLedgerService = new ClaimLedgerService(claimBalanceMapper, settlementService);
        poolService = new PoolService(poolLedgerMapper, claimLedgerService, assetMover, poolProperties);
        operations = new PoolOperationsService(poolService, claimLedgerService, settlementService,
                rewardAccumulator, assetMover, publisher);
    }

    public Long createPool(String poolCode, String owner) {
        PoolCreateDto dto = new PoolCreateDto();
        dto.setPoolCode(poolCode);
        dto.setOwnerAccount(owner);
        return poolService.createPool(dto).getPoolId();
    }

    public void fund(String account, long amount) {
        assetAccountService.credit(account, BigInteger.valueOf(amount), "test");
    }

    public BigInteger pending(Long poolId, String account) {
        return operations.getPendingProceeds(poolId, account).getPendingProceeds();
    }

    public BigInteger shares(Long poolId, String account) {
        return claimLedgerService.balanceOf(poolId, account);
    }

    public BigInteger underlying(String account) {
        return assetBalanceMapper.balance(account);
    }

    public static BigInteger units(long value) {
        return BigInteger.valueOf(value);
    }
}
