package com.slb.proceeds_pool.modules.pool.service;

import com.slb.proceeds_pool.common.exception.BizException;
import com.slb.proceeds_pool.common.exception.PoolErrorCode;
import com.slb.proceeds_pool.common.util.AccountAddress;
import com.slb.proceeds_pool.modules.asset.service.AssetMover;
import com.slb.proceeds_pool.modules.pool.config.PoolProperties;
import com.slb.proceeds_pool.modules.pool.dto.PoolCreateDto;
import com.slb.proceeds_pool.modules.pool.entity.PoolLedger;
import com.slb.proceeds_pool.modules.pool.mapper.PoolLedgerMapper;
import com.slb.proceeds_pool.modules.pool.vo.PoolInfoVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 池子的创建、加载与回写。
 */
@Service
@Slf4j
public class PoolService {

    private final PoolLedgerMapper poolLedgerMapper;
    private final ClaimLedgerService claimLedgerService;
    private final AssetMover assetMover;
    private final PoolProperties poolProperties;

    public PoolService(PoolLedgerMapper poolLedgerMapper,
                       ClaimLedgerService claimLedgerService,
                       AssetMover assetMover,
                       PoolProperties poolProperties) {
        this.poolLedgerMapper = poolLedgerMapper;
        this.claimLedgerService = claimLedgerService;
        this.assetMover = assetMover;
        this.poolProperties = poolProperties;
    }

    @Transactional
    public PoolInfoVo createPool(PoolCreateDto dto) {
        String owner = requireExternalAccount(AccountAddress.require(dto.getOwnerAccount()));
        String poolCode = dto.getPoolCode().trim();
        if (poolLedgerMapper.selectByCode(poolCode).isPresent()) {
            throw new BizException(PoolErrorCode.POOL_ALREADY_EXISTS, "池子编码已存在：" + poolCode);
        }

        PoolLedger ledger = new PoolLedger();
        ledger.setPoolCode(poolCode);
        ledger.setOwnerAccount(owner);
        ledger.setCustodyAccount(poolProperties.getCustodyPrefix() + poolCode);
        ledger.setCumulativeRewardPerShare(BigInteger.ZERO);
        ledger.setTotalProceedsDeposited(BigInteger.ZERO);
        ledger.setPendingZeroSupplyProceeds(BigInteger.ZERO);
        ledger.setTotalProceedsPaid(BigInteger.ZERO);
        ledger.setCreatedTime(LocalDateTime.now());
        poolLedgerMapper.insert(ledger);
        claimLedgerService.initSupply(ledger.getId());

        log.info("Pool created: id={}, code={}, owner={}, custody={}",
                ledger.getId(), poolCode, owner, ledger.getCustodyAccount());
        return toInfo(ledger);
    }

    /**
     * 托管地址段只能由池子自身持有；外部账户（操作者、接收方、池主）不得落在该地址段内。
     */
    public String requireExternalAccount(String account) {
        String prefix = AccountAddress.normalize(poolProperties.getCustodyPrefix());
        if (!prefix.isEmpty() && account.startsWith(prefix)) {
            throw new BizException(PoolErrorCode.RESERVED_ADDRESS, "托管地址不能作为外部账户：" + account);
        }
        return account;
    }

    public PoolLedger getPool(Long poolId) {
        return poolLedgerMapper.selectById(poolId)
                .orElseThrow(() -> new BizException(PoolErrorCode.POOL_NOT_FOUND, "池子不存在：" + poolId));
    }

    /**
     * 锁定池子行；同一池子的写操作在此串行。须在事务内调用。
     */
    public PoolLedger lockForUpdate(Long poolId) {
        return poolLedgerMapper.lockByIdForUpdate(poolId)
                .orElseThrow(() -> new BizException(PoolErrorCode.POOL_NOT_FOUND, "池子不存在：" + poolId));
    }

    public void saveAccounting(PoolLedger ledger) {
        ledger.setUpdatedTime(LocalDateTime.now());
        poolLedgerMapper.updateAccounting(ledger);
    }

    public List<PoolInfoVo> listPools() {
        return poolLedgerMapper.selectAll().stream().map(this::toInfo).toList();
    }

    public PoolInfoVo toInfo(PoolLedger ledger) {
        PoolInfoVo vo = new PoolInfoVo();
        vo.setPoolId(ledger.getId());
        vo.setPoolCode(ledger.getPoolCode());
        vo.setOwnerAccount(ledger.getOwnerAccount());
        vo.setCustodyAccount(ledger.getCustodyAccount());
        vo.setAssetSymbol(poolProperties.getAssetSymbol());
        vo.setTotalShares(claimLedgerService.totalSupply(ledger.getId()));
        vo.setTotalUnderlyingHeld(assetMover.balanceOf(ledger.getCustodyAccount()));
        vo.setTotalProceedsDeposited(ledger.getTotalProceedsDeposited());
        vo.setPendingZeroSupplyProceeds(ledger.getPendingZeroSupplyProceeds());
        vo.setTotalProceedsPaid(ledger.getTotalProceedsPaid());
        vo.setCumulativeRewardPerShare(ledger.getCumulativeRewardPerShare());
        vo.setPrecision(RewardAccumulator.PRECISION);
        vo.setCreatedTime(ledger.getCreatedTime());
        return vo;
    }
}
