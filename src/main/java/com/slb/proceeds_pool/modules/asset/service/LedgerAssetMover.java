package com.slb.proceeds_pool.modules.asset.service;

import com.slb.proceeds_pool.common.exception.BizException;
import com.slb.proceeds_pool.common.exception.PoolErrorCode;
import com.slb.proceeds_pool.common.util.Amounts;
import com.slb.proceeds_pool.modules.asset.entity.AssetBalance;
import com.slb.proceeds_pool.modules.asset.entity.AssetRefType;
import com.slb.proceeds_pool.modules.asset.mapper.AssetBalanceMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * 基于 asset_balance 表的资产划转：条件扣减 + 入账 + 流水，处于调用方事务内。
 */
@Service
@Slf4j
public class LedgerAssetMover implements AssetMover {

    private final AssetBalanceMapper assetBalanceMapper;
    private final AssetLedgerService assetLedgerService;

    public LedgerAssetMover(AssetBalanceMapper assetBalanceMapper, AssetLedgerService assetLedgerService) {
        this.assetBalanceMapper = assetBalanceMapper;
        this.assetLedgerService = assetLedgerService;
    }

    @Override
    @Transactional
    public void transfer(Long poolId, String from, String to, BigInteger amount, AssetRefType refType) {
        Amounts.requirePositive(amount);
        // 扣减必须先于入账：失败时尚未产生任何写入
        int affected = assetBalanceMapper.debit(from, amount);
        if (affected != 1) {
            log.warn("Asset move rejected: pool={}, type={}, from={}, to={}, amount={}",
                    poolId, refType, from, to, amount);
            throw new BizException(PoolErrorCode.TRANSFER_FAILED,
                    "资产划转失败：账户 " + from + " 可用余额不足 " + amount);
        }
        assetBalanceMapper.credit(to, amount);
        assetLedgerService.recordMove(poolId, from, to, amount, refType, null);
        log.debug("Asset moved: pool={}, type={}, from={}, to={}, amount={}", poolId, refType, from, to, amount);
    }

    @Override
    public BigInteger balanceOf(String account) {
        return assetBalanceMapper.selectByAccount(account)
                .map(AssetBalance::getBalance)
                .orElse(BigInteger.ZERO);
    }
}
