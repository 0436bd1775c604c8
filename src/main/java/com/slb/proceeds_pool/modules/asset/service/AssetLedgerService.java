package com.slb.proceeds_pool.modules.asset.service;

import com.slb.proceeds_pool.common.trace.TraceIdHolder;
import com.slb.proceeds_pool.common.vo.PageVo;
import com.slb.proceeds_pool.modules.asset.entity.AssetLedger;
import com.slb.proceeds_pool.modules.asset.entity.AssetRefType;
import com.slb.proceeds_pool.modules.asset.mapper.AssetLedgerMapper;
import com.slb.proceeds_pool.modules.asset.vo.AssetLedgerVo;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.List;

@Service
public class AssetLedgerService {

    private final AssetLedgerMapper assetLedgerMapper;

    public AssetLedgerService(AssetLedgerMapper assetLedgerMapper) {
        this.assetLedgerMapper = assetLedgerMapper;
    }

    /**
     * 记录一次资产划转流水。
     *
     * @param poolId 关联池子（后台入金为 null）
     * @param from   转出账户（后台入金为 null）
     */
    @Transactional
    public void recordMove(Long poolId,
                           String from,
                           String to,
                           BigInteger amount,
                           AssetRefType refType,
                           String remark) {
        AssetLedger ledger = new AssetLedger();
        ledger.setPoolId(poolId);
        ledger.setFromAccount(from);
        ledger.setToAccount(to);
        ledger.setAmount(amount);
        ledger.setRefType(refType.dbValue());
        ledger.setRemark(remark);
        ledger.setTraceId(TraceIdHolder.getOptional().orElse(null));
        ledger.setCreatedTime(LocalDateTime.now());
        assetLedgerMapper.insert(ledger);
    }

    public PageVo<AssetLedgerVo> listByAccount(String account, int page, int size) {
        long total = assetLedgerMapper.countByAccount(account);
        if (total <= 0) {
            return new PageVo<>(0L, page, size, List.of());
        }
        long offset = Math.max(0L, (long) (page - 1) * size);
        if (offset >= total) {
            return new PageVo<>(total, page, size, List.of());
        }
        List<AssetLedgerVo> list = assetLedgerMapper.selectByAccount(account, (int) offset, size).stream()
                .map(AssetLedgerVo::from)
                .toList();
        return new PageVo<>(total, page, size, list);
    }
}
