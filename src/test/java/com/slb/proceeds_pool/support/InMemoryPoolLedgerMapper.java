package com.slb.proceeds_pool.support;

import com.slb.proceeds_pool.modules.pool.entity.PoolLedger;
import com.slb.proceeds_pool.modules.pool.mapper.PoolLedgerMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * pool_ledger 的内存实现；读写都做拷贝，行为上等同于每次从库里重新读。
 */
public class InMemoryPoolLedgerMapper implements PoolLedgerMapper {

    private final Map<Long, PoolLedger> rows = new TreeMap<>();
    private final AtomicLong idSeq = new AtomicLong();

    @Override
    public int insert(PoolLedger ledger) {
        ledger.setId(idSeq.incrementAndGet());
        rows.put(ledger.getId(), copy(ledger));
        return 1;
    }

    @Override
    public Optional<PoolLedger> selectById(Long id) {
        return Optional.ofNullable(rows.get(id)).map(InMemoryPoolLedgerMapper::copy);
    }

    @Override
    public Optional<PoolLedger> selectByCode(String poolCode) {
        return rows.values().stream()
                .filter(row -> row.getPoolCode().equals(poolCode))
                .findFirst()
                .map(InMemoryPoolLedgerMapper::copy);
    }

    @Override
    public Optional<PoolLedger> lockByIdForUpdate(Long id) {
        return selectById(id);
    }

    @Override
    public int updateAccounting(PoolLedger ledger) {
        PoolLedger row = rows.get(ledger.getId());
        if (row == null) {
            return 0;
        }
        row.setCumulativeRewardPerShare(ledger.getCumulativeRewardPerShare());
        row.setTotalProceedsDeposited(ledger.getTotalProceedsDeposited());
        row.setPendingZeroSupplyProceeds(ledger.getPendingZeroSupplyProceeds());
        row.setTotalProceedsPaid(ledger.getTotalProceedsPaid());
        row.setUpdatedTime(ledger.getUpdatedTime());
        return 1;
    }

    @Override
    public List<PoolLedger> selectAll() {
        List<PoolLedger> list = new ArrayList<>();
        rows.values().forEach(row -> list.add(copy(row)));
        return list;
    }

    private static PoolLedger copy(PoolLedger src) {
        PoolLedger dst = new PoolLedger();
        dst.setId(src.getId());
        dst.setPoolCode(src.getPoolCode());
        dst.setOwnerAccount(src.getOwnerAccount());
        dst.setCustodyAccount(src.getCustodyAccount());
        dst.setCumulativeRewardPerShare(src.getCumulativeRewardPerShare());
        dst.setTotalProceedsDeposited(src.getTotalProceedsDeposited());
        dst.setPendingZeroSupplyProceeds(src.getPendingZeroSupplyProceeds());
        dst.setTotalProceedsPaid(src.getTotalProceedsPaid());
        dst.setCreatedTime(src.getCreatedTime());
        dst.setUpdatedTime(src.getUpdatedTime());
        return dst;
    }
}
