package com.slb.proceeds_pool.modules.pool.mapper;

import com.slb.proceeds_pool.modules.pool.entity.PoolLedger;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface PoolLedgerMapper {

    /**
     * 插入新池子，回填自增 id。
     */
    int insert(PoolLedger ledger);

    Optional<PoolLedger> selectById(@Param("id") Long id);

    Optional<PoolLedger> selectByCode(@Param("poolCode") String poolCode);

    /**
     * SELECT ... FOR UPDATE：同一池子的写操作串行执行，须在事务内调用。
     */
    Optional<PoolLedger> lockByIdForUpdate(@Param("id") Long id);

    /**
     * 回写累计收益、托管收益与发放计数。
     */
    int updateAccounting(PoolLedger ledger);

    List<PoolLedger> selectAll();
}
