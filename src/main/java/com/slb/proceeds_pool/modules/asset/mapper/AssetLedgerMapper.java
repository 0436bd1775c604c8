package com.slb.proceeds_pool.modules.asset.mapper;

import com.slb.proceeds_pool.modules.asset.entity.AssetLedger;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * MyBatis mapper：用于 asset_ledger 表的持久化操作。
 */
@Mapper
public interface AssetLedgerMapper {
    /**
     * 插入一条资产流水记录
     *
     * @param ledger 流水实体
     * @return 影响行数
     */
    int insert(AssetLedger ledger);

    long countByAccount(@Param("account") String account);

    /**
     * 按账户（转入或转出）倒序分页。
     */
    List<AssetLedger> selectByAccount(@Param("account") String account,
                                      @Param("offset") int offset,
                                      @Param("size") int size);
}
