package com.slb.proceeds_pool.modules.asset.mapper;

import com.slb.proceeds_pool.modules.asset.entity.AssetBalance;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigInteger;
import java.util.Optional;

@Mapper
public interface AssetBalanceMapper {

    Optional<AssetBalance> selectByAccount(@Param("account") String account);

    /**
     * 条件扣减：仅当余额充足时扣减。
     *
     * @return 影响行数，0 表示余额不足或账户不存在
     */
    int debit(@Param("account") String account, @Param("amount") BigInteger amount);

    /**
     * 入账：账户不存在时创建。
     */
    int credit(@Param("account") String account, @Param("amount") BigInteger amount);
}
