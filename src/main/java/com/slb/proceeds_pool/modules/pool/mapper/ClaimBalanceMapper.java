package com.slb.proceeds_pool.modules.pool.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigInteger;

/**
 * 份额账本：claim_balance（账户份额）与 claim_supply（总份额）。
 */
@Mapper
public interface ClaimBalanceMapper {

    /**
     * @return 账户份额，不存在时为 null
     */
    BigInteger selectBalance(@Param("poolId") Long poolId, @Param("account") String account);

    /**
     * @return 总份额，池子未初始化时为 null
     */
    BigInteger selectTotalSupply(@Param("poolId") Long poolId);

    int insertSupply(@Param("poolId") Long poolId);

    /**
     * 增加账户份额，账户行不存在时创建。
     */
    int increaseBalance(@Param("poolId") Long poolId,
                        @Param("account") String account,
                        @Param("amount") BigInteger amount);

    /**
     * 条件扣减：仅当份额充足时扣减，返回 0 表示不足。
     */
    int decreaseBalance(@Param("poolId") Long poolId,
                        @Param("account") String account,
                        @Param("amount") BigInteger amount);

    /**
     * 调整总份额，delta 可为负。
     */
    int changeTotalSupply(@Param("poolId") Long poolId, @Param("delta") BigInteger delta);
}
