package com.slb.proceeds_pool.modules.pool.mapper;

import com.slb.proceeds_pool.modules.pool.entity.AccountRewardState;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Optional;

@Mapper
public interface AccountRewardStateMapper {

    Optional<AccountRewardState> selectOne(@Param("poolId") Long poolId, @Param("account") String account);

    /**
     * 不存在则插入，存在则覆盖 checkpoint / locked / totalClaimed。
     */
    int upsert(AccountRewardState state);
}
