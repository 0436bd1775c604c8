package com.slb.proceeds_pool.modules.pool.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * 账户收益检查点，对应表：account_reward_state。
 * 不存在的记录等价于全零记录；全部取回后记录保留为零值。
 */
@Data
public class AccountRewardState implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long poolId;
    private String account;

    /** 上次结算时的每份额累计收益 */
    private BigInteger checkpoint;

    /** 转出份额前已产生、尚未领取的收益 */
    private BigInteger lockedProceeds;

    /** 累计已领取收益 */
    private BigInteger totalClaimed;

    private LocalDateTime updatedTime;

    public static AccountRewardState zero(Long poolId, String account) {
        AccountRewardState state = new AccountRewardState();
        state.setPoolId(poolId);
        state.setAccount(account);
        state.setCheckpoint(BigInteger.ZERO);
        state.setLockedProceeds(BigInteger.ZERO);
        state.setTotalClaimed(BigInteger.ZERO);
        return state;
    }
}
