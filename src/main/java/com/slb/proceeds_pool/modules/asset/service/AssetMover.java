package com.slb.proceeds_pool.modules.asset.service;

import com.slb.proceeds_pool.modules.asset.entity.AssetRefType;

import java.math.BigInteger;

/**
 * 底层资产划转能力。划转要么完整完成，要么抛出 TRANSFER_FAILED 且不产生任何变更。
 */
public interface AssetMover {

    /**
     * 从 {@code from} 划转 {@code amount} 到 {@code to}。
     *
     * @throws com.slb.proceeds_pool.common.exception.BizException TRANSFER_FAILED，余额不足时
     */
    void transfer(Long poolId, String from, String to, BigInteger amount, AssetRefType refType);

    BigInteger balanceOf(String account);
}
