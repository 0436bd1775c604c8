package com.slb.proceeds_pool.modules.asset.service;

import com.slb.proceeds_pool.common.util.AccountAddress;
import com.slb.proceeds_pool.common.util.Amounts;
import com.slb.proceeds_pool.modules.asset.entity.AssetRefType;
import com.slb.proceeds_pool.modules.asset.mapper.AssetBalanceMapper;
import com.slb.proceeds_pool.modules.asset.vo.AssetBalanceVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

@Service
@Slf4j
public class AssetAccountService {

    private final AssetBalanceMapper assetBalanceMapper;
    private final AssetLedgerService assetLedgerService;
    private final AssetMover assetMover;

    public AssetAccountService(AssetBalanceMapper assetBalanceMapper,
                               AssetLedgerService assetLedgerService,
                               AssetMover assetMover) {
        this.assetBalanceMapper = assetBalanceMapper;
        this.assetLedgerService = assetLedgerService;
        this.assetMover = assetMover;
    }

    /**
     * 后台入金：为账户增加底层资产。
     */
    @Transactional
    public AssetBalanceVo credit(String rawAccount, BigInteger amount, String remark) {
        String account = AccountAddress.require(rawAccount);
        Amounts.require(amount);
        assetBalanceMapper.credit(account, amount);
        assetLedgerService.recordMove(null, null, account, amount, AssetRefType.CREDIT, remark);
        log.info("Asset credited: account={}, amount={}", account, amount);
        return balanceOf(account);
    }

    public AssetBalanceVo balanceOf(String rawAccount) {
        String account = AccountAddress.require(rawAccount);
        return new AssetBalanceVo(account, assetMover.balanceOf(account));
    }
}
