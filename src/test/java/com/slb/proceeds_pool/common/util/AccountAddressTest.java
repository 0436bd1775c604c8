package com.slb.proceeds_pool.common.util;

import com.slb.proceeds_pool.common.exception.BizException;
import com.slb.proceeds_pool.common.exception.PoolErrorCode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AccountAddressTest {

    @Test
    void zeroAddresses() {
        assertTrue(AccountAddress.isZero(null));
        assertTrue(AccountAddress.isZero("   "));
        assertTrue(AccountAddress.isZero("0x0000000000000000000000000000000000000000"));
        assertTrue(AccountAddress.isZero("000"));
        assertFalse(AccountAddress.isZero("0x0000000000000000000000000000000000000001"));
        assertTrue(AccountAddress.isZero("0x"));
        assertTrue(AccountAddress.isZero(" 0X "));
        assertFalse(AccountAddress.isZero("0x10"));
    }

    @Test
    void require_normalizesOrRejects() {
        assertEquals("0xabcdef", AccountAddress.require("  0xABCdef\t"));

        BizException ex = assertThrows(BizException.class, () -> AccountAddress.require("0X00"));
        assertEquals(PoolErrorCode.ZERO_ADDRESS, ex.getErrorCode());
        BizException bare = assertThrows(BizException.class, () -> AccountAddress.require("0X"));
        assertEquals(PoolErrorCode.ZERO_ADDRESS, bare.getErrorCode());
    }
}
