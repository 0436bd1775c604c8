package com.slb.proceeds_pool.common.util;

import com.slb.proceeds_pool.common.exception.BizException;
import com.slb.proceeds_pool.common.exception.PoolErrorCode;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 账户地址工具：统一去空白、转小写；空串、裸 0x 与全零十六进制地址视为“零地址”。
 */
public final class AccountAddress {

    private static final Pattern ZERO_HEX = Pattern.compile("^(0x)?0*$");

    private AccountAddress() {
    }

    public static String normalize(String raw) {
        if (!StringUtils.hasText(raw)) {
            return "";
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isZero(String raw) {
        String normalized = normalize(raw);
        return normalized.isEmpty() || ZERO_HEX.matcher(normalized).matches();
    }

    /**
     * 规范化并校验非零地址，否则抛出 ZERO_ADDRESS。
     */
    public static String require(String raw) {
        if (isZero(raw)) {
            throw new BizException(PoolErrorCode.ZERO_ADDRESS);
        }
        return normalize(raw);
    }
}
