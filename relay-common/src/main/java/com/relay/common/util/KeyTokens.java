package com.relay.common.util;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * 访问密钥字符串工具类。
 */
public final class KeyTokens {

    /** 随机字节数，Base64 URL 编码后为 32 个字符 */
    public static final int TOKEN_BYTES = 24;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private KeyTokens() {
    }

    /**
     * 生成 URL 安全的随机 Key（字符集 A-Z a-z 0-9 - _，无填充）。
     */
    public static String generate() {
        byte[] randomBytes = new byte[TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }

    /**
     * 日志脱敏：只保留前 8 位。
     */
    public static String mask(String key) {
        if (key == null || key.length() <= 8) return "***";
        return key.substring(0, 8) + "***";
    }
}
