package com.relay.bot.admin;

import com.relay.common.dto.AccessKey;

import java.time.Instant;

/**
 * 面向管理员展示的 Key 状态。
 */
public enum KeyStatus {
    ACTIVE, EXPIRED, REVOKED;

    public static KeyStatus of(AccessKey key, Instant now) {
        if (key.isUsableAt(now)) {
            return ACTIVE;
        }
        return key.isActive() ? EXPIRED : REVOKED;
    }
}
