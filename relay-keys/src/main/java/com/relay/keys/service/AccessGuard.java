package com.relay.keys.service;

import com.relay.common.dto.AccessKey;
import com.relay.common.exception.ExpiredKeyException;
import com.relay.common.exception.InvalidKeyException;
import com.relay.common.exception.MissingCredentialException;
import com.relay.common.util.KeyTokens;
import com.relay.keys.store.KeyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * 单次请求的 Key 鉴权。
 * <p>
 * 过期检查在每次访问时进行：发现过期但仍为 active 的 Key 会先被持久化为停用，
 * 再拒绝本次请求。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessGuard {

    private final KeyStore keyStore;
    private final Clock clock;

    /**
     * 校验调用方提交的 Key。
     *
     * @return 通过校验的 Key 记录
     * @throws MissingCredentialException 未提供 Key
     * @throws InvalidKeyException        Key 不存在或已停用
     * @throws ExpiredKeyException        Key 已过期（已被停用）
     */
    public AccessKey authorize(String presentedKey) {
        if (presentedKey == null || presentedKey.isBlank()) {
            throw new MissingCredentialException();
        }

        AccessKey record = keyStore.findActiveByKey(presentedKey).orElse(null);
        if (record == null) {
            log.debug("拒绝无效 Key: {}", KeyTokens.mask(presentedKey));
            throw new InvalidKeyException();
        }

        if (record.isExpiredAt(clock.instant())) {
            keyStore.updateActiveFlag(presentedKey, false);
            log.info("Key 已过期，标记为停用: name={}, key={}", record.getName(), KeyTokens.mask(presentedKey));
            throw new ExpiredKeyException();
        }

        return record;
    }

    /**
     * 记录一次成功的请求，由存储层原子累加。
     */
    public void recordUsage(String key) {
        keyStore.incrementUsage(key);
    }
}
