package com.relay.keys.service;

import com.relay.common.dto.AccessKey;
import com.relay.common.exception.DuplicateKeyException;
import com.relay.common.exception.TokenGenerationExhaustedException;
import com.relay.common.util.KeyTokens;
import com.relay.keys.config.KeysProperties;
import com.relay.keys.store.KeyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * 访问密钥管理：签发、停用、轮换、删除与用量查询。
 * <p>
 * 这里不做管理员校验，调用方需自行确认身份。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KeyManager {

    private final KeyStore keyStore;
    private final KeysProperties properties;
    private final Clock clock;

    /**
     * 生成一个新的随机 Key 字符串（24 字节随机数，URL 安全编码）。
     */
    public String generateKeyToken() {
        return KeyTokens.generate();
    }

    /**
     * 签发新 Key。生成的 Key 与已有 Key 冲突时重新生成，最多尝试
     * {@code relay.keys.max-token-attempts} 次。
     *
     * @param name         归属名称
     * @param lifetimeDays 有效天数，必须为正数
     */
    public AccessKey createKey(String name, int lifetimeDays) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("名称不能为空");
        }
        if (lifetimeDays <= 0) {
            throw new IllegalArgumentException("有效天数必须大于 0: " + lifetimeDays);
        }

        // 存储层时间精度为毫秒
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant expiresAt = now.plus(Duration.ofDays(lifetimeDays));

        int maxAttempts = Math.max(1, properties.getMaxTokenAttempts());
        DuplicateKeyException lastCollision = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            AccessKey record = AccessKey.builder()
                    .key(generateKeyToken())
                    .name(name)
                    .createdAt(now)
                    .expiresAt(expiresAt)
                    .active(true)
                    .usage(0)
                    .build();
            try {
                AccessKey saved = keyStore.insert(record);
                log.info("签发 Key: name={}, key={}, 有效期 {} 天", name, KeyTokens.mask(saved.getKey()), lifetimeDays);
                return saved;
            } catch (DuplicateKeyException e) {
                log.warn("生成的 Key 已存在，重新生成 (第 {}/{} 次)", attempt, maxAttempts);
                lastCollision = e;
            }
        }

        throw new TokenGenerationExhaustedException(
                "连续 " + maxAttempts + " 次生成的 Key 均已存在", lastCollision);
    }

    /**
     * 停用该名称下的全部 Key。
     *
     * @return 本次停用的数量
     */
    public int revokeByName(String name) {
        int revoked = keyStore.revokeByName(name);
        log.info("停用 Key: name={}, 数量 {}", name, revoked);
        return revoked;
    }

    /**
     * 轮换：停用该名称下的全部旧 Key，再签发一个新 Key。旧 Key 的用量不会转移。
     */
    public AccessKey rotate(String name, int newLifetimeDays) {
        revokeByName(name);
        return createKey(name, newLifetimeDays);
    }

    /**
     * 删除 key 或 name 等于 token 的全部记录，删除后用量一并丢失。
     *
     * @return 删除的数量
     */
    public int deleteByKeyOrName(String token) {
        int deleted = keyStore.deleteByKeyOrName(token);
        log.info("删除 Key: token={}, 数量 {}", KeyTokens.mask(token), deleted);
        return deleted;
    }

    /**
     * 查询用量：先按 Key 查，查不到再按名称查。
     */
    public Optional<AccessKey> getUsage(String keyOrName) {
        Optional<AccessKey> byKey = keyStore.findByKey(keyOrName);
        return byKey.isPresent() ? byKey : keyStore.findByName(keyOrName);
    }

    public List<AccessKey> listAll() {
        return keyStore.listAll();
    }
}
