package com.relay.keys.store;

import com.relay.common.dto.AccessKey;
import com.relay.common.exception.DuplicateKeyException;
import com.relay.common.util.KeyTokens;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 基于内存的访问密钥存储。
 * <p>
 * 使用 {@link ConcurrentHashMap} 保存不可变快照，单条记录的修改都通过
 * {@code computeIfPresent} 完成，同一 Key 上的并发更新不会互相覆盖。
 */
@Slf4j
public class InMemoryKeyStore implements KeyStore {

    private static final Comparator<AccessKey> CREATION_ORDER =
            Comparator.comparing(AccessKey::getCreatedAt).thenComparing(AccessKey::getKey);

    private final Map<String, AccessKey> records = new ConcurrentHashMap<>();

    @Override
    public AccessKey insert(AccessKey record) {
        AccessKey snapshot = record.toBuilder().build();
        if (records.putIfAbsent(record.getKey(), snapshot) != null) {
            throw new DuplicateKeyException("Key 已存在: " + KeyTokens.mask(record.getKey()));
        }
        log.debug("写入 Key: {}...", KeyTokens.mask(record.getKey()));
        return snapshot.toBuilder().build();
    }

    @Override
    public Optional<AccessKey> findByKey(String key) {
        return Optional.ofNullable(records.get(key)).map(r -> r.toBuilder().build());
    }

    @Override
    public Optional<AccessKey> findByName(String name) {
        return records.values().stream()
                .filter(r -> r.getName().equals(name))
                .min(CREATION_ORDER)
                .map(r -> r.toBuilder().build());
    }

    @Override
    public Optional<AccessKey> findActiveByKey(String key) {
        return findByKey(key).filter(AccessKey::isActive);
    }

    @Override
    public void updateActiveFlag(String key, boolean active) {
        records.computeIfPresent(key, (k, r) -> r.toBuilder().active(active).build());
    }

    @Override
    public void incrementUsage(String key) {
        records.computeIfPresent(key, (k, r) -> r.toBuilder().usage(r.getUsage() + 1).build());
    }

    @Override
    public int revokeByName(String name) {
        AtomicInteger revoked = new AtomicInteger();
        for (String key : records.keySet()) {
            records.computeIfPresent(key, (k, r) -> {
                if (r.getName().equals(name) && r.isActive()) {
                    revoked.incrementAndGet();
                    return r.toBuilder().active(false).build();
                }
                return r;
            });
        }
        return revoked.get();
    }

    @Override
    public int deleteByKeyOrName(String token) {
        int deleted = 0;
        for (Map.Entry<String, AccessKey> entry : records.entrySet()) {
            boolean matches = entry.getKey().equals(token) || entry.getValue().getName().equals(token);
            if (matches && records.remove(entry.getKey()) != null) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public List<AccessKey> listAll() {
        return records.values().stream()
                .sorted(CREATION_ORDER)
                .map(r -> r.toBuilder().build())
                .toList();
    }

    @Override
    public int deactivateExpired(Instant now) {
        AtomicInteger deactivated = new AtomicInteger();
        for (String key : records.keySet()) {
            records.computeIfPresent(key, (k, r) -> {
                if (r.isActive() && r.isExpiredAt(now)) {
                    deactivated.incrementAndGet();
                    return r.toBuilder().active(false).build();
                }
                return r;
            });
        }
        return deactivated.get();
    }
}
