package com.relay.keys.store;

import com.relay.common.dto.AccessKey;
import com.relay.common.exception.DuplicateKeyException;
import com.relay.common.exception.StoreUnavailableException;
import com.relay.common.util.KeyTokens;
import com.relay.keys.entity.ApiKeyEntity;
import com.relay.keys.repository.ApiKeyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 基于 SQLite（Spring Data JDBC）的访问密钥存储。
 * <p>
 * 唯一性由 api_key 上的唯一索引保证；计数与状态修改都是单条 UPDATE 语句。
 */
@Slf4j
public class JdbcKeyStore implements KeyStore {

    private final ApiKeyRepository repository;

    public JdbcKeyStore(ApiKeyRepository repository) {
        this.repository = repository;
    }

    @Override
    public AccessKey insert(AccessKey record) {
        if (execute("检查 Key", () -> repository.existsByApiKey(record.getKey()))) {
            throw new DuplicateKeyException("Key 已存在: " + KeyTokens.mask(record.getKey()));
        }
        try {
            repository.save(toEntity(record));
        } catch (RuntimeException e) {
            // 并发写入同一个 Key 时由唯一索引拦下
            if (isUniqueViolation(e)) {
                throw new DuplicateKeyException("Key 已存在: " + KeyTokens.mask(record.getKey()), e);
            }
            log.error("写入 Key 失败: {}", e.getMessage());
            throw new StoreUnavailableException("写入 Key 失败", e);
        }
        log.debug("写入 Key: {}...", KeyTokens.mask(record.getKey()));
        return record;
    }

    @Override
    public Optional<AccessKey> findByKey(String key) {
        return execute("查询 Key", () -> repository.findByApiKey(key)).map(this::toRecord);
    }

    @Override
    public Optional<AccessKey> findByName(String name) {
        return execute("按名称查询 Key", () -> repository.findFirstByName(name)).map(this::toRecord);
    }

    @Override
    public Optional<AccessKey> findActiveByKey(String key) {
        return execute("查询 Key", () -> repository.findActiveByApiKey(key)).map(this::toRecord);
    }

    @Override
    public void updateActiveFlag(String key, boolean active) {
        execute("更新 Key 状态", () -> repository.updateActive(key, active));
    }

    @Override
    public void incrementUsage(String key) {
        execute("累加使用次数", () -> repository.incrementUsage(key));
    }

    @Override
    public int revokeByName(String name) {
        return execute("按名称停用 Key", () -> repository.deactivateByName(name));
    }

    @Override
    public int deleteByKeyOrName(String token) {
        return execute("删除 Key", () -> repository.deleteByKeyOrName(token));
    }

    @Override
    public List<AccessKey> listAll() {
        return execute("列出 Key", repository::findAllInCreationOrder).stream()
                .map(this::toRecord)
                .toList();
    }

    @Override
    public int deactivateExpired(Instant now) {
        return execute("停用过期 Key", () -> repository.deactivateExpired(now.toEpochMilli()));
    }

    // ==================== 内部方法 ====================

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("{}失败: {}", operation, e.getMessage());
            throw new StoreUnavailableException(operation + "失败", e);
        }
    }

    private boolean isUniqueViolation(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof org.springframework.dao.DuplicateKeyException) {
                return true;
            }
            String message = t.getMessage();
            if (message != null && message.contains("UNIQUE constraint failed")) {
                return true;
            }
        }
        return false;
    }

    private ApiKeyEntity toEntity(AccessKey record) {
        return ApiKeyEntity.builder()
                .apiKey(record.getKey())
                .name(record.getName())
                .createdAt(record.getCreatedAt().toEpochMilli())
                .expiresAt(record.getExpiresAt().toEpochMilli())
                .active(record.isActive())
                .usageCount(record.getUsage())
                .build();
    }

    private AccessKey toRecord(ApiKeyEntity entity) {
        return AccessKey.builder()
                .key(entity.getApiKey())
                .name(entity.getName())
                .createdAt(Instant.ofEpochMilli(entity.getCreatedAt()))
                .expiresAt(Instant.ofEpochMilli(entity.getExpiresAt()))
                .active(Boolean.TRUE.equals(entity.getActive()))
                .usage(entity.getUsageCount() != null ? entity.getUsageCount() : 0)
                .build();
    }
}
