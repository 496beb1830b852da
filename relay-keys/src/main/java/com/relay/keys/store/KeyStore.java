package com.relay.keys.store;

import com.relay.common.dto.AccessKey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 访问密钥存储接口。
 * <p>
 * 提供三种实现：
 * - {@link InMemoryKeyStore}：内存实现，适合测试
 * - {@link JdbcKeyStore}：SQLite 实现，适合单机部署
 * - {@link RedisKeyStore}：Redis 实现，适合多实例部署
 * <p>
 * 查不到时返回空 Optional；存储本身故障时抛出
 * {@link com.relay.common.exception.StoreUnavailableException}。
 */
public interface KeyStore {

    /**
     * 写入一条新记录。
     *
     * @throws com.relay.common.exception.DuplicateKeyException Key 已存在
     */
    AccessKey insert(AccessKey record);

    Optional<AccessKey> findByKey(String key);

    /** 按名称查找，同名多条时返回最早创建的一条 */
    Optional<AccessKey> findByName(String name);

    /** 按 Key 查找且仅返回 active 的记录，鉴权专用 */
    Optional<AccessKey> findActiveByKey(String key);

    void updateActiveFlag(String key, boolean active);

    /** 使用次数原子加一，并发调用不会丢失计数 */
    void incrementUsage(String key);

    /**
     * 停用该名称下的全部记录。
     *
     * @return 本次由 active 变为停用的记录数
     */
    int revokeByName(String name);

    /**
     * 删除 key 或 name 等于 token 的全部记录。
     *
     * @return 删除的记录数
     */
    int deleteByKeyOrName(String token);

    /** 全部记录，按创建时间排序 */
    List<AccessKey> listAll();

    /**
     * 停用所有已过期但仍为 active 的记录。
     *
     * @return 停用的记录数
     */
    int deactivateExpired(Instant now);
}
