package com.relay.keys.store;

import com.relay.common.dto.AccessKey;
import com.relay.common.exception.DuplicateKeyException;
import com.relay.common.exception.StoreUnavailableException;
import com.relay.common.util.KeyTokens;
import com.relay.keys.config.KeysProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 基于 Redis 的访问密钥存储。
 * <p>
 * 数据布局（前缀 = {@code <databaseName>:<collectionName>}）：
 * <ul>
 *   <li>{@code <前缀>:key:<key>}：Hash，保存单条记录</li>
 *   <li>{@code <前缀>:all}：ZSet，全部 Key，score 为创建时间，ZADD NX 保证唯一</li>
 *   <li>{@code <前缀>:name:<name>}：ZSet，同名 Key 索引</li>
 * </ul>
 * 使用次数通过 HINCRBY 在服务端累加。对已有记录的修改都放在 Lua 脚本里先判断 Hash 是否存在，
 * 与删除并发时不会留下只有部分字段的残缺记录。
 */
@Slf4j
public class RedisKeyStore implements KeyStore {

    private static final String F_NAME = "name";
    private static final String F_CREATED_AT = "createdAt";
    private static final String F_EXPIRES_AT = "expiresAt";
    private static final String F_ACTIVE = "active";
    private static final String F_USAGE = "usage";

    /** Hash 存在时 HINCRBY，返回新值；不存在返回 -1 */
    static final RedisScript<Long> INCREMENT_IF_EXISTS = new DefaultRedisScript<>(
            "if redis.call('EXISTS', KEYS[1]) == 1 then "
                    + "return redis.call('HINCRBY', KEYS[1], ARGV[1], ARGV[2]) end "
                    + "return -1", Long.class);

    /** Hash 存在时 HSET，返回 1；不存在返回 0 */
    static final RedisScript<Long> SET_IF_EXISTS = new DefaultRedisScript<>(
            "if redis.call('EXISTS', KEYS[1]) == 1 then "
                    + "redis.call('HSET', KEYS[1], ARGV[1], ARGV[2]) return 1 end "
                    + "return 0", Long.class);

    /** active 为 true 时改为 false，返回 1；否则（含记录不存在）返回 0 */
    static final RedisScript<Long> DEACTIVATE_IF_ACTIVE = new DefaultRedisScript<>(
            "if redis.call('HGET', KEYS[1], ARGV[1]) == 'true' then "
                    + "redis.call('HSET', KEYS[1], ARGV[1], 'false') return 1 end "
                    + "return 0", Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String prefix;

    public RedisKeyStore(StringRedisTemplate redisTemplate, KeysProperties properties) {
        this.redisTemplate = redisTemplate;
        this.prefix = properties.getDatabaseName() + ":" + properties.getCollectionName();
    }

    @Override
    public AccessKey insert(AccessKey record) {
        String key = record.getKey();
        double score = record.getCreatedAt().toEpochMilli();

        Boolean claimed = execute("写入 Key",
                () -> redisTemplate.opsForZSet().addIfAbsent(allIndex(), key, score));
        if (!Boolean.TRUE.equals(claimed)) {
            throw new DuplicateKeyException("Key 已存在: " + KeyTokens.mask(key));
        }

        Map<String, String> fields = new HashMap<>();
        fields.put(F_NAME, record.getName());
        fields.put(F_CREATED_AT, String.valueOf(record.getCreatedAt().toEpochMilli()));
        fields.put(F_EXPIRES_AT, String.valueOf(record.getExpiresAt().toEpochMilli()));
        fields.put(F_ACTIVE, String.valueOf(record.isActive()));
        fields.put(F_USAGE, String.valueOf(record.getUsage()));

        execute("写入 Key", () -> {
            redisTemplate.opsForHash().putAll(recordKey(key), fields);
            return redisTemplate.opsForZSet().add(nameIndex(record.getName()), key, score);
        });
        log.debug("写入 Key: {}...", KeyTokens.mask(key));
        return record;
    }

    @Override
    public Optional<AccessKey> findByKey(String key) {
        HashOperations<String, String, String> ops = redisTemplate.opsForHash();
        Map<String, String> fields = execute("查询 Key", () -> ops.entries(recordKey(key)));
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        if (!isComplete(fields)) {
            log.warn("忽略字段不完整的 Key 记录: {}, 字段 {}", KeyTokens.mask(key), fields.keySet());
            return Optional.empty();
        }
        return Optional.of(toRecord(key, fields));
    }

    @Override
    public Optional<AccessKey> findByName(String name) {
        Set<String> first = execute("按名称查询 Key",
                () -> redisTemplate.opsForZSet().range(nameIndex(name), 0, 0));
        if (first == null || first.isEmpty()) {
            return Optional.empty();
        }
        return findByKey(first.iterator().next());
    }

    @Override
    public Optional<AccessKey> findActiveByKey(String key) {
        return findByKey(key).filter(AccessKey::isActive);
    }

    @Override
    public void updateActiveFlag(String key, boolean active) {
        execute("更新 Key 状态", () -> redisTemplate.execute(SET_IF_EXISTS,
                List.of(recordKey(key)), F_ACTIVE, String.valueOf(active)));
    }

    @Override
    public void incrementUsage(String key) {
        Long usage = execute("累加使用次数", () -> redisTemplate.execute(INCREMENT_IF_EXISTS,
                List.of(recordKey(key)), F_USAGE, "1"));
        if (usage != null && usage < 0) {
            log.debug("Key 已被删除，跳过计数: {}", KeyTokens.mask(key));
        }
    }

    @Override
    public int revokeByName(String name) {
        int revoked = 0;
        for (String key : membersOf(nameIndex(name))) {
            if (deactivateIfActive(key)) {
                revoked++;
            }
        }
        return revoked;
    }

    @Override
    public int deleteByKeyOrName(String token) {
        Set<String> targets = new LinkedHashSet<>(membersOf(nameIndex(token)));
        if (Boolean.TRUE.equals(execute("删除 Key", () -> redisTemplate.hasKey(recordKey(token))))) {
            targets.add(token);
        }

        int deleted = 0;
        for (String key : targets) {
            Object name = execute("删除 Key", () -> redisTemplate.opsForHash().get(recordKey(key), F_NAME));
            Boolean removed = execute("删除 Key", () -> redisTemplate.delete(recordKey(key)));
            execute("删除 Key", () -> redisTemplate.opsForZSet().remove(allIndex(), key));
            if (name != null) {
                execute("删除 Key", () -> redisTemplate.opsForZSet().remove(nameIndex(name.toString()), key));
            }
            if (Boolean.TRUE.equals(removed)) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public List<AccessKey> listAll() {
        List<AccessKey> result = new ArrayList<>();
        for (String key : membersOf(allIndex())) {
            findByKey(key).ifPresent(result::add);
        }
        return result;
    }

    @Override
    public int deactivateExpired(Instant now) {
        int deactivated = 0;
        for (AccessKey record : listAll()) {
            if (record.isActive() && record.isExpiredAt(now) && deactivateIfActive(record.getKey())) {
                deactivated++;
            }
        }
        return deactivated;
    }

    // ==================== 内部方法 ====================

    private boolean deactivateIfActive(String key) {
        Long flipped = execute("停用 Key", () -> redisTemplate.execute(DEACTIVATE_IF_ACTIVE,
                List.of(recordKey(key)), F_ACTIVE));
        return flipped != null && flipped == 1L;
    }

    private boolean isComplete(Map<String, String> fields) {
        return fields.containsKey(F_NAME)
                && fields.containsKey(F_CREATED_AT)
                && fields.containsKey(F_EXPIRES_AT)
                && fields.containsKey(F_ACTIVE);
    }

    private Set<String> membersOf(String index) {
        Set<String> members = execute("读取索引", () -> redisTemplate.opsForZSet().range(index, 0, -1));
        return members != null ? members : Set.of();
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("{}失败: {}", operation, e.getMessage());
            throw new StoreUnavailableException(operation + "失败", e);
        }
    }

    private AccessKey toRecord(String key, Map<String, String> fields) {
        return AccessKey.builder()
                .key(key)
                .name(fields.get(F_NAME))
                .createdAt(Instant.ofEpochMilli(Long.parseLong(fields.get(F_CREATED_AT))))
                .expiresAt(Instant.ofEpochMilli(Long.parseLong(fields.get(F_EXPIRES_AT))))
                .active(Boolean.parseBoolean(fields.get(F_ACTIVE)))
                .usage(Long.parseLong(fields.getOrDefault(F_USAGE, "0")))
                .build();
    }

    private String recordKey(String key) {
        return prefix + ":key:" + key;
    }

    private String allIndex() {
        return prefix + ":all";
    }

    private String nameIndex(String name) {
        return prefix + ":name:" + name;
    }
}
