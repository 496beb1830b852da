package com.relay.keys.config;

import com.relay.keys.repository.ApiKeyRepository;
import com.relay.keys.store.InMemoryKeyStore;
import com.relay.keys.store.JdbcKeyStore;
import com.relay.keys.store.KeyStore;
import com.relay.keys.store.RedisKeyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jdbc.core.convert.JdbcCustomConversions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.relational.core.dialect.Dialect;

import java.time.Clock;

/**
 * 访问密钥模块自动配置。
 * <p>
 * 通过 {@code relay.keys.storage-type} 切换存储实现：
 * <ul>
 *   <li>{@code memory}（未配置时）：纯内存，进程退出即丢失，适合测试</li>
 *   <li>{@code jdbc}：SQLite 持久化，单机部署</li>
 *   <li>{@code redis}：Redis 实现，适合多实例部署</li>
 * </ul>
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.relay.keys")
@EnableConfigurationProperties(KeysProperties.class)
public class KeysModuleConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 注册 SQLite 方言 —— Spring Data JDBC 内置不认识 SQLite，需手动提供。
     */
    @Bean
    public Dialect jdbcDialect() {
        return SqliteDialect.INSTANCE;
    }

    /**
     * active 列在 SQLite 中是 INTEGER，读写时与 Boolean 互转。
     */
    @Bean
    public JdbcCustomConversions jdbcCustomConversions() {
        return new JdbcCustomConversions(SqliteConverters.all());
    }

    // ==================== 内存实现 ====================

    @Bean
    @ConditionalOnProperty(name = "relay.keys.storage-type", havingValue = "memory", matchIfMissing = true)
    public KeyStore inMemoryKeyStore() {
        log.warn("使用内存 Key 存储（进程重启后所有 Key 丢失）");
        return new InMemoryKeyStore();
    }

    // ==================== SQLite 实现 ====================

    @Bean
    @ConditionalOnProperty(name = "relay.keys.storage-type", havingValue = "jdbc")
    public KeyStore jdbcKeyStore(ApiKeyRepository repository) {
        log.info("使用 SQLite Key 存储");
        return new JdbcKeyStore(repository);
    }

    // ==================== Redis 实现 ====================

    @Bean
    @ConditionalOnProperty(name = "relay.keys.storage-type", havingValue = "redis")
    public KeyStore redisKeyStore(StringRedisTemplate redisTemplate, KeysProperties properties) {
        log.info("使用 Redis Key 存储（前缀 {}:{}）", properties.getDatabaseName(), properties.getCollectionName());
        return new RedisKeyStore(redisTemplate, properties);
    }
}
