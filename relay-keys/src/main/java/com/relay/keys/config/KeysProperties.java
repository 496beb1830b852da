package com.relay.keys.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 访问密钥模块配置项。
 */
@Data
@ConfigurationProperties(prefix = "relay.keys")
public class KeysProperties {

    /** 存储类型: memory（内存，仅用于测试/临时部署） / jdbc（SQLite） / redis */
    private String storageType = "memory";

    /** 库名（环境变量 DB_NAME），用作 SQLite 默认文件名和 Redis key 前缀 */
    private String databaseName = "neonosint";

    /** 集合名，Redis key 前缀的第二段 */
    private String collectionName = "AI_APIKEY";

    /** 生成 Key 冲突时的最大尝试次数 */
    private int maxTokenAttempts = 5;

    /** 是否启用定时清理过期 Key（鉴权时的过期检查始终生效） */
    private boolean sweepEnabled = false;

    /** 定时清理间隔（秒） */
    private int sweepIntervalSeconds = 3600;
}
